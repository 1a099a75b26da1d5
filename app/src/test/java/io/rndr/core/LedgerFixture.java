package io.rndr.core;

import io.rndr.core.escrow.EscrowLedger;
import io.rndr.core.events.EventLog;
import io.rndr.core.events.LedgerEvent;
import io.rndr.core.ledger.LedgerRuntime;
import io.rndr.core.protocol.AbiCodec;
import io.rndr.core.state.InMemoryStateStore;
import io.rndr.core.state.SupplyAudit;
import io.rndr.core.token.TokenLedger;

import java.math.BigInteger;
import java.util.List;

/** A token and an escrow ledger wired together on in-memory state. */
public final class LedgerFixture {
    public static final String OWNER = "owner-0001";
    public static final String BRIDGE = "bridge-manager";
    public static final String TOKEN = "rndr-token";
    public static final String ESCROW = "rndr-escrow";

    public final InMemoryStateStore store = new InMemoryStateStore();
    public final LedgerRuntime runtime = new LedgerRuntime(store);
    public final TokenLedger token = new TokenLedger(TOKEN, runtime);
    public final EscrowLedger escrow;

    public LedgerFixture() {
        this(false);
    }

    public LedgerFixture(boolean prevalidateDisbursals) {
        escrow = new EscrowLedger(ESCROW, runtime, prevalidateDisbursals);
        token.initialize(OWNER, BRIDGE, "Render Token", "RNDR");
        escrow.initialize(OWNER, TOKEN);
        token.setEscrowContractAddress(OWNER, ESCROW);
    }

    public void mint(String account, long amount) {
        token.deposit(BRIDGE, account, AbiCodec.encodeUint256(amt(amount)));
    }

    public SupplyAudit.Result audit() {
        return runtime.read(() -> SupplyAudit.run(store, TOKEN, ESCROW));
    }

    public EventLog events() {
        return new EventLog(store);
    }

    public <T extends LedgerEvent> T lastEvent(Class<T> type) {
        List<T> events = events().ofType(type);
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public static BigInteger amt(long value) {
        return BigInteger.valueOf(value);
    }
}
