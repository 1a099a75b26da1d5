package io.rndr.core.node;

import io.rndr.core.escrow.EscrowLedger;
import io.rndr.core.events.EventLog;
import io.rndr.core.ledger.LedgerRuntime;
import io.rndr.core.state.InMemoryStateStore;
import io.rndr.core.state.StateStore;
import io.rndr.core.state.SupplyAudit;
import io.rndr.core.storage.RocksDBStateStore;
import io.rndr.core.token.TokenLedger;

import java.util.logging.Logger;

/**
 * Wires the state store, the ledger runtime and the deployed ledgers.
 * Start once; after that the ledgers are ready to take calls.
 */
public final class Node {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final StateStore store;
    private final LedgerRuntime runtime;
    private final TokenLedger token;
    private final EscrowLedger escrow;
    private final TokenLedger legacyToken;
    private final EventLog events;
    private final NodeConfig config;

    public Node(StateStore store, NodeConfig config) {
        this.store = store;
        this.config = config;
        this.runtime = new LedgerRuntime(store);
        this.legacyToken = config.legacyTokenAddress == null ? null : new TokenLedger(config.legacyTokenAddress, runtime);
        this.token = new TokenLedger(config.tokenAddress, runtime);
        this.escrow = new EscrowLedger(config.escrowAddress, runtime, config.prevalidateDisbursals);
        this.events = new EventLog(store);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(new InMemoryStateStore(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, String dataDir) {
        return new Node(RocksDBStateStore.open(dataDir), config);
    }

    /** Apply genesis on empty state, then check supply. Safe to call multiple times. */
    public void start() {
        if (!GenesisBuilder.initIfNeeded(runtime, token, escrow, legacyToken, config)) {
            LOG.info("Existing state found for " + token.address() + ", skipping genesis");
        }
        SupplyAudit.Result audit = audit();
        LOG.info("Supply " + audit.totalSupply() + " (escrowed " + audit.escrowed() + ")");
    }

    public SupplyAudit.Result audit() {
        return runtime.read(() -> SupplyAudit.run(store, token.address(), escrow.address()));
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    public void close() {
        store.close();
    }

    public LedgerRuntime runtime() { return runtime; }
    public TokenLedger token() { return token; }
    public EscrowLedger escrow() { return escrow; }
    public TokenLedger legacyToken() { return legacyToken; }
    public EventLog events() { return events; }
    public NodeConfig config() { return config; }
}
