package io.rndr.core.state;

import io.rndr.core.LedgerFixture;
import io.rndr.core.ledger.LedgerException;
import io.rndr.core.protocol.Amounts;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static io.rndr.core.LedgerFixture.OWNER;
import static io.rndr.core.LedgerFixture.amt;
import static org.junit.jupiter.api.Assertions.*;

class SupplyAuditTest {

    private static final List<String> ACCOUNTS = List.of("acct-a", "acct-b", "acct-c", "acct-d");
    private static final List<String> IDS = List.of("user-1", "user-2", "");

    @Test
    void freshLedgersBalance() {
        LedgerFixture fx = new LedgerFixture();
        SupplyAudit.Result result = fx.audit();

        assertTrue(result.balanced());
        assertEquals(BigInteger.ZERO, result.totalSupply());
    }

    @Test
    void conservationHoldsAcrossRandomActivity() {
        LedgerFixture fx = new LedgerFixture();
        for (String account : ACCOUNTS) {
            fx.mint(account, 1_000);
        }
        Random random = new Random(7L);
        int rejected = 0;

        for (int step = 0; step < 400; step++) {
            String a = pick(random, ACCOUNTS);
            String b = pick(random, ACCOUNTS);
            String id = pick(random, IDS);
            BigInteger amount = amt(random.nextInt(300));
            try {
                switch (random.nextInt(9)) {
                    case 0 -> fx.token.transfer(a, b, amount);
                    case 1 -> fx.token.approve(a, b, amount);
                    case 2 -> fx.token.transferFrom(b, a, pick(random, ACCOUNTS), amount);
                    case 3 -> fx.token.holdInEscrow(a, id, amount);
                    case 4 -> fx.token.holdInEscrowForJob(a, id, amount);
                    case 5 -> fx.escrow.disburseFunds(OWNER, id, List.of(a, b), List.of(amount, amt(random.nextInt(100))));
                    case 6 -> fx.escrow.disburseJob(OWNER, id, List.of(b), List.of(amount));
                    case 7 -> fx.token.withdraw(a, amount);
                    default -> fx.mint(a, amount.longValue());
                }
            } catch (LedgerException e) {
                rejected++;
            }
            SupplyAudit.Result result = fx.audit();
            assertTrue(result.balanced(), "step " + step + ": " + result);
        }

        // the walk is only meaningful if both outcomes occurred
        assertTrue(rejected > 0);
        assertTrue(rejected < 400);
        SupplyAudit.Result end = fx.audit();
        assertEquals(fx.token.totalSupply(), end.totalSupply());
        assertEquals(fx.token.balanceOf(LedgerFixture.ESCROW), end.escrowHolding());
    }

    @Test
    void detectsBalancesWrittenBehindTheLedgersBack() {
        LedgerFixture fx = new LedgerFixture();
        fx.mint("acct-a", 10);

        fx.store.commit(Map.of(StateKey.of(Table.BALANCES, LedgerFixture.TOKEN, "acct-z"), Amounts.toBytes(amt(5))));

        SupplyAudit.Result result = fx.audit();
        assertFalse(result.balanced());
        assertEquals(amt(15), result.circulating());
        assertEquals(amt(10), result.totalSupply());
    }

    @Test
    void plainTransferToEscrowIsStrandedNotLost() {
        LedgerFixture fx = new LedgerFixture();
        fx.mint("acct-a", 100);
        fx.token.holdInEscrow("acct-a", "user-1", amt(30));

        fx.token.transfer("acct-a", LedgerFixture.ESCROW, amt(20));

        SupplyAudit.Result result = fx.audit();
        assertTrue(result.balanced(), result.toString());
        assertEquals(amt(50), result.escrowHolding());
        assertEquals(amt(30), result.escrowed());
        assertEquals(amt(20), result.stranded());
        assertEquals(amt(50), result.circulating());

        // only the escrowed 30 can ever leave through a disbursal
        fx.escrow.disburseFunds(OWNER, "user-1", List.of("acct-b"), List.of(amt(30)));
        assertEquals(amt(20), fx.audit().stranded());
        assertTrue(fx.audit().balanced());
    }

    @Test
    void detectsEscrowBalancesWithoutBackingTokens() {
        LedgerFixture fx = new LedgerFixture();
        fx.mint("acct-a", 10);

        fx.store.commit(Map.of(StateKey.of(Table.ESCROW, LedgerFixture.ESCROW, "user-9"), Amounts.toBytes(amt(4))));

        SupplyAudit.Result result = fx.audit();
        assertFalse(result.balanced());
        assertEquals(amt(4), result.escrowed());
        assertEquals(BigInteger.ZERO, result.stranded());
    }

    private static String pick(Random random, List<String> values) {
        return values.get(random.nextInt(values.size()));
    }
}
