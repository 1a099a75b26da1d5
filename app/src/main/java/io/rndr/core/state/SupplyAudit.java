package io.rndr.core.state;

import io.rndr.core.protocol.Amounts;

import java.math.BigInteger;
import java.util.logging.Logger;

/**
 * Recomputes token conservation from committed state.
 *
 * Tokens held by the escrow ledger's address are reported as the escrow holding,
 * apart from the circulating sum. The holding must cover every escrowed user and
 * job balance. Anything above that was sent to the escrow address with a plain
 * transfer: it is still part of the supply, but no escrow id can ever disburse it,
 * so it is reported as {@link Result#stranded()} rather than as a mismatch.
 */
public final class SupplyAudit {
    private static final Logger LOG = Logger.getLogger(SupplyAudit.class.getName());

    private SupplyAudit(){}

    public record Result(BigInteger totalSupply,
                         BigInteger totalMinted,
                         BigInteger totalBurned,
                         BigInteger circulating,
                         BigInteger escrowedUsers,
                         BigInteger escrowedJobs,
                         BigInteger escrowHolding) {

        public BigInteger escrowed() {
            return escrowedUsers.add(escrowedJobs);
        }

        /** Tokens at the escrow address that no escrow id accounts for. */
        public BigInteger stranded() {
            return escrowHolding.subtract(escrowed()).max(BigInteger.ZERO);
        }

        /** Every unit minted and not burned is circulating or held by the escrow, and the holding backs every escrow id. */
        public boolean balanced() {
            BigInteger outstanding = totalMinted.subtract(totalBurned);
            return circulating.add(escrowHolding).equals(outstanding)
                    && outstanding.equals(totalSupply)
                    && escrowHolding.compareTo(escrowed()) >= 0;
        }
    }

    /**
     * @param escrowAddress may be null when no escrow ledger is deployed
     */
    public static Result run(StateStore store, String tokenAddress, String escrowAddress) {
        BigInteger[] circulating = {BigInteger.ZERO};
        BigInteger[] escrowHolding = {BigInteger.ZERO};
        String balancePrefix = StateKey.prefix(tokenAddress);
        store.scan(Table.BALANCES, balancePrefix, (key, value) -> {
            String account = key.substring(balancePrefix.length());
            BigInteger amount = Amounts.fromBytes(value);
            if (account.equals(escrowAddress)) {
                escrowHolding[0] = amount;
            } else {
                circulating[0] = circulating[0].add(amount);
            }
        });

        BigInteger users = escrowAddress == null ? BigInteger.ZERO : sum(store, Table.ESCROW, escrowAddress);
        BigInteger jobs = escrowAddress == null ? BigInteger.ZERO : sum(store, Table.JOBS, escrowAddress);

        Result result = new Result(
                meta(store, tokenAddress, "totalSupply"),
                meta(store, tokenAddress, "totalMinted"),
                meta(store, tokenAddress, "totalBurned"),
                circulating[0],
                users,
                jobs,
                escrowHolding[0]);
        if (!result.balanced()) {
            LOG.warning("Supply audit mismatch for " + tokenAddress + ": " + result);
        } else if (result.stranded().signum() > 0) {
            LOG.info(() -> result.stranded() + " tokens sit at " + escrowAddress + " outside any escrow id");
        }
        return result;
    }

    private static BigInteger sum(StateStore store, Table table, String namespace) {
        BigInteger[] total = {BigInteger.ZERO};
        store.scan(table, StateKey.prefix(namespace), (key, value) -> total[0] = total[0].add(Amounts.fromBytes(value)));
        return total[0];
    }

    private static BigInteger meta(StateStore store, String namespace, String slot) {
        StateKey key = StateKey.of(Table.META, namespace, slot);
        return store.get(key.table(), key.key()).map(Amounts::fromBytes).orElse(BigInteger.ZERO);
    }
}
