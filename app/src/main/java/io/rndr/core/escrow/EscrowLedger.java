package io.rndr.core.escrow;

import io.rndr.core.events.LedgerEvent;
import io.rndr.core.ledger.EscrowReceiver;
import io.rndr.core.ledger.FungibleToken;
import io.rndr.core.ledger.LedgerError;
import io.rndr.core.ledger.LedgerException;
import io.rndr.core.ledger.LedgerRuntime;
import io.rndr.core.ledger.OwnedLedger;
import io.rndr.core.metrics.LedgerMetrics;
import io.rndr.core.protocol.Amounts;
import io.rndr.core.state.Table;

import java.math.BigInteger;
import java.util.List;
import java.util.logging.Logger;

/**
 * Escrowed balances keyed by an opaque user id (and, for older callers, a job id).
 *
 * Balances grow only through {@link #fundUser}/{@link #fundJob} called by the
 * configured token ledger, and shrink only through disbursals made by the
 * disbursal address. The tokens themselves sit on the token ledger under this
 * ledger's address.
 */
public final class EscrowLedger extends OwnedLedger implements EscrowReceiver {
    private static final Logger LOG = Logger.getLogger(EscrowLedger.class.getName());

    static final String SLOT_DISBURSAL = "disbursalAddress";
    static final String SLOT_RENDER_TOKEN = "renderTokenAddress";

    private final boolean prevalidateDisbursals;

    public EscrowLedger(String address, LedgerRuntime runtime) {
        this(address, runtime, false);
    }

    /**
     * @param prevalidateDisbursals when true, a disbursal whose amounts add up to more
     *                              than the balance is rejected before anyone is paid
     */
    public EscrowLedger(String address, LedgerRuntime runtime, boolean prevalidateDisbursals) {
        super(address, runtime);
        this.prevalidateDisbursals = prevalidateDisbursals;
    }

    /** One-time setup; the owner also starts out as the disbursal address. */
    public void initialize(String owner, String renderTokenAddress) {
        runtime.execute("initialize", () -> {
            initializeOwner(owner);
            storage.putSlot(SLOT_RENDER_TOKEN, requireAddress(renderTokenAddress, LedgerError.INVALID_ADDRESS));
            storage.putSlot(SLOT_DISBURSAL, owner);
            LOG.info(() -> "Escrow initialized at " + address + " for token " + renderTokenAddress);
        });
    }

    public BigInteger userBalance(String userId) {
        if (userId == null) {
            return BigInteger.ZERO;
        }
        return runtime.read(() -> storage.amount(Table.ESCROW, userId));
    }

    public BigInteger jobBalance(String jobId) {
        if (jobId == null) {
            return BigInteger.ZERO;
        }
        return runtime.read(() -> storage.amount(Table.JOBS, jobId));
    }

    public String disbursalAddress() {
        return runtime.read(() -> storage.slot(SLOT_DISBURSAL).orElse(null));
    }

    public String renderTokenAddress() {
        return runtime.read(() -> storage.slot(SLOT_RENDER_TOKEN).orElse(null));
    }

    public boolean prevalidatesDisbursals() {
        return prevalidateDisbursals;
    }

    // -------------------- funding --------------------

    @Override
    public void fundUser(String caller, String userId, BigInteger amount) {
        fund("fundUser", Table.ESCROW, caller, userId, amount);
    }

    @Override
    public void fundJob(String caller, String jobId, BigInteger amount) {
        fund("fundJob", Table.JOBS, caller, jobId, amount);
    }

    private void fund(String entryPoint, Table table, String caller, String id, BigInteger amount) {
        runtime.execute(entryPoint, () -> {
            onlyCaller(storage.slot(SLOT_RENDER_TOKEN).orElse(null), caller, entryPoint);
            requireEscrowId(id);
            BigInteger balance = Amounts.add(storage.amount(table, id), amount);
            storage.putAmount(table, id, balance);
            emit(balanceUpdate(table, id, balance));
            LedgerMetrics.recordEscrowFunded(amount);
            LOG.fine(() -> entryPoint + " " + id + " +" + amount + " = " + balance);
        });
    }

    // -------------------- disbursal --------------------

    /**
     * Pays {@code amounts[i]} to {@code recipients[i]} out of {@code userId}'s balance.
     *
     * Each payment commits on its own. When one fails (usually because the balance
     * ran out), payments made before it stay made, the remaining balance is still
     * announced and the failure is rethrown. Enable pre-validation to reject such a
     * call up front instead.
     */
    public void disburseFunds(String caller, String userId, List<String> recipients, List<BigInteger> amounts) {
        disburse("disburseFunds", Table.ESCROW, caller, userId, recipients, amounts);
    }

    /** Legacy job-keyed variant of {@link #disburseFunds}. */
    public void disburseJob(String caller, String jobId, List<String> recipients, List<BigInteger> amounts) {
        disburse("disburseJob", Table.JOBS, caller, jobId, recipients, amounts);
    }

    private void disburse(String entryPoint, Table table, String caller, String id,
                          List<String> recipients, List<BigInteger> amounts) {
        runtime.serialized(() -> {
            FungibleToken token = runtime.execute(entryPoint, () -> {
                onlyCaller(storage.slot(SLOT_DISBURSAL).orElse(null), caller, entryPoint);
                requireEscrowId(id);
                if (recipients == null || amounts == null) {
                    throw new LedgerException(LedgerError.LENGTH_MISMATCH, "recipients and amounts are required");
                }
                BigInteger balance = storage.amount(table, id);
                if (balance.signum() == 0) {
                    throw new LedgerException(LedgerError.NO_BALANCE, id + " has nothing to disburse");
                }
                if (recipients.size() != amounts.size()) {
                    throw new LedgerException(LedgerError.LENGTH_MISMATCH,
                            recipients.size() + " recipients, " + amounts.size() + " amounts");
                }
                if (prevalidateDisbursals) {
                    BigInteger total = BigInteger.ZERO;
                    for (BigInteger amount : amounts) {
                        total = Amounts.add(total, amount);
                    }
                    Amounts.sub(balance, total, LedgerError.INSUFFICIENT_ESCROW_BALANCE);
                }
                return token();
            });

            int paid = 0;
            try {
                for (int i = 0; i < recipients.size(); i++) {
                    String recipient = recipients.get(i);
                    BigInteger amount = amounts.get(i);
                    runtime.execute(entryPoint + ".payout", () -> {
                        BigInteger balance = storage.amount(table, id);
                        storage.putAmount(table, id, Amounts.sub(balance, amount, LedgerError.INSUFFICIENT_ESCROW_BALANCE));
                        token.transfer(address, recipient, amount);
                    });
                    paid++;
                    LedgerMetrics.recordEscrowDisbursed(amount);
                }
            } finally {
                if (paid < recipients.size()) {
                    int done = paid;
                    if (done > 0) {
                        LedgerMetrics.incrementPartialDisbursals();
                    }
                    LOG.warning(() -> entryPoint + " for " + id + " stopped after " + done
                            + " of " + recipients.size() + " payments");
                }
                runtime.execute(entryPoint + ".settle", () -> {
                    emit(balanceUpdate(table, id, storage.amount(table, id)));
                });
            }
            return null;
        });
    }

    // -------------------- configuration --------------------

    /** Rejects the null address. */
    public void changeDisbursalAddress(String caller, String newAddress) {
        updateAddressSlot(caller, "changeDisbursalAddress", SLOT_DISBURSAL, newAddress);
    }

    public void changeRenderTokenAddress(String caller, String newAddress) {
        updateAddressSlot(caller, "changeRenderTokenAddress", SLOT_RENDER_TOKEN, newAddress);
    }

    private void updateAddressSlot(String caller, String entryPoint, String slot, String value) {
        runtime.execute(entryPoint, () -> {
            onlyOwner(caller, entryPoint);
            requireAddress(value, LedgerError.INVALID_ADDRESS);
            storage.putSlot(slot, value);
            emit(new LedgerEvent.AddressUpdate(address, slot, value));
            LOG.info(() -> "Escrow " + address + " " + slot + " set to " + value);
        });
    }

    private FungibleToken token() {
        String tokenAddress = storage.slot(SLOT_RENDER_TOKEN).orElse(null);
        return runtime.registry().resolve(tokenAddress, FungibleToken.class)
                .orElseThrow(() -> new LedgerException(LedgerError.ESCROW_NOT_CONFIGURED,
                        "no token ledger deployed at " + tokenAddress));
    }

    private LedgerEvent balanceUpdate(Table table, String id, BigInteger balance) {
        return table == Table.JOBS
                ? new LedgerEvent.JobBalanceUpdate(address, id, balance)
                : new LedgerEvent.UserBalanceUpdate(address, id, balance);
    }
}
