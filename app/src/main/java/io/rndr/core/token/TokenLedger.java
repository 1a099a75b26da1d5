package io.rndr.core.token;

import io.rndr.core.events.LedgerEvent;
import io.rndr.core.ledger.EscrowReceiver;
import io.rndr.core.ledger.FungibleToken;
import io.rndr.core.ledger.LedgerError;
import io.rndr.core.ledger.LedgerException;
import io.rndr.core.ledger.LedgerRuntime;
import io.rndr.core.ledger.OwnedLedger;
import io.rndr.core.protocol.AbiCodec;
import io.rndr.core.protocol.Address;
import io.rndr.core.protocol.Amounts;
import io.rndr.core.state.Table;

import java.math.BigInteger;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Fungible token ledger: balances, allowances, bridge mint/burn, legacy migration
 * and the hand-off of tokens into escrow.
 *
 * Every mutating method takes the calling identity first and runs as one
 * serialized, all-or-nothing unit on the shared {@link LedgerRuntime}.
 */
public final class TokenLedger extends OwnedLedger implements FungibleToken {
    private static final Logger LOG = Logger.getLogger(TokenLedger.class.getName());

    public static final int DECIMALS = 18;

    static final String SLOT_NAME = "name";
    static final String SLOT_SYMBOL = "symbol";
    static final String SLOT_TOTAL_SUPPLY = "totalSupply";
    static final String SLOT_TOTAL_MINTED = "totalMinted";
    static final String SLOT_TOTAL_BURNED = "totalBurned";
    static final String SLOT_ESCROW = "escrowContractAddress";
    static final String SLOT_CHILD_CHAIN_MANAGER = "childChainManager";
    static final String SLOT_LEGACY_TOKEN = "legacyTokenAddress";

    public TokenLedger(String address, LedgerRuntime runtime) {
        super(address, runtime);
    }

    /**
     * One-time setup. {@code legacyTokenAddress} may be null when there is nothing
     * to migrate from.
     */
    public void initialize(String owner, String childChainManager, String name, String symbol, String legacyTokenAddress) {
        runtime.execute("initialize", () -> {
            initializeOwner(owner);
            requireAddress(childChainManager, LedgerError.INVALID_ADDRESS);
            storage.putSlot(SLOT_CHILD_CHAIN_MANAGER, childChainManager);
            storage.putSlot(SLOT_NAME, Objects.requireNonNull(name, "name"));
            storage.putSlot(SLOT_SYMBOL, Objects.requireNonNull(symbol, "symbol"));
            if (legacyTokenAddress != null) {
                storage.putSlot(SLOT_LEGACY_TOKEN, requireAddress(legacyTokenAddress, LedgerError.INVALID_ADDRESS));
            }
            LOG.info(() -> "Token " + symbol + " initialized at " + address + " (owner " + owner + ")");
        });
    }

    public void initialize(String owner, String childChainManager, String name, String symbol) {
        initialize(owner, childChainManager, name, symbol, null);
    }

    // -------------------- reads --------------------

    public String name() { return runtime.read(() -> storage.slot(SLOT_NAME).orElse("")); }
    public String symbol() { return runtime.read(() -> storage.slot(SLOT_SYMBOL).orElse("")); }
    public int decimals() { return DECIMALS; }
    public BigInteger totalSupply() { return runtime.read(() -> storage.amountSlot(SLOT_TOTAL_SUPPLY)); }
    public BigInteger totalMinted() { return runtime.read(() -> storage.amountSlot(SLOT_TOTAL_MINTED)); }
    public BigInteger totalBurned() { return runtime.read(() -> storage.amountSlot(SLOT_TOTAL_BURNED)); }
    public String escrowContractAddress() { return runtime.read(() -> storage.slot(SLOT_ESCROW).orElse(null)); }
    public String childChainManager() { return runtime.read(() -> storage.slot(SLOT_CHILD_CHAIN_MANAGER).orElse(null)); }
    public String legacyTokenAddress() { return runtime.read(() -> storage.slot(SLOT_LEGACY_TOKEN).orElse(null)); }

    @Override
    public BigInteger balanceOf(String account) {
        if (account == null) {
            return BigInteger.ZERO;
        }
        return runtime.read(() -> storage.amount(Table.BALANCES, account));
    }

    @Override
    public BigInteger allowance(String owner, String spender) {
        if (owner == null || spender == null) {
            return BigInteger.ZERO;
        }
        return runtime.read(() -> storage.amount(Table.ALLOWANCES, allowanceKey(owner, spender)));
    }

    // -------------------- transfers & allowances --------------------

    @Override
    public boolean transfer(String caller, String to, BigInteger amount) {
        return runtime.execute("transfer", () -> {
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            requireAddress(to, LedgerError.INVALID_RECIPIENT);
            moveTokens(caller, to, amount);
            return true;
        });
    }

    /** Absolute overwrite; replacing one nonzero allowance with another is allowed. */
    public boolean approve(String caller, String spender, BigInteger amount) {
        return runtime.execute("approve", () -> {
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            requireAddress(spender, LedgerError.INVALID_ADDRESS);
            setAllowance(caller, spender, Amounts.requireUint256(amount));
            return true;
        });
    }

    public boolean increaseAllowance(String caller, String spender, BigInteger delta) {
        return runtime.execute("increaseAllowance", () -> {
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            requireAddress(spender, LedgerError.INVALID_ADDRESS);
            BigInteger current = storage.amount(Table.ALLOWANCES, allowanceKey(caller, spender));
            setAllowance(caller, spender, Amounts.add(current, delta));
            return true;
        });
    }

    /** Saturates at zero instead of failing when {@code delta} exceeds the allowance. */
    public boolean decreaseAllowance(String caller, String spender, BigInteger delta) {
        return runtime.execute("decreaseAllowance", () -> {
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            requireAddress(spender, LedgerError.INVALID_ADDRESS);
            BigInteger current = storage.amount(Table.ALLOWANCES, allowanceKey(caller, spender));
            setAllowance(caller, spender, Amounts.saturatingSub(current, delta));
            return true;
        });
    }

    @Override
    public boolean transferFrom(String caller, String from, String to, BigInteger amount) {
        return runtime.execute("transferFrom", () -> {
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            requireAddress(from, LedgerError.INVALID_ADDRESS);
            requireAddress(to, LedgerError.INVALID_RECIPIENT);
            Amounts.requireUint256(amount);
            BigInteger allowed = storage.amount(Table.ALLOWANCES, allowanceKey(from, caller));
            BigInteger remaining = Amounts.sub(allowed, amount, LedgerError.INSUFFICIENT_ALLOWANCE);
            if (storage.amount(Table.BALANCES, from).compareTo(amount) < 0) {
                throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE, from + " cannot cover " + amount);
            }
            setAllowance(from, caller, remaining);
            moveTokens(from, to, amount);
            return true;
        });
    }

    // -------------------- escrow --------------------

    /**
     * Moves {@code amount} from the caller to the escrow ledger and credits it there
     * under {@code userId}. Both steps commit together or not at all.
     */
    public void holdInEscrow(String caller, String userId, BigInteger amount) {
        runtime.execute("holdInEscrow", () -> {
            requireEscrowId(userId);
            EscrowReceiver escrow = escrowReceiver();
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            moveTokens(caller, escrow.address(), amount);
            escrow.fundUser(address, userId, amount);
            emit(new LedgerEvent.Escrow(address, caller, userId, amount));
        });
    }

    /** Legacy job-keyed variant of {@link #holdInEscrow}. */
    public void holdInEscrowForJob(String caller, String jobId, BigInteger amount) {
        runtime.execute("holdInEscrowForJob", () -> {
            requireEscrowId(jobId);
            EscrowReceiver escrow = escrowReceiver();
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            moveTokens(caller, escrow.address(), amount);
            escrow.fundJob(address, jobId, amount);
            emit(new LedgerEvent.Escrow(address, caller, jobId, amount));
        });
    }

    public void setEscrowContractAddress(String caller, String escrowAddress) {
        updateAddressSlot(caller, "setEscrowContractAddress", SLOT_ESCROW, escrowAddress);
    }

    // -------------------- bridge --------------------

    /**
     * Bridge credit: mints the amount ABI-encoded in {@code depositData} to {@code user}.
     * Only the configured child chain manager may call it.
     */
    public void deposit(String caller, String user, byte[] depositData) {
        runtime.execute("deposit", () -> {
            onlyCaller(storage.slot(SLOT_CHILD_CHAIN_MANAGER).orElse(null), caller, "deposit");
            requireAddress(user, LedgerError.INVALID_RECIPIENT);
            BigInteger amount = AbiCodec.decodeUint256(depositData);
            mint(user, amount);
            LOG.fine(() -> "Deposit " + amount + " -> " + user);
        });
    }

    /** Burns the caller's own tokens for release on the root chain. */
    public void withdraw(String caller, BigInteger amount) {
        runtime.execute("withdraw", () -> {
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            burn(caller, amount);
            LOG.fine(() -> "Withdraw " + amount + " <- " + caller);
        });
    }

    public void updateChildChainManager(String caller, String manager) {
        updateAddressSlot(caller, "updateChildChainManager", SLOT_CHILD_CHAIN_MANAGER, manager);
    }

    // -------------------- legacy migration --------------------

    public void setLegacyTokenAddress(String caller, String legacyAddress) {
        updateAddressSlot(caller, "setLegacyTokenAddress", SLOT_LEGACY_TOKEN, legacyAddress);
    }

    /**
     * Swaps the caller's whole legacy balance for the same amount here. The caller must
     * have approved this ledger for at least that balance on the legacy token; the
     * legacy tokens end up held by this ledger's address. Not guarded against repeat
     * calls: a second call migrates whatever legacy balance is held and approved then.
     */
    public BigInteger migrate(String caller) {
        return runtime.execute("migrate", () -> {
            requireAddress(caller, LedgerError.INVALID_ADDRESS);
            FungibleToken legacy = legacyToken();
            BigInteger balance = legacy.balanceOf(caller);
            BigInteger approved = legacy.allowance(caller, address);
            if (approved.compareTo(balance) < 0) {
                throw new LedgerException(LedgerError.INSUFFICIENT_ALLOWANCE,
                        caller + " approved " + approved + " of legacy balance " + balance);
            }
            legacy.transferFrom(address, caller, address, balance);
            mint(caller, balance);
            emit(new LedgerEvent.TokenMigration(address, caller, balance));
            LOG.info(() -> "Migrated " + balance + " legacy tokens for " + caller);
            return balance;
        });
    }

    // -------------------- internals --------------------

    private void moveTokens(String from, String to, BigInteger amount) {
        Amounts.requireUint256(amount);
        BigInteger fromBalance = storage.amount(Table.BALANCES, from);
        storage.putAmount(Table.BALANCES, from, Amounts.sub(fromBalance, amount, LedgerError.INSUFFICIENT_BALANCE));
        // read after the debit so a self-transfer nets to zero
        BigInteger toBalance = storage.amount(Table.BALANCES, to);
        storage.putAmount(Table.BALANCES, to, Amounts.add(toBalance, amount));
        emit(new LedgerEvent.Transfer(address, from, to, amount));
        LOG.fine(() -> "Transfer " + amount + " " + from + " -> " + to);
    }

    private void mint(String to, BigInteger amount) {
        Amounts.requireUint256(amount);
        storage.putAmountSlot(SLOT_TOTAL_SUPPLY, Amounts.add(storage.amountSlot(SLOT_TOTAL_SUPPLY), amount));
        storage.putAmountSlot(SLOT_TOTAL_MINTED, Amounts.add(storage.amountSlot(SLOT_TOTAL_MINTED), amount));
        storage.putAmount(Table.BALANCES, to, Amounts.add(storage.amount(Table.BALANCES, to), amount));
        emit(new LedgerEvent.Transfer(address, Address.ZERO, to, amount));
    }

    private void burn(String from, BigInteger amount) {
        Amounts.requireUint256(amount);
        BigInteger balance = storage.amount(Table.BALANCES, from);
        storage.putAmount(Table.BALANCES, from, Amounts.sub(balance, amount, LedgerError.INSUFFICIENT_BALANCE));
        storage.putAmountSlot(SLOT_TOTAL_SUPPLY,
                Amounts.sub(storage.amountSlot(SLOT_TOTAL_SUPPLY), amount, LedgerError.ARITHMETIC_OVERFLOW));
        storage.putAmountSlot(SLOT_TOTAL_BURNED, Amounts.add(storage.amountSlot(SLOT_TOTAL_BURNED), amount));
        emit(new LedgerEvent.Transfer(address, from, Address.ZERO, amount));
    }

    private void setAllowance(String owner, String spender, BigInteger value) {
        storage.putAmount(Table.ALLOWANCES, allowanceKey(owner, spender), value);
        emit(new LedgerEvent.Approval(address, owner, spender, value));
    }

    private void updateAddressSlot(String caller, String entryPoint, String slot, String value) {
        runtime.execute(entryPoint, () -> {
            onlyOwner(caller, entryPoint);
            requireAddress(value, LedgerError.INVALID_ADDRESS);
            storage.putSlot(slot, value);
            emit(new LedgerEvent.AddressUpdate(address, slot, value));
            LOG.info(() -> "Token " + address + " " + slot + " set to " + value);
        });
    }

    private EscrowReceiver escrowReceiver() {
        String escrowAddress = storage.slot(SLOT_ESCROW).orElse(null);
        if (escrowAddress == null) {
            throw new LedgerException(LedgerError.ESCROW_NOT_CONFIGURED, "no escrow contract address set");
        }
        return runtime.registry().resolve(escrowAddress, EscrowReceiver.class)
                .orElseThrow(() -> new LedgerException(LedgerError.ESCROW_NOT_CONFIGURED,
                        "no escrow ledger deployed at " + escrowAddress));
    }

    private FungibleToken legacyToken() {
        String legacyAddress = storage.slot(SLOT_LEGACY_TOKEN).orElse(null);
        return runtime.registry().resolve(legacyAddress, FungibleToken.class)
                .orElseThrow(() -> new LedgerException(LedgerError.LEGACY_SOURCE_NOT_CONFIGURED,
                        legacyAddress == null ? "no legacy token address set" : "no token deployed at " + legacyAddress));
    }

    static String allowanceKey(String owner, String spender) {
        return owner + "->" + spender;
    }
}
