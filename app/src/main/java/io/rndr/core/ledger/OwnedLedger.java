package io.rndr.core.ledger;

import io.rndr.core.events.LedgerEvent;
import io.rndr.core.protocol.Address;

import java.util.logging.Logger;

/**
 * Common plumbing of a ledger deployed at an address: its storage namespace, the
 * single administrative owner and the authorization checks built on it.
 */
public abstract class OwnedLedger {
    private static final Logger LOG = Logger.getLogger(OwnedLedger.class.getName());

    protected static final String SLOT_OWNER = "owner";

    protected final String address;
    protected final LedgerRuntime runtime;
    protected final ContractStorage storage;

    protected OwnedLedger(String address, LedgerRuntime runtime) {
        if (!Address.isValid(address)) {
            throw new IllegalArgumentException("Invalid ledger address: " + address);
        }
        this.address = address;
        this.runtime = runtime;
        this.storage = new ContractStorage(runtime, address);
        runtime.registry().register(address, this);
    }

    public String address() {
        return address;
    }

    public String owner() {
        return runtime.read(() -> storage.slot(SLOT_OWNER).orElse(null));
    }

    public boolean isInitialized() {
        return runtime.read(() -> storage.slot(SLOT_OWNER).isPresent());
    }

    /** Single-step handoff: the new owner takes effect immediately. */
    public void transferOwnership(String caller, String newOwner) {
        runtime.execute("transferOwnership", () -> {
            onlyOwner(caller, "transferOwnership");
            requireAddress(newOwner, LedgerError.INVALID_ADDRESS);
            String previous = storage.slot(SLOT_OWNER).orElse(null);
            storage.putSlot(SLOT_OWNER, newOwner);
            emit(new LedgerEvent.OwnershipTransferred(address, previous, newOwner));
            LOG.info(() -> "Ownership of " + address + " transferred " + previous + " -> " + newOwner);
        });
    }

    protected void initializeOwner(String owner) {
        if (storage.slot(SLOT_OWNER).isPresent()) {
            throw new LedgerException(LedgerError.ALREADY_INITIALIZED, address + " already initialized");
        }
        requireAddress(owner, LedgerError.INVALID_ADDRESS);
        storage.putSlot(SLOT_OWNER, owner);
        emit(new LedgerEvent.OwnershipTransferred(address, Address.ZERO, owner));
    }

    protected void onlyOwner(String caller, String entryPoint) {
        String owner = storage.slot(SLOT_OWNER).orElse(null);
        if (owner == null || !owner.equals(caller)) {
            LOG.warning(() -> "Rejected " + entryPoint + " on " + address + " from non-owner " + caller);
            throw new LedgerException(LedgerError.NOT_OWNER, caller + " is not the owner of " + address);
        }
    }

    /** Exact-identity check for privileged callers other than the owner. */
    protected static void onlyCaller(String expected, String caller, String entryPoint) {
        if (expected == null || !expected.equals(caller)) {
            LOG.warning(() -> "Rejected " + entryPoint + " from " + caller + " (expected " + expected + ")");
            throw new LedgerException(LedgerError.NOT_AUTHORIZED, caller + " may not call " + entryPoint);
        }
    }

    protected static String requireAddress(String value, LedgerError error) {
        if (!Address.isValid(value)) {
            throw new LedgerException(error, "invalid address: " + value);
        }
        return value;
    }

    /** Escrow ids are opaque, so any non-null string (even an empty one) is accepted. */
    protected static String requireEscrowId(String id) {
        if (id == null) {
            throw new LedgerException(LedgerError.INVALID_ESCROW_ID, "escrow id is required");
        }
        return id;
    }

    protected void emit(LedgerEvent event) {
        runtime.emit(event);
    }
}
