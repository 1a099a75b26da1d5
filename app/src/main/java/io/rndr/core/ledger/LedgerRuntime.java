package io.rndr.core.ledger;

import io.rndr.core.events.LedgerEvent;
import io.rndr.core.metrics.LedgerMetrics;
import io.rndr.core.state.StateKey;
import io.rndr.core.state.StateStore;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serialized execution of ledger calls.
 *
 * Every entry point runs while holding one process-wide fair lock, so calls to
 * any ledger never interleave. The outermost {@link #execute} opens a
 * {@link StateTransaction}; nested cross-ledger calls join it. If the outermost
 * body throws, all buffered writes and events are dropped; otherwise they are
 * committed to the store in one atomic write.
 */
public final class LedgerRuntime {
    private static final Logger LOG = Logger.getLogger(LedgerRuntime.class.getName());

    private final StateStore store;
    private final ContractRegistry registry = new ContractRegistry();
    private final ReentrantLock lock = new ReentrantLock(true);
    private StateTransaction current; // guarded by lock

    public LedgerRuntime(StateStore store) {
        this.store = store;
    }

    public ContractRegistry registry() {
        return registry;
    }

    /** Run {@code body} as one all-or-nothing unit, or join the unit already running. */
    public <T> T execute(String entryPoint, Supplier<T> body) {
        lock.lock();
        try {
            if (current != null) {
                return body.get();
            }
            StateTransaction tx = new StateTransaction(store);
            current = tx;
            try {
                T result = body.get();
                tx.commit();
                LedgerMetrics.recordCall(entryPoint);
                return result;
            } catch (LedgerException e) {
                LedgerMetrics.recordRejection(entryPoint, e.error());
                LOG.fine(() -> entryPoint + " rejected: " + e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                LedgerMetrics.recordFailure(entryPoint);
                LOG.log(Level.WARNING, entryPoint + " failed, state rolled back", e);
                throw e;
            } finally {
                current = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public void execute(String entryPoint, Runnable body) {
        execute(entryPoint, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Hold the lock across several independent units, so no other call runs between
     * them while each one still commits or rolls back on its own.
     */
    public <T> T serialized(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    /** Read under the lock, seeing uncommitted writes of the running unit if there is one. */
    public <T> T read(Supplier<T> body) {
        return serialized(body);
    }

    StateView view() {
        if (lock.isHeldByCurrentThread() && current != null) {
            return current;
        }
        return store::get;
    }

    void write(StateKey key, byte[] value) {
        requireTransaction().put(key, value);
    }

    public void emit(LedgerEvent event) {
        requireTransaction().emit(event);
    }

    public boolean inTransaction() {
        return lock.isHeldByCurrentThread() && current != null;
    }

    private StateTransaction requireTransaction() {
        if (!lock.isHeldByCurrentThread() || current == null) {
            throw new IllegalStateException("State can only change inside a ledger call");
        }
        return current;
    }
}
