package io.rndr.core.ledger;

import io.rndr.core.events.EventCodec;
import io.rndr.core.events.LedgerEvent;
import io.rndr.core.protocol.Amounts;
import io.rndr.core.state.StateKey;
import io.rndr.core.state.StateStore;
import io.rndr.core.state.Table;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Buffered writes and events of one unit of work. Nothing reaches the store until
 * {@link #commit()}; dropping the instance discards everything.
 */
final class StateTransaction implements StateView {
    static final StateKey EVENT_SEQUENCE = new StateKey(Table.META, "_runtime/eventSequence");

    private final StateStore store;
    private final Map<StateKey, byte[]> writes = new LinkedHashMap<>();
    private final List<LedgerEvent> events = new ArrayList<>();

    StateTransaction(StateStore store) {
        this.store = store;
    }

    @Override
    public Optional<byte[]> get(Table table, String key) {
        byte[] pending = writes.get(new StateKey(table, key));
        if (pending != null) {
            return Optional.of(pending.clone());
        }
        return store.get(table, key);
    }

    void put(StateKey key, byte[] value) {
        writes.put(key, value.clone());
    }

    void emit(LedgerEvent event) {
        events.add(event);
    }

    /** Writes the state changes and the events (with fresh sequence numbers) in one store commit. */
    void commit() {
        if (!events.isEmpty()) {
            long next = store.get(EVENT_SEQUENCE.table(), EVENT_SEQUENCE.key())
                    .map(Amounts::fromBytes)
                    .map(BigInteger::longValueExact)
                    .orElse(0L);
            for (LedgerEvent event : events) {
                writes.put(new StateKey(Table.EVENTS, EventCodec.sequenceKey(next)), EventCodec.toBytes(event));
                next++;
            }
            writes.put(EVENT_SEQUENCE, BigInteger.valueOf(next).toByteArray());
        }
        store.commit(writes);
    }
}
