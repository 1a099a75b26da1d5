package io.rndr.core.events;

import io.rndr.core.state.StateStore;
import io.rndr.core.state.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the notification log. Events are written by the ledger runtime in
 * the same commit as the state change that produced them.
 */
public final class EventLog {
    private final StateStore store;

    public EventLog(StateStore store) {
        this.store = store;
    }

    /** Events with a sequence strictly greater than {@code after}, oldest first. */
    public List<RecordedEvent> since(long after, int limit) {
        List<RecordedEvent> out = new ArrayList<>();
        if (limit <= 0 || after == Long.MAX_VALUE) {
            return out;
        }
        long first = Math.max(after + 1, 0L);
        store.scanFrom(Table.EVENTS, EventCodec.sequenceKey(first), (key, value) -> {
            out.add(new RecordedEvent(Long.parseLong(key), EventCodec.fromBytes(value)));
            return out.size() < limit;
        });
        return out;
    }

    public List<RecordedEvent> all() {
        return since(-1L, Integer.MAX_VALUE);
    }

    public <T extends LedgerEvent> List<T> ofType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (RecordedEvent recorded : all()) {
            if (type.isInstance(recorded.event())) {
                out.add(type.cast(recorded.event()));
            }
        }
        return out;
    }
}
