package io.rndr.core.state;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * In-memory implementation of StateStore.
 * Not persistent; resets every process run.
 */
public final class InMemoryStateStore implements StateStore {

    private final Map<Table, TreeMap<String, byte[]>> tables = new EnumMap<>(Table.class);

    public InMemoryStateStore() {
        for (Table table : Table.values()) {
            tables.put(table, new TreeMap<>());
        }
    }

    @Override
    public synchronized Optional<byte[]> get(Table table, String key) {
        byte[] value = tables.get(table).get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public synchronized void commit(Map<StateKey, byte[]> writes) {
        if (writes == null || writes.isEmpty()) {
            return;
        }
        for (Map.Entry<StateKey, byte[]> e : writes.entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalArgumentException("Null value for " + e.getKey());
            }
        }
        for (Map.Entry<StateKey, byte[]> e : writes.entrySet()) {
            tables.get(e.getKey().table()).put(e.getKey().key(), e.getValue().clone());
        }
    }

    @Override
    public synchronized void scan(Table table, String prefix, BiConsumer<String, byte[]> visitor) {
        SortedMap<String, byte[]> view = prefix == null || prefix.isEmpty()
                ? tables.get(table)
                : tables.get(table).tailMap(prefix);
        for (Map.Entry<String, byte[]> e : view.entrySet()) {
            if (prefix != null && !e.getKey().startsWith(prefix)) {
                break;
            }
            visitor.accept(e.getKey(), e.getValue().clone());
        }
    }

    @Override
    public synchronized void scanFrom(Table table, String fromKey, BiPredicate<String, byte[]> visitor) {
        for (Map.Entry<String, byte[]> e : tables.get(table).tailMap(fromKey, true).entrySet()) {
            if (!visitor.test(e.getKey(), e.getValue().clone())) {
                return;
            }
        }
    }
}
