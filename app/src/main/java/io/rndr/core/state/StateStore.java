package io.rndr.core.state;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * Committed ledger state: a handful of ordered key/value tables.
 * Writes only arrive through {@link #commit(Map)}, which must apply all of them or none.
 */
public interface StateStore {

    Optional<byte[]> get(Table table, String key);

    /** Apply every write atomically. */
    void commit(Map<StateKey, byte[]> writes);

    /** Visit keys starting with {@code prefix} in ascending key order. */
    void scan(Table table, String prefix, BiConsumer<String, byte[]> visitor);

    /**
     * Visit keys at or after {@code fromKey} in ascending key order, stopping as soon
     * as the visitor returns false.
     */
    void scanFrom(Table table, String fromKey, BiPredicate<String, byte[]> visitor);

    /** Close underlying resources if any. */
    default void close() {
    }
}
