package io.rndr.core.state;

import java.util.Objects;

/**
 * A key inside one table. Ledger-owned keys are prefixed with the owning
 * ledger's address so two ledgers never see each other's rows.
 */
public record StateKey(Table table, String key) {
    public static final char NAMESPACE_SEPARATOR = '/';

    public StateKey {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(key, "key");
    }

    public static StateKey of(Table table, String namespace, String localKey) {
        return new StateKey(table, prefix(namespace) + localKey);
    }

    public static String prefix(String namespace) {
        return namespace + NAMESPACE_SEPARATOR;
    }
}
