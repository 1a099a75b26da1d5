package io.rndr.core.ledger;

import io.rndr.core.state.Table;

import java.util.Optional;

/** Read access to ledger state, either committed or as seen inside a running call. */
@FunctionalInterface
public interface StateView {
    Optional<byte[]> get(Table table, String key);
}
