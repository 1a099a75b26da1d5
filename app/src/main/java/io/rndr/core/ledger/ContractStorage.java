package io.rndr.core.ledger;

import io.rndr.core.protocol.Amounts;
import io.rndr.core.state.StateKey;
import io.rndr.core.state.Table;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * A ledger's own slice of the state: every key is prefixed with the ledger's address.
 */
public final class ContractStorage {
    private final LedgerRuntime runtime;
    private final String namespace;

    public ContractStorage(LedgerRuntime runtime, String namespace) {
        this.runtime = runtime;
        this.namespace = namespace;
    }

    public BigInteger amount(Table table, String key) {
        StateKey k = StateKey.of(table, namespace, key);
        return runtime.view().get(k.table(), k.key()).map(Amounts::fromBytes).orElse(BigInteger.ZERO);
    }

    public void putAmount(Table table, String key, BigInteger value) {
        runtime.write(StateKey.of(table, namespace, key), Amounts.toBytes(value));
    }

    public Optional<String> slot(String name) {
        StateKey k = StateKey.of(Table.META, namespace, name);
        return runtime.view().get(k.table(), k.key())
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .filter(s -> !s.isEmpty());
    }

    public void putSlot(String name, String value) {
        runtime.write(StateKey.of(Table.META, namespace, name),
                (value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
    }

    public BigInteger amountSlot(String name) {
        return amount(Table.META, name);
    }

    public void putAmountSlot(String name, BigInteger value) {
        putAmount(Table.META, name, value);
    }
}
