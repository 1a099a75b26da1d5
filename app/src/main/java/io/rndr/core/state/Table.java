package io.rndr.core.state;

import java.nio.charset.StandardCharsets;

/** Logical tables of the ledger state; each maps to one RocksDB column family. */
public enum Table {
    BALANCES("balances"),
    ALLOWANCES("allowances"),
    ESCROW("escrow"),
    JOBS("jobs"),
    META("meta"),
    EVENTS("events");

    private final String columnFamily;

    Table(String columnFamily) {
        this.columnFamily = columnFamily;
    }

    public String columnFamily() {
        return columnFamily;
    }

    public byte[] columnFamilyBytes() {
        return columnFamily.getBytes(StandardCharsets.UTF_8);
    }
}
