package io.rndr.core.storage;

import io.rndr.core.state.StateKey;
import io.rndr.core.state.StateStore;
import io.rndr.core.state.Table;
import org.rocksdb.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * Persistent StateStore using RocksDB.
 *
 * Layout (column families, one per {@link Table}):
 *  - "balances"   : key = tokenAddress/account,          val = uint256 (two's complement bytes)
 *  - "allowances" : key = tokenAddress/owner->spender,   val = uint256
 *  - "escrow"     : key = escrowAddress/userId,          val = uint256
 *  - "jobs"       : key = escrowAddress/jobId,           val = uint256
 *  - "meta"       : key = ledgerAddress/slot,            val = UTF-8 or uint256
 *  - "events"     : key = zero-padded sequence,          val = JSON event
 */
public final class RocksDBStateStore implements StateStore, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final Map<Table, ColumnFamilyHandle> handles;
    private final List<ColumnFamilyHandle> allHandles;
    private final DBOptions dbOptions;

    private RocksDBStateStore(RocksDB db,
                              Map<Table, ColumnFamilyHandle> handles,
                              List<ColumnFamilyHandle> allHandles,
                              DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        this.allHandles = allHandles;
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBStateStore open(String dataDir) {
        try {
            DBOptions dbOpts = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true);

            List<ColumnFamilyDescriptor> cfDescs = new ArrayList<>();
            cfDescs.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
            for (Table table : Table.values()) {
                cfDescs.add(new ColumnFamilyDescriptor(table.columnFamilyBytes()));
            }
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);

            // default CF sits at index 0, tables follow in declaration order
            Map<Table, ColumnFamilyHandle> byTable = new EnumMap<>(Table.class);
            Table[] tables = Table.values();
            for (int i = 0; i < tables.length; i++) {
                byTable.put(tables[i], cfHandles.get(i + 1));
            }
            return new RocksDBStateStore(db, byTable, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- StateStore API ----------------

    @Override
    public synchronized Optional<byte[]> get(Table table, String key) {
        try {
            byte[] value = db.get(handles.get(table), keyBytes(key));
            return Optional.ofNullable(value);
        } catch (RocksDBException e) {
            throw new IllegalStateException("get failed for " + table + ":" + key, e);
        }
    }

    @Override
    public synchronized void commit(Map<StateKey, byte[]> writes) {
        if (writes == null || writes.isEmpty()) {
            return;
        }
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            // batch for atomicity
            for (Map.Entry<StateKey, byte[]> e : writes.entrySet()) {
                if (e.getValue() == null) {
                    throw new IllegalArgumentException("Null value for " + e.getKey());
                }
                batch.put(handles.get(e.getKey().table()), keyBytes(e.getKey().key()), e.getValue());
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("commit failed", e);
        }
    }

    @Override
    public synchronized void scan(Table table, String prefix, BiConsumer<String, byte[]> visitor) {
        byte[] prefixBytes = prefix == null ? new byte[0] : keyBytes(prefix);
        try (RocksIterator it = db.newIterator(handles.get(table))) {
            if (prefixBytes.length == 0) {
                it.seekToFirst();
            } else {
                it.seek(prefixBytes);
            }
            for (; it.isValid(); it.next()) {
                byte[] key = it.key();
                if (!startsWith(key, prefixBytes)) {
                    break;
                }
                visitor.accept(new String(key, StandardCharsets.UTF_8), it.value());
            }
        }
    }

    @Override
    public synchronized void scanFrom(Table table, String fromKey, BiPredicate<String, byte[]> visitor) {
        try (RocksIterator it = db.newIterator(handles.get(table))) {
            for (it.seek(keyBytes(fromKey)); it.isValid(); it.next()) {
                if (!visitor.test(new String(it.key(), StandardCharsets.UTF_8), it.value())) {
                    return;
                }
            }
        }
    }

    @Override
    public void close() {
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle handle : allHandles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private static byte[] keyBytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }
}
