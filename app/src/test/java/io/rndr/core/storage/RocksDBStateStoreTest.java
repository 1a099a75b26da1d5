package io.rndr.core.storage;

import io.rndr.core.state.StateKey;
import io.rndr.core.state.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void committedRowsSurviveReopen() {
        String dir = tempDir.resolve("db").toString();
        try (RocksDBStateStore store = RocksDBStateStore.open(dir)) {
            Map<StateKey, byte[]> writes = new LinkedHashMap<>();
            writes.put(StateKey.of(Table.BALANCES, "tok", "alice"), bytes("a"));
            writes.put(StateKey.of(Table.ESCROW, "esc", "user-1"), bytes("b"));
            store.commit(writes);
        }

        try (RocksDBStateStore store = RocksDBStateStore.open(dir)) {
            assertArrayEquals(bytes("a"), store.get(Table.BALANCES, "tok/alice").orElseThrow());
            assertArrayEquals(bytes("b"), store.get(Table.ESCROW, "esc/user-1").orElseThrow());
            // tables are separate column families
            assertTrue(store.get(Table.ESCROW, "tok/alice").isEmpty());
        }
    }

    @Test
    void nullValueRejectsTheWholeBatch() {
        try (RocksDBStateStore store = RocksDBStateStore.open(tempDir.resolve("db").toString())) {
            Map<StateKey, byte[]> writes = new LinkedHashMap<>();
            writes.put(StateKey.of(Table.BALANCES, "tok", "alice"), bytes("a"));
            writes.put(StateKey.of(Table.BALANCES, "tok", "bob"), null);

            assertThrows(IllegalArgumentException.class, () -> store.commit(writes));
            assertTrue(store.get(Table.BALANCES, "tok/alice").isEmpty());
        }
    }

    @Test
    void scanStopsAtPrefixBoundary() {
        try (RocksDBStateStore store = RocksDBStateStore.open(tempDir.resolve("db").toString())) {
            Map<StateKey, byte[]> writes = new LinkedHashMap<>();
            writes.put(StateKey.of(Table.JOBS, "esc", "job-b"), bytes("2"));
            writes.put(StateKey.of(Table.JOBS, "esc", "job-a"), bytes("1"));
            writes.put(StateKey.of(Table.JOBS, "escrow2", "job-c"), bytes("3"));
            store.commit(writes);

            List<String> keys = new ArrayList<>();
            store.scan(Table.JOBS, StateKey.prefix("esc"), (k, v) -> keys.add(k));
            assertEquals(List.of("esc/job-a", "esc/job-b"), keys);
        }
    }

    @Test
    void scanFromSeeksPastEarlierKeys() {
        try (RocksDBStateStore store = RocksDBStateStore.open(tempDir.resolve("db").toString())) {
            Map<StateKey, byte[]> writes = new LinkedHashMap<>();
            for (int i = 0; i < 5; i++) {
                writes.put(new StateKey(Table.EVENTS, String.format("%03d", i)), bytes("e" + i));
            }
            store.commit(writes);

            List<String> visited = new ArrayList<>();
            store.scanFrom(Table.EVENTS, "001", (k, v) -> {
                visited.add(k + "=" + new String(v, StandardCharsets.UTF_8));
                return !k.equals("003");
            });
            assertEquals(List.of("001=e1", "002=e2", "003=e3"), visited);
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
