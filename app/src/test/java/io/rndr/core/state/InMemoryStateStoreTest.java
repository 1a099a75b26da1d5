package io.rndr.core.state;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    @Test
    void commitIsAllOrNothing() {
        InMemoryStateStore store = new InMemoryStateStore();
        Map<StateKey, byte[]> writes = new LinkedHashMap<>();
        writes.put(StateKey.of(Table.BALANCES, "tok", "alice"), bytes("1"));
        writes.put(StateKey.of(Table.BALANCES, "tok", "bob"), null);

        assertThrows(IllegalArgumentException.class, () -> store.commit(writes));
        assertTrue(store.get(Table.BALANCES, "tok/alice").isEmpty());
    }

    @Test
    void scanStaysInsidePrefixInKeyOrder() {
        InMemoryStateStore store = new InMemoryStateStore();
        Map<StateKey, byte[]> writes = new LinkedHashMap<>();
        writes.put(StateKey.of(Table.ESCROW, "esc", "u2"), bytes("2"));
        writes.put(StateKey.of(Table.ESCROW, "esc", "u1"), bytes("1"));
        writes.put(StateKey.of(Table.ESCROW, "esc2", "u3"), bytes("3"));
        writes.put(StateKey.of(Table.JOBS, "esc", "j1"), bytes("4"));
        store.commit(writes);

        List<String> keys = new ArrayList<>();
        store.scan(Table.ESCROW, StateKey.prefix("esc"), (k, v) -> keys.add(k));
        assertEquals(List.of("esc/u1", "esc/u2"), keys);
    }

    @Test
    void scanFromSeeksAndStopsWhenTold() {
        InMemoryStateStore store = new InMemoryStateStore();
        Map<StateKey, byte[]> writes = new LinkedHashMap<>();
        for (int i = 0; i < 6; i++) {
            writes.put(new StateKey(Table.EVENTS, "0" + i), bytes("e" + i));
        }
        store.commit(writes);

        List<String> visited = new ArrayList<>();
        store.scanFrom(Table.EVENTS, "02", (k, v) -> {
            visited.add(k);
            return visited.size() < 2;
        });
        assertEquals(List.of("02", "03"), visited);
    }

    @Test
    void returnedValuesAreCopies() {
        InMemoryStateStore store = new InMemoryStateStore();
        store.commit(Map.of(new StateKey(Table.META, "tok/name"), bytes("Render")));

        byte[] read = store.get(Table.META, "tok/name").orElseThrow();
        read[0] = 'X';
        assertEquals("Render", new String(store.get(Table.META, "tok/name").orElseThrow(), StandardCharsets.UTF_8));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
