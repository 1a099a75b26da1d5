package io.rndr.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertFalse(options.enableApi());
        assertFalse(options.inMemory());
        assertFalse(options.resetState());
        assertFalse(options.prevalidateDisbursals());
        assertTrue(options.demo());
        assertEquals(8080, options.apiPort());
        assertEquals(Path.of("./data/ledger").normalize(), options.dataDir().normalize());
        assertEquals("rndr-owner", options.owner());
        assertEquals("child-chain-manager", options.bridgeManager());
        assertTrue(options.apiCallers().isEmpty());
    }

    @Test
    void enablesApiWithToken() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--enable-api",
                "--api-bind=0.0.0.0",
                "--api-port=8181",
                "--api-token=test-api",
                "--no-demo",
                "--owner=ops-multisig",
                "--bridge-manager=polygon-ccm"
        });
        assertFalse(options.showHelp());
        assertTrue(options.enableApi());
        assertEquals("0.0.0.0", options.apiBind());
        assertEquals(8181, options.apiPort());
        assertEquals("test-api", options.apiToken());
        assertFalse(options.demo());
        assertTrue(options.keepAlive());
        assertEquals("ops-multisig", options.owner());
        assertEquals("polygon-ccm", options.bridgeManager());
    }

    @Test
    void storageAndDisbursalFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--in-memory", "--reset-state", "--prevalidate-disbursals", "--data-dir=/tmp/ledger-x"
        });
        assertTrue(options.inMemory());
        assertTrue(options.resetState());
        assertTrue(options.prevalidateDisbursals());
        assertEquals(Path.of("/tmp/ledger-x"), options.dataDir());

        Main.CliOptions positional = Main.CliOptions.parse(new String[] {"somewhere/else"});
        assertEquals(Path.of("somewhere/else"), positional.dataDir());
    }

    @Test
    void callerCredentialsAreRepeatable() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--api-caller=ops-key=rndr-owner",
                "--api-caller=bridge-key=child-chain-manager"
        });
        assertNull(options.errorMessage());
        assertEquals(Map.of("ops-key", "rndr-owner", "bridge-key", "child-chain-manager"), options.apiCallers());

        Main.CliOptions malformed = Main.CliOptions.parse(new String[] {"--api-caller=no-identity"});
        assertTrue(malformed.showHelp());
        assertTrue(malformed.errorMessage().contains("--api-caller"));
    }

    @Test
    void invalidPortSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--api-port=70000"});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
        assertTrue(options.errorMessage().contains("--api-port"));
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }

    @Test
    void genesisAllocationsPersistAsStrings(@TempDir Path dir) {
        Path file = dir.resolve("nested").resolve("genesis-alloc.json");
        assertNull(Main.loadAllocations(file));

        Map<String, BigInteger> allocations = new LinkedHashMap<>();
        allocations.put("alice123456", new BigInteger("1000000000000000000000000"));
        allocations.put("bob654321", BigInteger.TEN);
        Main.saveAllocations(file, allocations);

        assertEquals(allocations, Main.loadAllocations(file));
    }
}
