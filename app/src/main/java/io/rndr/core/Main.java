package io.rndr.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rndr.core.api.ApiServer;
import io.rndr.core.escrow.EscrowLedger;
import io.rndr.core.ledger.LedgerException;
import io.rndr.core.metrics.LedgerMetrics;
import io.rndr.core.node.Node;
import io.rndr.core.node.NodeConfig;
import io.rndr.core.protocol.Amounts;
import io.rndr.core.state.SupplyAudit;
import io.rndr.core.token.TokenLedger;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = NodeConfig.defaultLocal()
                .withOwner(options.owner(), options.bridgeManager())
                .withPrevalidateDisbursals(options.prevalidateDisbursals());

        Node node;
        if (options.inMemory()) {
            node = Node.inMemory(config);
            LOG.info("Using in-memory state (nothing is persisted)");
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.resetState()) {
                resetState(dataPath);
            }
            Files.createDirectories(dataPath);
            Path allocFile = dataPath.resolve("genesis-alloc.json");
            Map<String, BigInteger> allocations = loadAllocations(allocFile);
            if (allocations == null) {
                allocations = config.genesisAllocations;
                saveAllocations(allocFile, allocations);
            }
            config = config.withGenesisAllocations(allocations);
            node = Node.rocks(config, dataPath.resolve("state").toString());
        }

        ApiServer apiServer = null;
        try {
            node.start();
            LOG.info("Token " + node.token().address() + ", escrow " + node.escrow().address()
                    + ", owner " + config.owner);

            if (options.demo()) {
                runDemoFlow(node);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.enableApi()) {
                apiServer = new ApiServer(node, options.apiBind(), options.apiPort(), options.apiToken(),
                        options.apiCallers());
                apiServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "rndr-ledger-shutdown"));
                LOG.info("Ledger node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (apiServer != null) {
                apiServer.stop();
            }
            node.close();
        }
    }

    /**
     * Walks one escrow cycle: a holder escrows tokens for a user id, the disbursal
     * authority pays two providers, and the audit confirms nothing leaked.
     */
    private static void runDemoFlow(Node node) {
        NodeConfig config = node.config();
        TokenLedger token = node.token();
        EscrowLedger escrow = node.escrow();
        String holder = config.genesisAllocations.keySet().stream().findFirst().orElse(null);
        if (holder == null || token.balanceOf(holder).signum() == 0) {
            LOG.info("Demo skipped: no funded genesis account");
            return;
        }
        String userId = "demo-user-" + System.currentTimeMillis();
        try {
            token.holdInEscrow(holder, userId, BigInteger.valueOf(1_000));
            LOG.info("Escrowed 1000 for " + userId + ", escrow balance=" + escrow.userBalance(userId));

            escrow.disburseFunds(escrow.disbursalAddress(), userId,
                    List.of("provider-one", "provider-two"),
                    List.of(BigInteger.valueOf(600), BigInteger.valueOf(400)));
            LOG.info("provider-one balance=" + token.balanceOf("provider-one"));
            LOG.info("provider-two balance=" + token.balanceOf("provider-two"));
        } catch (LedgerException e) {
            LOG.warning("Demo flow rejected: " + e.getMessage());
        }

        SupplyAudit.Result audit = node.audit();
        LOG.info("Supply audit balanced=" + audit.balanced() + " supply=" + audit.totalSupply());
        LOG.info("=== Metrics ===\n" + LedgerMetrics.scrapeMetrics());
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }

    static Map<String, BigInteger> loadAllocations(Path path) {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            Map<String, String> raw = JSON.readValue(path.toFile(), new TypeReference<Map<String, String>>() {});
            Map<String, BigInteger> out = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : raw.entrySet()) {
                out.put(e.getKey(), Amounts.parse(e.getValue()));
            }
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read genesis allocations from " + path, e);
        }
    }

    static void saveAllocations(Path path, Map<String, BigInteger> allocations) {
        Map<String, String> raw = new LinkedHashMap<>();
        for (Map.Entry<String, BigInteger> e : allocations.entrySet()) {
            raw.put(e.getKey(), e.getValue().toString());
        }
        try {
            Files.createDirectories(path.getParent());
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), raw);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist genesis allocations to " + path, e);
        }
    }

    private static void resetState(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        Path allocFile = dataPath.resolve("genesis-alloc.json").normalize();
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .filter(path -> !path.normalize().equals(allocFile))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset ledger data in " + dataPath, e);
        }
        LOG.info("Cleared ledger state under " + dataPath + " (genesis-alloc.json preserved).");
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean resetState,
            boolean keepAlive,
            boolean demo,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken,
            Map<String, String> apiCallers,
            String owner,
            String bridgeManager,
            boolean prevalidateDisbursals
    ) {
        static CliOptions parse(String[] args) {
            NodeConfig defaults = NodeConfig.defaultLocal();
            Path dataDir = envPath("RNDR_DATA_DIR", Path.of("./data/ledger"));
            boolean inMemory = false;
            boolean reset = false;
            boolean keepAlive = false;
            boolean demo = true;
            boolean enableApi = "true".equalsIgnoreCase(System.getenv("RNDR_ENABLE_API"));
            String apiBind = envOrDefault("RNDR_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            String apiToken = null;
            Map<String, String> apiCallers = new LinkedHashMap<>();
            String owner = envOrDefault("RNDR_OWNER", defaults.owner);
            String bridgeManager = envOrDefault("RNDR_BRIDGE_MANAGER", defaults.bridgeManager);
            boolean prevalidate = "true".equalsIgnoreCase(System.getenv("RNDR_PREVALIDATE_DISBURSALS"));
            boolean showHelp = false;
            String error = null;

            try {
                apiPort = envPort("RNDR_API_PORT", 8080);
                String envCallers = System.getenv("RNDR_API_CALLERS");
                if (envCallers != null && !envCallers.isBlank()) {
                    for (String binding : envCallers.split(",")) {
                        addCaller(apiCallers, binding, "RNDR_API_CALLERS");
                    }
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--reset-state")) {
                        reset = true;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.equals("--enable-api")) {
                        enableApi = true;
                    } else if (arg.startsWith("--api-bind=")) {
                        apiBind = arg.substring("--api-bind=".length());
                    } else if (arg.startsWith("--api-port=")) {
                        try {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--api-token=")) {
                        apiToken = arg.substring("--api-token=".length());
                    } else if (arg.startsWith("--api-caller=")) {
                        try {
                            addCaller(apiCallers, arg.substring("--api-caller=".length()), "--api-caller");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--owner=")) {
                        owner = arg.substring("--owner=".length()).trim();
                    } else if (arg.startsWith("--bridge-manager=")) {
                        bridgeManager = arg.substring("--bridge-manager=".length()).trim();
                    } else if (arg.equals("--prevalidate-disbursals")) {
                        prevalidate = true;
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (apiToken == null || apiToken.isBlank()) {
                apiToken = System.getenv("RNDR_API_TOKEN");
            }
            keepAlive = keepAlive || enableApi || "true".equalsIgnoreCase(System.getenv("RNDR_KEEP_ALIVE"));
            if (owner == null || owner.isBlank()) {
                owner = defaults.owner;
            }
            if (bridgeManager == null || bridgeManager.isBlank()) {
                bridgeManager = defaults.bridgeManager;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    reset,
                    keepAlive,
                    demo,
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken,
                    Map.copyOf(apiCallers),
                    owner,
                    bridgeManager,
                    prevalidate
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: rndr-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for ledger data (default ./data/ledger)
  --in-memory                Keep state in memory only
  --reset-state              Delete ledger state (genesis-alloc.json is preserved)
  --keep-alive               Keep the node running until interrupted
  --demo / --no-demo         Enable (default) or disable the demo escrow flow
  --enable-api               Start the HTTP API (default bind 127.0.0.1:8080)
  --api-bind=<host>          Bind address for the HTTP API
  --api-port=<port>          Port for the HTTP API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the HTTP API
  --api-caller=<token>=<id>  Let requests presenting <token> call as <id> (repeatable)
  --owner=<addr>             Owner of the token and escrow ledgers on genesis
  --bridge-manager=<addr>    Child chain manager allowed to deposit
  --prevalidate-disbursals   Reject disbursals whose total exceeds the balance before paying anyone

Environment overrides:
  RNDR_DATA_DIR              Override --data-dir
  RNDR_API_TOKEN             Token for API auth (if --api-token not supplied)
  RNDR_API_CALLERS           Comma-separated <token>=<id> caller bindings
  RNDR_API_BIND              Override --api-bind
  RNDR_API_PORT              Override --api-port
  RNDR_ENABLE_API            Set to "true" to enable the API without CLI flag
  RNDR_OWNER                 Override --owner
  RNDR_BRIDGE_MANAGER        Override --bridge-manager
  RNDR_PREVALIDATE_DISBURSALS Set to "true" to pre-validate disbursals
  RNDR_KEEP_ALIVE            Set to "true" to force keep-alive mode
""");
        }

        private static void addCaller(Map<String, String> callers, String binding, String source) {
            int sep = binding.indexOf('=');
            String token = sep < 0 ? "" : binding.substring(0, sep).trim();
            String identity = sep < 0 ? "" : binding.substring(sep + 1).trim();
            if (token.isEmpty() || identity.isEmpty()) {
                throw new IllegalArgumentException("Invalid " + source + " binding, expected <token>=<id>: " + binding);
            }
            callers.put(token, identity);
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}
