package io.rndr.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.rndr.core.escrow.EscrowLedger;
import io.rndr.core.events.RecordedEvent;
import io.rndr.core.ledger.LedgerError;
import io.rndr.core.ledger.LedgerException;
import io.rndr.core.metrics.HttpMetrics;
import io.rndr.core.metrics.LedgerMetrics;
import io.rndr.core.node.Node;
import io.rndr.core.state.SupplyAudit;
import io.rndr.core.token.TokenLedger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front end for the ledgers: read endpoints for token, escrow, events and the
 * supply audit, plus {@code POST /call} for state-changing entry points.
 *
 * Read endpoints are guarded by the optional shared {@code authToken}. Calls are
 * guarded separately: each caller credential maps to exactly one ledger identity,
 * and a call runs as that identity. With no caller credentials configured,
 * {@code /call} refuses every request.
 */
public final class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final int DEFAULT_EVENT_LIMIT = 100;
    private static final int MAX_EVENT_LIMIT = 1000;
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "RNDR Ledger API",
    "version": "1.0.0"
  },
  "paths": {
    "/token/info": {
      "get": {
        "summary": "Token metadata, supply and configured addresses",
        "responses": { "200": { "description": "Token information" }, "401": { "description": "Auth required" } }
      }
    },
    "/token/balance": {
      "get": {
        "summary": "Token balance of an account",
        "parameters": [
          { "name": "addr", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Balance response" },
          "400": { "description": "Missing or invalid parameters" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/token/allowance": {
      "get": {
        "summary": "Remaining allowance of a spender over an owner's tokens",
        "parameters": [
          { "name": "owner", "in": "query", "required": true, "schema": { "type": "string" } },
          { "name": "spender", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Allowance response" },
          "400": { "description": "Missing or invalid parameters" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/escrow/info": {
      "get": {
        "summary": "Escrow owner, disbursal authority and token address",
        "responses": { "200": { "description": "Escrow information" }, "401": { "description": "Auth required" } }
      }
    },
    "/escrow/balance": {
      "get": {
        "summary": "Escrowed balance of a user id",
        "parameters": [
          { "name": "userId", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Escrow balance" },
          "400": { "description": "Missing parameter" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/escrow/job": {
      "get": {
        "summary": "Escrowed balance of a legacy job id",
        "parameters": [
          { "name": "jobId", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Job balance" },
          "400": { "description": "Missing parameter" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/events": {
      "get": {
        "summary": "Ledger events in sequence order",
        "parameters": [
          { "name": "after", "in": "query", "required": false, "schema": { "type": "integer", "format": "int64" } },
          { "name": "limit", "in": "query", "required": false, "schema": { "type": "integer" } }
        ],
        "responses": { "200": { "description": "Event page" }, "401": { "description": "Auth required" } }
      }
    },
    "/audit": {
      "get": {
        "summary": "Recompute supply conservation from committed state",
        "responses": { "200": { "description": "Audit result" }, "401": { "description": "Auth required" } }
      }
    },
    "/call": {
      "post": {
        "summary": "Invoke a ledger entry point",
        "requestBody": {
          "required": true,
          "content": {
            "application/json": {
              "schema": { "$ref": "#/components/schemas/CallRequest" }
            }
          }
        },
        "responses": {
          "200": { "description": "Call committed" },
          "400": { "description": "Invalid request or rejected by the ledger" },
          "401": { "description": "Caller credential required" },
          "403": { "description": "Caller does not match the credential, or not permitted by the ledger" }
        }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics in plain text",
        "responses": { "200": { "description": "Metrics dump" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "Return this OpenAPI document",
        "responses": { "200": { "description": "OpenAPI specification" } }
      }
    }
  },
  "components": {
    "schemas": {
      "CallRequest": {
        "type": "object",
        "required": ["method"],
        "properties": {
          "caller": { "type": "string", "description": "Must match the identity bound to the presented credential; defaults to it" },
          "contract": { "type": "string", "description": "Ledger address; defaults by method" },
          "method": { "type": "string" },
          "args": { "type": "object" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final Node node;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final Map<String, String> callerCredentials;
    private final ObjectMapper mapper;
    private final CallDispatcher dispatcher;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(Node node, String bindAddress, int port, String authToken) {
        this(node, bindAddress, port, authToken, Map.of());
    }

    /**
     * @param callerCredentials credential (Bearer token or X-API-Key value) to the ledger
     *                          identity that calls made with it run as
     */
    public ApiServer(Node node, String bindAddress, int port, String authToken, Map<String, String> callerCredentials) {
        this.node = node;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.dispatcher = new CallDispatcher(node, mapper);
        this.callerCredentials = callerCredentials == null ? Map.of() : Map.copyOf(callerCredentials);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("API server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/token/info", new TokenInfoHandler());
        server.createContext("/token/balance", new TokenBalanceHandler());
        server.createContext("/token/allowance", new AllowanceHandler());
        server.createContext("/escrow/info", new EscrowInfoHandler());
        server.createContext("/escrow/balance", new EscrowBalanceHandler());
        server.createContext("/escrow/job", new JobBalanceHandler());
        server.createContext("/events", new EventsHandler());
        server.createContext("/audit", new AuditHandler());
        server.createContext("/call", new CallHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "API server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
        if (callerCredentials.isEmpty()) {
            LOG.warning("No caller credentials configured; POST /call will refuse every request");
        } else {
            LOG.info(() -> "POST /call accepts " + callerCredentials.size() + " caller identities");
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /**
     * Shared request plumbing: timing, method check, optional auth and mapping of
     * failures to JSON error bodies.
     */
    abstract class Route implements HttpHandler {
        private final String allowedMethod;
        private final boolean requiresAuth;

        Route(String allowedMethod, boolean requiresAuth) {
            this.allowedMethod = allowedMethod;
            this.requiresAuth = requiresAuth;
        }

        abstract int serve(HttpExchange exchange) throws IOException;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String route = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                if (requiresAuth) {
                    status = ensureAuthorized(exchange);
                    if (status != -1) {
                        return;
                    }
                }
                status = serve(exchange);
            } catch (LedgerException e) {
                status = sendError(exchange, statusFor(e.error()), e.code(), e.getMessage());
            } catch (IllegalArgumentException e) {
                status = sendError(exchange, 400, "invalid_request",
                        Optional.ofNullable(e.getMessage()).orElse("Invalid request"));
            } catch (Exception e) {
                LOG.log(Level.WARNING, route + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, route, method, status);
                exchange.close();
            }
        }
    }

    final class TokenInfoHandler extends Route {
        TokenInfoHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            TokenLedger token = node.token();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("address", token.address());
            resp.put("name", token.name());
            resp.put("symbol", token.symbol());
            resp.put("decimals", token.decimals());
            resp.put("totalSupply", token.totalSupply().toString());
            resp.put("owner", token.owner());
            resp.put("escrowContractAddress", token.escrowContractAddress());
            resp.put("childChainManager", token.childChainManager());
            resp.put("legacyTokenAddress", token.legacyTokenAddress());
            return sendJson(exchange, 200, resp);
        }
    }

    final class TokenBalanceHandler extends Route {
        TokenBalanceHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String address = queryParam(exchange.getRequestURI(), "addr");
            if (address == null || address.isBlank()) {
                return sendError(exchange, 400, "missing_addr", "Query parameter 'addr' is required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("address", address);
            resp.put("balance", node.token().balanceOf(address).toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class AllowanceHandler extends Route {
        AllowanceHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String owner = queryParam(exchange.getRequestURI(), "owner");
            String spender = queryParam(exchange.getRequestURI(), "spender");
            if (owner == null || owner.isBlank() || spender == null || spender.isBlank()) {
                return sendError(exchange, 400, "missing_parameters", "Query parameters 'owner' and 'spender' are required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("owner", owner);
            resp.put("spender", spender);
            resp.put("allowance", node.token().allowance(owner, spender).toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class EscrowInfoHandler extends Route {
        EscrowInfoHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            EscrowLedger escrow = node.escrow();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("address", escrow.address());
            resp.put("owner", escrow.owner());
            resp.put("disbursalAddress", escrow.disbursalAddress());
            resp.put("renderTokenAddress", escrow.renderTokenAddress());
            resp.put("prevalidateDisbursals", escrow.prevalidatesDisbursals());
            resp.put("heldTokens", node.token().balanceOf(escrow.address()).toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class EscrowBalanceHandler extends Route {
        EscrowBalanceHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            // empty ids are legal escrow keys, only a missing parameter is rejected
            String userId = queryParam(exchange.getRequestURI(), "userId");
            if (userId == null) {
                return sendError(exchange, 400, "missing_userId", "Query parameter 'userId' is required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("userId", userId);
            resp.put("balance", node.escrow().userBalance(userId).toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class JobBalanceHandler extends Route {
        JobBalanceHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String jobId = queryParam(exchange.getRequestURI(), "jobId");
            if (jobId == null) {
                return sendError(exchange, 400, "missing_jobId", "Query parameter 'jobId' is required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("jobId", jobId);
            resp.put("balance", node.escrow().jobBalance(jobId).toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class EventsHandler extends Route {
        EventsHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            long after = parseLong(queryParam(exchange.getRequestURI(), "after"), -1L, "after");
            long limit = parseLong(queryParam(exchange.getRequestURI(), "limit"), DEFAULT_EVENT_LIMIT, "limit");
            if (limit < 1 || limit > MAX_EVENT_LIMIT) {
                return sendError(exchange, 400, "invalid_limit", "limit must be between 1 and " + MAX_EVENT_LIMIT);
            }
            List<RecordedEvent> page = node.events().since(after, (int) limit);
            ArrayNode events = mapper.createArrayNode();
            for (RecordedEvent recorded : page) {
                ObjectNode entry = events.addObject();
                entry.put("sequence", recorded.sequence());
                entry.set("event", mapper.valueToTree(recorded.event()));
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.set("events", events);
            resp.put("next", page.isEmpty() ? after : page.get(page.size() - 1).sequence());
            return sendJson(exchange, 200, resp);
        }
    }

    final class AuditHandler extends Route {
        AuditHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            SupplyAudit.Result audit = node.audit();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("balanced", audit.balanced());
            resp.put("totalSupply", audit.totalSupply().toString());
            resp.put("totalMinted", audit.totalMinted().toString());
            resp.put("totalBurned", audit.totalBurned().toString());
            resp.put("circulating", audit.circulating().toString());
            resp.put("escrowedUsers", audit.escrowedUsers().toString());
            resp.put("escrowedJobs", audit.escrowedJobs().toString());
            resp.put("escrowHolding", audit.escrowHolding().toString());
            resp.put("strandedInEscrow", audit.stranded().toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class CallHandler extends Route {
        CallHandler() { super("POST", false); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String identity = callerIdentity(exchange);
            if (identity == null) {
                exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
                return sendError(exchange, 401, "unauthorized", "A caller credential is required for /call");
            }
            CallDispatcher.CallRequest request;
            try {
                request = mapper.readValue(exchange.getRequestBody(), CallDispatcher.CallRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse call request");
            }
            if (request == null) {
                return sendError(exchange, 400, "invalid_json", "Call request body is empty");
            }
            if (request.caller == null) {
                request.caller = identity;
            } else if (!request.caller.equals(identity)) {
                LOG.warning(() -> "Rejected /call as " + request.caller + " with the credential of " + identity);
                return sendError(exchange, 403, "caller_mismatch",
                        "Credential is bound to " + identity + ", not " + request.caller);
            }
            ObjectNode resp = dispatcher.dispatch(request);
            LOG.fine(() -> "Call " + request.method + " from " + request.caller + " committed");
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsHandler extends Route {
        MetricsHandler() { super("GET", true); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] payload = LedgerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends Route {
        OpenApiHandler() { super("GET", false); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    /** Identity bound to the Bearer token or X-API-Key presented, or null. */
    private String callerIdentity(HttpExchange exchange) {
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.startsWith("Bearer ")) {
                    String identity = callerCredentials.get(header.substring("Bearer ".length()).trim());
                    if (identity != null) {
                        return identity;
                    }
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        return apiKey == null ? null : callerCredentials.get(apiKey.trim());
    }

    static int statusFor(LedgerError error) {
        return switch (error) {
            case NOT_OWNER, NOT_AUTHORIZED -> 403;
            default -> 400;
        };
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        HttpMetrics.recordError(exchange.getHttpContext().getPath(), code);
        ObjectNode body = mapper.createObjectNode();
        body.put("error", code);
        body.put("message", message);
        return sendJson(exchange, status, body);
    }

    private static long parseLong(String value, long fallback, String name) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter '" + name + "' must be an integer");
        }
    }

    private static String queryParam(URI uri, String key) {
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (key.equals(k)) {
                return kv.length == 2 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
            }
        }
        return null;
    }
}
