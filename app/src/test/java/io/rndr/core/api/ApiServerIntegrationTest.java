package io.rndr.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rndr.core.ledger.LedgerError;
import io.rndr.core.metrics.HttpMetrics;
import io.rndr.core.metrics.LedgerMetrics;
import io.rndr.core.node.Node;
import io.rndr.core.node.NodeConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerIntegrationTest {

    private static final String ALICE = "alice123456";
    private static final String BOB = "bob654321";
    private static final String OWNER = "rndr-owner";
    private static final Map<String, String> CREDENTIALS = Map.of(
            ALICE, "alice-key",
            BOB, "bob-key",
            OWNER, "owner-key");

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();

    private ApiServer server;
    private Node node;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        port = freePort();
        node = Node.inMemory(NodeConfig.defaultLocal());
        node.start();
        Map<String, String> callers = new HashMap<>();
        CREDENTIALS.forEach((identity, credential) -> callers.put(credential, identity));
        server = new ApiServer(node, "127.0.0.1", port, null, callers);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (node != null) {
            node.close();
        }
    }

    @Test
    void tokenInfoAndBalances() throws Exception {
        HttpResponse<String> info = get("/token/info");
        assertEquals(200, info.statusCode());
        JsonNode body = mapper.readTree(info.body());
        assertEquals("RNDR", body.get("symbol").asText());
        assertEquals(18, body.get("decimals").asInt());
        assertEquals("1500000", body.get("totalSupply").asText());

        JsonNode balance = mapper.readTree(get("/token/balance?addr=" + ALICE).body());
        assertEquals("1000000", balance.get("balance").asText());

        assertEquals(400, get("/token/balance").statusCode());
    }

    @Test
    void transferThroughCallEndpoint() throws Exception {
        ObjectNode args = mapper.createObjectNode().put("to", BOB).put("amount", "250");
        HttpResponse<String> resp = call(ALICE, "transfer", args);

        assertEquals(200, resp.statusCode(), resp.body());
        assertEquals(BigInteger.valueOf(999_750), node.token().balanceOf(ALICE));
        assertEquals("500250", mapper.readTree(get("/token/balance?addr=" + BOB).body()).get("balance").asText());
    }

    @Test
    void escrowCycleThroughCallEndpoint() throws Exception {
        assertEquals(200, call(ALICE, "holdInEscrow",
                mapper.createObjectNode().put("userId", "user-42").put("amount", 1_000)).statusCode());

        JsonNode escrowBalance = mapper.readTree(get("/escrow/balance?userId=user-42").body());
        assertEquals("1000", escrowBalance.get("balance").asText());

        ObjectNode disburse = mapper.createObjectNode().put("userId", "user-42");
        disburse.putArray("recipients").add("provider-1").add("provider-2");
        disburse.putArray("amounts").add("600").add(400);
        HttpResponse<String> resp = call(OWNER, "disburseFunds", disburse);
        assertEquals(200, resp.statusCode(), resp.body());

        assertEquals(BigInteger.valueOf(600), node.token().balanceOf("provider-1"));
        assertEquals(BigInteger.valueOf(400), node.token().balanceOf("provider-2"));
        assertEquals("0", mapper.readTree(get("/escrow/balance?userId=user-42").body()).get("balance").asText());

        JsonNode audit = mapper.readTree(get("/audit").body());
        assertTrue(audit.get("balanced").asBoolean());
    }

    @Test
    void ledgerRejectionsMapToErrorBodies() throws Exception {
        double overdraftsBefore = LedgerMetrics.rejections(LedgerError.INSUFFICIENT_BALANCE);
        double apiOverdraftsBefore = HttpMetrics.errors("/call", "InsufficientBalance");

        HttpResponse<String> notOwner = call(ALICE, "setEscrowContractAddress",
                mapper.createObjectNode().put("address", "elsewhere"));
        assertEquals(403, notOwner.statusCode());
        assertEquals("NotOwner", mapper.readTree(notOwner.body()).get("error").asText());

        HttpResponse<String> overdraft = call(BOB, "transfer",
                mapper.createObjectNode().put("to", ALICE).put("amount", "500001"));
        assertEquals(400, overdraft.statusCode());
        assertEquals("InsufficientBalance", mapper.readTree(overdraft.body()).get("error").asText());
        assertEquals(overdraftsBefore + 1, LedgerMetrics.rejections(LedgerError.INSUFFICIENT_BALANCE));
        assertEquals(apiOverdraftsBefore + 1, HttpMetrics.errors("/call", "InsufficientBalance"));

        HttpResponse<String> nullRecipient = call(ALICE, "transfer",
                mapper.createObjectNode().putNull("to").put("amount", 1));
        assertEquals("InvalidRecipient", mapper.readTree(nullRecipient.body()).get("error").asText());

        HttpResponse<String> unknown = call(ALICE, "mintForFree", mapper.createObjectNode());
        assertEquals(400, unknown.statusCode());
        assertEquals("invalid_request", mapper.readTree(unknown.body()).get("error").asText());

        HttpResponse<String> missingId = call(ALICE, "holdInEscrow",
                mapper.createObjectNode().putNull("userId").put("amount", 10));
        assertEquals(400, missingId.statusCode());
        assertEquals("InvalidEscrowId", mapper.readTree(missingId.body()).get("error").asText());
        assertEquals(BigInteger.valueOf(1_000_000), node.token().balanceOf(ALICE));
    }

    @Test
    void malformedBodiesAndMethods() throws Exception {
        HttpRequest badJson = HttpRequest.newBuilder(uri("/call"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer alice-key")
                .POST(HttpRequest.BodyPublishers.ofString("{not json"))
                .build();
        HttpResponse<String> resp = http.send(badJson, HttpResponse.BodyHandlers.ofString());
        assertEquals(400, resp.statusCode());
        assertEquals("invalid_json", mapper.readTree(resp.body()).get("error").asText());

        assertEquals(405, get("/call").statusCode());
    }

    @Test
    void eventsArePagedInSequenceOrder() throws Exception {
        call(ALICE, "transfer", mapper.createObjectNode().put("to", BOB).put("amount", 1));

        JsonNode firstPage = mapper.readTree(get("/events?limit=2").body());
        assertEquals(2, firstPage.get("events").size());
        long next = firstPage.get("next").asLong();
        assertEquals(firstPage.get("events").get(1).get("sequence").asLong(), next);

        JsonNode rest = mapper.readTree(get("/events?after=" + next + "&limit=1000").body());
        JsonNode last = rest.get("events").get(rest.get("events").size() - 1).get("event");
        assertEquals("Transfer", last.get("type").asText());
        assertEquals(BOB, last.get("to").asText());

        assertEquals(400, get("/events?limit=0").statusCode());
    }

    @Test
    void metricsAndOpenApi() throws Exception {
        get("/token/info");
        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("ledger.calls"));
        assertTrue(metrics.body().contains("escrow.funded.amount"));

        HttpResponse<String> openapi = get("/openapi.json");
        assertEquals(200, openapi.statusCode());
        assertTrue(mapper.readTree(openapi.body()).get("paths").has("/call"));
    }

    private HttpResponse<String> call(String caller, String method, ObjectNode args) throws Exception {
        ObjectNode body = mapper.createObjectNode().put("caller", caller).put("method", method);
        body.set("args", args);
        HttpRequest request = HttpRequest.newBuilder(uri("/call"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + CREDENTIALS.get(caller))
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + port + path);
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
