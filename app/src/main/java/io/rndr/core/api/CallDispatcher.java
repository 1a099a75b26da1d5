package io.rndr.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rndr.core.escrow.EscrowLedger;
import io.rndr.core.node.Node;
import io.rndr.core.protocol.AbiCodec;
import io.rndr.core.protocol.Amounts;
import io.rndr.core.token.TokenLedger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps a {@code POST /call} body onto a ledger entry point.
 *
 * The target is the ledger at {@code contract} when given, otherwise the escrow
 * ledger for escrow-only methods and the token ledger for the rest. Amounts may be
 * JSON numbers, decimal strings or 0x-prefixed hex strings.
 */
public final class CallDispatcher {
    private static final Set<String> ESCROW_METHODS = Set.of(
            "disburseFunds", "disburseJob", "changeDisbursalAddress", "changeRenderTokenAddress");

    private final Node node;
    private final ObjectMapper mapper;

    public CallDispatcher(Node node, ObjectMapper mapper) {
        this.node = node;
        this.mapper = mapper;
    }

    public static class CallRequest {
        public String caller;
        public String contract;
        public String method;
        public JsonNode args;
    }

    /**
     * @throws IllegalArgumentException for an unknown method or contract, or missing arguments
     * @throws io.rndr.core.ledger.LedgerException when the ledger rejects the call
     */
    public ObjectNode dispatch(CallRequest request) {
        if (request == null || request.method == null || request.method.isBlank()) {
            throw new IllegalArgumentException("Field 'method' is required");
        }
        JsonNode args = request.args == null ? mapper.createObjectNode() : request.args;
        ObjectNode result = mapper.createObjectNode()
                .put("status", "ok")
                .put("method", request.method);

        Object target = resolveTarget(request);
        if (target instanceof EscrowLedger escrow) {
            callEscrow(escrow, request.caller, request.method, args);
        } else {
            TokenLedger token = (TokenLedger) target;
            BigInteger migrated = callToken(token, request.caller, request.method, args);
            if (migrated != null) {
                result.put("migrated", migrated.toString());
            }
        }
        return result;
    }

    private Object resolveTarget(CallRequest request) {
        if (request.contract == null || request.contract.isBlank()) {
            return ESCROW_METHODS.contains(request.method) ? node.escrow() : node.token();
        }
        var registry = node.runtime().registry();
        Object target = registry.resolve(request.contract, TokenLedger.class).map(Object.class::cast)
                .or(() -> registry.resolve(request.contract, EscrowLedger.class))
                .orElse(null);
        if (target == null) {
            throw new IllegalArgumentException("No ledger at " + request.contract);
        }
        return target;
    }

    private BigInteger callToken(TokenLedger token, String caller, String method, JsonNode args) {
        switch (method) {
            case "transfer" -> token.transfer(caller, text(args, "to"), amount(args, "amount"));
            case "approve" -> token.approve(caller, text(args, "spender"), amount(args, "amount"));
            case "increaseAllowance" -> token.increaseAllowance(caller, text(args, "spender"), amount(args, "delta"));
            case "decreaseAllowance" -> token.decreaseAllowance(caller, text(args, "spender"), amount(args, "delta"));
            case "transferFrom" -> token.transferFrom(caller, text(args, "from"), text(args, "to"), amount(args, "amount"));
            case "holdInEscrow" -> token.holdInEscrow(caller, text(args, "userId"), amount(args, "amount"));
            case "holdInEscrowForJob" -> token.holdInEscrowForJob(caller, text(args, "jobId"), amount(args, "amount"));
            case "setEscrowContractAddress" -> token.setEscrowContractAddress(caller, text(args, "address"));
            case "updateChildChainManager" -> token.updateChildChainManager(caller, text(args, "address"));
            case "setLegacyTokenAddress" -> token.setLegacyTokenAddress(caller, text(args, "address"));
            case "deposit" -> token.deposit(caller, text(args, "user"), AbiCodec.parseHex(text(args, "depositData")));
            case "withdraw" -> token.withdraw(caller, amount(args, "amount"));
            case "transferOwnership" -> token.transferOwnership(caller, text(args, "newOwner"));
            case "migrate" -> {
                return token.migrate(caller);
            }
            default -> throw new IllegalArgumentException("Unknown token method: " + method);
        }
        return null;
    }

    private void callEscrow(EscrowLedger escrow, String caller, String method, JsonNode args) {
        switch (method) {
            case "disburseFunds" -> escrow.disburseFunds(caller, text(args, "userId"),
                    textList(args, "recipients"), amountList(args, "amounts"));
            case "disburseJob" -> escrow.disburseJob(caller, text(args, "jobId"),
                    textList(args, "recipients"), amountList(args, "amounts"));
            case "changeDisbursalAddress" -> escrow.changeDisbursalAddress(caller, text(args, "address"));
            case "changeRenderTokenAddress" -> escrow.changeRenderTokenAddress(caller, text(args, "address"));
            case "transferOwnership" -> escrow.transferOwnership(caller, text(args, "newOwner"));
            default -> throw new IllegalArgumentException("Unknown escrow method: " + method);
        }
    }

    // A JSON null stays null so the ledger reports the null address itself.
    private static String text(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Missing argument '" + field + "'");
        }
        return value.isNull() ? null : value.asText();
    }

    private static BigInteger amount(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing argument '" + field + "'");
        }
        return toAmount(value);
    }

    private static BigInteger toAmount(JsonNode value) {
        if (value.isIntegralNumber()) {
            return Amounts.requireUint256(value.bigIntegerValue());
        }
        if (value.isTextual()) {
            return Amounts.parse(value.asText());
        }
        throw new IllegalArgumentException("Amounts must be integers or integer strings, got " + value);
    }

    private static List<String> textList(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || !value.isArray()) {
            throw new IllegalArgumentException("Argument '" + field + "' must be an array");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : value) {
            out.add(item.isNull() ? null : item.asText());
        }
        return out;
    }

    private static List<BigInteger> amountList(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || !value.isArray()) {
            throw new IllegalArgumentException("Argument '" + field + "' must be an array");
        }
        List<BigInteger> out = new ArrayList<>();
        for (JsonNode item : value) {
            out.add(toAmount(item));
        }
        return out;
    }
}
