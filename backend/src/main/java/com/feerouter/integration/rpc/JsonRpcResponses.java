package com.feerouter.integration.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.feerouter.error.IntegrationException;

/**
 * Parsing helpers shared by the gateway adapters.
 */
public final class JsonRpcResponses {

    private JsonRpcResponses() {
    }

    /**
     * Returns the {@code result} node or throws if the body is unparseable, carries an {@code error}, or has no result.
     */
    public static JsonNode result(ObjectMapper objectMapper, String method, String body) {
        if (body == null || body.isBlank()) {
            throw new IntegrationException(method + " returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IntegrationException(method + " returned malformed JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new IntegrationException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new IntegrationException(method + " returned no result");
        }
        return result;
    }

    /**
     * Reads a u64 amount encoded either as a JSON number or a decimal string. Values above {@link Long#MAX_VALUE}
     * or below zero are rejected.
     */
    public static long amount(JsonNode node, String field, String method) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            throw new IntegrationException(method + " result missing '" + field + "'");
        }
        try {
            long parsed = Long.parseLong(value.asText().trim());
            if (parsed < 0) {
                throw new IntegrationException(method + " returned negative '" + field + "': " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IntegrationException(method + " returned non-integer '" + field + "': " + value.asText(), e);
        }
    }

    public static String text(JsonNode node, String field, String method) {
        String value = node.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new IntegrationException(method + " result missing '" + field + "'");
        }
        return value;
    }
}
