package io.sqlrpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.util.Timestamps;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

final class Params {
    static final double MIN_TIMEOUT_SECONDS = 0.001d;

    private Params() {
    }

    static String requiredString(ObjectNode params, String field) {
        JsonNode node = params.get(field);
        if (node == null || node.isNull()) {
            throw invalid("missing required param '" + field + "'");
        }
        if (!node.isTextual()) {
            throw invalid("'" + field + "' must be a string");
        }
        return node.asText();
    }

    static String string(ObjectNode params, String field, String fallback) {
        JsonNode node = params.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isTextual()) {
            throw invalid("'" + field + "' must be a string");
        }
        return node.asText();
    }

    static boolean bool(ObjectNode params, String field, boolean fallback) {
        JsonNode node = params.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            throw invalid("'" + field + "' must be a boolean");
        }
        return node.asBoolean();
    }

    static int integer(ObjectNode params, String field, int fallback) {
        JsonNode node = params.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw invalid("'" + field + "' must be an integer");
        }
        return node.asInt();
    }

    /**
     * {@code timeout} in seconds; absent or null means no limit. Values below a millisecond are rejected.
     */
    static Duration timeout(ObjectNode params) {
        JsonNode node = params.get("timeout");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber() || node.asDouble() <= 0.0d) {
            throw invalid("'timeout' must be a positive number of seconds");
        }
        if (node.asDouble() < MIN_TIMEOUT_SECONDS) {
            throw invalid("'timeout' must be at least " + MIN_TIMEOUT_SECONDS + " seconds");
        }
        return Timestamps.fromSeconds(node.asDouble());
    }

    static List<String> stringList(ObjectNode params, String field) {
        JsonNode node = params.get(field);
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isTextual()) {
            for (String part : node.asText().trim().split("\\s+")) {
                if (!part.isEmpty()) {
                    out.add(part);
                }
            }
            return out;
        }
        if (!node.isArray()) {
            throw invalid("'" + field + "' must be a string or an array of strings");
        }
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw invalid("'" + field + "' must contain only strings");
            }
            out.add(element.asText());
        }
        return out;
    }

    private static RpcException invalid(String detail) {
        return new RpcException(RpcErrorCode.INVALID_PARAMS, detail);
    }
}
