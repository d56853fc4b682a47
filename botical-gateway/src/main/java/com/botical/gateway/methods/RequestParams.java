package com.botical.gateway.methods;

import com.botical.common.errors.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Payload accessors shared by the request registrars.
 */
final class RequestParams {

    private RequestParams() {
    }

    static String textParam(JsonNode payload, String field, String defaultValue) {
        if (payload != null && payload.has(field) && !payload.get(field).isNull()) {
            return payload.get(field).asText(defaultValue).trim();
        }
        return defaultValue;
    }

    static String requiredText(JsonNode payload, String field) {
        String value = textParam(payload, field, "");
        if (value.isEmpty()) {
            throw new ValidationException(field + " required");
        }
        return value;
    }

    static boolean boolParam(JsonNode payload, String field) {
        return payload != null && payload.path(field).asBoolean(false);
    }

    static int intParam(JsonNode payload, String field, int defaultValue) {
        if (payload != null && payload.hasNonNull(field)) {
            JsonNode node = payload.get(field);
            if (!node.canConvertToInt()) {
                throw new ValidationException(field + " must be an integer");
            }
            return node.asInt();
        }
        return defaultValue;
    }

    static CompletableFuture<Object> fail(String message) {
        return CompletableFuture.failedFuture(new ValidationException(message));
    }
}
