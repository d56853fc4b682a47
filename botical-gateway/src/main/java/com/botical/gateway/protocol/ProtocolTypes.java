package com.botical.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket protocol frames.
 *
 * <ul>
 * <li>request, client to server: {@code {id, type, payload?}}</li>
 * <li>response, server to client: {@code {id, type:"response", success, payload?, error?}}</li>
 * <li>event, server to client: {@code {type, payload}}</li>
 * </ul>
 */
public final class ProtocolTypes {

    private ProtocolTypes() {
    }

    /** WebSocket close code for a missing or rejected credential. */
    public static final int CLOSE_UNAUTHORIZED = 4001;
    /** WebSocket close code for a project the user may not open. */
    public static final int CLOSE_FORBIDDEN = 4003;

    // ── Error codes ──────────────────────────────────────────────

    public static final class ErrorCodes {
        public static final String UNKNOWN_REQUEST = "UNKNOWN_REQUEST";
        public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

        private ErrorCodes() {
        }
    }

    // ── Event types pushed to clients ────────────────────────────

    public static final class EventTypes {
        public static final String CONNECTED = "connected";
        public static final String SESSION_SYNC = "session.sync";

        private EventTypes() {
        }
    }

    // ── Error shape ──────────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorShape {
        private String code;
        private String message;
        private Object details;

        public static ErrorShape of(String code, String message) {
            return new ErrorShape(code, message, null);
        }
    }

    // ── Request frame ────────────────────────────────────────────

    /** Client request: {@code {id, type, payload?}}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RequestFrame {
        private String id;
        private String type;
        private JsonNode payload;

        public boolean isValid() {
            return id != null && !id.isEmpty() && type != null && !type.isEmpty();
        }
    }

    // ── Response frame ───────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponseFrame {
        private String id;
        private String type = "response";
        private boolean success;
        private Object payload;
        private ErrorShape error;

        public static ResponseFrame success(String id, Object payload) {
            return new ResponseFrame(id, "response", true, payload, null);
        }

        public static ResponseFrame failure(String id, ErrorShape error) {
            return new ResponseFrame(id, "response", false, null, error);
        }

        public static ResponseFrame failure(String id, String code, String message) {
            return failure(id, ErrorShape.of(code, message));
        }
    }

    // ── Event frame ──────────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventFrame {
        private String type;
        private Object payload;

        public static EventFrame of(String type, Object payload) {
            return new EventFrame(type, payload);
        }
    }
}
