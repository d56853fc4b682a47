package com.botical.common.bus;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Closed set of events that flow through the {@link EventBus}.
 *
 * <p>
 * Naming follows {@code entity.action} or {@code entity.sub.action}. Each kind
 * is a record whose components are its payload; the record is serialized as
 * the {@code payload} of the outbound event frame.
 */
public sealed interface BoticalEvent {

    /** Wire discriminator, e.g. {@code message.text.delta}. */
    @JsonIgnore
    String type();

    /**
     * Events bound to a single session. A {@code null} session id means the
     * event is only relevant at project level.
     */
    interface SessionScoped {
        String sessionId();
    }

    // ── Session ─────────────────────────────────────────────────────────

    record SessionCreated(String sessionId, String title, String agent, String parentId)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "session.created";

        @Override
        public String type() {
            return TYPE;
        }
    }

    /** Only the changed fields are set; the rest stay null and are omitted on the wire. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SessionUpdated(String sessionId, String title, String status, String agent)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "session.updated";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record SessionDeleted(String sessionId) implements BoticalEvent, SessionScoped {
        public static final String TYPE = "session.deleted";

        @Override
        public String type() {
            return TYPE;
        }
    }

    // ── Message streaming ───────────────────────────────────────────────

    record MessageCreated(String sessionId, String messageId, String role)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "message.created";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record MessageTextDelta(String sessionId, String messageId, String partId, String delta)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "message.text.delta";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record MessageReasoningDelta(String sessionId, String messageId, String partId, String delta)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "message.reasoning.delta";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record MessageToolCall(String sessionId, String messageId, String partId,
            String toolName, String toolCallId, Object args)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "message.tool.call";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record MessageToolResult(String sessionId, String messageId, String partId,
            String toolCallId, Object result)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "message.tool.result";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record MessageComplete(String sessionId, String messageId, String finishReason)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "message.complete";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record MessageError(String sessionId, String messageId, String errorType, String errorMessage)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "message.error";

        @Override
        public String type() {
            return TYPE;
        }
    }

    // ── Tool approval ───────────────────────────────────────────────────

    record ToolApprovalRequired(String sessionId, String messageId, String toolCallId,
            String toolName, String description, long expiresAt)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "tool.approval.required";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record ToolApprovalResolved(String sessionId, String toolCallId, String status,
            boolean approved, String reason)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "tool.approval.resolved";

        @Override
        public String type() {
            return TYPE;
        }
    }

    // ── Files ───────────────────────────────────────────────────────────

    record FileUpdated(String fileId, String path, String sessionId, String messageId)
            implements BoticalEvent, SessionScoped {
        public static final String TYPE = "file.updated";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record FileDeleted(String fileId, String path) implements BoticalEvent {
        public static final String TYPE = "file.deleted";

        @Override
        public String type() {
            return TYPE;
        }
    }

    // ── Processes ───────────────────────────────────────────────────────

    record ProcessSpawned(String id, String projectId, String kind, String command,
            String cwd, String status) implements BoticalEvent {
        public static final String TYPE = "process.spawned";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record ProcessOutput(String id, String data, String stream) implements BoticalEvent {
        public static final String TYPE = "process.output";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record ProcessExited(String id, String projectId, int exitCode, String status)
            implements BoticalEvent {
        public static final String TYPE = "process.exited";

        @Override
        public String type() {
            return TYPE;
        }
    }

    record ProcessKilled(String id, String projectId) implements BoticalEvent {
        public static final String TYPE = "process.killed";

        @Override
        public String type() {
            return TYPE;
        }
    }
}
