package com.botical.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A streamed fragment of a message: text, reasoning or a tool invocation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessagePart {

    public static final String TOOL_PENDING = "pending";
    public static final String TOOL_RUNNING = "running";
    public static final String TOOL_COMPLETED = "completed";
    public static final String TOOL_ERROR = "error";

    private String id;
    private String messageId;
    private String sessionId;
    private String type; // "text" | "reasoning" | "tool"
    private Object content;
    private String toolName;
    private String toolCallId;
    private String toolStatus;
    private long createdAt;
}
