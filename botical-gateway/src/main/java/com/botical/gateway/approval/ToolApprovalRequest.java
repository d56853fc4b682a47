package com.botical.gateway.approval;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * A tool call that needs a human decision before it runs.
 */
@Getter
@Builder
public class ToolApprovalRequest {
    private final String sessionId;
    private final String messageId;
    private final String toolCallId;
    private final String toolName;
    private final String description;
    /** Null for the table default. */
    private final Duration timeout;
}
