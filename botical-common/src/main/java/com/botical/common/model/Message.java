package com.botical.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One turn in a session. Content lives in its {@link MessagePart}s.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String id;
    private String sessionId;
    private String role; // "user" | "assistant" | "system"
    private String parentId;
    private String finishReason;
    private String errorType;
    private String errorMessage;
    private long createdAt;
    private Long completedAt;
}
