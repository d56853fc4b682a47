package com.botical.common.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;

/**
 * A message together with its ordered parts, as sent in a sync snapshot.
 */
public record MessageWithParts(
        @JsonUnwrapped Message message,
        List<MessagePart> parts) {

    public MessageWithParts {
        parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public String id() {
        return message.getId();
    }
}
