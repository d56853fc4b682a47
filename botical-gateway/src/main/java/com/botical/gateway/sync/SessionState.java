package com.botical.gateway.sync;

import com.botical.common.model.MessageWithParts;
import com.botical.common.model.Session;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Ordered session snapshot sent to a client that needs to catch up.
 *
 * @param cursor the last-known message id the snapshot was computed from, or null
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record SessionState(
        Session session,
        List<MessageWithParts> messages,
        String cursor) {

    public SessionState {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }
}
