package com.botical.gateway.sync;

import com.botical.common.errors.NotFoundException;
import com.botical.common.model.Message;
import com.botical.common.model.MessageWithParts;
import com.botical.common.model.Session;
import com.botical.common.store.WorkspaceStore;
import com.botical.gateway.protocol.ProtocolTypes.EventFrame;
import com.botical.gateway.protocol.ProtocolTypes.EventTypes;
import com.botical.gateway.websocket.ConnectionDescriptor;
import com.botical.gateway.websocket.ConnectionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the ordered state of a session for a client that loaded late or
 * lost its connection.
 *
 * <p>
 * With a cursor that names a known message, only the messages after it are
 * returned. A missing or unknown cursor yields the whole history: the client
 * gets more than it needs rather than a silent gap.
 */
@Slf4j
public class StateCatchUpService {

    private final WorkspaceStore store;
    private final ConnectionRegistry connections;
    private final ObjectMapper objectMapper;

    public StateCatchUpService(WorkspaceStore store, ConnectionRegistry connections, ObjectMapper objectMapper) {
        this.store = store;
        this.connections = connections;
        this.objectMapper = objectMapper;
    }

    /**
     * Pull variant.
     *
     * @param afterMessageId optional cursor; only messages strictly after it are returned when found
     * @throws NotFoundException if the session does not exist in the project
     */
    public SessionState getSessionState(String projectId, String sessionId, String afterMessageId) {
        Session session = store.getSession(projectId, sessionId)
                .orElseThrow(() -> new NotFoundException("Session", sessionId));

        List<Message> messages = store.listMessages(projectId, sessionId);
        if (afterMessageId != null && !afterMessageId.isEmpty()) {
            int afterIndex = indexOf(messages, afterMessageId);
            if (afterIndex >= 0) {
                messages = messages.subList(afterIndex + 1, messages.size());
            } else {
                log.debug("sync:cursor-unknown session={} cursor={}, sending full history", sessionId, afterMessageId);
            }
        }

        List<MessageWithParts> withParts = new ArrayList<>(messages.size());
        for (Message message : messages) {
            withParts.add(new MessageWithParts(message, store.listParts(projectId, message.getId())));
        }
        return new SessionState(session, withParts, afterMessageId);
    }

    /**
     * Push variant: write a {@code session.sync} event to one connection only.
     * A missing connection, closed connection or deleted session is not an
     * error here; nothing is written.
     *
     * @return true if the event was written
     */
    public boolean syncClient(String connectionId, String projectId, String sessionId, String lastKnownMessageId) {
        Optional<ConnectionDescriptor> descriptor = connections.get(connectionId);
        if (descriptor.isEmpty() || !descriptor.get().isOpen()) {
            return false;
        }

        SessionState state;
        try {
            state = getSessionState(projectId, sessionId, lastKnownMessageId);
        } catch (NotFoundException e) {
            log.debug("sync:skip conn={} session={}: {}", connectionId, sessionId, e.getMessage());
            return false;
        }

        String frame;
        try {
            frame = objectMapper.writeValueAsString(EventFrame.of(EventTypes.SESSION_SYNC, state));
        } catch (JsonProcessingException e) {
            log.error("sync:serialize-failed session={}: {}", sessionId, e.getMessage(), e);
            return false;
        }
        return connections.send(connectionId, frame);
    }

    /**
     * Active sessions of a project, oldest first.
     */
    public List<Session> getActiveSessions(String projectId) {
        return store.listSessions(projectId, Session.STATUS_ACTIVE);
    }

    /**
     * Session list without messages.
     *
     * @param status filter or null
     * @param limit  maximum rows, 0 or less for no limit
     */
    public List<Session> getSessionsSummary(String projectId, String status, int limit) {
        List<Session> sessions = store.listSessions(projectId, status);
        if (limit > 0 && sessions.size() > limit) {
            return List.copyOf(sessions.subList(0, limit));
        }
        return sessions;
    }

    private static int indexOf(List<Message> messages, String messageId) {
        for (int i = 0; i < messages.size(); i++) {
            if (messageId.equals(messages.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }
}
