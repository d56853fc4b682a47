package com.botical.common.store;

import com.botical.common.model.Message;
import com.botical.common.model.MessagePart;
import com.botical.common.model.Session;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-project storage of sessions, messages and message parts.
 *
 * <p>
 * Every {@code list*} call returns rows ordered by creation time, ties broken
 * by insertion order, so two reads of the same data always agree.
 */
public interface WorkspaceStore {

    Optional<Session> getSession(String projectId, String sessionId);

    /**
     * @param status filter, or {@code null} for every status
     */
    List<Session> listSessions(String projectId, String status);

    List<Message> listMessages(String projectId, String sessionId);

    List<MessagePart> listParts(String projectId, String messageId);

    Optional<MessagePart> findToolPart(String projectId, String sessionId, String toolCallId);

    boolean updateToolStatus(String projectId, String partId, String toolStatus);

    Session createSession(String projectId, Session session);

    Message createMessage(String projectId, Message message);

    MessagePart createPart(String projectId, MessagePart part);
}
