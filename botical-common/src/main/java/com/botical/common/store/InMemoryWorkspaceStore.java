package com.botical.common.store;

import com.botical.common.model.Message;
import com.botical.common.model.MessagePart;
import com.botical.common.model.Session;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Heap-backed {@link WorkspaceStore}, partitioned by project.
 * Used for local single-user runs and tests.
 */
@Slf4j
public class InMemoryWorkspaceStore implements WorkspaceStore {

    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /** Row plus its insertion sequence, the tiebreaker for equal timestamps. */
    private record Row<T>(T value, long createdAt, long seq) {
    }

    private static final class Partition {
        final Map<String, Row<Session>> sessions = new ConcurrentHashMap<>();
        final Map<String, Row<Message>> messages = new ConcurrentHashMap<>();
        final Map<String, Row<MessagePart>> parts = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<Session> getSession(String projectId, String sessionId) {
        Partition p = partitions.get(projectId);
        if (p == null || sessionId == null) {
            return Optional.empty();
        }
        Row<Session> row = p.sessions.get(sessionId);
        return row != null ? Optional.of(row.value()) : Optional.empty();
    }

    @Override
    public List<Session> listSessions(String projectId, String status) {
        Partition p = partitions.get(projectId);
        if (p == null) {
            return List.of();
        }
        return ordered(p.sessions, s -> status == null || status.equals(s.getStatus()));
    }

    @Override
    public List<Message> listMessages(String projectId, String sessionId) {
        Partition p = partitions.get(projectId);
        if (p == null) {
            return List.of();
        }
        return ordered(p.messages, m -> sessionId.equals(m.getSessionId()));
    }

    @Override
    public List<MessagePart> listParts(String projectId, String messageId) {
        Partition p = partitions.get(projectId);
        if (p == null) {
            return List.of();
        }
        return ordered(p.parts, part -> messageId.equals(part.getMessageId()));
    }

    @Override
    public Optional<MessagePart> findToolPart(String projectId, String sessionId, String toolCallId) {
        Partition p = partitions.get(projectId);
        if (p == null || toolCallId == null) {
            return Optional.empty();
        }
        return p.parts.values().stream()
                .map(Row::value)
                .filter(part -> toolCallId.equals(part.getToolCallId())
                        && (sessionId == null || sessionId.equals(part.getSessionId())))
                .findFirst();
    }

    @Override
    public boolean updateToolStatus(String projectId, String partId, String toolStatus) {
        Partition p = partitions.get(projectId);
        if (p == null) {
            return false;
        }
        Row<MessagePart> row = p.parts.get(partId);
        if (row == null) {
            return false;
        }
        row.value().setToolStatus(toolStatus);
        return true;
    }

    @Override
    public Session createSession(String projectId, Session session) {
        long now = System.currentTimeMillis();
        if (session.getId() == null) {
            session.setId(newId("sess"));
        }
        session.setProjectId(projectId);
        if (session.getCreatedAt() == 0) {
            session.setCreatedAt(now);
        }
        if (session.getUpdatedAt() == 0) {
            session.setUpdatedAt(session.getCreatedAt());
        }
        partition(projectId).sessions.put(session.getId(), row(session, session.getCreatedAt()));
        log.debug("store:create session={} project={}", session.getId(), projectId);
        return session;
    }

    @Override
    public Message createMessage(String projectId, Message message) {
        if (message.getId() == null) {
            message.setId(newId("msg"));
        }
        if (message.getCreatedAt() == 0) {
            message.setCreatedAt(System.currentTimeMillis());
        }
        partition(projectId).messages.put(message.getId(), row(message, message.getCreatedAt()));
        return message;
    }

    @Override
    public MessagePart createPart(String projectId, MessagePart part) {
        if (part.getId() == null) {
            part.setId(newId("part"));
        }
        if (part.getCreatedAt() == 0) {
            part.setCreatedAt(System.currentTimeMillis());
        }
        partition(projectId).parts.put(part.getId(), row(part, part.getCreatedAt()));
        return part;
    }

    private Partition partition(String projectId) {
        return partitions.computeIfAbsent(projectId, k -> new Partition());
    }

    private <T> Row<T> row(T value, long createdAt) {
        return new Row<>(value, createdAt, sequence.incrementAndGet());
    }

    private static <T> List<T> ordered(Map<String, Row<T>> rows, Predicate<T> filter) {
        List<Row<T>> matching = new ArrayList<>();
        for (Row<T> row : rows.values()) {
            if (filter.test(row.value())) {
                matching.add(row);
            }
        }
        matching.sort(Comparator.<Row<T>>comparingLong(Row::createdAt).thenComparingLong(Row::seq));
        List<T> values = new ArrayList<>(matching.size());
        for (Row<T> row : matching) {
            values.add(row.value());
        }
        return values;
    }

    private static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
