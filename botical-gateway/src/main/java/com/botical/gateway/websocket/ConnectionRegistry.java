package com.botical.gateway.websocket;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks every live connection by id.
 *
 * <p>
 * Removing a connection also removes it from every room in the
 * {@link RoomIndex}, so nothing is ever fanned out to a dropped connection.
 * The registry holds references only; the single place it touches the network
 * is {@link #send}.
 */
@Slf4j
public class ConnectionRegistry {

    private final Map<String, ConnectionDescriptor> connections = new ConcurrentHashMap<>();
    private final RoomIndex roomIndex;

    public ConnectionRegistry(RoomIndex roomIndex) {
        this.roomIndex = roomIndex;
    }

    /**
     * Register a connection, replacing any previous entry with the same id.
     */
    public void add(String connectionId, ConnectionDescriptor descriptor) {
        ConnectionDescriptor previous = connections.put(connectionId, descriptor);
        if (previous != null) {
            log.debug("conn:replace conn={}", connectionId);
        }
    }

    public Optional<ConnectionDescriptor> get(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public boolean has(String connectionId) {
        return connections.containsKey(connectionId);
    }

    /**
     * Drop a connection and all of its room memberships.
     *
     * @return true if the connection was registered
     */
    public boolean remove(String connectionId) {
        ConnectionDescriptor removed = connections.remove(connectionId);
        int rooms = roomIndex.leaveAll(connectionId);
        if (removed != null) {
            log.debug("conn:remove conn={} rooms={}", connectionId, rooms);
        }
        return removed != null;
    }

    public boolean isOpen(String connectionId) {
        ConnectionDescriptor descriptor = connections.get(connectionId);
        return descriptor != null && descriptor.isOpen();
    }

    /**
     * Write a text frame to one connection.
     *
     * @return false if the connection is unknown, closed, or the write failed
     */
    public boolean send(String connectionId, String textFrame) {
        ConnectionDescriptor descriptor = connections.get(connectionId);
        if (descriptor == null || !descriptor.isOpen()) {
            return false;
        }
        try {
            descriptor.getChannel().send(textFrame);
            return true;
        } catch (Exception e) {
            log.warn("conn:send-failed conn={}: {}", connectionId, e.getMessage());
            return false;
        }
    }

    /**
     * Record client activity on a connection.
     */
    public void touch(String connectionId) {
        ConnectionDescriptor descriptor = connections.get(connectionId);
        if (descriptor != null) {
            descriptor.touch();
        }
    }

    public List<ConnectionDescriptor> getByProject(String projectId) {
        List<ConnectionDescriptor> result = new ArrayList<>();
        for (ConnectionDescriptor descriptor : connections.values()) {
            if (descriptor.getProjectId().equals(projectId)) {
                result.add(descriptor);
            }
        }
        return result;
    }

    public List<ConnectionDescriptor> getByUser(String userId) {
        List<ConnectionDescriptor> result = new ArrayList<>();
        for (ConnectionDescriptor descriptor : connections.values()) {
            if (descriptor.getUserId().equals(userId)) {
                result.add(descriptor);
            }
        }
        return result;
    }

    public int getCount() {
        return connections.size();
    }

    public int getProjectCount(String projectId) {
        return getByProject(projectId).size();
    }

    public List<String> getAllIds() {
        return List.copyOf(connections.keySet());
    }

    /**
     * Forget every connection and room membership.
     */
    public void clear() {
        connections.clear();
        roomIndex.clear();
    }
}
