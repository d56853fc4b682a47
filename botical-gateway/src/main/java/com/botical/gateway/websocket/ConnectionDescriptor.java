package com.botical.gateway.websocket;

import lombok.Getter;

/**
 * Identity and transport handle of one live client connection.
 */
@Getter
public class ConnectionDescriptor {

    private final String connectionId;
    private final String userId;
    private final String projectId;
    private final long connectedAt;
    private final ConnectionChannel channel;

    private volatile long lastActivity;

    public ConnectionDescriptor(String connectionId, String userId, String projectId, ConnectionChannel channel) {
        this(connectionId, userId, projectId, System.currentTimeMillis(), channel);
    }

    public ConnectionDescriptor(String connectionId, String userId, String projectId, long connectedAt,
            ConnectionChannel channel) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.projectId = projectId;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
        this.channel = channel;
    }

    public boolean isOpen() {
        return channel != null && channel.isOpen();
    }

    void touch() {
        this.lastActivity = System.currentTimeMillis();
    }
}
