package com.botical.gateway.websocket;

import com.botical.common.errors.ValidationException;

/**
 * Room naming: {@code session:<sessionId>} and {@code project:<projectId>}.
 */
public final class Rooms {

    public static final String SESSION_PREFIX = "session:";
    public static final String PROJECT_PREFIX = "project:";

    private Rooms() {
    }

    public enum Kind {
        SESSION,
        PROJECT
    }

    /** A parsed channel name. */
    public record RoomName(Kind kind, String id) {
        public String name() {
            return kind == Kind.SESSION ? session(id) : project(id);
        }
    }

    public static String session(String sessionId) {
        return SESSION_PREFIX + sessionId;
    }

    public static String project(String projectId) {
        return PROJECT_PREFIX + projectId;
    }

    /**
     * Parse a client-supplied channel.
     *
     * @throws ValidationException for anything but {@code session:<id>} or {@code project:<id>}
     */
    public static RoomName parse(String channel) {
        if (channel != null) {
            if (channel.startsWith(SESSION_PREFIX) && channel.length() > SESSION_PREFIX.length()) {
                return new RoomName(Kind.SESSION, channel.substring(SESSION_PREFIX.length()));
            }
            if (channel.startsWith(PROJECT_PREFIX) && channel.length() > PROJECT_PREFIX.length()) {
                return new RoomName(Kind.PROJECT, channel.substring(PROJECT_PREFIX.length()));
            }
        }
        throw new ValidationException("Invalid channel: " + channel
                + " (expected session:<id> or project:<id>)");
    }
}
