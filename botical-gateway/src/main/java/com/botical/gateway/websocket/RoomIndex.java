package com.botical.gateway.websocket;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Many-to-many membership between room names and connection ids.
 *
 * <p>
 * Both directions are kept in step under one monitor, so a reader never sees a
 * connection listed in a room that the connection itself does not list. A room
 * exists only while it has members; the last {@link #leave} removes it.
 * Readers get snapshots, never live views.
 */
@Slf4j
public class RoomIndex {

    private final Map<String, Set<String>> membersByRoom = new HashMap<>();
    private final Map<String, Set<String>> roomsByConnection = new HashMap<>();

    /**
     * Add a connection to a room. Joining twice has no further effect.
     *
     * @return true if membership changed
     */
    public synchronized boolean join(String room, String connectionId) {
        boolean added = membersByRoom.computeIfAbsent(room, k -> new LinkedHashSet<>()).add(connectionId);
        roomsByConnection.computeIfAbsent(connectionId, k -> new LinkedHashSet<>()).add(room);
        if (added) {
            log.debug("room:join room={} conn={}", room, connectionId);
        }
        return added;
    }

    /**
     * Remove a connection from a room.
     *
     * @return true if the connection was a member
     */
    public synchronized boolean leave(String room, String connectionId) {
        boolean removed = removeMember(room, connectionId);
        Set<String> rooms = roomsByConnection.get(connectionId);
        if (rooms != null) {
            rooms.remove(room);
            if (rooms.isEmpty()) {
                roomsByConnection.remove(connectionId);
            }
        }
        return removed;
    }

    /**
     * Remove a connection from every room it joined.
     *
     * @return number of rooms left
     */
    public synchronized int leaveAll(String connectionId) {
        Set<String> rooms = roomsByConnection.remove(connectionId);
        if (rooms == null) {
            return 0;
        }
        int count = 0;
        for (String room : rooms) {
            if (removeMember(room, connectionId)) {
                count++;
            }
        }
        log.debug("room:leave-all conn={} rooms={}", connectionId, count);
        return count;
    }

    private boolean removeMember(String room, String connectionId) {
        Set<String> members = membersByRoom.get(room);
        if (members == null) {
            return false;
        }
        boolean removed = members.remove(connectionId);
        if (members.isEmpty()) {
            membersByRoom.remove(room);
        }
        return removed;
    }

    public synchronized boolean isMember(String room, String connectionId) {
        Set<String> members = membersByRoom.get(room);
        return members != null && members.contains(connectionId);
    }

    public synchronized List<String> getMembers(String room) {
        Set<String> members = membersByRoom.get(room);
        return members != null ? List.copyOf(members) : List.of();
    }

    public synchronized List<String> getRooms(String connectionId) {
        Set<String> rooms = roomsByConnection.get(connectionId);
        return rooms != null ? List.copyOf(rooms) : List.of();
    }

    public synchronized int getMemberCount(String room) {
        Set<String> members = membersByRoom.get(room);
        return members != null ? members.size() : 0;
    }

    public synchronized boolean exists(String room) {
        Set<String> members = membersByRoom.get(room);
        return members != null && !members.isEmpty();
    }

    public synchronized List<String> getAllRooms() {
        return List.copyOf(membersByRoom.keySet());
    }

    public synchronized int getRoomCount() {
        return membersByRoom.size();
    }

    public synchronized void clear() {
        membersByRoom.clear();
        roomsByConnection.clear();
    }
}
