package com.botical.gateway.websocket;

import com.botical.common.bus.BoticalEvent;
import com.botical.common.bus.BoticalEvent.FileDeleted;
import com.botical.common.bus.BoticalEvent.FileUpdated;
import com.botical.common.bus.BoticalEvent.MessageComplete;
import com.botical.common.bus.BoticalEvent.MessageCreated;
import com.botical.common.bus.BoticalEvent.MessageError;
import com.botical.common.bus.BoticalEvent.MessageReasoningDelta;
import com.botical.common.bus.BoticalEvent.MessageTextDelta;
import com.botical.common.bus.BoticalEvent.MessageToolCall;
import com.botical.common.bus.BoticalEvent.MessageToolResult;
import com.botical.common.bus.BoticalEvent.ProcessExited;
import com.botical.common.bus.BoticalEvent.ProcessKilled;
import com.botical.common.bus.BoticalEvent.ProcessOutput;
import com.botical.common.bus.BoticalEvent.ProcessSpawned;
import com.botical.common.bus.BoticalEvent.SessionCreated;
import com.botical.common.bus.BoticalEvent.SessionDeleted;
import com.botical.common.bus.BoticalEvent.SessionUpdated;
import com.botical.common.bus.BoticalEvent.ToolApprovalRequired;
import com.botical.common.bus.BoticalEvent.ToolApprovalResolved;
import com.botical.common.bus.EventBus;
import com.botical.common.bus.EventEnvelope;
import com.botical.common.bus.EventPattern;
import com.botical.common.bus.Subscription;
import com.botical.gateway.protocol.ProtocolTypes.EventFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fans project-scoped bus events out to the WebSocket connections subscribed
 * to the rooms each event targets.
 *
 * <p>
 * Every event goes to {@code project:<scope>}; events that name a session also
 * go to {@code session:<sessionId>}. A connection that is in both rooms gets
 * one frame. The frame is serialized once per event. Closed connections are
 * skipped without a write attempt, and one failed write never stops the rest
 * of the pass.
 */
@Slf4j
public class SyncBridge {

    /** Outcome of one fan-out pass. */
    public record FanOutResult(int recipients, int delivered, int skippedClosed, int failed) {
        static final FanOutResult EMPTY = new FanOutResult(0, 0, 0, 0);
    }

    private final EventBus eventBus;
    private final RoomIndex roomIndex;
    private final ConnectionRegistry connections;
    private final ObjectMapper objectMapper;
    private final Map<Class<? extends BoticalEvent>, EventRoute> routes;

    private Subscription subscription;

    public SyncBridge(EventBus eventBus, RoomIndex roomIndex, ConnectionRegistry connections,
            ObjectMapper objectMapper) {
        this(eventBus, roomIndex, connections, objectMapper, defaultRoutes());
    }

    SyncBridge(EventBus eventBus, RoomIndex roomIndex, ConnectionRegistry connections,
            ObjectMapper objectMapper, Map<Class<? extends BoticalEvent>, EventRoute> routes) {
        validateRoutes(routes);
        this.eventBus = eventBus;
        this.roomIndex = roomIndex;
        this.connections = connections;
        this.objectMapper = objectMapper;
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
    }

    /**
     * Routing for every event kind on the bus.
     */
    static Map<Class<? extends BoticalEvent>, EventRoute> defaultRoutes() {
        Map<Class<? extends BoticalEvent>, EventRoute> routes = new LinkedHashMap<>();
        routes.put(SessionCreated.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(SessionUpdated.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(SessionDeleted.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(MessageCreated.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(MessageTextDelta.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(MessageReasoningDelta.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(MessageToolCall.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(MessageToolResult.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(MessageComplete.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(MessageError.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(ToolApprovalRequired.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(ToolApprovalResolved.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(FileUpdated.class, EventRoute.SESSION_AND_PROJECT);
        routes.put(FileDeleted.class, EventRoute.PROJECT_ONLY);
        routes.put(ProcessSpawned.class, EventRoute.PROJECT_ONLY);
        routes.put(ProcessOutput.class, EventRoute.PROJECT_ONLY);
        routes.put(ProcessExited.class, EventRoute.PROJECT_ONLY);
        routes.put(ProcessKilled.class, EventRoute.PROJECT_ONLY);
        return routes;
    }

    /**
     * Fail fast when a kind of the sealed event union has no route.
     */
    static void validateRoutes(Map<Class<? extends BoticalEvent>, EventRoute> routes) {
        List<String> missing = new ArrayList<>();
        for (Class<?> kind : BoticalEvent.class.getPermittedSubclasses()) {
            if (!routes.containsKey(kind)) {
                missing.add(kind.getSimpleName());
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No fan-out route for event kinds: " + missing);
        }
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Start forwarding bus events. Calling it again while active does nothing.
     */
    public synchronized void setup() {
        if (subscription != null) {
            return;
        }
        subscription = eventBus.subscribe(EventPattern.ALL, this::onEvent);
        log.info("Event bus bridge initialized ({} routes)", routes.size());
    }

    /**
     * Stop forwarding. Safe to call twice or before {@link #setup()}.
     */
    public synchronized void teardown() {
        if (subscription == null) {
            return;
        }
        subscription.unsubscribe();
        subscription = null;
        log.info("Event bus bridge torn down");
    }

    public synchronized boolean isActive() {
        return subscription != null;
    }

    public synchronized int getSubscriptionCount() {
        return subscription != null ? 1 : 0;
    }

    // ── Fan-out ─────────────────────────────────────────────────────────

    private void onEvent(EventEnvelope envelope) {
        if (envelope.isGlobal()) {
            return;
        }
        FanOutResult result = deliver(envelope);
        if (result.recipients() > 0) {
            log.debug("bridge:fan-out event={} project={} recipients={} delivered={} closed={} failed={}",
                    envelope.event().type(), envelope.projectId(), result.recipients(),
                    result.delivered(), result.skippedClosed(), result.failed());
        }
    }

    /**
     * Deliver one scoped envelope to every open member of its target rooms.
     */
    FanOutResult deliver(EventEnvelope envelope) {
        String scope = envelope.projectId();
        BoticalEvent event = envelope.event();
        Set<String> recipients = new LinkedHashSet<>();
        for (String room : targetRooms(scope, event)) {
            recipients.addAll(roomIndex.getMembers(room));
        }
        if (recipients.isEmpty()) {
            return FanOutResult.EMPTY;
        }

        String frame;
        try {
            frame = objectMapper.writeValueAsString(EventFrame.of(event.type(), event));
        } catch (JsonProcessingException e) {
            log.error("bridge:serialize-failed event={}: {}", event.type(), e.getMessage(), e);
            return new FanOutResult(recipients.size(), 0, 0, recipients.size());
        }

        int delivered = 0;
        int skippedClosed = 0;
        int failed = 0;
        for (String connectionId : recipients) {
            Optional<ConnectionDescriptor> found = connections.get(connectionId);
            if (found.isEmpty()) {
                // membership outlived its connection
                roomIndex.leaveAll(connectionId);
                continue;
            }
            ConnectionDescriptor descriptor = found.get();
            if (!scope.equals(descriptor.getProjectId())) {
                continue;
            }
            if (!descriptor.isOpen()) {
                skippedClosed++;
                continue;
            }
            try {
                descriptor.getChannel().send(frame);
                delivered++;
            } catch (Exception e) {
                failed++;
                log.warn("bridge:send-failed conn={} event={}: {}", connectionId, event.type(), e.getMessage());
            }
        }
        return new FanOutResult(recipients.size(), delivered, skippedClosed, failed);
    }

    List<String> targetRooms(String scope, BoticalEvent event) {
        List<String> rooms = new ArrayList<>(2);
        if (routes.get(event.getClass()) == EventRoute.SESSION_AND_PROJECT
                && event instanceof BoticalEvent.SessionScoped scoped
                && scoped.sessionId() != null && !scoped.sessionId().isBlank()) {
            rooms.add(Rooms.session(scoped.sessionId()));
        }
        rooms.add(Rooms.project(scope));
        return rooms;
    }
}
