package com.botical.gateway.methods;

import com.botical.common.errors.ForbiddenException;
import com.botical.gateway.sync.StateCatchUpService;
import com.botical.gateway.websocket.ConnectionDescriptor;
import com.botical.gateway.websocket.RequestRouter;
import com.botical.gateway.websocket.RoomIndex;
import com.botical.gateway.websocket.Rooms;
import com.botical.gateway.websocket.Rooms.RoomName;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.botical.gateway.methods.RequestParams.boolParam;
import static com.botical.gateway.methods.RequestParams.fail;
import static com.botical.gateway.methods.RequestParams.textParam;

/**
 * Registers {@code ping}, {@code subscribe} and {@code unsubscribe}.
 */
@Slf4j
@Component
public class SubscriptionMethodRegistrar {

    private final RequestRouter router;
    private final RoomIndex roomIndex;
    private final StateCatchUpService catchUp;

    public SubscriptionMethodRegistrar(RequestRouter router, RoomIndex roomIndex, StateCatchUpService catchUp) {
        this.router = router;
        this.roomIndex = roomIndex;
        this.catchUp = catchUp;
    }

    @PostConstruct
    public void registerMethods() {
        router.register("ping", (payload, conn) -> CompletableFuture.completedFuture(
                Map.of("pong", System.currentTimeMillis())));
        router.register("subscribe", this::handleSubscribe);
        router.register("unsubscribe", this::handleUnsubscribe);
    }

    /**
     * Join a room. Subscribing to a session with {@code sync:true} or a
     * {@code lastMessageId} also pushes a {@code session.sync} snapshot, so a
     * reconnecting client recovers what it missed before the join.
     */
    CompletableFuture<Object> handleSubscribe(JsonNode payload, ConnectionDescriptor conn) {
        String channel = textParam(payload, "channel", "");
        if (channel.isEmpty()) {
            return fail("channel required");
        }
        RoomName room = Rooms.parse(channel);
        if (room.kind() == Rooms.Kind.PROJECT && !room.id().equals(conn.getProjectId())) {
            throw new ForbiddenException("Cannot subscribe to another project");
        }

        String connId = conn.getConnectionId();
        roomIndex.join(room.name(), connId);
        log.debug("ws:subscribe conn={} room={}", connId, room.name());

        if (room.kind() == Rooms.Kind.SESSION) {
            String lastMessageId = textParam(payload, "lastMessageId", null);
            if (boolParam(payload, "sync") || (lastMessageId != null && !lastMessageId.isEmpty())) {
                catchUp.syncClient(connId, conn.getProjectId(), room.id(), lastMessageId);
            }
        }
        return CompletableFuture.completedFuture(Map.of("subscribed", channel));
    }

    CompletableFuture<Object> handleUnsubscribe(JsonNode payload, ConnectionDescriptor conn) {
        String channel = textParam(payload, "channel", "");
        if (channel.isEmpty()) {
            return fail("channel required");
        }
        RoomName room = Rooms.parse(channel);
        roomIndex.leave(room.name(), conn.getConnectionId());
        return CompletableFuture.completedFuture(Map.of("unsubscribed", channel));
    }
}
