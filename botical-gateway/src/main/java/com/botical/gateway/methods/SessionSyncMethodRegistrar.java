package com.botical.gateway.methods;

import com.botical.gateway.sync.StateCatchUpService;
import com.botical.gateway.websocket.ConnectionDescriptor;
import com.botical.gateway.websocket.RequestRouter;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.botical.gateway.methods.RequestParams.intParam;
import static com.botical.gateway.methods.RequestParams.requiredText;
import static com.botical.gateway.methods.RequestParams.textParam;

/**
 * Registers the pull catch-up requests {@code session.sync} and {@code session.list}.
 */
@Component
public class SessionSyncMethodRegistrar {

    static final int DEFAULT_LIST_LIMIT = 50;

    private final RequestRouter router;
    private final StateCatchUpService catchUp;

    public SessionSyncMethodRegistrar(RequestRouter router, StateCatchUpService catchUp) {
        this.router = router;
        this.catchUp = catchUp;
    }

    @PostConstruct
    public void registerMethods() {
        router.register("session.sync", this::handleSessionSync);
        router.register("session.list", this::handleSessionList);
    }

    CompletableFuture<Object> handleSessionSync(JsonNode payload, ConnectionDescriptor conn) {
        String sessionId = requiredText(payload, "sessionId");
        String lastMessageId = textParam(payload, "lastMessageId", null);
        if (lastMessageId != null && lastMessageId.isEmpty()) {
            lastMessageId = null;
        }
        return CompletableFuture.completedFuture(
                catchUp.getSessionState(conn.getProjectId(), sessionId, lastMessageId));
    }

    CompletableFuture<Object> handleSessionList(JsonNode payload, ConnectionDescriptor conn) {
        String status = textParam(payload, "status", null);
        if (status != null && status.isEmpty()) {
            status = null;
        }
        int limit = intParam(payload, "limit", DEFAULT_LIST_LIMIT);
        return CompletableFuture.completedFuture(
                Map.of("sessions", catchUp.getSessionsSummary(conn.getProjectId(), status, limit)));
    }
}
