package com.botical.gateway.methods;

import com.botical.common.errors.ValidationException;
import com.botical.gateway.approval.DecisionScope;
import com.botical.gateway.approval.ToolApprovalCoordinator;
import com.botical.gateway.websocket.ConnectionDescriptor;
import com.botical.gateway.websocket.RequestRouter;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.botical.gateway.methods.RequestParams.requiredText;
import static com.botical.gateway.methods.RequestParams.textParam;

/**
 * Registers {@code tool.approve} and {@code tool.reject}, the user side of
 * the approval round trip.
 */
@Slf4j
@Component
public class ToolApprovalMethodRegistrar {

    private final RequestRouter router;
    private final ToolApprovalCoordinator coordinator;

    public ToolApprovalMethodRegistrar(RequestRouter router, ToolApprovalCoordinator coordinator) {
        this.router = router;
        this.coordinator = coordinator;
    }

    @PostConstruct
    public void registerMethods() {
        router.register("tool.approve", this::handleApprove);
        router.register("tool.reject", this::handleReject);
    }

    CompletableFuture<Object> handleApprove(JsonNode payload, ConnectionDescriptor conn) {
        String sessionId = requiredText(payload, "sessionId");
        String toolCallId = requiredText(payload, "toolCallId");
        DecisionScope scope = parseScope(textParam(payload, "scope", null));
        coordinator.approve(conn.getProjectId(), sessionId, toolCallId, scope);
        return CompletableFuture.completedFuture(Map.of("approved", true));
    }

    CompletableFuture<Object> handleReject(JsonNode payload, ConnectionDescriptor conn) {
        String sessionId = requiredText(payload, "sessionId");
        String toolCallId = requiredText(payload, "toolCallId");
        String reason = textParam(payload, "reason", null);
        DecisionScope scope = parseScope(textParam(payload, "scope", null));
        coordinator.reject(conn.getProjectId(), sessionId, toolCallId, reason, scope);
        return CompletableFuture.completedFuture(Map.of("rejected", true));
    }

    private static DecisionScope parseScope(String raw) {
        try {
            return DecisionScope.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid scope: " + raw);
        }
    }
}
