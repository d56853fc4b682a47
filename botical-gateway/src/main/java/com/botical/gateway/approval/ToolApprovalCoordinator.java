package com.botical.gateway.approval;

import com.botical.common.bus.BoticalEvent;
import com.botical.common.bus.EventBus;
import com.botical.common.errors.ConflictException;
import com.botical.common.errors.NotFoundException;
import com.botical.common.errors.ValidationException;
import com.botical.common.model.MessagePart;
import com.botical.common.store.WorkspaceStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ties the approval table to the rest of the workspace: announces pending
 * approvals on the bus, applies user decisions to the stored tool part and
 * remembers session-scoped answers.
 */
@Slf4j
public class ToolApprovalCoordinator {

    private final ApprovalTable approvals;
    private final ApprovalDecisionCache decisions;
    private final EventBus eventBus;
    private final WorkspaceStore store;
    private final Map<String, PendingRequest> requests = new ConcurrentHashMap<>();

    /** A registered request and the project it was raised in. */
    private record PendingRequest(String projectId, ToolApprovalRequest request) {
    }

    public ToolApprovalCoordinator(ApprovalTable approvals, ApprovalDecisionCache decisions,
            EventBus eventBus, WorkspaceStore store) {
        this.approvals = approvals;
        this.decisions = decisions;
        this.eventBus = eventBus;
        this.store = store;
    }

    /**
     * Suspend a tool call until the user answers, the timeout fires or the
     * session ends. A remembered session-scoped answer completes immediately.
     */
    public CompletableFuture<ApprovalDecision> requestApproval(String projectId, ToolApprovalRequest request) {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("projectId required");
        }
        Optional<ApprovalDecision> remembered = decisions.lookup(request.getSessionId(), request.getToolName());
        if (remembered.isPresent()) {
            log.debug("approval:remembered session={} tool={} approved={}",
                    request.getSessionId(), request.getToolName(), remembered.get().approved());
            return CompletableFuture.completedFuture(remembered.get());
        }

        CompletableFuture<ApprovalDecision> future = new CompletableFuture<>();
        String callId = request.getToolCallId();
        if (callId == null || callId.isBlank()) {
            throw new ValidationException("callId required");
        }
        PendingRequest pending = new PendingRequest(projectId, request);
        if (requests.putIfAbsent(callId, pending) != null) {
            throw new ConflictException("Approval already pending for call " + callId);
        }
        ApprovalRecord record;
        try {
            record = approvals.register(callId, request.getSessionId(), decision -> {
                requests.remove(callId, pending);
                eventBus.publish(projectId, new BoticalEvent.ToolApprovalResolved(
                        request.getSessionId(), callId, decision.status().wireName(),
                        decision.approved(), decision.reason()));
                future.complete(decision);
            }, request.getTimeout());
        } catch (RuntimeException e) {
            requests.remove(callId, pending);
            throw e;
        }

        eventBus.publish(projectId, new BoticalEvent.ToolApprovalRequired(
                request.getSessionId(), request.getMessageId(), callId,
                request.getToolName(), request.getDescription(), record.expiresAt()));
        log.info("approval:required session={} call={} tool={}",
                request.getSessionId(), callId, request.getToolName());
        return future;
    }

    public ApprovalRecord approve(String projectId, String sessionId, String toolCallId, DecisionScope scope) {
        return decide(projectId, sessionId, toolCallId, true, null, scope);
    }

    public ApprovalRecord reject(String projectId, String sessionId, String toolCallId, String reason,
            DecisionScope scope) {
        return decide(projectId, sessionId, toolCallId, false, reason, scope);
    }

    private ApprovalRecord decide(String projectId, String sessionId, String toolCallId,
            boolean approved, String reason, DecisionScope scope) {
        ApprovalRecord pending = approvals.getPending(toolCallId)
                .filter(r -> r.sessionId().equals(sessionId))
                .orElseThrow(() -> new NotFoundException("No pending approval found for this tool call"));
        PendingRequest owner = requests.get(toolCallId);
        if (owner == null || !owner.projectId().equals(projectId)) {
            throw new NotFoundException("No pending approval found for this tool call");
        }
        ToolApprovalRequest request = owner.request();

        ApprovalRecord resolved = approvals.resolve(toolCallId, approved, reason)
                .orElseThrow(() -> new NotFoundException("No pending approval found for this tool call"));

        String toolStatus = approved ? MessagePart.TOOL_RUNNING : MessagePart.TOOL_ERROR;
        store.findToolPart(projectId, pending.sessionId(), toolCallId)
                .ifPresent(part -> store.updateToolStatus(projectId, part.getId(), toolStatus));

        if (scope == DecisionScope.SESSION) {
            decisions.remember(sessionId, request.getToolName(), approved
                    ? ApprovalDecision.approved(reason)
                    : ApprovalDecision.denied(ApprovalStatus.REJECTED, reason));
        }
        log.info("approval:decided session={} call={} approved={} scope={}",
                sessionId, toolCallId, approved, scope);
        return resolved;
    }

    /**
     * Release every waiter of a session as cancelled and forget its remembered answers.
     */
    public int endSession(String sessionId) {
        int released = approvals.cancelForSession(sessionId);
        decisions.invalidateSession(sessionId);
        return released;
    }

    public boolean hasPending(String sessionId) {
        return approvals.hasPending(sessionId);
    }
}
