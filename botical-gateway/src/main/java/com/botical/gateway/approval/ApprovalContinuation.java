package com.botical.gateway.approval;

/**
 * Callback that releases a suspended tool call. Invoked at most once.
 */
@FunctionalInterface
public interface ApprovalContinuation {

    void release(ApprovalDecision decision);
}
