package com.botical.gateway.approval;

/**
 * Snapshot of an approval entry.
 *
 * @param resolvedAt epoch millis of the terminal transition, null while pending
 */
public record ApprovalRecord(
        String callId,
        String sessionId,
        ApprovalStatus status,
        long createdAt,
        long expiresAt,
        Long resolvedAt,
        String reason) {

    ApprovalRecord withResolution(ApprovalStatus status, String reason) {
        return new ApprovalRecord(callId, sessionId, status, createdAt, expiresAt,
                System.currentTimeMillis(), reason);
    }
}
