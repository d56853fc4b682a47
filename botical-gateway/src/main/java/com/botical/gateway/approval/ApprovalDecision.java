package com.botical.gateway.approval;

/**
 * What a waiting tool call is released with.
 */
public record ApprovalDecision(ApprovalStatus status, boolean approved, String reason) {

    public static ApprovalDecision approved(String reason) {
        return new ApprovalDecision(ApprovalStatus.APPROVED, true, reason);
    }

    public static ApprovalDecision denied(ApprovalStatus status, String reason) {
        if (!status.isTerminal() || status == ApprovalStatus.APPROVED) {
            throw new IllegalArgumentException("not a denial: " + status);
        }
        return new ApprovalDecision(status, false, reason);
    }
}
