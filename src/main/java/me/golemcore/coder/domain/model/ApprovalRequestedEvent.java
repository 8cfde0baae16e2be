package me.golemcore.coder.domain.model;

/**
 * Published when a tool call waits for a human verdict.
 */
public record ApprovalRequestedEvent(PendingApproval approval) {
}
