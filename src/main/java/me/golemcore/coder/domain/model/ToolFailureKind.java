package me.golemcore.coder.domain.model;

/**
 * Typed classification for tool failures, so the loop can tell policy outcomes
 * from execution problems.
 */
public enum ToolFailureKind {

    /**
     * Mode policy, deny-list or configuration refused the call.
     */
    POLICY_DENIED,

    /**
     * User declined, or the approval expired or was cancelled.
     */
    CONFIRMATION_DENIED,

    /**
     * Arguments missing, malformed, or rejected by the tool.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, non-zero exit,
     * etc.).
     */
    EXECUTION_FAILED,

    /**
     * The turn was cancelled before the call was dispatched.
     */
    CANCELLED
}
