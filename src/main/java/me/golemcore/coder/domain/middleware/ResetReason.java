package me.golemcore.coder.domain.middleware;

/**
 * Why the pipeline is being reset. Clearing the conversation resets every
 * middleware fully; compaction lets each middleware keep the counters it wants
 * to carry over.
 */
public enum ResetReason {
    CLEAR, COMPACT
}
