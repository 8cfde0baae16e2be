package me.golemcore.coder.port.outbound;

/**
 * Coarse classification of model backend failures.
 */
public enum ModelErrorKind {
    AUTH, RATE_LIMIT, CONTEXT_TOO_LONG, CONNECTION, GENERIC
}
