package me.golemcore.coder.domain.mode;

/**
 * Result of the read-only mode check for one tool call.
 */
public record BlockDecision(boolean blocked, String reason) {

    private static final BlockDecision ALLOWED = new BlockDecision(false, null);

    public static BlockDecision allowed() {
        return ALLOWED;
    }

    public static BlockDecision blocked(String reason) {
        return new BlockDecision(true, reason);
    }
}
