package me.golemcore.coder.domain.service.command;

/**
 * Raised after a timed-out process tree has been killed.
 */
public class CommandTimeoutException extends CommandExecutionException {

    private static final long serialVersionUID = 1L;

    private final long timeoutSeconds;

    public CommandTimeoutException(long timeoutSeconds, String command) {
        super("Command timed out after " + timeoutSeconds + "s: " + command);
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
