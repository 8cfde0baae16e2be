package me.golemcore.coder.domain.service.command;

/**
 * Command text could not be split into arguments, or was empty.
 */
public class CommandSyntaxException extends CommandExecutionException {

    private static final long serialVersionUID = 1L;

    public CommandSyntaxException(String message) {
        super(message);
    }
}
