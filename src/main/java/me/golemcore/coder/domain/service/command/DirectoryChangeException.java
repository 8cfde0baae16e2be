package me.golemcore.coder.domain.service.command;

public class DirectoryChangeException extends CommandExecutionException {

    private static final long serialVersionUID = 1L;

    public DirectoryChangeException(String message) {
        super(message);
    }
}
