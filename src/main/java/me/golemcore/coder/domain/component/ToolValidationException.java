package me.golemcore.coder.domain.component;

/**
 * Tool arguments are missing or have the wrong type.
 */
public class ToolValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ToolValidationException(String message) {
        super(message);
    }
}
