package com.portos.core.recovery;

/**
 * Thrown by tool functions that want to attach a machine-readable code (HTTP status,
 * errno name, CLI exit code) to a failure so it can be classified.
 */
public class ToolInvocationException extends Exception {

    private final String code;

    public ToolInvocationException(String message, String code) {
        super(message);
        this.code = code;
    }

    public ToolInvocationException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
