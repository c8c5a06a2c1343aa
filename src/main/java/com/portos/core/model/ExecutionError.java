package com.portos.core.model;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;

/**
 * Failure recorded on an execution when it enters the error state.
 */
public record ExecutionError(String message, String code, String stack, Instant timestamp) {

    public static final String UNKNOWN_MESSAGE = "Unknown error";

    public static ExecutionError from(Throwable error, String code, Instant timestamp) {
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        return new ExecutionError(message, code, trace.toString(), timestamp);
    }

    public static ExecutionError of(String message, String code, Instant timestamp) {
        return new ExecutionError(message != null ? message : UNKNOWN_MESSAGE, code, null, timestamp);
    }
}
