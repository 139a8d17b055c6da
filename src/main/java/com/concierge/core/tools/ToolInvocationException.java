package com.concierge.core.tools;

/**
 * Thrown when a tool call cannot be dispatched: unknown tool name or malformed arguments.
 */
public class ToolInvocationException extends RuntimeException {

    public ToolInvocationException(String message) {
        super(message);
    }

    public ToolInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
