package com.concierge.core.tools;

import com.concierge.core.llm.ToolSpec;

import java.util.Map;

/**
 * A tool the executor agent can call by name.
 * <p>
 * Handlers return a plain string that is fed back to the model as the tool result.
 * Failures may be signalled by throwing; the executor records them as recoverable
 * tool errors.
 */
public interface ConciergeTool {

    /** Argument key carrying the conversation id for session-scoped tools. */
    String SESSION_ID = "session_id";

    String name();

    String description();

    /** JSON schema of the arguments object the model must produce. */
    default String inputSchema() {
        return ToolSpec.EMPTY_SCHEMA;
    }

    /**
     * Session-scoped tools receive {@link #SESSION_ID} in their arguments,
     * injected by the executor rather than chosen by the model.
     */
    default boolean sessionScoped() {
        return false;
    }

    String call(Map<String, Object> arguments);

    default ToolSpec toSpec() {
        return new ToolSpec(name(), description(), inputSchema());
    }

    /** Schema for tools taking a single required {@code query} string. */
    static String querySchema(String description) {
        return """
                {"type":"object","properties":{"query":{"type":"string","description":"%s"}},\
                "required":["query"],"additionalProperties":false}""".formatted(description.replace("\"", "\\\""));
    }
}
