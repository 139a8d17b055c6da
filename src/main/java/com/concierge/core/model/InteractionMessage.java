package com.concierge.core.model;

import java.io.Serializable;

/**
 * One entry of the user-facing conversation history.
 *
 * @param role    "user" or "assistant"
 * @param content message text
 */
public record InteractionMessage(
    String role,
    String content
) implements Serializable {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public InteractionMessage {
        content = content != null ? content : "";
    }

    public static InteractionMessage user(String content) {
        return new InteractionMessage(USER, content);
    }

    public static InteractionMessage assistant(String content) {
        return new InteractionMessage(ASSISTANT, content);
    }

    public boolean isAssistant() {
        return ASSISTANT.equals(role);
    }
}
