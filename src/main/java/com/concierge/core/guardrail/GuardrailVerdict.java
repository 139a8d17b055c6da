package com.concierge.core.guardrail;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Outcome of a guardrail check.
 *
 * @param allowed whether the text may pass
 * @param message text to show the user instead, when not allowed
 */
public record GuardrailVerdict(
    @JsonPropertyDescription("Whether the message is allowed.")
    boolean allowed,

    @JsonPropertyDescription("The message to show the user if the message is not allowed.")
    String message
) {

    public static GuardrailVerdict allow() {
        return new GuardrailVerdict(true, "");
    }

    public static GuardrailVerdict reject(String message) {
        return new GuardrailVerdict(false, message);
    }
}
