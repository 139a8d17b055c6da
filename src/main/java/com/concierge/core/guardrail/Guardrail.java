package com.concierge.core.guardrail;

/**
 * Topic and safety gate around a conversation turn.
 */
public interface Guardrail {

    /** Checks a user message before any agent sees it. */
    GuardrailVerdict checkInput(String userMessage);

    /** Checks assistant text before it is shown to the user. */
    GuardrailVerdict checkOutput(String assistantReply);
}
