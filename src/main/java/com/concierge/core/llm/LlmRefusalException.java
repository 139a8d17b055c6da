package com.concierge.core.llm;

/**
 * Thrown when the model declines to answer a structured request.
 */
public class LlmRefusalException extends RuntimeException {

    private final String refusal;

    public LlmRefusalException(String outputType, String refusal) {
        super("LLM refused to produce " + outputType + ": " + refusal);
        this.refusal = refusal;
    }

    public String getRefusal() {
        return refusal;
    }
}
