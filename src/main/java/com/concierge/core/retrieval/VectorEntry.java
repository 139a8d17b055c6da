package com.concierge.core.retrieval;

/**
 * A document stored in a session collection together with its embedding.
 */
public record VectorEntry(
    TalkDocument document,
    float[] embedding
) {
}
