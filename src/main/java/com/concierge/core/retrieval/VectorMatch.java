package com.concierge.core.retrieval;

/**
 * A nearest-neighbour hit.
 *
 * @param document the stored document
 * @param distance cosine distance to the query (0 = identical direction)
 */
public record VectorMatch(
    TalkDocument document,
    double distance
) {
}
