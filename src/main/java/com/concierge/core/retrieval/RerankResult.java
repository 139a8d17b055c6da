package com.concierge.core.retrieval;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * One reranked candidate.
 *
 * @param index  position of the candidate in the list shown to the reranker
 * @param score  relevance from 0 to 10
 * @param reason short phrase explaining the relevance
 */
public record RerankResult(
    @JsonPropertyDescription("The original index of the entry")
    int index,

    @JsonPropertyDescription("Number from 0 to 10 (relevance)")
    int score,

    @JsonPropertyDescription("One short phrase why it's relevant")
    String reason
) {
}
