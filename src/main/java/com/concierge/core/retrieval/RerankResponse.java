package com.concierge.core.retrieval;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Structured output of the rerank call.
 */
public record RerankResponse(
    @JsonPropertyDescription("The entries to keep, most relevant first")
    List<RerankResult> results
) {

    public RerankResponse {
        results = results != null ? List.copyOf(results) : List.of();
    }
}
