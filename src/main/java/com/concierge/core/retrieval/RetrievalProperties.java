package com.concierge.core.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retrieval settings bound from {@code concierge.retrieval.*}.
 */
@Component
@ConfigurationProperties(prefix = "concierge.retrieval")
public class RetrievalProperties {

    /** Nearest neighbours fetched before reranking. */
    private int retrieveK = 20;

    /** Results kept after reranking. */
    private int topK = 5;

    private int embeddingBatchSize = 100;

    /** Rerank scores at or below this value are dropped. */
    private int minRelevanceScore = 3;

    public int getRetrieveK() { return retrieveK; }
    public void setRetrieveK(int retrieveK) { this.retrieveK = retrieveK; }

    public int getTopK() { return topK; }
    public void setTopK(int topK) { this.topK = topK; }

    public int getEmbeddingBatchSize() { return embeddingBatchSize; }
    public void setEmbeddingBatchSize(int embeddingBatchSize) { this.embeddingBatchSize = embeddingBatchSize; }

    public int getMinRelevanceScore() { return minRelevanceScore; }
    public void setMinRelevanceScore(int minRelevanceScore) { this.minRelevanceScore = minRelevanceScore; }
}
