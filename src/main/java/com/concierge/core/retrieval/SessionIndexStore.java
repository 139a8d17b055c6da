package com.concierge.core.retrieval;

import java.util.List;
import java.util.Optional;

/**
 * Per-session vector collection and schedule overview storage.
 */
public interface SessionIndexStore {

    /** Drops any existing collection for the session and stores {@code entries} in its place. */
    void replaceCollection(String sessionId, List<VectorEntry> entries);

    boolean hasCollection(String sessionId);

    /**
     * Returns up to {@code k} entries closest to {@code query} by cosine distance,
     * nearest first. Empty when the session has no collection.
     */
    List<VectorMatch> nearest(String sessionId, float[] query, int k);

    void saveOverview(String sessionId, String overview);

    Optional<String> findOverview(String sessionId);
}
