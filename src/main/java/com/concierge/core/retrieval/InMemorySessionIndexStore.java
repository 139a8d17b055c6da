package com.concierge.core.retrieval;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SessionIndexStore} held in memory; lost on restart.
 * <p>
 * Search is a linear cosine scan, which is fine at conference-schedule sizes.
 */
@Component
public class InMemorySessionIndexStore implements SessionIndexStore {

    private final Map<String, List<VectorEntry>> collections = new ConcurrentHashMap<>();
    private final Map<String, String> overviews = new ConcurrentHashMap<>();

    @Override
    public void replaceCollection(String sessionId, List<VectorEntry> entries) {
        collections.put(sessionId, List.copyOf(entries));
    }

    @Override
    public boolean hasCollection(String sessionId) {
        return collections.containsKey(sessionId);
    }

    @Override
    public List<VectorMatch> nearest(String sessionId, float[] query, int k) {
        List<VectorEntry> entries = collections.get(sessionId);
        if (entries == null || k <= 0) {
            return List.of();
        }
        return entries.stream()
                .map(e -> new VectorMatch(e.document(), cosineDistance(query, e.embedding())))
                .sorted(Comparator.comparingDouble(VectorMatch::distance))
                .limit(k)
                .toList();
    }

    @Override
    public void saveOverview(String sessionId, String overview) {
        overviews.put(sessionId, overview);
    }

    @Override
    public Optional<String> findOverview(String sessionId) {
        return Optional.ofNullable(overviews.get(sessionId));
    }

    static double cosineDistance(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 1.0;
        }
        return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
