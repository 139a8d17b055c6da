package com.concierge.core.retrieval;

import com.concierge.core.llm.LlmService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Indexes uploaded conference schedules per session and answers semantic
 * queries over them: embed, nearest-neighbour search, then an LLM rerank.
 * <p>
 * All outcomes, including "nothing indexed yet", are returned as status strings
 * because the results go straight back to the model as tool output.
 * Reindexing and querying the same session concurrently must be serialized by the caller.
 */
@Service
public class RetrievalEngine {

    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

    static final String RERANK_PROMPT = """
            You are a re-ranker for conference schedule search results.
            Given a user query and a list of retrieved schedule entries (each with index, title, room, track, and excerpt), you must:
            1. Evaluate how relevant each entry is to the query (0-10).
            2. Drop entries that are clearly irrelevant (score 0-3).
            3. Return the remaining entries in order of relevance (most relevant first).

            Respond with a JSON object whose "results" array holds one object per entry to KEEP, in relevance order.
            Each object must have:
            - "index": the original index of the entry
            - "score": number from 1 to 10 (relevance)
            - "reason": one short phrase why it's relevant

            If nothing is relevant, return an empty "results" array.
            """;

    public static final String NOT_A_SCHEDULE = "Not a recognized schedule format (missing days).";
    public static final String NO_TALKS = "No talks found in schedule.";
    public static final String NOT_INDEXED = "No schedule has been indexed for this session. Upload a schedule file first.";
    public static final String NO_MATCHES = "No matching sessions found.";
    public static final String NO_RELEVANT = "No relevant sessions found after re-ranking.";
    public static final String NO_OVERVIEW = "No schedule overview for this session. Upload a schedule file first.";

    private static final int RERANK_EXCERPT = 600;
    private static final int RESULT_EXCERPT = 800;

    private final EmbeddingModel embeddingModel;
    private final LlmService llmService;
    private final SessionIndexStore store;
    private final RetrievalProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RetrievalEngine(EmbeddingModel embeddingModel, LlmService llmService,
                           SessionIndexStore store, RetrievalProperties properties) {
        this.embeddingModel = embeddingModel;
        this.llmService = llmService;
        this.store = store;
        this.properties = properties;
    }

    /**
     * Reads a schedule file and indexes it.
     *
     * @return status string, see {@link #index(String, String)}
     */
    public String indexFile(String sessionId, Path path) {
        if (!Files.exists(path)) {
            return "File not found: " + path;
        }
        try {
            return index(sessionId, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return "Invalid or unreadable JSON: " + e.getMessage();
        }
    }

    /**
     * Replaces the session's collection with the talks of {@code scheduleJson}
     * and stores the schedule overview.
     *
     * @return {@code Indexed N sessions for RAG and saved schedule overview.} on success,
     *         otherwise a status string describing why nothing was indexed
     */
    public String index(String sessionId, String scheduleJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(scheduleJson);
        } catch (JsonProcessingException e) {
            return "Invalid or unreadable JSON: " + e.getOriginalMessage();
        }
        if (root == null || !root.isObject() || ScheduleParser.days(root).isEmpty()) {
            return NOT_A_SCHEDULE;
        }

        List<TalkDocument> documents = ScheduleParser.documents(root);
        if (documents.isEmpty()) {
            return NO_TALKS;
        }

        store.saveOverview(sessionId, ScheduleParser.overview(root));

        List<float[]> embeddings = embed(documents.stream().map(TalkDocument::text).toList());
        List<VectorEntry> entries = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            entries.add(new VectorEntry(documents.get(i), embeddings.get(i)));
        }
        store.replaceCollection(sessionId, entries);

        log.info("Indexed {} sessions for session {}", documents.size(), sessionId);
        return "Indexed " + documents.size() + " sessions for RAG and saved schedule overview.";
    }

    public String query(String sessionId, String query) {
        return query(sessionId, query, properties.getTopK());
    }

    /**
     * Semantic search over the session's schedule, reranked by the LLM.
     *
     * @return up to {@code topK} formatted {@code --- Result i ---} blocks, or a status string
     */
    public String query(String sessionId, String query, int topK) {
        if (!store.hasCollection(sessionId)) {
            return NOT_INDEXED;
        }
        float[] queryEmbedding = embeddingModel.embed(query);
        List<VectorMatch> candidates = store.nearest(sessionId, queryEmbedding, properties.getRetrieveK());
        if (candidates.isEmpty()) {
            return NO_MATCHES;
        }

        List<VectorMatch> ranked = rerank(query, candidates, topK);
        if (ranked.isEmpty()) {
            return NO_RELEVANT;
        }

        List<String> out = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            TalkDocument doc = ranked.get(i).document();
            Map<String, String> meta = doc.metadata();
            out.add("--- Result " + (i + 1) + " ---");
            out.add("Title: " + titleOf(meta));
            out.add("Room: " + meta.getOrDefault("room", ""));
            out.add("Date: " + meta.getOrDefault("date", ""));
            out.add("Start: " + meta.getOrDefault("start", ""));
            out.add("Track: " + meta.getOrDefault("track", ""));
            out.add("Excerpt: " + excerpt(doc.text(), RESULT_EXCERPT) + "\n");
        }
        return String.join("\n", out).strip();
    }

    public String overview(String sessionId) {
        return store.findOverview(sessionId).orElse(NO_OVERVIEW);
    }

    /**
     * Asks the LLM to score the candidates, then drops low scores and invalid
     * indices, keeps only the first scoring of a repeated index, sorts by score
     * descending (stable) and keeps the first {@code topK}.
     */
    List<VectorMatch> rerank(String query, List<VectorMatch> candidates, int topK) {
        List<String> blocks = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            TalkDocument doc = candidates.get(i).document();
            Map<String, String> meta = doc.metadata();
            blocks.add("[" + i + "] Title: " + titleOf(meta) + "\n"
                    + "Room: " + meta.getOrDefault("room", "") + " | Track: " + meta.getOrDefault("track", "") + "\n"
                    + "Excerpt: " + excerpt(doc.text(), RERANK_EXCERPT));
        }
        String userPrompt = "Query: " + query + "\n\nRetrieved entries:\n" + String.join("\n\n", blocks);

        RerankResponse response = llmService.structuredCall(RERANK_PROMPT, userPrompt, RerankResponse.class);
        Set<Integer> seen = new HashSet<>();
        List<VectorMatch> kept = response.results().stream()
                .filter(r -> r.score() > properties.getMinRelevanceScore())
                .filter(r -> r.index() >= 0 && r.index() < candidates.size())
                .filter(r -> seen.add(r.index()))
                .sorted(Comparator.comparingInt(RerankResult::score).reversed())
                .limit(Math.max(topK, 0))
                .map(r -> candidates.get(r.index()))
                .toList();
        log.debug("Rerank kept {} of {} candidates ({} scored)", kept.size(), candidates.size(),
                response.results().size());
        return kept;
    }

    /** Embeds in batches; blank texts are sent as a single space. */
    List<float[]> embed(List<String> texts) {
        int batchSize = Math.max(1, properties.getEmbeddingBatchSize());
        List<float[]> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i += batchSize) {
            List<String> batch = texts.subList(i, Math.min(i + batchSize, texts.size())).stream()
                    .map(t -> t == null || t.isBlank() ? " " : t.strip())
                    .toList();
            List<float[]> vectors = embeddingModel.embed(batch);
            if (vectors.size() != batch.size()) {
                throw new IllegalStateException("Embedding model returned " + vectors.size()
                        + " vectors for " + batch.size() + " inputs");
            }
            out.addAll(vectors);
        }
        return out;
    }

    private static String titleOf(Map<String, String> meta) {
        String title = meta.getOrDefault("title", "");
        return title.isEmpty() ? "(no title)" : title;
    }

    private static String excerpt(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
