package com.concierge.core.tools;

import com.concierge.core.retrieval.RetrievalEngine;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@code rag_search}: semantic search over the session's uploaded schedule.
 */
@Component
public class ScheduleSearchTool implements ConciergeTool {

    public static final String NAME = "rag_search";

    static final String NO_SESSION = "No session context. Use this tool from the conference concierge "
            + "with a session that has an uploaded schedule.";

    private final RetrievalEngine retrievalEngine;

    public ScheduleSearchTool(RetrievalEngine retrievalEngine) {
        this.retrievalEngine = retrievalEngine;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Semantic search over the user's uploaded conference schedule. "
                + "Use this to find talks/sessions by topic, track, or keyword. "
                + "Returns matching sessions with title, room, time, and excerpt.";
    }

    @Override
    public String inputSchema() {
        return ConciergeTool.querySchema("Search query (e.g. 'RAG', 'machine learning', 'keynote') "
                + "to find relevant sessions in the schedule.");
    }

    @Override
    public boolean sessionScoped() {
        return true;
    }

    @Override
    public String call(Map<String, Object> arguments) {
        Object sessionId = arguments.get(SESSION_ID);
        if (sessionId == null || sessionId.toString().isBlank()) {
            return NO_SESSION;
        }
        Object query = arguments.get("query");
        if (query == null || query.toString().isBlank()) {
            throw new IllegalArgumentException(NAME + " requires a non-empty 'query' argument");
        }
        return retrievalEngine.query(sessionId.toString(), query.toString());
    }
}
