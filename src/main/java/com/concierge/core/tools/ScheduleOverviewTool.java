package com.concierge.core.tools;

import com.concierge.core.retrieval.RetrievalEngine;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@code get_schedule_overview}: the compact program of the session's uploaded schedule.
 */
@Component
public class ScheduleOverviewTool implements ConciergeTool {

    public static final String NAME = "get_schedule_overview";

    private final RetrievalEngine retrievalEngine;

    public ScheduleOverviewTool(RetrievalEngine retrievalEngine) {
        this.retrievalEngine = retrievalEngine;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Retrieve the full schedule overview for the user's uploaded conference. "
                + "Returns a compact list of all sessions (title, time, room, track) so you can see "
                + "the whole program at a glance. Call this when you need the full schedule structure; "
                + "use rag_search for topic-specific sessions.";
    }

    @Override
    public boolean sessionScoped() {
        return true;
    }

    @Override
    public String call(Map<String, Object> arguments) {
        Object sessionId = arguments.get(SESSION_ID);
        if (sessionId == null || sessionId.toString().isBlank()) {
            return "No session context.";
        }
        return retrievalEngine.overview(sessionId.toString());
    }
}
