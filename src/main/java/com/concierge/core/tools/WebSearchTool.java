package com.concierge.core.tools;

import org.springframework.stereotype.Component;

/**
 * {@code google_web_search}: organic Google results via Serper.
 */
@Component
public class WebSearchTool extends SerperSearchTool {

    public static final String NAME = "google_web_search";

    public WebSearchTool(SerperClient client) {
        super(client);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Searches for information on the web using Serper's search endpoint.";
    }

    @Override
    public String inputSchema() {
        return ConciergeTool.querySchema("Search query for information on the web.");
    }

    @Override
    protected String endpoint() {
        return "/search";
    }

    @Override
    protected String resultField() {
        return "organic";
    }

    @Override
    protected String apiLabel() {
        return "search";
    }

    @Override
    protected String emptyMessage() {
        return "No organic results returned.";
    }
}
