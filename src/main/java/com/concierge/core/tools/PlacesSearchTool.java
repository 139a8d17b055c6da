package com.concierge.core.tools;

import org.springframework.stereotype.Component;

/**
 * {@code google_places_search}: places, venues and restaurants via Serper.
 */
@Component
public class PlacesSearchTool extends SerperSearchTool {

    public static final String NAME = "google_places_search";

    public PlacesSearchTool(SerperClient client) {
        super(client);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Finds places, venues, or restaurants using Serper's places endpoint.";
    }

    @Override
    public String inputSchema() {
        return ConciergeTool.querySchema("Search query for places, venues, or restaurants.");
    }

    @Override
    protected String endpoint() {
        return "/places";
    }

    @Override
    protected String resultField() {
        return "places";
    }

    @Override
    protected String apiLabel() {
        return "places";
    }

    @Override
    protected String emptyMessage() {
        return "No places returned.";
    }
}
