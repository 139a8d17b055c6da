package com.concierge.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Base for tools backed by one Serper endpoint.
 * <p>
 * API failures are returned to the model as {@code Error ...} strings rather than
 * thrown, so a flaky search backend does not use up the task's tool error budget.
 */
public abstract class SerperSearchTool implements ConciergeTool {

    private static final Logger log = LoggerFactory.getLogger(SerperSearchTool.class);

    private final SerperClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    protected SerperSearchTool(SerperClient client) {
        this.client = client;
    }

    /** Endpoint path, e.g. {@code /search}. */
    protected abstract String endpoint();

    /** Field of the response holding the result list. */
    protected abstract String resultField();

    /** Short name of the API used in error messages, e.g. "search". */
    protected abstract String apiLabel();

    protected abstract String emptyMessage();

    @Override
    public String call(Map<String, Object> arguments) {
        Object query = arguments.get("query");
        if (query == null || query.toString().isBlank()) {
            throw new IllegalArgumentException(name() + " requires a non-empty 'query' argument");
        }

        String body;
        try {
            body = client.post(endpoint(), query.toString());
        } catch (SerperClient.SerperException e) {
            log.warn("{} failed: {}", name(), e.getMessage());
            return "Error calling " + apiLabel() + " API: " + e.getMessage();
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return "Error: invalid JSON from " + apiLabel() + " API: " + truncate(body, 500);
        }

        JsonNode results = json.path(resultField());
        if (!results.isArray() || results.isEmpty()) {
            var empty = objectMapper.createObjectNode();
            empty.putArray(resultField());
            empty.put("message", emptyMessage());
            return empty.toString();
        }
        return results.toString();
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
