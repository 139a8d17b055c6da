package com.concierge.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * HTTP client for the Serper Google search API.
 * <p>
 * Authenticates with the {@code X-API-KEY} header from
 * {@link SearchProperties#getSerperApiKey()} and returns the raw response body;
 * callers decide how to read it.
 */
@Component
public class SerperClient {

    private static final Logger log = LoggerFactory.getLogger(SerperClient.class);

    private final SearchProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SerperClient(SearchProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * POSTs {@code {"q": query, "gl": region}} to the given endpoint.
     *
     * @param endpoint path below the base URL, e.g. {@code /search} or {@code /places}
     * @return the response body
     * @throws SerperException on transport failures, non-2xx responses or a missing API key
     */
    public String post(String endpoint, String query) {
        String apiKey = properties.getSerperApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new SerperException("Serper API key is not configured (concierge.search.serper-api-key)");
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("q", query);
        body.put("gl", properties.getRegion());

        var request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + endpoint))
                .header("X-API-KEY", apiKey)
                .header("Content-Type", "application/json")
                .timeout(properties.getTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new SerperException("Serper POST %s failed (HTTP %d): %s"
                        .formatted(endpoint, response.statusCode(), response.body()));
            }
            log.debug("Serper POST {} returned {} chars", endpoint, response.body().length());
            return response.body();
        } catch (IOException e) {
            throw new SerperException("Serper request failed: POST " + endpoint + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SerperException("Serper request interrupted: POST " + endpoint, e);
        }
    }

    public static class SerperException extends RuntimeException {
        public SerperException(String message) {
            super(message);
        }

        public SerperException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
