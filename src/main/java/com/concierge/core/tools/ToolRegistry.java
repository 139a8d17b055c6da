package com.concierge.core.tools;

import com.concierge.core.llm.ToolSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name-keyed registry of the tools available to the executor agent.
 * <p>
 * Built once at startup from every {@link ConciergeTool} bean; duplicate names
 * fail the startup. Registration order is kept so tool declarations reach the
 * model in a stable order.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final Map<String, ConciergeTool> tools = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ToolRegistry(List<ConciergeTool> tools) {
        for (ConciergeTool tool : tools) {
            ConciergeTool existing = this.tools.putIfAbsent(tool.name(), tool);
            if (existing != null) {
                throw new IllegalStateException("Duplicate tool name '" + tool.name() + "': "
                        + existing.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
            }
        }
        log.info("Registered {} tools: {}", this.tools.size(), this.tools.keySet());
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public List<ToolSpec> toolSpecs() {
        return tools.values().stream().map(ConciergeTool::toSpec).toList();
    }

    /**
     * Parses the model's raw JSON arguments and invokes the named tool.
     * Session-scoped tools get {@code session_id} set to {@code sessionId},
     * overriding anything the model supplied.
     *
     * @throws ToolInvocationException for unknown names and malformed arguments
     */
    public String invoke(String name, String argumentsJson, String sessionId) {
        ConciergeTool tool = tools.get(name);
        if (tool == null) {
            throw new ToolInvocationException("Unknown tool: " + name);
        }
        Map<String, Object> arguments = new HashMap<>(parseArguments(name, argumentsJson));
        if (tool.sessionScoped()) {
            arguments.put(ConciergeTool.SESSION_ID, sessionId);
        }
        String result = tool.call(arguments);
        return result != null ? result : "";
    }

    /** Parses raw JSON tool arguments; blank input is an empty argument map. */
    public Map<String, Object> parseArguments(String name, String argumentsJson) {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(argumentsJson, ARGS_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new ToolInvocationException("Malformed arguments for tool '" + name + "': "
                    + e.getOriginalMessage(), e);
        }
    }
}
