package com.concierge.core.llm;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Declaration of a tool offered to the model: name, description and JSON schema.
 * <p>
 * Execution never goes through Spring AI; the executor agent dispatches tool calls
 * itself, so the callback produced here only carries the definition.
 *
 * @param name        tool name the model uses to call it
 * @param description what the tool does, shown to the model
 * @param inputSchema JSON schema of the arguments object
 */
public record ToolSpec(
    String name,
    String description,
    String inputSchema
) {

    public static final String EMPTY_SCHEMA = """
            {"type":"object","properties":{},"required":[],"additionalProperties":false}""";

    public ToolCallback toToolCallback() {
        ToolDefinition definition = ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(inputSchema)
                .build();
        return new ToolCallback() {
            @Override
            public ToolDefinition getToolDefinition() {
                return definition;
            }

            @Override
            public String call(String toolInput) {
                throw new UnsupportedOperationException(
                        "Tool '" + name + "' is dispatched by the executor, not by the chat model");
            }
        };
    }
}
