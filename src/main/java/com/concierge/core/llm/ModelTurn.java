package com.concierge.core.llm;

import com.concierge.core.model.ToolCallRequest;

import java.util.List;

/**
 * One assistant response from a tool-enabled completion.
 *
 * @param content   free text of the response (may be empty)
 * @param toolCalls tool calls in the order the model returned them
 */
public record ModelTurn(
    String content,
    List<ToolCallRequest> toolCalls
) {

    public ModelTurn {
        content = content != null ? content : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
