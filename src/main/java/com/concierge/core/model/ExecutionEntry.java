package com.concierge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One message in a task's private execution history.
 * <p>
 * Assistant entries carry the model text and any tool calls it requested;
 * tool entries carry a tool's output keyed by the originating call id.
 *
 * @param role       "assistant" or "tool"
 * @param content    message text or tool output
 * @param toolCalls  tool calls requested by an assistant turn (empty for tool entries)
 * @param toolCallId id of the call this tool entry answers (null for assistant entries)
 * @param toolName   name of the tool that produced this entry (null for assistant entries)
 */
public record ExecutionEntry(
    String role,
    String content,
    List<ToolCallRequest> toolCalls,
    String toolCallId,
    String toolName
) implements Serializable {

    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    public ExecutionEntry {
        content = content != null ? content : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static ExecutionEntry assistant(String content, List<ToolCallRequest> toolCalls) {
        return new ExecutionEntry(ASSISTANT, content, toolCalls, null, null);
    }

    public static ExecutionEntry assistantText(String content) {
        return new ExecutionEntry(ASSISTANT, content, List.of(), null, null);
    }

    public static ExecutionEntry toolResult(String toolCallId, String toolName, String content) {
        return new ExecutionEntry(TOOL, content, List.of(), toolCallId, toolName);
    }

    public boolean isTool() {
        return TOOL.equals(role);
    }
}
