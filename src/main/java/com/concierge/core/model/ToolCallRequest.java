package com.concierge.core.model;

import java.io.Serializable;

/**
 * A tool invocation requested by the model.
 *
 * @param callId    provider-assigned id, echoed back on the tool result
 * @param name      registered tool name
 * @param arguments raw JSON arguments as produced by the model
 */
public record ToolCallRequest(
    String callId,
    String name,
    String arguments
) implements Serializable {
}
