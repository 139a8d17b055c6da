package com.concierge.core.persistence;

import com.concierge.core.state.StateSnapshot;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One entry of a conversation's checkpoint log.
 *
 * @param stepIndex position in the log, starting at 0 and increasing by one per checkpoint
 * @param state     immutable snapshot of the state at this step
 * @param agentName agent whose invocation produced this state; null for user input and guardrail steps
 * @param timestamp when the checkpoint was taken
 * @param metadata  extra context such as {@code event} and {@code task_id}
 */
public record StateCheckpoint(
    int stepIndex,
    StateSnapshot state,
    String agentName,
    Instant timestamp,
    Map<String, Object> metadata
) implements Serializable {

    public static final String EVENT = "event";
    public static final String TASK_ID = "task_id";

    public StateCheckpoint {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public String conversationId() {
        return state.conversationId();
    }

    /** The {@code event} metadata value, or null. */
    public String event() {
        Object event = metadata.get(EVENT);
        return event != null ? event.toString() : null;
    }
}
