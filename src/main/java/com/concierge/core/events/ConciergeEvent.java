package com.concierge.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted while a conversation turn runs.
 *
 * @param eventType      event type (e.g. "turn.started", "plan.created", "task.completed")
 * @param conversationId the conversation this event belongs to
 * @param taskId         the task this event relates to (nullable for turn-level events)
 * @param payload        arbitrary key-value data associated with the event
 * @param timestamp      when the event occurred
 */
public record ConciergeEvent(
    String eventType,
    String conversationId,
    Integer taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TURN_STARTED = "turn.started";
    public static final String PHASE_INTAKE = "phase.intake";
    public static final String PHASE_PLANNING = "phase.planning";
    public static final String PLAN_CREATED = "plan.created";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TURN_COMPLETED = "turn.completed";

    public ConciergeEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static ConciergeEvent of(String eventType, String conversationId, Integer taskId,
                                    Map<String, Object> payload) {
        return new ConciergeEvent(eventType, conversationId, taskId, payload, Instant.now());
    }

    public static ConciergeEvent of(String eventType, String conversationId) {
        return of(eventType, conversationId, null, Map.of());
    }
}
