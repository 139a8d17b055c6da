package com.concierge.core.model;

import java.io.Serializable;

/**
 * Persisted view of a task: what survives between turns.
 */
public record PlanEntry(
    int id,
    String description,
    TaskStatus status,
    String result
) implements Serializable {
}
