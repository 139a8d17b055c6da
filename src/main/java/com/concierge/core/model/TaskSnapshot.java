package com.concierge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable copy of a {@link Task}, including its execution history.
 */
public record TaskSnapshot(
    int id,
    String description,
    TaskStatus status,
    List<ExecutionEntry> executionHistory,
    String result
) implements Serializable {

    public TaskSnapshot {
        executionHistory = executionHistory != null ? List.copyOf(executionHistory) : List.of();
        result = result != null ? result : "";
    }
}
