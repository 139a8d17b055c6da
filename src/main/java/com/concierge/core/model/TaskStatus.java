package com.concierge.core.model;

/**
 * Lifecycle of a single plan task.
 * <p>
 * Status only moves forward: {@code PENDING -> IN_PROGRESS -> COMPLETED | FAILED}.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canAdvanceTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
