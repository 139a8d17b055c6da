package com.concierge.core.agents;

/**
 * Thrown when a task records more recoverable tool errors than its budget allows.
 * Aborts the whole turn.
 */
public class ToolErrorBudgetExceededException extends RuntimeException {

    private final int taskId;
    private final int errorCount;

    public ToolErrorBudgetExceededException(int taskId, int errorCount, Throwable lastError) {
        super("Task " + taskId + " exceeded its tool error budget (" + errorCount + " errors), last: "
                + lastError.getMessage(), lastError);
        this.taskId = taskId;
        this.errorCount = errorCount;
    }

    public int getTaskId() {
        return taskId;
    }

    public int getErrorCount() {
        return errorCount;
    }
}
