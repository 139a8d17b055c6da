package com.concierge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single unit of plan work, executed by the executor agent in its own
 * tool-calling loop.
 * <p>
 * Ids are positional (0..N-1 in plan order) and never change. The execution
 * history belongs to this task only and is never shown to other tasks.
 */
public class Task {

    private final int id;
    private final String description;
    private TaskStatus status;
    private final List<ExecutionEntry> executionHistory;
    private String result;

    public Task(int id, String description) {
        this(id, description, TaskStatus.PENDING, List.of(), "");
    }

    private Task(int id, String description, TaskStatus status,
                 List<ExecutionEntry> executionHistory, String result) {
        this.id = id;
        this.description = description != null ? description : "";
        this.status = status;
        this.executionHistory = new ArrayList<>(executionHistory);
        this.result = result != null ? result : "";
    }

    /**
     * Rebuilds a task from persisted or checkpointed data, bypassing the
     * transition guards.
     */
    public static Task restore(int id, String description, TaskStatus status,
                               List<ExecutionEntry> executionHistory, String result) {
        return new Task(id, description, status,
                executionHistory != null ? executionHistory : List.of(), result);
    }

    public static Task fromSnapshot(TaskSnapshot snapshot) {
        return restore(snapshot.id(), snapshot.description(), snapshot.status(),
                snapshot.executionHistory(), snapshot.result());
    }

    public static Task fromPlanEntry(PlanEntry entry) {
        return restore(entry.id(), entry.description(), entry.status(), List.of(), entry.result());
    }

    public int id() {
        return id;
    }

    public String description() {
        return description;
    }

    public TaskStatus status() {
        return status;
    }

    public String result() {
        return result;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public List<ExecutionEntry> executionHistory() {
        return Collections.unmodifiableList(executionHistory);
    }

    public void appendHistory(ExecutionEntry entry) {
        executionHistory.add(entry);
    }

    public void start() {
        advanceTo(TaskStatus.IN_PROGRESS);
    }

    public void complete(String result) {
        advanceTo(TaskStatus.COMPLETED);
        this.result = result != null ? result : "";
    }

    public void fail() {
        advanceTo(TaskStatus.FAILED);
    }

    private void advanceTo(TaskStatus target) {
        if (!status.canAdvanceTo(target)) {
            throw new IllegalStateException(
                    "Task " + id + " cannot move from " + status + " to " + target);
        }
        status = target;
    }

    public TaskSnapshot snapshot() {
        return new TaskSnapshot(id, description, status, executionHistory, result);
    }

    public PlanEntry toPlanEntry() {
        return new PlanEntry(id, description, status, result);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", status=" + status + ", description='" + description + "'}";
    }
}
