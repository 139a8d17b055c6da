package com.concierge.core.state;

import com.concierge.core.model.InteractionMessage;
import com.concierge.core.model.PlanEntry;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskSnapshot;
import com.concierge.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Conversation state threaded through the agents during one turn.
 * <p>
 * The orchestrator owns the instance for the duration of a turn; agents
 * receive it, mutate it and hand it back. Between turns only the interaction
 * history and the plan are persisted, and the state is rehydrated from them
 * via {@link #rehydrate}.
 */
public class AgentState {

    private final String conversationId;
    private List<String> necessaryDetailsRequired = new ArrayList<>();
    private List<String> optionalDetails = new ArrayList<>();
    private String queryToPlan = "";
    private List<String> planDescription = new ArrayList<>();
    private final List<Task> plan = new ArrayList<>();
    private String synthesizedSchedule = "";
    private final List<InteractionMessage> interactionHistory = new ArrayList<>();

    public AgentState(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId must not be blank");
        }
        this.conversationId = conversationId;
    }

    public static AgentState rehydrate(String conversationId,
                                       List<InteractionMessage> history,
                                       List<PlanEntry> plan) {
        var state = new AgentState(conversationId);
        state.interactionHistory.addAll(history);
        plan.forEach(entry -> state.plan.add(Task.fromPlanEntry(entry)));
        return state;
    }

    public static AgentState fromSnapshot(StateSnapshot snapshot) {
        var state = new AgentState(snapshot.conversationId());
        state.necessaryDetailsRequired = new ArrayList<>(snapshot.necessaryDetailsRequired());
        state.optionalDetails = new ArrayList<>(snapshot.optionalDetails());
        state.queryToPlan = snapshot.queryToPlan();
        state.planDescription = new ArrayList<>(snapshot.planDescription());
        snapshot.plan().forEach(task -> state.plan.add(Task.fromSnapshot(task)));
        state.synthesizedSchedule = snapshot.synthesizedSchedule();
        state.interactionHistory.addAll(snapshot.interactionHistory());
        return state;
    }

    public StateSnapshot snapshot() {
        List<TaskSnapshot> tasks = plan.stream().map(Task::snapshot).toList();
        return new StateSnapshot(conversationId, necessaryDetailsRequired, optionalDetails,
                queryToPlan, planDescription, tasks, synthesizedSchedule, interactionHistory);
    }

    // ── Identity ─────────────────────────────────────────────────────

    public String conversationId() {
        return conversationId;
    }

    // ── Intake ───────────────────────────────────────────────────────

    public List<String> necessaryDetailsRequired() {
        return Collections.unmodifiableList(necessaryDetailsRequired);
    }

    public void setNecessaryDetailsRequired(List<String> details) {
        this.necessaryDetailsRequired = new ArrayList<>(details);
    }

    public List<String> optionalDetails() {
        return Collections.unmodifiableList(optionalDetails);
    }

    public void setOptionalDetails(List<String> details) {
        this.optionalDetails = new ArrayList<>(details);
    }

    public String queryToPlan() {
        return queryToPlan;
    }

    public void setQueryToPlan(String queryToPlan) {
        this.queryToPlan = queryToPlan != null ? queryToPlan : "";
    }

    // ── Planning ─────────────────────────────────────────────────────

    public List<String> planDescription() {
        return Collections.unmodifiableList(planDescription);
    }

    public void setPlanDescription(List<String> planDescription) {
        this.planDescription = new ArrayList<>(planDescription);
    }

    public List<Task> plan() {
        return Collections.unmodifiableList(plan);
    }

    /**
     * Replaces the plan with one PENDING task per plan description entry,
     * ids assigned 0..N-1 in description order.
     */
    public List<Task> constructPlan() {
        plan.clear();
        for (int i = 0; i < planDescription.size(); i++) {
            plan.add(new Task(i, planDescription.get(i)));
        }
        return plan();
    }

    public Task task(int id) {
        if (id < 0 || id >= plan.size()) {
            throw new IllegalArgumentException("No task with id " + id + " in a plan of " + plan.size());
        }
        return plan.get(id);
    }

    /** The task currently being executed, if any. */
    public Optional<Task> currentTask() {
        return plan.stream().filter(t -> t.status() == TaskStatus.IN_PROGRESS).findFirst();
    }

    public List<Task> tasksWithStatus(TaskStatus status) {
        return plan.stream().filter(t -> t.status() == status).toList();
    }

    public List<Task> completedTasks() {
        return tasksWithStatus(TaskStatus.COMPLETED);
    }

    public List<PlanEntry> planEntries() {
        return plan.stream().map(Task::toPlanEntry).toList();
    }

    // ── Synthesis ────────────────────────────────────────────────────

    public String synthesizedSchedule() {
        return synthesizedSchedule;
    }

    public void setSynthesizedSchedule(String synthesizedSchedule) {
        this.synthesizedSchedule = synthesizedSchedule != null ? synthesizedSchedule : "";
    }

    // ── Interaction history ──────────────────────────────────────────

    public List<InteractionMessage> interactionHistory() {
        return Collections.unmodifiableList(interactionHistory);
    }

    public void appendUserMessage(String content) {
        interactionHistory.add(InteractionMessage.user(content));
    }

    public void appendAssistantMessage(String content) {
        interactionHistory.add(InteractionMessage.assistant(content));
    }

    public Optional<InteractionMessage> lastMessage() {
        return interactionHistory.isEmpty()
                ? Optional.empty()
                : Optional.of(interactionHistory.get(interactionHistory.size() - 1));
    }

    /** Overwrites the content of the most recent assistant message, used for guardrail substitution. */
    public void replaceLastAssistantMessage(String content) {
        int last = interactionHistory.size() - 1;
        if (last < 0 || !interactionHistory.get(last).isAssistant()) {
            throw new IllegalStateException("Last history entry is not an assistant message");
        }
        interactionHistory.set(last, InteractionMessage.assistant(content));
    }
}
