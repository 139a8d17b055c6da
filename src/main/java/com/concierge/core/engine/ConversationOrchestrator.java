package com.concierge.core.engine;

import com.concierge.core.agents.ConciergeAgent;
import com.concierge.core.agents.ExecutorAgent;
import com.concierge.core.agents.IntakeAgent;
import com.concierge.core.agents.PlanningAgent;
import com.concierge.core.events.ConciergeEvent;
import com.concierge.core.events.EventBus;
import com.concierge.core.guardrail.Guardrail;
import com.concierge.core.guardrail.GuardrailVerdict;
import com.concierge.core.logging.MdcContext;
import com.concierge.core.metrics.ConciergeMetrics;
import com.concierge.core.model.InteractionMessage;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.persistence.CheckpointLog;
import com.concierge.core.persistence.StateCheckpoint;
import com.concierge.core.state.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs one conversation turn through the phase state machine:
 * input guardrail, intake until a plannable summary exists, planning, then
 * every task in plan order through the executor, and finally the output
 * guardrail over the synthesized schedule.
 * <p>
 * A checkpoint is appended after the input guardrail, after every agent
 * invocation, after an output substitution and after the final reply. Exceptions
 * from agents propagate unchanged; the step that failed gets no checkpoint.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    public static final String EVENT_INPUT_REJECTED = "input_rejected";
    public static final String EVENT_USER_INPUT = "user_input";
    public static final String EVENT_AFTER_INTAKE = "after_intake";
    public static final String EVENT_OUTPUT_REJECTED = "output_rejected";
    public static final String EVENT_AFTER_PLANNING = "after_planning";
    public static final String EVENT_AFTER_EXECUTION = "after_execution";
    public static final String EVENT_REPLY = "reply";

    private final ConciergeAgent intakeAgent;
    private final ConciergeAgent planningAgent;
    private final ConciergeAgent executorAgent;
    private final Guardrail guardrail;
    private final EventBus eventBus;
    private final ConciergeMetrics metrics;

    @Autowired
    public ConversationOrchestrator(IntakeAgent intakeAgent, PlanningAgent planningAgent, ExecutorAgent executorAgent,
                                    Guardrail guardrail, EventBus eventBus, ConciergeMetrics metrics) {
        this((ConciergeAgent) intakeAgent, planningAgent, executorAgent, guardrail, eventBus, metrics);
    }

    public ConversationOrchestrator(ConciergeAgent intakeAgent, ConciergeAgent planningAgent,
                                    ConciergeAgent executorAgent, Guardrail guardrail,
                                    EventBus eventBus, ConciergeMetrics metrics) {
        this.intakeAgent = intakeAgent;
        this.planningAgent = planningAgent;
        this.executorAgent = executorAgent;
        this.guardrail = guardrail;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs one turn for {@code userMessage}.
     *
     * @param state       the conversation state, rehydrated by the caller
     * @param checkpoints the conversation's checkpoint log
     * @return the state after the turn; its last history entry is the assistant reply
     */
    public AgentState runStep(AgentState state, CheckpointLog checkpoints, String userMessage) {
        String conversationId = state.conversationId();
        MdcContext.setConversation(conversationId);
        try {
            log.info("Turn started: {}", abbreviate(userMessage, 80));
            publish(ConciergeEvent.TURN_STARTED, conversationId, null, Map.of());

            state.appendUserMessage(userMessage);
            GuardrailVerdict input = guardrail.checkInput(userMessage);
            if (!input.allowed()) {
                log.info("Input rejected by guardrail");
                metrics.recordGuardrailRejection("input");
                state.appendAssistantMessage(input.message());
                checkpoint(checkpoints, state, null, Map.of(StateCheckpoint.EVENT, EVENT_INPUT_REJECTED));
                publish(ConciergeEvent.TURN_COMPLETED, conversationId, null, Map.of("outcome", EVENT_INPUT_REJECTED));
                return state;
            }
            checkpoint(checkpoints, state, null, Map.of(StateCheckpoint.EVENT, EVENT_USER_INPUT));

            while (true) {
                if (state.queryToPlan().isEmpty()) {
                    state = runIntake(state, checkpoints);
                    if (state.queryToPlan().isEmpty()) {
                        publish(ConciergeEvent.TURN_COMPLETED, conversationId, null, Map.of("outcome", "clarify"));
                        return state;
                    }
                } else {
                    state = runPlanAndTasks(state, checkpoints);
                    publish(ConciergeEvent.TURN_COMPLETED, conversationId, null, Map.of("outcome", "schedule"));
                    return state;
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Whether {@code checkpoint} is the last one a completed turn can leave behind:
     * the final reply, a rejected input, a substituted clarifying message, or an
     * intake step that stopped the turn without a plannable query. Checkpoints of
     * an aborted turn never match.
     */
    public static boolean endsTurn(StateCheckpoint checkpoint) {
        String event = checkpoint.event();
        if (EVENT_AFTER_INTAKE.equals(event)) {
            return checkpoint.state().queryToPlan().isEmpty();
        }
        return EVENT_REPLY.equals(event) || EVENT_INPUT_REJECTED.equals(event) || EVENT_OUTPUT_REJECTED.equals(event);
    }

    private AgentState runIntake(AgentState state, CheckpointLog checkpoints) {
        publish(ConciergeEvent.PHASE_INTAKE, state.conversationId(), null, Map.of());
        int historySize = state.interactionHistory().size();
        MdcContext.setAgent(state.conversationId(), intakeAgent.name());
        state = invoke(intakeAgent, state, checkpoints, Map.of(StateCheckpoint.EVENT, EVENT_AFTER_INTAKE));
        MdcContext.clearTask();

        Optional<InteractionMessage> last = state.lastMessage();
        if (state.interactionHistory().size() > historySize && last.isPresent() && last.get().isAssistant()) {
            GuardrailVerdict output = guardrail.checkOutput(last.get().content());
            if (!output.allowed()) {
                log.info("Clarifying message replaced by guardrail");
                metrics.recordGuardrailRejection("output");
                state.replaceLastAssistantMessage(output.message());
                checkpoint(checkpoints, state, null, Map.of(StateCheckpoint.EVENT, EVENT_OUTPUT_REJECTED));
            }
        }
        return state;
    }

    private AgentState runPlanAndTasks(AgentState state, CheckpointLog checkpoints) {
        String conversationId = state.conversationId();
        publish(ConciergeEvent.PHASE_PLANNING, conversationId, null, Map.of());
        MdcContext.setAgent(conversationId, planningAgent.name());
        state = invoke(planningAgent, state, checkpoints, planned -> Map.of(
                StateCheckpoint.EVENT, EVENT_AFTER_PLANNING,
                "has_plan", !planned.planDescription().isEmpty()));
        MdcContext.clearTask();

        state.constructPlan();
        log.info("Plan constructed with {} tasks", state.plan().size());
        publish(ConciergeEvent.PLAN_CREATED, conversationId, null, Map.of("tasks", state.planDescription()));

        for (int taskId = 0; taskId < state.plan().size(); taskId++) {
            Task task = state.task(taskId);
            if (task.status() != TaskStatus.PENDING) {
                continue;
            }
            task.start();
            MdcContext.setTask(conversationId, taskId, executorAgent.name());
            publish(ConciergeEvent.TASK_STARTED, conversationId, taskId, Map.of("description", task.description()));

            while (!state.task(taskId).isTerminal()) {
                state = invoke(executorAgent, state, checkpoints, Map.of(
                        StateCheckpoint.EVENT, EVENT_AFTER_EXECUTION,
                        StateCheckpoint.TASK_ID, taskId));
            }

            TaskStatus outcome = state.task(taskId).status();
            log.info("Task {} finished as {}", taskId, outcome);
            metrics.recordTaskOutcome(outcome.name());
            publish(outcome == TaskStatus.COMPLETED ? ConciergeEvent.TASK_COMPLETED : ConciergeEvent.TASK_FAILED,
                    conversationId, taskId, Map.of("status", outcome.name()));
            MdcContext.clearTask();
        }

        String schedule = state.synthesizedSchedule();
        GuardrailVerdict output = guardrail.checkOutput(schedule);
        String reply = schedule;
        if (!output.allowed()) {
            log.info("Schedule replaced by guardrail");
            metrics.recordGuardrailRejection("output");
            reply = output.message();
        }
        state.appendAssistantMessage(reply);
        checkpoint(checkpoints, state, null, Map.of(StateCheckpoint.EVENT, EVENT_REPLY));
        return state;
    }

    private AgentState invoke(ConciergeAgent agent, AgentState state, CheckpointLog checkpoints,
                              Map<String, Object> metadata) {
        return invoke(agent, state, checkpoints, next -> metadata);
    }

    private AgentState invoke(ConciergeAgent agent, AgentState state, CheckpointLog checkpoints,
                              Function<AgentState, Map<String, Object>> metadata) {
        log.info("Invoking {}", agent.name());
        long start = System.currentTimeMillis();
        AgentState next = agent.advance(state);
        metrics.recordAgentInvocation(agent.name(), System.currentTimeMillis() - start);
        checkpoint(checkpoints, next, agent.name(), metadata.apply(next));
        return next;
    }

    private void checkpoint(CheckpointLog checkpoints, AgentState state, String agentName,
                            Map<String, Object> metadata) {
        checkpoints.append(state, agentName, metadata);
        metrics.incrementCheckpoints();
    }

    private void publish(String type, String conversationId, Integer taskId, Map<String, Object> payload) {
        eventBus.publish(ConciergeEvent.of(type, conversationId, taskId, payload));
    }

    private static String abbreviate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
