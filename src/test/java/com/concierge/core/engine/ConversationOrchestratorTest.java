package com.concierge.core.engine;

import com.concierge.core.agents.ConciergeAgent;
import com.concierge.core.agents.ToolErrorBudgetExceededException;
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
import com.concierge.core.persistence.InMemoryCheckpointStore;
import com.concierge.core.persistence.StateCheckpoint;
import com.concierge.core.state.AgentState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConversationOrchestratorTest {

    private static final String CONV = "conv-1";

    private Guardrail guardrail;
    private EventBus eventBus;
    private List<ConciergeEvent> events;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryCheckpointStore checkpointStore;
    private AtomicInteger intakeCalls;
    private AtomicInteger executorCalls;

    @BeforeEach
    void setUp() {
        guardrail = mock(Guardrail.class);
        when(guardrail.checkInput(anyString())).thenReturn(GuardrailVerdict.allow());
        when(guardrail.checkOutput(anyString())).thenReturn(GuardrailVerdict.allow());
        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribe(CONV, events::add);
        meterRegistry = new SimpleMeterRegistry();
        checkpointStore = new InMemoryCheckpointStore();
        intakeCalls = new AtomicInteger();
        executorCalls = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    private static ConciergeAgent agent(String name, Consumer<AgentState> behaviour) {
        return new ConciergeAgent() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public AgentState advance(AgentState state) {
                behaviour.accept(state);
                return state;
            }
        };
    }

    private ConciergeAgent clarifyingIntake(String message) {
        return agent("IntakeAgent", s -> {
            intakeCalls.incrementAndGet();
            s.setNecessaryDetailsRequired(List.of("conference"));
            s.appendAssistantMessage(message);
        });
    }

    private ConciergeAgent planningIntake() {
        return agent("IntakeAgent", s -> {
            intakeCalls.incrementAndGet();
            s.setQueryToPlan("DevConf Berlin, AI talks");
        });
    }

    private static ConciergeAgent planner(String... tasks) {
        return agent("PlanningAgent", s -> s.setPlanDescription(List.of(tasks)));
    }

    /** Completes the current task in one invocation and appends its description to the schedule. */
    private ConciergeAgent completingExecutor() {
        return agent("ExecutorAgent", s -> {
            executorCalls.incrementAndGet();
            Task task = s.currentTask().orElseThrow();
            s.setSynthesizedSchedule((s.synthesizedSchedule() + " " + task.description()).trim());
            task.complete("done " + task.id());
        });
    }

    private ConversationOrchestrator orchestrator(ConciergeAgent intake, ConciergeAgent planning,
                                                  ConciergeAgent executor) {
        return new ConversationOrchestrator(intake, planning, executor, guardrail, eventBus,
                new ConciergeMetrics(meterRegistry));
    }

    private List<StateCheckpoint> checkpoints() {
        return checkpointStore.list(CONV);
    }

    private List<String> checkpointEvents() {
        return checkpoints().stream().map(StateCheckpoint::event).toList();
    }

    private AgentState run(ConversationOrchestrator orchestrator, String message) {
        return orchestrator.runStep(new AgentState(CONV), CheckpointLog.open(CONV, checkpointStore), message);
    }

    @Nested
    @DisplayName("Input guardrail")
    class InputGuardrail {

        @Test
        @DisplayName("rejected input short-circuits with one checkpoint")
        void rejected() {
            when(guardrail.checkInput("recipe for lasagna"))
                    .thenReturn(GuardrailVerdict.reject("Let's stick to the conference."));
            var orchestrator = orchestrator(clarifyingIntake("?"), planner(), completingExecutor());

            AgentState result = run(orchestrator, "recipe for lasagna");

            assertEquals(0, intakeCalls.get());
            assertEquals(List.of(ConversationOrchestrator.EVENT_INPUT_REJECTED), checkpointEvents());
            assertEquals(List.of(InteractionMessage.user("recipe for lasagna"),
                    InteractionMessage.assistant("Let's stick to the conference.")), result.interactionHistory());
            assertEquals(1.0, meterRegistry.counter("concierge.guardrail.rejections", "stage", "input").count());
        }
    }

    @Nested
    @DisplayName("Intake")
    class Intake {

        @Test
        @DisplayName("a greeting ends the turn with a clarifying question and two checkpoints")
        void clarify() {
            var orchestrator = orchestrator(clarifyingIntake("Which conference?"), planner("x"),
                    completingExecutor());

            AgentState result = run(orchestrator, "hi");

            assertEquals(List.of(ConversationOrchestrator.EVENT_USER_INPUT,
                    ConversationOrchestrator.EVENT_AFTER_INTAKE), checkpointEvents());
            assertEquals("IntakeAgent", checkpoints().get(1).agentName());
            assertEquals("Which conference?", result.lastMessage().orElseThrow().content());
            assertTrue(result.plan().isEmpty());
            assertEquals(0, executorCalls.get());
        }

        @Test
        @DisplayName("a rejected clarifying message is replaced and checkpointed")
        void outputSubstitution() {
            when(guardrail.checkOutput("something harmful"))
                    .thenReturn(GuardrailVerdict.reject("I can't provide that."));
            var orchestrator = orchestrator(clarifyingIntake("something harmful"), planner(), completingExecutor());

            AgentState result = run(orchestrator, "hi");

            assertEquals("I can't provide that.", result.lastMessage().orElseThrow().content());
            assertEquals(List.of(ConversationOrchestrator.EVENT_USER_INPUT,
                    ConversationOrchestrator.EVENT_AFTER_INTAKE,
                    ConversationOrchestrator.EVENT_OUTPUT_REJECTED), checkpointEvents());
            assertEquals("something harmful",
                    checkpoints().get(1).state().interactionHistory().get(1).content(),
                    "the intake checkpoint keeps the original message");
        }
    }

    @Nested
    @DisplayName("Planning and execution")
    class PlanningAndExecution {

        @Test
        @DisplayName("full turn checkpoints every agent invocation in order")
        void fullTurn() {
            var orchestrator = orchestrator(planningIntake(), planner("Find AI talks", "Build schedule"),
                    completingExecutor());

            AgentState result = run(orchestrator, "DevConf Berlin, I like AI");

            List<StateCheckpoint> checkpoints = checkpoints();
            assertEquals(List.of(
                    ConversationOrchestrator.EVENT_USER_INPUT,
                    ConversationOrchestrator.EVENT_AFTER_INTAKE,
                    ConversationOrchestrator.EVENT_AFTER_PLANNING,
                    ConversationOrchestrator.EVENT_AFTER_EXECUTION,
                    ConversationOrchestrator.EVENT_AFTER_EXECUTION,
                    ConversationOrchestrator.EVENT_REPLY), checkpointEvents());
            assertEquals(List.of(0, 1, 2, 3, 4, 5), checkpoints.stream().map(StateCheckpoint::stepIndex).toList());
            assertEquals(true, checkpoints.get(2).metadata().get("has_plan"));
            assertEquals(0, checkpoints.get(3).metadata().get(StateCheckpoint.TASK_ID));
            assertEquals(1, checkpoints.get(4).metadata().get(StateCheckpoint.TASK_ID));
            assertEquals(TaskStatus.COMPLETED, checkpoints.get(3).state().plan().get(0).status());
            assertEquals(TaskStatus.PENDING, checkpoints.get(3).state().plan().get(1).status());

            assertEquals("Find AI talks Build schedule", result.lastMessage().orElseThrow().content());
            assertTrue(result.plan().stream().allMatch(t -> t.status() == TaskStatus.COMPLETED));
            assertEquals(2.0, meterRegistry.counter("concierge.tasks.total", "status", "COMPLETED").count());
            assertEquals(6.0, meterRegistry.counter("concierge.checkpoints.total").count());
        }

        @Test
        @DisplayName("events follow the turn's phases")
        void events() {
            var orchestrator = orchestrator(planningIntake(), planner("Only task"), completingExecutor());

            run(orchestrator, "go");

            assertEquals(List.of(
                    ConciergeEvent.TURN_STARTED,
                    ConciergeEvent.PHASE_INTAKE,
                    ConciergeEvent.PHASE_PLANNING,
                    ConciergeEvent.PLAN_CREATED,
                    ConciergeEvent.TASK_STARTED,
                    ConciergeEvent.TASK_COMPLETED,
                    ConciergeEvent.TURN_COMPLETED), events.stream().map(ConciergeEvent::eventType).toList());
            assertEquals(0, events.get(4).taskId());
        }

        @Test
        @DisplayName("a failed task does not stop the remaining tasks")
        void failedTaskContinues() {
            ConciergeAgent executor = agent("ExecutorAgent", s -> {
                Task task = s.currentTask().orElseThrow();
                if (task.id() == 0) {
                    task.fail();
                } else {
                    s.setSynthesizedSchedule("schedule");
                    task.complete("ok");
                }
            });
            var orchestrator = orchestrator(planningIntake(), planner("a", "b"), executor);

            AgentState result = run(orchestrator, "go");

            assertEquals(TaskStatus.FAILED, result.task(0).status());
            assertEquals(TaskStatus.COMPLETED, result.task(1).status());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(ConciergeEvent.TASK_FAILED)));
            assertEquals(1.0, meterRegistry.counter("concierge.tasks.total", "status", "FAILED").count());
        }

        @Test
        @DisplayName("the executor is invoked until the task is terminal")
        void multipleInvocations() {
            ConciergeAgent executor = agent("ExecutorAgent", s -> {
                if (executorCalls.incrementAndGet() == 2) {
                    s.currentTask().orElseThrow().complete("done");
                }
            });
            var orchestrator = orchestrator(planningIntake(), planner("a"), executor);

            run(orchestrator, "go");

            assertEquals(2, executorCalls.get());
            assertEquals(2, checkpointEvents().stream()
                    .filter(ConversationOrchestrator.EVENT_AFTER_EXECUTION::equals).count());
        }

        @Test
        @DisplayName("an empty schedule is appended as the reply unchanged")
        void emptySchedule() {
            var orchestrator = orchestrator(planningIntake(), planner(), completingExecutor());

            AgentState result = run(orchestrator, "go");

            assertEquals(false, checkpoints().get(2).metadata().get("has_plan"));
            InteractionMessage reply = result.lastMessage().orElseThrow();
            assertTrue(reply.isAssistant());
            assertEquals("", reply.content());
            assertEquals(0, executorCalls.get());
            assertEquals(ConversationOrchestrator.EVENT_REPLY, checkpoints().get(checkpoints().size() - 1).event());
        }

        @Test
        @DisplayName("a rejected schedule is replaced by the guardrail message")
        void scheduleRejected() {
            when(guardrail.checkOutput("a")).thenReturn(GuardrailVerdict.reject("I can't provide that."));
            var orchestrator = orchestrator(planningIntake(), planner("a"), completingExecutor());

            AgentState result = run(orchestrator, "go");

            assertEquals("I can't provide that.", result.lastMessage().orElseThrow().content());
            assertEquals("a", result.synthesizedSchedule());
        }

        @Test
        @DisplayName("a fatal executor error propagates without a checkpoint for the failed step")
        void fatalError() {
            ConciergeAgent executor = agent("ExecutorAgent", s -> {
                throw new ToolErrorBudgetExceededException(0, 6, new IllegalStateException("down"));
            });
            var orchestrator = orchestrator(planningIntake(), planner("a", "b"), executor);

            assertThrows(ToolErrorBudgetExceededException.class, () -> run(orchestrator, "go"));

            assertEquals(ConversationOrchestrator.EVENT_AFTER_PLANNING,
                    checkpoints().get(checkpoints().size() - 1).event());
            assertNull(MDC.get(MdcContext.CONVERSATION_ID));
            assertNull(MDC.get(MdcContext.TASK_ID));
        }
    }

    @Nested
    @DisplayName("Turn boundaries")
    class TurnBoundaries {

        @Test
        @DisplayName("only the reply ends a full turn")
        void fullTurnEndsAtReply() {
            run(orchestrator(planningIntake(), planner("a"), completingExecutor()), "go");

            List<Boolean> ends = checkpoints().stream().map(ConversationOrchestrator::endsTurn).toList();

            assertEquals(List.of(false, false, false, false, true), ends);
        }

        @Test
        @DisplayName("a clarify turn ends at its intake checkpoint")
        void clarifyTurnEndsAtIntake() {
            run(orchestrator(clarifyingIntake("Which conference?"), planner(), completingExecutor()), "hi");

            assertEquals(List.of(false, true),
                    checkpoints().stream().map(ConversationOrchestrator::endsTurn).toList());
        }

        @Test
        @DisplayName("an aborted turn leaves no checkpoint that ends it")
        void abortedTurnHasNoEnd() {
            ConciergeAgent executor = agent("ExecutorAgent", s -> {
                throw new IllegalStateException("down");
            });

            assertThrows(IllegalStateException.class,
                    () -> run(orchestrator(planningIntake(), planner("a"), executor), "go"));

            assertTrue(checkpoints().stream().noneMatch(ConversationOrchestrator::endsTurn));
        }
    }
}
