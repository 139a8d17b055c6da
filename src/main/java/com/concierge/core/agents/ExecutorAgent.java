package com.concierge.core.agents;

import com.concierge.core.llm.LlmService;
import com.concierge.core.llm.ModelTurn;
import com.concierge.core.llm.ToolSpec;
import com.concierge.core.metrics.ConciergeMetrics;
import com.concierge.core.model.ExecutionEntry;
import com.concierge.core.model.Task;
import com.concierge.core.model.ToolCallRequest;
import com.concierge.core.state.AgentState;
import com.concierge.core.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Executes the in-progress task in a bounded tool-calling loop.
 * <p>
 * Every model turn gets a freshly built prompt (completed task results, the
 * schedule so far and the current task) followed by the task's own execution
 * history. Tool calls run one at a time in the order the model returned them.
 * The loop ends when the model calls {@value #SUBMIT_TASK_RESULT} (COMPLETED)
 * or runs out of turns (FAILED). Tool failures are recorded in the history and
 * counted; exceeding the error budget aborts the turn with
 * {@link ToolErrorBudgetExceededException}.
 */
@Component
public class ExecutorAgent implements ConciergeAgent {

    private static final Logger log = LoggerFactory.getLogger(ExecutorAgent.class);

    public static final String NAME = "ExecutorAgent";
    public static final String SUBMIT_TASK_RESULT = "submit_task_result";
    public static final String GENERATE_SCHEDULE = "generate_schedule";

    private static final String SYSTEM_PROMPT = """
            You are the Executor Agent for a Conference Concierge System.
            Your job is to execute ONLY the current task, then stop by calling submit_task_result.

            Each task has a narrow scope.
            Do only what the current task asks.
            As soon as you have the information that fulfills the current task, call submit_task_result with that result and stop.
            Do not add extra steps unless the current task explicitly asks for them.

            EXAMPLE:
            If the task is "Check the internal database for the conference schedule",
            call get_schedule_overview, check the result, then call submit_task_result with that overview if it satisfies the task.

            INPUT:
            - Current task description
            - Current task execution history
            - Previous tasks' descriptions and their results
            - Generated schedule so far

            AVAILABLE TOOLS:
            1. get_schedule_overview: Full schedule overview (all sessions: title, time, room, track) for the uploaded conference.
               Use when the task needs the program at a glance.
            2. rag_search: Semantic search over the uploaded schedule (e.g. by topic "RAG", "ML", "keynote"). Use for topic-specific sessions.
            3. google_web_search: Searches the internet for information on the web.
            4. google_places_search: Searches for places, venues, or restaurants.
            5. submit_task_result: Call this when the current task is done. You MUST call this to finish the task.
            6. generate_schedule: Generate a personal schedule from gathered information.

            RULES:
            - Execute only the current task. When you have enough information to answer the current task, call submit_task_result with that result immediately.
            - For schedule-related tasks, prefer get_schedule_overview and rag_search over web search when schedule data is available.
            - If no schedule was uploaded or tools return no data, use the internet.
            - Do not generate information not present in tool results.
            - The result is the only artifact passed to the next step; include all relevant detail.
            - For "generate a personal schedule" tasks, make the schedule consistent, complete, without overlaps or missing timeslots.
            """;

    private static final String SUBMIT_SCHEMA = """
            {"type":"object","properties":{"result":{"type":"string",\
            "description":"The full task result (all gathered information)."}},\
            "required":["result"],"additionalProperties":false}""";

    private static final ToolSpec SUBMIT_SPEC = new ToolSpec(SUBMIT_TASK_RESULT,
            "Call this when the task is fully complete. Pass the complete result so it can be used by later steps. "
                    + "Do not use plain text to finish; you must call this tool.",
            SUBMIT_SCHEMA);

    private static final ToolSpec GENERATE_SPEC = new ToolSpec(GENERATE_SCHEDULE,
            "Generate a personal schedule for the user from the information gathered so far. "
                    + "Can be called multiple times to refine the schedule.",
            ToolSpec.EMPTY_SCHEMA);

    private final LlmService llmService;
    private final ToolRegistry toolRegistry;
    private final ScheduleSynthesizer synthesizer;
    private final AgentProperties properties;
    private final ConciergeMetrics metrics;
    private final List<ToolSpec> toolSpecs;

    public ExecutorAgent(LlmService llmService, ToolRegistry toolRegistry, ScheduleSynthesizer synthesizer,
                         AgentProperties properties, ConciergeMetrics metrics) {
        for (String reserved : List.of(SUBMIT_TASK_RESULT, GENERATE_SCHEDULE)) {
            if (toolRegistry.contains(reserved)) {
                throw new IllegalStateException("Tool name '" + reserved + "' is reserved by the executor");
            }
        }
        this.llmService = llmService;
        this.toolRegistry = toolRegistry;
        this.synthesizer = synthesizer;
        this.properties = properties;
        this.metrics = metrics;
        List<ToolSpec> specs = new ArrayList<>(toolRegistry.toolSpecs());
        specs.add(SUBMIT_SPEC);
        specs.add(GENERATE_SPEC);
        this.toolSpecs = List.copyOf(specs);
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Runs the loop for the state's IN_PROGRESS task until it is COMPLETED or FAILED.
     *
     * @throws IllegalStateException            if no task is in progress
     * @throws ToolErrorBudgetExceededException if the task records too many tool errors
     */
    @Override
    public AgentState advance(AgentState state) {
        Task task = state.currentTask()
                .orElseThrow(() -> new IllegalStateException("No task in progress for conversation " + state.conversationId()));
        log.info("Executing task {}: {}", task.id(), abbreviate(task.description(), 80));

        int errors = 0;
        int turn = 0;
        while (true) {
            turn++;
            if (turn > properties.getMaxTaskTurns()) {
                log.warn("Task {} hit max turns ({}), marking failed", task.id(), properties.getMaxTaskTurns());
                task.fail();
                return state;
            }

            log.debug("Task {} turn {}", task.id(), turn);
            ModelTurn response = llmService.toolCall(SYSTEM_PROMPT, buildUserPrompt(state, task),
                    task.executionHistory(), toolSpecs);
            task.appendHistory(ExecutionEntry.assistant(response.content(), response.toolCalls()));

            if (!response.hasToolCalls()) {
                log.debug("Task {} turn {} returned no tool calls", task.id(), turn);
                if (!response.content().isBlank()) {
                    task.appendHistory(ExecutionEntry.assistantText(response.content()));
                }
                continue;
            }

            for (ToolCallRequest call : response.toolCalls()) {
                try {
                    if (execute(state, task, call)) {
                        return state;
                    }
                } catch (RuntimeException e) {
                    errors++;
                    metrics.recordToolCall(call.name(), "error");
                    if (errors > properties.getMaxToolErrors()) {
                        throw new ToolErrorBudgetExceededException(task.id(), errors, e);
                    }
                    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    log.warn("Tool {} failed for task {} ({} of {} errors): {}", call.name(), task.id(),
                            errors, properties.getMaxToolErrors(), message);
                    task.appendHistory(ExecutionEntry.toolResult(call.callId(), call.name(), "Error: " + message));
                }
            }
        }
    }

    /**
     * Runs one tool call and records its result.
     *
     * @return true when the call completed the task
     */
    private boolean execute(AgentState state, Task task, ToolCallRequest call) {
        String name = call.name() != null ? call.name() : "";
        switch (name) {
            case SUBMIT_TASK_RESULT -> {
                Map<String, Object> args = toolRegistry.parseArguments(name, call.arguments());
                Object result = args.get("result");
                task.complete(result != null ? result.toString().trim() : "");
                metrics.recordToolCall(name, "success");
                log.info("Task {} completed; result length={}", task.id(), task.result().length());
                return true;
            }
            case GENERATE_SCHEDULE -> {
                String schedule = synthesizer.synthesize(state, task);
                state.setSynthesizedSchedule(schedule);
                task.appendHistory(ExecutionEntry.toolResult(call.callId(), name, schedule));
                metrics.recordToolCall(name, "success");
                return false;
            }
            default -> {
                log.info("Calling tool {} with args {}", name, abbreviate(String.valueOf(call.arguments()), 100));
                String result = toolRegistry.invoke(name, call.arguments(), state.conversationId());
                task.appendHistory(ExecutionEntry.toolResult(call.callId(), name, result));
                metrics.recordToolCall(name, "success");
                return false;
            }
        }
    }

    static String buildUserPrompt(AgentState state, Task task) {
        return "Previous tasks descriptions and their results:\n"
                + completedTaskLines(state) + "\n"
                + "Synthesized schedule so far: " + state.synthesizedSchedule() + "\n"
                + "Current task: " + task.description() + "\n";
    }

    /** {@code Task {id}: {description}: {result}} per completed task, ascending by id. */
    static String completedTaskLines(AgentState state) {
        return state.completedTasks().stream()
                .sorted(Comparator.comparingInt(Task::id))
                .map(t -> "Task " + t.id() + ": " + t.description() + ": " + t.result())
                .collect(Collectors.joining("\n"));
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
