package com.concierge.core.agents;

import com.concierge.core.llm.LlmService;
import com.concierge.core.model.ExecutionEntry;
import com.concierge.core.model.Task;
import com.concierge.core.state.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Turns completed task results into the personal schedule shown to the user.
 * Backs the executor's {@code generate_schedule} tool.
 */
@Component
public class ScheduleSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ScheduleSynthesizer.class);

    private static final String SYSTEM_PROMPT = """
            You are the Synthesizer for a Conference Concierge System.
            Your job is to take the completed task results and produce one final, personalized conference schedule for the user.

            INPUT:
            The results of the completed tasks.
            Previously synthesized schedule.
            The execution history of the current task.

            RULES:
            - Only use information present in the task results and tool outputs. If you cannot generate the schedule, say so.
            - The schedule must be complete: include every session/talk with time and speaker needed to fulfill the user's request.
              Include the previously synthesized schedule.
            - Write clearly. Use sections or bullets.
            """;

    private final LlmService llmService;

    public ScheduleSynthesizer(LlmService llmService) {
        this.llmService = llmService;
    }

    /**
     * Produces a new schedule from the completed tasks, the schedule so far and
     * {@code current}'s execution history. Does not modify the state.
     */
    public String synthesize(AgentState state, Task current) {
        String prompt = ExecutorAgent.completedTaskLines(state)
                + "\nSynthesized schedule so far: " + state.synthesizedSchedule()
                + "\nCurrent task execution history:\n" + renderHistory(current);
        String schedule = llmService.complete(SYSTEM_PROMPT, prompt);
        log.info("Synthesized schedule ({} chars) during task {}", schedule.length(), current.id());
        return schedule;
    }

    static String renderHistory(Task task) {
        return task.executionHistory().stream()
                .map(ScheduleSynthesizer::render)
                .collect(Collectors.joining("\n"));
    }

    private static String render(ExecutionEntry entry) {
        if (entry.isTool()) {
            return "tool[" + entry.toolName() + "]: " + entry.content();
        }
        String calls = entry.toolCalls().stream()
                .map(c -> c.name() + "(" + c.arguments() + ")")
                .collect(Collectors.joining(", "));
        return calls.isEmpty() ? "assistant: " + entry.content()
                : "assistant: " + entry.content() + " [calls: " + calls + "]";
    }
}
