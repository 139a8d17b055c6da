package com.concierge.dispatch.cli;

import com.concierge.core.model.InteractionMessage;
import com.concierge.core.model.Task;
import com.concierge.core.persistence.CheckpointQueryService;
import com.concierge.core.state.AgentState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: concierge inspect &lt;conversation-id&gt; &lt;step&gt;
 * <p>
 * Restores the state recorded at one checkpoint and prints the intake details,
 * the plan with task outcomes, the synthesized schedule and the last message.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Show the state recorded at a checkpoint")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Conversation ID")
    private String conversationId;

    @Parameters(index = "1", description = "Checkpoint step index (see timeline)")
    private int step;

    private final CheckpointQueryService queryService;

    public InspectCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var stateOpt = queryService.getStateAtStep(conversationId, step);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error("No checkpoint " + step + " for conversation: " + conversationId);
            return;
        }
        AgentState state = stateOpt.get();

        System.out.println();
        System.out.println("STEP " + step + " OF " + conversationId);
        System.out.println("──────────────────────────────────");
        System.out.println("  Messages:        " + state.interactionHistory().size());
        System.out.println("  Query to plan:   " + orDash(state.queryToPlan()));
        System.out.println("  Missing details: " + joinOrDash(state.necessaryDetailsRequired()));
        System.out.println("  Optional:        " + joinOrDash(state.optionalDetails()));

        if (!state.plan().isEmpty()) {
            System.out.println();
            ConsoleOutput.plan(state.plan());
            for (Task task : state.plan()) {
                if (!task.result().isBlank()) {
                    System.out.println("    " + task.id() + " result: " + task.result().strip());
                }
                if (!task.executionHistory().isEmpty()) {
                    System.out.println("    " + task.id() + " history entries: " + task.executionHistory().size());
                }
            }
        }

        if (!state.synthesizedSchedule().isBlank()) {
            System.out.println();
            System.out.println("  SCHEDULE:");
            System.out.println(state.synthesizedSchedule());
        }

        state.lastMessage().ifPresent(message -> {
            System.out.println();
            System.out.println("  Last message (" + role(message) + "): " + message.content());
        });
    }

    private static String role(InteractionMessage message) {
        return message.isAssistant() ? "assistant" : "user";
    }

    private static String orDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }

    private static String joinOrDash(List<String> items) {
        return items.isEmpty() ? "-" : String.join(", ", items);
    }
}
