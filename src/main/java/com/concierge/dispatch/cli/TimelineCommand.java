package com.concierge.dispatch.cli;

import com.concierge.core.persistence.CheckpointQueryService;
import com.concierge.core.persistence.StateCheckpoint;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: concierge timeline &lt;conversation-id&gt;
 * <p>
 * Lists every checkpoint of a conversation in step order with the agent
 * that produced it and the recorded event.
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "Show a conversation's checkpoint timeline")
@Component
public class TimelineCommand implements Runnable {

    @Parameters(index = "0", description = "Conversation ID")
    private String conversationId;

    private final CheckpointQueryService queryService;

    public TimelineCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<StateCheckpoint> checkpoints = queryService.listCheckpoints(conversationId);
        if (checkpoints.isEmpty()) {
            ConsoleOutput.error("No checkpoints found for conversation: " + conversationId);
            return;
        }

        ConsoleOutput.info("Timeline for conversation " + conversationId);
        System.out.println();
        System.out.printf("  %-4s %-16s %-18s %-6s %s%n", "#", "AGENT", "EVENT", "TASK", "TIMESTAMP");
        System.out.println("  " + "-".repeat(72));

        for (StateCheckpoint cp : checkpoints) {
            String agent = cp.agentName() != null ? cp.agentName() : "-";
            String event = cp.event() != null ? cp.event() : "-";
            Object taskId = cp.metadata().get(StateCheckpoint.TASK_ID);
            System.out.printf("  %-4d %-16s %-18s %-6s %s%n", cp.stepIndex(), agent, event,
                    taskId != null ? taskId : "-", cp.timestamp());
        }

        System.out.println();
        ConsoleOutput.info(checkpoints.size() + " checkpoint" + (checkpoints.size() != 1 ? "s" : "") + " recorded.");
    }
}
