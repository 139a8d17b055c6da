package com.concierge.dispatch.cli;

import com.concierge.core.model.InteractionMessage;
import com.concierge.core.persistence.CheckpointQueryService;
import com.concierge.core.persistence.StateCheckpoint;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: concierge sessions
 * <p>
 * Lists every conversation with recorded checkpoints: Conversation ID | Steps |
 * Last event | Last message (truncated).
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List conversations with checkpoints")
@Component
public class SessionsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final CheckpointQueryService queryService;

    public SessionsCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> conversationIds = queryService.listConversationIds();
        if (conversationIds.isEmpty()) {
            ConsoleOutput.info("No conversations found.");
            return;
        }

        List<String> display = conversationIds.size() > limit
                ? conversationIds.subList(conversationIds.size() - limit, conversationIds.size())
                : conversationIds;

        ConsoleOutput.info("Conversations (" + display.size() + " of " + conversationIds.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-6s %-16s %s%n", "CONVERSATION ID", "STEPS", "LAST EVENT", "LAST MESSAGE");
        System.out.println("  " + "-".repeat(80));

        for (String conversationId : display) {
            List<StateCheckpoint> checkpoints = queryService.listCheckpoints(conversationId);
            if (checkpoints.isEmpty()) {
                continue;
            }
            StateCheckpoint last = checkpoints.get(checkpoints.size() - 1);
            List<InteractionMessage> history = last.state().interactionHistory();
            String message = history.isEmpty() ? "-" : truncate(history.get(history.size() - 1).content(), 36);
            System.out.printf("  %-24s %-6d %-16s %s%n", conversationId, checkpoints.size(),
                    last.event() != null ? last.event() : "-", message);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isBlank()) return "-";
        String line = s.strip().replace('\n', ' ');
        return line.length() <= max ? line : line.substring(0, max - 3) + "...";
    }
}
