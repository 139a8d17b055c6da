package com.concierge.dispatch.cli;

import com.concierge.core.engine.ConversationService;
import com.concierge.core.engine.TurnHandle;
import com.concierge.core.retrieval.RetrievalEngine;
import com.concierge.core.state.AgentState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletionException;

/**
 * CLI command: concierge chat &lt;conversation-id&gt; &lt;message&gt; [--schedule FILE]
 * <p>
 * Optionally indexes a schedule for the conversation, runs one turn while
 * streaming its progress, then prints the assistant's reply and the plan.
 */
@Command(name = "chat", mixinStandardHelpOptions = true, description = "Send one message to the concierge")
@Component
public class ChatCommand implements Runnable {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(200);

    @Parameters(index = "0", description = "Conversation ID")
    private String conversationId;

    @Parameters(index = "1", description = "Your message")
    private String message;

    @Option(names = {"--schedule", "-s"}, description = "Schedule JSON file to index before the turn")
    private Path schedule;

    private final ConversationService conversationService;
    private final RetrievalEngine retrievalEngine;

    public ChatCommand(ConversationService conversationService, RetrievalEngine retrievalEngine) {
        this.conversationService = conversationService;
        this.retrievalEngine = retrievalEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (schedule != null) {
            ConsoleOutput.info(retrievalEngine.indexFile(conversationId, schedule));
        }

        TurnHandle handle = conversationService.submitTurn(conversationId, message);
        try {
            while (!handle.result().isDone()) {
                handle.progress().poll(POLL_INTERVAL).ifPresent(ConsoleOutput::event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for the turn to finish");
            return;
        }
        handle.progress().drain().forEach(ConsoleOutput::event);

        AgentState state;
        try {
            state = handle.result().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ConsoleOutput.error("Turn failed: " + cause.getMessage());
            return;
        }

        System.out.println();
        state.lastMessage().ifPresent(reply -> ConsoleOutput.reply(reply.content()));
        if (!state.plan().isEmpty()) {
            ConsoleOutput.plan(state.plan());
        }
        if (handle.progress().droppedCount() > 0) {
            ConsoleOutput.info(handle.progress().droppedCount() + " progress events were dropped.");
        }
    }
}
