package com.concierge.dispatch.cli;

import com.concierge.core.retrieval.RetrievalEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * CLI command: concierge index &lt;conversation-id&gt; &lt;file&gt;
 * <p>
 * Indexes a pretalx-style schedule file for semantic search within the conversation.
 */
@Command(name = "index", mixinStandardHelpOptions = true, description = "Index a conference schedule file")
@Component
public class IndexCommand implements Runnable {

    @Parameters(index = "0", description = "Conversation ID")
    private String conversationId;

    @Parameters(index = "1", description = "Schedule JSON file")
    private Path file;

    private final RetrievalEngine retrievalEngine;

    public IndexCommand(RetrievalEngine retrievalEngine) {
        this.retrievalEngine = retrievalEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        String status = retrievalEngine.indexFile(conversationId, file);
        if (status.startsWith("Indexed ")) {
            ConsoleOutput.success(status);
        } else {
            ConsoleOutput.error(status);
        }
    }
}
