package com.concierge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: chat, index, sessions, timeline, inspect.
 */
@Command(
        name = "concierge",
        mixinStandardHelpOptions = true,
        version = "Conference Concierge 0.1.0",
        description = "Plans a personal conference schedule with a team of LLM agents",
        subcommands = {
                ChatCommand.class,
                IndexCommand.class,
                SessionsCommand.class,
                TimelineCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ConciergeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
