package com.concierge.dispatch.cli;

import com.concierge.core.events.ConciergeEvent;
import com.concierge.core.model.Task;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the concierge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CONFERENCE CONCIERGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CONCIERGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void reply(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Concierge:|@"));
        System.out.println(message);
        System.out.println();
    }

    public static void plan(List<Task> plan) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Plan|@"));
        for (Task task : plan) {
            String status = switch (task.status()) {
                case COMPLETED -> "@|fg(green) COMPLETED  |@";
                case FAILED -> "@|fg(red) FAILED     |@";
                case IN_PROGRESS -> "@|fg(yellow) IN_PROGRESS|@";
                case PENDING -> "@|fg(white) PENDING    |@";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + status + " " + task.id() + ". " + task.description()));
        }
    }

    public static void event(ConciergeEvent event) {
        String prefix = switch (event.eventType()) {
            case ConciergeEvent.TURN_STARTED, ConciergeEvent.TURN_COMPLETED -> "@|fg(cyan) [TURN]|@";
            case ConciergeEvent.PHASE_INTAKE, ConciergeEvent.PHASE_PLANNING -> "@|bold,fg(yellow) [PHASE]|@";
            case ConciergeEvent.PLAN_CREATED -> "@|fg(magenta) [PLAN]|@";
            case ConciergeEvent.TASK_STARTED -> "@|fg(blue) [TASK]|@";
            case ConciergeEvent.TASK_COMPLETED -> "@|fg(green),bold [TASK]|@";
            case ConciergeEvent.TASK_FAILED -> "@|fg(red),bold [TASK]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String detail = event.taskId() != null
                ? event.eventType() + " #" + event.taskId() + " " + describe(event)
                : event.eventType() + " " + describe(event);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + detail.strip()));
    }

    private static String describe(ConciergeEvent event) {
        Object description = event.payload().get("description");
        if (description != null) {
            return description.toString();
        }
        Object outcome = event.payload().getOrDefault("outcome", event.payload().get("status"));
        return outcome != null ? "(" + outcome + ")" : "";
    }
}
