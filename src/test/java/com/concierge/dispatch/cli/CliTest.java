package com.concierge.dispatch.cli;

import com.concierge.core.engine.ConversationService;
import com.concierge.core.engine.TurnHandle;
import com.concierge.core.events.ConciergeEvent;
import com.concierge.core.events.ProgressChannel;
import com.concierge.core.persistence.CheckpointQueryService;
import com.concierge.core.persistence.StateCheckpoint;
import com.concierge.core.retrieval.RetrievalEngine;
import com.concierge.core.state.AgentState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the concierge CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    /**
     * Exit code and everything written to stdout and stderr.
     */
    private record CliResult(int exitCode, String output) {}

    private ConversationService conversationService = mock(ConversationService.class);
    private RetrievalEngine retrievalEngine = mock(RetrievalEngine.class);
    private CheckpointQueryService queryService = mock(CheckpointQueryService.class);

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ChatCommand.class) {
                    return (K) new ChatCommand(conversationService, retrievalEngine);
                }
                if (cls == IndexCommand.class) {
                    return (K) new IndexCommand(retrievalEngine);
                }
                if (cls == TimelineCommand.class) {
                    return (K) new TimelineCommand(queryService);
                }
                if (cls == SessionsCommand.class) {
                    return (K) new SessionsCommand(queryService);
                }
                if (cls == InspectCommand.class) {
                    return (K) new InspectCommand(queryService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ConciergeCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static TurnHandle completedTurn(AgentState state, ConciergeEvent... events) {
        var progress = new ProgressChannel(16);
        for (ConciergeEvent event : events) {
            progress.accept(event);
        }
        return new TurnHandle(CompletableFuture.completedFuture(state), progress);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("chat"));
            assertTrue(result.output().contains("index"));
            assertTrue(result.output().contains("timeline"));
            assertTrue(result.output().contains("sessions"));
            assertTrue(result.output().contains("inspect"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Conference Concierge 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("CONFERENCE CONCIERGE"));
            assertTrue(result.output().contains("Usage"));
        }
    }

    // =====================================================================
    //  chat
    // =====================================================================

    @Nested
    @DisplayName("chat")
    class ChatTests {

        @Test
        @DisplayName("prints progress, the reply and the plan")
        void printsReplyAndPlan() {
            var state = new AgentState("conv-1");
            state.appendUserMessage("DevConf, AI");
            state.setPlanDescription(List.of("Find AI talks"));
            state.constructPlan();
            state.task(0).start();
            state.task(0).complete("RAG talk");
            state.appendAssistantMessage("09:00 Keynote\n10:00 RAG in Practice");
            when(conversationService.submitTurn("conv-1", "DevConf, AI")).thenReturn(completedTurn(state,
                    ConciergeEvent.of(ConciergeEvent.TASK_STARTED, "conv-1", 0, Map.of("description", "Find AI talks"))));

            CliResult result = execute("chat", "conv-1", "DevConf, AI");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("task.started #0 Find AI talks"));
            assertTrue(result.output().contains("10:00 RAG in Practice"));
            assertTrue(result.output().contains("0. Find AI talks"));
            verifyNoInteractions(retrievalEngine);
        }

        @Test
        @DisplayName("--schedule indexes before the turn")
        void indexesSchedule() {
            var state = new AgentState("conv-1");
            state.appendAssistantMessage("Which conference?");
            when(retrievalEngine.indexFile(eq("conv-1"), any(Path.class)))
                    .thenReturn("Indexed 12 sessions for RAG and saved schedule overview.");
            when(conversationService.submitTurn(anyString(), anyString())).thenReturn(completedTurn(state));

            CliResult result = execute("chat", "conv-1", "hi", "--schedule", "schedule.json");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Indexed 12 sessions"));
            verify(retrievalEngine).indexFile("conv-1", Path.of("schedule.json"));
        }

        @Test
        @DisplayName("a failed turn is reported")
        void failedTurn() {
            when(conversationService.submitTurn(anyString(), anyString())).thenReturn(new TurnHandle(
                    CompletableFuture.failedFuture(new IllegalStateException("model unavailable")),
                    new ProgressChannel(4)));

            CliResult result = execute("chat", "conv-1", "hi");

            assertTrue(result.output().contains("Turn failed: model unavailable"));
        }

        @Test
        @DisplayName("missing arguments fail parsing")
        void missingArguments() {
            CliResult result = execute("chat", "conv-1");
            assertNotEquals(0, result.exitCode());
        }
    }

    // =====================================================================
    //  index and timeline
    // =====================================================================

    @Nested
    @DisplayName("index")
    class IndexTests {

        @Test
        @DisplayName("reports success")
        void success() {
            when(retrievalEngine.indexFile(anyString(), any(Path.class)))
                    .thenReturn("Indexed 3 sessions for RAG and saved schedule overview.");

            CliResult result = execute("index", "conv-1", "schedule.json");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Indexed 3 sessions"));
        }

        @Test
        @DisplayName("reports status strings as errors")
        void failure() {
            when(retrievalEngine.indexFile(anyString(), any(Path.class)))
                    .thenReturn(RetrievalEngine.NOT_A_SCHEDULE);

            CliResult result = execute("index", "conv-1", "talks.json");

            assertTrue(result.output().contains(RetrievalEngine.NOT_A_SCHEDULE));
        }
    }

    @Nested
    @DisplayName("timeline")
    class TimelineTests {

        @Test
        @DisplayName("lists checkpoints with agent, event and task")
        void listsCheckpoints() {
            var snapshot = new AgentState("conv-1").snapshot();
            Instant now = Instant.parse("2025-05-01T09:00:00Z");
            when(queryService.listCheckpoints("conv-1")).thenReturn(List.of(
                    new StateCheckpoint(0, snapshot, null, now, Map.of(StateCheckpoint.EVENT, "user_input")),
                    new StateCheckpoint(1, snapshot, "ExecutorAgent", now,
                            Map.of(StateCheckpoint.EVENT, "after_execution", StateCheckpoint.TASK_ID, 0))));

            CliResult result = execute("timeline", "conv-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("user_input"));
            assertTrue(result.output().contains("ExecutorAgent"));
            assertTrue(result.output().contains("after_execution"));
            assertTrue(result.output().contains("2 checkpoints recorded."));
        }

        @Test
        @DisplayName("unknown conversations are reported")
        void unknownConversation() {
            when(queryService.listCheckpoints("conv-x")).thenReturn(List.of());

            CliResult result = execute("timeline", "conv-x");

            assertTrue(result.output().contains("No checkpoints found for conversation: conv-x"));
        }
    }

    // =====================================================================
    //  sessions and inspect
    // =====================================================================

    @Nested
    @DisplayName("sessions")
    class SessionsTests {

        @Test
        @DisplayName("lists conversations with step count, last event and last message")
        void listsConversations() {
            var state = new AgentState("conv-1");
            state.appendUserMessage("hi");
            state.appendAssistantMessage("Which conference?");
            Instant now = Instant.parse("2025-05-01T09:00:00Z");
            when(queryService.listConversationIds()).thenReturn(List.of("conv-1"));
            when(queryService.listCheckpoints("conv-1")).thenReturn(List.of(
                    new StateCheckpoint(0, state.snapshot(), null, now, Map.of(StateCheckpoint.EVENT, "user_input")),
                    new StateCheckpoint(1, state.snapshot(), "IntakeAgent", now,
                            Map.of(StateCheckpoint.EVENT, "after_intake"))));

            CliResult result = execute("sessions");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Conversations (1 of 1)"));
            assertTrue(result.output().contains("conv-1"));
            assertTrue(result.output().contains("after_intake"));
            assertTrue(result.output().contains("Which conference?"));
        }

        @Test
        @DisplayName("--limit keeps the most recent conversations")
        void limit() {
            when(queryService.listConversationIds()).thenReturn(List.of("conv-a", "conv-b", "conv-c"));
            when(queryService.listCheckpoints(anyString())).thenReturn(List.of());

            CliResult result = execute("sessions", "-n", "2");

            assertTrue(result.output().contains("Conversations (2 of 3)"));
        }

        @Test
        @DisplayName("reports when nothing was recorded")
        void empty() {
            when(queryService.listConversationIds()).thenReturn(List.of());

            CliResult result = execute("sessions");

            assertTrue(result.output().contains("No conversations found."));
        }
    }

    @Nested
    @DisplayName("inspect")
    class InspectTests {

        @Test
        @DisplayName("prints the intake details, plan and schedule recorded at a step")
        void printsState() {
            var state = new AgentState("conv-1");
            state.appendUserMessage("DevConf, AI");
            state.setQueryToPlan("DevConf, AI talks");
            state.setOptionalDetails(List.of("dietary needs"));
            state.setPlanDescription(List.of("Find AI talks"));
            state.constructPlan();
            state.task(0).start();
            state.task(0).complete("RAG in Practice");
            state.setSynthesizedSchedule("10:00 RAG in Practice");
            when(queryService.getStateAtStep("conv-1", 4)).thenReturn(Optional.of(state));

            CliResult result = execute("inspect", "conv-1", "4");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("STEP 4 OF conv-1"));
            assertTrue(result.output().contains("DevConf, AI talks"));
            assertTrue(result.output().contains("dietary needs"));
            assertTrue(result.output().contains("0. Find AI talks"));
            assertTrue(result.output().contains("0 result: RAG in Practice"));
            assertTrue(result.output().contains("10:00 RAG in Practice"));
            assertTrue(result.output().contains("Last message (user): DevConf, AI"));
        }

        @Test
        @DisplayName("unknown steps are reported")
        void unknownStep() {
            when(queryService.getStateAtStep("conv-1", 9)).thenReturn(Optional.empty());

            CliResult result = execute("inspect", "conv-1", "9");

            assertTrue(result.output().contains("No checkpoint 9 for conversation: conv-1"));
        }

        @Test
        @DisplayName("a non-numeric step fails parsing")
        void badStep() {
            CliResult result = execute("inspect", "conv-1", "latest");
            assertNotEquals(0, result.exitCode());
        }
    }
}
