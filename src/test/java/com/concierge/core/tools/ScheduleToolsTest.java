package com.concierge.core.tools;

import com.concierge.core.retrieval.RetrievalEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ScheduleToolsTest {

    private RetrievalEngine engine;

    @BeforeEach
    void setUp() {
        engine = mock(RetrievalEngine.class);
    }

    @Nested
    @DisplayName("rag_search")
    class Search {

        @Test
        @DisplayName("queries the engine for the injected session")
        void queriesSession() {
            when(engine.query("conv-1", "rag")).thenReturn("--- Result 1 ---");
            var tool = new ScheduleSearchTool(engine);

            assertTrue(tool.sessionScoped());
            assertEquals("--- Result 1 ---", tool.call(Map.of("query", "rag", ConciergeTool.SESSION_ID, "conv-1")));
        }

        @Test
        @DisplayName("without a session it explains instead of searching")
        void noSession() {
            var tool = new ScheduleSearchTool(engine);
            var args = new HashMap<String, Object>();
            args.put("query", "rag");
            args.put(ConciergeTool.SESSION_ID, null);

            assertEquals(ScheduleSearchTool.NO_SESSION, tool.call(args));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("a blank query is rejected")
        void blankQuery() {
            var tool = new ScheduleSearchTool(engine);
            assertThrows(IllegalArgumentException.class,
                    () -> tool.call(Map.of("query", " ", ConciergeTool.SESSION_ID, "conv-1")));
        }

        @Test
        @DisplayName("through the registry the session comes from the conversation")
        void throughRegistry() {
            when(engine.query("conv-9", "ml")).thenReturn("hits");
            var registry = new ToolRegistry(java.util.List.of(new ScheduleSearchTool(engine)));

            assertEquals("hits", registry.invoke(ScheduleSearchTool.NAME, "{\"query\":\"ml\"}", "conv-9"));
        }
    }

    @Nested
    @DisplayName("get_schedule_overview")
    class Overview {

        @Test
        @DisplayName("returns the stored overview")
        void returnsOverview() {
            when(engine.overview("conv-1")).thenReturn("# DevConf");
            var tool = new ScheduleOverviewTool(engine);

            assertEquals("# DevConf", tool.call(Map.of(ConciergeTool.SESSION_ID, "conv-1")));
        }

        @Test
        @DisplayName("without a session it reports missing context")
        void noSession() {
            var tool = new ScheduleOverviewTool(engine);
            assertEquals("No session context.", tool.call(Map.of()));
            verifyNoInteractions(engine);
        }
    }
}
