package com.concierge.core.agents;

import com.concierge.core.llm.LlmParseException;
import com.concierge.core.llm.LlmRefusalException;
import com.concierge.core.llm.LlmService;
import com.concierge.core.model.IntakeDecision;
import com.concierge.core.model.InteractionMessage;
import com.concierge.core.state.AgentState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IntakeAgentTest {

    private LlmService llmService;
    private IntakeAgent agent;
    private AgentState state;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        agent = new IntakeAgent(llmService);
        state = new AgentState("conv-1");
    }

    private void decides(IntakeDecision decision) {
        when(llmService.structuredCall(anyString(), anyList(), eq(IntakeDecision.class))).thenReturn(decision);
    }

    @Test
    @DisplayName("a greeting leads to one clarifying message and no plan query")
    void greetingClarifies() {
        state.appendUserMessage("hi");
        decides(new IntakeDecision("clarify", List.of("conference", "interests"), List.of("dates"),
                "  Hi! Which conference are you attending?  ", null));

        agent.advance(state);

        assertEquals("", state.queryToPlan());
        assertEquals(List.of("conference", "interests"), state.necessaryDetailsRequired());
        assertEquals(List.of("dates"), state.optionalDetails());
        assertEquals(2, state.interactionHistory().size());
        assertEquals(InteractionMessage.assistant("Hi! Which conference are you attending?"),
                state.lastMessage().orElseThrow());
    }

    @Test
    @DisplayName("clarify without details or message falls back to defaults")
    void clarifyDefaults() {
        state.appendUserMessage("hi");
        decides(new IntakeDecision("clarify", null, null, " ", null));

        agent.advance(state);

        assertEquals(IntakeAgent.DEFAULT_MISSING, state.necessaryDetailsRequired());
        assertEquals(IntakeAgent.DEFAULT_CLARIFYING_MESSAGE, state.lastMessage().orElseThrow().content());
    }

    @Test
    @DisplayName("plan stores the trimmed summary and clears the detail lists")
    void plan() {
        state.appendUserMessage("DevConf 2025 in Berlin, I like AI");
        state.setNecessaryDetailsRequired(List.of("interests"));
        decides(new IntakeDecision("plan", null, null, null, "  DevConf 2025 Berlin, interested in AI  "));

        agent.advance(state);

        assertEquals("DevConf 2025 Berlin, interested in AI", state.queryToPlan());
        assertTrue(state.necessaryDetailsRequired().isEmpty());
        assertEquals(1, state.interactionHistory().size());
    }

    @Test
    @DisplayName("plan without a summary is a parse failure")
    void planWithoutSummary() {
        state.appendUserMessage("x");
        decides(new IntakeDecision("plan", null, null, null, " "));

        assertThrows(LlmParseException.class, () -> agent.advance(state));
    }

    @Test
    @DisplayName("the whole conversation is sent to the model")
    void sendsHistory() {
        state.appendUserMessage("hi");
        state.appendAssistantMessage("Which conference?");
        state.appendUserMessage("DevConf");
        decides(new IntakeDecision("clarify", null, null, "Interests?", null));

        agent.advance(state);

        verify(llmService).structuredCall(anyString(), argThat((List<InteractionMessage> h) -> h.size() == 3),
                eq(IntakeDecision.class));
    }

    @Test
    @DisplayName("refusals propagate")
    void refusal() {
        state.appendUserMessage("x");
        when(llmService.structuredCall(anyString(), anyList(), eq(IntakeDecision.class)))
                .thenThrow(new LlmRefusalException("IntakeDecision", "no"));

        assertThrows(LlmRefusalException.class, () -> agent.advance(state));
    }
}
