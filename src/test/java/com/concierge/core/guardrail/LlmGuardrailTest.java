package com.concierge.core.guardrail;

import com.concierge.core.llm.LlmParseException;
import com.concierge.core.llm.LlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmGuardrailTest {

    private LlmService llmService;
    private LlmGuardrail guardrail;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        guardrail = new LlmGuardrail(llmService);
    }

    private void classifierReturns(GuardrailVerdict verdict) {
        when(llmService.structuredCall(anyString(), anyString(), eq(GuardrailVerdict.class))).thenReturn(verdict);
    }

    @Nested
    @DisplayName("Input")
    class Input {

        @Test
        @DisplayName("blank input is rejected without a model call")
        void blank() {
            GuardrailVerdict verdict = guardrail.checkInput("   ");
            assertFalse(verdict.allowed());
            assertEquals(LlmGuardrail.INPUT_REJECT_MESSAGE, verdict.message());
            verifyNoInteractions(llmService);
        }

        @Test
        @DisplayName("allowed messages pass")
        void allowed() {
            classifierReturns(new GuardrailVerdict(true, null));
            assertTrue(guardrail.checkInput("hi").allowed());
        }

        @Test
        @DisplayName("rejection carries the classifier's message")
        void rejectedWithMessage() {
            classifierReturns(GuardrailVerdict.reject("Let's talk about the conference instead."));

            GuardrailVerdict verdict = guardrail.checkInput("give me a lasagna recipe");

            assertFalse(verdict.allowed());
            assertEquals("Let's talk about the conference instead.", verdict.message());
        }

        @Test
        @DisplayName("rejection without a message uses the default")
        void rejectedWithoutMessage() {
            classifierReturns(GuardrailVerdict.reject(" "));
            assertEquals(LlmGuardrail.INPUT_REJECT_MESSAGE, guardrail.checkInput("spam").message());
        }

        @Test
        @DisplayName("classifier failure fails open")
        void failOpen() {
            when(llmService.structuredCall(anyString(), anyString(), eq(GuardrailVerdict.class)))
                    .thenThrow(new LlmParseException("bad json"));
            assertTrue(guardrail.checkInput("hello").allowed());
        }

        @Test
        @DisplayName("long input is truncated before classification")
        void truncates() {
            classifierReturns(GuardrailVerdict.allow());
            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);

            guardrail.checkInput("x".repeat(5000));

            verify(llmService).structuredCall(anyString(), prompt.capture(), eq(GuardrailVerdict.class));
            assertEquals("Message: ".length() + 2000, prompt.getValue().length());
        }
    }

    @Nested
    @DisplayName("Output")
    class Output {

        @Test
        @DisplayName("blank output passes without a model call")
        void blank() {
            assertTrue(guardrail.checkOutput("").allowed());
            verifyNoInteractions(llmService);
        }

        @Test
        @DisplayName("rejected output always uses the canned message")
        void cannedMessage() {
            classifierReturns(GuardrailVerdict.reject("classifier wording"));

            GuardrailVerdict verdict = guardrail.checkOutput("something harmful");

            assertFalse(verdict.allowed());
            assertEquals(LlmGuardrail.OUTPUT_REJECT_MESSAGE, verdict.message());
        }

        @Test
        @DisplayName("output is classified as a reply")
        void replyPrefix() {
            classifierReturns(GuardrailVerdict.allow());
            guardrail.checkOutput("Your schedule");
            verify(llmService).structuredCall(anyString(), eq("Reply: Your schedule"), eq(GuardrailVerdict.class));
        }
    }
}
