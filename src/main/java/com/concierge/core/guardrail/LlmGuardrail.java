package com.concierge.core.guardrail;

import com.concierge.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link Guardrail} backed by an LLM classifier.
 * <p>
 * Blank input is rejected without a model call; blank output passes. When the
 * classifier itself fails the check fails open: the text is allowed and the
 * failure is logged.
 */
@Component
public class LlmGuardrail implements Guardrail {

    private static final Logger log = LoggerFactory.getLogger(LlmGuardrail.class);

    public static final String INPUT_REJECT_MESSAGE =
            "Please keep your message on the topic of conference schedule planning.";
    public static final String OUTPUT_REJECT_MESSAGE =
            "I can't provide that. How can I help with your conference schedule?";

    private static final int MAX_CHECKED_CHARS = 2000;

    private static final String SYSTEM_PROMPT = """
            You classify user messages for a conference schedule planning assistant.
            Allow (allowed = true): anything on-topic (schedule, talks, planning), greetings (e.g. hi, hello, hey there),
            small talk, thanks, or harmless conversation openers.
            Reject (allowed = false) only: harmful/abusive content, or messages that are clearly off-topic and cannot
            lead to schedule help (e.g. recipe requests, sports scores).
            When in doubt, allow.
            When rejecting, set "message" to a short, polite reply steering the user back to schedule planning.
            """;

    private final LlmService llmService;

    public LlmGuardrail(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public GuardrailVerdict checkInput(String userMessage) {
        if (userMessage == null || userMessage.isBlank()) {
            return GuardrailVerdict.reject(INPUT_REJECT_MESSAGE);
        }
        return classify("Message: " + truncate(userMessage), INPUT_REJECT_MESSAGE, "input");
    }

    @Override
    public GuardrailVerdict checkOutput(String assistantReply) {
        if (assistantReply == null || assistantReply.isBlank()) {
            return GuardrailVerdict.allow();
        }
        GuardrailVerdict verdict = classify("Reply: " + truncate(assistantReply), OUTPUT_REJECT_MESSAGE, "output");
        // the classifier's own wording is never shown in place of an assistant reply
        return verdict.allowed() ? verdict : GuardrailVerdict.reject(OUTPUT_REJECT_MESSAGE);
    }

    private GuardrailVerdict classify(String prompt, String fallbackMessage, String stage) {
        GuardrailVerdict verdict;
        try {
            verdict = llmService.structuredCall(SYSTEM_PROMPT, prompt, GuardrailVerdict.class);
        } catch (RuntimeException e) {
            log.warn("Guardrail {} check failed, allowing: {}", stage, e.getMessage());
            return GuardrailVerdict.allow();
        }
        if (verdict.allowed()) {
            return GuardrailVerdict.allow();
        }
        String message = verdict.message() == null || verdict.message().isBlank()
                ? fallbackMessage : verdict.message();
        log.info("Guardrail rejected {}", stage);
        return GuardrailVerdict.reject(message);
    }

    private static String truncate(String text) {
        return text.length() <= MAX_CHECKED_CHARS ? text : text.substring(0, MAX_CHECKED_CHARS);
    }
}
