package com.concierge.core.agents;

import com.concierge.core.llm.LlmParseException;
import com.concierge.core.llm.LlmService;
import com.concierge.core.model.IntakeDecision;
import com.concierge.core.state.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides from the whole conversation whether there is enough to plan a schedule.
 * <p>
 * On "clarify" it records what is missing and appends one clarifying assistant
 * message; on "plan" it stores the request summary as {@code queryToPlan}.
 * Refusals and unparseable decisions propagate from {@link LlmService}.
 */
@Component
public class IntakeAgent implements ConciergeAgent {

    private static final Logger log = LoggerFactory.getLogger(IntakeAgent.class);

    public static final String NAME = "IntakeAgent";

    static final List<String> DEFAULT_MISSING = List.of("need_more");

    static final String DEFAULT_CLARIFYING_MESSAGE =
            "Happy to help you plan your conference! Which conference are you attending "
            + "(name, year and location), and which topics or tracks interest you most?";

    private static final String SYSTEM_PROMPT = """
            You are the intake for a conference schedule assistant.
            Given the conversation so far, decide whether you have enough information to build a personal conference schedule.

            NECESSARY to proceed: conference identity (year, name, location) and at least one user interest (topic, track, or session type).
            OPTIONAL: exact dates, food/accommodation preferences, specific session titles.

            Output a single JSON object with:
            - "action": Either "clarify" or "plan".
            - If "clarify":
              1. Set "necessary_details_required" to the list of missing necessary items.
              2. Set "optional_details" to the list of additional details that can be helpful to build a personal schedule.
              3. Do not output "summary".
              4. Set "user_message" to ONE friendly, concise message asking for the missing necessary details
                 (and optionally inviting additional details).
            - If "plan":
              1. Set "summary" to a concise paragraph for the planning agent with all relevant details (conference, interests, preferences).
              2. Do not output "user_message"; leave "necessary_details_required" and "optional_details" empty.

            RULES:
            - For "clarify", write the exact message the user will see: friendly and inviting.
            - For "plan", summarize only what the user provided; do not invent or instruct the planner.
            """;

    private final LlmService llmService;

    public IntakeAgent(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AgentState advance(AgentState state) {
        log.info("Intake over {} history messages", state.interactionHistory().size());
        IntakeDecision decision = llmService.structuredCall(SYSTEM_PROMPT, state.interactionHistory(), IntakeDecision.class);

        if (decision.isPlan()) {
            String summary = decision.summary();
            if (summary == null || summary.isBlank()) {
                throw new LlmParseException("Intake chose 'plan' without a summary");
            }
            state.setNecessaryDetailsRequired(List.of());
            state.setOptionalDetails(List.of());
            state.setQueryToPlan(summary.trim());
            log.info("Intake action=plan, summary length={}", state.queryToPlan().length());
            return state;
        }

        state.setNecessaryDetailsRequired(decision.necessaryDetailsRequired().isEmpty()
                ? DEFAULT_MISSING : decision.necessaryDetailsRequired());
        state.setOptionalDetails(decision.optionalDetails());
        String message = decision.userMessage();
        state.appendAssistantMessage(message == null || message.isBlank() ? DEFAULT_CLARIFYING_MESSAGE : message.trim());
        log.info("Intake action=clarify, missing={}, optional={}",
                state.necessaryDetailsRequired(), state.optionalDetails());
        return state;
    }
}
