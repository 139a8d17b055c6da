package com.concierge.core.agents;

import com.concierge.core.llm.LlmService;
import com.concierge.core.model.PlanDescription;
import com.concierge.core.state.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Breaks the intake summary into an ordered list of single-purpose task descriptions.
 * Task ids are assigned later, when the orchestrator builds the plan.
 */
@Component
public class PlanningAgent implements ConciergeAgent {

    private static final Logger log = LoggerFactory.getLogger(PlanningAgent.class);

    public static final String NAME = "PlanningAgent";

    private static final String SYSTEM_PROMPT = """
            You are the Planning Agent for a Conference Concierge System.
            Your job is to break down a user's request into a logical sequence of actionable tasks.
            Your plan will be executed by the Executor Agent.
            Your final instruction to the Executor is to use the generate_schedule tool to generate a personal schedule
            that the user could follow to attend the conference.

            INPUT: The user's request in the form of "User: {user_request}".

            TOOLS AVAILABLE TO THE EXECUTOR AGENT:
            1. Look up the uploaded conference schedule (overview and semantic search).
            2. Search the internet for information on the web.
            3. Search the internet for places, venues, or restaurants.
            4. Synthesize the results gathered so far into a personal schedule for the user.

            RULES:
            - Output a JSON object with a "plan_description" key holding the list of task descriptions.
            - Each task description should be single-purpose and actionable.

            EXAMPLE OUTPUT:
            {
              "plan_description": [
                "Check the internal database for the conference schedule.",
                "Search the internet for information on the web about the conference.",
                "Find talks related to machine learning.",
                "Take into account the user's availability to attend the conference.",
                "Find highly-rated lunch spots near the conference venue.",
                "Taking into account the gathered information, build a personal schedule for the user."
              ]
            }
            """;

    private final LlmService llmService;

    public PlanningAgent(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AgentState advance(AgentState state) {
        log.info("Planning from summary ({} chars)", state.queryToPlan().length());
        PlanDescription plan = llmService.structuredCall(SYSTEM_PROMPT, "User: " + state.queryToPlan(), PlanDescription.class);
        List<String> tasks = plan.planDescription().stream()
                .filter(d -> d != null && !d.isBlank())
                .map(String::trim)
                .toList();
        state.setPlanDescription(tasks);
        log.info("Plan generated ({} tasks)", tasks.size());
        return state;
    }
}
