package com.concierge.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.io.Serializable;
import java.util.List;

/**
 * Structured output of the intake agent: either ask the user for more
 * details or hand a summary to the planner.
 *
 * @param action                   "clarify" or "plan"
 * @param necessaryDetailsRequired missing details that block planning
 * @param optionalDetails          details that would help but are not required
 * @param userMessage              clarifying message shown to the user
 * @param summary                  concise request summary for the planner
 */
public record IntakeDecision(
    @JsonPropertyDescription("Either 'clarify' (need more from the user) or 'plan' (ready to plan).")
    String action,

    @JsonProperty("necessary_details_required")
    @JsonPropertyDescription("When action is 'clarify', the necessary details still missing.")
    List<String> necessaryDetailsRequired,

    @JsonProperty("optional_details")
    @JsonAlias("optional_details_required")
    @JsonPropertyDescription("When action is 'clarify', optional details that would help build a personal schedule.")
    List<String> optionalDetails,

    @JsonProperty("user_message")
    @JsonPropertyDescription("When action is 'clarify', the friendly message to show the user.")
    String userMessage,

    @JsonPropertyDescription("When action is 'plan', the concise summary for the planning agent.")
    String summary
) implements Serializable {

    public static final String CLARIFY = "clarify";
    public static final String PLAN = "plan";

    public IntakeDecision {
        necessaryDetailsRequired = necessaryDetailsRequired != null ? List.copyOf(necessaryDetailsRequired) : List.of();
        optionalDetails = optionalDetails != null ? List.copyOf(optionalDetails) : List.of();
    }

    /** Anything other than an explicit "plan" is treated as a request for clarification. */
    public boolean isPlan() {
        return action != null && PLAN.equalsIgnoreCase(action.trim());
    }
}
