package com.concierge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.io.Serializable;
import java.util.List;

/**
 * Structured output of the planning agent.
 *
 * @param planDescription ordered, single-purpose task descriptions
 */
public record PlanDescription(
    @JsonProperty("plan_description")
    @JsonPropertyDescription("Ordered list of tasks to execute to build a personal conference schedule.")
    List<String> planDescription
) implements Serializable {

    public PlanDescription {
        planDescription = planDescription != null ? List.copyOf(planDescription) : List.of();
    }
}
