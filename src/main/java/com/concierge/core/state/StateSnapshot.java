package com.concierge.core.state;

import com.concierge.core.model.InteractionMessage;
import com.concierge.core.model.TaskSnapshot;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable deep copy of an {@link AgentState}.
 * <p>
 * All lists are unmodifiable copies; their elements are immutable records,
 * so consecutive snapshots may share them safely.
 */
public record StateSnapshot(
    String conversationId,
    List<String> necessaryDetailsRequired,
    List<String> optionalDetails,
    String queryToPlan,
    List<String> planDescription,
    List<TaskSnapshot> plan,
    String synthesizedSchedule,
    List<InteractionMessage> interactionHistory
) implements Serializable {

    public StateSnapshot {
        necessaryDetailsRequired = copy(necessaryDetailsRequired);
        optionalDetails = copy(optionalDetails);
        queryToPlan = queryToPlan != null ? queryToPlan : "";
        planDescription = copy(planDescription);
        plan = copy(plan);
        synthesizedSchedule = synthesizedSchedule != null ? synthesizedSchedule : "";
        interactionHistory = copy(interactionHistory);
    }

    private static <T> List<T> copy(List<T> source) {
        return source != null ? List.copyOf(source) : List.of();
    }
}
