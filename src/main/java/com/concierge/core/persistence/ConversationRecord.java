package com.concierge.core.persistence;

import com.concierge.core.model.InteractionMessage;
import com.concierge.core.model.PlanEntry;

import java.util.List;

/**
 * What survives between turns of a conversation: its history and its plan.
 */
public record ConversationRecord(
    String conversationId,
    List<InteractionMessage> interactionHistory,
    List<PlanEntry> plan
) {

    public ConversationRecord {
        interactionHistory = interactionHistory != null ? List.copyOf(interactionHistory) : List.of();
        plan = plan != null ? List.copyOf(plan) : List.of();
    }

    public static ConversationRecord empty(String conversationId) {
        return new ConversationRecord(conversationId, List.of(), List.of());
    }
}
