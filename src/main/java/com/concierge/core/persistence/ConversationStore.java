package com.concierge.core.persistence;

import java.util.Optional;

/**
 * Per-conversation storage of interaction history and plan between turns.
 */
public interface ConversationStore {

    Optional<ConversationRecord> load(String conversationId);

    void save(ConversationRecord record);
}
