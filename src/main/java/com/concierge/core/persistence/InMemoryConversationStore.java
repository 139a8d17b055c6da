package com.concierge.core.persistence;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConversationStore} held in memory.
 */
@Component
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, ConversationRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ConversationRecord> load(String conversationId) {
        return Optional.ofNullable(records.get(conversationId));
    }

    @Override
    public void save(ConversationRecord record) {
        records.put(record.conversationId(), record);
    }
}
