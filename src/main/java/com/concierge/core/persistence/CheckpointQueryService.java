package com.concierge.core.persistence;

import com.concierge.core.state.AgentState;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read-side queries over the checkpoint store for the CLI and for resuming
 * conversations: list conversations, inspect timelines, restore state at a step.
 */
@Service
public class CheckpointQueryService {

    private final CheckpointStore store;

    public CheckpointQueryService(CheckpointStore store) {
        this.store = store;
    }

    public List<String> listConversationIds() {
        return store.conversationIds();
    }

    /**
     * Lists all checkpoints for a conversation, ordered by step index.
     */
    public List<StateCheckpoint> listCheckpoints(String conversationId) {
        return store.list(conversationId);
    }

    /**
     * The checkpoint with the highest step index that satisfies {@code filter}.
     */
    public Optional<StateCheckpoint> getLatestCheckpoint(String conversationId, Predicate<StateCheckpoint> filter) {
        List<StateCheckpoint> checkpoints = store.list(conversationId);
        for (int i = checkpoints.size() - 1; i >= 0; i--) {
            if (filter.test(checkpoints.get(i))) {
                return Optional.of(checkpoints.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * A fresh, independently mutable copy of the state recorded at {@code stepIndex}.
     */
    public Optional<AgentState> getStateAtStep(String conversationId, int stepIndex) {
        return store.list(conversationId).stream()
                .filter(cp -> cp.stepIndex() == stepIndex)
                .findFirst()
                .map(cp -> AgentState.fromSnapshot(cp.state()));
    }
}
