package com.concierge.core.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link CheckpointStore} held in memory; checkpoints are lost on restart.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, List<StateCheckpoint>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void append(StateCheckpoint checkpoint) {
        checkpoints.computeIfAbsent(checkpoint.conversationId(), k -> new CopyOnWriteArrayList<>()).add(checkpoint);
    }

    @Override
    public List<StateCheckpoint> list(String conversationId) {
        List<StateCheckpoint> list = checkpoints.get(conversationId);
        return list != null ? List.copyOf(list) : List.of();
    }

    @Override
    public List<String> conversationIds() {
        return new ArrayList<>(checkpoints.keySet());
    }
}
