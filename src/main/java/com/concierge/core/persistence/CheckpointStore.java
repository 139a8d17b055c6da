package com.concierge.core.persistence;

import java.util.List;

/**
 * Append-only storage for conversation checkpoints.
 */
public interface CheckpointStore {

    /**
     * Stores a checkpoint under its state's conversation id.
     *
     * @throws CheckpointStoreException if the checkpoint could not be written
     */
    void append(StateCheckpoint checkpoint);

    /** All checkpoints of a conversation, ascending by step index. */
    List<StateCheckpoint> list(String conversationId);

    /** Ids of every conversation with at least one checkpoint. */
    List<String> conversationIds();
}
