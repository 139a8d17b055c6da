package com.concierge.core.persistence;

import com.concierge.core.state.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Append-only checkpoint sequence of one conversation.
 * <p>
 * Step indices continue from whatever the store already holds, so they stay
 * monotonic across turns. Each appended checkpoint carries its own immutable
 * snapshot of the state; later mutation of the live state never changes it.
 * Only the orchestrator writes to the log.
 */
public class CheckpointLog {

    private static final Logger log = LoggerFactory.getLogger(CheckpointLog.class);

    private final String conversationId;
    private final CheckpointStore store;
    private final Clock clock;
    private int nextStepIndex;

    private CheckpointLog(String conversationId, CheckpointStore store, Clock clock, int nextStepIndex) {
        this.conversationId = conversationId;
        this.store = store;
        this.clock = clock;
        this.nextStepIndex = nextStepIndex;
    }

    public static CheckpointLog open(String conversationId, CheckpointStore store) {
        return open(conversationId, store, Clock.systemUTC());
    }

    public static CheckpointLog open(String conversationId, CheckpointStore store, Clock clock) {
        List<StateCheckpoint> existing = store.list(conversationId);
        int next = existing.isEmpty() ? 0 : existing.get(existing.size() - 1).stepIndex() + 1;
        return new CheckpointLog(conversationId, store, clock, next);
    }

    /**
     * Snapshots {@code state} and appends it as the next step.
     *
     * @param agentName agent that produced the state, or null for user input and guardrail steps
     */
    public StateCheckpoint append(AgentState state, String agentName, Map<String, Object> metadata) {
        if (!conversationId.equals(state.conversationId())) {
            throw new IllegalArgumentException("State of conversation '" + state.conversationId()
                    + "' cannot be checkpointed into the log of '" + conversationId + "'");
        }
        var checkpoint = new StateCheckpoint(nextStepIndex, state.snapshot(), agentName, clock.instant(), metadata);
        store.append(checkpoint);
        nextStepIndex++;
        log.debug("Checkpoint {} ({}, {})", checkpoint.stepIndex(),
                agentName != null ? agentName : "-", checkpoint.event());
        return checkpoint;
    }

    public String conversationId() {
        return conversationId;
    }

    public int nextStepIndex() {
        return nextStepIndex;
    }

    public List<StateCheckpoint> checkpoints() {
        return store.list(conversationId);
    }
}
