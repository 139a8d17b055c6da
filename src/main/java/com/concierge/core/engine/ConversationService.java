package com.concierge.core.engine;

import com.concierge.core.events.EventBus;
import com.concierge.core.events.EventProperties;
import com.concierge.core.events.ProgressChannel;
import com.concierge.core.model.PlanEntry;
import com.concierge.core.persistence.CheckpointLog;
import com.concierge.core.persistence.CheckpointQueryService;
import com.concierge.core.persistence.CheckpointStore;
import com.concierge.core.persistence.ConversationRecord;
import com.concierge.core.persistence.ConversationStore;
import com.concierge.core.persistence.StateCheckpoint;
import com.concierge.core.state.AgentState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point for conversation turns.
 * <p>
 * Rehydrates the state from the stored history and plan (falling back to the
 * latest checkpoint of a completed turn when the conversation store has
 * nothing), runs the turn
 * through the {@link ConversationOrchestrator} and stores the result. Turns can
 * also be submitted to a single background worker, which serializes them.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    private final ConversationOrchestrator orchestrator;
    private final ConversationStore conversationStore;
    private final CheckpointStore checkpointStore;
    private final CheckpointQueryService checkpointQueryService;
    private final EventBus eventBus;
    private final EventProperties eventProperties;
    private final ExecutorService worker;

    public ConversationService(ConversationOrchestrator orchestrator, ConversationStore conversationStore,
                               CheckpointStore checkpointStore, CheckpointQueryService checkpointQueryService,
                               EventBus eventBus, EventProperties eventProperties) {
        this.orchestrator = orchestrator;
        this.conversationStore = conversationStore;
        this.checkpointStore = checkpointStore;
        this.checkpointQueryService = checkpointQueryService;
        this.eventBus = eventBus;
        this.eventProperties = eventProperties;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "concierge-turn-worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs one turn on the calling thread.
     *
     * @return the state after the turn
     */
    public AgentState handleMessage(String conversationId, String message) {
        AgentState state = loadState(conversationId);
        CheckpointLog checkpoints = CheckpointLog.open(conversationId, checkpointStore);
        AgentState result = orchestrator.runStep(state, checkpoints, message);
        conversationStore.save(new ConversationRecord(conversationId, result.interactionHistory(), result.planEntries()));
        return result;
    }

    /**
     * Runs one turn on the background worker. Progress events for the
     * conversation are queued on the returned handle's channel until the turn ends.
     */
    public TurnHandle submitTurn(String conversationId, String message) {
        ProgressChannel progress = eventBus.openChannel(conversationId, eventProperties.getProgressCapacity());
        CompletableFuture<AgentState> result = CompletableFuture
                .supplyAsync(() -> handleMessage(conversationId, message), worker)
                .whenComplete((state, error) -> {
                    progress.close();
                    if (error != null) {
                        log.error("Turn failed for conversation {}: {}", conversationId, error.getMessage());
                    }
                });
        return new TurnHandle(result, progress);
    }

    /**
     * The state a new turn starts from: stored history and plan, the latest
     * checkpoint that ends a completed turn when nothing is stored, or a fresh
     * state. Checkpoints left by an aborted turn are skipped.
     */
    public AgentState loadState(String conversationId) {
        return conversationStore.load(conversationId)
                .or(() -> checkpointQueryService
                        .getLatestCheckpoint(conversationId, ConversationOrchestrator::endsTurn)
                        .map(ConversationService::fromCheckpoint))
                .map(r -> AgentState.rehydrate(conversationId, r.interactionHistory(), r.plan()))
                .orElseGet(() -> new AgentState(conversationId));
    }

    private static ConversationRecord fromCheckpoint(StateCheckpoint checkpoint) {
        List<PlanEntry> plan = checkpoint.state().plan().stream()
                .map(t -> new PlanEntry(t.id(), t.description(), t.status(), t.result()))
                .toList();
        return new ConversationRecord(checkpoint.conversationId(), checkpoint.state().interactionHistory(), plan);
    }

    @PreDestroy
    public void shutdown() {
        worker.shutdownNow();
    }
}
