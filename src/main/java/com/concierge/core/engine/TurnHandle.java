package com.concierge.core.engine;

import com.concierge.core.events.ProgressChannel;
import com.concierge.core.state.AgentState;

import java.util.concurrent.CompletableFuture;

/**
 * A turn submitted to the background worker.
 *
 * @param result   completes with the state after the turn, or exceptionally with the fatal error
 * @param progress progress events of the turn; read-only side channel
 */
public record TurnHandle(
    CompletableFuture<AgentState> result,
    ProgressChannel progress
) {
}
