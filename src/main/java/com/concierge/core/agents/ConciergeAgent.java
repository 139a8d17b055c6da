package com.concierge.core.agents;

import com.concierge.core.state.AgentState;

/**
 * One reasoning role in a conversation turn.
 * <p>
 * Agents receive the turn's state, mutate it and hand it back; the orchestrator
 * decides which agent runs next and checkpoints after every invocation.
 */
public interface ConciergeAgent {

    /** Name recorded on the checkpoints this agent produces. */
    String name();

    AgentState advance(AgentState state);
}
