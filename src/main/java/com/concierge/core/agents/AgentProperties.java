package com.concierge.core.agents;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Executor limits bound from {@code concierge.agent.*}.
 */
@Component
@ConfigurationProperties(prefix = "concierge.agent")
public class AgentProperties {

    /** Model turns a task may take before it is marked FAILED. */
    private int maxTaskTurns = 20;

    /** Recoverable tool errors a task may record; the next one aborts the turn. */
    private int maxToolErrors = 5;

    public int getMaxTaskTurns() { return maxTaskTurns; }
    public void setMaxTaskTurns(int maxTaskTurns) { this.maxTaskTurns = maxTaskTurns; }

    public int getMaxToolErrors() { return maxToolErrors; }
    public void setMaxToolErrors(int maxToolErrors) { this.maxToolErrors = maxToolErrors; }
}
