package com.concierge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for conversation turns.
 */
@Service
public class ConciergeMetrics {

    private final MeterRegistry registry;

    public ConciergeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAgentInvocation(String agentName, long ms) {
        Timer.builder("concierge.agent.duration")
                .tag("agent", agentName)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String status) {
        Counter.builder("concierge.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success" or "error"
     */
    public void recordToolCall(String toolName, String outcome) {
        Counter.builder("concierge.tool.calls")
                .tag("tool", toolName)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param stage "input" or "output"
     */
    public void recordGuardrailRejection(String stage) {
        Counter.builder("concierge.guardrail.rejections")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void incrementCheckpoints() {
        Counter.builder("concierge.checkpoints.total")
                .description("State checkpoints appended")
                .register(registry)
                .increment();
    }
}
