package com.foreman.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for session coordination.
 */
@Service
public class ForemanMetrics {

    private final MeterRegistry registry;

    public ForemanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGateVerdict(boolean accepted) {
        Counter.builder("foreman.gate.verdicts")
                .tag("result", accepted ? "accepted" : "rejected")
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("foreman.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPhaseTransition(String toPhase) {
        Counter.builder("foreman.phase.transitions")
                .tag("to", toPhase)
                .register(registry)
                .increment();
    }

    /**
     * @param role role key of the agent the task was assigned to
     */
    public void recordDispatch(String role) {
        Counter.builder("foreman.tasks.dispatched")
                .description("Tasks assigned to an agent")
                .tag("role", role)
                .register(registry)
                .increment();
    }
}
