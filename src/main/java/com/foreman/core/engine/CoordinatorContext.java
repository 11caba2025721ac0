package com.foreman.core.engine;

import com.foreman.core.events.EventBus;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.persistence.ProjectStore;
import com.foreman.core.qualitygate.QualityGate;
import com.foreman.core.report.Reporter;

import java.time.Clock;

/**
 * Collaborators shared by every {@link SessionCoordinator} of a process.
 *
 * @param maxInFlightPerRole upper bound on in-progress tasks per role
 */
public record CoordinatorContext(
    ProjectStore store,
    QualityGate gate,
    Reporter reporter,
    AgentExecutor executor,
    EventBus eventBus,
    ForemanMetrics metrics,
    Clock clock,
    int maxInFlightPerRole
) {

    public CoordinatorContext {
        if (maxInFlightPerRole < 1) {
            throw new IllegalArgumentException("maxInFlightPerRole must be at least 1, got " + maxInFlightPerRole);
        }
    }
}
