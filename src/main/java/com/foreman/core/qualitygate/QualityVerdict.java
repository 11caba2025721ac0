package com.foreman.core.qualitygate;

import java.util.Objects;

/**
 * Outcome of a {@link QualityGate} review.
 * <p>
 * {@link Accepted} can only be created by the gate, and the task graph demands one to
 * complete a task, so the pending-to-completed transition cannot bypass the gate.
 */
public sealed interface QualityVerdict permits QualityVerdict.Accepted, QualityVerdict.Rejected {

    boolean accepted();

    /** Proof that the gate accepted a specific task's claimed result. */
    final class Accepted implements QualityVerdict {

        private final String taskId;

        Accepted(String taskId) {
            this.taskId = Objects.requireNonNull(taskId);
        }

        public String taskId() {
            return taskId;
        }

        @Override
        public boolean accepted() {
            return true;
        }

        @Override
        public String toString() {
            return "Accepted[" + taskId + "]";
        }
    }

    /** A normal outcome, not an error: the task goes back to pending with this feedback. */
    record Rejected(String taskId, String feedback) implements QualityVerdict {

        @Override
        public boolean accepted() {
            return false;
        }
    }
}
