package com.foreman.core.qualitygate;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.error.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checkpoint between a claimed completion and a committed completed status.
 * <p>
 * Runs the role's {@link QualityPredicate} over the claimed result and returns a
 * {@link QualityVerdict}. Carries the configured retry ceiling, which the coordinator
 * passes to {@code TaskGraph#reject} when it commits a rejection.
 */
public class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    private final QualityPredicates predicates;
    private final int retryCeiling;

    public QualityGate(QualityPredicates predicates, int retryCeiling) {
        if (retryCeiling < 1) {
            throw new IllegalArgumentException("Retry ceiling must be at least 1, got " + retryCeiling);
        }
        this.predicates = predicates;
        this.retryCeiling = retryCeiling;
    }

    /**
     * Review an in-progress task's claimed result.
     *
     * @throws InvalidTransitionException if the task is not in progress
     */
    public QualityVerdict review(Task task, String claimedResult) {
        if (task.status() != TaskStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(
                    "Task " + task.id() + " is " + task.status().key() + "; only in-progress work can be reviewed");
        }
        QualityPredicate.Result result = predicates.forRole(task.role()).evaluate(task, claimedResult);
        if (result.accepted()) {
            log.info("Quality gate ACCEPTED task {} [{}]", task.id(), task.role().key());
            return new QualityVerdict.Accepted(task.id());
        }
        String feedback = result.feedback() != null ? result.feedback() : "Rejected by quality criteria";
        log.info("Quality gate REJECTED task {} [{}] (attempt {}/{}): {}",
                task.id(), task.role().key(), task.retryCount() + 1, retryCeiling, feedback);
        return new QualityVerdict.Rejected(task.id(), feedback);
    }

    public int getRetryCeiling() {
        return retryCeiling;
    }
}
