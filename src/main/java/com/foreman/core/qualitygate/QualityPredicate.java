package com.foreman.core.qualitygate;

import com.foreman.core.model.Task;

/**
 * Externally supplied validation criteria for one role.
 */
@FunctionalInterface
public interface QualityPredicate {

    Result evaluate(Task task, String claimedResult);

    /**
     * @param accepted whether the claimed result meets the criteria
     * @param feedback why it was rejected; null when accepted
     */
    record Result(boolean accepted, String feedback) {

        public static Result accept() {
            return new Result(true, null);
        }

        public static Result reject(String feedback) {
            return new Result(false, feedback);
        }
    }
}
