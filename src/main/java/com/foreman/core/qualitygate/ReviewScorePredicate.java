package com.foreman.core.qualitygate;

import com.foreman.core.model.Task;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default criteria for the quality checker: the review must carry a "Score: X/10"
 * line at or above the threshold.
 */
public class ReviewScorePredicate implements QualityPredicate {

    /** Minimum review score (inclusive) for acceptance. */
    public static final int DEFAULT_THRESHOLD = 6;

    private static final Pattern SCORE_PATTERN =
            Pattern.compile("(?i)Score:\\s*(\\d{1,2})\\s*/\\s*10");

    private final int threshold;

    public ReviewScorePredicate() {
        this(DEFAULT_THRESHOLD);
    }

    public ReviewScorePredicate(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public Result evaluate(Task task, String claimedResult) {
        if (claimedResult == null || claimedResult.isBlank()) {
            return Result.reject("No review output reported");
        }
        Matcher matcher = SCORE_PATTERN.matcher(claimedResult);
        if (!matcher.find()) {
            return Result.reject("Review did not report a score (expected 'Score: X/10')");
        }
        int score = Integer.parseInt(matcher.group(1));
        if (score < threshold) {
            return Result.reject(String.format("Review score %d/10 below threshold (minimum %d)", score, threshold));
        }
        return Result.accept();
    }
}
