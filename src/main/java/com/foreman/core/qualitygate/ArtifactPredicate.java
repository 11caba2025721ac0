package com.foreman.core.qualitygate;

import com.foreman.core.model.Task;

import java.util.regex.Pattern;

/**
 * Default criteria for producing roles: an artifact summary must be reported and it
 * must not show a build failure.
 */
public class ArtifactPredicate implements QualityPredicate {

    /** Requires anchoring context so the word "error" in ordinary commentary does not match. */
    static final Pattern BUILD_FAILURE_PATTERN =
            Pattern.compile("(?i)(BUILD FAILURE|BUILD FAILED|COMPILATION ERROR|npm ERR!)");

    @Override
    public Result evaluate(Task task, String claimedResult) {
        if (claimedResult == null || claimedResult.isBlank()) {
            return Result.reject("No artifact summary reported");
        }
        if (BUILD_FAILURE_PATTERN.matcher(claimedResult).find()) {
            return Result.reject("Build failure reported in artifact summary");
        }
        return Result.accept();
    }
}
