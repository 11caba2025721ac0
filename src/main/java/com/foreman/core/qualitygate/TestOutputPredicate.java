package com.foreman.core.qualitygate;

import com.foreman.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default criteria for the tester: parses test-runner output and accepts only when no
 * test failed.
 * <p>
 * Recognizes Maven/JUnit ("Tests run: X, Failures: Y") and pytest ("X passed, Y failed")
 * summaries. Without either, falls back to build-failure patterns; output with no
 * recognizable failure is accepted.
 */
public class TestOutputPredicate implements QualityPredicate {

    private static final Logger log = LoggerFactory.getLogger(TestOutputPredicate.class);

    /** Maven/JUnit style: "Tests run: 10, Failures: 2" */
    private static final Pattern MAVEN_PATTERN =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+)");

    /** pytest style: "8 passed, 2 failed" or "8 passed" */
    private static final Pattern PYTEST_PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");

    @Override
    public Result evaluate(Task task, String claimedResult) {
        if (claimedResult == null || claimedResult.isBlank()) {
            return Result.reject("No test output reported");
        }

        Matcher mavenMatcher = MAVEN_PATTERN.matcher(claimedResult);
        if (mavenMatcher.find()) {
            int total = Integer.parseInt(mavenMatcher.group(1));
            int failed = Integer.parseInt(mavenMatcher.group(2));
            log.debug("Parsed Maven-style output for {}: {}/{} tests passed", task.id(), total - failed, total);
            return failed == 0
                    ? Result.accept()
                    : Result.reject(String.format("Tests failed: %d of %d failed", failed, total));
        }

        Matcher passedMatcher = PYTEST_PASSED_PATTERN.matcher(claimedResult);
        Matcher failedMatcher = PYTEST_FAILED_PATTERN.matcher(claimedResult);
        boolean foundPassed = passedMatcher.find();
        boolean foundFailed = failedMatcher.find();
        if (foundPassed || foundFailed) {
            int passed = foundPassed ? Integer.parseInt(passedMatcher.group(1)) : 0;
            int failed = foundFailed ? Integer.parseInt(failedMatcher.group(1)) : 0;
            log.debug("Parsed pytest-style output for {}: {}/{} tests passed", task.id(), passed, passed + failed);
            return failed == 0
                    ? Result.accept()
                    : Result.reject(String.format("Tests failed: %d of %d failed", failed, passed + failed));
        }

        if (ArtifactPredicate.BUILD_FAILURE_PATTERN.matcher(claimedResult).find()) {
            return Result.reject("Build or test failure detected (no structured test output)");
        }
        return Result.accept();
    }
}
