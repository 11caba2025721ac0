package com.foreman.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "foreman")
public class ForemanProperties {

    /** Project directory; the store file lives here so projects never share state. */
    private String projectDir = ".";
    private String storeFile = ".foreman.db";

    /** Rejections (or failed executions) after which a task is blocked for human input. */
    private int retryCeiling = 3;

    /** In-progress tasks older than this are reported as potential blockers. */
    private Duration staleAfter = Duration.ofMinutes(30);

    /** Upper bound on concurrently in-progress tasks per role. */
    private int maxInFlightPerRole = 4;

    public Path getStorePath() {
        return Path.of(projectDir).toAbsolutePath().normalize().resolve(storeFile);
    }

    public String getProjectDir() { return projectDir; }
    public void setProjectDir(String projectDir) { this.projectDir = projectDir; }
    public String getStoreFile() { return storeFile; }
    public void setStoreFile(String storeFile) { this.storeFile = storeFile; }
    public int getRetryCeiling() { return retryCeiling; }
    public void setRetryCeiling(int retryCeiling) { this.retryCeiling = retryCeiling; }
    public Duration getStaleAfter() { return staleAfter; }
    public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }
    public int getMaxInFlightPerRole() { return maxInFlightPerRole; }
    public void setMaxInFlightPerRole(int maxInFlightPerRole) { this.maxInFlightPerRole = maxInFlightPerRole; }
}
