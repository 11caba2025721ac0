package com.foreman.core.health;

import com.foreman.config.ForemanProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final ForemanProperties properties;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            ForemanProperties properties) {
        this.dataSource = dataSource;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkProjectDirectory());
        results.add(checkStore());
        return results;
    }

    private HealthStatus checkProjectDirectory() {
        Path dir = properties.getStorePath().getParent();
        if (dir != null && Files.isDirectory(dir) && Files.isWritable(dir)) {
            return new HealthStatus("project-dir", HealthStatus.Status.UP,
                    "Project directory writable", Map.of("path", dir.toString()));
        }
        return new HealthStatus("project-dir", HealthStatus.Status.DOWN,
                "Project directory missing or not writable", Map.of("path", String.valueOf(dir)));
    }

    private HealthStatus checkStore() {
        if (dataSource == null) {
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("store", HealthStatus.Status.UP,
                        "Store connection valid", Map.of("file", properties.getStorePath().toString()));
            }
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of());
        }
    }
}
