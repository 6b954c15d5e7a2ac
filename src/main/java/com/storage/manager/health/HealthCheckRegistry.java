package com.storage.manager.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered checks and folds them into one status: any DOWN makes the aggregate
 * DOWN, otherwise any DEGRADED makes it DEGRADED. A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> checkResults = new LinkedHashMap<>();
        HealthStatus.Status worstStatus = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", result.status().name());
            entry.put("message", result.message());
            entry.put("details", result.details());
            checkResults.put(check.getName(), entry);

            if (result.status().isWorseThan(worstStatus)) {
                worstStatus = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worstStatus, worstMessage, checkResults);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed check={} error={}", check.getName(), e.getMessage());
            return HealthStatus.down("Check failed: " + e.getMessage());
        }
    }
}
