package com.storage.manager.health;

import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.Registration;
import com.storage.manager.registry.RegistryService;
import com.storage.manager.scheduler.CleanupScheduler;
import com.storage.manager.scheduler.RunState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scheduler liveness plus per-registration run state.
 * DOWN when the scheduler is not running; DEGRADED when no tick happened within
 * two intervals plus the initial delay.
 */
public class SchedulerHealthCheck implements HealthCheck {

    private final CleanupScheduler scheduler;
    private final RegistryService registry;
    private final Clock clock;

    public SchedulerHealthCheck(CleanupScheduler scheduler, RegistryService registry, Clock clock) {
        this.scheduler = scheduler;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "scheduler";
    }

    @Override
    public HealthStatus check() {
        Instant lastTick = scheduler.lastTickAt();
        HealthStatus base;
        if (!scheduler.isRunning()) {
            base = HealthStatus.down("Scheduler is not running");
        } else if (isStale(lastTick)) {
            base = HealthStatus.degraded("No scheduler tick since " + (lastTick != null ? lastTick : "startup"));
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("schedulerRunning", scheduler.isRunning())
                .withDetail("lastTickAt", lastTick != null ? lastTick.toString() : null)
                .withDetail("registrations", registrationStates());
    }

    private boolean isStale(Instant lastTick) {
        Duration interval = scheduler.config().checkInterval();
        Duration allowance = interval.multipliedBy(2).plus(scheduler.config().initialDelay());
        Instant reference = lastTick != null ? lastTick : scheduler.startedAt();
        return reference != null && Duration.between(reference, clock.instant()).compareTo(allowance) > 0;
    }

    private List<Map<String, Object>> registrationStates() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Registration registration : registry.snapshot()) {
            RunState state = scheduler.runState(registration.key());
            CleanupResult last = registration.lastResult();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("volumeName", registration.volumeName());
            entry.put("path", registration.path());
            entry.put("state", state.name());
            entry.put("lastStatus", last != null ? last.status().wireName() : null);
            entry.put("lastRunAt", registration.lastRunAt() != null ? registration.lastRunAt().toString() : null);
            out.add(entry);
        }
        return out;
    }
}
