package com.storage.manager.health;

import com.storage.manager.volume.ContainerRuntime;

/**
 * Reports DEGRADED when the container runtime does not answer: existing registrations
 * cannot be resolved, but the registry and API keep working.
 */
public class ContainerRuntimeHealthCheck implements HealthCheck {

    private final ContainerRuntime runtime;

    public ContainerRuntimeHealthCheck(ContainerRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public String getName() {
        return "containerRuntime";
    }

    @Override
    public HealthStatus check() {
        HealthStatus base = runtime.isAvailable()
                ? HealthStatus.up()
                : HealthStatus.degraded("Container runtime unreachable");
        return base.withDetail("endpoint", runtime.describe());
    }
}
