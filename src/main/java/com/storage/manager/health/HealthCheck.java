package com.storage.manager.health;

/**
 * A single component check contributing to the aggregate health report.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
