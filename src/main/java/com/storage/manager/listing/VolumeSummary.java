package com.storage.manager.listing;

import com.storage.manager.core.model.Registration;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the volume listing.
 *
 * @param usageBytes total bytes under the mountpoint, null when it cannot be read here
 */
public record VolumeSummary(
        String name,
        String driver,
        String mountpoint,
        Instant createdAt,
        List<String> containers,
        Long usageBytes,
        List<Registration> registrations
) {
    public VolumeSummary {
        containers = containers != null ? List.copyOf(containers) : List.of();
        registrations = registrations != null ? List.copyOf(registrations) : List.of();
    }

    public boolean isRegistered() {
        return !registrations.isEmpty();
    }
}
