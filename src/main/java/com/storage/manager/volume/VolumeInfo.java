package com.storage.manager.volume;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Volume metadata as reported by the container runtime.
 *
 * @param name       volume name
 * @param driver     volume driver (e.g. {@code local})
 * @param mountpoint host path of the volume root, may be null if the runtime did not report it
 * @param createdAt  creation time, may be null
 * @param containers names of containers mounting this volume
 */
public record VolumeInfo(String name, String driver, String mountpoint, Instant createdAt, List<String> containers) {

    public VolumeInfo {
        Objects.requireNonNull(name, "name is required");
        containers = containers != null ? List.copyOf(containers) : List.of();
    }

    /**
     * Placeholder for a volume known only through registrations.
     */
    public static VolumeInfo unknown(String name) {
        return new VolumeInfo(name, "unknown", null, null, List.of());
    }

    public VolumeInfo withContainers(List<String> attached) {
        return new VolumeInfo(name, driver, mountpoint, createdAt, attached);
    }
}
