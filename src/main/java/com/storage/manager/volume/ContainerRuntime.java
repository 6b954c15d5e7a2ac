package com.storage.manager.volume;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the container runtime.
 * All methods throw {@link com.storage.manager.core.exception.TransientInfraException}
 * when the runtime cannot be reached.
 */
public interface ContainerRuntime {

    /**
     * Inspects a single volume.
     *
     * @return the volume, or empty if the runtime does not know it
     */
    Optional<VolumeInfo> inspectVolume(String name);

    /**
     * Lists all volumes known to the runtime. Attached containers are not filled in.
     */
    List<VolumeInfo> listVolumes();

    /**
     * Lists all containers, including stopped ones.
     */
    List<ContainerInfo> listContainers();

    /**
     * Returns true if the runtime answers. Never throws.
     */
    boolean isAvailable();

    /**
     * Human-readable endpoint description for logs and health output.
     */
    String describe();
}
