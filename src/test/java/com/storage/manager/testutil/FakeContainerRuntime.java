package com.storage.manager.testutil;

import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.volume.ContainerInfo;
import com.storage.manager.volume.ContainerRuntime;
import com.storage.manager.volume.VolumeInfo;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory container runtime whose volumes are mounted on local directories.
 */
public class FakeContainerRuntime implements ContainerRuntime {

    private final Map<String, VolumeInfo> volumes = new ConcurrentHashMap<>();
    private final List<ContainerInfo> containers = new CopyOnWriteArrayList<>();
    private volatile boolean available = true;

    public FakeContainerRuntime withVolume(String name, Path mountpoint) {
        return withVolume(name, mountpoint, Instant.parse("2026-01-01T00:00:00Z"));
    }

    public FakeContainerRuntime withVolume(String name, Path mountpoint, Instant createdAt) {
        volumes.put(name, new VolumeInfo(name, "local", mountpoint.toString(), createdAt, List.of()));
        return this;
    }

    public FakeContainerRuntime withContainer(String name, Map<String, String> labels, String... volumeNames) {
        containers.add(new ContainerInfo("id-" + name, name, labels, List.of(volumeNames)));
        return this;
    }

    public void clearContainers() {
        containers.clear();
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public Optional<VolumeInfo> inspectVolume(String name) {
        requireAvailable();
        return Optional.ofNullable(volumes.get(name));
    }

    @Override
    public List<VolumeInfo> listVolumes() {
        requireAvailable();
        return new ArrayList<>(volumes.values());
    }

    @Override
    public List<ContainerInfo> listContainers() {
        requireAvailable();
        return new ArrayList<>(containers);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String describe() {
        return "fake";
    }

    private void requireAvailable() {
        if (!available) {
            throw new TransientInfraException("runtime unavailable");
        }
    }
}
