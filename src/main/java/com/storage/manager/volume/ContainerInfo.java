package com.storage.manager.volume;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Container metadata needed for label discovery and volume listing.
 *
 * @param id          container id
 * @param name        container name without the leading slash
 * @param labels      container labels
 * @param volumeNames names of named volumes mounted by the container
 */
public record ContainerInfo(String id, String name, Map<String, String> labels, List<String> volumeNames) {

    public ContainerInfo {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name : id;
        labels = labels != null ? Map.copyOf(labels) : Map.of();
        volumeNames = volumeNames != null ? List.copyOf(volumeNames) : List.of();
    }
}
