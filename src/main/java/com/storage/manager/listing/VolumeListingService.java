package com.storage.manager.listing;

import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.model.Registration;
import com.storage.manager.registry.RegistrationFilter;
import com.storage.manager.registry.RegistryService;
import com.storage.manager.volume.ContainerInfo;
import com.storage.manager.volume.ContainerRuntime;
import com.storage.manager.volume.UsageCache;
import com.storage.manager.volume.VolumeInfo;
import com.storage.manager.volume.VolumeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Joins runtime volumes, attached containers, cached usage and registrations into one
 * listing. Volumes known only through registrations appear with driver {@code unknown}.
 * When the runtime is unreachable the listing degrades to registration-only volumes.
 */
public class VolumeListingService {
    private static final Logger log = LoggerFactory.getLogger(VolumeListingService.class);

    private final VolumeResolver resolver;
    private final RegistryService registry;
    private final UsageCache usageCache;

    public VolumeListingService(VolumeResolver resolver, RegistryService registry, UsageCache usageCache) {
        this.resolver = resolver;
        this.registry = registry;
        this.usageCache = usageCache;
    }

    public List<VolumeSummary> list(VolumeQuery query) {
        Map<String, List<Registration>> registrationsByVolume = registry.list(RegistrationFilter.all()).stream()
                .collect(Collectors.groupingBy(Registration::volumeName, TreeMap::new, Collectors.toList()));

        Map<String, VolumeInfo> volumes = new TreeMap<>();
        ContainerRuntime runtime = resolver.runtime();
        try {
            Map<String, List<String>> attached = attachedContainers(runtime.listContainers());
            for (VolumeInfo volume : runtime.listVolumes()) {
                volumes.put(volume.name(), volume.withContainers(attached.getOrDefault(volume.name(), List.of())));
            }
        } catch (TransientInfraException e) {
            log.warn("listing.runtimeUnavailable runtime={} error={}", runtime.describe(), e.getMessage());
        }
        for (String volumeName : registrationsByVolume.keySet()) {
            volumes.computeIfAbsent(volumeName, VolumeInfo::unknown);
        }

        List<VolumeSummary> out = new ArrayList<>();
        for (VolumeInfo volume : volumes.values()) {
            List<Registration> registrations = registrationsByVolume.getOrDefault(volume.name(), List.of());
            if (!query.matchesName(volume.name())) {
                continue;
            }
            if (query.registered() != null && query.registered() == registrations.isEmpty()) {
                continue;
            }
            out.add(new VolumeSummary(volume.name(), volume.driver(), volume.mountpoint(), volume.createdAt(),
                    volume.containers(), usage(volume), registrations));
        }
        out.sort(query.sort().comparator(query.descending()));
        return out;
    }

    private Long usage(VolumeInfo volume) {
        if (volume.mountpoint() == null) {
            return null;
        }
        try {
            OptionalLong bytes = usageCache.get("volume:" + volume.name(), volume, resolver::volumeUsage);
            return bytes.isPresent() ? bytes.getAsLong() : null;
        } catch (RuntimeException e) {
            log.warn("listing.usageFailed volume={} error={}", volume.name(), e.getMessage());
            return null;
        }
    }

    private static Map<String, List<String>> attachedContainers(List<ContainerInfo> containers) {
        Map<String, TreeSet<String>> byVolume = new TreeMap<>();
        for (ContainerInfo container : containers) {
            for (String volumeName : container.volumeNames()) {
                byVolume.computeIfAbsent(volumeName, v -> new TreeSet<>()).add(container.name());
            }
        }
        Map<String, List<String>> out = new TreeMap<>();
        byVolume.forEach((volume, names) -> out.put(volume, List.copyOf(names)));
        return out;
    }
}
