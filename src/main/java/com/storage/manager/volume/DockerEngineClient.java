package com.storage.manager.volume;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storage.manager.core.exception.TransientInfraException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ContainerRuntime} backed by the Docker Engine HTTP API.
 *
 * <p>Talks plain HTTP to a TCP endpoint (default {@code http://localhost:2375}). Hosts that
 * only expose {@code /var/run/docker.sock} need a read-only socket proxy in front of it.
 * Every request carries a timeout so a stalled daemon cannot stall a scheduler tick.</p>
 *
 * <pre>
 * ContainerRuntime runtime = DockerEngineClient.builder()
 *     .baseUrl("http://docker-proxy:2375")
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 * </pre>
 */
public class DockerEngineClient implements ContainerRuntime {
    private static final Logger log = LoggerFactory.getLogger(DockerEngineClient.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:2375";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private DockerEngineClient(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<VolumeInfo> inspectVolume(String name) {
        HttpResponse<String> response = get("/volumes/" + URLEncoder.encode(name, StandardCharsets.UTF_8));
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireOk(response, "inspect volume " + name);
        return Optional.of(toVolumeInfo(read(response, DockerVolume.class)));
    }

    @Override
    public List<VolumeInfo> listVolumes() {
        HttpResponse<String> response = get("/volumes");
        requireOk(response, "list volumes");
        DockerVolumeList list = read(response, DockerVolumeList.class);
        List<VolumeInfo> volumes = new ArrayList<>();
        if (list.volumes() != null) {
            for (DockerVolume volume : list.volumes()) {
                volumes.add(toVolumeInfo(volume));
            }
        }
        return volumes;
    }

    @Override
    public List<ContainerInfo> listContainers() {
        HttpResponse<String> response = get("/containers/json?all=1");
        requireOk(response, "list containers");
        List<DockerContainer> containers;
        try {
            containers = objectMapper.readValue(response.body(), new TypeReference<List<DockerContainer>>() {});
        } catch (JsonProcessingException e) {
            throw new TransientInfraException("Malformed container list from " + baseUrl, e);
        }
        List<ContainerInfo> result = new ArrayList<>();
        for (DockerContainer container : containers) {
            result.add(toContainerInfo(container));
        }
        return result;
    }

    @Override
    public boolean isAvailable() {
        try {
            return get("/_ping").statusCode() == 200;
        } catch (TransientInfraException e) {
            log.debug("Docker engine not available at {}: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    @Override
    public String describe() {
        return "docker@" + baseUrl;
    }

    private HttpResponse<String> get(String path) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientInfraException("Docker engine unreachable at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfraException("Interrupted while calling docker engine at " + baseUrl, e);
        }
    }

    private void requireOk(HttpResponse<String> response, String operation) {
        if (response.statusCode() != 200) {
            throw new TransientInfraException("Docker engine failed to " + operation +
                    ": status " + response.statusCode() + ": " + response.body());
        }
    }

    private <T> T read(HttpResponse<String> response, Class<T> type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new TransientInfraException("Malformed response from docker engine at " + baseUrl, e);
        }
    }

    private static VolumeInfo toVolumeInfo(DockerVolume volume) {
        return new VolumeInfo(
                volume.name(),
                volume.driver() != null ? volume.driver() : "local",
                volume.mountpoint(),
                parseCreatedAt(volume.createdAt()),
                List.of());
    }

    private static ContainerInfo toContainerInfo(DockerContainer container) {
        String name = container.id();
        if (container.names() != null && !container.names().isEmpty()) {
            String first = container.names().get(0);
            name = first.startsWith("/") ? first.substring(1) : first;
        }
        List<String> volumeNames = new ArrayList<>();
        if (container.mounts() != null) {
            for (DockerMount mount : container.mounts()) {
                if ("volume".equals(mount.type()) && mount.name() != null) {
                    volumeNames.add(mount.name());
                }
            }
        }
        return new ContainerInfo(container.id(), name, container.labels(), volumeNames);
    }

    static Instant parseCreatedAt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable volume creation time '{}'", value);
            return null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public DockerEngineClient build() {
            return new DockerEngineClient(this);
        }
    }

    // Response DTOs for the Docker Engine API
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DockerVolumeList(
            @JsonProperty("Volumes") List<DockerVolume> volumes
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DockerVolume(
            @JsonProperty("Name") String name,
            @JsonProperty("Driver") String driver,
            @JsonProperty("Mountpoint") String mountpoint,
            @JsonProperty("CreatedAt") String createdAt
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DockerContainer(
            @JsonProperty("Id") String id,
            @JsonProperty("Names") List<String> names,
            @JsonProperty("Labels") Map<String, String> labels,
            @JsonProperty("Mounts") List<DockerMount> mounts
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DockerMount(
            @JsonProperty("Type") String type,
            @JsonProperty("Name") String name
    ) {}
}
