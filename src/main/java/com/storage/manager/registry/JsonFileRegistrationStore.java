package com.storage.manager.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.storage.manager.core.exception.RegistryCorruptedException;
import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.CleanupStatus;
import com.storage.manager.core.model.Provenance;
import com.storage.manager.core.model.Registration;
import com.storage.manager.core.model.RegistrationKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * JSON file-backed implementation of {@link RegistrationStore}.
 *
 * <p>The whole registry is written to a sibling temp file which is then moved over the
 * target, so a crash mid-write leaves the previous file intact. Timestamps are stored as
 * ISO-8601 strings. A file that exists but cannot be parsed, or that holds invalid or
 * duplicate entries, is reported as corrupt.</p>
 */
public class JsonFileRegistrationStore implements RegistrationStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileRegistrationStore.class);

    static final int FORMAT_VERSION = 1;

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileRegistrationStore(Path file) {
        this.file = file.toAbsolutePath();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<Registration> load() {
        if (!Files.exists(file)) {
            try {
                Files.createDirectories(file.getParent());
            } catch (IOException e) {
                throw new RegistryCorruptedException("Cannot create registry directory " + file.getParent(), e);
            }
            log.info("registry.store.initialized file={} (new)", file);
            return List.of();
        }

        StoredRegistry stored;
        try {
            stored = objectMapper.readValue(file.toFile(), StoredRegistry.class);
        } catch (IOException e) {
            throw new RegistryCorruptedException("Registry file " + file + " is unreadable or corrupt: " + e.getMessage(), e);
        }
        if (stored == null || stored.registrations() == null) {
            throw new RegistryCorruptedException("Registry file " + file + " has no registrations section");
        }
        if (stored.version() != FORMAT_VERSION) {
            throw new RegistryCorruptedException("Registry file " + file + " has unsupported version " + stored.version());
        }

        List<Registration> registrations = new ArrayList<>();
        Set<RegistrationKey> seen = new HashSet<>();
        int index = 0;
        for (StoredRegistration entry : stored.registrations()) {
            Registration registration;
            try {
                registration = fromStored(entry);
            } catch (RuntimeException e) {
                throw new RegistryCorruptedException("Registry file " + file + " has an invalid entry at index " +
                        index + ": " + e.getMessage(), e);
            }
            if (!seen.add(registration.key())) {
                throw new RegistryCorruptedException("Registry file " + file + " has a duplicate entry for " +
                        registration.key());
            }
            registrations.add(registration);
            index++;
        }
        log.info("registry.store.loaded file={} count={}", file, registrations.size());
        return registrations;
    }

    @Override
    public void save(Collection<Registration> registrations) {
        List<StoredRegistration> entries = new ArrayList<>();
        for (Registration registration : registrations) {
            entries.add(toStored(registration));
        }
        Path temp = null;
        try {
            Files.createDirectories(file.getParent());
            temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), new StoredRegistry(FORMAT_VERSION, entries));
            moveIntoPlace(temp);
            log.debug("registry.store.saved file={} count={}", file, entries.size());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TransientInfraException("Failed to write registry file " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return file.toString();
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("registry.store.atomicMoveUnsupported file={}", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("registry.store.tempCleanupFailed file={} error={}", temp, e.getMessage());
        }
    }

    private static StoredRegistration toStored(Registration registration) {
        CleanupResult result = registration.lastResult();
        StoredResult storedResult = result == null ? null : new StoredResult(
                result.filesRemoved(),
                result.bytesFreed(),
                result.filesFailed(),
                result.errors(),
                result.duration().toMillis(),
                result.status().wireName(),
                result.completedAt().toString());
        return new StoredRegistration(
                registration.volumeName(),
                registration.path(),
                registration.algorithm(),
                registration.params(),
                registration.description(),
                registration.provenance().wireName(),
                registration.createdAt().toString(),
                registration.updatedAt().toString(),
                registration.lastRunAt() != null ? registration.lastRunAt().toString() : null,
                storedResult);
    }

    private static Registration fromStored(StoredRegistration entry) {
        if (entry.algorithm() == null || entry.algorithm().isBlank()) {
            throw new IllegalArgumentException("algorithm is missing");
        }
        StoredResult stored = entry.lastResult();
        CleanupResult result = stored == null ? null : new CleanupResult(
                stored.filesRemoved(),
                stored.bytesFreed(),
                stored.filesFailed(),
                stored.errors(),
                Duration.ofMillis(stored.durationMs()),
                CleanupStatus.valueOf(required(stored.status(), "last_result.status").toUpperCase(Locale.ROOT)),
                Instant.parse(required(stored.completedAt(), "last_result.completed_at")));
        return new Registration(
                RegistrationKey.of(entry.volumeName(), entry.path()),
                entry.algorithm(),
                entry.params(),
                entry.description(),
                Provenance.fromWireName(entry.provenance()),
                Instant.parse(required(entry.createdAt(), "created_at")),
                Instant.parse(required(entry.updatedAt(), "updated_at")),
                entry.lastRunAt() != null ? Instant.parse(entry.lastRunAt()) : null,
                result);
    }

    private static String required(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is missing");
        }
        return value;
    }

    // On-disk DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record StoredRegistry(
            @JsonProperty("version") int version,
            @JsonProperty("registrations") List<StoredRegistration> registrations
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record StoredRegistration(
            @JsonProperty("volume_name") String volumeName,
            @JsonProperty("path") String path,
            @JsonProperty("algorithm") String algorithm,
            @JsonProperty("params") Map<String, Object> params,
            @JsonProperty("description") String description,
            @JsonProperty("provenance") String provenance,
            @JsonProperty("created_at") String createdAt,
            @JsonProperty("updated_at") String updatedAt,
            @JsonProperty("last_run_at") String lastRunAt,
            @JsonProperty("last_result") StoredResult lastResult
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record StoredResult(
            @JsonProperty("files_removed") long filesRemoved,
            @JsonProperty("bytes_freed") long bytesFreed,
            @JsonProperty("files_failed") long filesFailed,
            @JsonProperty("errors") List<String> errors,
            @JsonProperty("duration_ms") long durationMs,
            @JsonProperty("status") String status,
            @JsonProperty("completed_at") String completedAt
    ) {}
}
