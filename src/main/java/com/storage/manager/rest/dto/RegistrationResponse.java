package com.storage.manager.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storage.manager.core.model.Registration;

import java.util.Map;

/**
 * Response DTO for a stored registration.
 */
public record RegistrationResponse(
        @JsonProperty("volume_name") String volumeName,
        @JsonProperty("path") String path,
        @JsonProperty("algorithm") String algorithm,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("description") String description,
        @JsonProperty("provenance") String provenance,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("last_run_at") String lastRunAt,
        @JsonProperty("last_result") CleanupResultResponse lastResult
) {
    public static RegistrationResponse from(Registration registration) {
        return new RegistrationResponse(
                registration.volumeName(),
                registration.path(),
                registration.algorithm(),
                registration.params(),
                registration.description(),
                registration.provenance().wireName(),
                registration.createdAt().toString(),
                registration.updatedAt().toString(),
                registration.lastRunAt() != null ? registration.lastRunAt().toString() : null,
                CleanupResultResponse.from(registration.lastResult()));
    }
}
