package com.storage.manager.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.RegistrationDraft;

import java.util.Map;

/**
 * Request DTO for registering a cleanup target.
 */
public record RegisterRequest(
        @JsonProperty("volume_name") String volumeName,
        @JsonProperty("path") String path,
        @JsonProperty("algorithm") String algorithm,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("description") String description
) {
    public RegistrationDraft toDraft() {
        if (volumeName == null || volumeName.isBlank()) {
            throw new ValidationException("volume_name is required");
        }
        if (path == null || path.isBlank()) {
            throw new ValidationException("path is required");
        }
        if (algorithm == null || algorithm.isBlank()) {
            throw new ValidationException("algorithm is required");
        }
        return new RegistrationDraft(volumeName.trim(), path.trim(), algorithm.trim(), params, description);
    }
}
