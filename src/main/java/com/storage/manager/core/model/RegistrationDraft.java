package com.storage.manager.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unvalidated registration input, as received from the API or parsed from labels.
 */
public record RegistrationDraft(
        String volumeName,
        String path,
        String algorithm,
        Map<String, Object> params,
        String description
) {
    public RegistrationDraft {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        if (description != null && description.isBlank()) {
            description = null;
        }
    }
}
