package com.storage.manager.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storage.manager.core.model.CleanupResult;

import java.util.List;

/**
 * Response DTO for the last result of a registration.
 */
public record CleanupResultResponse(
        @JsonProperty("status") String status,
        @JsonProperty("files_removed") long filesRemoved,
        @JsonProperty("bytes_freed") long bytesFreed,
        @JsonProperty("files_failed") long filesFailed,
        @JsonProperty("partial_failures") boolean partialFailures,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("completed_at") String completedAt
) {
    public static CleanupResultResponse from(CleanupResult result) {
        if (result == null) {
            return null;
        }
        return new CleanupResultResponse(
                result.status().wireName(),
                result.filesRemoved(),
                result.bytesFreed(),
                result.filesFailed(),
                result.hasPartialFailures(),
                result.errors(),
                result.duration().toMillis(),
                result.completedAt().toString());
    }
}
