package com.storage.manager.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storage.manager.listing.VolumeSummary;

import java.util.List;

/**
 * Response DTO for one entry of the volume listing.
 */
public record VolumeResponse(
        @JsonProperty("volume_name") String volumeName,
        @JsonProperty("driver") String driver,
        @JsonProperty("mountpoint") String mountpoint,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("containers") List<String> containers,
        @JsonProperty("usage_bytes") Long usageBytes,
        @JsonProperty("registrations") List<RegistrationResponse> registrations
) {
    public static VolumeResponse from(VolumeSummary summary) {
        return new VolumeResponse(
                summary.name(),
                summary.driver(),
                summary.mountpoint(),
                summary.createdAt() != null ? summary.createdAt().toString() : null,
                summary.containers(),
                summary.usageBytes(),
                summary.registrations().stream().map(RegistrationResponse::from).toList());
    }
}
