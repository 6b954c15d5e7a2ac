package com.storage.manager.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one cleanup run. Only the latest result is kept per registration.
 *
 * @param filesRemoved number of files deleted
 * @param bytesFreed   bytes released by the deleted files
 * @param filesFailed  number of files whose deletion failed and were skipped
 * @param errors       bounded list of error summaries
 * @param duration     wall-clock time of the run
 * @param status       completion status
 * @param completedAt  when the run finished (or was abandoned)
 */
public record CleanupResult(
        long filesRemoved,
        long bytesFreed,
        long filesFailed,
        List<String> errors,
        Duration duration,
        CleanupStatus status,
        Instant completedAt
) {
    /** Maximum number of error summaries retained per result. */
    public static final int MAX_ERRORS = 20;

    public CleanupResult {
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(duration, "duration is required");
        Objects.requireNonNull(completedAt, "completedAt is required");
        if (filesRemoved < 0 || bytesFreed < 0 || filesFailed < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        errors = errors != null
                ? List.copyOf(errors.size() > MAX_ERRORS ? errors.subList(0, MAX_ERRORS) : errors)
                : List.of();
    }

    /**
     * A run that found the target already compliant and deleted nothing.
     */
    public static CleanupResult compliant(Duration duration, Instant completedAt) {
        return new CleanupResult(0, 0, 0, List.of(), duration, CleanupStatus.COMPLETED, completedAt);
    }

    public static CleanupResult failed(String error, Duration duration, Instant completedAt) {
        return new CleanupResult(0, 0, 0, error != null ? List.of(error) : List.of(),
                duration, CleanupStatus.FAILED, completedAt);
    }

    public static CleanupResult timedOut(Duration duration, Instant completedAt) {
        return new CleanupResult(0, 0, 0, List.of("run exceeded timeout of " + duration.toSeconds() + "s"),
                duration, CleanupStatus.TIMED_OUT, completedAt);
    }

    /**
     * Returns true if the run completed but some individual deletions failed.
     */
    public boolean hasPartialFailures() {
        return status == CleanupStatus.COMPLETED && filesFailed > 0;
    }

    public boolean isSuccess() {
        return status == CleanupStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "CleanupResult{status=" + status.wireName() +
                ", removed=" + filesRemoved +
                ", freed=" + bytesFreed +
                ", failed=" + filesFailed +
                ", durationMs=" + duration.toMillis() + '}';
    }
}
