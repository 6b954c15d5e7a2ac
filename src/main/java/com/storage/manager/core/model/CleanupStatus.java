package com.storage.manager.core.model;

import java.util.Locale;

/**
 * Completion status of a single cleanup run.
 */
public enum CleanupStatus {
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
