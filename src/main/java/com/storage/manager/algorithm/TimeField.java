package com.storage.manager.algorithm;

import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.FileEntry;

import java.time.Instant;
import java.util.Locale;

/**
 * Which file timestamp an age threshold is compared against.
 */
public enum TimeField {
    MTIME,
    CTIME;

    public Instant of(FileEntry file) {
        return this == MTIME ? file.mtime() : file.ctime();
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TimeField parse(Object value) {
        if (value == null || value.toString().isBlank()) {
            return MTIME;
        }
        String normalized = value.toString().trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("MTIME")) {
            return MTIME;
        }
        if (normalized.equals("CTIME")) {
            return CTIME;
        }
        throw new ValidationException("Invalid time_field '" + value + "'. Allowed values: [mtime, ctime]");
    }
}
