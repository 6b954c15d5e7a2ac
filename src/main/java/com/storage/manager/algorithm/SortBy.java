package com.storage.manager.algorithm;

import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.FileEntry;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;

/**
 * File ordering key shared by the size- and count-based strategies.
 * Every ordering breaks ties on the full path, lexicographically.
 */
public enum SortBy {
    MTIME,
    CTIME,
    SIZE;

    private static final Comparator<FileEntry> BY_PATH = Comparator.comparing(FileEntry::sortPath);

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Order in which size-capped cleanup deletes: oldest first for time keys,
     * largest first for size.
     */
    public Comparator<FileEntry> evictionOrder() {
        return switch (this) {
            case MTIME -> Comparator.comparing(FileEntry::mtime).thenComparing(BY_PATH);
            case CTIME -> Comparator.comparing(FileEntry::ctime).thenComparing(BY_PATH);
            case SIZE -> Comparator.comparingLong(FileEntry::size).reversed().thenComparing(BY_PATH);
        };
    }

    /**
     * Most recent first for time keys, largest first for size.
     */
    public Comparator<FileEntry> recencyOrder() {
        return switch (this) {
            case MTIME -> Comparator.comparing(FileEntry::mtime).reversed().thenComparing(BY_PATH);
            case CTIME -> Comparator.comparing(FileEntry::ctime).reversed().thenComparing(BY_PATH);
            case SIZE -> Comparator.comparingLong(FileEntry::size).reversed().thenComparing(BY_PATH);
        };
    }

    /**
     * Parses a sort key, defaulting to {@link #MTIME} when absent.
     */
    public static SortBy parse(Object value) {
        if (value == null || value.toString().isBlank()) {
            return MTIME;
        }
        String normalized = value.toString().trim().toUpperCase(Locale.ROOT);
        for (SortBy candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new ValidationException("Invalid sort_by '" + value + "'. Allowed values: " +
                Arrays.toString(Arrays.stream(values()).map(SortBy::wireName).toArray()));
    }
}
