package com.storage.manager.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A regular file observed under a resolved target.
 *
 * @param path  absolute path of the file
 * @param mtime last content modification time
 * @param ctime last metadata change time (creation time where the filesystem has no ctime)
 * @param size  size in bytes
 */
public record FileEntry(Path path, Instant mtime, Instant ctime, long size) {

    public FileEntry {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(mtime, "mtime is required");
        Objects.requireNonNull(ctime, "ctime is required");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
    }

    /**
     * Full path as used for deterministic tie-breaking.
     */
    public String sortPath() {
        return path.toString();
    }
}
