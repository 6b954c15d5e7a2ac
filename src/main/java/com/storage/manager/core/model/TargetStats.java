package com.storage.manager.core.model;

import java.nio.file.Path;
import java.util.function.Predicate;

/**
 * Summary view of a resolved target used by the cleanup pre-check.
 * Implementations may compute each figure lazily with a walk that keeps no file list.
 */
public interface TargetStats {

    RegistrationKey key();

    Path root();

    long totalBytes();

    int fileCount();

    /**
     * Whether any regular file under the root matches; stops at the first match.
     */
    boolean anyFile(Predicate<FileEntry> predicate);
}
