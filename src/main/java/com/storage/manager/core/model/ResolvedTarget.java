package com.storage.manager.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Concrete filesystem view of a registration for one run. Never persisted.
 *
 * @param key        the registration this target was resolved for
 * @param root       absolute, validated filesystem root
 * @param totalBytes sum of the sizes of {@code files}
 * @param files      regular files found under the root
 */
public record ResolvedTarget(RegistrationKey key, Path root, long totalBytes, List<FileEntry> files)
        implements TargetStats {

    public ResolvedTarget {
        Objects.requireNonNull(root, "root is required");
        files = files != null ? List.copyOf(files) : List.of();
    }

    /**
     * Builds a target, computing the total from the file list.
     */
    public static ResolvedTarget of(RegistrationKey key, Path root, List<FileEntry> files) {
        long total = 0;
        for (FileEntry file : files) {
            total += file.size();
        }
        return new ResolvedTarget(key, root, total, files);
    }

    @Override
    public int fileCount() {
        return files.size();
    }

    @Override
    public boolean anyFile(Predicate<FileEntry> predicate) {
        return files.stream().anyMatch(predicate);
    }
}
