package com.storage.manager.volume;

import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.model.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Enumerates regular files under a path without following symbolic links.
 *
 * <p>ctime is read from the {@code unix} attribute view where available and falls back to
 * the creation time elsewhere. Files that vanish during the walk are skipped; unreadable
 * subdirectories are skipped with a warning. An unreadable root is a transient failure.</p>
 */
public class FileScanner {
    private static final Logger log = LoggerFactory.getLogger(FileScanner.class);

    private final boolean unixView;

    public FileScanner() {
        this(FileSystems.getDefault().supportedFileAttributeViews().contains("unix"));
    }

    FileScanner(boolean unixView) {
        this.unixView = unixView;
    }

    /**
     * Lists all regular files under {@code root} (or {@code root} itself if it is a file).
     */
    public List<FileEntry> scan(Path root) {
        List<FileEntry> files = new ArrayList<>();
        walk(root, (path, attrs) -> files.add(entry(path, attrs)));
        return files;
    }

    /**
     * Sums the sizes of all regular files under {@code root} without materializing entries.
     */
    public long totalBytes(Path root) {
        long[] total = {0L};
        walk(root, (path, attrs) -> {
            total[0] += attrs.size();
            return true;
        });
        return total[0];
    }

    /**
     * Counts the regular files under {@code root} without materializing entries.
     */
    public int countFiles(Path root) {
        int[] count = {0};
        walk(root, (path, attrs) -> {
            count[0]++;
            return true;
        });
        return count[0];
    }

    /**
     * Walks until the first regular file matching {@code predicate}.
     */
    public boolean anyMatch(Path root, Predicate<FileEntry> predicate) {
        boolean[] found = {false};
        walk(root, (path, attrs) -> {
            found[0] = predicate.test(entry(path, attrs));
            return !found[0];
        });
        return found[0];
    }

    private FileEntry entry(Path path, BasicFileAttributes attrs) {
        return new FileEntry(path, attrs.lastModifiedTime().toInstant(), ctime(path, attrs).toInstant(), attrs.size());
    }

    private void walk(Path root, FileConsumer consumer) {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !consumer.accept(file, attrs)) {
                        return FileVisitResult.TERMINATE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
                    if (file.equals(root)) {
                        throw e;
                    }
                    if (e instanceof NoSuchFileException) {
                        log.debug("scan.vanished path={}", file);
                    } else {
                        log.warn("scan.unreadable path={} error={}", file, e.toString());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new TransientInfraException("Cannot read " + root + ": " + e.getMessage(), e);
        }
    }

    private FileTime ctime(Path path, BasicFileAttributes attrs) {
        if (unixView) {
            try {
                Object value = Files.getAttribute(path, "unix:ctime", LinkOption.NOFOLLOW_LINKS);
                if (value instanceof FileTime fileTime) {
                    return fileTime;
                }
            } catch (IOException | UnsupportedOperationException | IllegalArgumentException e) {
                log.debug("scan.ctimeUnavailable path={} error={}", path, e.toString());
            }
        }
        return attrs.creationTime();
    }

    /**
     * Receives each regular file; returning false ends the walk.
     */
    @FunctionalInterface
    private interface FileConsumer {
        boolean accept(Path path, BasicFileAttributes attrs);
    }
}
