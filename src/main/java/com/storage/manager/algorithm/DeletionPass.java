package com.storage.manager.algorithm;

import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.CleanupStatus;
import com.storage.manager.core.model.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bookkeeping for one sequence of deletions, shared by all strategies.
 *
 * <p>A failed deletion is counted and skipped, never thrown; its bytes do not count
 * as freed. An interrupt on the worker thread stops further deletions, but nothing
 * already deleted is restored.</p>
 */
final class DeletionPass {
    private static final Logger log = LoggerFactory.getLogger(DeletionPass.class);

    private final FileDeleter deleter;
    private final Clock clock;
    private final Instant startedAt;
    private final List<String> errors = new ArrayList<>();

    private long filesRemoved;
    private long bytesFreed;
    private long filesFailed;
    private boolean interrupted;

    DeletionPass(FileDeleter deleter, Clock clock) {
        this.deleter = deleter;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Returns true once the worker thread has been interrupted (run timeout or shutdown).
     */
    boolean stopRequested() {
        if (!interrupted && Thread.currentThread().isInterrupted()) {
            interrupted = true;
            log.warn("cleanup.interrupted removed={} freed={}", filesRemoved, bytesFreed);
        }
        return interrupted;
    }

    /**
     * Attempts to delete one file.
     *
     * @return true if the file was deleted
     */
    boolean delete(FileEntry file) {
        try {
            deleter.delete(file.path());
            filesRemoved++;
            bytesFreed += file.size();
            log.debug("cleanup.deleted path={} size={}", file.path(), file.size());
            return true;
        } catch (IOException e) {
            filesFailed++;
            String summary = describe(file, e);
            if (errors.size() < CleanupResult.MAX_ERRORS) {
                errors.add(summary);
            }
            log.warn("cleanup.deleteFailed {}", summary);
            return false;
        }
    }

    long filesRemoved() {
        return filesRemoved;
    }

    CleanupResult finish() {
        Instant now = clock.instant();
        return new CleanupResult(filesRemoved, bytesFreed, filesFailed, errors,
                Duration.between(startedAt, now), CleanupStatus.COMPLETED, now);
    }

    private static String describe(FileEntry file, IOException e) {
        if (e instanceof NoSuchFileException) {
            return "file vanished: " + file.path();
        }
        if (e instanceof AccessDeniedException) {
            return "permission denied: " + file.path();
        }
        return e.getClass().getSimpleName() + " deleting " + file.path() +
                (e.getMessage() != null ? ": " + e.getMessage() : "");
    }
}
