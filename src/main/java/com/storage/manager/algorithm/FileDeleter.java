package com.storage.manager.algorithm;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Abstracts deletion so that ordering and failure handling can be tested deterministically.
 */
@FunctionalInterface
public interface FileDeleter {

    void delete(Path path) throws IOException;

    /**
     * Deletes with {@link Files#delete}, so a vanished file is reported as a failure.
     */
    static FileDeleter defaultDeleter() {
        return Files::delete;
    }
}
