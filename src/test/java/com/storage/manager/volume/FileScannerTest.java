package com.storage.manager.volume;

import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.model.FileEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileScanner")
class FileScannerTest {

    @TempDir
    Path dir;

    private final FileScanner scanner = new FileScanner();

    @Test
    @DisplayName("lists regular files recursively with size and mtime")
    void scan() throws IOException {
        Files.createDirectories(dir.resolve("a/b"));
        Path file = Files.write(dir.resolve("a/b/data.bin"), new byte[42]);
        Files.write(dir.resolve("top.txt"), new byte[8]);
        Instant mtime = Instant.parse("2026-02-03T04:05:06Z");
        Files.setLastModifiedTime(file, FileTime.from(mtime));

        List<FileEntry> entries = scanner.scan(dir);

        assertEquals(2, entries.size());
        FileEntry data = entries.stream().filter(e -> e.path().equals(file)).findFirst().orElseThrow();
        assertEquals(42, data.size());
        assertEquals(mtime, data.mtime());
        assertNotNull(data.ctime());
        assertEquals(50, scanner.totalBytes(dir));
    }

    @Test
    @DisplayName("counts files and stops matching at the first hit")
    void countAndMatch() throws IOException {
        Files.write(dir.resolve("one"), new byte[1]);
        Files.write(dir.resolve("two"), new byte[2]);
        Files.write(dir.resolve("three"), new byte[3]);
        int[] tested = {0};

        assertEquals(3, scanner.countFiles(dir));
        assertTrue(scanner.anyMatch(dir, entry -> ++tested[0] > 0));
        assertEquals(1, tested[0]);
        assertFalse(scanner.anyMatch(dir, entry -> entry.size() > 3));
    }

    @Test
    @DisplayName("does not follow symbolic links")
    void noSymlinks() throws IOException {
        Path outside = Files.createDirectories(dir.resolve("outside"));
        Files.write(outside.resolve("secret"), new byte[1000]);
        Path root = Files.createDirectories(dir.resolve("root"));
        Files.write(root.resolve("own"), new byte[1]);
        Files.createSymbolicLink(root.resolve("link"), outside);
        Files.createSymbolicLink(root.resolve("file-link"), outside.resolve("secret"));

        assertEquals(1, scanner.scan(root).size());
        assertEquals(1, scanner.totalBytes(root));
    }

    @Test
    @DisplayName("a missing root is a transient failure")
    void missingRoot() {
        assertThrows(TransientInfraException.class, () -> scanner.scan(dir.resolve("gone")));
    }

    @Test
    @DisplayName("falls back to creation time without the unix attribute view")
    void creationTimeFallback() throws IOException {
        Files.write(dir.resolve("f"), new byte[1]);
        FileEntry entry = new FileScanner(false).scan(dir).get(0);
        assertEquals(Files.readAttributes(dir.resolve("f"),
                BasicFileAttributes.class).creationTime().toInstant(), entry.ctime());
    }
}
