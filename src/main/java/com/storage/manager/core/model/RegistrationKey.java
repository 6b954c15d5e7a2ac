package com.storage.manager.core.model;

import com.storage.manager.core.exception.ValidationException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Unique key of a registration: a volume name plus a path relative to the volume root.
 *
 * <p>Paths are normalized on construction: always a leading {@code /}, no duplicate or
 * trailing separators, {@code .} segments dropped and {@code ..} segments folded.
 * A path that climbs above the volume root is rejected, so no key can ever point
 * outside its volume.</p>
 */
public record RegistrationKey(String volumeName, String path) implements Comparable<RegistrationKey> {

    public static final String ROOT = "/";

    public RegistrationKey {
        if (volumeName == null || volumeName.isBlank()) {
            throw new ValidationException("volume_name is required");
        }
        volumeName = volumeName.trim();
        path = normalizePath(path);
    }

    public static RegistrationKey of(String volumeName, String path) {
        return new RegistrationKey(volumeName, path);
    }

    /**
     * Normalizes a volume-relative path, rejecting traversal above the root.
     *
     * @throws ValidationException if the path is blank, contains NUL, or escapes the root
     */
    public static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("path is required");
        }
        if (path.indexOf('\0') >= 0) {
            throw new ValidationException("path must not contain NUL characters");
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.trim().replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    throw new ValidationException("path escapes the volume root: " + path);
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        return segments.isEmpty() ? ROOT : ROOT + String.join("/", segments);
    }

    /**
     * Returns true if this key covers the whole volume.
     */
    public boolean isVolumeRoot() {
        return ROOT.equals(path);
    }

    /**
     * Path without its leading separator, suitable for resolving against a mount root.
     */
    public String relativePath() {
        return path.substring(1);
    }

    @Override
    public int compareTo(RegistrationKey other) {
        int byVolume = volumeName.compareTo(other.volumeName);
        return byVolume != 0 ? byVolume : path.compareTo(other.path);
    }

    @Override
    public String toString() {
        return volumeName + ":" + path;
    }
}
