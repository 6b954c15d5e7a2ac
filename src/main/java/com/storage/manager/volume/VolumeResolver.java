package com.storage.manager.volume;

import com.storage.manager.core.exception.NotFoundException;
import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.RegistrationKey;
import com.storage.manager.core.model.FileEntry;
import com.storage.manager.core.model.ResolvedTarget;
import com.storage.manager.core.model.TargetStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Predicate;

/**
 * Maps a volume name plus a volume-relative path to an absolute, validated location.
 *
 * <p>Two layers guard against escaping the volume root. Lexically, {@link RegistrationKey}
 * refuses {@code ..} traversal above the root at registration time. At resolution time,
 * the real path (symlinks followed) must still lie under the real mount root.</p>
 */
public class VolumeResolver {
    private static final Logger log = LoggerFactory.getLogger(VolumeResolver.class);

    private final ContainerRuntime runtime;
    private final FileScanner scanner;

    public VolumeResolver(ContainerRuntime runtime) {
        this(runtime, new FileScanner());
    }

    public VolumeResolver(ContainerRuntime runtime, FileScanner scanner) {
        this.runtime = runtime;
        this.scanner = scanner;
    }

    /**
     * Lexical validation performed before a registration is stored.
     *
     * @return the normalized path
     * @throws ValidationException if the path is blank or escapes the volume root
     */
    public static String validateRelativePath(String path) {
        return RegistrationKey.normalizePath(path);
    }

    /**
     * Looks up a volume in the container runtime.
     *
     * @throws NotFoundException       if the runtime does not know the volume
     * @throws TransientInfraException if the runtime cannot be reached
     */
    public VolumeInfo requireVolume(String volumeName) {
        return runtime.inspectVolume(volumeName)
                .orElseThrow(() -> new NotFoundException("Unknown volume: " + volumeName));
    }

    public Path resolve(String volumeName, String path) {
        return resolve(RegistrationKey.of(volumeName, path));
    }

    /**
     * Resolves a key to the real path of its target.
     *
     * @throws NotFoundException       for an unknown volume
     * @throws ValidationException     if the target escapes the volume root
     * @throws TransientInfraException if the runtime is unreachable, the volume has no mountpoint,
     *                                 or the target does not currently exist
     */
    public Path resolve(RegistrationKey key) {
        VolumeInfo volume = requireVolume(key.volumeName());
        if (volume.mountpoint() == null || volume.mountpoint().isBlank()) {
            throw new TransientInfraException("Volume " + key.volumeName() + " has no mountpoint");
        }

        Path root = Paths.get(volume.mountpoint()).toAbsolutePath().normalize();
        Path resolved = root.resolve(key.relativePath()).normalize();
        if (!resolved.startsWith(root)) {
            throw new ValidationException("Path " + key.path() + " escapes the root of volume " + key.volumeName());
        }
        if (!Files.exists(resolved, LinkOption.NOFOLLOW_LINKS)) {
            throw new TransientInfraException("Target " + key + " does not exist at " + resolved);
        }

        try {
            Path realRoot = root.toRealPath();
            Path real = resolved.toRealPath();
            if (!real.startsWith(realRoot)) {
                log.warn("resolve.symlinkEscape key={} real={} root={}", key, real, realRoot);
                throw new ValidationException("Path " + key.path() + " resolves outside volume " + key.volumeName());
            }
            return real;
        } catch (IOException e) {
            throw new TransientInfraException("Cannot resolve " + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves a key and enumerates its files for one cleanup run.
     */
    public ResolvedTarget resolveTarget(RegistrationKey key) {
        return enumerate(inspectTarget(key));
    }

    /**
     * Resolves a key without enumerating it. Each figure of the returned view is computed
     * on first use by a walk that keeps no file list.
     */
    public TargetStats inspectTarget(RegistrationKey key) {
        return new ScannedTargetStats(key, resolve(key), scanner);
    }

    /**
     * Enumerates the files of an already resolved target.
     */
    public ResolvedTarget enumerate(TargetStats stats) {
        if (stats instanceof ResolvedTarget resolved) {
            return resolved;
        }
        return ResolvedTarget.of(stats.key(), stats.root(), scanner.scan(stats.root()));
    }

    /**
     * Current total bytes under a key's target.
     */
    public long usage(RegistrationKey key) {
        return scanner.totalBytes(resolve(key));
    }

    /**
     * Total bytes under a volume's mountpoint, or -1 if the mountpoint is not readable here.
     */
    public long volumeUsage(VolumeInfo volume) {
        if (volume.mountpoint() == null || volume.mountpoint().isBlank()) {
            return -1;
        }
        Path root = Paths.get(volume.mountpoint());
        if (!Files.isDirectory(root)) {
            return -1;
        }
        return scanner.totalBytes(root);
    }

    public ContainerRuntime runtime() {
        return runtime;
    }

    private static final class ScannedTargetStats implements TargetStats {
        private final RegistrationKey key;
        private final Path root;
        private final FileScanner scanner;
        private Long totalBytes;
        private Integer fileCount;

        ScannedTargetStats(RegistrationKey key, Path root, FileScanner scanner) {
            this.key = key;
            this.root = root;
            this.scanner = scanner;
        }

        @Override
        public RegistrationKey key() {
            return key;
        }

        @Override
        public Path root() {
            return root;
        }

        @Override
        public long totalBytes() {
            if (totalBytes == null) {
                totalBytes = scanner.totalBytes(root);
            }
            return totalBytes;
        }

        @Override
        public int fileCount() {
            if (fileCount == null) {
                fileCount = scanner.countFiles(root);
            }
            return fileCount;
        }

        @Override
        public boolean anyFile(Predicate<FileEntry> predicate) {
            return scanner.anyMatch(root, predicate);
        }
    }
}
