package com.storage.manager.algorithm;

import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.FileEntry;
import com.storage.manager.core.model.ResolvedTarget;
import com.storage.manager.core.model.TargetStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Caps the total size of a target. Files are deleted in {@link SortBy#evictionOrder()}
 * until the remaining total is at or below {@code max_bytes}.
 *
 * <p>Parameters: {@code max_bytes} (required, &gt; 0), {@code sort_by} (mtime | ctime | size,
 * default mtime).</p>
 */
public class MaxSizeAlgorithm implements CleanupAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(MaxSizeAlgorithm.class);

    public static final String ID = "max_size";
    static final String MAX_BYTES = "max_bytes";
    static final String SORT_BY = "sort_by";

    private final Clock clock;

    public MaxSizeAlgorithm() {
        this(Clock.systemUTC());
    }

    public MaxSizeAlgorithm(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Map<String, Object> validate(Map<String, ?> params) {
        Params parsed = parse(params);
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put(MAX_BYTES, parsed.maxBytes());
        canonical.put(SORT_BY, parsed.sortBy().wireName());
        return canonical;
    }

    @Override
    public boolean shouldClean(TargetStats target, Map<String, ?> params) {
        return target.totalBytes() > parse(params).maxBytes();
    }

    @Override
    public CleanupResult clean(ResolvedTarget target, Map<String, ?> params, FileDeleter deleter) {
        Params parsed = parse(params);
        DeletionPass pass = new DeletionPass(deleter, clock);

        long remaining = target.totalBytes();
        if (remaining <= parsed.maxBytes()) {
            return pass.finish();
        }

        List<FileEntry> ordered = new ArrayList<>(target.files());
        ordered.sort(parsed.sortBy().evictionOrder());

        for (FileEntry file : ordered) {
            if (remaining <= parsed.maxBytes() || pass.stopRequested()) {
                break;
            }
            if (pass.delete(file)) {
                remaining -= file.size();
            }
        }

        CleanupResult result = pass.finish();
        log.info("maxSize.completed target={} remaining={} limit={} result={}",
                target.root(), remaining, parsed.maxBytes(), result);
        return result;
    }

    private Params parse(Map<String, ?> params) {
        ParamReader reader = ParamReader.of(ID, params).allowOnly(Set.of(MAX_BYTES, SORT_BY));
        long maxBytes = reader.requiredLong(MAX_BYTES);
        if (maxBytes <= 0) {
            throw new ValidationException("max_bytes must be greater than 0");
        }
        return new Params(maxBytes, SortBy.parse(reader.raw(SORT_BY)));
    }

    private record Params(long maxBytes, SortBy sortBy) {
    }
}
