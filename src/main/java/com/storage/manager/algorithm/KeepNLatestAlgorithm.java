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
 * Keeps the {@code keep_count} most recent files (largest, for {@code sort_by=size})
 * and deletes the remainder, continuing in {@link SortBy#recencyOrder()}.
 *
 * <p>Parameters: {@code keep_count} (required, &gt;= 0), {@code sort_by} (default mtime).</p>
 */
public class KeepNLatestAlgorithm implements CleanupAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(KeepNLatestAlgorithm.class);

    public static final String ID = "keep_n_latest";
    static final String KEEP_COUNT = "keep_count";
    static final String SORT_BY = "sort_by";

    private final Clock clock;

    public KeepNLatestAlgorithm() {
        this(Clock.systemUTC());
    }

    public KeepNLatestAlgorithm(Clock clock) {
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
        canonical.put(KEEP_COUNT, parsed.keepCount());
        canonical.put(SORT_BY, parsed.sortBy().wireName());
        return canonical;
    }

    @Override
    public boolean shouldClean(TargetStats target, Map<String, ?> params) {
        return target.fileCount() > parse(params).keepCount();
    }

    @Override
    public CleanupResult clean(ResolvedTarget target, Map<String, ?> params, FileDeleter deleter) {
        Params parsed = parse(params);
        DeletionPass pass = new DeletionPass(deleter, clock);
        if (target.fileCount() <= parsed.keepCount()) {
            return pass.finish();
        }

        List<FileEntry> ordered = new ArrayList<>(target.files());
        ordered.sort(parsed.sortBy().recencyOrder());

        for (FileEntry file : ordered.subList(parsed.keepCount(), ordered.size())) {
            if (pass.stopRequested()) {
                break;
            }
            pass.delete(file);
        }

        CleanupResult result = pass.finish();
        log.info("keepNLatest.completed target={} kept={} result={}", target.root(), parsed.keepCount(), result);
        return result;
    }

    private Params parse(Map<String, ?> params) {
        ParamReader reader = ParamReader.of(ID, params).allowOnly(Set.of(KEEP_COUNT, SORT_BY));
        long keepCount = reader.requiredLong(KEEP_COUNT);
        if (keepCount < 0) {
            throw new ValidationException("keep_count must be >= 0");
        }
        if (keepCount > Integer.MAX_VALUE) {
            throw new ValidationException("keep_count is too large: " + keepCount);
        }
        return new Params((int) keepCount, SortBy.parse(reader.raw(SORT_BY)));
    }

    private record Params(int keepCount, SortBy sortBy) {
    }
}
