package com.storage.manager.algorithm;

import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.CleanupResult;
import com.storage.manager.core.model.FileEntry;
import com.storage.manager.core.model.ResolvedTarget;
import com.storage.manager.core.model.TargetStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deletes every file whose timestamp is strictly older than a single threshold:
 * {@code before_date} when given, otherwise {@code now - max_age_days}.
 * Directories are never removed, even if emptied.
 *
 * <p>Parameters: {@code before_date} (ISO-8601 instant, date-time or date; UTC assumed
 * without an offset), {@code max_age_days} (0 to 365000), {@code time_field} (mtime | ctime,
 * default mtime). One of the first two is required.</p>
 */
public class RemoveBeforeDateAlgorithm implements CleanupAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(RemoveBeforeDateAlgorithm.class);

    public static final String ID = "remove_before_date";
    static final String BEFORE_DATE = "before_date";
    static final String MAX_AGE_DAYS = "max_age_days";
    static final String TIME_FIELD = "time_field";
    /** About a thousand years; keeps {@code now - max_age_days} representable. */
    static final long MAX_AGE_DAYS_LIMIT = 365_000L;

    private final Clock clock;

    public RemoveBeforeDateAlgorithm() {
        this(Clock.systemUTC());
    }

    public RemoveBeforeDateAlgorithm(Clock clock) {
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
        if (parsed.beforeDate() != null) {
            canonical.put(BEFORE_DATE, parsed.beforeDate().toString());
        }
        if (parsed.maxAgeDays() != null) {
            canonical.put(MAX_AGE_DAYS, parsed.maxAgeDays());
        }
        canonical.put(TIME_FIELD, parsed.timeField().wireName());
        return canonical;
    }

    @Override
    public boolean shouldClean(TargetStats target, Map<String, ?> params) {
        Params parsed = parse(params);
        Instant threshold = parsed.threshold(clock);
        TimeField field = parsed.timeField();
        return target.anyFile(file -> field.of(file).isBefore(threshold));
    }

    @Override
    public CleanupResult clean(ResolvedTarget target, Map<String, ?> params, FileDeleter deleter) {
        Params parsed = parse(params);
        Instant threshold = parsed.threshold(clock);
        DeletionPass pass = new DeletionPass(deleter, clock);

        List<FileEntry> expired = new ArrayList<>();
        for (FileEntry file : target.files()) {
            if (parsed.timeField().of(file).isBefore(threshold)) {
                expired.add(file);
            }
        }
        TimeField field = parsed.timeField();
        expired.sort(Comparator.comparing((FileEntry file) -> field.of(file)).thenComparing(FileEntry::sortPath));

        for (FileEntry file : expired) {
            if (pass.stopRequested()) {
                break;
            }
            pass.delete(file);
        }

        CleanupResult result = pass.finish();
        log.info("removeBeforeDate.completed target={} threshold={} field={} result={}",
                target.root(), threshold, parsed.timeField().wireName(), result);
        return result;
    }

    private Params parse(Map<String, ?> params) {
        ParamReader reader = ParamReader.of(ID, params).allowOnly(Set.of(BEFORE_DATE, MAX_AGE_DAYS, TIME_FIELD));
        Instant beforeDate = reader.has(BEFORE_DATE) ? parseDate(reader.string(BEFORE_DATE)) : null;
        Long maxAgeDays = null;
        if (reader.has(MAX_AGE_DAYS)) {
            maxAgeDays = reader.requiredLong(MAX_AGE_DAYS);
            if (maxAgeDays < 0 || maxAgeDays > MAX_AGE_DAYS_LIMIT) {
                throw new ValidationException("max_age_days must be between 0 and " + MAX_AGE_DAYS_LIMIT);
            }
        }
        if (beforeDate == null && maxAgeDays == null) {
            throw new ValidationException("Either before_date or max_age_days must be provided");
        }
        return new Params(beforeDate, maxAgeDays, TimeField.parse(reader.raw(TIME_FIELD)));
    }

    static Instant parseDate(String value) {
        String normalized = value.trim();
        try {
            if (normalized.indexOf('T') < 0) {
                return LocalDate.parse(normalized).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(normalized, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ValidationException("before_date must be an ISO-8601 date or date-time, got '" + value + "'", e);
        }
    }

    private record Params(Instant beforeDate, Long maxAgeDays, TimeField timeField) {

        Instant threshold(Clock clock) {
            if (beforeDate != null) {
                return beforeDate;
            }
            return clock.instant().minus(Duration.ofDays(maxAgeDays));
        }
    }
}
