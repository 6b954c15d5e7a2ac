package com.storage.manager.listing;

import com.storage.manager.core.exception.ValidationException;

import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;

/**
 * Sort keys for the volume listing. Unknown usage and creation times always sort last;
 * name is the tie-breaker.
 */
public enum VolumeSortField {
    NAME {
        @Override
        Comparator<VolumeSummary> primary(boolean descending) {
            return keyed(VolumeSummary::name, descending);
        }
    },
    USAGE {
        @Override
        Comparator<VolumeSummary> primary(boolean descending) {
            return keyed(VolumeSummary::usageBytes, descending);
        }
    },
    CREATED {
        @Override
        Comparator<VolumeSummary> primary(boolean descending) {
            return keyed(VolumeSummary::createdAt, descending);
        }
    };

    abstract Comparator<VolumeSummary> primary(boolean descending);

    public Comparator<VolumeSummary> comparator(boolean descending) {
        return primary(descending).thenComparing(VolumeSummary::name);
    }

    private static <T extends Comparable<? super T>> Comparator<VolumeSummary> keyed(
            Function<VolumeSummary, T> key, boolean descending) {
        Comparator<T> order = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        return Comparator.comparing(key, Comparator.nullsLast(order));
    }

    /**
     * Parses {@code name}, {@code usage} or {@code created}; null or blank means NAME.
     */
    public static VolumeSortField parse(String value) {
        if (value == null || value.isBlank()) {
            return NAME;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid sort '" + value + "'. Allowed values: name, usage, created");
        }
    }
}
