package com.storage.manager.listing;

import com.storage.manager.core.exception.ValidationException;

import java.util.Locale;

/**
 * Filter and ordering for {@link VolumeListingService#list(VolumeQuery)}.
 *
 * @param nameContains case-insensitive substring of the volume name, null for all
 * @param registered   true for volumes with registrations only, false for those without, null for all
 * @param sort         sort key
 * @param descending   reverse the order
 */
public record VolumeQuery(String nameContains, Boolean registered, VolumeSortField sort, boolean descending) {

    public VolumeQuery {
        if (nameContains != null && nameContains.isBlank()) {
            nameContains = null;
        }
        sort = sort != null ? sort : VolumeSortField.NAME;
    }

    public static VolumeQuery all() {
        return new VolumeQuery(null, null, VolumeSortField.NAME, false);
    }

    /**
     * Builds a query from raw request parameters.
     *
     * @throws ValidationException for an unknown sort key or order
     */
    public static VolumeQuery of(String name, Boolean registered, String sort, String order) {
        return new VolumeQuery(name, registered, VolumeSortField.parse(sort), parseDescending(order));
    }

    boolean matchesName(String volumeName) {
        return nameContains == null
                || volumeName.toLowerCase(Locale.ROOT).contains(nameContains.toLowerCase(Locale.ROOT));
    }

    private static boolean parseDescending(String order) {
        if (order == null || order.isBlank() || order.equalsIgnoreCase("asc")) {
            return false;
        }
        if (order.equalsIgnoreCase("desc")) {
            return true;
        }
        throw new ValidationException("Invalid order '" + order + "'. Allowed values: asc, desc");
    }
}
