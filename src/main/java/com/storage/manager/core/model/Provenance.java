package com.storage.manager.core.model;

import java.util.Locale;

/**
 * Origin of a registration. Governs prune rights: discovery sweeps may only
 * remove or overwrite {@link #LABEL} registrations.
 */
public enum Provenance {
    API,
    LABEL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Provenance fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("provenance must not be blank");
        }
        return Provenance.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
