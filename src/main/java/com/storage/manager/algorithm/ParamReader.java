package com.storage.manager.algorithm;

import com.storage.manager.core.exception.ValidationException;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Typed access to a raw parameter map. Values coming from container labels are
 * strings, values coming from the API are JSON scalars; both are accepted.
 */
final class ParamReader {

    private final String algorithm;
    private final Map<String, ?> params;

    private ParamReader(String algorithm, Map<String, ?> params) {
        this.algorithm = algorithm;
        this.params = params != null ? params : Map.of();
    }

    static ParamReader of(String algorithm, Map<String, ?> params) {
        return new ParamReader(algorithm, params);
    }

    /**
     * Rejects any key outside the algorithm's schema.
     */
    ParamReader allowOnly(Set<String> allowed) {
        Set<String> unknown = new TreeSet<>(params.keySet());
        unknown.removeAll(allowed);
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown parameter(s) for " + algorithm + ": " + unknown +
                    ". Allowed: " + new TreeSet<>(allowed));
        }
        return this;
    }

    boolean has(String name) {
        Object value = params.get(name);
        return value != null && !value.toString().isBlank();
    }

    Object raw(String name) {
        return params.get(name);
    }

    String string(String name) {
        Object value = params.get(name);
        return value != null ? value.toString().trim() : null;
    }

    long requiredLong(String name) {
        if (!has(name)) {
            throw new ValidationException(algorithm + " requires parameter '" + name + "'");
        }
        return toLong(name, params.get(name));
    }

    private long toLong(String name, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new ValidationException("Parameter '" + name + "' must be an integer, got " + value);
            }
            return (long) d;
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Parameter '" + name + "' must be an integer, got '" + s + "'", e);
            }
        }
        throw new ValidationException("Parameter '" + name + "' must be an integer, got " +
                value.getClass().getSimpleName());
    }
}
