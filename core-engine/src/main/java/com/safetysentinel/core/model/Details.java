package com.safetysentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copy helper for opaque detail maps and metric tags.
 *
 * <p>
 * Unlike {@link Map#copyOf(Map)} this tolerates {@code null} values, which
 * callers routinely put into event payloads.
 * </p>
 */
final class Details {

    private Details() {
        // utility class
    }

    static <V> Map<String, V> copyOf(Map<String, ? extends V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
