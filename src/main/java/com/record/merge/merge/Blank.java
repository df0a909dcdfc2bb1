package com.record.merge.merge;

import java.util.Collection;
import java.util.Map;

/**
 * Blankness test used by attribute precedence.
 * Null, empty or whitespace-only strings, and empty collections or maps are blank.
 * {@code false} and {@code 0} are values.
 */
public final class Blank {

    private Blank() {
    }

    public static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    public static boolean isPresent(Object value) {
        return !isBlank(value);
    }
}
