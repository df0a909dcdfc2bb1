package com.record.merge.graph;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inlines {@code $name} parameters into a Cypher statement as literals.
 * Supports strings, numbers, booleans, null, collections (as lists) and maps (as map literals).
 */
public final class CypherLiterals {

    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private CypherLiterals() {
    }

    /**
     * Substitutes every {@code $name} placeholder that has a parameter.
     * Longer names are replaced first so {@code $id} never clobbers {@code $ids}.
     */
    public static String render(String query, Map<String, Object> params) {
        String result = query;
        var names = params.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        for (String name : names) {
            Pattern placeholder = Pattern.compile("\\$" + Pattern.quote(name) + "(?![A-Za-z0-9_])");
            result = placeholder.matcher(result)
                    .replaceAll(Matcher.quoteReplacement(format(params.get(name))));
        }
        return result;
    }

    public static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> collection) {
            StringBuilder sb = new StringBuilder("[");
            boolean first = true;
            for (Object element : collection) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(format(element));
                first = false;
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(key(String.valueOf(entry.getKey()))).append(": ").append(format(entry.getValue()));
                first = false;
            }
            return sb.append('}').toString();
        }
        return quote(value.toString());
    }

    private static String key(String key) {
        if (SAFE_KEY.matcher(key).matches()) {
            return key;
        }
        return "`" + key.replace("`", "``") + "`";
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
