package com.jirasync.webhooks.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** Lenient field access over the nested maps Jackson produces for a payload. */
final class PayloadFields {

    private PayloadFields() {}

    /**
     * Returns a scalar field as text. Numbers and booleans are converted,
     * blanks and nested objects yield {@code null}.
     */
    static String text(Map<String, Object> map, String field) {
        if (map == null) return null;
        Object value = map.get(field);
        if (value instanceof String) {
            String s = ((String) value).trim();
            return s.isEmpty() ? null : s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return null;
    }

    /**
     * Returns a copy of a nested object with its keys as text, or {@code null}
     * if the field is absent or not an object.
     */
    static Map<String, Object> object(Map<String, Object> map, String field) {
        if (map == null || !(map.get(field) instanceof Map<?, ?> nested)) return null;
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : nested.entrySet()) {
            copy.put(String.valueOf(e.getKey()), e.getValue());
        }
        return copy;
    }

    /**
     * Reads a field that is either a plain string or an object with a
     * {@code name}, like Jira's {@code status}.
     */
    static String textOrName(Map<String, Object> map, String field) {
        Map<String, Object> nested = object(map, field);
        return nested != null ? text(nested, "name") : text(map, field);
    }
}
