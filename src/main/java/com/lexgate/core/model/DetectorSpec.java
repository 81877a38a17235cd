package com.lexgate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strategy selection plus its free-form parameters, as written in the TF document.
 */
public record DetectorSpec(DetectorKind kind, Map<String, Object> params) {

    public DetectorSpec {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static DetectorSpec of(DetectorKind kind) {
        return new DetectorSpec(kind, Map.of());
    }

    public String stringParam(String name, String fallback) {
        Object value = params.get(name);
        return value == null ? fallback : String.valueOf(value);
    }

    public int intParam(String name, int fallback) {
        Object value = params.get(name);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + name + "' is not an integer: " + s, e);
            }
        }
        return fallback;
    }

    public boolean booleanParam(String name, boolean fallback) {
        Object value = params.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        return value == null ? fallback : Boolean.parseBoolean(String.valueOf(value));
    }

    public List<String> listParam(String name, List<String> fallback) {
        Object value = params.get(name);
        if (value == null) {
            return fallback;
        }
        if (value instanceof List<?> list) {
            var result = new ArrayList<String>(list.size());
            for (Object item : list) {
                result.add(String.valueOf(item));
            }
            return List.copyOf(result);
        }
        return List.of(String.valueOf(value));
    }

    /** Returns a string-to-string map parameter in document order; null values become empty strings. */
    public Map<String, String> mapParam(String name, Map<String, String> fallback) {
        Object value = params.get(name);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be a mapping");
        }
        var result = new LinkedHashMap<String, String>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v == null ? "" : String.valueOf(v)));
        return result;
    }
}
