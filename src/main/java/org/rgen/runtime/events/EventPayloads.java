package org.rgen.runtime.events;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes event payloads into immutable JSON-like values: strings, booleans, longs, doubles,
 * lists, string-keyed maps and null. Integral numbers become {@link Long} and fractional numbers
 * {@link Double}, so both snapshot encodings reproduce a payload exactly.
 */
public final class EventPayloads {

    private EventPayloads() {
    }

    /**
     * @param payload raw payload, may be null (treated as empty).
     * @return an immutable, insertion-ordered copy.
     * @throws IllegalArgumentException if a value is not JSON-like, including NaN and infinities.
     */
    public static Map<String, Object> normalize(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Payload keys must not be null");
            }
            copy.put(entry.getKey(), normalizeValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Builds a payload from alternating key/value arguments.
     */
    public static Map<String, Object> of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs but got " + keysAndValues.length + " arguments");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return normalize(map);
    }

    private static Object normalizeValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Long) {
            return value;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number)) {
                throw new IllegalArgumentException("Payload numbers must be finite: " + number);
            }
            return number;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Enum<?>) {
            return ((Enum<?>) value).name();
        }
        if (value instanceof Map<?, ?>) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new IllegalArgumentException("Nested payload keys must be strings: " + entry.getKey());
                }
                nested.put((String) entry.getKey(), normalizeValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof Iterable<?>) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Iterable<?>) value) {
                list.add(normalizeValue(element));
            }
            return Collections.unmodifiableList(list);
        }
        throw new IllegalArgumentException("Unsupported payload value type: " + value.getClass().getName());
    }
}
