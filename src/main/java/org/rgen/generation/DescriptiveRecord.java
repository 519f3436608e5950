package org.rgen.generation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loosely-typed content produced by a generator: an ordered map of strings, numbers, booleans,
 * lists and nested maps. Typed getters fail with {@link IllegalArgumentException} naming the key
 * when a value is missing or has the wrong shape.
 */
public final class DescriptiveRecord {

    private final Map<String, Object> values;

    public DescriptiveRecord(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static DescriptiveRecord empty() {
        return new DescriptiveRecord(Map.of());
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * @return a copy with the key set to the value.
     */
    public DescriptiveRecord with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new DescriptiveRecord(copy);
    }

    public String getString(String key) {
        Object value = require(key);
        if (!(value instanceof String)) {
            throw wrongType(key, "string", value);
        }
        return (String) value;
    }

    public String getString(String key, String defaultValue) {
        return has(key) ? getString(key) : defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        Object value = values.get(key);
        if (!(value instanceof Number)) {
            throw wrongType(key, "number", value);
        }
        return ((Number) value).doubleValue();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        Object value = values.get(key);
        if (!(value instanceof Boolean)) {
            throw wrongType(key, "boolean", value);
        }
        return (Boolean) value;
    }

    /**
     * @return the list of strings, or an empty list if the key is absent.
     */
    public List<String> getStringList(String key) {
        if (!has(key)) {
            return List.of();
        }
        Object value = values.get(key);
        if (!(value instanceof List<?>)) {
            throw wrongType(key, "list", value);
        }
        List<String> result = new ArrayList<>();
        for (Object element : (List<?>) value) {
            if (!(element instanceof String)) {
                throw wrongType(key, "list of strings", value);
            }
            result.add((String) element);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return the nested record, or an empty record if the key is absent.
     */
    public DescriptiveRecord getRecord(String key) {
        if (!has(key)) {
            return empty();
        }
        Object value = values.get(key);
        if (!(value instanceof Map<?, ?>)) {
            throw wrongType(key, "object", value);
        }
        Map<String, Object> nested = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> nested.put(String.valueOf(k), v));
        return new DescriptiveRecord(nested);
    }

    private Object require(String key) {
        Object value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Record is missing required field '" + key + "'");
        }
        return value;
    }

    private static IllegalArgumentException wrongType(String key, String expected, Object actual) {
        return new IllegalArgumentException("Field '" + key + "' must be a " + expected + " but was "
            + (actual == null ? "null" : actual.getClass().getSimpleName()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DescriptiveRecord)) return false;
        return values.equals(((DescriptiveRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "DescriptiveRecord" + values;
    }
}
