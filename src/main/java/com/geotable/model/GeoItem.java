package com.geotable.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable item as stored in the table: a map of attribute names to values.
 * Nested maps and lists are copied on creation so callers can reuse their input.
 */
@EqualsAndHashCode
@ToString
public final class GeoItem {

    private final Map<String, Object> attributes;

    private GeoItem(Map<String, Object> attributes) {
        this.attributes = attributes;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GeoItem of(Map<String, Object> attributes) {
        if (attributes == null) {
            throw new IllegalArgumentException("Item attributes must not be null");
        }
        return new GeoItem(copyMap(attributes));
    }

    @JsonValue
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public String getString(String name) {
        Object value = attributes.get(name);
        return value != null ? value.toString() : null;
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    /**
     * Copy of this item with the given attributes set. Other attributes are untouched.
     */
    public GeoItem withAttributes(Map<String, Object> updates) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.putAll(updates);
        return of(copy);
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return copyMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(copyValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
