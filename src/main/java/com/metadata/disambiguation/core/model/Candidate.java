package com.metadata.disambiguation.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted record considered as a possible match for a {@link Node}.
 * Identity is the stored label plus the record id.
 *
 * @param label      graph label the record is stored under
 * @param id         record id
 * @param type       fully-qualified concrete subtype tag, e.g. {@code share.article}
 * @param properties column values of the record; null values are dropped
 */
public record Candidate(String label, long id, String type, Map<String, Object> properties) {

    public Candidate {
        Objects.requireNonNull(label, "label is required");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (properties != null) {
            properties.forEach((column, value) -> {
                if (column != null && value != null) {
                    copy.put(column, value);
                }
            });
        }
        properties = Collections.unmodifiableMap(copy);
    }

    public Object property(String column) {
        return properties.get(column);
    }

    public String stringProperty(String column) {
        Object value = properties.get(column);
        return value != null ? value.toString() : null;
    }

    /**
     * Returns a numeric column as a long, or null if absent or not a number.
     */
    public Long longProperty(String column) {
        Object value = properties.get(column);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * The unqualified subtype name, e.g. {@code article} for {@code share.article}.
     */
    public String modelName() {
        if (type == null) {
            return null;
        }
        int dot = type.lastIndexOf('.');
        return dot >= 0 ? type.substring(dot + 1) : type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Candidate that = (Candidate) o;
        return id == that.id && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, id);
    }

    @Override
    public String toString() {
        return "Candidate{" + label + ":" + id + ", type='" + type + "'}";
    }
}
