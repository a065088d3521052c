package com.docrender.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered column definition of a {@link TableContent}.
 *
 * <p>The order of {@link #fields()} is the key order. Operations that do not explicitly reorder
 * columns must hand it on unchanged.
 *
 * @param fields columns in display order
 */
public record Schema(List<Field> fields) {

    /**
     * Compact constructor with validation.
     */
    public Schema {
        Objects.requireNonNull(fields, "fields must not be null");
        fields = List.copyOf(fields);
        Set<String> seen = new HashSet<>();
        for (Field field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException("duplicate field in schema: " + field.name());
            }
        }
    }

    /**
     * Creates a schema of plain fields with the given names, in the given order.
     *
     * @param keys column names
     * @return schema
     */
    public static Schema ofKeys(String... keys) {
        return ofKeys(List.of(keys));
    }

    /**
     * Creates a schema of plain fields with the given names, in the given order.
     *
     * @param keys column names
     * @return schema
     */
    public static Schema ofKeys(List<String> keys) {
        return new Schema(keys.stream().map(Field::of).toList());
    }

    /**
     * Returns the names of visible fields in key order.
     *
     * @return key order
     */
    public List<String> keyOrder() {
        return fields.stream().filter(field -> !field.hidden()).map(Field::name).toList();
    }

    /**
     * Returns the names of all fields, hidden ones included.
     *
     * @return field names in order
     */
    public List<String> fieldNames() {
        return fields.stream().map(Field::name).toList();
    }

    /**
     * Looks up a field by name.
     *
     * @param name field name
     * @return field, or empty if absent
     */
    public Optional<Field> findField(String name) {
        return fields.stream().filter(field -> field.name().equals(name)).findFirst();
    }

    /**
     * Returns whether a field with the given name exists.
     *
     * @param name field name
     * @return true if present
     */
    public boolean hasField(String name) {
        return findField(name).isPresent();
    }

    /**
     * Returns a new schema with the field inserted at the given position.
     *
     * @param position insertion index; {@code null} or beyond the end appends
     * @param field field to insert
     * @return new schema
     */
    public Schema withField(Integer position, Field field) {
        List<Field> copy = new ArrayList<>(fields);
        if (position == null || position >= copy.size()) {
            copy.add(field);
        } else {
            copy.add(position, field);
        }
        return new Schema(copy);
    }
}
