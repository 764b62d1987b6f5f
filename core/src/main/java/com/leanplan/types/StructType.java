package com.leanplan.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Represents a record type (row schema) with ordered, uniquely named fields.
 *
 * <p>This is the schema of every row-oriented expression node. Two record types are equal
 * iff they hold the same (name, type) pairs in the same order.
 */
public final class StructType implements DataType {

    /** Empty record type with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private final List<StructField> fields;

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     * @throws IllegalArgumentException if two fields share a name
     */
    public StructType(List<StructField> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
        Set<String> seen = new HashSet<>();
        for (StructField field : this.fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException("Duplicate field name: " + field.name());
            }
        }
    }

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Creates a single-field record.
     *
     * @param name the field name
     * @param dataType the field type
     * @return the record type
     */
    public static StructType of(String name, DataType dataType) {
        return new StructType(new StructField(name, dataType));
    }

    /**
     * Returns the fields in this struct.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return fields;
    }

    /**
     * Returns the field names in schema order.
     *
     * @return an unmodifiable list of names
     */
    public List<String> fieldNames() {
        return fields.stream().map(StructField::name).collect(Collectors.toUnmodifiableList());
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns the field at the given index.
     *
     * @param index the field index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the field with the given name, or null if not found.
     *
     * @param name the field name
     * @return the field, or null if not found
     */
    public StructField fieldByName(String name) {
        return fields.stream()
            .filter(f -> f.name().equals(name))
            .findFirst()
            .orElse(null);
    }

    /**
     * Returns the index of the field with the given name, or -1 if not found.
     *
     * @param name the field name
     * @return the field index, or -1 if not found
     */
    public int fieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(String name) {
        return fieldIndex(name) >= 0;
    }

    /**
     * Returns whether every given name is a field of this record.
     *
     * @param names the names to check
     * @return true if all names are present
     */
    public boolean containsAll(Collection<String> names) {
        return names.stream().allMatch(this::contains);
    }

    /**
     * Restricts this record to the given names, in the given order.
     *
     * @param names the field names to keep
     * @return the restricted record
     * @throws IllegalArgumentException if a name is not a field of this record
     */
    public StructType restrict(List<String> names) {
        List<StructField> restricted = new ArrayList<>(names.size());
        for (String name : names) {
            StructField field = fieldByName(name);
            if (field == null) {
                throw new IllegalArgumentException(
                    "Field '" + name + "' not found in " + this);
            }
            restricted.add(field);
        }
        return new StructType(restricted);
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return fields.stream()
            .map(StructField::toString)
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
