package com.planaccel.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered list of named fields. Relational plan nodes declare their output rows as a struct.
 */
public final class StructType extends DataType {

    private final List<Field> fields;

    public StructType(List<Field> fields) {
        super(TypeTag.STRUCT);
        this.fields = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(fields, "fields is null")));
    }

    /**
     * Builds a struct from a column-name to type map, preserving the map's iteration order.
     */
    public static StructType fromColumns(Map<String, DataType> columns) {
        List<Field> fields = new ArrayList<>();
        columns.forEach((name, type) -> fields.add(new Field(name, type)));
        return new StructType(fields);
    }

    public List<Field> getFields() {
        return fields;
    }

    public Map<String, DataType> toColumnMap() {
        Map<String, DataType> columns = new LinkedHashMap<>();
        for (Field field : fields) {
            columns.putIfAbsent(field.getName(), field.getType());
        }
        return columns;
    }

    /**
     * Concatenates the fields of two structs, as produced by a join.
     */
    public StructType concat(StructType other) {
        List<Field> combined = new ArrayList<>(fields);
        combined.addAll(other.fields);
        return new StructType(combined);
    }

    @Override
    public List<DataType> getElementTypes() {
        return fields.stream().map(Field::getType).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((StructType) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeTag.STRUCT, fields);
    }

    @Override
    public String toString() {
        return fields.stream()
                .map(Field::toString)
                .collect(Collectors.joining(",", "STRUCT<", ">"));
    }

    public static final class Field {
        private final String name;
        private final DataType type;

        public Field(String name, DataType type) {
            this.name = Objects.requireNonNull(name, "name is null");
            this.type = Objects.requireNonNull(type, "type is null");
        }

        public String getName() {
            return name;
        }

        public DataType getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Field that = (Field) o;
            return name.equals(that.name) && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type);
        }

        @Override
        public String toString() {
            return name + ":" + type;
        }
    }
}
