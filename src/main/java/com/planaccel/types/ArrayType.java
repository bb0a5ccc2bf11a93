package com.planaccel.types;

import java.util.List;
import java.util.Objects;

public final class ArrayType extends DataType {

    private final DataType elementType;

    public ArrayType(DataType elementType) {
        super(TypeTag.ARRAY);
        this.elementType = Objects.requireNonNull(elementType, "elementType is null");
    }

    public DataType getElementType() {
        return elementType;
    }

    @Override
    public List<DataType> getElementTypes() {
        return List.of(elementType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return elementType.equals(((ArrayType) o).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeTag.ARRAY, elementType);
    }

    @Override
    public String toString() {
        return "ARRAY<" + elementType + ">";
    }
}
