package com.planaccel.types;

import java.util.List;
import java.util.Objects;

public final class MapType extends DataType {

    private final DataType keyType;
    private final DataType valueType;

    public MapType(DataType keyType, DataType valueType) {
        super(TypeTag.MAP);
        this.keyType = Objects.requireNonNull(keyType, "keyType is null");
        this.valueType = Objects.requireNonNull(valueType, "valueType is null");
    }

    public DataType getKeyType() {
        return keyType;
    }

    public DataType getValueType() {
        return valueType;
    }

    @Override
    public List<DataType> getElementTypes() {
        return List.of(keyType, valueType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MapType that = (MapType) o;
        return keyType.equals(that.keyType) && valueType.equals(that.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeTag.MAP, keyType, valueType);
    }

    @Override
    public String toString() {
        return "MAP<" + keyType + "," + valueType + ">";
    }
}
