package com.planaccel.types;

/**
 * A scalar type without parameters (everything except decimals and containers).
 * Instances are exposed as constants on {@link DataTypes}.
 */
public final class PrimitiveType extends DataType {

    PrimitiveType(TypeTag tag) {
        super(tag);
        if (tag.isContainer() || tag == TypeTag.DECIMAL) {
            throw new IllegalArgumentException("Not a primitive type tag: " + tag);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getTag() == ((PrimitiveType) o).getTag();
    }

    @Override
    public int hashCode() {
        return getTag().hashCode();
    }

    @Override
    public String toString() {
        return getTag().name();
    }
}
