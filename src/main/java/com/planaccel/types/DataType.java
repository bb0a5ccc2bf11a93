package com.planaccel.types;

import java.util.List;

/**
 * Base class of all data types. Types are immutable values compared structurally.
 */
public abstract class DataType {

    private final TypeTag tag;

    protected DataType(TypeTag tag) {
        this.tag = tag;
    }

    public TypeTag getTag() {
        return tag;
    }

    /**
     * Element types directly contained in this type, in declaration order.
     * Empty for scalar types; the element type for arrays; key and value for maps;
     * the field types for structs.
     */
    public List<DataType> getElementTypes() {
        return List.of();
    }

    public boolean isNested() {
        return tag.isContainer();
    }

    /**
     * Depth of container nesting: 0 for scalars, 1 for {@code ARRAY<INT>}, 2 for
     * {@code ARRAY<ARRAY<INT>>} and so on.
     */
    public int nestingDepth() {
        int depth = 0;
        for (DataType element : getElementTypes()) {
            depth = Math.max(depth, element.nestingDepth());
        }
        return isNested() ? depth + 1 : 0;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
