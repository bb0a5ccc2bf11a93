package com.planaccel.types;

import java.util.List;
import java.util.Map;

/**
 * Constants and factories for {@link DataType} instances.
 */
public final class DataTypes {

    private DataTypes() {}

    public static final PrimitiveType BOOLEAN = new PrimitiveType(TypeTag.BOOLEAN);
    public static final PrimitiveType BYTE = new PrimitiveType(TypeTag.BYTE);
    public static final PrimitiveType SHORT = new PrimitiveType(TypeTag.SHORT);
    public static final PrimitiveType INT = new PrimitiveType(TypeTag.INT);
    public static final PrimitiveType LONG = new PrimitiveType(TypeTag.LONG);
    public static final PrimitiveType FLOAT = new PrimitiveType(TypeTag.FLOAT);
    public static final PrimitiveType DOUBLE = new PrimitiveType(TypeTag.DOUBLE);
    public static final PrimitiveType STRING = new PrimitiveType(TypeTag.STRING);
    public static final PrimitiveType BINARY = new PrimitiveType(TypeTag.BINARY);
    public static final PrimitiveType DATE = new PrimitiveType(TypeTag.DATE);
    public static final PrimitiveType TIMESTAMP = new PrimitiveType(TypeTag.TIMESTAMP);
    public static final PrimitiveType NULL = new PrimitiveType(TypeTag.NULL);

    public static DecimalType decimal(int precision, int scale) {
        return new DecimalType(precision, scale);
    }

    public static ArrayType arrayOf(DataType elementType) {
        return new ArrayType(elementType);
    }

    public static MapType mapOf(DataType keyType, DataType valueType) {
        return new MapType(keyType, valueType);
    }

    public static StructType structOf(List<StructType.Field> fields) {
        return new StructType(fields);
    }

    public static StructType structOf(Map<String, DataType> columns) {
        return StructType.fromColumns(columns);
    }

    public static StructType.Field field(String name, DataType type) {
        return new StructType.Field(name, type);
    }

    /**
     * Returns the primitive constant for a tag.
     * @throws IllegalArgumentException for DECIMAL and container tags, which need parameters
     */
    public static PrimitiveType primitive(TypeTag tag) {
        switch (tag) {
            case BOOLEAN: return BOOLEAN;
            case BYTE: return BYTE;
            case SHORT: return SHORT;
            case INT: return INT;
            case LONG: return LONG;
            case FLOAT: return FLOAT;
            case DOUBLE: return DOUBLE;
            case STRING: return STRING;
            case BINARY: return BINARY;
            case DATE: return DATE;
            case TIMESTAMP: return TIMESTAMP;
            case NULL: return NULL;
            default:
                throw new IllegalArgumentException("Type tag " + tag + " is not a primitive type");
        }
    }

    /**
     * Common super type of two numeric types used for arithmetic result typing.
     * Integral types widen to the larger width, any floating point operand gives DOUBLE
     * (FLOAT when both are FLOAT), decimals combine into a decimal wide enough for both
     * operands, capped at {@link DecimalType#MAX_PRECISION}.
     *
     * @throws IllegalArgumentException if either type is not numeric
     */
    public static DataType widerNumeric(DataType left, DataType right) {
        TypeTag l = left.getTag();
        TypeTag r = right.getTag();
        if (l == TypeTag.NULL) return right;
        if (r == TypeTag.NULL) return left;
        if (!l.isNumeric() || !r.isNumeric()) {
            throw new IllegalArgumentException("Expected numeric operands, got " + left + " and " + right);
        }
        if (l.isFloatingPoint() || r.isFloatingPoint()) {
            return (l == TypeTag.FLOAT && r == TypeTag.FLOAT) ? FLOAT : DOUBLE;
        }
        if (l == TypeTag.DECIMAL || r == TypeTag.DECIMAL) {
            DecimalType ld = asDecimal(left);
            DecimalType rd = asDecimal(right);
            int scale = Math.max(ld.getScale(), rd.getScale());
            int integerDigits = Math.max(ld.getPrecision() - ld.getScale(), rd.getPrecision() - rd.getScale());
            int precision = Math.min(DecimalType.MAX_PRECISION, integerDigits + scale);
            return decimal(precision, Math.min(scale, precision));
        }
        return l.ordinal() >= r.ordinal() ? left : right;
    }

    private static DecimalType asDecimal(DataType type) {
        switch (type.getTag()) {
            case DECIMAL: return (DecimalType) type;
            case BYTE: return decimal(3, 0);
            case SHORT: return decimal(5, 0);
            case INT: return decimal(10, 0);
            case LONG: return decimal(20, 0);
            default:
                throw new IllegalArgumentException("Cannot convert " + type + " to a decimal");
        }
    }
}
