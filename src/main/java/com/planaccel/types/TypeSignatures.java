package com.planaccel.types;

/**
 * Signatures shared by the built-in replacement rules.
 */
public final class TypeSignatures {

    private TypeSignatures() {}

    public static final TypeSignature BOOLEAN = TypeSignature.of(TypeTag.BOOLEAN);
    public static final TypeSignature INTEGRAL = TypeSignature.of(TypeTag.BYTE, TypeTag.SHORT, TypeTag.INT, TypeTag.LONG);
    public static final TypeSignature FP = TypeSignature.of(TypeTag.FLOAT, TypeTag.DOUBLE);
    public static final TypeSignature DOUBLE = TypeSignature.of(TypeTag.DOUBLE);
    public static final TypeSignature STRING = TypeSignature.of(TypeTag.STRING);
    public static final TypeSignature NULL = TypeSignature.of(TypeTag.NULL);

    /** Decimals that fit in a 64 bit unscaled value. */
    public static final TypeSignature DECIMAL_64 = TypeSignature.decimal(18);
    public static final TypeSignature DECIMAL_128 = TypeSignature.decimal(DecimalType.MAX_PRECISION);

    public static final TypeSignature NUMERIC = INTEGRAL.union(FP).union(DECIMAL_128);

    public static final TypeSignature DATETIME = TypeSignature.of(TypeTag.DATE, TypeTag.TIMESTAMP);

    /** Scalar types every accelerated operator is expected to move around. */
    public static final TypeSignature COMMON = BOOLEAN.union(NUMERIC).union(STRING).union(DATETIME).union(NULL);

    /** Types that have a defined total order, usable as sort or comparison keys. */
    public static final TypeSignature ORDERABLE = COMMON.union(TypeSignature.of(TypeTag.BINARY)).nested(TypeTag.ARRAY, TypeTag.STRUCT);

    public static final TypeSignature ALL = COMMON.union(TypeSignature.of(TypeTag.BINARY)).nested();
}
