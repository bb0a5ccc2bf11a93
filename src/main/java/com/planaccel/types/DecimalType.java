package com.planaccel.types;

import java.util.Objects;

/**
 * Fixed-point decimal with a precision of 1 to 38 digits and a scale between 0 and the precision.
 */
public final class DecimalType extends DataType {

    public static final int MAX_PRECISION = 38;

    private final int precision;
    private final int scale;

    public DecimalType(int precision, int scale) {
        super(TypeTag.DECIMAL);
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Decimal precision must be between 1 and " + MAX_PRECISION + ", got " + precision);
        }
        if (scale < 0 || scale > precision) {
            throw new IllegalArgumentException("Decimal scale must be between 0 and precision " + precision + ", got " + scale);
        }
        this.precision = precision;
        this.scale = scale;
    }

    public int getPrecision() {
        return precision;
    }

    public int getScale() {
        return scale;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DecimalType that = (DecimalType) o;
        return precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, scale);
    }

    @Override
    public String toString() {
        return "DECIMAL(" + precision + "," + scale + ")";
    }
}
