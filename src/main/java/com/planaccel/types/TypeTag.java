package com.planaccel.types;

/**
 * The fixed enumeration of data-type tags known to the planner.
 * Container tags ({@link #ARRAY}, {@link #MAP}, {@link #STRUCT}) carry element types,
 * {@link #DECIMAL} carries precision and scale.
 */
public enum TypeTag {
    BOOLEAN,
    BYTE,
    SHORT,
    INT,
    LONG,
    FLOAT,
    DOUBLE,
    STRING,
    BINARY,
    DATE,
    TIMESTAMP,
    NULL,
    DECIMAL,
    ARRAY,
    MAP,
    STRUCT;

    public boolean isContainer() {
        return this == ARRAY || this == MAP || this == STRUCT;
    }

    public boolean isIntegral() {
        return this == BYTE || this == SHORT || this == INT || this == LONG;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT || this == DOUBLE;
    }

    public boolean isNumeric() {
        return isIntegral() || isFloatingPoint() || this == DECIMAL;
    }
}
