package com.planaccel.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses type strings used in table definitions, e.g. {@code BIGINT}, {@code DECIMAL(10,2)},
 * {@code ARRAY<INT>}, {@code MAP<STRING,DOUBLE>} or {@code STRUCT<a:INT,b:STRING>}.
 * Common SQL aliases (INTEGER, VARCHAR, TINYINT, ...) are accepted; length parameters
 * on character types are ignored.
 */
public final class DataTypeParser {

    private final String input;
    private int pos;

    private DataTypeParser(String input) {
        this.input = input;
    }

    /**
     * @throws IllegalArgumentException if the string is not a valid type
     */
    public static DataType parse(String typeString) {
        Objects.requireNonNull(typeString, "typeString is null");
        DataTypeParser parser = new DataTypeParser(typeString);
        DataType type = parser.parseType();
        parser.skipWhitespace();
        if (parser.pos != typeString.length()) {
            throw parser.error("Unexpected trailing input");
        }
        return type;
    }

    private DataType parseType() {
        String name = readWord().toUpperCase(Locale.ROOT);
        switch (name) {
            case "BOOLEAN":
            case "BOOL":
                return DataTypes.BOOLEAN;
            case "TINYINT":
            case "BYTE":
                return DataTypes.BYTE;
            case "SMALLINT":
            case "SHORT":
                return DataTypes.SHORT;
            case "INT":
            case "INTEGER":
                return DataTypes.INT;
            case "BIGINT":
            case "LONG":
                return DataTypes.LONG;
            case "REAL":
            case "FLOAT":
                return DataTypes.FLOAT;
            case "DOUBLE":
                return DataTypes.DOUBLE;
            case "STRING":
            case "TEXT":
            case "VARCHAR":
            case "CHAR":
                skipOptionalLength();
                return DataTypes.STRING;
            case "BINARY":
            case "VARBINARY":
                return DataTypes.BINARY;
            case "DATE":
                return DataTypes.DATE;
            case "TIMESTAMP":
                return DataTypes.TIMESTAMP;
            case "NULL":
                return DataTypes.NULL;
            case "DECIMAL":
            case "NUMERIC":
                return parseDecimalParameters();
            case "ARRAY": {
                expect('<');
                DataType element = parseType();
                expect('>');
                return DataTypes.arrayOf(element);
            }
            case "MAP": {
                expect('<');
                DataType key = parseType();
                expect(',');
                DataType value = parseType();
                expect('>');
                return DataTypes.mapOf(key, value);
            }
            case "STRUCT":
            case "ROW":
                return parseStructFields();
            default:
                throw error("Unknown type '" + name + "'");
        }
    }

    private DataType parseDecimalParameters() {
        if (!peek('(')) {
            return DataTypes.decimal(10, 0);
        }
        expect('(');
        int precision = readInt();
        int scale = 0;
        if (peek(',')) {
            expect(',');
            scale = readInt();
        }
        expect(')');
        try {
            return DataTypes.decimal(precision, scale);
        } catch (IllegalArgumentException e) {
            throw error(e.getMessage());
        }
    }

    private DataType parseStructFields() {
        expect('<');
        List<StructType.Field> fields = new ArrayList<>();
        do {
            if (!fields.isEmpty()) {
                expect(',');
            }
            String fieldName = readWord();
            expect(':');
            fields.add(DataTypes.field(fieldName, parseType()));
        } while (peek(','));
        expect('>');
        return DataTypes.structOf(fields);
    }

    private void skipOptionalLength() {
        if (peek('(')) {
            expect('(');
            readInt();
            expect(')');
        }
    }

    private String readWord() {
        skipWhitespace();
        int start = pos;
        while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
            pos++;
        }
        if (start == pos) {
            throw error("Expected identifier");
        }
        return input.substring(start, pos);
    }

    private int readInt() {
        skipWhitespace();
        int start = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw error("Expected number");
        }
        return Integer.parseInt(input.substring(start, pos));
    }

    private boolean peek(char c) {
        skipWhitespace();
        return pos < input.length() && input.charAt(pos) == c;
    }

    private void expect(char c) {
        if (!peek(c)) {
            throw error("Expected '" + c + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at position " + pos + " in type string: " + input);
    }
}
