package com.gridcore.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A computed cell value: a number, text, a boolean, an error or empty.
 * Instances are immutable and compare by value.
 */
public final class CellValue {

    public enum Type {
        NUMBER, STRING, BOOLEAN, ERROR, EMPTY
    }

    public static final CellValue EMPTY = new CellValue(Type.EMPTY, 0, null, false, null);
    public static final CellValue TRUE = new CellValue(Type.BOOLEAN, 0, null, true, null);
    public static final CellValue FALSE = new CellValue(Type.BOOLEAN, 0, null, false, null);

    private final Type type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorType error;

    private CellValue(Type type, double number, String text, boolean bool, ErrorType error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
    }

    public static CellValue number(double value) {
        return new CellValue(Type.NUMBER, value, null, false, null);
    }

    public static CellValue string(String value) {
        return new CellValue(Type.STRING, 0, Objects.requireNonNull(value), false, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(ErrorType error) {
        return new CellValue(Type.ERROR, 0, null, false, Objects.requireNonNull(error));
    }

    public Type getType() {
        return type;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public boolean isBoolean() {
        return type == Type.BOOLEAN;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean isEmpty() {
        return type == Type.EMPTY;
    }

    public double asNumber() {
        return number;
    }

    public String asString() {
        return text;
    }

    public boolean asBoolean() {
        return bool;
    }

    public ErrorType getError() {
        return error;
    }

    /**
     * Text shown for this value; integral numbers drop the fraction, empty is "".
     */
    public String toDisplayString() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case STRING:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getCode();
            default:
                return "";
        }
    }

    /**
     * Plain representation for JSON output: Double, String, Boolean, error code or null.
     */
    @JsonValue
    public Object toJsonValue() {
        switch (type) {
            case NUMBER:
                return number;
            case STRING:
                return text;
            case BOOLEAN:
                return bool;
            case ERROR:
                return error.getCode();
            default:
                return null;
        }
    }

    /**
     * Formats a double so that parsing the result yields the same double.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        if (type != that.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, that.number) == 0;
            case STRING:
                return text.equals(that.text);
            case BOOLEAN:
                return bool == that.bool;
            case ERROR:
                return error == that.error;
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error);
    }

    @Override
    public String toString() {
        return type + "(" + toDisplayString() + ")";
    }
}
