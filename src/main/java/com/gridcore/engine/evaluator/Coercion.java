package com.gridcore.engine.evaluator;

import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.ErrorType;

/**
 * Value conversions shared by operators and functions.
 */
public final class Coercion {

    private Coercion() {
    }

    /**
     * Numeric view of a scalar: numbers as is, booleans 1/0, empty 0, numeric text parsed.
     * Returns null when the value has no numeric meaning (errors included).
     */
    public static Double toNumber(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.asNumber();
            case BOOLEAN:
                return value.asBoolean() ? 1.0 : 0.0;
            case EMPTY:
                return 0.0;
            case STRING:
                return parseNumber(value.asString());
            default:
                return null;
        }
    }

    /**
     * Parses trimmed text as a finite double, or returns null.
     */
    public static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        char last = trimmed.charAt(trimmed.length() - 1);
        // Double.parseDouble accepts "1d", "1f", "NaN" and "Infinity"
        if (!Character.isDigit(last) && last != '.') {
            return null;
        }
        try {
            double d = Double.parseDouble(trimmed);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Truth value of a scalar, or null when it cannot be read as one.
     */
    public static Boolean toBoolean(CellValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return value.asBoolean();
            case NUMBER:
                return value.asNumber() != 0;
            case EMPTY:
                return false;
            case STRING:
                if (value.asString().equalsIgnoreCase("TRUE")) {
                    return true;
                }
                if (value.asString().equalsIgnoreCase("FALSE")) {
                    return false;
                }
                return null;
            default:
                return null;
        }
    }

    /**
     * Wraps a double, turning NaN and infinities into #NUM!.
     */
    public static CellValue numberResult(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return CellValue.error(ErrorType.NUM);
        }
        return CellValue.number(value);
    }
}
