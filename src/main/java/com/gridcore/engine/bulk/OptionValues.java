package com.gridcore.engine.bulk;

import java.util.Locale;

/**
 * Loose enum lookup for option values: case and underscores are ignored,
 * so "percentDecrease", "PERCENT_DECREASE" and "percent_decrease" all match.
 */
final class OptionValues {

    private OptionValues() {
    }

    static <E extends Enum<E>> E lookup(Class<E> type, String value) {
        if (value == null) {
            return null;
        }
        String wanted = normalize(value);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(wanted)) {
                return constant;
            }
        }
        return null;
    }

    static <E extends Enum<E>> E require(Class<E> type, String value) {
        E constant = lookup(type, value);
        if (constant == null) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value);
        }
        return constant;
    }

    private static String normalize(String value) {
        return value.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
