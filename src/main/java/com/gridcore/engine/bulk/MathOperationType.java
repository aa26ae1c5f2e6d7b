package com.gridcore.engine.bulk;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum MathOperationType {
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    MODULO,
    PERCENT,
    PERCENT_DECREASE,
    ROUND,
    FLOOR,
    CEIL;

    /**
     * True for operations that only use the decimal places, not an operand.
     */
    public boolean isRounding() {
        return this == ROUND || this == FLOOR || this == CEIL;
    }

    @JsonCreator
    public static MathOperationType fromValue(String value) {
        return OptionValues.require(MathOperationType.class, value);
    }
}
