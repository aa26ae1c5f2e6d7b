package com.gridcore.engine.bulk;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum TransformType {
    UPPER,
    LOWER,
    TRIM,
    CLEAN,
    PROPER;

    @JsonCreator
    public static TransformType fromValue(String value) {
        return OptionValues.require(TransformType.class, value);
    }
}
