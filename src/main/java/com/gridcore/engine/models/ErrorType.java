package com.gridcore.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Spreadsheet error values that live inside cells.
 */
public enum ErrorType {
    REF("#REF!"),
    DIV_ZERO("#DIV/0!"),
    NAME("#NAME?"),
    VALUE("#VALUE!"),
    CIRCULAR("#CIRCULAR!"),
    NUM("#NUM!");

    private final String code;

    ErrorType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Looks up an error by its display code, ignoring case. Returns null when unknown.
     */
    public static ErrorType fromCode(String code) {
        for (ErrorType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        return null;
    }
}
