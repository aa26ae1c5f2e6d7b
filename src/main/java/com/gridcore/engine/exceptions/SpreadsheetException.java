package com.gridcore.engine.exceptions;

/**
 * Base type for every operation-level failure raised by the engine.
 * The code is stable and machine readable; it ends up in {@link ErrorResponse}.
 */
public class SpreadsheetException extends RuntimeException {

    private final String code;

    public SpreadsheetException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SpreadsheetException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
