package com.gridcore.engine.exceptions;

public class BulkValidationException extends SpreadsheetException {
    public BulkValidationException(String message) {
        super("VALIDATION_FAILED", message);
    }
}
