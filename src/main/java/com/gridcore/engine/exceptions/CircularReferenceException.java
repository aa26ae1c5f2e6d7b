package com.gridcore.engine.exceptions;

public class CircularReferenceException extends SpreadsheetException {
    public CircularReferenceException(String message) {
        super("CIRCULAR_REFERENCE", message);
    }
}
