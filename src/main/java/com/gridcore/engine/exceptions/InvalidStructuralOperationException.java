package com.gridcore.engine.exceptions;

public class InvalidStructuralOperationException extends SpreadsheetException {
    public InvalidStructuralOperationException(String message) {
        super("INVALID_STRUCTURAL_OPERATION", message);
    }
}
