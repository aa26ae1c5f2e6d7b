package com.gridcore.engine.exceptions;

public class InvalidAddressException extends SpreadsheetException {
    public InvalidAddressException(String message) {
        super("INVALID_ADDRESS", message);
    }
}
