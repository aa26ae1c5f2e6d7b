package com.gridcore.engine.exceptions;

public class BatchNotFoundException extends SpreadsheetException {
    public BatchNotFoundException(String message) {
        super("BATCH_NOT_FOUND", message);
    }
}
