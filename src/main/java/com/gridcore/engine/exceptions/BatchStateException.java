package com.gridcore.engine.exceptions;

/**
 * Raised when an operation conflicts with the current batch state,
 * e.g. beginning a second batch or undoing while one is open.
 */
public class BatchStateException extends SpreadsheetException {
    public BatchStateException(String code, String message) {
        super(code, message);
    }

    public static BatchStateException alreadyOpen(String openId) {
        return new BatchStateException("BATCH_ALREADY_OPEN",
                "Batch " + openId + " is already open; nested batches are not supported");
    }

    public static BatchStateException open(String openId, String operation) {
        return new BatchStateException("BATCH_OPEN",
                "Cannot " + operation + " while batch " + openId + " is open");
    }
}
