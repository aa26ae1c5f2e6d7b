package com.gridcore.engine.exceptions;

public class SheetNotFoundException extends SpreadsheetException {
    public SheetNotFoundException(String message) {
        super("SHEET_NOT_FOUND", message);
    }
}
