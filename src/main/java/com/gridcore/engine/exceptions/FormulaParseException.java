package com.gridcore.engine.exceptions;

/**
 * Thrown by the formula parser on malformed input.
 * Carries the zero-based position in the formula text and the offending token.
 */
public class FormulaParseException extends SpreadsheetException {

    private final int position;
    private final String token;

    public FormulaParseException(String message, int position, String token) {
        super("PARSE_ERROR", message + " at position " + position
                + (token == null || token.isEmpty() ? "" : " near '" + token + "'"));
        this.position = position;
        this.token = token;
    }

    public int getPosition() {
        return position;
    }

    public String getToken() {
        return token;
    }
}
