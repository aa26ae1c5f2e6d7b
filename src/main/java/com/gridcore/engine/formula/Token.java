package com.gridcore.engine.formula;

/**
 * A lexical token with its zero-based position in the formula text.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
