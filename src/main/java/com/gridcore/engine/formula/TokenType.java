package com.gridcore.engine.formula;

public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    CELL_REF,
    IDENTIFIER,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    EOF
}
