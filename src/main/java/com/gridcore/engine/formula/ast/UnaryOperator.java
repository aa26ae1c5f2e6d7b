package com.gridcore.engine.formula.ast;

public enum UnaryOperator {
    NEGATE,
    PLUS,
    PERCENT
}
