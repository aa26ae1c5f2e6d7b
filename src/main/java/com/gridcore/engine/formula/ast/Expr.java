package com.gridcore.engine.formula.ast;

/**
 * Base class of the formula syntax tree. The node set is closed;
 * consumers dispatch through {@link ExprVisitor}.
 */
public abstract class Expr {

    public abstract <R> R accept(ExprVisitor<R> visitor);
}
