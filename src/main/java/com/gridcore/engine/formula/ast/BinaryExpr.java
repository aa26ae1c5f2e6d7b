package com.gridcore.engine.formula.ast;

import java.util.Objects;

public final class BinaryExpr extends Expr {

    private final BinaryOperator operator;
    private final Expr left;
    private final Expr right;

    public BinaryExpr(BinaryOperator operator, Expr left, Expr right) {
        this.operator = Objects.requireNonNull(operator);
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expr getLeft() {
        return left;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryExpr)) {
            return false;
        }
        BinaryExpr that = (BinaryExpr) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return operator + "(" + left + ", " + right + ")";
    }
}
