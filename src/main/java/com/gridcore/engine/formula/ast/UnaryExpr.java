package com.gridcore.engine.formula.ast;

import java.util.Objects;

public final class UnaryExpr extends Expr {

    private final UnaryOperator operator;
    private final Expr operand;

    public UnaryExpr(UnaryOperator operator, Expr operand) {
        this.operator = Objects.requireNonNull(operator);
        this.operand = Objects.requireNonNull(operand);
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryExpr)) {
            return false;
        }
        UnaryExpr that = (UnaryExpr) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator + "(" + operand + ")";
    }
}
