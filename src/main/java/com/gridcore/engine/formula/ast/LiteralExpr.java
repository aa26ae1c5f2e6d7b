package com.gridcore.engine.formula.ast;

import com.gridcore.engine.models.CellValue;

import java.util.Objects;

public final class LiteralExpr extends Expr {

    private final CellValue value;

    public LiteralExpr(CellValue value) {
        this.value = Objects.requireNonNull(value);
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralExpr && value.equals(((LiteralExpr) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Literal(" + value + ")";
    }
}
