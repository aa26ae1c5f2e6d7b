package com.gridcore.engine.formula.ast;

/**
 * A bare identifier that is neither a reference nor a function call.
 * Named ranges are not supported, so these evaluate to #NAME?.
 */
public final class NameExpr extends Expr {

    private final String name;

    public NameExpr(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitName(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NameExpr && name.equals(((NameExpr) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Name(" + name + ")";
    }
}
