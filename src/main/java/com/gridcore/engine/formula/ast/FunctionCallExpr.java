package com.gridcore.engine.formula.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A call such as {@code SUM(A1:A3, 2)}. Names are stored upper-cased.
 */
public final class FunctionCallExpr extends Expr {

    private final String name;
    private final List<Expr> arguments;

    public FunctionCallExpr(String name, List<Expr> arguments) {
        this.name = name.toUpperCase(Locale.ROOT);
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCallExpr)) {
            return false;
        }
        FunctionCallExpr that = (FunctionCallExpr) o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
