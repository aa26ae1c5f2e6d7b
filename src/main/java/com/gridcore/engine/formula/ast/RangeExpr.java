package com.gridcore.engine.formula.ast;

import com.gridcore.engine.models.CellRange;

import java.util.Objects;

/**
 * A rectangular range. The parser normalizes it so that start is the top-left corner.
 */
public final class RangeExpr extends Expr {

    private final ReferenceExpr start;
    private final ReferenceExpr end;

    public RangeExpr(ReferenceExpr start, ReferenceExpr end) {
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
    }

    public ReferenceExpr getStart() {
        return start;
    }

    public ReferenceExpr getEnd() {
        return end;
    }

    public CellRange toCellRange() {
        return CellRange.of(start.getAddress(), end.getAddress());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RangeExpr)) {
            return false;
        }
        RangeExpr that = (RangeExpr) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "Range(" + start + ":" + end + ")";
    }
}
