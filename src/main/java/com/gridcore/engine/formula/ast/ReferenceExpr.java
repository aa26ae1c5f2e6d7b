package com.gridcore.engine.formula.ast;

import com.gridcore.engine.models.CellAddress;

import java.util.Objects;

/**
 * A single cell reference. Absolute axes were written with a {@code $} and are
 * left alone by structural edits and relative translation.
 */
public final class ReferenceExpr extends Expr {

    private final CellAddress address;
    private final boolean absoluteCol;
    private final boolean absoluteRow;

    public ReferenceExpr(CellAddress address, boolean absoluteCol, boolean absoluteRow) {
        this.address = Objects.requireNonNull(address);
        this.absoluteCol = absoluteCol;
        this.absoluteRow = absoluteRow;
    }

    public ReferenceExpr(CellAddress address) {
        this(address, false, false);
    }

    public CellAddress getAddress() {
        return address;
    }

    public boolean isAbsoluteCol() {
        return absoluteCol;
    }

    public boolean isAbsoluteRow() {
        return absoluteRow;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ReferenceExpr)) {
            return false;
        }
        ReferenceExpr that = (ReferenceExpr) o;
        return address.equals(that.address) && absoluteCol == that.absoluteCol && absoluteRow == that.absoluteRow;
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, absoluteCol, absoluteRow);
    }

    @Override
    public String toString() {
        return "Ref(" + (absoluteCol ? "$" : "") + CellAddress.columnToLabel(address.getCol())
                + (absoluteRow ? "$" : "") + (address.getRow() + 1) + ")";
    }
}
