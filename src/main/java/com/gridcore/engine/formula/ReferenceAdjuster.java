package com.gridcore.engine.formula;

import com.gridcore.engine.formula.ast.BinaryExpr;
import com.gridcore.engine.formula.ast.Expr;
import com.gridcore.engine.formula.ast.ExprVisitor;
import com.gridcore.engine.formula.ast.FunctionCallExpr;
import com.gridcore.engine.formula.ast.LiteralExpr;
import com.gridcore.engine.formula.ast.NameExpr;
import com.gridcore.engine.formula.ast.RangeExpr;
import com.gridcore.engine.formula.ast.ReferenceExpr;
import com.gridcore.engine.formula.ast.UnaryExpr;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.ErrorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites references inside a formula tree, returning a new tree.
 *
 * Structural mode handles row/column insertion and deletion:
 * - relative components at or after the index shift by the count;
 * - absolute components never shift;
 * - a reference whose row/column was deleted becomes a #REF! literal;
 * - a range grows when rows are inserted strictly inside it, is clipped when
 *   deletion removes one of its edges, and becomes #REF! when fully deleted.
 *
 * Translation mode moves relative components by a fixed offset, which is what
 * copying a formula to another cell needs.
 */
public final class ReferenceAdjuster implements ExprVisitor<Expr> {

    public enum Axis {
        ROW,
        COLUMN
    }

    private enum Mode {
        INSERT,
        DELETE,
        TRANSLATE
    }

    private static final Expr REF_ERROR = new LiteralExpr(CellValue.error(ErrorType.REF));

    private final Mode mode;
    private final Axis axis;
    private final int index;
    private final int count;
    private final int deltaRow;
    private final int deltaCol;
    private final int maxRows;
    private final int maxColumns;

    private ReferenceAdjuster(Mode mode, Axis axis, int index, int count, int deltaRow, int deltaCol,
                              int maxRows, int maxColumns) {
        this.mode = mode;
        this.axis = axis;
        this.index = index;
        this.count = count;
        this.deltaRow = deltaRow;
        this.deltaCol = deltaCol;
        this.maxRows = maxRows;
        this.maxColumns = maxColumns;
    }

    public static Expr insert(Expr expr, Axis axis, int index, int count, int maxRows, int maxColumns) {
        return expr.accept(new ReferenceAdjuster(Mode.INSERT, axis, index, count, 0, 0, maxRows, maxColumns));
    }

    public static Expr delete(Expr expr, Axis axis, int index, int count, int maxRows, int maxColumns) {
        return expr.accept(new ReferenceAdjuster(Mode.DELETE, axis, index, count, 0, 0, maxRows, maxColumns));
    }

    public static Expr translate(Expr expr, int deltaRow, int deltaCol, int maxRows, int maxColumns) {
        return expr.accept(new ReferenceAdjuster(Mode.TRANSLATE, null, 0, 0, deltaRow, deltaCol, maxRows, maxColumns));
    }

    public static Expr translate(Expr expr, int deltaRow, int deltaCol) {
        return translate(expr, deltaRow, deltaCol, CellAddress.MAX_ROWS, CellAddress.MAX_COLUMNS);
    }

    @Override
    public Expr visitLiteral(LiteralExpr expr) {
        return expr;
    }

    @Override
    public Expr visitReference(ReferenceExpr expr) {
        CellAddress address = expr.getAddress();
        int col = adjustSingle(address.getCol(), expr.isAbsoluteCol(), Axis.COLUMN);
        int row = adjustSingle(address.getRow(), expr.isAbsoluteRow(), Axis.ROW);
        if (col < 0 || row < 0 || col >= maxColumns || row >= maxRows) {
            return REF_ERROR;
        }
        if (col == address.getCol() && row == address.getRow()) {
            return expr;
        }
        return new ReferenceExpr(CellAddress.of(col, row), expr.isAbsoluteCol(), expr.isAbsoluteRow());
    }

    @Override
    public Expr visitRange(RangeExpr expr) {
        ReferenceExpr start = expr.getStart();
        ReferenceExpr end = expr.getEnd();
        int[] cols = adjustSpan(start.getAddress().getCol(), start.isAbsoluteCol(),
                end.getAddress().getCol(), end.isAbsoluteCol(), Axis.COLUMN);
        int[] rows = adjustSpan(start.getAddress().getRow(), start.isAbsoluteRow(),
                end.getAddress().getRow(), end.isAbsoluteRow(), Axis.ROW);
        if (cols == null || rows == null) {
            return REF_ERROR;
        }
        if (cols[0] < 0 || rows[0] < 0 || cols[1] >= maxColumns || rows[1] >= maxRows) {
            return REF_ERROR;
        }
        return new RangeExpr(
                new ReferenceExpr(CellAddress.of(cols[0], rows[0]), start.isAbsoluteCol(), start.isAbsoluteRow()),
                new ReferenceExpr(CellAddress.of(cols[1], rows[1]), end.isAbsoluteCol(), end.isAbsoluteRow()));
    }

    @Override
    public Expr visitUnary(UnaryExpr expr) {
        Expr operand = expr.getOperand().accept(this);
        return operand == expr.getOperand() ? expr : new UnaryExpr(expr.getOperator(), operand);
    }

    @Override
    public Expr visitBinary(BinaryExpr expr) {
        Expr left = expr.getLeft().accept(this);
        Expr right = expr.getRight().accept(this);
        if (left == expr.getLeft() && right == expr.getRight()) {
            return expr;
        }
        return new BinaryExpr(expr.getOperator(), left, right);
    }

    @Override
    public Expr visitFunctionCall(FunctionCallExpr expr) {
        List<Expr> args = new ArrayList<>(expr.getArguments().size());
        boolean changed = false;
        for (Expr arg : expr.getArguments()) {
            Expr adjusted = arg.accept(this);
            changed |= adjusted != arg;
            args.add(adjusted);
        }
        return changed ? new FunctionCallExpr(expr.getName(), args) : expr;
    }

    @Override
    public Expr visitName(NameExpr expr) {
        return expr;
    }

    // Returns -1 when the component no longer exists.
    private int adjustSingle(int value, boolean absolute, Axis componentAxis) {
        if (mode == Mode.TRANSLATE) {
            if (absolute) {
                return value;
            }
            return value + (componentAxis == Axis.ROW ? deltaRow : deltaCol);
        }
        if (componentAxis != axis) {
            return value;
        }
        if (mode == Mode.INSERT) {
            return !absolute && value >= index ? value + count : value;
        }
        if (value >= index && value < index + count) {
            return -1;
        }
        return !absolute && value >= index + count ? value - count : value;
    }

    // Returns {low, high} or null when the whole span was deleted.
    private int[] adjustSpan(int low, boolean lowAbsolute, int high, boolean highAbsolute, Axis componentAxis) {
        if (mode != Mode.DELETE || componentAxis != axis) {
            int newLow = adjustSingle(low, lowAbsolute, componentAxis);
            int newHigh = adjustSingle(high, highAbsolute, componentAxis);
            if (newHigh < newLow) {
                // mixed $ flags can cross the two edges over
                return new int[]{newHigh, newLow};
            }
            return new int[]{newLow, newHigh};
        }
        int deleteEnd = index + count;
        int newLow;
        if (low < index) {
            newLow = low;
        } else if (low >= deleteEnd) {
            newLow = lowAbsolute ? low : low - count;
        } else if (lowAbsolute) {
            return null;
        } else {
            // first surviving row/column after the deleted block
            newLow = index;
        }
        int newHigh;
        if (high < index) {
            newHigh = high;
        } else if (high >= deleteEnd) {
            newHigh = highAbsolute ? high : high - count;
        } else if (highAbsolute) {
            return null;
        } else {
            newHigh = index - 1;
        }
        if (newHigh < newLow) {
            return null;
        }
        return new int[]{newLow, newHigh};
    }
}
