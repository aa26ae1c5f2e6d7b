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
import com.gridcore.engine.models.CellRange;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects what a formula reads. Ranges of up to {@link #EXPANSION_LIMIT} cells are
 * expanded cell by cell; larger ones are reported whole by {@link #collectRanges}.
 */
public final class ReferenceCollector implements ExprVisitor<Void> {

    public static final long EXPANSION_LIMIT = 1024;

    private final Set<CellAddress> references = new LinkedHashSet<>();
    private final Set<CellRange> ranges = new LinkedHashSet<>();

    private ReferenceCollector() {
    }

    private static ReferenceCollector run(Expr expr) {
        ReferenceCollector collector = new ReferenceCollector();
        expr.accept(collector);
        return collector;
    }

    /**
     * Single references plus the cells of small ranges.
     */
    public static Set<CellAddress> collect(Expr expr) {
        return run(expr).references;
    }

    /**
     * Ranges too large to expand.
     */
    public static Set<CellRange> collectRanges(Expr expr) {
        return run(expr).ranges;
    }

    @Override
    public Void visitLiteral(LiteralExpr expr) {
        return null;
    }

    @Override
    public Void visitReference(ReferenceExpr expr) {
        references.add(expr.getAddress());
        return null;
    }

    @Override
    public Void visitRange(RangeExpr expr) {
        CellRange range = expr.toCellRange();
        if (range.size() <= EXPANSION_LIMIT) {
            references.addAll(range.addresses());
        } else {
            ranges.add(range);
        }
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr expr) {
        expr.getOperand().accept(this);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr expr) {
        expr.getLeft().accept(this);
        expr.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCallExpr expr) {
        for (Expr arg : expr.getArguments()) {
            arg.accept(this);
        }
        return null;
    }

    @Override
    public Void visitName(NameExpr expr) {
        return null;
    }
}
