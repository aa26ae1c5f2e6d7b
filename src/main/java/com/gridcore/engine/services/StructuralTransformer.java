package com.gridcore.engine.services;

import com.gridcore.engine.exceptions.InvalidStructuralOperationException;
import com.gridcore.engine.formula.FormulaPrinter;
import com.gridcore.engine.formula.ReferenceAdjuster;
import com.gridcore.engine.formula.ReferenceAdjuster.Axis;
import com.gridcore.engine.formula.ReferenceCollector;
import com.gridcore.engine.formula.ast.Expr;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Inserts and deletes rows and columns.
 *
 * Each edit runs in three steps:
 * 1) move the stored cells along the affected axis (dropping deleted ones);
 * 2) rewrite every formula through {@link ReferenceAdjuster} and regenerate its source;
 * 3) rebuild the dependency graph from the rewritten formulas.
 * The caller recalculates afterwards. Validation happens before step 1, so a
 * rejected edit leaves the sheet untouched.
 */
public class StructuralTransformer {

    private static final Logger logger = LoggerFactory.getLogger(StructuralTransformer.class);

    private final CellStore store;
    private final DependencyGraph graph;
    private final int maxRows;
    private final int maxColumns;

    public StructuralTransformer(CellStore store, DependencyGraph graph, int maxRows, int maxColumns) {
        this.store = store;
        this.graph = graph;
        this.maxRows = maxRows;
        this.maxColumns = maxColumns;
    }

    public void insertRows(int index, int count) {
        insert(Axis.ROW, index, count);
    }

    public void insertColumns(int index, int count) {
        insert(Axis.COLUMN, index, count);
    }

    public void deleteRows(int index, int count) {
        delete(Axis.ROW, index, count);
    }

    public void deleteColumns(int index, int count) {
        delete(Axis.COLUMN, index, count);
    }

    private void insert(Axis axis, int index, int count) {
        validate(axis, index, count);
        int limit = limitOf(axis);
        for (Cell cell : store.cells()) {
            int coordinate = coordinateOf(cell.getAddress(), axis);
            if (coordinate >= index && (long) coordinate + count >= limit) {
                throw new InvalidStructuralOperationException("Inserting " + count + " "
                        + axisName(axis) + "(s) would push " + cell.getAddress() + " off the sheet");
            }
        }

        List<Cell> moved = new ArrayList<>(store.size());
        for (Cell cell : store.cells()) {
            CellAddress address = cell.getAddress();
            int coordinate = coordinateOf(address, axis);
            moved.add(coordinate >= index ? cell.moveTo(shift(address, axis, count)) : cell);
        }
        store.replaceAll(moved);
        rewriteFormulas(expr -> ReferenceAdjuster.insert(expr, axis, index, count, maxRows, maxColumns));
        logger.info("Inserted {} {}(s) at index {}", count, axisName(axis), index);
    }

    private void delete(Axis axis, int index, int count) {
        validate(axis, index, count);
        long deleteEnd = (long) index + count;

        List<Cell> kept = new ArrayList<>(store.size());
        for (Cell cell : store.cells()) {
            CellAddress address = cell.getAddress();
            int coordinate = coordinateOf(address, axis);
            if (coordinate < index) {
                kept.add(cell);
            } else if (coordinate >= deleteEnd) {
                kept.add(cell.moveTo(shift(address, axis, -count)));
            }
        }
        store.replaceAll(kept);
        rewriteFormulas(expr -> ReferenceAdjuster.delete(expr, axis, index, count, maxRows, maxColumns));
        logger.info("Deleted {} {}(s) at index {}", count, axisName(axis), index);
    }

    private void rewriteFormulas(UnaryOperator<Expr> rewrite) {
        graph.clear();
        for (Cell cell : store.cells()) {
            if (!cell.hasFormula()) {
                continue;
            }
            Expr rewritten = rewrite.apply(cell.getFormula());
            if (rewritten != cell.getFormula()) {
                cell.setFormula(rewritten, FormulaPrinter.print(rewritten));
            }
            graph.setDependencies(cell.getAddress(), ReferenceCollector.collect(cell.getFormula()),
                    ReferenceCollector.collectRanges(cell.getFormula()));
        }
    }

    private void validate(Axis axis, int index, int count) {
        if (index < 0) {
            throw new InvalidStructuralOperationException("Index must be non-negative: " + index);
        }
        if (count < 1) {
            throw new InvalidStructuralOperationException("Count must be at least 1: " + count);
        }
        if (index >= limitOf(axis)) {
            throw new InvalidStructuralOperationException("Index " + index + " is beyond the last "
                    + axisName(axis));
        }
    }

    private int limitOf(Axis axis) {
        return axis == Axis.ROW ? maxRows : maxColumns;
    }

    private static int coordinateOf(CellAddress address, Axis axis) {
        return axis == Axis.ROW ? address.getRow() : address.getCol();
    }

    private static CellAddress shift(CellAddress address, Axis axis, int delta) {
        return axis == Axis.ROW ? address.offset(delta, 0) : address.offset(0, delta);
    }

    private static String axisName(Axis axis) {
        return axis == Axis.ROW ? "row" : "column";
    }
}
