package com.gridcore.engine.formula;

import com.gridcore.engine.formula.ReferenceAdjuster.Axis;
import com.gridcore.engine.models.CellAddress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reference rewriting for row/column insertion, deletion and copying.
 * Indexes are zero-based: row index 1 is the row labelled 2.
 */
class ReferenceAdjusterTest {

    private static final int ROWS = CellAddress.MAX_ROWS;
    private static final int COLS = CellAddress.MAX_COLUMNS;

    private static String insert(String formula, Axis axis, int index, int count) {
        return FormulaPrinter.print(ReferenceAdjuster.insert(FormulaParser.parseFormula(formula), axis, index, count, ROWS, COLS));
    }

    private static String delete(String formula, Axis axis, int index, int count) {
        return FormulaPrinter.print(ReferenceAdjuster.delete(FormulaParser.parseFormula(formula), axis, index, count, ROWS, COLS));
    }

    @Test
    void testInsertRowShiftsReferencesAtOrAfterIndex() {
        assertEquals("A1+A3+A4", insert("A1+A2+A3", Axis.ROW, 1, 1));
        assertEquals("A1+A5", insert("A1+A2", Axis.ROW, 1, 3));
    }

    @Test
    void testAbsoluteComponentsDoNotShift() {
        assertEquals("$A$2+A$2+$A3", insert("$A$2+A$2+$A2", Axis.ROW, 0, 1));
        assertEquals("$B1+C$1", insert("$B1+B$1", Axis.COLUMN, 0, 1));
    }

    @Test
    void testDeletedReferenceBecomesRefError() {
        assertEquals("A1+#REF!+A2", delete("A1+A2+A3", Axis.ROW, 1, 1));
        assertEquals("#REF!*2", delete("B1*2", Axis.COLUMN, 1, 1));
        assertEquals("#REF!", delete("$A$2", Axis.ROW, 1, 1));
    }

    @Test
    void testInsertColumn() {
        assertEquals("C1*2", insert("B1*2", Axis.COLUMN, 0, 1));
        assertEquals("SUM(A1:C1)", insert("SUM(A1:B1)", Axis.COLUMN, 1, 1));
    }

    /**
     * Insertion inside a range grows it; insertion before moves it; after leaves it.
     */
    @Test
    void testRangeExtendsOnInsert() {
        assertEquals("SUM(A1:A4)", insert("SUM(A1:A3)", Axis.ROW, 1, 1));
        assertEquals("SUM(A2:A4)", insert("SUM(A1:A3)", Axis.ROW, 0, 1));
        assertEquals("SUM(A1:A3)", insert("SUM(A1:A3)", Axis.ROW, 3, 1));
    }

    @Test
    void testRangeIsClippedOnDelete() {
        assertEquals("SUM(A1:A4)", delete("SUM(A1:A5)", Axis.ROW, 1, 1));
        assertEquals("SUM(A1:A3)", delete("SUM(A1:A5)", Axis.ROW, 0, 2));
        assertEquals("SUM(A1:A2)", delete("SUM(A1:A5)", Axis.ROW, 2, 3));
        assertEquals("SUM(#REF!)", delete("SUM(A2:A3)", Axis.ROW, 1, 2));
    }

    @Test
    void testRangeWithDeletedAbsoluteEdge() {
        assertEquals("SUM(#REF!)", delete("SUM(A$1:A5)", Axis.ROW, 0, 1));
        assertEquals("SUM(A1:A4)", delete("SUM(A1:A5)", Axis.ROW, 4, 1));
    }

    @Test
    void testShiftPastTheSheetEdgeIsRefError() {
        String moved = FormulaPrinter.print(ReferenceAdjuster.insert(
                FormulaParser.parseFormula("A10+A1"), Axis.ROW, 0, 1, 10, COLS));
        assertEquals("#REF!+A2", moved);
    }

    @Test
    void testTranslateMovesRelativeComponentsOnly() {
        assertEquals("B2+$B$1+C$2+$A3",
                FormulaPrinter.print(ReferenceAdjuster.translate(
                        FormulaParser.parseFormula("A1+$B$1+B$2+$A2"), 1, 1)));
        assertEquals("SUM(B1:B3)",
                FormulaPrinter.print(ReferenceAdjuster.translate(FormulaParser.parseFormula("SUM(A1:A3)"), 0, 1)));
    }

    @Test
    void testTranslateOffTheSheetIsRefError() {
        assertEquals("#REF!",
                FormulaPrinter.print(ReferenceAdjuster.translate(FormulaParser.parseFormula("A1"), -1, 0)));
    }

    @Test
    void testFormulasWithoutReferencesAreUnchanged() {
        assertEquals("1+2", insert("1+2", Axis.ROW, 0, 5));
        assertEquals("revenue*2", delete("revenue*2", Axis.COLUMN, 0, 1));
    }
}
