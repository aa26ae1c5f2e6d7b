package com.gridcore.engine.bulk;

import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FillOperationTest {

    private SpreadsheetEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SpreadsheetEngine();
    }

    private void fill(String selection, FillOptions.Direction direction, FillOptions.Pattern pattern) {
        FillOptions options = new FillOptions(direction);
        options.setPattern(pattern);
        new FillOperation(engine, Selection.parse(selection), options).execute();
    }

    private static CellValue num(double d) {
        return CellValue.number(d);
    }

    @Test
    void testLinearSeriesDown() {
        engine.setCellValue("A1", "1");
        engine.setCellValue("A2", "3");
        fill("A1:A5", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals(num(5), engine.getCellValue("A3"));
        assertEquals(num(9), engine.getCellValue("A5"));
    }

    @Test
    void testExponentialSeries() {
        engine.setCellValue("A1", "2");
        engine.setCellValue("A2", "4");
        engine.setCellValue("A3", "8");
        fill("A1:A5", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals(num(16), engine.getCellValue("A4"));
        assertEquals(num(32), engine.getCellValue("A5"));
    }

    @Test
    void testSingleNumberCopiesUnlessLinearIsForced() {
        engine.setCellValue("A1", "5");
        engine.setCellValue("B1", "5");
        fill("A1:A3", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        fill("B1:B3", FillOptions.Direction.DOWN, FillOptions.Pattern.LINEAR);
        assertEquals(num(5), engine.getCellValue("A3"));
        assertEquals(num(7), engine.getCellValue("B3"));
    }

    @Test
    void testDecimalStepsStayClean() {
        engine.setCellValue("A1", "0.1");
        engine.setCellValue("A2", "0.2");
        fill("A1:A3", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals("0.3", engine.getCell("A3").getRawValue());
    }

    @Test
    void testTextRepeats() {
        engine.setCellValue("A1", "a");
        engine.setCellValue("B1", "b");
        fill("A1:E1", FillOptions.Direction.RIGHT, FillOptions.Pattern.AUTO);
        assertEquals(CellValue.string("a"), engine.getCellValue("C1"));
        assertEquals(CellValue.string("b"), engine.getCellValue("D1"));
        assertEquals(CellValue.string("a"), engine.getCellValue("E1"));
    }

    @Test
    void testNumberedTextCountsUp() {
        engine.setCellValue("A1", "Item 1");
        engine.setCellValue("A2", "Item 2");
        fill("A1:A4", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals(CellValue.string("Item 3"), engine.getCellValue("A3"));
        assertEquals(CellValue.string("Item 4"), engine.getCellValue("A4"));
    }

    @Test
    void testNumberedTextKeepsZeroPadding() {
        engine.setCellValue("A1", "Product-008");
        engine.setCellValue("B1", "Product-009");
        fill("A1:D1", FillOptions.Direction.RIGHT, FillOptions.Pattern.AUTO);
        assertEquals(CellValue.string("Product-010"), engine.getCellValue("C1"));
        assertEquals(CellValue.string("Product-011"), engine.getCellValue("D1"));
    }

    @Test
    void testNumberedTextWithMixedPrefixesRepeats() {
        engine.setCellValue("A1", "Item 1");
        engine.setCellValue("A2", "Product 2");
        fill("A1:A3", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals(CellValue.string("Item 1"), engine.getCellValue("A3"));
    }

    @Test
    void testSingleNumberedTextNeedsTextPattern() {
        engine.setCellValue("A1", "Q1");
        engine.setCellValue("B1", "Q1");
        fill("A1:A3", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        fill("B1:B3", FillOptions.Direction.DOWN, FillOptions.Pattern.TEXT);
        assertEquals(CellValue.string("Q1"), engine.getCellValue("A3"));
        assertEquals(CellValue.string("Q3"), engine.getCellValue("B3"));
    }

    @Test
    void testWeeklyDates() {
        engine.setCellValue("A1", "2024-01-01");
        engine.setCellValue("A2", "2024-01-08");
        fill("A1:A4", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals(CellValue.string("2024-01-15"), engine.getCellValue("A3"));
        assertEquals(CellValue.string("2024-01-22"), engine.getCellValue("A4"));
    }

    @Test
    void testDatesKeepTheirFormatAcrossMonthEnd() {
        engine.setCellValue("A1", "01/30/2024");
        engine.setCellValue("A2", "01/31/2024");
        fill("A1:A3", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals(CellValue.string("02/01/2024"), engine.getCellValue("A3"));
    }

    @Test
    void testIrregularDatesRepeat() {
        engine.setCellValue("A1", "2024-01-01");
        engine.setCellValue("A2", "2024-01-03");
        engine.setCellValue("A3", "2024-01-07");
        fill("A1:A4", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals(CellValue.string("2024-01-01"), engine.getCellValue("A4"));
    }

    @Test
    void testDatePatternStepsOneDayFromSingleSource() {
        engine.setCellValue("A1", "2024-02-28");
        fill("A1:A3", FillOptions.Direction.DOWN, FillOptions.Pattern.DATE);
        assertEquals(CellValue.string("2024-02-29"), engine.getCellValue("A2"));
        assertEquals(CellValue.string("2024-03-01"), engine.getCellValue("A3"));
    }

    /**
     * Copied formulas have their relative references moved along with them.
     */
    @Test
    void testFormulaReferencesAreTranslated() {
        engine.setCellValue("A1", "1");
        engine.setCellValue("A2", "2");
        engine.setCellValue("B1", "=A1*10+$A$1");
        fill("B1:B3", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals("=A2*10+$A$1", engine.getCell("B2").getRawValue());
        assertEquals("=A3*10+$A$1", engine.getCell("B3").getRawValue());
        assertEquals(num(21), engine.getCellValue("B2"));
        assertEquals(num(1), engine.getCellValue("B3"));
    }

    @Test
    void testUpAndLeft() {
        engine.setCellValue("A5", "10");
        engine.setCellValue("A4", "20");
        fill("A1:A5", FillOptions.Direction.UP, FillOptions.Pattern.AUTO);
        assertEquals(num(50), engine.getCellValue("A1"));

        engine.setCellValue("E2", "x");
        fill("C2:E2", FillOptions.Direction.LEFT, FillOptions.Pattern.COPY);
        assertEquals(CellValue.string("x"), engine.getCellValue("C2"));
    }

    @Test
    void testEachColumnIsItsOwnLine() {
        engine.setCellValue("A1", "1");
        engine.setCellValue("A2", "2");
        engine.setCellValue("B1", "10");
        engine.setCellValue("B2", "20");
        fill("A1:B4", FillOptions.Direction.DOWN, FillOptions.Pattern.AUTO);
        assertEquals(num(4), engine.getCellValue("A4"));
        assertEquals(num(40), engine.getCellValue("B4"));
    }

    @Test
    void testExplicitSourceCount() {
        engine.setCellValue("A1", "1");
        engine.setCellValue("A2", "2");
        engine.setCellValue("A3", "100");
        FillOptions options = new FillOptions(FillOptions.Direction.DOWN);
        options.setSourceCount(2);
        new FillOperation(engine, Selection.parse("A1:A4"), options).execute();
        assertEquals(num(3), engine.getCellValue("A3"));
        assertEquals(num(4), engine.getCellValue("A4"));
    }

    @Test
    void testValidation() {
        FillOptions options = new FillOptions(FillOptions.Direction.DOWN);
        engine.setCellValue("A1", "1");
        assertEquals("Fill requires a cell or range selection",
                new FillOperation(engine, Selection.parse("A:A"), options).validate());
        options.setSourceCount(0);
        assertEquals("Source count must be at least 1",
                new FillOperation(engine, Selection.parse("A1:A3"), options).validate());
    }
}
