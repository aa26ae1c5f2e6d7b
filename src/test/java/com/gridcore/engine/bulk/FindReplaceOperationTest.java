package com.gridcore.engine.bulk;

import com.gridcore.engine.exceptions.BulkValidationException;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FindReplaceOperationTest {

    private SpreadsheetEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SpreadsheetEngine();
        engine.setCellValue("A1", "apple pie");
        engine.setCellValue("A2", "Apple");
        engine.setCellValue("A3", "=\"apple\"&1");
        engine.setCellValue("B1", "42");
        engine.setCellValue("D9", "apple far away");
    }

    private FindReplaceOperation operation(String selection, FindReplaceOptions options) {
        return new FindReplaceOperation(engine, Selection.parse(selection), options);
    }

    @Test
    void testLiteralCaseSensitiveReplace() {
        FindReplaceOperation op = operation("A1:B3", new FindReplaceOptions("apple", "pear"));
        OperationPreview preview = op.preview();
        assertEquals(1, preview.getChanges().size());
        assertEquals("apple pie", preview.getChanges().get(0).getBefore());
        assertEquals("pear pie", preview.getChanges().get(0).getAfter());
        assertFalse(preview.isTruncated());

        op.execute();
        assertEquals(CellValue.string("pear pie"), engine.getCellValue("A1"));
        assertEquals(CellValue.string("Apple"), engine.getCellValue("A2"));
        assertEquals(CellValue.string("apple1"), engine.getCellValue("A3"));
    }

    @Test
    void testCaseInsensitiveWholeCell() {
        FindReplaceOptions options = new FindReplaceOptions("apple", "pear");
        options.setCaseSensitive(false);
        options.setWholeCellMatch(true);
        operation("A1:A3", options).execute();
        assertEquals(CellValue.string("apple pie"), engine.getCellValue("A1"));
        assertEquals(CellValue.string("pear"), engine.getCellValue("A2"));
    }

    @Test
    void testRegexWithGroups() {
        FindReplaceOptions options = new FindReplaceOptions("a(p+)le", "o$1");
        options.setUseRegex(true);
        operation("A1", options).execute();
        assertEquals(CellValue.string("opp pie"), engine.getCellValue("A1"));
    }

    @Test
    void testFirstMatchOnly() {
        engine.setCellValue("C1", "aaa");
        FindReplaceOptions options = new FindReplaceOptions("a", "b");
        options.setGlobal(false);
        operation("C1", options).execute();
        assertEquals(CellValue.string("baa"), engine.getCellValue("C1"));
    }

    @Test
    void testSearchInFormulas() {
        FindReplaceOptions options = new FindReplaceOptions("apple", "pear");
        options.setSearchInFormulas(true);
        options.setSearchInValues(false);
        FindReplaceOperation op = operation("A1:A3", options);
        assertFalse(op.canUndo());

        op.execute();
        assertEquals("=\"pear\"&1", engine.getCell("A3").getRawValue());
        assertEquals(CellValue.string("pear1"), engine.getCellValue("A3"));
        assertEquals(CellValue.string("apple pie"), engine.getCellValue("A1"));
    }

    /**
     * Replacing inside a number's text stores the result as a number again.
     */
    @Test
    void testNumbersAreSearchedByDisplayText() {
        operation("B1", new FindReplaceOptions("4", "5")).execute();
        assertEquals(CellValue.number(52), engine.getCellValue("B1"));
    }

    @Test
    void testSheetScopeIgnoresSelection() {
        FindReplaceOptions options = new FindReplaceOptions("far", "near");
        options.setScope(FindReplaceOptions.Scope.SHEET);
        operation("A1", options).execute();
        assertEquals(CellValue.string("apple near away"), engine.getCellValue("D9"));
    }

    @Test
    void testSummaryCountsMatches() {
        engine.setCellValue("C1", "apple apple");
        OperationPreview preview = operation("A1:C1", new FindReplaceOptions("apple", "pear")).preview();
        assertEquals(2, preview.getChanges().size());
        assertTrue(preview.getSummary().contains("3 match"), preview.getSummary());
    }

    @Test
    void testValidation() {
        assertEquals("Find pattern cannot be empty", operation("A1", new FindReplaceOptions("", "x")).validate());

        FindReplaceOptions badRegex = new FindReplaceOptions("(", "x");
        badRegex.setUseRegex(true);
        FindReplaceOperation op = operation("A1", badRegex);
        assertTrue(op.validate().startsWith("Invalid regular expression"));
        assertThrows(BulkValidationException.class, op::preview);
        assertThrows(BulkValidationException.class, op::execute);
    }

    /**
     * The reverse substitution only touches the cells the forward replace changed.
     */
    @Test
    void testUndoOperation() {
        engine.setCellValue("C1", "pear tart");
        FindReplaceOperation op = operation("A1:C1", new FindReplaceOptions("apple", "pear"));
        assertTrue(op.canUndo());
        assertNull(op.createUndoOperation());

        op.execute();
        assertEquals(1, op.getLastChanged().size());
        FindReplaceOperation undo = op.createUndoOperation();
        assertNotNull(undo);
        undo.execute();

        assertEquals(CellValue.string("apple pie"), engine.getCellValue("A1"));
        assertEquals(CellValue.string("pear tart"), engine.getCellValue("C1"));
    }

    @Test
    void testEngineUndoRevertsWholeReplace() {
        FindReplaceOptions options = new FindReplaceOptions("apple", "pear");
        options.setCaseSensitive(false);
        operation("A1:A2", options).execute();
        assertTrue(engine.undo());
        assertEquals(CellValue.string("apple pie"), engine.getCellValue("A1"));
        assertEquals(CellValue.string("Apple"), engine.getCellValue("A2"));
    }

    @Test
    void testEstimateTime() {
        FindReplaceOptions options = new FindReplaceOptions("x", "y");
        assertEquals(200, operation("A1", options).estimateTime());
        assertEquals(667, operation("A1:A10000", options).estimateTime());
        options.setUseRegex(true);
        assertEquals(952, operation("A1:A10000", options).estimateTime());
    }
}
