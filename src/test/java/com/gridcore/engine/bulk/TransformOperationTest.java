package com.gridcore.engine.bulk;

import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TransformOperationTest {

    private SpreadsheetEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SpreadsheetEngine();
        engine.setCellValue("A1", "  hello   world ");
        engine.setCellValue("A2", "MiXed case");
        engine.setCellValue("A3", "42");
        engine.setCellValue("A4", "=LOWER(\"X\")");
        engine.setCellValue("A5", "line1\nline2\tend");
    }

    private void transform(String selection, TransformType type) {
        new TransformOperation(engine, Selection.parse(selection), new TransformOptions(type)).execute();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "UPPER  | mIxEd 1st  | MIXED 1ST",
            "LOWER  | mIxEd 1st  | mixed 1st",
            "TRIM   | \"  a   b \" | a b",
            "PROPER | o'neil-SMITH jr | O'Neil-Smith Jr"
    }, ignoreLeadingAndTrailingWhitespace = true)
    void testTransformText(TransformType type, String input, String expected) {
        TransformOperation op = new TransformOperation(engine, Selection.parse("A1"), new TransformOptions(type));
        assertEquals(expected, op.transform(input));
    }

    @Test
    void testUpperSkipsNumbersAndFormulas() {
        transform("A1:A5", TransformType.UPPER);
        assertEquals(CellValue.string("MIXED CASE"), engine.getCellValue("A2"));
        assertEquals(CellValue.number(42), engine.getCellValue("A3"));
        assertEquals("=LOWER(\"X\")", engine.getCell("A4").getRawValue());
    }

    @Test
    void testTrimAndClean() {
        transform("A1", TransformType.TRIM);
        assertEquals(CellValue.string("hello world"), engine.getCellValue("A1"));
        transform("A5", TransformType.CLEAN);
        assertEquals(CellValue.string("line1 line2 end"), engine.getCellValue("A5"));
    }

    /**
     * With skipNonText off, numbers are rewritten as text.
     */
    @Test
    void testNumbersBecomeText() {
        TransformOptions options = new TransformOptions(TransformType.UPPER);
        options.setSkipNonText(false);
        new TransformOperation(engine, Selection.parse("A3"), options).execute();
        assertEquals(CellValue.string("42"), engine.getCellValue("A3"));
        assertEquals("'42", engine.getCell("A3").getRawValue());
    }

    @Test
    void testValidation() {
        assertEquals("Transform type is required",
                new TransformOperation(engine, Selection.parse("A1"), new TransformOptions()).validate());
    }
}
