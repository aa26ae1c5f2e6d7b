package com.gridcore.engine.bulk;

import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MathOperationTest {

    private SpreadsheetEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SpreadsheetEngine();
        engine.setCellValue("A1", "10");
        engine.setCellValue("A2", "$1,200");
        engine.setCellValue("A3", "abc");
        engine.setCellValue("A4", "=A1*2");
    }

    private MathOperation operation(String selection, MathOperationType type, Double value) {
        return new MathOperation(engine, Selection.parse(selection), new MathOptions(type, value));
    }

    @Test
    void testAddSkipsTextAndFormulas() {
        operation("A1:A4", MathOperationType.ADD, 5.0).execute();
        assertEquals(CellValue.number(15), engine.getCellValue("A1"));
        assertEquals(CellValue.number(1205), engine.getCellValue("A2"));
        assertEquals(CellValue.string("abc"), engine.getCellValue("A3"));
        assertEquals("=A1*2", engine.getCell("A4").getRawValue());
        assertEquals(CellValue.number(30), engine.getCellValue("A4"));
    }

    @Test
    void testConvertStringsOff() {
        MathOptions options = new MathOptions(MathOperationType.MULTIPLY, 2.0);
        options.setConvertStrings(false);
        new MathOperation(engine, Selection.parse("A1:A2"), options).execute();
        assertEquals(CellValue.number(20), engine.getCellValue("A1"));
        assertEquals(CellValue.string("$1,200"), engine.getCellValue("A2"));
    }

    @Test
    void testPercentOperations() {
        engine.setCellValue("B1", "200");
        operation("B1", MathOperationType.PERCENT_DECREASE, 10.0).execute();
        assertEquals(CellValue.number(180), engine.getCellValue("B1"));
        operation("B1", MathOperationType.PERCENT, 50.0).execute();
        assertEquals(CellValue.number(90), engine.getCellValue("B1"));
    }

    @Test
    void testRounding() {
        engine.setCellValue("C1", "2.345");
        engine.setCellValue("C2", "-2.5");
        engine.setCellValue("C3", "2.1");

        MathOptions round = new MathOptions(MathOperationType.ROUND, null);
        round.setDecimalPlaces(2);
        new MathOperation(engine, Selection.parse("C1"), round).execute();
        assertEquals(CellValue.number(2.35), engine.getCellValue("C1"));

        operation("C2", MathOperationType.FLOOR, null).execute();
        assertEquals(CellValue.number(-3), engine.getCellValue("C2"));
        operation("C3", MathOperationType.CEIL, null).execute();
        assertEquals(CellValue.number(3), engine.getCellValue("C3"));
    }

    @Test
    void testModuloAndDivide() {
        operation("A1", MathOperationType.MODULO, 3.0).execute();
        assertEquals(CellValue.number(1), engine.getCellValue("A1"));
        operation("A1", MathOperationType.DIVIDE, 4.0).execute();
        assertEquals(CellValue.number(0.25), engine.getCellValue("A1"));
    }

    @Test
    void testValidation() {
        assertEquals("Operation is required", operation("A1", null, 1.0).validate());
        assertEquals("Cannot divide by zero", operation("A1", MathOperationType.DIVIDE, 0.0).validate());
        assertEquals("Cannot divide by zero", operation("A1", MathOperationType.MODULO, 0.0).validate());
        assertEquals("Operand must be a finite number", operation("A1", MathOperationType.ADD, null).validate());
        assertEquals("Operand must be a finite number",
                operation("A1", MathOperationType.ADD, Double.POSITIVE_INFINITY).validate());
        assertEquals("Percent decrease must be less than 100",
                operation("A1", MathOperationType.PERCENT_DECREASE, 100.0).validate());

        MathOptions options = new MathOptions(MathOperationType.ROUND, null);
        options.setDecimalPlaces(11);
        assertEquals("Decimal places must be between 0 and 10",
                new MathOperation(engine, Selection.parse("A1"), options).validate());
    }

    @Test
    void testEmptySelectionOfColumns() {
        assertEquals("Selection is empty", operation("Z:Z", MathOperationType.ADD, 1.0).validate());
    }
}
