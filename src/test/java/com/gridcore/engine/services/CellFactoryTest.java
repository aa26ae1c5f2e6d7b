package com.gridcore.engine.services;

import com.gridcore.engine.exceptions.FormulaParseException;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class CellFactoryTest {

    private static final CellAddress A1 = CellAddress.fromString("A1");

    @Test
    void testLiteralTypes() {
        assertEquals(CellValue.number(42), CellFactory.parseLiteral("42"));
        assertEquals(CellValue.number(-3.5), CellFactory.parseLiteral(" -3.5 "));
        assertEquals(CellValue.TRUE, CellFactory.parseLiteral("true"));
        assertEquals(CellValue.string("hello"), CellFactory.parseLiteral("hello"));
        assertEquals(CellValue.string("42"), CellFactory.parseLiteral("'42"));
        assertEquals(CellValue.string("="), CellFactory.parseLiteral("="));
        assertEquals(CellValue.string("NaN"), CellFactory.parseLiteral("NaN"));
        assertEquals(CellValue.string("1d"), CellFactory.parseLiteral("1d"));
    }

    @Test
    void testFormulaCell() {
        Cell cell = CellFactory.create(A1, "= B1 * 2");
        assertTrue(cell.hasFormula());
        assertEquals("B1 * 2", cell.getFormulaSource());
        assertEquals("= B1 * 2", cell.getRawValue());
        assertTrue(cell.getValue().isEmpty());
    }

    @Test
    void testMalformedFormula() {
        assertThrows(FormulaParseException.class, () -> CellFactory.create(A1, "=SUM(A1"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "hello   | hello",
            "42      | '42",
            "TRUE    | 'TRUE",
            "=A1     | '=A1",
            "'quoted | ''quoted"
    })
    void testTextRaw(String text, String expected) {
        assertEquals(expected, CellFactory.textRaw(text));
        assertEquals(CellValue.string(text), CellFactory.parseLiteral(CellFactory.textRaw(text)));
    }
}
