package com.gridcore.engine.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellValueTest {

    @Test
    void testDisplayStrings() {
        assertEquals("42", CellValue.number(42).toDisplayString());
        assertEquals("3.5", CellValue.number(3.5).toDisplayString());
        assertEquals("-0.25", CellValue.number(-0.25).toDisplayString());
        assertEquals("TRUE", CellValue.TRUE.toDisplayString());
        assertEquals("hello", CellValue.string("hello").toDisplayString());
        assertEquals("#DIV/0!", CellValue.error(ErrorType.DIV_ZERO).toDisplayString());
        assertEquals("", CellValue.EMPTY.toDisplayString());
    }

    @Test
    void testFormatNumberAvoidsScientificNotation() {
        assertEquals("1000000", CellValue.formatNumber(1_000_000));
        assertEquals("0.0001", CellValue.formatNumber(0.0001));
        assertEquals("0", CellValue.formatNumber(-0.0));
    }

    @Test
    void testJsonValues() {
        assertEquals(42.0, CellValue.number(42).toJsonValue());
        assertEquals(Boolean.FALSE, CellValue.FALSE.toJsonValue());
        assertEquals("#REF!", CellValue.error(ErrorType.REF).toJsonValue());
        assertNull(CellValue.EMPTY.toJsonValue());
    }

    @Test
    void testValueEquality() {
        assertEquals(CellValue.number(1), CellValue.number(1.0));
        assertEquals(CellValue.string("a"), CellValue.string("a"));
        assertNotEquals(CellValue.string("1"), CellValue.number(1));
        assertEquals(CellValue.error(ErrorType.NAME), CellValue.error(ErrorType.NAME));
        assertNotEquals(CellValue.error(ErrorType.NAME), CellValue.error(ErrorType.VALUE));
    }

    @Test
    void testErrorCodes() {
        for (ErrorType type : ErrorType.values()) {
            assertEquals(type, ErrorType.fromCode(type.getCode()));
        }
        assertEquals("#CIRCULAR!", ErrorType.CIRCULAR.getCode());
    }
}
