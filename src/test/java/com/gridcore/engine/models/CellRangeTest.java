package com.gridcore.engine.models;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellRangeTest {

    private static CellAddress a(String text) {
        return CellAddress.fromString(text);
    }

    @Test
    void testWholeSheetSizeDoesNotOverflow() {
        CellRange sheet = CellRange.of(a("A1"), a("XFD1048576"));
        assertEquals(17_179_869_184L, sheet.size());
        assertTrue(sheet.contains(a("XFD1048576")));
    }

    @Test
    void testCornersInAnyOrder() {
        CellRange range = CellRange.of(a("C3"), a("A1"));
        assertEquals(CellRange.of(a("A1"), a("C3")), range);
        assertEquals("A1:C3", range.toString());
        assertFalse(range.contains(a("D2")));
    }

    @Test
    void testAddressesAreRowMajor() {
        assertEquals(List.of(a("A1"), a("B1"), a("A2"), a("B2")), CellRange.of(a("A1"), a("B2")).addresses());
    }
}
