package com.gridcore.engine.bulk;

import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormatOperationTest {

    private SpreadsheetEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SpreadsheetEngine();
        engine.setCellValue("A1", "1234.5");
        engine.setCellValue("A2", "0.25");
        engine.setCellValue("A3", "45000");
        engine.setCellValue("A4", "label");
        engine.setCellValue("A5", "=A1");
    }

    private FormatOperation operation(String selection, FormatOptions options) {
        return new FormatOperation(engine, Selection.parse(selection), options);
    }

    @Test
    void testCurrency() {
        operation("A1:A5", new FormatOptions("currency")).execute();
        assertEquals(CellValue.string("$1,234.50"), engine.getCellValue("A1"));
        assertEquals(CellValue.string("label"), engine.getCellValue("A4"));
        assertEquals("=A1", engine.getCell("A5").getRawValue());
    }

    @Test
    void testPercent() {
        FormatOptions options = new FormatOptions("percent");
        options.setDecimals(0);
        operation("A2", options).execute();
        assertEquals(CellValue.string("25%"), engine.getCellValue("A2"));
    }

    /**
     * Plain number formatting without grouping reads as a number, so it is stored as forced text.
     */
    @Test
    void testNumberWithoutGrouping() {
        FormatOptions options = new FormatOptions("NUMBER");
        options.setUseThousandsSeparator(false);
        operation("A1", options).execute();
        assertEquals("'1234.50", engine.getCell("A1").getRawValue());
        assertEquals(CellValue.string("1234.50"), engine.getCellValue("A1"));
    }

    @Test
    void testDateFromSerialNumber() {
        operation("A3", new FormatOptions("date")).execute();
        assertEquals(CellValue.string("03/15/2023"), engine.getCellValue("A3"));

        FormatOptions iso = new FormatOptions("date");
        iso.setDateFormat("yyyy-MM-dd");
        engine.setCellValue("B1", "1");
        operation("B1", iso).execute();
        assertEquals(CellValue.string("1899-12-31"), engine.getCellValue("B1"));
    }

    @Test
    void testTextFreezesDisplayValue() {
        operation("A1:A4", new FormatOptions("text")).execute();
        assertEquals(CellValue.string("1234.5"), engine.getCellValue("A1"));
        assertEquals(CellValue.string("label"), engine.getCellValue("A4"));
        assertEquals(CellValue.string("1234.5"), engine.getCellValue("A5"));
    }

    @Test
    void testValidation() {
        assertEquals("Unknown format type: bogus", operation("A1", new FormatOptions("bogus")).validate());

        FormatOptions currency = new FormatOptions("currency");
        currency.setCurrency("XXXX");
        assertTrue(operation("A1", currency).validate().startsWith("Invalid currency code"));

        FormatOptions date = new FormatOptions("date");
        date.setDateFormat("yyyy-{");
        assertTrue(operation("A1", date).validate().startsWith("Invalid date format"));

        FormatOptions decimals = new FormatOptions("number");
        decimals.setDecimals(12);
        assertEquals("Decimals must be between 0 and 10", operation("A1", decimals).validate());
    }
}
