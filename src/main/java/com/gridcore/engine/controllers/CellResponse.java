package com.gridcore.engine.controllers;

import com.gridcore.engine.models.Cell;

/**
 * JSON view of one cell, e.g.
 * { "address": "B2", "rawValue": "=A1*2", "formula": "A1*2", "value": 84.0 }
 */
public class CellResponse {
    private final String address;
    private final String rawValue;
    private final String formula;
    private final Object value;

    public CellResponse(String address, String rawValue, String formula, Object value) {
        this.address = address;
        this.rawValue = rawValue;
        this.formula = formula;
        this.value = value;
    }

    public static CellResponse of(String address, Cell cell) {
        if (cell == null) {
            return new CellResponse(address, null, null, null);
        }
        return new CellResponse(cell.getAddress().toString(), cell.getRawValue(),
                cell.getFormulaSource(), cell.getValue().toJsonValue());
    }

    public String getAddress() {
        return address;
    }

    public String getRawValue() {
        return rawValue;
    }

    public String getFormula() {
        return formula;
    }

    public Object getValue() {
        return value;
    }
}
