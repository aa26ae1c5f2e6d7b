package com.gridcore.engine.models;

/**
 * Frozen content of one cell, used by undo units.
 */
public final class CellSnapshot {

    private final String rawValue;
    private final String formulaSource;
    private final CellValue value;

    public CellSnapshot(String rawValue, String formulaSource, CellValue value) {
        this.rawValue = rawValue;
        this.formulaSource = formulaSource;
        this.value = value;
    }

    public static CellSnapshot of(Cell cell) {
        return new CellSnapshot(cell.getRawValue(), cell.getFormulaSource(), cell.getValue());
    }

    public String getRawValue() {
        return rawValue;
    }

    public String getFormulaSource() {
        return formulaSource;
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public String toString() {
        return rawValue + " -> " + value;
    }
}
