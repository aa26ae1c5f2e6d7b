package com.gridcore.engine.models;

import com.gridcore.engine.formula.ast.Expr;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its address
 * - rawValue (the text the user typed, "=A1+1" for formulas)
 * - the parsed formula and its source text, when the raw value is a formula
 * - value (the cached computed result)
 */
public class Cell {
    private final CellAddress address;
    private String rawValue;
    private Expr formula;
    private String formulaSource;
    private CellValue value = CellValue.EMPTY;

    public Cell(CellAddress address, String rawValue) {
        this.address = address;
        this.rawValue = rawValue;
    }

    public Cell(CellAddress address, String rawValue, Expr formula, String formulaSource) {
        this(address, rawValue);
        this.formula = formula;
        this.formulaSource = formulaSource;
    }

    // Basic getters
    public CellAddress getAddress() {
        return address;
    }

    public String getRawValue() {
        return rawValue;
    }

    public Expr getFormula() {
        return formula;
    }

    public String getFormulaSource() {
        return formulaSource;
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value == null ? CellValue.EMPTY : value;
    }

    /**
     * Replaces the formula after references were rewritten; the raw value follows the new source.
     */
    public void setFormula(Expr formula, String formulaSource) {
        this.formula = formula;
        this.formulaSource = formulaSource;
        this.rawValue = "=" + formulaSource;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    public boolean hasError() {
        return value.isError();
    }

    public boolean isEmpty() {
        return rawValue == null || rawValue.isEmpty();
    }

    /**
     * Same content at another address. Used when rows or columns move.
     */
    public Cell moveTo(CellAddress newAddress) {
        Cell moved = new Cell(newAddress, rawValue, formula, formulaSource);
        moved.value = value;
        return moved;
    }

    public Cell copy() {
        return moveTo(address);
    }

    @Override
    public String toString() {
        return address + "[" + rawValue + " -> " + value.toDisplayString() + "]";
    }
}
