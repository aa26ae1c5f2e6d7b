package com.gridcore.engine.services;

import com.gridcore.engine.evaluator.Coercion;
import com.gridcore.engine.formula.FormulaParser;
import com.gridcore.engine.formula.ast.Expr;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;

/**
 * Interprets raw cell input.
 * "=..." is a formula, a leading apostrophe forces text, TRUE/FALSE are booleans,
 * numeric text is a number and everything else is text.
 */
public final class CellFactory {

    private CellFactory() {
    }

    /**
     * Builds a cell from non-empty raw input. Formulas are parsed here, so a
     * malformed formula fails with FormulaParseException before anything is stored.
     * The computed value of a formula cell is left empty for the recalculation pass.
     */
    public static Cell create(CellAddress address, String rawValue) {
        if (isFormula(rawValue)) {
            Expr expr = FormulaParser.parseFormula(rawValue);
            return new Cell(address, rawValue, expr, rawValue.substring(1).trim());
        }
        Cell cell = new Cell(address, rawValue);
        cell.setValue(parseLiteral(rawValue));
        return cell;
    }

    public static boolean isFormula(String rawValue) {
        return rawValue != null && rawValue.length() > 1 && rawValue.charAt(0) == '=';
    }

    public static CellValue parseLiteral(String rawValue) {
        if (rawValue == null || rawValue.isEmpty()) {
            return CellValue.EMPTY;
        }
        if (rawValue.charAt(0) == '\'') {
            return CellValue.string(rawValue.substring(1));
        }
        if (rawValue.equalsIgnoreCase("TRUE")) {
            return CellValue.TRUE;
        }
        if (rawValue.equalsIgnoreCase("FALSE")) {
            return CellValue.FALSE;
        }
        Double number = Coercion.parseNumber(rawValue);
        if (number != null) {
            return CellValue.number(number);
        }
        return CellValue.string(rawValue);
    }

    /**
     * Raw input that stores exactly the given text, adding an apostrophe when
     * the text would otherwise read as a formula, number or boolean.
     */
    public static String textRaw(String text) {
        if (text.isEmpty()) {
            return text;
        }
        if (text.charAt(0) == '=' || text.charAt(0) == '\'' || !parseLiteral(text).isString()) {
            return "'" + text;
        }
        return text;
    }
}
