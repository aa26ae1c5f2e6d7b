package com.gridcore.engine.bulk;

import com.gridcore.engine.evaluator.Coercion;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Applies arithmetic to every numeric cell in the selection. Formula cells and
 * non-numeric text are left alone; text such as "$1,200" or "15%" is read as a
 * number when convertStrings is set.
 */
public class MathOperation extends CellwiseBulkOperation<MathOptions> {

    public MathOperation(SpreadsheetEngine engine, Selection selection, MathOptions options) {
        super(engine, selection, options);
    }

    @Override
    public BulkOperationKind getKind() {
        return BulkOperationKind.MATH_OPERATION;
    }

    @Override
    protected String validateOptions() {
        MathOperationType operation = options.getOperation();
        if (operation == null) {
            return "Operation is required";
        }
        if (options.getDecimalPlaces() < 0 || options.getDecimalPlaces() > 10) {
            return "Decimal places must be between 0 and 10";
        }
        if (operation.isRounding()) {
            return null;
        }
        Double value = options.getValue();
        if (value == null || !Double.isFinite(value)) {
            return "Operand must be a finite number";
        }
        if ((operation == MathOperationType.DIVIDE || operation == MathOperationType.MODULO) && value == 0) {
            return "Cannot divide by zero";
        }
        if (operation == MathOperationType.PERCENT_DECREASE && value >= 100) {
            return "Percent decrease must be less than 100";
        }
        return null;
    }

    @Override
    protected CellChange computeChange(CellAddress address, Cell cell) {
        if (cell == null || cell.hasFormula()) {
            return null;
        }
        Double current = numericValue(cell.getValue());
        if (current == null) {
            return null;
        }
        double result = apply(current);
        if (!Double.isFinite(result)) {
            return null;
        }
        return change(address, cell, CellValue.formatNumber(result));
    }

    private Double numericValue(CellValue value) {
        if (value.isNumber()) {
            return value.asNumber();
        }
        if (value.isString() && options.isConvertStrings()) {
            return Coercion.parseNumber(value.asString().replaceAll("[\\s,$%]", ""));
        }
        return null;
    }

    private double apply(double current) {
        double operand = options.getValue() == null ? 0 : options.getValue();
        int decimals = options.getDecimalPlaces();
        switch (options.getOperation()) {
            case ADD:
                return current + operand;
            case SUBTRACT:
                return current - operand;
            case MULTIPLY:
                return current * operand;
            case DIVIDE:
                return current / operand;
            case MODULO:
                return current % operand;
            case PERCENT:
                return current * operand / 100;
            case PERCENT_DECREASE:
                return current * (1 - operand / 100);
            case ROUND:
                return scale(current, decimals, RoundingMode.HALF_UP);
            case FLOOR:
                return scale(current, decimals, RoundingMode.FLOOR);
            case CEIL:
                return scale(current, decimals, RoundingMode.CEILING);
            default:
                throw new IllegalStateException("Unknown operation " + options.getOperation());
        }
    }

    private static double scale(double value, int decimals, RoundingMode mode) {
        return BigDecimal.valueOf(value).setScale(decimals, mode).doubleValue();
    }

    @Override
    protected double cellsPerSecond() {
        return 100_000;
    }

    @Override
    protected long minimumTime() {
        return 50;
    }

    @Override
    public String getDescription() {
        String operation = options.getOperation() == null ? "math" : options.getOperation().name().toLowerCase();
        return "Apply " + operation + (options.getValue() == null ? "" : " " + CellValue.formatNumber(options.getValue()))
                + " to " + selection;
    }
}
