package com.gridcore.engine.evaluator;

import com.gridcore.engine.models.CellValue;

import java.util.List;

/**
 * An evaluated function argument: either one scalar or the row-major values of a range.
 * Empty cells of a range may be missing from its values.
 */
public final class FunctionArgument {

    private final CellValue value;
    private final List<CellValue> rangeValues;

    private FunctionArgument(CellValue value, List<CellValue> rangeValues) {
        this.value = value;
        this.rangeValues = rangeValues;
    }

    public static FunctionArgument scalar(CellValue value) {
        return new FunctionArgument(value, null);
    }

    public static FunctionArgument range(List<CellValue> values) {
        return new FunctionArgument(null, List.copyOf(values));
    }

    public boolean isRange() {
        return rangeValues != null;
    }

    public CellValue getValue() {
        return value;
    }

    public List<CellValue> getRangeValues() {
        return rangeValues;
    }

    /**
     * Scalar as a one-element list, or the range values.
     */
    public List<CellValue> values() {
        return isRange() ? rangeValues : List.of(value);
    }
}
