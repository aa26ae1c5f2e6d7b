package com.gridcore.engine.evaluator;

import com.gridcore.engine.models.CellValue;

import java.util.List;

/**
 * A builtin function. Implementations return error values rather than throwing.
 */
@FunctionalInterface
public interface SpreadsheetFunction {
    CellValue apply(List<FunctionArgument> args);
}
