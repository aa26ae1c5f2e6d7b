package com.gridcore.engine.bulk;

import com.gridcore.engine.exceptions.FormulaParseException;
import com.gridcore.engine.formula.FormulaParser;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.CellFactory;
import com.gridcore.engine.services.SpreadsheetEngine;

/**
 * Writes the same raw value into every selected cell.
 */
public class BulkSetOperation extends CellwiseBulkOperation<BulkSetOptions> {

    public BulkSetOperation(SpreadsheetEngine engine, Selection selection, BulkSetOptions options) {
        super(engine, selection, options);
    }

    @Override
    public BulkOperationKind getKind() {
        return BulkOperationKind.BULK_SET;
    }

    @Override
    protected String validateOptions() {
        if (options.getValue() == null) {
            return "Value is required";
        }
        if (CellFactory.isFormula(options.getValue())) {
            try {
                FormulaParser.parseFormula(options.getValue());
            } catch (FormulaParseException e) {
                return "Invalid formula: " + e.getMessage();
            }
        }
        return null;
    }

    @Override
    protected CellChange computeChange(CellAddress address, Cell cell) {
        if (cell == null) {
            return options.isSkipEmpty() ? null : change(address, null, options.getValue());
        }
        if (options.isPreserveFormulas() && cell.hasFormula()) {
            return null;
        }
        if (!options.isOverwriteExisting()) {
            return null;
        }
        return change(address, cell, options.getValue());
    }

    @Override
    protected double cellsPerSecond() {
        return 50_000;
    }

    @Override
    protected long minimumTime() {
        return 100;
    }

    @Override
    public String getDescription() {
        return "Set " + selection + " to '" + options.getValue() + "'";
    }
}
