package com.gridcore.engine.bulk;

import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.CellFactory;
import com.gridcore.engine.services.SpreadsheetEngine;

import java.util.Locale;

/**
 * Text clean-up over the selection. Results are always stored as text.
 * Formula cells are never touched; numbers and booleans only when skipNonText is off.
 */
public class TransformOperation extends CellwiseBulkOperation<TransformOptions> {

    public TransformOperation(SpreadsheetEngine engine, Selection selection, TransformOptions options) {
        super(engine, selection, options);
    }

    @Override
    public BulkOperationKind getKind() {
        return BulkOperationKind.TRANSFORM;
    }

    @Override
    protected String validateOptions() {
        return options.getTransformType() == null ? "Transform type is required" : null;
    }

    @Override
    protected CellChange computeChange(CellAddress address, Cell cell) {
        if (cell == null || cell.hasFormula()) {
            return null;
        }
        CellValue value = cell.getValue();
        if (value.isError() || (!value.isString() && options.isSkipNonText())) {
            return null;
        }
        String text = value.toDisplayString();
        String transformed = transform(text);
        if (transformed.equals(text) && value.isString()) {
            return null;
        }
        return change(address, cell, CellFactory.textRaw(transformed));
    }

    String transform(String text) {
        switch (options.getTransformType()) {
            case UPPER:
                return text.toUpperCase(Locale.ROOT);
            case LOWER:
                return text.toLowerCase(Locale.ROOT);
            case TRIM:
                return text.trim().replaceAll(" {2,}", " ");
            case CLEAN:
                return text.replaceAll("[\\r\\n\\t]+", " ")
                        .replaceAll("\\p{Cntrl}", "")
                        .replaceAll(" {2,}", " ")
                        .trim();
            case PROPER:
                return proper(text);
            default:
                throw new IllegalStateException("Unknown transform " + options.getTransformType());
        }
    }

    private static String proper(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = !Character.isDigit(c);
            }
        }
        return sb.toString();
    }

    @Override
    protected double cellsPerSecond() {
        return 50_000;
    }

    @Override
    public String getDescription() {
        return "Transform " + selection + " to " + options.getTransformType();
    }
}
