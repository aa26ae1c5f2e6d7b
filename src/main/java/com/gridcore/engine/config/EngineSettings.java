package com.gridcore.engine.config;

import com.gridcore.engine.models.CellAddress;

/**
 * Tunables for one engine instance. Plain value object so engines can be built without Spring.
 */
public final class EngineSettings {

    public static final int DEFAULT_UNDO_DEPTH = 100;
    public static final int DEFAULT_PREVIEW_LIMIT = 100;
    public static final int DEFAULT_MAX_SELECTION_CELLS = 1_000_000;

    private final int maxRows;
    private final int maxColumns;
    private final int undoMaxDepth;
    private final int previewLimit;
    private final int maxSelectionCells;

    public EngineSettings(int maxRows, int maxColumns, int undoMaxDepth, int previewLimit, int maxSelectionCells) {
        if (maxRows < 1 || maxRows > CellAddress.MAX_ROWS) {
            throw new IllegalArgumentException("maxRows must be between 1 and " + CellAddress.MAX_ROWS);
        }
        if (maxColumns < 1 || maxColumns > CellAddress.MAX_COLUMNS) {
            throw new IllegalArgumentException("maxColumns must be between 1 and " + CellAddress.MAX_COLUMNS);
        }
        if (undoMaxDepth < 1) {
            throw new IllegalArgumentException("undoMaxDepth must be positive");
        }
        if (previewLimit < 1 || maxSelectionCells < 1) {
            throw new IllegalArgumentException("Bulk limits must be positive");
        }
        this.maxRows = maxRows;
        this.maxColumns = maxColumns;
        this.undoMaxDepth = undoMaxDepth;
        this.previewLimit = previewLimit;
        this.maxSelectionCells = maxSelectionCells;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(CellAddress.MAX_ROWS, CellAddress.MAX_COLUMNS,
                DEFAULT_UNDO_DEPTH, DEFAULT_PREVIEW_LIMIT, DEFAULT_MAX_SELECTION_CELLS);
    }

    public EngineSettings withUndoMaxDepth(int depth) {
        return new EngineSettings(maxRows, maxColumns, depth, previewLimit, maxSelectionCells);
    }

    public EngineSettings withLimits(int rows, int columns) {
        return new EngineSettings(rows, columns, undoMaxDepth, previewLimit, maxSelectionCells);
    }

    public int getMaxRows() {
        return maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public int getUndoMaxDepth() {
        return undoMaxDepth;
    }

    public int getPreviewLimit() {
        return previewLimit;
    }

    public int getMaxSelectionCells() {
        return maxSelectionCells;
    }
}
