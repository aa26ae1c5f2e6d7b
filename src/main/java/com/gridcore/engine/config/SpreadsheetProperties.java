package com.gridcore.engine.config;

import com.gridcore.engine.models.CellAddress;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the {@code gridcore.*} keys from application.properties.
 */
@ConfigurationProperties(prefix = "gridcore")
public class SpreadsheetProperties {

    private final Limits limits = new Limits();
    private final Undo undo = new Undo();
    private final Bulk bulk = new Bulk();

    public Limits getLimits() {
        return limits;
    }

    public Undo getUndo() {
        return undo;
    }

    public Bulk getBulk() {
        return bulk;
    }

    public EngineSettings toEngineSettings() {
        return new EngineSettings(limits.getMaxRows(), limits.getMaxColumns(),
                undo.getMaxDepth(), bulk.getPreviewLimit(), bulk.getMaxSelectionCells());
    }

    public static class Limits {
        private int maxRows = CellAddress.MAX_ROWS;
        private int maxColumns = CellAddress.MAX_COLUMNS;

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }

        public int getMaxColumns() {
            return maxColumns;
        }

        public void setMaxColumns(int maxColumns) {
            this.maxColumns = maxColumns;
        }
    }

    public static class Undo {
        private int maxDepth = EngineSettings.DEFAULT_UNDO_DEPTH;

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }
    }

    public static class Bulk {
        private int previewLimit = EngineSettings.DEFAULT_PREVIEW_LIMIT;
        private int maxSelectionCells = EngineSettings.DEFAULT_MAX_SELECTION_CELLS;

        public int getPreviewLimit() {
            return previewLimit;
        }

        public void setPreviewLimit(int previewLimit) {
            this.previewLimit = previewLimit;
        }

        public int getMaxSelectionCells() {
            return maxSelectionCells;
        }

        public void setMaxSelectionCells(int maxSelectionCells) {
            this.maxSelectionCells = maxSelectionCells;
        }
    }
}
