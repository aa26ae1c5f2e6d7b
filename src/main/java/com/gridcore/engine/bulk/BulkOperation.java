package com.gridcore.engine.bulk;

import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.UndoUnit;

/**
 * A selection-scoped edit that can be validated, previewed and executed.
 */
public interface BulkOperation {

    BulkOperationKind getKind();

    Selection getSelection();

    /**
     * Returns a human-readable problem, or null when the operation can run.
     */
    String validate();

    /**
     * Computes at most 'limit' changes without touching the sheet.
     */
    OperationPreview preview(int limit);

    /**
     * Preview capped at the engine's configured preview limit.
     */
    OperationPreview preview();

    /**
     * Applies every change as one undoable step.
     *
     * @throws com.gridcore.engine.exceptions.BulkValidationException if validation fails
     * @throws com.gridcore.engine.exceptions.BatchStateException if a batch is open
     */
    UndoUnit execute();

    /**
     * Rough running time in milliseconds.
     */
    long estimateTime();

    String getDescription();
}
