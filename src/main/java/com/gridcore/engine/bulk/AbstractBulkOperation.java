package com.gridcore.engine.bulk;

import com.gridcore.engine.exceptions.BatchStateException;
import com.gridcore.engine.exceptions.BulkValidationException;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;
import com.gridcore.engine.services.UndoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Shared validate / preview / execute flow. Subclasses produce a lazy stream of
 * changes; preview stops pulling from it once the limit is exceeded, execute
 * drains it and hands everything to the engine as one undoable step.
 *
 * @param <O> the options type of the operation
 */
public abstract class AbstractBulkOperation<O> implements BulkOperation {

    private static final Logger logger = LoggerFactory.getLogger(AbstractBulkOperation.class);

    protected static final double DEFAULT_CELLS_PER_SECOND = 10_000;

    protected final SpreadsheetEngine engine;
    protected final Selection selection;
    protected final O options;

    protected AbstractBulkOperation(SpreadsheetEngine engine, Selection selection, O options) {
        this.engine = engine;
        this.selection = selection;
        this.options = options;
    }

    @Override
    public Selection getSelection() {
        return selection;
    }

    public O getOptions() {
        return options;
    }

    @Override
    public String validate() {
        if (selection == null) {
            return "Selection is required";
        }
        long size = targetSize();
        if (size == 0) {
            return "Selection is empty";
        }
        int max = engine.getSettings().getMaxSelectionCells();
        if (size > max) {
            return "Selection of " + size + " cells exceeds the maximum of " + max + " cells";
        }
        return validateOptions();
    }

    /**
     * Kind-specific checks; null when the options are acceptable.
     */
    protected String validateOptions() {
        return null;
    }

    @Override
    public OperationPreview preview() {
        return preview(engine.getSettings().getPreviewLimit());
    }

    @Override
    public OperationPreview preview(int limit) {
        requireValid();
        List<CellChange> changes = changes().limit((long) limit + 1).collect(Collectors.toList());
        boolean truncated = changes.size() > limit;
        if (truncated) {
            changes = new ArrayList<>(changes.subList(0, limit));
        }
        logger.debug("Preview of {}: {} changes{}", getDescription(), changes.size(), truncated ? " (truncated)" : "");
        return new OperationPreview(changes, truncated, summarize(changes, truncated), estimateTime());
    }

    @Override
    public UndoUnit execute() {
        requireValid();
        if (engine.isBatchOpen()) {
            throw BatchStateException.open(engine.getActiveBatchId(), "execute " + getKind().getKindName());
        }
        Map<CellAddress, String> updates = new LinkedHashMap<>();
        changes().forEach(change -> updates.put(change.getAddress(), change.getAfter()));
        UndoUnit unit = engine.applyChanges(updates, getDescription());
        logger.info("{} changed {} cells", getDescription(), updates.size());
        afterExecute(updates.keySet());
        return unit;
    }

    @Override
    public long estimateTime() {
        long time = Math.round(targetSize() / cellsPerSecond() * 1000);
        return Math.max(minimumTime(), time);
    }

    /**
     * Lazily computed changes, in the order they would be applied.
     */
    protected abstract Stream<CellChange> changes();

    /**
     * The cells actually visited; find/replace widens this to the whole sheet.
     */
    protected Selection targetSelection() {
        return selection;
    }

    protected long targetSize() {
        return targetSelection().size(engine.getCellAddresses());
    }

    protected double cellsPerSecond() {
        return DEFAULT_CELLS_PER_SECOND;
    }

    protected long minimumTime() {
        return 0;
    }

    protected void afterExecute(Set<CellAddress> changed) {
    }

    protected String summarize(List<CellChange> changes, boolean truncated) {
        return (truncated ? "More than " : "") + changes.size() + " cell(s) will change";
    }

    protected static String rawOf(Cell cell) {
        return cell == null ? null : cell.getRawValue();
    }

    private void requireValid() {
        String error = validate();
        if (error != null) {
            throw new BulkValidationException(error);
        }
    }
}
