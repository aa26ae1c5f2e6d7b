package com.gridcore.engine.services;

import com.gridcore.engine.bulk.BulkOperation;
import com.gridcore.engine.bulk.BulkOperationFactory;
import com.gridcore.engine.bulk.BulkOperationKind;
import com.gridcore.engine.config.EngineSettings;
import com.gridcore.engine.events.SpreadsheetEvent;
import com.gridcore.engine.events.SpreadsheetEventListener;
import com.gridcore.engine.evaluator.Evaluator;
import com.gridcore.engine.exceptions.BatchStateException;
import com.gridcore.engine.exceptions.CircularReferenceException;
import com.gridcore.engine.exceptions.InvalidAddressException;
import com.gridcore.engine.exceptions.InvalidStructuralOperationException;
import com.gridcore.engine.exceptions.SpreadsheetException;
import com.gridcore.engine.formula.ReferenceCollector;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellRange;
import com.gridcore.engine.models.CellSnapshot;
import com.gridcore.engine.models.CellStore;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One spreadsheet: cell storage, formulas, recalculation, structural edits,
 * batches, undo/redo and bulk operations behind a single facade.
 *
 * Not thread-safe; every call runs to completion before the next one.
 * Every top-level mutation is atomic: it either applies fully (and becomes one
 * undo unit) or throws and leaves the sheet as it was.
 */
public class SpreadsheetEngine {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetEngine.class);

    private final EngineSettings settings;
    private final CellStore store = new CellStore();
    private final DependencyGraph graph = new DependencyGraph();
    private final RecalculationEngine recalculationEngine;
    private final StructuralTransformer structuralTransformer;
    private final TransactionManager transactionManager = new TransactionManager();
    private final UndoRedoStack undoRedoStack;
    private final BulkOperationFactory bulkOperationFactory;
    private final List<SpreadsheetEventListener> listeners = new CopyOnWriteArrayList<>();

    public SpreadsheetEngine() {
        this(EngineSettings.defaults());
    }

    public SpreadsheetEngine(EngineSettings settings) {
        this(settings, new Evaluator());
    }

    public SpreadsheetEngine(EngineSettings settings, Evaluator evaluator) {
        this.settings = settings;
        this.recalculationEngine = new RecalculationEngine(store, graph, evaluator);
        this.structuralTransformer = new StructuralTransformer(store, graph,
                settings.getMaxRows(), settings.getMaxColumns());
        this.undoRedoStack = new UndoRedoStack(settings.getUndoMaxDepth());
        this.bulkOperationFactory = new BulkOperationFactory(this);
    }

    // ----------------------------------------------------------------
    // Cell mutations
    // ----------------------------------------------------------------

    /**
     * Sets a cell from raw input; empty input deletes the cell.
     * Outside a batch the change is applied, recalculated and recorded for undo,
     * and a copy of the stored cell is returned (null after a delete).
     * Inside a batch the change is buffered and the pending, not yet computed, cell is returned.
     *
     * @throws com.gridcore.engine.exceptions.FormulaParseException for malformed formulas
     * @throws CircularReferenceException if the formula would close a cycle
     */
    public Cell setCellValue(CellAddress address, String rawValue) {
        checkBounds(address);
        if (transactionManager.isOpen()) {
            if (isBlank(rawValue)) {
                transactionManager.record(Mutation.deleteCell(address));
                return null;
            }
            Cell pending = CellFactory.create(address, rawValue);
            transactionManager.record(Mutation.setCell(address, rawValue));
            return pending;
        }
        Map<CellAddress, String> change = new LinkedHashMap<>();
        change.put(address, rawValue);
        applyChanges(change, "Set " + address);
        return getCell(address);
    }

    public Cell setCellValue(String address, String rawValue) {
        return setCellValue(CellAddress.fromString(address), rawValue);
    }

    public void deleteCell(CellAddress address) {
        checkBounds(address);
        if (transactionManager.isOpen()) {
            transactionManager.record(Mutation.deleteCell(address));
            return;
        }
        Map<CellAddress, String> change = new LinkedHashMap<>();
        change.put(address, null);
        applyChanges(change, "Delete " + address);
    }

    /**
     * Sets several cells as one atomic step with a single recalculation and one undo unit.
     */
    public void setCellValues(Map<CellAddress, String> values) {
        for (CellAddress address : values.keySet()) {
            checkBounds(address);
        }
        if (transactionManager.isOpen()) {
            for (Map.Entry<CellAddress, String> entry : values.entrySet()) {
                if (isBlank(entry.getValue())) {
                    transactionManager.record(Mutation.deleteCell(entry.getKey()));
                } else {
                    CellFactory.create(entry.getKey(), entry.getValue());
                    transactionManager.record(Mutation.setCell(entry.getKey(), entry.getValue()));
                }
            }
            return;
        }
        applyChanges(new LinkedHashMap<>(values), "Set " + values.size() + " cells");
    }

    /**
     * Applies raw values to cells (null or empty deletes), recalculates once and
     * pushes one undo unit. Used by the cell setters and by bulk operations.
     * On failure every change is reverted before the exception propagates.
     */
    public UndoUnit applyChanges(Map<CellAddress, String> changes, String description) {
        ensureNoBatch("apply changes");
        if (changes.isEmpty()) {
            return new UndoUnit(description, Collections.emptyMap(), Collections.emptyMap(), false);
        }
        Map<CellAddress, CellSnapshot> before = snapshot(changes.keySet());
        try {
            for (Map.Entry<CellAddress, String> entry : changes.entrySet()) {
                applyCellChange(entry.getKey(), entry.getValue());
            }
        } catch (SpreadsheetException e) {
            restoreCells(before);
            throw e;
        }
        Map<CellAddress, CellValue> recalculated = recalculationEngine.recalculate(changes.keySet());
        UndoUnit unit = new UndoUnit(description, before, snapshot(changes.keySet()), false);
        undoRedoStack.push(unit);
        publishUpdates(changes.keySet(), recalculated);
        return unit;
    }

    // ----------------------------------------------------------------
    // Structural edits
    // ----------------------------------------------------------------

    public void insertRow(int index) {
        insertRows(index, 1);
    }

    public void insertRows(int index, int count) {
        structural(Mutation.Kind.INSERT_ROWS, index, count);
    }

    public void deleteRow(int index) {
        deleteRows(index, 1);
    }

    public void deleteRows(int index, int count) {
        structural(Mutation.Kind.DELETE_ROWS, index, count);
    }

    public void insertColumn(int index) {
        insertColumns(index, 1);
    }

    public void insertColumns(int index, int count) {
        structural(Mutation.Kind.INSERT_COLUMNS, index, count);
    }

    public void deleteColumn(int index) {
        deleteColumns(index, 1);
    }

    public void deleteColumns(int index, int count) {
        structural(Mutation.Kind.DELETE_COLUMNS, index, count);
    }

    private void structural(Mutation.Kind kind, int index, int count) {
        if (index < 0 || count < 1) {
            throw new InvalidStructuralOperationException("Invalid index " + index + " or count " + count);
        }
        Mutation mutation = Mutation.structural(kind, index, count);
        if (transactionManager.isOpen()) {
            transactionManager.record(mutation);
            return;
        }
        Map<CellAddress, CellSnapshot> before = snapshotSheet();
        applyMutation(mutation);
        Map<CellAddress, CellValue> recalculated = recalculationEngine.recalculate();
        undoRedoStack.push(new UndoUnit(mutation.toString(), before, snapshotSheet(), true));
        publishUpdates(Collections.emptyList(), recalculated);
    }

    // ----------------------------------------------------------------
    // Batches
    // ----------------------------------------------------------------

    public String beginBatch() {
        return beginBatch(null);
    }

    /**
     * Opens a batch; subsequent mutations are buffered until commit or rollback.
     */
    public String beginBatch(String id) {
        return transactionManager.beginBatch(id);
    }

    /**
     * Applies the buffered mutations in call order, recalculates once, records one
     * undo unit and emits one batch:complete event. If any mutation fails the
     * sheet is restored, the batch is discarded and the failure is rethrown.
     *
     * @return the number of mutations applied
     */
    public int commitBatch(String id) {
        Transaction transaction = transactionManager.commit(id);
        List<Mutation> mutations = transaction.getMutations();
        boolean fullSheet = transaction.hasStructuralMutations();
        Set<CellAddress> touched = new LinkedHashSet<>();
        for (Mutation mutation : mutations) {
            if (!mutation.isStructural()) {
                touched.add(mutation.getAddress());
            }
        }

        Map<CellAddress, CellSnapshot> before = fullSheet ? snapshotSheet() : snapshot(touched);
        try {
            for (Mutation mutation : mutations) {
                applyMutation(mutation);
            }
        } catch (SpreadsheetException e) {
            logger.warn("Batch {} failed on commit and was rolled back: {}", id, e.getMessage());
            if (fullSheet) {
                restoreSheet(before);
            } else {
                restoreCells(before);
            }
            throw e;
        }

        Map<CellAddress, CellValue> recalculated = fullSheet
                ? recalculationEngine.recalculate()
                : recalculationEngine.recalculate(touched);
        if (!mutations.isEmpty()) {
            Map<CellAddress, CellSnapshot> after = fullSheet ? snapshotSheet() : snapshot(touched);
            undoRedoStack.push(new UndoUnit("Batch " + id, before, after, fullSheet));
        }
        logger.info("Committed batch {} with {} mutations", id, mutations.size());
        publishCellUpdates(fullSheet ? Collections.emptyList() : touched, recalculated);
        emit(SpreadsheetEvent.batchComplete(mutations.size()));
        emit(SpreadsheetEvent.calculationComplete(recalculationEngine.getLastEvaluatedCount()));
        return mutations.size();
    }

    public void rollbackBatch(String id) {
        transactionManager.rollback(id);
    }

    public boolean isBatchOpen() {
        return transactionManager.isOpen();
    }

    public String getActiveBatchId() {
        return transactionManager.getActiveId();
    }

    // ----------------------------------------------------------------
    // Undo / redo
    // ----------------------------------------------------------------

    /**
     * Reverts the most recent undo unit. Returns false when there is nothing to undo.
     */
    public boolean undo() {
        ensureNoBatch("undo");
        UndoUnit unit = undoRedoStack.undo();
        if (unit == null) {
            return false;
        }
        applySnapshots(unit.getBefore(), unit.isFullSheet());
        logger.info("Undo: {}", unit.getDescription());
        return true;
    }

    /**
     * Reapplies the most recently undone unit. Returns false when there is nothing to redo.
     */
    public boolean redo() {
        ensureNoBatch("redo");
        UndoUnit unit = undoRedoStack.redo();
        if (unit == null) {
            return false;
        }
        applySnapshots(unit.getAfter(), unit.isFullSheet());
        logger.info("Redo: {}", unit.getDescription());
        return true;
    }

    public boolean canUndo() {
        return undoRedoStack.canUndo();
    }

    public boolean canRedo() {
        return undoRedoStack.canRedo();
    }

    public void clearHistory() {
        undoRedoStack.clear();
    }

    public int getUndoSize() {
        return undoRedoStack.undoSize();
    }

    // ----------------------------------------------------------------
    // Queries
    // ----------------------------------------------------------------

    /**
     * Returns a copy of the cell, or null when the cell is empty.
     */
    public Cell getCell(CellAddress address) {
        Cell cell = store.get(address);
        return cell == null ? null : cell.copy();
    }

    public Cell getCell(String address) {
        return getCell(CellAddress.fromString(address));
    }

    public CellValue getCellValue(CellAddress address) {
        return store.getValue(address);
    }

    public CellValue getCellValue(String address) {
        return getCellValue(CellAddress.fromString(address));
    }

    public int getCellCount() {
        return store.size();
    }

    /**
     * Occupied addresses, row-major.
     */
    public List<CellAddress> getCellAddresses() {
        return store.sortedAddresses();
    }

    public DependencyGraph getDependencyGraph() {
        return graph;
    }

    public RecalculationEngine.State getRecalculationState() {
        return recalculationEngine.getState();
    }

    public EngineSettings getSettings() {
        return settings;
    }

    /**
     * Recalculates every formula cell and returns the cells whose value changed.
     */
    public Map<CellAddress, CellValue> recalculate() {
        Map<CellAddress, CellValue> recalculated = recalculationEngine.recalculate();
        publishUpdates(Collections.emptyList(), recalculated);
        return recalculated;
    }

    public Map<CellAddress, CellValue> recalculateCell(CellAddress address) {
        Map<CellAddress, CellValue> recalculated = recalculationEngine.recalculateCell(address);
        publishUpdates(Collections.emptyList(), recalculated);
        return recalculated;
    }

    // ----------------------------------------------------------------
    // Bulk operations
    // ----------------------------------------------------------------

    /**
     * Creates a bulk operation such as "findReplace" or "fill"; returns null for an unsupported kind.
     */
    public BulkOperation createOperation(String kind, Selection selection, Map<String, Object> options) {
        return bulkOperationFactory.createOperation(kind, selection, options);
    }

    public BulkOperation createOperation(BulkOperationKind kind, Selection selection, Map<String, Object> options) {
        return bulkOperationFactory.createOperation(kind, selection, options);
    }

    // ----------------------------------------------------------------
    // Events
    // ----------------------------------------------------------------

    public void addListener(SpreadsheetEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SpreadsheetEventListener listener) {
        listeners.remove(listener);
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private void applyMutation(Mutation mutation) {
        switch (mutation.getKind()) {
            case SET_CELL:
                applyCellChange(mutation.getAddress(), mutation.getRawValue());
                break;
            case DELETE_CELL:
                applyCellChange(mutation.getAddress(), null);
                break;
            case INSERT_ROWS:
                structuralTransformer.insertRows(mutation.getIndex(), mutation.getCount());
                break;
            case DELETE_ROWS:
                structuralTransformer.deleteRows(mutation.getIndex(), mutation.getCount());
                break;
            case INSERT_COLUMNS:
                structuralTransformer.insertColumns(mutation.getIndex(), mutation.getCount());
                break;
            case DELETE_COLUMNS:
                structuralTransformer.deleteColumns(mutation.getIndex(), mutation.getCount());
                break;
            default:
                throw new IllegalStateException("Unknown mutation " + mutation.getKind());
        }
    }

    // Stores one cell and its graph edges; the value of a formula is left for recalculation.
    private void applyCellChange(CellAddress address, String rawValue) {
        if (isBlank(rawValue)) {
            store.remove(address);
            graph.removeDependencies(address);
            return;
        }
        Cell cell = CellFactory.create(address, rawValue);
        if (cell.hasFormula()) {
            Set<CellAddress> references = ReferenceCollector.collect(cell.getFormula());
            Set<CellRange> ranges = ReferenceCollector.collectRanges(cell.getFormula());
            if (graph.wouldCycle(address, references, ranges)) {
                logger.warn("Rejected {} for {}: circular reference", rawValue, address);
                throw new CircularReferenceException("Setting " + address + " to " + rawValue
                        + " would create a circular reference");
            }
            graph.setDependencies(address, references, ranges);
        } else {
            graph.removeDependencies(address);
        }
        store.put(cell);
    }

    private void applySnapshots(Map<CellAddress, CellSnapshot> snapshots, boolean fullSheet) {
        if (fullSheet) {
            restoreSheet(snapshots);
            publishUpdates(Collections.emptyList(), recalculationEngine.recalculate());
        } else {
            restoreCells(snapshots);
            publishUpdates(snapshots.keySet(), recalculationEngine.recalculate(snapshots.keySet()));
        }
    }

    private void restoreCells(Map<CellAddress, CellSnapshot> snapshots) {
        for (Map.Entry<CellAddress, CellSnapshot> entry : snapshots.entrySet()) {
            restoreCell(entry.getKey(), entry.getValue());
        }
    }

    private void restoreSheet(Map<CellAddress, CellSnapshot> snapshots) {
        store.clear();
        graph.clear();
        restoreCells(snapshots);
    }

    private void restoreCell(CellAddress address, CellSnapshot snapshot) {
        if (snapshot == null) {
            store.remove(address);
            graph.removeDependencies(address);
            return;
        }
        Cell cell = CellFactory.create(address, snapshot.getRawValue());
        cell.setValue(snapshot.getValue());
        store.put(cell);
        if (cell.hasFormula()) {
            graph.setDependencies(address, ReferenceCollector.collect(cell.getFormula()),
                    ReferenceCollector.collectRanges(cell.getFormula()));
        } else {
            graph.removeDependencies(address);
        }
    }

    private Map<CellAddress, CellSnapshot> snapshot(Collection<CellAddress> addresses) {
        Map<CellAddress, CellSnapshot> result = new LinkedHashMap<>();
        for (CellAddress address : addresses) {
            Cell cell = store.get(address);
            result.put(address, cell == null ? null : CellSnapshot.of(cell));
        }
        return result;
    }

    private Map<CellAddress, CellSnapshot> snapshotSheet() {
        return snapshot(store.sortedAddresses());
    }

    private void publishUpdates(Collection<CellAddress> changed, Map<CellAddress, CellValue> recalculated) {
        publishCellUpdates(changed, recalculated);
        emit(SpreadsheetEvent.calculationComplete(recalculationEngine.getLastEvaluatedCount()));
    }

    private void publishCellUpdates(Collection<CellAddress> changed, Map<CellAddress, CellValue> recalculated) {
        if (listeners.isEmpty()) {
            return;
        }
        for (CellAddress address : changed) {
            emit(SpreadsheetEvent.cellUpdate(address, store.getValue(address)));
        }
        for (Map.Entry<CellAddress, CellValue> entry : recalculated.entrySet()) {
            if (!changed.contains(entry.getKey())) {
                emit(SpreadsheetEvent.cellUpdate(entry.getKey(), entry.getValue()));
            }
        }
    }

    private void emit(SpreadsheetEvent event) {
        for (SpreadsheetEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Listener failed while handling {}", event, e);
            }
        }
    }

    private void ensureNoBatch(String operation) {
        if (transactionManager.isOpen()) {
            throw BatchStateException.open(transactionManager.getActiveId(), operation);
        }
    }

    private void checkBounds(CellAddress address) {
        if (address.getRow() >= settings.getMaxRows() || address.getCol() >= settings.getMaxColumns()) {
            throw new InvalidAddressException("Cell address out of bounds: " + address);
        }
    }

    private static boolean isBlank(String rawValue) {
        return rawValue == null || rawValue.isEmpty();
    }
}
