package com.gridcore.engine.services;

import com.gridcore.engine.bulk.BulkOperation;
import com.gridcore.engine.bulk.OperationPreview;
import com.gridcore.engine.config.EngineSettings;
import com.gridcore.engine.config.SpreadsheetProperties;
import com.gridcore.engine.exceptions.BulkValidationException;
import com.gridcore.engine.exceptions.SheetNotFoundException;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

/**
 * Hosts sheets for the REST layer. Each sheet wraps one engine; calls into an
 * engine are serialized by the sheet's read/write lock.
 */
@Service
public class SheetService {

    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; nothing is persisted
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();
    private final EngineSettings settings;

    public SheetService() {
        this(EngineSettings.defaults());
    }

    @Autowired
    public SheetService(SpreadsheetProperties properties) {
        this(properties.toEngineSettings());
    }

    public SheetService(EngineSettings settings) {
        this.settings = settings;
    }

    /**
     * Creates a new empty Sheet and returns its ID.
     */
    public long createSheet() {
        Sheet sheet = new Sheet(settings);
        sheets.put(sheet.getId(), sheet);
        logger.info("Created sheet {}", sheet.getId());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    public void deleteSheet(long sheetId) {
        if (sheets.remove(sheetId) == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        logger.info("Deleted sheet {}", sheetId);
    }

    /**
     * Sets a cell from raw input. Parse errors and circular references propagate
     * to the controller and leave the sheet unchanged.
     */
    public Cell setCellValue(long sheetId, String address, String rawValue) {
        return write(sheetId, engine -> engine.setCellValue(CellAddress.fromString(address), rawValue));
    }

    public void deleteCell(long sheetId, String address) {
        write(sheetId, engine -> {
            engine.deleteCell(CellAddress.fromString(address));
            return null;
        });
    }

    public Cell getCell(long sheetId, String address) {
        return read(sheetId, engine -> engine.getCell(CellAddress.fromString(address)));
    }

    /**
     * Returns a map of A1 address -> computed value for all cells, row-major.
     */
    public Map<String, Object> getSheetData(long sheetId) {
        return read(sheetId, engine -> {
            Map<String, Object> data = new LinkedHashMap<>();
            for (CellAddress address : engine.getCellAddresses()) {
                CellValue value = engine.getCellValue(address);
                data.put(address.toString(), value.toJsonValue());
            }
            return data;
        });
    }

    public void insertRows(long sheetId, int index, int count) {
        write(sheetId, engine -> {
            engine.insertRows(index, count);
            return null;
        });
    }

    public void deleteRows(long sheetId, int index, int count) {
        write(sheetId, engine -> {
            engine.deleteRows(index, count);
            return null;
        });
    }

    public void insertColumns(long sheetId, int index, int count) {
        write(sheetId, engine -> {
            engine.insertColumns(index, count);
            return null;
        });
    }

    public void deleteColumns(long sheetId, int index, int count) {
        write(sheetId, engine -> {
            engine.deleteColumns(index, count);
            return null;
        });
    }

    public boolean undo(long sheetId) {
        return write(sheetId, SpreadsheetEngine::undo);
    }

    public boolean redo(long sheetId) {
        return write(sheetId, SpreadsheetEngine::redo);
    }

    public String beginBatch(long sheetId, String batchId) {
        return write(sheetId, engine -> engine.beginBatch(batchId));
    }

    public int commitBatch(long sheetId, String batchId) {
        return write(sheetId, engine -> engine.commitBatch(batchId));
    }

    public void rollbackBatch(long sheetId, String batchId) {
        write(sheetId, engine -> {
            engine.rollbackBatch(batchId);
            return null;
        });
    }

    public Map<CellAddress, CellValue> recalculate(long sheetId) {
        return write(sheetId, SpreadsheetEngine::recalculate);
    }

    public OperationPreview previewBulk(long sheetId, String kind, String selection, Map<String, Object> options,
                                        Integer limit) {
        return read(sheetId, engine -> {
            BulkOperation operation = createOperation(engine, kind, selection, options);
            return limit == null ? operation.preview() : operation.preview(limit);
        });
    }

    /**
     * Executes a bulk operation and returns the number of changed cells.
     */
    public int executeBulk(long sheetId, String kind, String selection, Map<String, Object> options) {
        return write(sheetId, engine -> createOperation(engine, kind, selection, options).execute().size());
    }

    public Map<String, Set<String>> getForwardGraph(long sheetId) {
        return read(sheetId, engine -> engine.getDependencyGraph().getForwardGraph());
    }

    public Map<String, Set<String>> getReverseGraph(long sheetId) {
        return read(sheetId, engine -> engine.getDependencyGraph().getReverseGraph());
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private static BulkOperation createOperation(SpreadsheetEngine engine, String kind, String selection,
                                                 Map<String, Object> options) {
        BulkOperation operation = engine.createOperation(kind, Selection.parse(selection), options);
        if (operation == null) {
            throw new BulkValidationException("Unsupported bulk operation: " + kind);
        }
        return operation;
    }

    private <T> T read(long sheetId, Function<SpreadsheetEngine, T> action) {
        Sheet sheet = getSheet(sheetId);
        return locked(sheet.getLock().readLock(), sheet, action);
    }

    private <T> T write(long sheetId, Function<SpreadsheetEngine, T> action) {
        Sheet sheet = getSheet(sheetId);
        return locked(sheet.getLock().writeLock(), sheet, action);
    }

    private static <T> T locked(Lock lock, Sheet sheet, Function<SpreadsheetEngine, T> action) {
        lock.lock();
        try {
            return action.apply(sheet.getEngine());
        } finally {
            lock.unlock();
        }
    }
}
