package com.gridcore.engine.bulk;

import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An operation where every cell's new value depends only on that cell.
 */
public abstract class CellwiseBulkOperation<O> extends AbstractBulkOperation<O> {

    protected CellwiseBulkOperation(SpreadsheetEngine engine, Selection selection, O options) {
        super(engine, selection, options);
    }

    @Override
    protected Stream<CellChange> changes() {
        List<CellAddress> occupied = engine.getCellAddresses();
        return StreamSupport.stream(targetSelection().addresses(occupied).spliterator(), false)
                .map(address -> computeChange(address, engine.getCell(address)))
                .filter(Objects::nonNull);
    }

    /**
     * The change for one cell, or null to leave it alone. 'cell' is null for empty cells.
     */
    protected abstract CellChange computeChange(CellAddress address, Cell cell);

    protected static CellChange change(CellAddress address, Cell cell, String newRaw) {
        String oldRaw = rawOf(cell);
        if (Objects.equals(oldRaw, newRaw) || (oldRaw == null && (newRaw == null || newRaw.isEmpty()))) {
            return null;
        }
        return new CellChange(address, oldRaw, newRaw);
    }
}
