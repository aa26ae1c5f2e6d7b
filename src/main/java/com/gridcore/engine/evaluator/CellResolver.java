package com.gridcore.engine.evaluator;

import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellRange;
import com.gridcore.engine.models.CellValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Supplies the current computed value of a cell; empty cells resolve to {@link CellValue#EMPTY}.
 */
@FunctionalInterface
public interface CellResolver {
    CellValue resolve(CellAddress address);

    /**
     * Values of the cells in 'range', row-major. Implementations may leave out empty cells.
     */
    default List<CellValue> resolveRange(CellRange range) {
        List<CellAddress> addresses = range.addresses();
        List<CellValue> values = new ArrayList<>(addresses.size());
        for (CellAddress address : addresses) {
            CellValue value = resolve(address);
            values.add(value == null ? CellValue.EMPTY : value);
        }
        return values;
    }
}
