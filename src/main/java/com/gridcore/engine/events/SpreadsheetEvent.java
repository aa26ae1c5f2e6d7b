package com.gridcore.engine.events;

import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;

/**
 * Notification emitted after a mutation completes.
 * Only the fields relevant to the event type are set.
 */
public final class SpreadsheetEvent {

    private final EventType type;
    private final CellAddress address;
    private final CellValue newValue;
    private final int operationCount;
    private final int cellsRecalculated;

    private SpreadsheetEvent(EventType type, CellAddress address, CellValue newValue,
                             int operationCount, int cellsRecalculated) {
        this.type = type;
        this.address = address;
        this.newValue = newValue;
        this.operationCount = operationCount;
        this.cellsRecalculated = cellsRecalculated;
    }

    public static SpreadsheetEvent cellUpdate(CellAddress address, CellValue newValue) {
        return new SpreadsheetEvent(EventType.CELL_UPDATE, address, newValue, 0, 0);
    }

    public static SpreadsheetEvent batchComplete(int operationCount) {
        return new SpreadsheetEvent(EventType.BATCH_COMPLETE, null, null, operationCount, 0);
    }

    public static SpreadsheetEvent calculationComplete(int cellsRecalculated) {
        return new SpreadsheetEvent(EventType.CALCULATION_COMPLETE, null, null, 0, cellsRecalculated);
    }

    public EventType getType() {
        return type;
    }

    public CellAddress getAddress() {
        return address;
    }

    public CellValue getNewValue() {
        return newValue;
    }

    public int getOperationCount() {
        return operationCount;
    }

    public int getCellsRecalculated() {
        return cellsRecalculated;
    }

    @Override
    public String toString() {
        switch (type) {
            case CELL_UPDATE:
                return type.getEventName() + " " + address + "=" + newValue;
            case BATCH_COMPLETE:
                return type.getEventName() + " operations=" + operationCount;
            default:
                return type.getEventName() + " cells=" + cellsRecalculated;
        }
    }
}
