package com.gridcore.engine.bulk;

import com.gridcore.engine.models.CellAddress;

/**
 * One proposed edit: the raw value before (null when empty) and after.
 */
public final class CellChange {

    private final CellAddress address;
    private final String before;
    private final String after;

    public CellChange(CellAddress address, String before, String after) {
        this.address = address;
        this.before = before;
        this.after = after;
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getBefore() {
        return before;
    }

    public String getAfter() {
        return after;
    }

    @Override
    public String toString() {
        return address + ": " + before + " -> " + after;
    }
}
