package com.gridcore.engine.services;

import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellSnapshot;

import java.util.Collections;
import java.util.Map;

/**
 * Everything needed to revert or reapply one user-level action.
 * A null snapshot means the cell did not exist. Full-sheet units hold every
 * occupied cell and replace the sheet wholesale on restore.
 */
public final class UndoUnit {

    private final String description;
    private final Map<CellAddress, CellSnapshot> before;
    private final Map<CellAddress, CellSnapshot> after;
    private final boolean fullSheet;

    public UndoUnit(String description, Map<CellAddress, CellSnapshot> before,
                    Map<CellAddress, CellSnapshot> after, boolean fullSheet) {
        this.description = description;
        this.before = Collections.unmodifiableMap(before);
        this.after = Collections.unmodifiableMap(after);
        this.fullSheet = fullSheet;
    }

    public String getDescription() {
        return description;
    }

    public Map<CellAddress, CellSnapshot> getBefore() {
        return before;
    }

    public Map<CellAddress, CellSnapshot> getAfter() {
        return after;
    }

    public boolean isFullSheet() {
        return fullSheet;
    }

    /**
     * Number of addresses touched by the action.
     */
    public int size() {
        return fullSheet ? Math.max(before.size(), after.size()) : before.size();
    }

    @Override
    public String toString() {
        return "UndoUnit(" + description + ", " + size() + " cells" + (fullSheet ? ", full sheet" : "") + ")";
    }
}
