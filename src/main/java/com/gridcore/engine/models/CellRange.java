package com.gridcore.engine.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable rectangle of cells, inclusive on both corners.
 */
public final class CellRange {

    private final int minCol;
    private final int minRow;
    private final int maxCol;
    private final int maxRow;

    private CellRange(int minCol, int minRow, int maxCol, int maxRow) {
        this.minCol = minCol;
        this.minRow = minRow;
        this.maxCol = maxCol;
        this.maxRow = maxRow;
    }

    /**
     * The rectangle spanned by two corners, in any order.
     */
    public static CellRange of(CellAddress a, CellAddress b) {
        return new CellRange(Math.min(a.getCol(), b.getCol()), Math.min(a.getRow(), b.getRow()),
                Math.max(a.getCol(), b.getCol()), Math.max(a.getRow(), b.getRow()));
    }

    public int getMinCol() {
        return minCol;
    }

    public int getMinRow() {
        return minRow;
    }

    public int getMaxCol() {
        return maxCol;
    }

    public int getMaxRow() {
        return maxRow;
    }

    public boolean contains(CellAddress address) {
        return address.getCol() >= minCol && address.getCol() <= maxCol
                && address.getRow() >= minRow && address.getRow() <= maxRow;
    }

    public long size() {
        return (long) (maxRow - minRow + 1) * (maxCol - minCol + 1);
    }

    /**
     * Every address of the rectangle, row-major. Only meant for small ranges.
     */
    public List<CellAddress> addresses() {
        List<CellAddress> result = new ArrayList<>((int) Math.min(size(), 1024));
        for (int row = minRow; row <= maxRow; row++) {
            for (int col = minCol; col <= maxCol; col++) {
                result.add(CellAddress.of(col, row));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return minCol == that.minCol && minRow == that.minRow && maxCol == that.maxCol && maxRow == that.maxRow;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minCol, minRow, maxCol, maxRow);
    }

    @Override
    public String toString() {
        return CellAddress.of(minCol, minRow) + ":" + CellAddress.of(maxCol, maxRow);
    }
}
