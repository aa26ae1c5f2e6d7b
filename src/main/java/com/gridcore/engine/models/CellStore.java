package com.gridcore.engine.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sparse map of occupied cells. Empty cells are never stored.
 */
public class CellStore {

    private final Map<CellAddress, Cell> cells = new HashMap<>();

    public Cell get(CellAddress address) {
        return cells.get(address);
    }

    public CellValue getValue(CellAddress address) {
        Cell cell = cells.get(address);
        return cell == null ? CellValue.EMPTY : cell.getValue();
    }

    public void put(Cell cell) {
        cells.put(cell.getAddress(), cell);
    }

    public Cell remove(CellAddress address) {
        return cells.remove(address);
    }

    public boolean contains(CellAddress address) {
        return cells.containsKey(address);
    }

    public int size() {
        return cells.size();
    }

    public void clear() {
        cells.clear();
    }

    public Collection<Cell> cells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    /**
     * Occupied addresses in row-major order.
     */
    public List<CellAddress> sortedAddresses() {
        List<CellAddress> addresses = new ArrayList<>(cells.keySet());
        Collections.sort(addresses);
        return addresses;
    }

    /**
     * Occupied addresses inside 'range', row-major.
     */
    public List<CellAddress> addressesWithin(CellRange range) {
        List<CellAddress> addresses = new ArrayList<>();
        for (CellAddress address : cells.keySet()) {
            if (range.contains(address)) {
                addresses.add(address);
            }
        }
        Collections.sort(addresses);
        return addresses;
    }

    /**
     * Addresses of formula cells in row-major order.
     */
    public List<CellAddress> formulaAddresses() {
        List<CellAddress> addresses = new ArrayList<>();
        for (Cell cell : cells.values()) {
            if (cell.hasFormula()) {
                addresses.add(cell.getAddress());
            }
        }
        Collections.sort(addresses);
        return addresses;
    }

    /**
     * Replaces the whole content, e.g. after rows or columns moved.
     */
    public void replaceAll(Collection<Cell> newCells) {
        cells.clear();
        for (Cell cell : newCells) {
            cells.put(cell.getAddress(), cell);
        }
    }
}
