package com.gridcore.engine.models;

import com.gridcore.engine.exceptions.InvalidAddressException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The set of cells a bulk operation works on.
 *
 * Cell and range selections are bounded rectangles and are walked lazily, row-major,
 * empty cells included. Row, column and whole-sheet selections are unbounded and
 * only visit occupied cells.
 */
public final class Selection {

    public enum Kind {
        CELL,
        RANGE,
        ROWS,
        COLUMNS,
        ALL
    }

    private static final Pattern ROWS_PATTERN = Pattern.compile("^(\\d+)(?::(\\d+))?$");
    private static final Pattern COLUMNS_PATTERN = Pattern.compile("^([A-Za-z]+)(?::([A-Za-z]+))?$");

    private final Kind kind;
    private final int minRow;
    private final int maxRow;
    private final int minCol;
    private final int maxCol;

    private Selection(Kind kind, int minRow, int maxRow, int minCol, int maxCol) {
        this.kind = kind;
        this.minRow = minRow;
        this.maxRow = maxRow;
        this.minCol = minCol;
        this.maxCol = maxCol;
    }

    public static Selection cell(CellAddress address) {
        return new Selection(Kind.CELL, address.getRow(), address.getRow(), address.getCol(), address.getCol());
    }

    public static Selection range(CellAddress a, CellAddress b) {
        return new Selection(Kind.RANGE,
                Math.min(a.getRow(), b.getRow()), Math.max(a.getRow(), b.getRow()),
                Math.min(a.getCol(), b.getCol()), Math.max(a.getCol(), b.getCol()));
    }

    /**
     * Zero-based, inclusive row span.
     */
    public static Selection rows(int first, int last) {
        if (first < 0 || last < 0) {
            throw new InvalidAddressException("Row indexes must be non-negative");
        }
        return new Selection(Kind.ROWS, Math.min(first, last), Math.max(first, last), 0, CellAddress.MAX_COLUMNS - 1);
    }

    /**
     * Zero-based, inclusive column span.
     */
    public static Selection columns(int first, int last) {
        if (first < 0 || last < 0) {
            throw new InvalidAddressException("Column indexes must be non-negative");
        }
        return new Selection(Kind.COLUMNS, 0, CellAddress.MAX_ROWS - 1, Math.min(first, last), Math.max(first, last));
    }

    public static Selection all() {
        return new Selection(Kind.ALL, 0, CellAddress.MAX_ROWS - 1, 0, CellAddress.MAX_COLUMNS - 1);
    }

    /**
     * Parses "B2", "A1:C10", "3:5" (rows), "B:D" (columns) or "*" (whole sheet).
     */
    public static Selection parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidAddressException("Selection must not be empty");
        }
        String s = text.trim();
        if (s.equals("*")) {
            return all();
        }
        Matcher rows = ROWS_PATTERN.matcher(s);
        if (rows.matches()) {
            int first = Integer.parseInt(rows.group(1)) - 1;
            int last = rows.group(2) == null ? first : Integer.parseInt(rows.group(2)) - 1;
            if (first < 0 || last < 0) {
                throw new InvalidAddressException("Row numbers start at 1: " + text);
            }
            return rows(first, last);
        }
        Matcher cols = COLUMNS_PATTERN.matcher(s);
        if (cols.matches()) {
            int first = CellAddress.labelToColumn(cols.group(1));
            int last = cols.group(2) == null ? first : CellAddress.labelToColumn(cols.group(2));
            return columns(first, last);
        }
        int colon = s.indexOf(':');
        if (colon < 0) {
            return cell(CellAddress.fromString(s));
        }
        return range(CellAddress.fromString(s.substring(0, colon)), CellAddress.fromString(s.substring(colon + 1)));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isBounded() {
        return kind == Kind.CELL || kind == Kind.RANGE;
    }

    public int getMinRow() {
        return minRow;
    }

    public int getMaxRow() {
        return maxRow;
    }

    public int getMinCol() {
        return minCol;
    }

    public int getMaxCol() {
        return maxCol;
    }

    public boolean contains(CellAddress address) {
        return address.getRow() >= minRow && address.getRow() <= maxRow
                && address.getCol() >= minCol && address.getCol() <= maxCol;
    }

    /**
     * Number of cells the selection visits given the occupied addresses.
     */
    public long size(Collection<CellAddress> occupied) {
        if (isBounded()) {
            return (long) (maxRow - minRow + 1) * (maxCol - minCol + 1);
        }
        return occupied.stream().filter(this::contains).count();
    }

    /**
     * Addresses visited by the selection, row-major.
     * The occupied addresses are only consulted for unbounded kinds and must be sorted.
     */
    public Iterable<CellAddress> addresses(Collection<CellAddress> occupied) {
        if (!isBounded()) {
            List<CellAddress> inside = new ArrayList<>();
            for (CellAddress address : occupied) {
                if (contains(address)) {
                    inside.add(address);
                }
            }
            return inside;
        }
        return () -> new Iterator<CellAddress>() {
            private int row = minRow;
            private int col = minCol;

            @Override
            public boolean hasNext() {
                return row <= maxRow;
            }

            @Override
            public CellAddress next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CellAddress address = CellAddress.of(col, row);
                if (++col > maxCol) {
                    col = minCol;
                    row++;
                }
                return address;
            }
        };
    }

    @Override
    public String toString() {
        switch (kind) {
            case CELL:
                return CellAddress.of(minCol, minRow).toString();
            case RANGE:
                return CellAddress.of(minCol, minRow) + ":" + CellAddress.of(maxCol, maxRow);
            case ROWS:
                return (minRow + 1) + ":" + (maxRow + 1);
            case COLUMNS:
                return CellAddress.columnToLabel(minCol) + ":" + CellAddress.columnToLabel(maxCol);
            default:
                return "*";
        }
    }
}
