package com.gridcore.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gridcore.engine.exceptions.InvalidAddressException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable zero-based cell coordinate.
 * The text form is A1 notation: bijective base-26 column letters followed by a one-based row,
 * so {@code (col=0,row=0)} is "A1" and {@code (col=27,row=9)} is "AB10".
 * Addresses order row-major (row first, then column).
 */
public final class CellAddress implements Comparable<CellAddress> {

    public static final int MAX_COLUMNS = 16384;
    public static final int MAX_ROWS = 1048576;

    private static final Pattern A1_PATTERN = Pattern.compile("^([A-Za-z]+)([0-9]+)$");

    private final int col;
    private final int row;

    private CellAddress(int col, int row) {
        this.col = col;
        this.row = row;
    }

    /**
     * Creates an address from zero-based coordinates.
     * Throws InvalidAddressException for negative values.
     */
    public static CellAddress of(int col, int row) {
        if (col < 0 || row < 0) {
            throw new InvalidAddressException("Coordinates must be non-negative: col=" + col + ", row=" + row);
        }
        return new CellAddress(col, row);
    }

    /**
     * Parses A1 notation, case-insensitively.
     * Rejects empty input, digits before letters, trailing characters, row 0
     * and anything beyond the sheet limits.
     */
    public static CellAddress fromString(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidAddressException("Address must not be empty");
        }
        Matcher matcher = A1_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidAddressException("Invalid cell address: " + text);
        }
        String letters = matcher.group(1);
        String digits = matcher.group(2);
        if (letters.length() > 3 || digits.length() > 7) {
            throw new InvalidAddressException("Cell address out of bounds: " + text);
        }
        int col = labelToColumn(letters);
        int row = Integer.parseInt(digits) - 1;
        if (row < 0) {
            throw new InvalidAddressException("Row numbers start at 1: " + text);
        }
        if (col >= MAX_COLUMNS || row >= MAX_ROWS) {
            throw new InvalidAddressException("Cell address out of bounds: " + text);
        }
        return new CellAddress(col, row);
    }

    /**
     * Converts column letters to a zero-based index ("A" is 0, "Z" is 25, "AA" is 26).
     */
    public static int labelToColumn(String label) {
        if (label == null || label.isEmpty()) {
            throw new InvalidAddressException("Column label must not be empty");
        }
        int result = 0;
        for (int i = 0; i < label.length(); i++) {
            char c = Character.toUpperCase(label.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new InvalidAddressException("Invalid column label: " + label);
            }
            result = result * 26 + (c - 'A' + 1);
            if (result > MAX_COLUMNS) {
                throw new InvalidAddressException("Column out of bounds: " + label);
            }
        }
        return result - 1;
    }

    /**
     * Converts a zero-based column index to letters (0 is "A", 26 is "AA").
     */
    public static String columnToLabel(int col) {
        if (col < 0) {
            throw new InvalidAddressException("Column index must be non-negative: " + col);
        }
        StringBuilder sb = new StringBuilder();
        int n = col + 1;
        while (n > 0) {
            n--;
            sb.insert(0, (char) ('A' + n % 26));
            n /= 26;
        }
        return sb.toString();
    }

    /**
     * Returns the address shifted by the given deltas; fails if the result is negative.
     */
    public CellAddress offset(int deltaRow, int deltaCol) {
        int newRow = row + deltaRow;
        int newCol = col + deltaCol;
        if (newRow < 0 || newCol < 0) {
            throw new InvalidAddressException("Offset moves " + this + " off the sheet");
        }
        return new CellAddress(newCol, newRow);
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return col == that.col && row == that.row;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @JsonValue
    @Override
    public String toString() {
        return columnToLabel(col) + (row + 1);
    }
}
