package com.gridcore.engine.services;

import com.gridcore.engine.models.CellAddress;

/**
 * One buffered change inside a batch.
 */
public final class Mutation {

    public enum Kind {
        SET_CELL,
        DELETE_CELL,
        INSERT_ROWS,
        DELETE_ROWS,
        INSERT_COLUMNS,
        DELETE_COLUMNS
    }

    private final Kind kind;
    private final CellAddress address;
    private final String rawValue;
    private final int index;
    private final int count;

    private Mutation(Kind kind, CellAddress address, String rawValue, int index, int count) {
        this.kind = kind;
        this.address = address;
        this.rawValue = rawValue;
        this.index = index;
        this.count = count;
    }

    public static Mutation setCell(CellAddress address, String rawValue) {
        return new Mutation(Kind.SET_CELL, address, rawValue, 0, 0);
    }

    public static Mutation deleteCell(CellAddress address) {
        return new Mutation(Kind.DELETE_CELL, address, null, 0, 0);
    }

    public static Mutation structural(Kind kind, int index, int count) {
        if (kind == Kind.SET_CELL || kind == Kind.DELETE_CELL) {
            throw new IllegalArgumentException("Not a structural mutation: " + kind);
        }
        return new Mutation(kind, null, null, index, count);
    }

    public Kind getKind() {
        return kind;
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getRawValue() {
        return rawValue;
    }

    public int getIndex() {
        return index;
    }

    public int getCount() {
        return count;
    }

    public boolean isStructural() {
        return address == null;
    }

    @Override
    public String toString() {
        return isStructural() ? kind + "(" + index + ", " + count + ")" : kind + "(" + address + ")";
    }
}
