package com.dealgrid.app.models;

import com.dealgrid.app.references.AddressCodec;

import java.util.Objects;

/**
 * A (column, row) coordinate inside one sheet. Both are 1-based.
 * Ordering is row-major, which is also the iteration order of ranges.
 */
public final class CellAddress implements Comparable<CellAddress> {

    private final int column;
    private final int row;

    public CellAddress(int column, int row) {
        this.column = column;
        this.row = row;
    }

    public static CellAddress of(String text) {
        return AddressCodec.parseAddress(text);
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public CellAddress offset(int columns, int rows) {
        return new CellAddress(column + columns, row + rows);
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
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
        return column == that.column && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }

    @Override
    public String toString() {
        return AddressCodec.format(column, row);
    }
}
