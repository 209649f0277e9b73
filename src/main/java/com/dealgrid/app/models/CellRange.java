package com.dealgrid.app.models;

import com.dealgrid.app.references.AddressCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An inclusive rectangle of addresses. Corners are normalized on construction,
 * so "B3:A1" and "A1:B3" are the same range.
 */
public final class CellRange {

    private final CellAddress start;
    private final CellAddress end;

    public CellRange(CellAddress a, CellAddress b) {
        this.start = new CellAddress(Math.min(a.getColumn(), b.getColumn()), Math.min(a.getRow(), b.getRow()));
        this.end = new CellAddress(Math.max(a.getColumn(), b.getColumn()), Math.max(a.getRow(), b.getRow()));
    }

    public static CellRange of(String text) {
        return AddressCodec.parseRange(text);
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public int getRowCount() {
        return end.getRow() - start.getRow() + 1;
    }

    public int getColumnCount() {
        return end.getColumn() - start.getColumn() + 1;
    }

    public boolean isSingleCell() {
        return start.equals(end);
    }

    public boolean contains(CellAddress address) {
        return address.getColumn() >= start.getColumn() && address.getColumn() <= end.getColumn()
                && address.getRow() >= start.getRow() && address.getRow() <= end.getRow();
    }

    public boolean intersects(CellRange other) {
        return start.getColumn() <= other.end.getColumn() && other.start.getColumn() <= end.getColumn()
                && start.getRow() <= other.end.getRow() && other.start.getRow() <= end.getRow();
    }

    /**
     * Addresses in row-major order.
     */
    public List<CellAddress> addresses() {
        List<CellAddress> result = new ArrayList<>(getRowCount() * getColumnCount());
        for (int row = start.getRow(); row <= end.getRow(); row++) {
            for (int col = start.getColumn(); col <= end.getColumn(); col++) {
                result.add(new CellAddress(col, row));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return isSingleCell() ? start.toString() : start + ":" + end;
    }
}
