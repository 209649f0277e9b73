package com.dealgrid.app.services;

import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.Sheet;

import java.util.Objects;

/**
 * Identifies a cell across the workbook. Equality uses the sheet id, so a key stays
 * valid when the sheet is renamed.
 */
final class CellKey {
    private final Sheet sheet;
    private final CellAddress address;

    CellKey(Sheet sheet, CellAddress address) {
        this.sheet = sheet;
        this.address = address;
    }

    Sheet getSheet() {
        return sheet;
    }

    CellAddress getAddress() {
        return address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellKey)) {
            return false;
        }
        CellKey other = (CellKey) o;
        return sheet.getId() == other.sheet.getId() && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet.getId(), address);
    }

    @Override
    public String toString() {
        return sheet.getName() + "!" + address;
    }
}
