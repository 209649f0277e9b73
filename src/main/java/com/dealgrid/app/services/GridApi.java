package com.dealgrid.app.services;

import com.dealgrid.app.models.WriteOptions;
import com.dealgrid.app.models.state.WorkbookState;

import java.util.List;
import java.util.Map;

/**
 * Headless read/write contract of a workbook, used by automation clients.
 *
 * Addresses may be sheet-qualified ("Sheet2!B4", "'Deal Terms'!C2"); unqualified
 * addresses target the active sheet. Every write returns only after the affected
 * formulas have been recalculated.
 */
public interface GridApi {

    /**
     * Writes a literal. Text starting with '=' is treated as a formula.
     */
    void write(String address, Object value, WriteOptions options);

    void setFormula(String address, String formula);

    /**
     * Merges the given attributes into the cell's style.
     */
    void styleCell(String address, Map<String, Object> style);

    void clearRange(String start, String end);

    void writeRange(String start, String end, List<List<Object>> matrix);

    /**
     * Materialized value: Double, String, Boolean, a CellError or null for blank.
     */
    Object readValue(String address);

    WorkbookState exportState();

    void importState(WorkbookState state);
}
