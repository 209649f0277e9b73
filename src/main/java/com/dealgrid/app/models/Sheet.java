package com.dealgrid.app.models;

import java.util.*;

/**
 * Represents one named grid inside a workbook:
 * - A unique ID (within the workbook) and a display name
 * - A sparse CellStore holding the cells
 * - Grid metadata: dimensions, frozen panes, hidden rows/columns, size overrides, merges
 * - Conditional format rules, in declaration order
 * - Named ranges (upper-case name -> range text)
 * - The style overlay computed from the conditional formats
 */
public class Sheet {

    private final long id;
    private String name;
    private final CellStore cells;

    private int rowCount;
    private int columnCount;
    private int frozenRows;
    private int frozenColumns;
    private final Set<Integer> hiddenRows = new TreeSet<>();
    private final Set<Integer> hiddenColumns = new TreeSet<>();
    private final Map<Integer, Integer> rowHeights = new TreeMap<>();
    private final Map<Integer, Integer> columnWidths = new TreeMap<>();
    private final List<CellRange> mergedRanges = new ArrayList<>();
    private final List<ConditionalFormat> conditionalFormats = new ArrayList<>();
    private final Map<String, String> namedRanges = new LinkedHashMap<>();

    // Recomputed after every mutation, never edited directly
    private Map<CellAddress, Map<String, Object>> formatOverlay = new HashMap<>();

    public Sheet(long id, String name, CellStore cells, int rowCount, int columnCount) {
        this.id = id;
        this.name = name;
        this.cells = cells;
        this.rowCount = rowCount;
        this.columnCount = columnCount;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public CellStore getCells() {
        return cells;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public void setDimensions(int rowCount, int columnCount) {
        if (rowCount < 1 || columnCount < 1) {
            throw new IllegalArgumentException("Dimensions must be positive: " + rowCount + "x" + columnCount);
        }
        this.rowCount = rowCount;
        this.columnCount = columnCount;
    }

    /**
     * Grows the dimensions so the address is inside the grid.
     */
    public void ensureContains(CellAddress address) {
        rowCount = Math.max(rowCount, address.getRow());
        columnCount = Math.max(columnCount, address.getColumn());
    }

    public int getFrozenRows() {
        return frozenRows;
    }

    public int getFrozenColumns() {
        return frozenColumns;
    }

    public void setFrozen(int rows, int columns) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Frozen counts cannot be negative");
        }
        this.frozenRows = rows;
        this.frozenColumns = columns;
    }

    public Set<Integer> getHiddenRows() {
        return hiddenRows;
    }

    public Set<Integer> getHiddenColumns() {
        return hiddenColumns;
    }

    public Map<Integer, Integer> getRowHeights() {
        return rowHeights;
    }

    public Map<Integer, Integer> getColumnWidths() {
        return columnWidths;
    }

    public List<CellRange> getMergedRanges() {
        return mergedRanges;
    }

    public List<ConditionalFormat> getConditionalFormats() {
        return conditionalFormats;
    }

    public Map<String, String> getNamedRanges() {
        return namedRanges;
    }

    public String getNamedRange(String name) {
        return name == null ? null : namedRanges.get(name.toUpperCase(Locale.ROOT));
    }

    public Map<CellAddress, Map<String, Object>> getFormatOverlay() {
        return formatOverlay;
    }

    public void setFormatOverlay(Map<CellAddress, Map<String, Object>> formatOverlay) {
        this.formatOverlay = formatOverlay;
    }

    /**
     * Deep copy of cells and metadata under a new id and name.
     */
    public Sheet copy(long newId, String newName) {
        CellStore store = new CellStore(cells.getClock(), cells.getHistoryLimit());
        store.restore(cells.snapshot());
        Sheet copy = new Sheet(newId, newName, store, rowCount, columnCount);
        copy.frozenRows = frozenRows;
        copy.frozenColumns = frozenColumns;
        copy.hiddenRows.addAll(hiddenRows);
        copy.hiddenColumns.addAll(hiddenColumns);
        copy.rowHeights.putAll(rowHeights);
        copy.columnWidths.putAll(columnWidths);
        copy.mergedRanges.addAll(mergedRanges);
        for (ConditionalFormat format : conditionalFormats) {
            copy.conditionalFormats.add(new ConditionalFormat(format.getId(), format.getRange(),
                    format.getCondition(), format.getValue(), format.getValue2(), format.getStyle()));
        }
        copy.namedRanges.putAll(namedRanges);
        Map<CellAddress, Map<String, Object>> overlay = new HashMap<>();
        for (Map.Entry<CellAddress, Map<String, Object>> entry : formatOverlay.entrySet()) {
            overlay.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
        }
        copy.formatOverlay = overlay;
        return copy;
    }
}
