package com.dealgrid.app.models.state;

import com.dealgrid.app.models.ConditionalFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializable form of one sheet: metadata plus its populated cells.
 */
public class SheetState {
    private long id;
    private String name;
    private int rowCount;
    private int columnCount;
    private int frozenRows;
    private int frozenColumns;
    private List<Integer> hiddenRows = new ArrayList<>();
    private List<Integer> hiddenColumns = new ArrayList<>();
    private Map<Integer, Integer> rowHeights = new LinkedHashMap<>();
    private Map<Integer, Integer> columnWidths = new LinkedHashMap<>();
    private List<String> mergedRanges = new ArrayList<>();
    private List<ConditionalFormat> conditionalFormats = new ArrayList<>();
    private Map<String, String> namedRanges = new LinkedHashMap<>();
    private List<CellState> cells = new ArrayList<>();

    public SheetState() {
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getRowCount() {
        return rowCount;
    }

    public void setRowCount(int rowCount) {
        this.rowCount = rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public void setColumnCount(int columnCount) {
        this.columnCount = columnCount;
    }

    public int getFrozenRows() {
        return frozenRows;
    }

    public void setFrozenRows(int frozenRows) {
        this.frozenRows = frozenRows;
    }

    public int getFrozenColumns() {
        return frozenColumns;
    }

    public void setFrozenColumns(int frozenColumns) {
        this.frozenColumns = frozenColumns;
    }

    public List<Integer> getHiddenRows() {
        return hiddenRows;
    }

    public void setHiddenRows(List<Integer> hiddenRows) {
        this.hiddenRows = hiddenRows;
    }

    public List<Integer> getHiddenColumns() {
        return hiddenColumns;
    }

    public void setHiddenColumns(List<Integer> hiddenColumns) {
        this.hiddenColumns = hiddenColumns;
    }

    public Map<Integer, Integer> getRowHeights() {
        return rowHeights;
    }

    public void setRowHeights(Map<Integer, Integer> rowHeights) {
        this.rowHeights = rowHeights;
    }

    public Map<Integer, Integer> getColumnWidths() {
        return columnWidths;
    }

    public void setColumnWidths(Map<Integer, Integer> columnWidths) {
        this.columnWidths = columnWidths;
    }

    public List<String> getMergedRanges() {
        return mergedRanges;
    }

    public void setMergedRanges(List<String> mergedRanges) {
        this.mergedRanges = mergedRanges;
    }

    public List<ConditionalFormat> getConditionalFormats() {
        return conditionalFormats;
    }

    public void setConditionalFormats(List<ConditionalFormat> conditionalFormats) {
        this.conditionalFormats = conditionalFormats;
    }

    public Map<String, String> getNamedRanges() {
        return namedRanges;
    }

    public void setNamedRanges(Map<String, String> namedRanges) {
        this.namedRanges = namedRanges;
    }

    public List<CellState> getCells() {
        return cells;
    }

    public void setCells(List<CellState> cells) {
        this.cells = cells;
    }
}
