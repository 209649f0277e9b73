package com.dealgrid.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Grid defaults, bound from {@code dealgrid.grid.*}.
 */
@ConfigurationProperties(prefix = "dealgrid.grid")
public class GridProperties {

    private int defaultRows = 100;
    private int defaultColumns = 26;
    private int undoHistoryLimit = 100;
    private int cellHistoryLimit = 50;
    private String defaultSheetName = "Sheet";

    public int getDefaultRows() {
        return defaultRows;
    }

    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultColumns() {
        return defaultColumns;
    }

    public void setDefaultColumns(int defaultColumns) {
        this.defaultColumns = defaultColumns;
    }

    public int getUndoHistoryLimit() {
        return undoHistoryLimit;
    }

    public void setUndoHistoryLimit(int undoHistoryLimit) {
        this.undoHistoryLimit = undoHistoryLimit;
    }

    public int getCellHistoryLimit() {
        return cellHistoryLimit;
    }

    public void setCellHistoryLimit(int cellHistoryLimit) {
        this.cellHistoryLimit = cellHistoryLimit;
    }

    public String getDefaultSheetName() {
        return defaultSheetName;
    }

    public void setDefaultSheetName(String defaultSheetName) {
        this.defaultSheetName = defaultSheetName;
    }
}
