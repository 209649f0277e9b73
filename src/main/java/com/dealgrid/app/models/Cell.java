package com.dealgrid.app.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its address within the sheet
 * - value: the materialized result (literal, or last evaluation of the formula)
 * - formula: source text starting with '=', or null for literal cells
 * - type: display classification
 * - style, sourceAnnotation, link, comment: display-only attributes
 * - history: prior values with timestamps, for audit
 */
public class Cell {
    private final CellAddress address;
    private Object value;
    private String formula;
    private CellType type = CellType.TEXT;
    private Map<String, Object> style = new LinkedHashMap<>();
    private String sourceAnnotation;
    private String link;
    private String comment;
    private final List<CellHistoryEntry> history = new ArrayList<>();

    public Cell(CellAddress address) {
        this.address = address;
    }

    /**
     * Deep copy, used by snapshots and sheet copies.
     */
    public Cell(Cell other) {
        this(other.address, other);
    }

    /**
     * Deep copy placed at a different address.
     */
    public Cell(CellAddress address, Cell other) {
        this.address = address;
        this.value = other.value;
        this.formula = other.formula;
        this.type = other.type;
        this.style = new LinkedHashMap<>(other.style);
        this.sourceAnnotation = other.sourceAnnotation;
        this.link = other.link;
        this.comment = other.comment;
        this.history.addAll(other.history);
    }

    public CellAddress getAddress() {
        return address;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public boolean hasFormula() {
        return formula != null && !formula.isEmpty();
    }

    public CellType getType() {
        return type;
    }

    public void setType(CellType type) {
        this.type = type;
    }

    public Map<String, Object> getStyle() {
        return Collections.unmodifiableMap(style);
    }

    public void setStyle(Map<String, Object> style) {
        this.style = style == null ? new LinkedHashMap<>() : new LinkedHashMap<>(style);
    }

    /**
     * Merges the given attributes on top of the current style.
     */
    public void mergeStyle(Map<String, Object> additions) {
        if (additions != null) {
            style.putAll(additions);
        }
    }

    public String getSourceAnnotation() {
        return sourceAnnotation;
    }

    public void setSourceAnnotation(String sourceAnnotation) {
        this.sourceAnnotation = sourceAnnotation;
    }

    public String getLink() {
        return link;
    }

    public void setLink(String link) {
        this.link = link;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public List<CellHistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    // Drops the oldest entries beyond the limit
    void appendHistory(CellHistoryEntry entry, int limit) {
        history.add(entry);
        while (limit > 0 && history.size() > limit) {
            history.remove(0);
        }
    }

    public boolean isError() {
        return value instanceof CellError;
    }

    /**
     * Same content, ignoring history. Used to compare snapshots.
     */
    public boolean sameContent(Cell other) {
        if (other == null) {
            return false;
        }
        return Objects.equals(value, other.value)
                && Objects.equals(formula, other.formula)
                && type == other.type
                && style.equals(other.style)
                && Objects.equals(sourceAnnotation, other.sourceAnnotation)
                && Objects.equals(link, other.link)
                && Objects.equals(comment, other.comment);
    }
}
