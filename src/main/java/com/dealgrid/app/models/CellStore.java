package com.dealgrid.app.models;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Sparse grid of one sheet. Cells exist only for addresses that have been written.
 * Iteration is row-major.
 */
public class CellStore {

    private final NavigableMap<CellAddress, Cell> cells = new TreeMap<>();
    private final Clock clock;
    private final int historyLimit;

    public CellStore(Clock clock, int historyLimit) {
        this.clock = clock;
        this.historyLimit = historyLimit;
    }

    /**
     * Writes a literal (formula == null) or a formula. A literal clears any previous formula.
     * The prior value is appended to the cell's history.
     */
    public Cell write(CellAddress address, Object value, String formula) {
        Cell cell = cells.computeIfAbsent(address, Cell::new);
        cell.appendHistory(new CellHistoryEntry(cell.getValue(), clock.instant()), historyLimit);
        cell.setFormula(formula);
        if (formula != null) {
            cell.setType(CellType.FORMULA);
        } else {
            Object normalized = CellValues.normalize(value);
            cell.setValue(normalized);
            cell.setType(CellValues.inferType(normalized));
        }
        return cell;
    }

    /**
     * Stores an evaluation result without touching history or formula.
     */
    public void materialize(CellAddress address, Object value) {
        Cell cell = cells.get(address);
        if (cell != null) {
            cell.setValue(value);
        }
    }

    public Cell read(CellAddress address) {
        return cells.get(address);
    }

    public Object readValue(CellAddress address) {
        Cell cell = cells.get(address);
        return cell == null ? null : cell.getValue();
    }

    /**
     * Returns the cell at the address, creating an empty one if needed.
     */
    public Cell getOrCreate(CellAddress address) {
        return cells.computeIfAbsent(address, Cell::new);
    }

    public void remove(CellAddress address) {
        cells.remove(address);
    }

    public int clearRange(CellRange range) {
        int removed = 0;
        for (CellAddress address : new ArrayList<>(cells.keySet())) {
            if (range.contains(address)) {
                cells.remove(address);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Writes a row-major matrix starting at the range's top-left corner,
     * clipped to the range. Text starting with '=' is stored as a formula.
     * Returns the addresses written.
     */
    public List<CellAddress> writeRange(CellRange range, List<List<Object>> matrix) {
        List<CellAddress> written = new ArrayList<>();
        CellAddress start = range.getStart();
        for (int r = 0; r < matrix.size() && r < range.getRowCount(); r++) {
            List<Object> row = matrix.get(r);
            if (row == null) {
                continue;
            }
            for (int c = 0; c < row.size() && c < range.getColumnCount(); c++) {
                CellAddress target = start.offset(c, r);
                Object value = row.get(c);
                if (value instanceof String && ((String) value).startsWith("=")) {
                    write(target, null, (String) value);
                } else {
                    write(target, value, null);
                }
                written.add(target);
            }
        }
        return written;
    }

    /**
     * Copies cells of the source range so that its top-left lands on the destination.
     * Formula text is copied unchanged. Returns the destination addresses.
     */
    public List<CellAddress> copyRange(CellRange source, CellAddress destination) {
        int dc = destination.getColumn() - source.getStart().getColumn();
        int dr = destination.getRow() - source.getStart().getRow();
        List<Cell> originals = new ArrayList<>();
        for (Cell cell : cells.values()) {
            if (source.contains(cell.getAddress())) {
                originals.add(new Cell(cell));
            }
        }
        List<CellAddress> targets = new ArrayList<>();
        for (Cell original : originals) {
            CellAddress target = original.getAddress().offset(dc, dr);
            Cell copy = write(target, original.getValue(), original.getFormula());
            copy.setValue(original.getValue());
            copy.setType(original.getType());
            copy.setStyle(original.getStyle());
            copy.setSourceAnnotation(original.getSourceAnnotation());
            copy.setLink(original.getLink());
            copy.setComment(original.getComment());
            targets.add(target);
        }
        return targets;
    }

    /**
     * Addresses whose formula text or display text contains the query, ignoring case.
     */
    public List<CellAddress> find(String query) {
        List<CellAddress> result = new ArrayList<>();
        if (query == null || query.isEmpty()) {
            return result;
        }
        String needle = query.toLowerCase(Locale.ROOT);
        for (Cell cell : cells.values()) {
            String display = CellValues.display(cell.getValue()).toLowerCase(Locale.ROOT);
            String formula = cell.hasFormula() ? cell.getFormula().toLowerCase(Locale.ROOT) : "";
            if (display.contains(needle) || formula.contains(needle)) {
                result.add(cell.getAddress());
            }
        }
        return result;
    }

    public List<Cell> formulaCells() {
        List<Cell> result = new ArrayList<>();
        for (Cell cell : cells.values()) {
            if (cell.hasFormula()) {
                result.add(cell);
            }
        }
        return result;
    }

    public Collection<Cell> cells() {
        return cells.values();
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * Deep copy of the cell map.
     */
    public NavigableMap<CellAddress, Cell> snapshot() {
        NavigableMap<CellAddress, Cell> copy = new TreeMap<>();
        for (Map.Entry<CellAddress, Cell> entry : cells.entrySet()) {
            copy.put(entry.getKey(), new Cell(entry.getValue()));
        }
        return copy;
    }

    /**
     * Replaces all cells with deep copies of the given map.
     */
    public void restore(Map<CellAddress, Cell> state) {
        cells.clear();
        for (Map.Entry<CellAddress, Cell> entry : state.entrySet()) {
            cells.put(entry.getKey(), new Cell(entry.getValue()));
        }
    }

    public Clock getClock() {
        return clock;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }
}
