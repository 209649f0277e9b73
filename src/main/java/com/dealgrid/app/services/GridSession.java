package com.dealgrid.app.services;

import com.dealgrid.app.config.GridProperties;
import com.dealgrid.app.exceptions.InvalidAddressException;
import com.dealgrid.app.formula.FormulaEvaluator;
import com.dealgrid.app.formula.FormulaNode;
import com.dealgrid.app.formula.FormulaParseException;
import com.dealgrid.app.models.Cell;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.CellHistoryEntry;
import com.dealgrid.app.models.CellRange;
import com.dealgrid.app.models.CellStore;
import com.dealgrid.app.models.CellType;
import com.dealgrid.app.models.CellValues;
import com.dealgrid.app.models.ConditionalFormat;
import com.dealgrid.app.models.Sheet;
import com.dealgrid.app.models.Workbook;
import com.dealgrid.app.models.WriteOptions;
import com.dealgrid.app.models.state.CellState;
import com.dealgrid.app.models.state.SheetState;
import com.dealgrid.app.models.state.WorkbookState;
import com.dealgrid.app.references.AddressCodec;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * The single mutation entry point of one workbook.
 *
 * Every cell mutation runs the same pipeline before returning:
 * 1) write into the sheet's CellStore
 * 2) recalculate the written formulas and their dependents
 * 3) refresh the conditional-format overlays
 * 4) commit an undo snapshot
 *
 * Sheet and metadata operations recalculate and refresh the overlays but do not commit
 * a snapshot. A session holds no locks; callers serialize access (see WorkbookService).
 */
public class GridSession implements GridApi {

    private static final Logger log = LoggerFactory.getLogger(GridSession.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private final Workbook workbook;
    private final GridProperties properties;
    private final FormulaEvaluator evaluator;
    private final MultiSheetManager sheets;
    private final RecalculationController recalculation;
    private final ConditionalFormatEngine formats = new ConditionalFormatEngine();
    private final UndoRedoManager<WorkbookSnapshot> history;
    private long formatCounter;

    public GridSession(GridProperties properties, FormulaEvaluator evaluator, Clock clock) {
        this.workbook = new Workbook();
        this.properties = properties;
        this.evaluator = evaluator;
        this.sheets = new MultiSheetManager(workbook, properties, clock);
        this.recalculation = new RecalculationController(sheets, evaluator, clock);
        sheets.createSheet(null);
        this.history = new UndoRedoManager<>(WorkbookSnapshot.capture(workbook), properties.getUndoHistoryLimit());
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public Sheet getActiveSheet() {
        return sheets.getActiveSheet();
    }

    public List<Sheet> getSheets() {
        return sheets.getSheets();
    }

    // ----------------------------------------------------------------
    // GridApi
    // ----------------------------------------------------------------

    @Override
    public void write(String address, Object value, WriteOptions options) {
        Target target = target(address);
        Cell cell;
        if (value instanceof String && ((String) value).startsWith("=")) {
            cell = writeCell(target, null, (String) value);
        } else {
            cell = writeCell(target, literal(value), null);
        }
        applyOptions(cell, options);
        afterCellMutation(target.sheet, Collections.singletonList(target.address));
    }

    @Override
    public void setFormula(String address, String formula) {
        if (StringUtils.isBlank(formula)) {
            throw new IllegalArgumentException("Formula cannot be blank");
        }
        Target target = target(address);
        String text = formula.trim();
        writeCell(target, null, text.startsWith("=") ? text : "=" + text);
        afterCellMutation(target.sheet, Collections.singletonList(target.address));
    }

    @Override
    public void styleCell(String address, Map<String, Object> style) {
        Target target = target(address);
        target.sheet.ensureContains(target.address);
        target.sheet.getCells().getOrCreate(target.address).mergeStyle(style);
        commitCellChange();
    }

    @Override
    public void clearRange(String start, String end) {
        RangeTarget target = rangeTarget(start, end);
        CellStore store = target.sheet.getCells();
        List<CellAddress> cleared = new ArrayList<>();
        for (Cell cell : store.cells()) {
            if (target.range.contains(cell.getAddress())) {
                cleared.add(cell.getAddress());
            }
        }
        if (cleared.isEmpty()) {
            return;
        }
        store.clearRange(target.range);
        afterCellMutation(target.sheet, cleared);
    }

    @Override
    public void writeRange(String start, String end, List<List<Object>> matrix) {
        RangeTarget target = rangeTarget(start, end);
        if (matrix == null) {
            throw new IllegalArgumentException("Matrix cannot be null");
        }
        // Reject bad values before anything is written
        List<List<Object>> checked = new ArrayList<>();
        for (List<Object> row : matrix) {
            List<Object> values = new ArrayList<>();
            if (row != null) {
                for (Object value : row) {
                    values.add(value instanceof String && ((String) value).startsWith("=") ? value : literal(value));
                }
            }
            checked.add(values);
        }
        List<CellAddress> written = target.sheet.getCells().writeRange(target.range, checked);
        for (CellAddress address : written) {
            target.sheet.ensureContains(address);
        }
        afterCellMutation(target.sheet, written);
    }

    @Override
    public Object readValue(String address) {
        Target target = target(address);
        return target.sheet.getCells().readValue(target.address);
    }

    @Override
    public WorkbookState exportState() {
        WorkbookState state = new WorkbookState();
        state.setActiveSheetId(workbook.getActiveSheetId());
        List<SheetState> sheetStates = new ArrayList<>();
        for (Sheet sheet : sheets.getSheets()) {
            sheetStates.add(toState(sheet));
        }
        state.setSheets(sheetStates);
        return state;
    }

    /**
     * Replaces every sheet with the given state. The state is validated completely before
     * the workbook changes. Formulas are recalculated afterwards.
     */
    @Override
    public void importState(WorkbookState state) {
        if (state == null || state.getSheets() == null || state.getSheets().isEmpty()) {
            throw new IllegalArgumentException("A workbook needs at least one sheet");
        }
        long maxId = 0;
        for (SheetState sheetState : state.getSheets()) {
            maxId = Math.max(maxId, sheetState.getId());
        }
        Set<Long> usedIds = new HashSet<>();
        Set<String> usedNames = new HashSet<>();
        List<Sheet> imported = new ArrayList<>();
        for (SheetState sheetState : state.getSheets()) {
            long id = sheetState.getId();
            if (id <= 0 || !usedIds.add(id)) {
                id = ++maxId;
                usedIds.add(id);
            }
            Sheet sheet = fromState(sheetState, id);
            if (!usedNames.add(sheet.getName().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate sheet name: " + sheet.getName());
            }
            imported.add(sheet);
        }

        workbook.clearSheets();
        for (Sheet sheet : imported) {
            workbook.addSheet(sheet);
        }
        workbook.reserveSheetIds(maxId);
        long active = workbook.findById(state.getActiveSheetId()) != null
                ? state.getActiveSheetId() : imported.get(0).getId();
        workbook.setActiveSheetId(active);

        recalculation.recalculateAll();
        refreshOverlays();
        history.commit(WorkbookSnapshot.capture(workbook));
        log.info("Imported {} sheet(s) into workbook {}", imported.size(), workbook.getId());
    }

    // ----------------------------------------------------------------
    // Cell extras
    // ----------------------------------------------------------------

    /**
     * UI-style input: text starting with '=' is a formula, blank text clears the cell,
     * anything else is read as a literal (number, boolean, error sentinel or text).
     */
    public void enter(String address, String text) {
        if (text != null && text.trim().startsWith("=")) {
            setFormula(address, text);
            return;
        }
        Object literal = CellValues.parseLiteral(text);
        if (literal == null) {
            clearRange(address, address);
            return;
        }
        write(address, literal, WriteOptions.none());
    }

    public void formatCell(String address, CellType type) {
        if (type == null) {
            throw new IllegalArgumentException("Cell type cannot be null");
        }
        Target target = target(address);
        target.sheet.ensureContains(target.address);
        target.sheet.getCells().getOrCreate(target.address).setType(type);
        commitCellChange();
    }

    /**
     * Writes display text that links to the url.
     */
    public void link(String address, String text, String url) {
        if (StringUtils.isBlank(url)) {
            throw new IllegalArgumentException("Link url cannot be blank");
        }
        Target target = target(address);
        Cell cell = writeCell(target, literal(text), null);
        cell.setLink(url);
        cell.setType(CellType.LINK);
        afterCellMutation(target.sheet, Collections.singletonList(target.address));
    }

    public void comment(String address, String comment) {
        Target target = target(address);
        target.sheet.ensureContains(target.address);
        target.sheet.getCells().getOrCreate(target.address).setComment(comment);
        commitCellChange();
    }

    public String readDisplay(String address) {
        return CellValues.display(readValue(address));
    }

    /**
     * Copy of the cell, or null when the address is empty.
     */
    public Cell readCell(String address) {
        Target target = target(address);
        Cell cell = target.sheet.getCells().read(target.address);
        return cell == null ? null : new Cell(cell);
    }

    public Map<String, Object> effectiveStyle(String address) {
        Target target = target(address);
        return ConditionalFormatEngine.effectiveStyle(target.sheet, target.address);
    }

    public List<CellHistoryEntry> cellHistory(String address) {
        Target target = target(address);
        Cell cell = target.sheet.getCells().read(target.address);
        return cell == null ? Collections.emptyList() : new ArrayList<>(cell.getHistory());
    }

    /**
     * Addresses on the active sheet whose display or formula text contains the query.
     */
    public List<String> find(String query) {
        List<String> result = new ArrayList<>();
        for (CellAddress address : getActiveSheet().getCells().find(query)) {
            result.add(address.toString());
        }
        return result;
    }

    /**
     * Copies the source range so its top-left lands on the destination, on the same
     * sheet. Formula text is copied unchanged.
     */
    public void copyRange(String sourceStart, String sourceEnd, String destination) {
        RangeTarget source = rangeTarget(sourceStart, sourceEnd);
        Target dest = target(destination);
        if (dest.sheet != source.sheet) {
            throw new IllegalArgumentException("Source and destination must be on the same sheet");
        }
        int lastColumn = dest.address.getColumn() + source.range.getColumnCount() - 1;
        int lastRow = dest.address.getRow() + source.range.getRowCount() - 1;
        if (lastColumn > AddressCodec.MAX_COLUMN || lastRow > AddressCodec.MAX_ROW) {
            throw new InvalidAddressException("Copy destination runs off the grid: " + destination);
        }
        List<CellAddress> written = source.sheet.getCells().copyRange(source.range, dest.address);
        if (written.isEmpty()) {
            return;
        }
        for (CellAddress address : written) {
            source.sheet.ensureContains(address);
        }
        afterCellMutation(source.sheet, written);
    }

    // ----------------------------------------------------------------
    // Undo / redo
    // ----------------------------------------------------------------

    public boolean undo() {
        WorkbookSnapshot previous = history.undo();
        if (previous == null) {
            return false;
        }
        restore(previous);
        log.info("Undo in workbook {}", workbook.getId());
        return true;
    }

    public boolean redo() {
        WorkbookSnapshot next = history.redo();
        if (next == null) {
            return false;
        }
        restore(next);
        log.info("Redo in workbook {}", workbook.getId());
        return true;
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public void resetHistory() {
        history.reset(WorkbookSnapshot.capture(workbook));
    }

    // ----------------------------------------------------------------
    // Sheets
    // ----------------------------------------------------------------

    public long createSheet(String name) {
        long id = sheets.createSheet(name);
        afterSheetChange();
        return id;
    }

    public void switchSheet(String idOrName) {
        sheets.switchSheet(idOrName);
    }

    public void renameSheet(String idOrName, String newName) {
        sheets.renameSheet(idOrName, newName);
        afterSheetChange();
    }

    public long copySheet(String idOrName, String newName) {
        long id = sheets.copySheet(idOrName, newName);
        afterSheetChange();
        return id;
    }

    public void deleteSheet(String idOrName) {
        sheets.deleteSheet(idOrName);
        afterSheetChange();
    }

    // ----------------------------------------------------------------
    // Sheet metadata (active sheet)
    // ----------------------------------------------------------------

    /**
     * Resizes the active sheet. Shrinking below a populated cell is rejected.
     */
    public void setDimensions(int rows, int columns) {
        Sheet sheet = getActiveSheet();
        for (Cell cell : sheet.getCells().cells()) {
            if (cell.getAddress().getRow() > rows || cell.getAddress().getColumn() > columns) {
                throw new IllegalArgumentException("Cell " + cell.getAddress() + " lies outside " + rows + "x" + columns);
            }
        }
        sheet.setDimensions(rows, columns);
    }

    public void setColumnWidth(String column, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Column width must be positive");
        }
        getActiveSheet().getColumnWidths().put(AddressCodec.toIndex(column), width);
    }

    public void setRowHeight(int row, int height) {
        checkRow(row);
        if (height <= 0) {
            throw new IllegalArgumentException("Row height must be positive");
        }
        getActiveSheet().getRowHeights().put(row, height);
    }

    public void freeze(int rows, int columns) {
        getActiveSheet().setFrozen(rows, columns);
    }

    public void hideRow(int row) {
        checkRow(row);
        getActiveSheet().getHiddenRows().add(row);
    }

    public void unhideRow(int row) {
        getActiveSheet().getHiddenRows().remove(row);
    }

    public void hideColumn(String column) {
        getActiveSheet().getHiddenColumns().add(AddressCodec.toIndex(column));
    }

    public void unhideColumn(String column) {
        getActiveSheet().getHiddenColumns().remove(AddressCodec.toIndex(column));
    }

    /**
     * Merges the range. Single cells and ranges overlapping an existing merge are rejected.
     */
    public void merge(String start, String end) {
        RangeTarget target = rangeTarget(start, end);
        if (target.range.isSingleCell()) {
            throw new IllegalArgumentException("Cannot merge a single cell");
        }
        for (CellRange existing : target.sheet.getMergedRanges()) {
            if (existing.intersects(target.range)) {
                throw new IllegalArgumentException("Range " + target.range + " overlaps merged range " + existing);
            }
        }
        target.sheet.getMergedRanges().add(target.range);
    }

    public boolean unmerge(String start, String end) {
        RangeTarget target = rangeTarget(start, end);
        return target.sheet.getMergedRanges().remove(target.range);
    }

    /**
     * Adds a rule to the active sheet and returns its id. A rule without an id gets one.
     */
    public String addConditionalFormat(ConditionalFormat rule) {
        if (rule == null || rule.getCondition() == null) {
            throw new IllegalArgumentException("A conditional format needs a condition");
        }
        AddressCodec.parseRange(rule.getRange());
        Sheet sheet = getActiveSheet();
        if (StringUtils.isBlank(rule.getId())) {
            rule.setId(nextFormatId(sheet));
        }
        sheet.getConditionalFormats().add(rule);
        formats.refresh(sheet);
        return rule.getId();
    }

    public boolean removeConditionalFormat(String id) {
        Sheet sheet = getActiveSheet();
        boolean removed = sheet.getConditionalFormats().removeIf(rule -> rule.getId().equals(id));
        if (removed) {
            formats.refresh(sheet);
        }
        return removed;
    }

    /**
     * Defines a named range on the active sheet. The target is a cell, range, sheet
     * reference or 3D reference, e.g. "B2:B9" or "Inputs!C4".
     */
    public void defineName(String name, String target) {
        if (name == null || !NAME_PATTERN.matcher(name.trim()).matches() || AddressCodec.isAddress(name)
                || "TRUE".equalsIgnoreCase(name.trim()) || "FALSE".equalsIgnoreCase(name.trim())) {
            throw new IllegalArgumentException("Invalid range name: " + name);
        }
        if (StringUtils.isBlank(target)) {
            throw new IllegalArgumentException("Named range target cannot be blank");
        }
        FormulaNode node;
        try {
            node = evaluator.parse(target.trim());
        } catch (FormulaParseException e) {
            throw new IllegalArgumentException("Invalid named range target: " + target);
        }
        if (!(node instanceof FormulaNode.CellRef || node instanceof FormulaNode.RangeRef
                || node instanceof FormulaNode.SheetSpanRef)) {
            throw new IllegalArgumentException("Named range target must be a reference: " + target);
        }
        getActiveSheet().getNamedRanges().put(name.trim().toUpperCase(Locale.ROOT), target.trim());
        afterSheetChange();
    }

    public boolean removeName(String name) {
        if (name == null) {
            return false;
        }
        boolean removed = getActiveSheet().getNamedRanges().remove(name.trim().toUpperCase(Locale.ROOT)) != null;
        if (removed) {
            afterSheetChange();
        }
        return removed;
    }

    // ----------------------------------------------------------------
    // CSV
    // ----------------------------------------------------------------

    public String exportCsv() {
        return CsvInterchange.export(getActiveSheet().getCells());
    }

    /**
     * Replaces the active sheet's cells with the CSV content.
     */
    public void importCsv(String csv) {
        List<List<String>> rows = CsvInterchange.parse(csv);
        Sheet sheet = getActiveSheet();
        sheet.getCells().restore(Collections.emptyMap());
        List<CellAddress> written = CsvInterchange.load(sheet.getCells(), rows);
        for (CellAddress address : written) {
            sheet.ensureContains(address);
        }
        recalculation.recalculateAll();
        refreshOverlays();
        history.commit(WorkbookSnapshot.capture(workbook));
        log.info("Imported {} CSV row(s) into sheet {}", rows.size(), sheet.getName());
    }

    // ----------------------------------------------------------------
    // Internal helpers
    // ----------------------------------------------------------------

    private Cell writeCell(Target target, Object value, String formula) {
        target.sheet.ensureContains(target.address);
        return target.sheet.getCells().write(target.address, value, formula);
    }

    private static void applyOptions(Cell cell, WriteOptions options) {
        if (options == null) {
            return;
        }
        if (options.getSource() != null) {
            cell.setSourceAnnotation(options.getSource());
        }
        if (options.getLink() != null) {
            cell.setLink(options.getLink());
        }
    }

    private void afterCellMutation(Sheet sheet, Collection<CellAddress> written) {
        recalculation.recalculateAfterWrite(sheet, written);
        commitCellChange();
    }

    private void commitCellChange() {
        refreshOverlays();
        history.commit(WorkbookSnapshot.capture(workbook));
    }

    // Sheet changes are not undoable; the present snapshot is re-captured so the next
    // commit covers new sheets and current names
    private void afterSheetChange() {
        recalculation.recalculateAll();
        refreshOverlays();
        history.replacePresent(WorkbookSnapshot.capture(workbook));
    }

    private void restore(WorkbookSnapshot snapshot) {
        snapshot.restoreInto(workbook);
        recalculation.recalculateAll();
        refreshOverlays();
    }

    private void refreshOverlays() {
        for (Sheet sheet : sheets.getSheets()) {
            formats.refresh(sheet);
        }
    }

    private String nextFormatId(Sheet sheet) {
        String id;
        do {
            id = "cf-" + (++formatCounter);
        } while (hasFormat(sheet, id));
        return id;
    }

    private static boolean hasFormat(Sheet sheet, String id) {
        for (ConditionalFormat rule : sheet.getConditionalFormats()) {
            if (id.equals(rule.getId())) {
                return true;
            }
        }
        return false;
    }

    private static void checkRow(int row) {
        if (row < 1 || row > AddressCodec.MAX_ROW) {
            throw new InvalidAddressException("Row out of range: " + row);
        }
    }

    /**
     * Accepts the value kinds a cell can hold; numbers become Double.
     */
    private static Object literal(Object value) {
        Object normalized = CellValues.normalize(value);
        if (normalized == null || normalized instanceof String || normalized instanceof Double
                || normalized instanceof Boolean || normalized instanceof CellError) {
            return normalized;
        }
        throw new IllegalArgumentException("Unsupported cell value type: " + normalized.getClass().getSimpleName());
    }

    private Target target(String address) {
        if (StringUtils.isBlank(address)) {
            throw new InvalidAddressException("Address cannot be blank");
        }
        String text = address.trim();
        int bang = text.lastIndexOf('!');
        if (bang < 0) {
            return new Target(getActiveSheet(), AddressCodec.parseAddress(text));
        }
        Sheet sheet = sheets.require(unquote(text.substring(0, bang)));
        return new Target(sheet, AddressCodec.parseAddress(text.substring(bang + 1)));
    }

    private RangeTarget rangeTarget(String start, String end) {
        Target from = target(start);
        CellAddress to;
        if (StringUtils.isBlank(end)) {
            to = from.address;
        } else if (end.indexOf('!') >= 0) {
            Target qualified = target(end);
            if (qualified.sheet != from.sheet) {
                throw new InvalidAddressException("Range corners are on different sheets: " + start + ", " + end);
            }
            to = qualified.address;
        } else {
            to = AddressCodec.parseAddress(end);
        }
        return new RangeTarget(from.sheet, new CellRange(from.address, to));
    }

    private static String unquote(String name) {
        String text = name.trim();
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            return text.substring(1, text.length() - 1).replace("''", "'");
        }
        return text;
    }

    private SheetState toState(Sheet sheet) {
        SheetState state = new SheetState();
        state.setId(sheet.getId());
        state.setName(sheet.getName());
        state.setRowCount(sheet.getRowCount());
        state.setColumnCount(sheet.getColumnCount());
        state.setFrozenRows(sheet.getFrozenRows());
        state.setFrozenColumns(sheet.getFrozenColumns());
        state.setHiddenRows(new ArrayList<>(sheet.getHiddenRows()));
        state.setHiddenColumns(new ArrayList<>(sheet.getHiddenColumns()));
        state.setRowHeights(new TreeMap<>(sheet.getRowHeights()));
        state.setColumnWidths(new TreeMap<>(sheet.getColumnWidths()));
        List<String> merged = new ArrayList<>();
        for (CellRange range : sheet.getMergedRanges()) {
            merged.add(range.toString());
        }
        state.setMergedRanges(merged);
        state.setConditionalFormats(new ArrayList<>(sheet.getConditionalFormats()));
        state.getNamedRanges().putAll(sheet.getNamedRanges());
        List<CellState> cells = new ArrayList<>();
        for (Cell cell : sheet.getCells().cells()) {
            CellState cellState = new CellState();
            cellState.setAddress(cell.getAddress().toString());
            cellState.setValue(cell.getValue());
            cellState.setFormula(cell.getFormula());
            cellState.setType(cell.getType());
            cellState.setStyle(new LinkedHashMap<>(cell.getStyle()));
            cellState.setSource(cell.getSourceAnnotation());
            cellState.setLink(cell.getLink());
            cellState.setComment(cell.getComment());
            cells.add(cellState);
        }
        state.setCells(cells);
        return state;
    }

    private Sheet fromState(SheetState state, long id) {
        if (StringUtils.isBlank(state.getName())) {
            throw new IllegalArgumentException("Sheet " + id + " has no name");
        }
        int rows = state.getRowCount() > 0 ? state.getRowCount() : properties.getDefaultRows();
        int columns = state.getColumnCount() > 0 ? state.getColumnCount() : properties.getDefaultColumns();
        Sheet sheet = new Sheet(id, state.getName().trim(), sheets.newStore(), rows, columns);
        sheet.setFrozen(state.getFrozenRows(), state.getFrozenColumns());
        if (state.getHiddenRows() != null) {
            sheet.getHiddenRows().addAll(state.getHiddenRows());
        }
        if (state.getHiddenColumns() != null) {
            sheet.getHiddenColumns().addAll(state.getHiddenColumns());
        }
        if (state.getRowHeights() != null) {
            sheet.getRowHeights().putAll(state.getRowHeights());
        }
        if (state.getColumnWidths() != null) {
            sheet.getColumnWidths().putAll(state.getColumnWidths());
        }
        if (state.getMergedRanges() != null) {
            for (String range : state.getMergedRanges()) {
                sheet.getMergedRanges().add(AddressCodec.parseRange(range));
            }
        }
        if (state.getConditionalFormats() != null) {
            for (ConditionalFormat rule : state.getConditionalFormats()) {
                if (rule.getCondition() == null) {
                    throw new IllegalArgumentException("Conditional format without a condition on sheet " + state.getName());
                }
                AddressCodec.parseRange(rule.getRange());
                if (StringUtils.isBlank(rule.getId())) {
                    rule.setId(nextFormatId(sheet));
                }
                sheet.getConditionalFormats().add(rule);
            }
        }
        if (state.getNamedRanges() != null) {
            for (Map.Entry<String, String> named : state.getNamedRanges().entrySet()) {
                sheet.getNamedRanges().put(named.getKey().toUpperCase(Locale.ROOT), named.getValue());
            }
        }
        if (state.getCells() != null) {
            for (CellState cellState : state.getCells()) {
                CellAddress address = AddressCodec.parseAddress(cellState.getAddress());
                Cell cell;
                if (StringUtils.isNotBlank(cellState.getFormula())) {
                    String formula = cellState.getFormula().trim();
                    cell = sheet.getCells().write(address, null, formula.startsWith("=") ? formula : "=" + formula);
                    cell.setValue(importedValue(cellState.getValue()));
                } else {
                    cell = sheet.getCells().write(address, importedValue(cellState.getValue()), null);
                }
                if (cellState.getType() != null) {
                    cell.setType(cellState.getType());
                }
                cell.setStyle(cellState.getStyle());
                cell.setSourceAnnotation(cellState.getSource());
                cell.setLink(cellState.getLink());
                cell.setComment(cellState.getComment());
                sheet.ensureContains(address);
            }
        }
        return sheet;
    }

    // Error sentinels come back from JSON as plain text
    private static Object importedValue(Object value) {
        Object literal = literal(value);
        if (literal instanceof String) {
            CellError error = CellError.fromSentinel((String) literal);
            if (error != null) {
                return error;
            }
        }
        return literal;
    }

    private static final class Target {
        private final Sheet sheet;
        private final CellAddress address;

        Target(Sheet sheet, CellAddress address) {
            this.sheet = sheet;
            this.address = address;
        }
    }

    private static final class RangeTarget {
        private final Sheet sheet;
        private final CellRange range;

        RangeTarget(Sheet sheet, CellRange range) {
            this.sheet = sheet;
            this.range = range;
        }
    }
}
