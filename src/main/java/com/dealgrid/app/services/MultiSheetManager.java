package com.dealgrid.app.services;

import com.dealgrid.app.config.GridProperties;
import com.dealgrid.app.exceptions.SheetNotFoundException;
import com.dealgrid.app.exceptions.SheetOperationException;
import com.dealgrid.app.formula.FormulaRewriter;
import com.dealgrid.app.formula.SheetDirectory;
import com.dealgrid.app.models.Cell;
import com.dealgrid.app.models.CellStore;
import com.dealgrid.app.models.Sheet;
import com.dealgrid.app.models.Workbook;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sheet lifecycle for one workbook: create, switch, rename, copy and delete.
 * Also resolves the sheet names used by cross-sheet and 3D references.
 *
 * Sheets are addressed by id or by name. A value that parses as a number is tried as
 * an id first, then as a name.
 */
public class MultiSheetManager implements SheetDirectory {

    private static final Logger log = LoggerFactory.getLogger(MultiSheetManager.class);

    private final Workbook workbook;
    private final GridProperties properties;
    private final Clock clock;

    public MultiSheetManager(Workbook workbook, GridProperties properties, Clock clock) {
        this.workbook = workbook;
        this.properties = properties;
        this.clock = clock;
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public List<Sheet> getSheets() {
        return workbook.getSheets();
    }

    public Sheet getActiveSheet() {
        return workbook.getActiveSheet();
    }

    /**
     * Creates an empty sheet with the default dimensions and returns its id.
     * A blank name becomes the next free "SheetN". The first sheet becomes active.
     */
    public long createSheet(String name) {
        String sheetName = StringUtils.isBlank(name) ? nextDefaultName() : name.trim();
        checkNameAvailable(sheetName, null);
        Sheet sheet = new Sheet(workbook.nextSheetId(), sheetName, newStore(),
                properties.getDefaultRows(), properties.getDefaultColumns());
        workbook.addSheet(sheet);
        if (workbook.getActiveSheet() == null) {
            workbook.setActiveSheetId(sheet.getId());
        }
        log.info("Created sheet {} ({}) in workbook {}", sheet.getId(), sheetName, workbook.getId());
        return sheet.getId();
    }

    public Sheet switchSheet(String idOrName) {
        Sheet sheet = require(idOrName);
        workbook.setActiveSheetId(sheet.getId());
        return sheet;
    }

    /**
     * Renames the sheet and rewrites every formula that qualifies a reference with the
     * old name. The caller recalculates afterwards.
     */
    public Sheet renameSheet(String idOrName, String newName) {
        if (StringUtils.isBlank(newName)) {
            throw new IllegalArgumentException("Sheet name cannot be blank");
        }
        Sheet sheet = require(idOrName);
        String target = newName.trim();
        checkNameAvailable(target, sheet);
        String oldName = sheet.getName();
        sheet.setName(target);
        int rewritten = 0;
        for (Sheet each : workbook.getSheets()) {
            for (Cell cell : each.getCells().formulaCells()) {
                String updated = FormulaRewriter.renameSheet(cell.getFormula(), oldName, target);
                if (!updated.equals(cell.getFormula())) {
                    cell.setFormula(updated);
                    rewritten++;
                }
            }
            for (Map.Entry<String, String> named : each.getNamedRanges().entrySet()) {
                // Named range targets are stored without the leading '='
                named.setValue(FormulaRewriter.renameSheet("=" + named.getValue(), oldName, target).substring(1));
            }
        }
        log.info("Renamed sheet {} from {} to {}, {} formula(s) rewritten", sheet.getId(), oldName, target, rewritten);
        return sheet;
    }

    /**
     * Appends a deep copy of the sheet. A blank name becomes "&lt;name&gt; (Copy)",
     * numbered when taken.
     */
    public long copySheet(String idOrName, String newName) {
        Sheet source = require(idOrName);
        String name;
        if (StringUtils.isBlank(newName)) {
            name = source.getName() + " (Copy)";
            for (int n = 2; workbook.findByName(name) != null; n++) {
                name = source.getName() + " (Copy " + n + ")";
            }
        } else {
            name = newName.trim();
            checkNameAvailable(name, null);
        }
        Sheet copy = source.copy(workbook.nextSheetId(), name);
        workbook.addSheet(copy);
        log.info("Copied sheet {} to {} ({})", source.getName(), copy.getId(), name);
        return copy.getId();
    }

    /**
     * Deletes the sheet. The last remaining sheet cannot be deleted. When the active
     * sheet goes, the previous sheet in creation order becomes active, or the first one.
     */
    public void deleteSheet(String idOrName) {
        Sheet sheet = require(idOrName);
        if (workbook.getSheets().size() <= 1) {
            log.warn("Rejected deleting the last sheet {} of workbook {}", sheet.getName(), workbook.getId());
            throw new SheetOperationException("Cannot delete the last sheet");
        }
        int index = workbook.indexOf(sheet);
        boolean wasActive = workbook.getActiveSheetId() == sheet.getId();
        workbook.removeSheet(sheet);
        if (wasActive) {
            Sheet next = workbook.getSheets().get(Math.max(0, index - 1));
            workbook.setActiveSheetId(next.getId());
        }
        log.info("Deleted sheet {} ({}) from workbook {}", sheet.getId(), sheet.getName(), workbook.getId());
    }

    /**
     * Looks a sheet up by id or name.
     *
     * @throws SheetNotFoundException when nothing matches
     */
    public Sheet require(String idOrName) {
        Sheet sheet = lookup(idOrName);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + idOrName);
        }
        return sheet;
    }

    public Sheet lookup(String idOrName) {
        if (StringUtils.isBlank(idOrName)) {
            return null;
        }
        String text = idOrName.trim();
        if (StringUtils.isNumeric(text)) {
            Sheet byId = workbook.findById(Long.parseLong(text));
            if (byId != null) {
                return byId;
            }
        }
        return workbook.findByName(text);
    }

    @Override
    public Sheet findSheet(String name) {
        return workbook.findByName(name);
    }

    @Override
    public List<Sheet> sheetSpan(String first, String last) {
        Sheet from = workbook.findByName(first);
        Sheet to = workbook.findByName(last);
        if (from == null || to == null) {
            return null;
        }
        int a = workbook.indexOf(from);
        int b = workbook.indexOf(to);
        return new ArrayList<>(workbook.getSheets().subList(Math.min(a, b), Math.max(a, b) + 1));
    }

    /**
     * A fresh empty cell store with the configured history limit.
     */
    public CellStore newStore() {
        return new CellStore(clock, properties.getCellHistoryLimit());
    }

    private String nextDefaultName() {
        int n = workbook.getSheets().size() + 1;
        String name = properties.getDefaultSheetName() + n;
        while (workbook.findByName(name) != null) {
            n++;
            name = properties.getDefaultSheetName() + n;
        }
        return name;
    }

    private void checkNameAvailable(String name, Sheet self) {
        Sheet existing = workbook.findByName(name);
        if (existing != null && existing != self) {
            log.warn("Rejected duplicate sheet name {} in workbook {}", name, workbook.getId());
            throw new SheetOperationException("A sheet named " + name + " already exists");
        }
    }
}
