package com.dealgrid.app.services;

import com.dealgrid.app.formula.FormulaRewriter;
import com.dealgrid.app.models.Cell;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.Sheet;
import com.dealgrid.app.models.Workbook;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Immutable deep copy of every sheet's cell map, keyed by sheet id, together with the
 * sheet names at capture time. Sheet metadata is not part of the snapshot.
 */
public final class WorkbookSnapshot {

    private final Map<Long, NavigableMap<CellAddress, Cell>> cellsBySheet;
    private final Map<Long, String> namesBySheet;

    private WorkbookSnapshot(Map<Long, NavigableMap<CellAddress, Cell>> cellsBySheet,
                             Map<Long, String> namesBySheet) {
        this.cellsBySheet = Collections.unmodifiableMap(cellsBySheet);
        this.namesBySheet = Collections.unmodifiableMap(namesBySheet);
    }

    public static WorkbookSnapshot capture(Workbook workbook) {
        Map<Long, NavigableMap<CellAddress, Cell>> cells = new LinkedHashMap<>();
        Map<Long, String> names = new LinkedHashMap<>();
        for (Sheet sheet : workbook.getSheets()) {
            cells.put(sheet.getId(), Collections.unmodifiableNavigableMap(sheet.getCells().snapshot()));
            names.put(sheet.getId(), sheet.getName());
        }
        return new WorkbookSnapshot(cells, names);
    }

    /**
     * Restores the captured cells into the sheets that still exist. Sheets created
     * after the capture keep their cells. Formulas that qualify a sheet renamed since
     * the capture are rewritten to its current name.
     */
    public void restoreInto(Workbook workbook) {
        Map<Long, String> renamed = new LinkedHashMap<>();
        for (Sheet sheet : workbook.getSheets()) {
            String captured = namesBySheet.get(sheet.getId());
            if (captured != null && !captured.equals(sheet.getName())) {
                renamed.put(sheet.getId(), captured);
            }
        }
        for (Sheet sheet : workbook.getSheets()) {
            NavigableMap<CellAddress, Cell> cells = cellsBySheet.get(sheet.getId());
            if (cells == null) {
                continue;
            }
            sheet.getCells().restore(cells);
            if (!renamed.isEmpty()) {
                for (Cell cell : sheet.getCells().formulaCells()) {
                    cell.setFormula(requalify(cell.getFormula(), renamed, workbook));
                }
            }
        }
    }

    // Two passes through placeholder names so that swapped names do not collide
    private static String requalify(String formula, Map<Long, String> renamed, Workbook workbook) {
        String text = formula;
        for (Map.Entry<Long, String> entry : renamed.entrySet()) {
            text = FormulaRewriter.renameSheet(text, entry.getValue(), placeholder(entry.getKey()));
        }
        for (Long id : renamed.keySet()) {
            text = FormulaRewriter.renameSheet(text, placeholder(id), workbook.findById(id).getName());
        }
        return text;
    }

    private static String placeholder(long sheetId) {
        return "__sheet_" + sheetId + "__";
    }
}
