package com.dealgrid.app.controllers;

import com.dealgrid.app.models.ConditionalFormat;
import com.dealgrid.app.models.dto.CellView;
import com.dealgrid.app.models.dto.CellWriteRequest;
import com.dealgrid.app.models.state.WorkbookState;
import com.dealgrid.app.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for workbooks, their cells and their sheets.
 * "/workbooks" is the base path. Addresses in paths may be sheet-qualified,
 * e.g. "Sheet2!B4"; unqualified addresses target the active sheet.
 */
@RestController
@RequestMapping("/workbooks")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbooks
     * Creates a workbook with one empty sheet, returns its ID.
     */
    @PostMapping
    public ResponseEntity<Long> createWorkbook() {
        return ResponseEntity.ok(workbookService.createWorkbook());
    }

    /**
     * GET /workbooks/{id}
     * Returns the display text of the active sheet's populated cells,
     * e.g. { "A1": "Revenue", "B1": "1200" }.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getWorkbook(@PathVariable long id) {
        return ResponseEntity.ok(workbookService.getActiveSheetValues(id));
    }

    /**
     * PUT /workbooks/{id}/cells/{address}
     * Body: { "value": ..., "source": ..., "link": ... }. Writes a literal.
     */
    @PutMapping("/{id}/cells/{address}")
    public ResponseEntity<Void> writeCell(@PathVariable long id,
                                          @PathVariable String address,
                                          @RequestBody CellWriteRequest request) {
        workbookService.writeCell(id, address, request);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /workbooks/{id}/cells/{address}/formula
     * Body: the formula as plain text, with or without the leading '='.
     */
    @PutMapping(value = "/{id}/cells/{address}/formula", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Void> setFormula(@PathVariable long id,
                                           @PathVariable String address,
                                           @RequestBody String formula) {
        workbookService.setFormula(id, address, formula);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /workbooks/{id}/cells/{address}/style
     * Body: style attributes, merged into the cell's current style.
     */
    @PutMapping("/{id}/cells/{address}/style")
    public ResponseEntity<Void> styleCell(@PathVariable long id,
                                          @PathVariable String address,
                                          @RequestBody Map<String, Object> style) {
        workbookService.styleCell(id, address, style);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{id}/cells/{address}")
    public ResponseEntity<CellView> readCell(@PathVariable long id, @PathVariable String address) {
        return ResponseEntity.ok(workbookService.readCell(id, address));
    }

    @DeleteMapping("/{id}/range/{start}/{end}")
    public ResponseEntity<Void> clearRange(@PathVariable long id,
                                           @PathVariable String start,
                                           @PathVariable String end) {
        workbookService.clearRange(id, start, end);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /workbooks/{id}/range/{start}/{end}
     * Body: row-major matrix of values, clipped to the range.
     */
    @PutMapping("/{id}/range/{start}/{end}")
    public ResponseEntity<Void> writeRange(@PathVariable long id,
                                           @PathVariable String start,
                                           @PathVariable String end,
                                           @RequestBody List<List<Object>> matrix) {
        workbookService.writeRange(id, start, end, matrix);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /workbooks/{id}/undo
     * Returns false when there was nothing to undo.
     */
    @PostMapping("/{id}/undo")
    public ResponseEntity<Boolean> undo(@PathVariable long id) {
        return ResponseEntity.ok(workbookService.undo(id));
    }

    @PostMapping("/{id}/redo")
    public ResponseEntity<Boolean> redo(@PathVariable long id) {
        return ResponseEntity.ok(workbookService.redo(id));
    }

    @GetMapping("/{id}/state")
    public ResponseEntity<WorkbookState> exportState(@PathVariable long id) {
        return ResponseEntity.ok(workbookService.exportState(id));
    }

    @PutMapping("/{id}/state")
    public ResponseEntity<Void> importState(@PathVariable long id, @RequestBody WorkbookState state) {
        workbookService.importState(id, state);
        return ResponseEntity.ok().build();
    }

    @GetMapping(value = "/{id}/csv", produces = "text/csv")
    public ResponseEntity<String> exportCsv(@PathVariable long id) {
        return ResponseEntity.ok(workbookService.exportCsv(id));
    }

    /**
     * PUT /workbooks/{id}/csv
     * Replaces the active sheet's cells with the CSV body.
     */
    @PutMapping(value = "/{id}/csv", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<Void> importCsv(@PathVariable long id, @RequestBody String csv) {
        workbookService.importCsv(id, csv);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /workbooks/{id}/sheets
     * Optional body: { "name": "Cap Table" }. Returns the new sheet's ID.
     */
    @PostMapping("/{id}/sheets")
    public ResponseEntity<Long> createSheet(@PathVariable long id,
                                            @RequestBody(required = false) Map<String, String> request) {
        String name = request == null ? null : request.get("name");
        return ResponseEntity.ok(workbookService.createSheet(id, name));
    }

    @PutMapping("/{id}/sheets/{sheet}/active")
    public ResponseEntity<Void> switchSheet(@PathVariable long id, @PathVariable String sheet) {
        workbookService.switchSheet(id, sheet);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /workbooks/{id}/sheets/{sheet}/name
     * Body: { "name": "New Name" }. Formulas referring to the old name are rewritten.
     */
    @PutMapping("/{id}/sheets/{sheet}/name")
    public ResponseEntity<Void> renameSheet(@PathVariable long id,
                                            @PathVariable String sheet,
                                            @RequestBody Map<String, String> request) {
        workbookService.renameSheet(id, sheet, request.get("name"));
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{id}/sheets/{sheet}/copy")
    public ResponseEntity<Long> copySheet(@PathVariable long id,
                                          @PathVariable String sheet,
                                          @RequestBody(required = false) Map<String, String> request) {
        String name = request == null ? null : request.get("name");
        return ResponseEntity.ok(workbookService.copySheet(id, sheet, name));
    }

    @DeleteMapping("/{id}/sheets/{sheet}")
    public ResponseEntity<Void> deleteSheet(@PathVariable long id, @PathVariable String sheet) {
        workbookService.deleteSheet(id, sheet);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /workbooks/{id}/conditional-formats
     * Adds a rule to the active sheet, returns the rule ID.
     */
    @PostMapping("/{id}/conditional-formats")
    public ResponseEntity<String> addConditionalFormat(@PathVariable long id,
                                                       @RequestBody ConditionalFormat rule) {
        return ResponseEntity.ok(workbookService.addConditionalFormat(id, rule));
    }
}
