package com.dealgrid.app.services;

import com.dealgrid.app.config.GridProperties;
import com.dealgrid.app.exceptions.SheetNotFoundException;
import com.dealgrid.app.exceptions.SheetOperationException;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.Sheet;
import com.dealgrid.app.models.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultiSheetManagerTest {

    private MultiSheetManager sheets;

    @BeforeEach
    void setUp() {
        sheets = new MultiSheetManager(new Workbook(), new GridProperties(), Clock.systemUTC());
    }

    @Test
    void testCreateUsesDefaultsAndActivatesTheFirstSheet() {
        long first = sheets.createSheet(null);
        long second = sheets.createSheet("  Cap Table ");

        assertEquals("Sheet1", sheets.require(String.valueOf(first)).getName());
        assertEquals("Cap Table", sheets.require(String.valueOf(second)).getName());
        assertEquals(first, sheets.getActiveSheet().getId());
        assertEquals(100, sheets.getActiveSheet().getRowCount());
        assertEquals(26, sheets.getActiveSheet().getColumnCount());
        assertEquals("Sheet3", sheets.require(String.valueOf(sheets.createSheet(""))).getName());
    }

    @Test
    void testNamesAreUniqueIgnoringCase() {
        sheets.createSheet("Model");
        assertThrows(SheetOperationException.class, () -> sheets.createSheet("MODEL"));
    }

    @Test
    void testLookupByIdOrName() {
        long id = sheets.createSheet("Model");
        assertSame(sheets.require("model"), sheets.require(String.valueOf(id)));
        assertNull(sheets.lookup("Other"));
        assertThrows(SheetNotFoundException.class, () -> sheets.require("Other"));
    }

    @Test
    void testSwitchSheet() {
        sheets.createSheet("Model");
        long inputs = sheets.createSheet("Inputs");
        sheets.switchSheet("Inputs");
        assertEquals(inputs, sheets.getActiveSheet().getId());
    }

    @Test
    void testRenameRewritesFormulasAndNamedRanges() {
        sheets.createSheet("Model");
        sheets.createSheet("Inputs");
        Sheet model = sheets.require("Model");
        model.getCells().write(CellAddress.of("A1"), null, "=Inputs!B2*2");
        model.getCells().write(CellAddress.of("A2"), null, "=SUM(Model:Inputs!C1)");
        model.getNamedRanges().put("RATE", "Inputs!B1");

        sheets.renameSheet("Inputs", "Assumptions 2024");

        assertEquals("='Assumptions 2024'!B2*2", model.getCells().read(CellAddress.of("A1")).getFormula());
        assertEquals("=SUM(Model:'Assumptions 2024'!C1)", model.getCells().read(CellAddress.of("A2")).getFormula());
        assertEquals("'Assumptions 2024'!B1", model.getNamedRange("rate"));
        assertNull(sheets.findSheet("Inputs"));
    }

    @Test
    void testRenameRejectsBlankAndTakenNames() {
        sheets.createSheet("Model");
        sheets.createSheet("Inputs");
        assertThrows(IllegalArgumentException.class, () -> sheets.renameSheet("Model", " "));
        assertThrows(SheetOperationException.class, () -> sheets.renameSheet("Model", "inputs"));
        // renaming to its own name in another case is allowed
        sheets.renameSheet("Model", "MODEL");
        assertEquals("MODEL", sheets.require("model").getName());
    }

    @Test
    void testCopyIsDeepAndNamedAfterTheSource() {
        sheets.createSheet("Model");
        Sheet model = sheets.require("Model");
        model.getCells().write(CellAddress.of("A1"), 42, null);

        long copyId = sheets.copySheet("Model", null);
        long secondCopy = sheets.copySheet("Model", "");
        Sheet copy = sheets.require(String.valueOf(copyId));

        assertEquals("Model (Copy)", copy.getName());
        assertEquals("Model (Copy 2)", sheets.require(String.valueOf(secondCopy)).getName());
        assertEquals(42.0, copy.getCells().readValue(CellAddress.of("A1")));

        copy.getCells().write(CellAddress.of("A1"), 7, null);
        assertEquals(42.0, model.getCells().readValue(CellAddress.of("A1")));
    }

    @Test
    void testDeleteMovesTheActivePointerBack() {
        sheets.createSheet("One");
        sheets.createSheet("Two");
        long three = sheets.createSheet("Three");
        sheets.switchSheet("Three");

        sheets.deleteSheet("Three");
        assertEquals("Two", sheets.getActiveSheet().getName());
        assertNull(sheets.lookup(String.valueOf(three)));

        sheets.switchSheet("One");
        sheets.deleteSheet("One");
        assertEquals("Two", sheets.getActiveSheet().getName());
    }

    @Test
    void testLastSheetCannotBeDeleted() {
        sheets.createSheet("Only");
        assertThrows(SheetOperationException.class, () -> sheets.deleteSheet("Only"));
        assertEquals(1, sheets.getSheets().size());
    }

    @Test
    void testSheetSpanFollowsCreationOrder() {
        sheets.createSheet("Q1");
        sheets.createSheet("Q2");
        sheets.createSheet("Q3");

        List<Sheet> span = sheets.sheetSpan("q3", "Q1");
        assertEquals(3, span.size());
        assertEquals("Q1", span.get(0).getName());
        assertNull(sheets.sheetSpan("Q1", "Q9"));
    }
}
