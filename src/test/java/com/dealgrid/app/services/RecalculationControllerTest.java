package com.dealgrid.app.services;

import com.dealgrid.app.config.GridProperties;
import com.dealgrid.app.formula.FormulaEvaluator;
import com.dealgrid.app.formula.functions.FunctionLibrary;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.Sheet;
import com.dealgrid.app.models.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Collections;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dependency-driven recalculation over raw cell stores, without the session pipeline.
 */
class RecalculationControllerTest {

    private MultiSheetManager sheets;
    private RecalculationController recalculation;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        sheets = new MultiSheetManager(new Workbook(), new GridProperties(), clock);
        sheets.createSheet("Model");
        sheet = sheets.getActiveSheet();
        recalculation = new RecalculationController(sheets,
                new FormulaEvaluator(FunctionLibrary.standard()), clock);
    }

    private void write(Sheet target, String address, Object value) {
        CellAddress a = CellAddress.of(address);
        if (value instanceof String && ((String) value).startsWith("=")) {
            target.getCells().write(a, null, (String) value);
        } else {
            target.getCells().write(a, value, null);
        }
        recalculation.recalculateAfterWrite(target, Collections.singletonList(a));
    }

    private Object value(Sheet target, String address) {
        return target.getCells().readValue(CellAddress.of(address));
    }

    @Test
    void testDependentsFollowTransitively() {
        write(sheet, "A1", 10);
        write(sheet, "B1", "=A1*2");
        write(sheet, "C1", "=B1+1");
        assertEquals(21.0, value(sheet, "C1"));

        write(sheet, "A1", 20);
        assertEquals(40.0, value(sheet, "B1"));
        assertEquals(41.0, value(sheet, "C1"));
    }

    @Test
    void testDiamondIsEvaluatedOncePerPassInOrder() {
        write(sheet, "A1", 1);
        write(sheet, "B1", "=A1+1");
        write(sheet, "B2", "=A1+2");
        write(sheet, "C1", "=B1*B2");
        assertEquals(6.0, value(sheet, "C1"));

        write(sheet, "A1", 2);
        assertEquals(12.0, value(sheet, "C1"));
    }

    @Test
    void testRangeReferencesPickUpNewCells() {
        write(sheet, "D1", "=SUM(A1:A10)");
        write(sheet, "A7", 5);
        assertEquals(5.0, value(sheet, "D1"));
    }

    @Test
    void testCycleMarksEveryMemberCircular() {
        write(sheet, "A1", "=B1+1");
        write(sheet, "B1", "=A1+1");
        assertEquals(CellError.CIRCULAR, value(sheet, "A1"));
        assertEquals(CellError.CIRCULAR, value(sheet, "B1"));

        // breaking the cycle lets both settle again
        write(sheet, "B1", 5);
        assertEquals(6.0, value(sheet, "A1"));
    }

    @Test
    void testSelfReferenceIsCircular() {
        write(sheet, "A1", "=A1+1");
        assertEquals(CellError.CIRCULAR, value(sheet, "A1"));
    }

    @Test
    void testCrossSheetDependents() {
        sheets.createSheet("Inputs");
        Sheet inputs = sheets.require("Inputs");
        write(inputs, "A1", 100);
        write(sheet, "A1", "=Inputs!A1*3");
        assertEquals(300.0, value(sheet, "A1"));

        write(inputs, "A1", 1);
        assertEquals(3.0, value(sheet, "A1"));
    }

    @Test
    void testNamedRangeDependents() {
        sheet.getNamedRanges().put("GROWTH", "B1");
        write(sheet, "B1", 0.1);
        write(sheet, "C1", "=100*(1+Growth)");
        assertEquals(110.0, (Double) value(sheet, "C1"), 1e-9);

        write(sheet, "B1", 0.5);
        assertEquals(150.0, (Double) value(sheet, "C1"), 1e-9);
    }

    @Test
    void testDependentsOfListsOnlyAffectedFormulas() {
        write(sheet, "A1", 1);
        write(sheet, "B1", "=A1");
        write(sheet, "C1", "=B1");
        write(sheet, "D1", "=5");

        Set<CellKey> dependents = recalculation.dependentsOf(
                Collections.singletonList(new CellKey(sheet, CellAddress.of("A1"))));
        assertEquals(2, dependents.size());
        assertTrue(dependents.contains(new CellKey(sheet, CellAddress.of("B1"))));
        assertTrue(dependents.contains(new CellKey(sheet, CellAddress.of("C1"))));
    }

    @Test
    void testRecalculateAllCatchesWritesMadeOutsideAPass() {
        write(sheet, "A1", "=B1");
        sheet.getCells().write(CellAddress.of("B1"), 9, null);
        assertEquals(0.0, value(sheet, "A1"));

        recalculation.recalculateAll();
        assertEquals(9.0, value(sheet, "A1"));
    }
}
