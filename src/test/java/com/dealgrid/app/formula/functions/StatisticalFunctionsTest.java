package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaFixture;
import com.dealgrid.app.models.CellError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatisticalFunctionsTest {

    private FormulaFixture fx;

    @BeforeEach
    void setUp() {
        fx = new FormulaFixture();
        // 2, 4, 4, 4, 5, 5, 7, 9: mean 5, population deviation 2
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
        for (int i = 0; i < values.length; i++) {
            fx.set("A" + (i + 1), values[i]);
        }
    }

    @Test
    void testCentralTendency() {
        assertEquals(5.0, fx.eval("=AVERAGE(A1:A8)"));
        assertEquals(4.5, fx.eval("=MEDIAN(A1:A8)"));
        assertEquals(4.0, fx.eval("=MEDIAN(A1:A3)"));
    }

    @Test
    void testStdevAndVarAreThePopulationStatistics() {
        assertEquals(2.0, fx.number("=STDEV(A1:A8)"), 1e-12);
        assertEquals(4.0, fx.number("=VAR(A1:A8)"), 1e-12);
        assertEquals(4.0, fx.number("=VAR.P(A1:A8)"), 1e-12);
        assertEquals(32.0 / 7.0, fx.number("=VAR.S(A1:A8)"), 1e-12);
        assertEquals(Math.sqrt(32.0 / 7.0), fx.number("=STDEV.S(A1:A8)"), 1e-12);
    }

    @Test
    void testEmptyInputIsAnError() {
        assertEquals(CellError.ERROR, fx.eval("=AVERAGE(Z1:Z5)"));
        assertEquals(CellError.ERROR, fx.eval("=MEDIAN(Z1:Z5)"));
        assertEquals(CellError.ERROR, fx.eval("=VAR.S(5)"));
    }

    @Test
    void testOrderStatistics() {
        assertEquals(9.0, fx.eval("=LARGE(A1:A8, 1)"));
        assertEquals(7.0, fx.eval("=LARGE(A1:A8, 2)"));
        assertEquals(2.0, fx.eval("=SMALL(A1:A8, 1)"));
        assertEquals(CellError.ERROR, fx.eval("=SMALL(A1:A8, 9)"));
        assertEquals(2.0, fx.eval("=PERCENTILE(A1:A8, 0)"));
        assertEquals(9.0, fx.eval("=PERCENTILE(A1:A8, 1)"));
        assertEquals(4.5, fx.number("=PERCENTILE(A1:A8, 0.5)"), 1e-12);
        assertEquals(CellError.ERROR, fx.eval("=PERCENTILE(A1:A8, 1.5)"));
    }

    @Test
    void testCorrelation() {
        for (int i = 1; i <= 4; i++) {
            fx.set("B" + i, i).set("C" + i, 2 * i + 1).set("D" + i, 10 - i);
        }
        assertEquals(1.0, fx.number("=CORREL(B1:B4, C1:C4)"), 1e-12);
        assertEquals(-1.0, fx.number("=CORREL(B1:B4, D1:D4)"), 1e-12);
    }
}
