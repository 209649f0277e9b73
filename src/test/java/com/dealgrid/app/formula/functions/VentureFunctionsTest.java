package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaFixture;
import com.dealgrid.app.models.CellError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cap table, preference and fund economics functions.
 */
class VentureFunctionsTest {

    private FormulaFixture fx;

    @BeforeEach
    void setUp() {
        fx = new FormulaFixture();
    }

    @Test
    void testCapTableMath() {
        assertEquals(0.2, fx.number("=DILUTION(1000000, 250000, 1000000)"), 1e-12);
        assertEquals(0.2, fx.number("=OWNERSHIP(2000000, 10000000)"), 1e-12);
        assertEquals(2.0, fx.eval("=PRICEPERSHARE(10000000, 5000000)"));
        assertEquals(2000000.0, fx.number("=OPTIONPOOL(0.1, 20000000)"), 1e-6);
        assertEquals(CellError.ERROR, fx.eval("=OWNERSHIP(1, 0)"));
    }

    @Test
    void testLiquidationPreference() {
        assertEquals(10000000.0, fx.eval("=LIQUIDPREF(5000000, 2)"));
        assertEquals(10000000.0, fx.eval("=LIQUIDPREF(5000000, 2, TRUE)"));
    }

    @Test
    void testWaterfallPaysCommonAfterThePreference() {
        assertEquals(24000000.0, fx.number("=WATERFALL(50000000, 10000000, 6000000, 10000000)"), 1e-6);
        assertEquals(0.0, fx.eval("=WATERFALL(8000000, 10000000, 6000000, 10000000)"));
    }

    @Test
    void testParticipatingPreferred() {
        assertEquals(14000000.0, fx.number("=PARTICIPATING(50000000, 5000000, 1, 0.2)"), 1e-6);
        assertEquals(12000000.0, fx.number("=PARTICIPATING(50000000, 5000000, 1, 0.2, 12000000)"), 1e-6);
        assertEquals(14000000.0, fx.number("=PARTICIPATING(50000000, 5000000, 1, 0.2, \"uncapped\")"), 1e-6);
        // a small exit pays out at most what there is
        assertEquals(3000000.0, fx.number("=PARTICIPATING(3000000, 5000000, 1, 0.2)"), 1e-6);
    }

    @Test
    void testIpoRatchet() {
        assertEquals(12.0, fx.number("=IPORATCHET(10, 11)"), 1e-12);
        assertEquals(15.0, fx.number("=IPORATCHET(10, 15)"), 1e-12);
        assertEquals(15.0, fx.number("=IPORATCHET(10, 11, 0.5)"), 1e-12);
    }

    @Test
    void testFundEconomics() {
        assertEquals(125.9712, fx.number("=CUMULDIV(100, 0.08, 3)"), 1e-9);
        assertEquals(10.0, fx.number("=CATCHUP(150, 100, 0.2)"), 1e-12);
        assertEquals(0.0, fx.eval("=CATCHUP(80, 100, 0.2)"));
        assertEquals(40.0, fx.number("=CARRIEDINT(300, 100, 0.2)"), 1e-12);
    }

    @Test
    void testBreakevenAndSensitivity() {
        assertEquals(2000.0, fx.eval("=BREAKEVEN(100000, 50)"));
        assertEquals(2000.0, fx.eval("=BREAKEVEN(100000, 500, 10)"));
        assertEquals(120.0, fx.number("=SENSITIVITY(100, 0.1, 2)"), 1e-12);
    }

    @Test
    void testScenarioAcceptsThreeWeightForms() {
        assertEquals(105.0, fx.number("=SCENARIO(100, 150, 50, 0.5, 0.3, 0.2)"), 1e-9);
        assertEquals(105.0, fx.number("=SCENARIO(100, 150, 50, \"0.5,0.3,0.2\")"), 1e-9);

        fx.set("A1", 0.5).set("A2", 0.3).set("A3", 0.2);
        assertEquals(105.0, fx.number("=SCENARIO(100, 150, 50, A1:A3)"), 1e-9);

        assertEquals(CellError.ERROR, fx.eval("=SCENARIO(100, 150, 50, 0.5)"));
        assertEquals(CellError.ERROR, fx.eval("=SCENARIO(100, 150, 50, \"0.5,0.5\")"));
        assertEquals(CellError.ERROR, fx.eval("=SCENARIO(100, 150, 50, 0.5, 0.5)"));
    }
}
