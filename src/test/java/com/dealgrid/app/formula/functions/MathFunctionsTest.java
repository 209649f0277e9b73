package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaFixture;
import com.dealgrid.app.models.CellError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MathFunctionsTest {

    private FormulaFixture fx;

    @BeforeEach
    void setUp() {
        fx = new FormulaFixture();
        fx.set("A1", 1).set("A2", 2).set("A3", 3).set("A4", "n/a").set("A5", true);
    }

    @Test
    void testAggregatesSkipTextAndBooleansInRanges() {
        assertEquals(6.0, fx.eval("=SUM(A1:A5)"));
        assertEquals(6.0, fx.eval("=PRODUCT(A1:A3)"));
        assertEquals(1.0, fx.eval("=MIN(A1:A5)"));
        assertEquals(3.0, fx.eval("=MAX(A1:A5)"));
        assertEquals(3.0, fx.eval("=COUNT(A1:A10)"));
        assertEquals(5.0, fx.eval("=COUNTA(A1:A10)"));
        assertEquals(10.0, fx.eval("=SUM(A1:A3, 4)"));
    }

    @Test
    void testNumericTextCountsInAggregates() {
        fx.set("B1", "1,000").set("B2", "$500");
        assertEquals(1500.0, fx.eval("=SUM(B1:B2)"));
    }

    @Test
    void testErrorsInsideRangesPropagate() {
        fx.set("A6", CellError.NA);
        assertEquals(CellError.NA, fx.eval("=SUM(A1:A6)"));
        assertEquals(6.0, fx.eval("=COUNTA(A1:A6)"));
    }

    @Test
    void testRounding() {
        assertEquals(2.35, fx.eval("=ROUND(2.345, 2)"));
        assertEquals(-3.0, fx.eval("=ROUND(-2.5)"));
        assertEquals(2.35, fx.eval("=ROUNDUP(2.341, 2)"));
        assertEquals(2.34, fx.eval("=ROUNDDOWN(2.349, 2)"));
        assertEquals(1200.0, fx.eval("=ROUND(1234, -2)"));
        assertEquals(10.0, fx.eval("=CEILING(9.2, 5)"));
        assertEquals(5.0, fx.eval("=FLOOR(9.2, 5)"));
        assertEquals(-3.0, fx.eval("=INT(-2.5)"));
    }

    @Test
    void testDomainErrors() {
        assertEquals(CellError.ERROR, fx.eval("=SQRT(-1)"));
        assertEquals(CellError.ERROR, fx.eval("=LN(0)"));
        assertEquals(CellError.ERROR, fx.eval("=MOD(5, 0)"));
        assertEquals(CellError.ERROR, fx.eval("=FLOOR(5, 0)"));
        assertEquals(0.0, fx.eval("=CEILING(5, 0)"));
    }

    @Test
    void testMathBasics() {
        assertEquals(5.0, fx.eval("=ABS(-5)"));
        assertEquals(8.0, fx.eval("=POWER(2, 3)"));
        assertEquals(3.0, fx.eval("=SQRT(9)"));
        assertEquals(2.0, fx.number("=LOG(100)"), 1e-12);
        assertEquals(3.0, fx.number("=LOG(8, 2)"), 1e-12);
        assertEquals(1.0, fx.number("=LN(EXP(1))"), 1e-12);
        assertEquals(1.0, fx.eval("=MOD(-5, 3)"));
        assertEquals(-1.0, fx.eval("=MOD(5, -3)"));
    }

    @Test
    void testSumIfAndCountIf() {
        fx.set("C1", "Seed").set("D1", 100)
                .set("C2", "Series A").set("D2", 400)
                .set("C3", "seed").set("D3", 50);
        assertEquals(150.0, fx.eval("=SUMIF(C1:C3, \"Seed\", D1:D3)"));
        assertEquals(500.0, fx.eval("=SUMIF(D1:D3, \">=100\")"));
        assertEquals(400.0, fx.eval("=SUMIF(C1:C3, \"Series*\", D1:D3)"));
        assertEquals(2.0, fx.eval("=COUNTIF(C1:C3, \"seed\")"));
        assertEquals(1.0, fx.eval("=COUNTIF(D1:D3, \"<100\")"));
        assertEquals(2.0, fx.eval("=COUNTIF(D1:D3, \"<>50\")"));
    }
}
