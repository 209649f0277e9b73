package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaFixture;
import com.dealgrid.app.models.CellError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lookups over a small cap table:
 * A: holder, B: shares, C: class.
 */
class LookupFunctionsTest {

    private FormulaFixture fx;

    @BeforeEach
    void setUp() {
        fx = new FormulaFixture();
        fx.set("A1", "Founders").set("B1", 8000000).set("C1", "Common")
                .set("A2", "Seed Fund").set("B2", 1500000).set("C2", "Preferred")
                .set("A3", "Series A Lead").set("B3", 2500000).set("C3", "Preferred");
    }

    @Test
    void testVlookupDefaultsToExactMatch() {
        assertEquals(1500000.0, fx.eval("=VLOOKUP(\"seed fund\", A1:C3, 2)"));
        assertEquals("Common", fx.eval("=VLOOKUP(\"Founders\", A1:C3, 3, TRUE)"));
        assertEquals(CellError.NA, fx.eval("=VLOOKUP(\"Seed\", A1:C3, 2)"));
    }

    @Test
    void testInexactVlookupMatchesContainedText() {
        assertEquals(1500000.0, fx.eval("=VLOOKUP(\"Seed\", A1:C3, 2, FALSE)"));
        assertEquals(2500000.0, fx.eval("=VLOOKUP(\"Lead\", A1:C3, 2, FALSE)"));
    }

    @Test
    void testInexactVlookupIsCaseSensitive() {
        assertEquals(CellError.NA, fx.eval("=VLOOKUP(\"seed\", A1:C3, 2, FALSE)"));
        assertEquals(CellError.NA, fx.eval("=VLOOKUP(\"LEAD\", A1:C3, 2, FALSE)"));
    }

    @Test
    void testLookupIndexOutOfRangeIsRef() {
        assertEquals(CellError.REF, fx.eval("=VLOOKUP(\"Founders\", A1:C3, 4)"));
        assertEquals(CellError.REF, fx.eval("=VLOOKUP(\"Founders\", A1:C3, 0)"));
        assertEquals(CellError.REF, fx.eval("=HLOOKUP(\"Founders\", A1:C3, 5)"));
    }

    @Test
    void testHlookup() {
        assertEquals(8000000.0, fx.eval("=HLOOKUP(8000000, A1:C3, 1)"));
        assertEquals("Preferred", fx.eval("=HLOOKUP(\"Common\", A1:C3, 2)"));
        assertEquals(CellError.NA, fx.eval("=HLOOKUP(\"Other\", A1:C3, 2)"));
    }

    @Test
    void testIndex() {
        assertEquals("Seed Fund", fx.eval("=INDEX(A1:C3, 2, 1)"));
        assertEquals(2500000.0, fx.eval("=INDEX(B1:B3, 3)"));
        assertEquals("Common", fx.eval("=INDEX(A1:C1, 3)"));
        assertEquals(CellError.REF, fx.eval("=INDEX(A1:C3, 4, 1)"));
    }

    @Test
    void testMatch() {
        assertEquals(3.0, fx.eval("=MATCH(\"series a lead\", A1:A3, 0)"));
        assertEquals(CellError.NA, fx.eval("=MATCH(\"Angel\", A1:A3, 0)"));

        fx.set("E1", 10).set("E2", 20).set("E3", 30);
        assertEquals(2.0, fx.eval("=MATCH(25, E1:E3)"));
        assertEquals(3.0, fx.eval("=MATCH(30, E1:E3, 1)"));
        assertEquals(CellError.NA, fx.eval("=MATCH(5, E1:E3, 1)"));

        fx.set("F1", 30).set("F2", 20).set("F3", 10);
        assertEquals(2.0, fx.eval("=MATCH(15, F1:F3, -1)"));
    }

    @Test
    void testIndexMatchTogether() {
        assertEquals(2500000.0, fx.eval("=INDEX(B1:B3, MATCH(\"Series A Lead\", A1:A3, 0))"));
    }
}
