package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaFixture;
import com.dealgrid.app.models.CellError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextFunctionsTest {

    private FormulaFixture fx;

    @BeforeEach
    void setUp() {
        fx = new FormulaFixture();
        fx.set("A1", "Series A").set("A2", 1500000);
    }

    @Test
    void testCaseAndLength() {
        assertEquals("SERIES A", fx.eval("=UPPER(A1)"));
        assertEquals("series a", fx.eval("=LOWER(A1)"));
        assertEquals("Acme Capital Partners", fx.eval("=PROPER(\"acme CAPITAL partners\")"));
        assertEquals(8.0, fx.eval("=LEN(A1)"));
        assertEquals("a b", fx.eval("=TRIM(\"  a   b \")"));
    }

    @Test
    void testConcatenateFormatsNumbersLikeTheGrid() {
        assertEquals("Series A: 1500000", fx.eval("=CONCATENATE(A1, \": \", A2)"));
    }

    @Test
    void testSubstrings() {
        assertEquals("Ser", fx.eval("=LEFT(A1, 3)"));
        assertEquals("S", fx.eval("=LEFT(A1)"));
        assertEquals("s A", fx.eval("=RIGHT(A1, 3)"));
        assertEquals("rie", fx.eval("=MID(A1, 3, 3)"));
        assertEquals(CellError.ERROR, fx.eval("=MID(A1, 0, 3)"));
    }

    @Test
    void testFindIsCaseSensitiveAndSearchIsNot() {
        assertEquals(8.0, fx.eval("=FIND(\"A\", A1)"));
        assertEquals(CellError.ERROR, fx.eval("=FIND(\"a\", \"XYZ\")"));
        assertEquals(1.0, fx.eval("=SEARCH(\"s\", A1)"));
        assertEquals(6.0, fx.eval("=SEARCH(\"s\", A1, 2)"));
    }

    @Test
    void testSubstituteAndReplace() {
        assertEquals("a-b-c", fx.eval("=SUBSTITUTE(\"a b c\", \" \", \"-\")"));
        assertEquals("a b-c", fx.eval("=SUBSTITUTE(\"a b c\", \" \", \"-\", 2)"));
        assertEquals("Series B", fx.eval("=REPLACE(A1, 8, 1, \"B\")"));
    }

    @Test
    void testTextAndValue() {
        assertEquals("1,500,000.00", fx.eval("=TEXT(A2, \"#,##0.00\")"));
        assertEquals("25%", fx.eval("=TEXT(0.25, \"0%\")"));
        assertEquals(1234.5, fx.eval("=VALUE(\"1,234.5\")"));
        assertEquals(CellError.ERROR, fx.eval("=VALUE(\"abc\")"));
    }
}
