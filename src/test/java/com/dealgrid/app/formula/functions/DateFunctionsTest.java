package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaFixture;
import com.dealgrid.app.models.CellError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DateFunctionsTest {

    private FormulaFixture fx;

    @BeforeEach
    void setUp() {
        fx = new FormulaFixture();
    }

    @Test
    void testTodayAndNowReadTheClock() {
        assertEquals("2024-06-30", fx.eval("=TODAY()"));
        assertEquals("2024-06-30 09:30:00", fx.eval("=NOW()"));
    }

    @Test
    void testDateRollsOverflowForward() {
        assertEquals("2024-03-31", fx.eval("=DATE(2024, 3, 31)"));
        assertEquals("2025-02-01", fx.eval("=DATE(2024, 14, 1)"));
        assertEquals("2024-03-01", fx.eval("=DATE(2024, 2, 30)"));
    }

    @Test
    void testDateParts() {
        fx.set("A1", "2023-11-15");
        assertEquals(2023.0, fx.eval("=YEAR(A1)"));
        assertEquals(11.0, fx.eval("=MONTH(A1)"));
        assertEquals(15.0, fx.eval("=DAY(A1)"));
        // serial 45000 is 2023-03-15
        assertEquals(3.0, fx.eval("=MONTH(45000)"));
        assertEquals(CellError.ERROR, fx.eval("=YEAR(\"soon\")"));
    }

    @Test
    void testDatedif() {
        fx.set("A1", "2021-01-15").set("A2", "2024-06-30");
        assertEquals(1262.0, fx.eval("=DATEDIF(A1, A2, \"D\")"));
        assertEquals(41.0, fx.eval("=DATEDIF(A1, A2, \"M\")"));
        assertEquals(3.0, fx.eval("=DATEDIF(A1, A2, \"y\")"));
        assertEquals(CellError.ERROR, fx.eval("=DATEDIF(A2, A1, \"D\")"));
        assertEquals(CellError.ERROR, fx.eval("=DATEDIF(A1, A2, \"W\")"));
    }
}
