package com.dealgrid.app.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellValuesTest {

    @Test
    void testDisplayText() {
        assertEquals("", CellValues.display(null));
        assertEquals("6", CellValues.display(6.0));
        assertEquals("0.25", CellValues.display(0.25));
        assertEquals("0", CellValues.display(-0.0));
        assertEquals("TRUE", CellValues.display(true));
        assertEquals("#N/A", CellValues.display(CellError.NA));
        assertEquals("#ERROR!", CellValues.display(Double.NaN));
        assertEquals("Revenue", CellValues.display("Revenue"));
    }

    @Test
    void testInferType() {
        assertEquals(CellType.NUMBER, CellValues.inferType(12.0));
        assertEquals(CellType.NUMBER, CellValues.inferType("12.5"));
        assertEquals(CellType.CURRENCY, CellValues.inferType("$1,200.50"));
        assertEquals(CellType.PERCENTAGE, CellValues.inferType("15%"));
        assertEquals(CellType.DATE, CellValues.inferType("2024-03-31"));
        assertEquals(CellType.LINK, CellValues.inferType("https://example.com"));
        assertEquals(CellType.BOOLEAN, CellValues.inferType(false));
        assertEquals(CellType.TEXT, CellValues.inferType("Series A"));
    }

    @Test
    void testParseNumberUnderstandsFinancialNotation() {
        assertEquals(1234.5, CellValues.parseNumber("1,234.5"));
        assertEquals(1000.0, CellValues.parseNumber("$1,000"));
        assertEquals(-12.0, CellValues.parseNumber("-12"));
        assertEquals(0.15, CellValues.parseNumber("15%"), 1e-12);
        assertNull(CellValues.parseNumber("abc"));
        assertNull(CellValues.parseNumber("  "));
    }

    @Test
    void testParseLiteral() {
        assertNull(CellValues.parseLiteral(""));
        assertEquals(Boolean.TRUE, CellValues.parseLiteral("true"));
        assertEquals(CellError.REF, CellValues.parseLiteral("#REF!"));
        assertEquals(42.0, CellValues.parseLiteral("42"));
        assertEquals("$1,000", CellValues.parseLiteral("$1,000"));
        assertEquals("Seed round", CellValues.parseLiteral("Seed round"));
    }
}
