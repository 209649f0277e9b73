package com.dealgrid.app.models;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the sparse cell map of one sheet.
 */
class CellStoreTest {

    private CellStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);
        store = new CellStore(clock, 3);
    }

    @Test
    void testLiteralWriteClearsFormula() {
        CellAddress a1 = CellAddress.of("A1");
        store.write(a1, null, "=1+1");
        assertTrue(store.read(a1).hasFormula());
        assertEquals(CellType.FORMULA, store.read(a1).getType());

        store.write(a1, 5, null);
        Cell cell = store.read(a1);
        assertFalse(cell.hasFormula());
        assertEquals(5.0, cell.getValue());
        assertEquals(CellType.NUMBER, cell.getType());
    }

    @Test
    void testHistoryKeepsPriorValuesUpToTheLimit() {
        CellAddress a1 = CellAddress.of("A1");
        for (int i = 1; i <= 5; i++) {
            store.write(a1, (double) i, null);
        }
        List<CellHistoryEntry> history = store.read(a1).getHistory();
        assertEquals(3, history.size());
        // oldest entries dropped: priors were null, 1, 2, 3, 4
        assertEquals(2.0, history.get(0).getValue());
        assertEquals(4.0, history.get(2).getValue());
        assertEquals(Instant.parse("2024-06-30T12:00:00Z"), history.get(2).getTimestamp());
    }

    @Test
    void testWriteRangeClipsAndDetectsFormulas() {
        List<List<Object>> matrix = Arrays.asList(
                Arrays.<Object>asList(1, 2, 3),
                Arrays.<Object>asList("=A1+B1", "x"),
                Arrays.<Object>asList(9));
        List<CellAddress> written = store.writeRange(CellRange.of("A1:B2"), matrix);

        assertEquals(4, written.size());
        assertNull(store.read(CellAddress.of("C1")));
        assertNull(store.read(CellAddress.of("A3")));
        assertEquals("=A1+B1", store.read(CellAddress.of("A2")).getFormula());
        assertEquals("x", store.readValue(CellAddress.of("B2")));
    }

    @Test
    void testClearRangeRemovesOnlyCellsInside() {
        store.write(CellAddress.of("A1"), 1, null);
        store.write(CellAddress.of("B2"), 2, null);
        store.write(CellAddress.of("C3"), 3, null);

        assertEquals(2, store.clearRange(CellRange.of("A1:B2")));
        assertEquals(1, store.size());
        assertEquals(3.0, store.readValue(CellAddress.of("C3")));
    }

    @Test
    void testCopyRangeKeepsFormulaTextAndAttributes() {
        store.write(CellAddress.of("A1"), 10, null).setComment("seed");
        store.write(CellAddress.of("A2"), null, "=A1*2");

        List<CellAddress> targets = store.copyRange(CellRange.of("A1:A2"), CellAddress.of("C5"));

        assertEquals(Arrays.asList(CellAddress.of("C5"), CellAddress.of("C6")), targets);
        assertEquals(10.0, store.readValue(CellAddress.of("C5")));
        assertEquals("seed", store.read(CellAddress.of("C5")).getComment());
        assertEquals("=A1*2", store.read(CellAddress.of("C6")).getFormula());
    }

    @Test
    void testFindMatchesDisplayAndFormulaIgnoringCase() {
        store.write(CellAddress.of("A1"), "Revenue", null);
        store.write(CellAddress.of("B1"), null, "=SUM(A2:A9)");
        store.write(CellAddress.of("C1"), 7, null);

        assertEquals(Arrays.asList(CellAddress.of("A1")), store.find("revenue"));
        assertEquals(Arrays.asList(CellAddress.of("B1")), store.find("sum("));
        assertTrue(store.find("").isEmpty());
    }

    @Test
    void testSnapshotIsIndependentOfLaterWrites() {
        store.write(CellAddress.of("A1"), 1, null);
        NavigableMap<CellAddress, Cell> snapshot = store.snapshot();

        store.write(CellAddress.of("A1"), 2, null);
        store.write(CellAddress.of("B1"), 3, null);
        assertEquals(1.0, snapshot.get(CellAddress.of("A1")).getValue());

        store.restore(snapshot);
        assertEquals(1, store.size());
        assertEquals(1.0, store.readValue(CellAddress.of("A1")));
    }

    @Test
    void testStyleMergeKeepsExistingKeys() {
        Cell cell = store.getOrCreate(CellAddress.of("A1"));
        cell.mergeStyle(Map.of("bold", true));
        cell.mergeStyle(Map.of("color", "red"));
        assertEquals(true, cell.getStyle().get("bold"));
        assertEquals("red", cell.getStyle().get("color"));
    }
}
