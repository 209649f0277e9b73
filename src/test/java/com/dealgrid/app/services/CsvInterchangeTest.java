package com.dealgrid.app.services;

import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.CellStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvInterchangeTest {

    private CellStore store;

    @BeforeEach
    void setUp() {
        store = new CellStore(Clock.systemUTC(), 10);
    }

    @Test
    void testExportWritesDisplayTextRowByRow() {
        store.write(CellAddress.of("A1"), "Holder", null);
        store.write(CellAddress.of("B1"), "Shares", null);
        store.write(CellAddress.of("A2"), "Founders", null);
        store.write(CellAddress.of("B2"), 8000000, null);
        store.write(CellAddress.of("C2"), true, null);

        assertEquals("Holder,Shares\r\nFounders,8000000,TRUE\r\n", CsvInterchange.export(store));
    }

    @Test
    void testExportQuotesSpecialCharacters() {
        store.write(CellAddress.of("A1"), "Smith, Jones & Co", null);
        store.write(CellAddress.of("B1"), "the \"lead\"", null);

        assertEquals("\"Smith, Jones & Co\",\"the \"\"lead\"\"\"\r\n", CsvInterchange.export(store));
    }

    @Test
    void testExportPadsGapsAndSkipsStyleOnlyRows() {
        store.write(CellAddress.of("C1"), 5, null);
        store.getOrCreate(CellAddress.of("A4")).mergeStyle(Map.of("bold", true));

        assertEquals(",,5\r\n", CsvInterchange.export(store));
        assertEquals("", CsvInterchange.export(new CellStore(Clock.systemUTC(), 10)));
    }

    @Test
    void testParseHandlesQuotedFields() {
        List<List<String>> rows = CsvInterchange.parse("a,\"b,c\"\r\n\"say \"\"hi\"\"\",d\r\n");
        assertEquals(2, rows.size());
        assertEquals(Arrays.asList("a", "b,c"), rows.get(0));
        assertEquals(Arrays.asList("say \"hi\"", "d"), rows.get(1));
        assertTrue(CsvInterchange.parse("").isEmpty());
    }

    @Test
    void testLoadParsesLiterals() {
        List<CellAddress> written = CsvInterchange.load(store, CsvInterchange.parse("Round,Amount\nSeed,1500000\nBridge,,#N/A\n"));

        assertEquals(6, written.size());
        assertEquals("Round", store.readValue(CellAddress.of("A1")));
        assertEquals(1500000.0, store.readValue(CellAddress.of("B2")));
        assertNull(store.read(CellAddress.of("B3")));
        assertEquals(CellError.NA, store.readValue(CellAddress.of("C3")));
    }
}
