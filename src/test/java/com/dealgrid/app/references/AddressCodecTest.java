package com.dealgrid.app.references;

import com.dealgrid.app.exceptions.InvalidAddressException;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AddressCodecTest {

    @Test
    void testColumnLettersAreBijectiveBase26() {
        assertEquals(1, AddressCodec.toIndex("A"));
        assertEquals(26, AddressCodec.toIndex("Z"));
        assertEquals(27, AddressCodec.toIndex("AA"));
        assertEquals(702, AddressCodec.toIndex("ZZ"));
        assertEquals(703, AddressCodec.toIndex("AAA"));

        assertEquals("A", AddressCodec.toLetters(1));
        assertEquals("Z", AddressCodec.toLetters(26));
        assertEquals("AA", AddressCodec.toLetters(27));
        assertEquals("ZZZ", AddressCodec.toLetters(AddressCodec.MAX_COLUMN));
    }

    @Test
    void testEveryColumnSurvivesTheConversion() {
        for (int i = 1; i <= AddressCodec.MAX_COLUMN; i++) {
            assertEquals(i, AddressCodec.toIndex(AddressCodec.toLetters(i)));
        }
    }

    @Test
    void testParseAddressAcceptsDollarsAndLowerCase() {
        CellAddress address = AddressCodec.parseAddress("$b$12");
        assertEquals(2, address.getColumn());
        assertEquals(12, address.getRow());
        assertEquals("B12", AddressCodec.normalize("b12"));
    }

    @Test
    void testInvalidAddressesAreRejected() {
        assertThrows(InvalidAddressException.class, () -> AddressCodec.parseAddress("A0"));
        assertThrows(InvalidAddressException.class, () -> AddressCodec.parseAddress("1A"));
        assertThrows(InvalidAddressException.class, () -> AddressCodec.parseAddress("ABCD1"));
        assertThrows(InvalidAddressException.class, () -> AddressCodec.parseAddress(""));
        assertThrows(InvalidAddressException.class, () -> AddressCodec.toLetters(0));
        assertFalse(AddressCodec.isAddress("Revenue"));
        assertTrue(AddressCodec.isAddress("AA100"));
    }

    @Test
    void testRangeIsNormalizedAndExpandedRowMajor() {
        CellRange range = AddressCodec.parseRange("B2:A1");
        assertEquals("A1:B2", range.toString());

        List<CellAddress> cells = AddressCodec.expandRange("A1:B2");
        assertEquals(4, cells.size());
        assertEquals("A1", cells.get(0).toString());
        assertEquals("B1", cells.get(1).toString());
        assertEquals("A2", cells.get(2).toString());
        assertEquals("B2", cells.get(3).toString());
    }

    @Test
    void testSingleAddressIsAOneCellRange() {
        CellRange range = AddressCodec.parseRange("C3");
        assertTrue(range.isSingleCell());
        assertThrows(InvalidAddressException.class, () -> AddressCodec.parseRange("A1:B2:C3"));
    }
}
