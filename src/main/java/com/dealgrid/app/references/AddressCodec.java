package com.dealgrid.app.references;

import com.dealgrid.app.exceptions.InvalidAddressException;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellRange;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between A1-style text addresses and integer coordinates.
 * Columns use bijective base 26: column 1 is "A", 26 is "Z", 27 is "AA".
 * Rows are 1-based.
 */
public final class AddressCodec {

    public static final int MAX_COLUMN = 18278; // "ZZZ"
    public static final int MAX_ROW = 1_048_576;

    // "$A$1", "b12", "AA100"
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?(\\d{1,7})$");

    private AddressCodec() {
    }

    /**
     * Converts column letters to a 1-based column index.
     */
    public static int toIndex(String letters) {
        if (letters == null || letters.isEmpty() || letters.length() > 3) {
            throw new InvalidAddressException("Invalid column letters: " + letters);
        }
        int index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new InvalidAddressException("Invalid column letters: " + letters);
            }
            index = index * 26 + (c - 'A' + 1);
        }
        return index;
    }

    /**
     * Converts a 1-based column index to its letters.
     */
    public static String toLetters(int index) {
        if (index < 1 || index > MAX_COLUMN) {
            throw new InvalidAddressException("Column index out of range: " + index);
        }
        StringBuilder sb = new StringBuilder();
        int n = index;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Parses "A1" (optionally with $ markers) into a CellAddress.
     */
    public static CellAddress parseAddress(String text) {
        if (text == null) {
            throw new InvalidAddressException("Address is null");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidAddressException("Invalid cell address: " + text);
        }
        int column = toIndex(matcher.group(1));
        int row = Integer.parseInt(matcher.group(2));
        if (row < 1 || row > MAX_ROW || column > MAX_COLUMN) {
            throw new InvalidAddressException("Cell address out of range: " + text);
        }
        return new CellAddress(column, row);
    }

    public static boolean isAddress(String text) {
        if (text == null) {
            return false;
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return false;
        }
        int row = Integer.parseInt(matcher.group(2));
        return row >= 1 && row <= MAX_ROW;
    }

    /**
     * Parses "A1:B3" into a normalized range. A single address yields a 1x1 range.
     */
    public static CellRange parseRange(String text) {
        if (text == null) {
            throw new InvalidAddressException("Range is null");
        }
        String trimmed = text.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            CellAddress single = parseAddress(trimmed);
            return new CellRange(single, single);
        }
        if (trimmed.indexOf(':', colon + 1) >= 0) {
            throw new InvalidAddressException("Invalid range: " + text);
        }
        return new CellRange(parseAddress(trimmed.substring(0, colon)), parseAddress(trimmed.substring(colon + 1)));
    }

    /**
     * Expands "A1:B3" into its addresses in row-major order.
     */
    public static List<CellAddress> expandRange(String text) {
        return parseRange(text).addresses();
    }

    public static String format(int column, int row) {
        return toLetters(column) + row;
    }

    public static String normalize(String address) {
        return parseAddress(address).toString().toUpperCase(Locale.ROOT);
    }
}
