package com.dealgrid.app.services;

import com.dealgrid.app.models.Cell;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellStore;
import com.dealgrid.app.models.CellValues;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CSV export and import of one sheet's cells, RFC 4180 quoting.
 *
 * Export writes display text. Rows run to the last populated row and each row stops at
 * its last populated column. Import reads fields back as literals and re-infers the type.
 */
public final class CsvInterchange {

    private static final String LINE_END = "\r\n";

    private CsvInterchange() {
    }

    public static String export(CellStore store) {
        int lastRow = 0;
        for (Cell cell : store.cells()) {
            lastRow = Math.max(lastRow, cell.getAddress().getRow());
        }
        List<List<String>> rows = new ArrayList<>();
        for (int r = 0; r < lastRow; r++) {
            rows.add(new ArrayList<>());
        }
        for (Cell cell : store.cells()) {
            if (cell.getValue() == null) {
                continue;
            }
            List<String> row = rows.get(cell.getAddress().getRow() - 1);
            int column = cell.getAddress().getColumn();
            while (row.size() < column) {
                row.add("");
            }
            row.set(column - 1, CellValues.display(cell.getValue()));
        }
        // Style-only cells leave nothing to export at the bottom
        while (!rows.isEmpty() && rows.get(rows.size() - 1).isEmpty()) {
            rows.remove(rows.size() - 1);
        }

        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out, ICSVWriter.DEFAULT_SEPARATOR, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER, LINE_END)) {
            for (List<String> row : rows) {
                writer.writeNext(row.toArray(new String[0]), false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Splits CSV text into rows of raw fields.
     *
     * @throws IllegalArgumentException when the text is not valid CSV
     */
    public static List<List<String>> parse(String text) {
        List<List<String>> rows = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return rows;
        }
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            for (String[] fields : reader.readAll()) {
                rows.add(new ArrayList<>(Arrays.asList(fields)));
            }
        } catch (IOException | CsvException e) {
            throw new IllegalArgumentException("Malformed CSV: " + e.getMessage(), e);
        }
        return rows;
    }

    /**
     * Writes the parsed rows into an empty store starting at A1 and returns the
     * addresses written. Empty fields stay blank.
     */
    public static List<CellAddress> load(CellStore store, List<List<String>> rows) {
        List<CellAddress> written = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                Object value = CellValues.parseLiteral(row.get(c));
                if (value == null) {
                    continue;
                }
                CellAddress address = new CellAddress(c + 1, r + 1);
                store.write(address, value, null);
                written.add(address);
            }
        }
        return written;
    }
}
