package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.RangeValue;
import com.dealgrid.app.formula.Values;
import com.dealgrid.app.models.CellError;


/**
 * VLOOKUP, HLOOKUP, INDEX and MATCH. Indexes are 1-based within the range.
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("VLOOKUP", 3, 4, args -> {
            Object wanted = args.scalar(0);
            RangeValue table = args.range(1);
            int column = args.integer(2);
            boolean exact = args.bool(3, true);
            if (column < 1 || column > table.getColumnCount()) {
                throw new FormulaException(CellError.REF, "Column index out of range: " + column);
            }
            for (int row = 0; row < table.getRowCount(); row++) {
                if (matches(table.get(row, 0), wanted, exact)) {
                    return table.get(row, column - 1);
                }
            }
            throw new FormulaException(CellError.NA);
        });
        library.register("HLOOKUP", 3, 4, args -> {
            Object wanted = args.scalar(0);
            RangeValue table = args.range(1);
            int row = args.integer(2);
            boolean exact = args.bool(3, true);
            if (row < 1 || row > table.getRowCount()) {
                throw new FormulaException(CellError.REF, "Row index out of range: " + row);
            }
            for (int column = 0; column < table.getColumnCount(); column++) {
                if (matches(table.get(0, column), wanted, exact)) {
                    return table.get(row - 1, column);
                }
            }
            throw new FormulaException(CellError.NA);
        });
        library.register("INDEX", 2, 3, args -> {
            RangeValue range = args.range(0);
            int row = args.integer(1);
            int column;
            if (args.has(2)) {
                column = args.integer(2);
            } else if (range.getRowCount() == 1 && range.getColumnCount() > 1) {
                // INDEX(A1:E1, 3) picks along the row
                column = row;
                row = 1;
            } else {
                column = 1;
            }
            if (row < 1 || row > range.getRowCount() || column < 1 || column > range.getColumnCount()) {
                throw new FormulaException(CellError.REF, "Index out of range");
            }
            return range.get(row - 1, column - 1);
        });
        library.register("MATCH", 2, 3, args -> {
            Object wanted = args.scalar(0);
            RangeValue range = args.range(1);
            int type = (int) args.number(2, 1);
            int length;
            boolean byRow;
            if (range.getColumnCount() == 1) {
                length = range.getRowCount();
                byRow = true;
            } else if (range.getRowCount() == 1) {
                length = range.getColumnCount();
                byRow = false;
            } else {
                throw new FormulaException(CellError.NA, "MATCH needs a single row or column");
            }
            int best = -1;
            for (int i = 0; i < length; i++) {
                Object candidate = byRow ? range.get(i, 0) : range.get(0, i);
                if (candidate == null || Values.isError(candidate)) {
                    continue;
                }
                if (type == 0) {
                    if (Values.equalsValue(candidate, wanted)) {
                        return (double) (i + 1);
                    }
                    continue;
                }
                int cmp = Values.compare(candidate, wanted);
                if (cmp == 0) {
                    return (double) (i + 1);
                }
                if (type > 0 ? cmp < 0 : cmp > 0) {
                    best = i;
                } else {
                    // Sorted input: once past the lookup value nothing later can qualify
                    break;
                }
            }
            if (best < 0) {
                throw new FormulaException(CellError.NA);
            }
            return (double) (best + 1);
        });
    }

    // Inexact lookups match when the key's text contains the wanted text, case-sensitively
    private static boolean matches(Object key, Object wanted, boolean exact) {
        if (key == null || Values.isError(key)) {
            return false;
        }
        if (exact) {
            return Values.equalsValue(key, wanted);
        }
        return Values.toText(key).contains(Values.toText(wanted));
    }
}
