package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.RangeValue;
import com.dealgrid.app.formula.Values;
import com.dealgrid.app.models.CellError;

import static com.dealgrid.app.formula.functions.FunctionLibrary.VARIADIC;

/**
 * IF, IFERROR, AND and OR only evaluate the arguments they need.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("IF", 2, 3, args -> {
            if (args.bool(0)) {
                return args.get(1);
            }
            return args.has(2) ? args.get(2) : Boolean.FALSE;
        });
        library.register("AND", 1, VARIADIC, args -> {
            boolean seen = false;
            for (int i = 0; i < args.size(); i++) {
                Boolean value = logical(args.get(i), true);
                if (value == null) {
                    continue;
                }
                seen = true;
                if (!value) {
                    return Boolean.FALSE;
                }
            }
            if (!seen) {
                throw new FormulaException(CellError.ERROR);
            }
            return Boolean.TRUE;
        });
        library.register("OR", 1, VARIADIC, args -> {
            boolean seen = false;
            for (int i = 0; i < args.size(); i++) {
                Boolean value = logical(args.get(i), false);
                if (value == null) {
                    continue;
                }
                seen = true;
                if (value) {
                    return Boolean.TRUE;
                }
            }
            if (!seen) {
                throw new FormulaException(CellError.ERROR);
            }
            return Boolean.FALSE;
        });
        library.register("NOT", 1, 1, args -> !args.bool(0));
        library.register("IFERROR", 2, 2, args -> {
            Object value = args.get(0);
            return value instanceof CellError ? args.get(1) : value;
        });
        library.register("ISERROR", 1, 1, args -> args.get(0) instanceof CellError);
        library.register("ISBLANK", 1, 1, args -> args.get(0) == null);
        library.register("ISNUMBER", 1, 1, args -> args.get(0) instanceof Double);
        library.register("ISTEXT", 1, 1, args -> args.get(0) instanceof String);
        library.register("TRUE", 0, 0, args -> Boolean.TRUE);
        library.register("FALSE", 0, 0, args -> Boolean.FALSE);
    }

    /**
     * Combined truth of one argument (all members for AND, any member for OR),
     * or null when it holds nothing logical. Inside ranges text and blanks are skipped;
     * a scalar must coerce.
     */
    private static Boolean logical(Object value, boolean all) {
        if (value instanceof RangeValue) {
            Boolean combined = null;
            for (Object member : ((RangeValue) value).values()) {
                if (member instanceof CellError) {
                    throw new FormulaException((CellError) member);
                }
                if (member instanceof Boolean || member instanceof Double) {
                    boolean b = Values.toBoolean(member);
                    combined = combined == null ? b : (all ? combined && b : combined || b);
                }
            }
            return combined;
        }
        if (value == null) {
            return null;
        }
        return Values.toBoolean(value);
    }
}
