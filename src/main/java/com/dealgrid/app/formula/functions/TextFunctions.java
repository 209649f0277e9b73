package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.Values;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.CellValues;
import org.apache.commons.lang3.StringUtils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

import static com.dealgrid.app.formula.functions.FunctionLibrary.VARIADIC;

/**
 * Text functions. Positions are 1-based; FIND is case-sensitive, SEARCH is not.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("CONCATENATE", 1, VARIADIC, args -> {
            StringBuilder sb = new StringBuilder();
            for (Object value : args.flatten()) {
                sb.append(Values.toText(value));
            }
            return sb.toString();
        });
        library.register("LEN", 1, 1, args -> (double) args.text(0).length());
        library.register("UPPER", 1, 1, args -> args.text(0).toUpperCase(Locale.ROOT));
        library.register("LOWER", 1, 1, args -> args.text(0).toLowerCase(Locale.ROOT));
        library.register("PROPER", 1, 1, args -> proper(args.text(0)));
        library.register("TRIM", 1, 1, args -> StringUtils.normalizeSpace(args.text(0)));
        library.register("LEFT", 1, 2, args -> {
            String text = args.text(0);
            return StringUtils.left(text, count(args.number(1, 1)));
        });
        library.register("RIGHT", 1, 2, args -> {
            String text = args.text(0);
            return StringUtils.right(text, count(args.number(1, 1)));
        });
        library.register("MID", 3, 3, args -> {
            String text = args.text(0);
            int start = (int) args.number(1);
            int length = count(args.number(2));
            if (start < 1) {
                throw new FormulaException(CellError.ERROR);
            }
            return StringUtils.mid(text, start - 1, length);
        });
        library.register("FIND", 2, 3, args -> {
            String needle = args.text(0);
            String haystack = args.text(1);
            int start = (int) args.number(2, 1);
            return position(haystack, needle, start, false);
        });
        library.register("SEARCH", 2, 3, args -> {
            String needle = args.text(0);
            String haystack = args.text(1);
            int start = (int) args.number(2, 1);
            return position(haystack, needle, start, true);
        });
        library.register("SUBSTITUTE", 3, 4, args -> {
            String text = args.text(0);
            String oldText = args.text(1);
            String newText = args.text(2);
            if (!args.has(3)) {
                return StringUtils.replace(text, oldText, newText);
            }
            int instance = (int) args.number(3);
            if (instance < 1) {
                throw new FormulaException(CellError.ERROR);
            }
            int index = StringUtils.ordinalIndexOf(text, oldText, instance);
            if (index < 0 || oldText.isEmpty()) {
                return text;
            }
            return text.substring(0, index) + newText + text.substring(index + oldText.length());
        });
        library.register("REPLACE", 4, 4, args -> {
            String text = args.text(0);
            int start = (int) args.number(1);
            int length = count(args.number(2));
            String replacement = args.text(3);
            if (start < 1) {
                throw new FormulaException(CellError.ERROR);
            }
            int from = Math.min(start - 1, text.length());
            int to = Math.min(from + length, text.length());
            return text.substring(0, from) + replacement + text.substring(to);
        });
        library.register("TEXT", 2, 2, args -> {
            double value = args.number(0);
            String pattern = args.text(1);
            try {
                return new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.US)).format(value);
            } catch (IllegalArgumentException e) {
                throw new FormulaException(CellError.ERROR, "Bad format: " + pattern);
            }
        });
        library.register("VALUE", 1, 1, args -> {
            Object value = args.scalar(0);
            if (value instanceof Double) {
                return value;
            }
            Double parsed = CellValues.parseNumber(Values.toText(value));
            if (parsed == null) {
                throw new FormulaException(CellError.ERROR, "Not a number: " + value);
            }
            return parsed;
        });
    }

    private static int count(double n) {
        if (n < 0) {
            throw new FormulaException(CellError.ERROR);
        }
        return (int) n;
    }

    private static double position(String haystack, String needle, int start, boolean ignoreCase) {
        if (start < 1 || start > haystack.length() + 1) {
            throw new FormulaException(CellError.ERROR);
        }
        int index = ignoreCase
                ? StringUtils.indexOfIgnoreCase(haystack, needle, start - 1)
                : StringUtils.indexOf(haystack, needle, start - 1);
        if (index < 0) {
            throw new FormulaException(CellError.ERROR, "Text not found: " + needle);
        }
        return index + 1;
    }

    // Upper-cases the first letter of every run of letters
    private static String proper(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean previousLetter = false;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }
}
