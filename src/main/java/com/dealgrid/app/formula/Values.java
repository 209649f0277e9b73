package com.dealgrid.app.formula;

import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.CellValues;

import java.util.Locale;

/**
 * Coercion and comparison rules for evaluation values:
 * Double, String, Boolean, CellError, RangeValue, or null for blank.
 * Every coercion rethrows an error operand as a FormulaException carrying it.
 */
public final class Values {

    private Values() {
    }

    public static boolean isError(Object value) {
        return value instanceof CellError;
    }

    /**
     * Returns the scalar itself, unwrapping 1x1 ranges. Larger ranges are an error here.
     */
    public static Object scalar(Object value) {
        if (value instanceof RangeValue) {
            RangeValue range = (RangeValue) value;
            if (range.isSingleCell()) {
                return range.get(0, 0);
            }
            throw new FormulaException(CellError.ERROR, "Range used where a single value is expected");
        }
        return value;
    }

    public static double toNumber(Object value) {
        Object v = scalar(value);
        if (v == null) {
            return 0.0;
        }
        if (v instanceof Double) {
            return (Double) v;
        }
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        if (v instanceof Boolean) {
            return ((Boolean) v) ? 1.0 : 0.0;
        }
        if (v instanceof CellError) {
            throw new FormulaException((CellError) v);
        }
        Double parsed = CellValues.parseNumber(v.toString());
        if (parsed == null) {
            throw new FormulaException(CellError.ERROR, "Not a number: " + v);
        }
        return parsed;
    }

    /**
     * Numeric view of an aggregate member, or null when it is skipped
     * (blank, boolean, non-numeric text). Errors propagate.
     */
    public static Double aggregateNumber(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof CellError) {
            throw new FormulaException((CellError) value);
        }
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return CellValues.parseNumber(value.toString());
    }

    public static String toText(Object value) {
        Object v = scalar(value);
        if (v instanceof CellError) {
            throw new FormulaException((CellError) v);
        }
        return CellValues.display(v);
    }

    public static boolean toBoolean(Object value) {
        Object v = scalar(value);
        if (v == null) {
            return false;
        }
        if (v instanceof Boolean) {
            return (Boolean) v;
        }
        if (v instanceof Double) {
            return (Double) v != 0.0;
        }
        if (v instanceof CellError) {
            throw new FormulaException((CellError) v);
        }
        String text = v.toString().trim();
        if ("TRUE".equalsIgnoreCase(text)) {
            return true;
        }
        if ("FALSE".equalsIgnoreCase(text)) {
            return false;
        }
        Double parsed = CellValues.parseNumber(text);
        if (parsed == null) {
            throw new FormulaException(CellError.ERROR, "Not a boolean: " + v);
        }
        return parsed != 0.0;
    }

    /**
     * Orders values: numbers before text before booleans; text ignores case.
     * Numeric-looking text compares as a number against a number.
     * A blank takes the empty value of the other side's kind.
     */
    public static int compare(Object a, Object b) {
        Object left = scalar(a);
        Object right = scalar(b);
        if (left instanceof CellError) {
            throw new FormulaException((CellError) left);
        }
        if (right instanceof CellError) {
            throw new FormulaException((CellError) right);
        }
        if (left == null && right == null) {
            return 0;
        }
        if (left == null) {
            left = emptyLike(right);
        }
        if (right == null) {
            right = emptyLike(left);
        }
        if (left instanceof String && right instanceof Double) {
            Double parsed = CellValues.parseNumber((String) left);
            if (parsed != null) {
                left = parsed;
            }
        } else if (left instanceof Double && right instanceof String) {
            Double parsed = CellValues.parseNumber((String) right);
            if (parsed != null) {
                right = parsed;
            }
        }
        int rankLeft = rank(left);
        int rankRight = rank(right);
        if (rankLeft != rankRight) {
            return Integer.compare(rankLeft, rankRight);
        }
        if (left instanceof Double) {
            return Double.compare((Double) left, (Double) right);
        }
        if (left instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        return left.toString().toLowerCase(Locale.ROOT).compareTo(right.toString().toLowerCase(Locale.ROOT));
    }

    public static boolean equalsValue(Object a, Object b) {
        return compare(a, b) == 0;
    }

    /**
     * Maps NaN and infinities to #ERROR!.
     */
    public static double finite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new FormulaException(CellError.ERROR, "Non-finite result");
        }
        return value;
    }

    private static Object emptyLike(Object other) {
        if (other instanceof Double) {
            return 0.0;
        }
        if (other instanceof Boolean) {
            return Boolean.FALSE;
        }
        return "";
    }

    private static int rank(Object v) {
        if (v instanceof Double) {
            return 0;
        }
        if (v instanceof Boolean) {
            return 2;
        }
        return 1;
    }
}
