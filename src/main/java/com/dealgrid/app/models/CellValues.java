package com.dealgrid.app.models;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Helpers for turning materialized values into display text and back,
 * and for inferring a cell's display type from a literal.
 */
public final class CellValues {

    private static final Pattern PLAIN_NUMBER = Pattern.compile("^[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?$");
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*");
    private static final Pattern CURRENCY = Pattern.compile("^-?\\$[\\d,]+\\.?\\d*$");
    private static final Pattern PERCENTAGE = Pattern.compile("^-?\\d+\\.?\\d*%$");

    private CellValues() {
    }

    /**
     * Numbers become Double, CharSequences become String; everything else is kept.
     */
    public static Object normalize(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        return value;
    }

    /**
     * Text shown in place of the value. Integral doubles drop the fraction,
     * booleans render as TRUE/FALSE and errors as their sentinel.
     */
    public static String display(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return CellError.ERROR.getSentinel();
            }
            if (d == 0) {
                return "0";
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        if (value instanceof CellError) {
            return ((CellError) value).getSentinel();
        }
        return value.toString();
    }

    /**
     * Classifies a literal by its shape: numeric pattern, leading currency symbol,
     * percentage suffix, ISO date prefix, URL prefix.
     */
    public static CellType inferType(Object value) {
        if (value instanceof Number) {
            return CellType.NUMBER;
        }
        if (value instanceof Boolean) {
            return CellType.BOOLEAN;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.startsWith("=")) {
                return CellType.FORMULA;
            }
            if (text.startsWith("http")) {
                return CellType.LINK;
            }
            if (ISO_DATE_PREFIX.matcher(text).matches()) {
                return CellType.DATE;
            }
            if (CURRENCY.matcher(text).matches()) {
                return CellType.CURRENCY;
            }
            if (PERCENTAGE.matcher(text).matches()) {
                return CellType.PERCENTAGE;
            }
            if (PLAIN_NUMBER.matcher(text).matches()) {
                return CellType.NUMBER;
            }
        }
        return CellType.TEXT;
    }

    /**
     * Reads numeric-looking text: "1,234.5", "$1,000", "-12", "15%" (as 0.15).
     * Returns null when the text is not numeric.
     */
    public static Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String t = text.trim();
        if (t.isEmpty()) {
            return null;
        }
        boolean percent = false;
        if (t.endsWith("%")) {
            percent = true;
            t = t.substring(0, t.length() - 1).trim();
        }
        boolean negative = false;
        if (t.startsWith("-")) {
            negative = true;
            t = t.substring(1);
        }
        if (t.startsWith("$")) {
            t = t.substring(1);
        }
        t = t.replace(",", "");
        if (!PLAIN_NUMBER.matcher(t).matches()) {
            return null;
        }
        double d = Double.parseDouble(t);
        if (negative) {
            d = -d;
        }
        return percent ? d / 100.0 : d;
    }

    /**
     * Interprets typed or imported text as a literal value: blank, boolean,
     * error sentinel, plain number, or text (kept verbatim).
     */
    public static Object parseLiteral(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String t = text.trim();
        if ("TRUE".equalsIgnoreCase(t)) {
            return Boolean.TRUE;
        }
        if ("FALSE".equalsIgnoreCase(t)) {
            return Boolean.FALSE;
        }
        CellError error = CellError.fromSentinel(t);
        if (error != null) {
            return error;
        }
        if (PLAIN_NUMBER.matcher(t).matches()) {
            return Double.parseDouble(t);
        }
        return text;
    }
}
