package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.Values;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.CellValues;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SUMIF/COUNTIF criteria: a value to match, or text such as "&gt;=100", "&lt;&gt;closed", "Seed*".
 * Numeric operands compare numerically, text compares ignoring case, '*' and '?' are wildcards.
 */
final class Criteria {

    private final String operator;
    private final Object operand;
    private final Pattern wildcard;

    private Criteria(String operator, Object operand, Pattern wildcard) {
        this.operator = operator;
        this.operand = operand;
        this.wildcard = wildcard;
    }

    static Criteria parse(Object criterion) {
        if (criterion instanceof CellError) {
            throw new FormulaException((CellError) criterion);
        }
        if (!(criterion instanceof String)) {
            return new Criteria("=", criterion, null);
        }
        String text = (String) criterion;
        String operator = "=";
        for (String candidate : new String[]{">=", "<=", "<>", ">", "<", "="}) {
            if (text.startsWith(candidate)) {
                operator = candidate;
                text = text.substring(candidate.length());
                break;
            }
        }
        Double number = CellValues.parseNumber(text);
        if (number != null) {
            return new Criteria(operator, number, null);
        }
        Pattern wildcard = null;
        if (("=".equals(operator) || "<>".equals(operator)) && StringUtils.containsAny(text, '*', '?')) {
            StringBuilder regex = new StringBuilder();
            for (char c : text.toCharArray()) {
                if (c == '*') {
                    regex.append(".*");
                } else if (c == '?') {
                    regex.append('.');
                } else {
                    regex.append(Pattern.quote(String.valueOf(c)));
                }
            }
            wildcard = Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        }
        return new Criteria(operator, text, wildcard);
    }

    boolean matches(Object value) {
        if (value instanceof CellError) {
            return false;
        }
        if (wildcard != null) {
            boolean hit = value != null && wildcard.matcher(CellValues.display(value)).matches();
            return "=".equals(operator) == hit;
        }
        if (operand instanceof Double) {
            Double number = value instanceof Boolean ? null : Values.aggregateNumber(value);
            if (number == null) {
                return "<>".equals(operator);
            }
            return test(Double.compare(number, (Double) operand));
        }
        if (operand instanceof Boolean) {
            boolean equal = operand.equals(value);
            return "<>".equals(operator) != equal;
        }
        String expected = operand == null ? "" : operand.toString().toLowerCase(Locale.ROOT);
        String actual = CellValues.display(value).toLowerCase(Locale.ROOT);
        if ("=".equals(operator) && expected.isEmpty()) {
            return value == null || actual.isEmpty();
        }
        if (value instanceof Double && !"<>".equals(operator)) {
            return false;
        }
        return test(actual.compareTo(expected));
    }

    private boolean test(int cmp) {
        switch (operator) {
            case ">=":
                return cmp >= 0;
            case "<=":
                return cmp <= 0;
            case "<>":
                return cmp != 0;
            case ">":
                return cmp > 0;
            case "<":
                return cmp < 0;
            default:
                return cmp == 0;
        }
    }
}
