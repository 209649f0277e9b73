package com.dealgrid.app.services;

import com.dealgrid.app.exceptions.InvalidAddressException;
import com.dealgrid.app.models.Cell;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.CellRange;
import com.dealgrid.app.models.CellValues;
import com.dealgrid.app.models.ConditionalFormat;
import com.dealgrid.app.models.Sheet;
import com.dealgrid.app.references.AddressCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes the conditional-format style overlay of a sheet from its rules and the
 * materialized cell values. Rules apply in declaration order; a later matching rule
 * overrides earlier ones key by key. Blank cells never match.
 */
public class ConditionalFormatEngine {

    private static final Logger log = LoggerFactory.getLogger(ConditionalFormatEngine.class);

    /**
     * Recomputes and stores the overlay of the sheet.
     */
    public void refresh(Sheet sheet) {
        sheet.setFormatOverlay(compute(sheet));
    }

    public Map<CellAddress, Map<String, Object>> compute(Sheet sheet) {
        Map<CellAddress, Map<String, Object>> overlay = new HashMap<>();
        for (ConditionalFormat rule : sheet.getConditionalFormats()) {
            CellRange range;
            try {
                range = AddressCodec.parseRange(rule.getRange());
            } catch (InvalidAddressException e) {
                log.warn("Skipping conditional format {} with bad range {}", rule.getId(), rule.getRange());
                continue;
            }
            List<Object> rangeValues = new ArrayList<>();
            List<CellAddress> addresses = new ArrayList<>();
            for (Cell cell : sheet.getCells().cells()) {
                if (cell.getValue() != null && range.contains(cell.getAddress())) {
                    addresses.add(cell.getAddress());
                    rangeValues.add(cell.getValue());
                }
            }
            for (int i = 0; i < addresses.size(); i++) {
                if (matches(rule, rangeValues.get(i), rangeValues)) {
                    overlay.computeIfAbsent(addresses.get(i), a -> new LinkedHashMap<>()).putAll(rule.getStyle());
                }
            }
        }
        return overlay;
    }

    /**
     * The cell's own style with the overlay merged on top.
     */
    public static Map<String, Object> effectiveStyle(Sheet sheet, CellAddress address) {
        Map<String, Object> style = new LinkedHashMap<>();
        Cell cell = sheet.getCells().read(address);
        if (cell != null) {
            style.putAll(cell.getStyle());
        }
        Map<String, Object> overlay = sheet.getFormatOverlay().get(address);
        if (overlay != null) {
            style.putAll(overlay);
        }
        return style;
    }

    boolean matches(ConditionalFormat rule, Object value, List<Object> rangeValues) {
        if (value == null || rule.getCondition() == null) {
            return false;
        }
        switch (rule.getCondition()) {
            case EQUALS:
                return sameValue(value, rule.getValue());
            case GREATER: {
                Double number = numeric(value);
                Double bound = numeric(rule.getValue());
                return number != null && bound != null && number > bound;
            }
            case LESS: {
                Double number = numeric(value);
                Double bound = numeric(rule.getValue());
                return number != null && bound != null && number < bound;
            }
            case BETWEEN: {
                Double number = numeric(value);
                Double low = numeric(rule.getValue());
                Double high = numeric(rule.getValue2());
                return number != null && low != null && high != null && number >= low && number <= high;
            }
            case CONTAINS:
                return rule.getValue() != null
                        && CellValues.display(value).contains(CellValues.display(rule.getValue()));
            case DUPLICATE:
                return occurrences(value, rangeValues) > 1;
            case UNIQUE:
                return occurrences(value, rangeValues) == 1;
            default:
                return false;
        }
    }

    private static int occurrences(Object value, List<Object> rangeValues) {
        int count = 0;
        for (Object other : rangeValues) {
            if (sameValue(value, other)) {
                count++;
            }
        }
        return count;
    }

    // Numbers by value, text ignoring case, numeric text equal to its number
    static boolean sameValue(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof CellError || b instanceof CellError) {
            return a == b;
        }
        Double left = numeric(a);
        Double right = numeric(b);
        if (left != null && right != null && !(a instanceof Boolean) && !(b instanceof Boolean)) {
            return left.doubleValue() == right.doubleValue();
        }
        if (a instanceof Boolean || b instanceof Boolean) {
            return a.equals(b);
        }
        return a.toString().toLowerCase(Locale.ROOT).equals(b.toString().toLowerCase(Locale.ROOT));
    }

    private static Double numeric(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            return CellValues.parseNumber((String) value);
        }
        return null;
    }
}
