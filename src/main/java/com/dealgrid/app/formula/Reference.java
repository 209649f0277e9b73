package com.dealgrid.app.formula;

import com.dealgrid.app.models.CellRange;

/**
 * One reference target found in a formula. Exactly one shape applies:
 * a range on the formula's own sheet (sheet == null), a range on a named sheet,
 * a range across a sheet span (lastSheet != null), or a named range (name != null).
 */
public final class Reference {
    private final String sheet;
    private final String lastSheet;
    private final CellRange range;
    private final String name;

    private Reference(String sheet, String lastSheet, CellRange range, String name) {
        this.sheet = sheet;
        this.lastSheet = lastSheet;
        this.range = range;
        this.name = name;
    }

    public static Reference range(String sheet, CellRange range) {
        return new Reference(sheet, null, range, null);
    }

    public static Reference span(String firstSheet, String lastSheet, CellRange range) {
        return new Reference(firstSheet, lastSheet, range, null);
    }

    public static Reference name(String name) {
        return new Reference(null, null, null, name);
    }

    public String getSheet() {
        return sheet;
    }

    public String getLastSheet() {
        return lastSheet;
    }

    public CellRange getRange() {
        return range;
    }

    public String getName() {
        return name;
    }

    public boolean isSpan() {
        return lastSheet != null;
    }

    public boolean isName() {
        return name != null;
    }
}
