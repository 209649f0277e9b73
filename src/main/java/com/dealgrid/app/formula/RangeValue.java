package com.dealgrid.app.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rectangular block of materialized values, only ever passed to functions.
 * The declared size is the size of the referenced range; the stored data may stop
 * earlier when trailing rows or columns are empty, and reads past it return blank.
 */
public final class RangeValue {

    private final int rowCount;
    private final int columnCount;
    private final Object[][] data;

    public RangeValue(int rowCount, int columnCount, Object[][] data) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.data = data;
    }

    /**
     * A single-column range holding the values in order.
     */
    public static RangeValue column(List<Object> values) {
        Object[][] data = new Object[values.size()][];
        for (int i = 0; i < values.size(); i++) {
            data[i] = new Object[]{values.get(i)};
        }
        return new RangeValue(values.size(), 1, data);
    }

    public static RangeValue single(Object value) {
        return new RangeValue(1, 1, new Object[][]{{value}});
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public int getDataRowCount() {
        return data.length;
    }

    public int getDataColumnCount() {
        int max = 0;
        for (Object[] row : data) {
            max = Math.max(max, row.length);
        }
        return max;
    }

    /**
     * Zero-based access; positions outside the stored data are blank.
     */
    public Object get(int row, int column) {
        if (row < 0 || row >= data.length) {
            return null;
        }
        Object[] r = data[row];
        if (column < 0 || column >= r.length) {
            return null;
        }
        return r[column];
    }

    /**
     * Stored values in row-major order, blanks included.
     */
    public List<Object> values() {
        List<Object> result = new ArrayList<>();
        for (Object[] row : data) {
            Collections.addAll(result, row);
        }
        return result;
    }

    public boolean isSingleCell() {
        return rowCount == 1 && columnCount == 1;
    }
}
