package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.RangeValue;
import com.dealgrid.app.formula.Values;
import com.dealgrid.app.models.CellError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.dealgrid.app.formula.functions.FunctionLibrary.VARIADIC;

/**
 * STDEV and VAR are population statistics; the .S variants are the sample ones.
 */
final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("AVERAGE", 1, VARIADIC, args -> mean(args.numbers()));
        library.register("MEDIAN", 1, VARIADIC, args -> {
            List<Double> values = sorted(args.numbers());
            if (values.isEmpty()) {
                throw new FormulaException(CellError.ERROR);
            }
            int mid = values.size() / 2;
            return values.size() % 2 != 0 ? values.get(mid) : (values.get(mid - 1) + values.get(mid)) / 2.0;
        });
        library.register("STDEV", 1, VARIADIC, args -> Math.sqrt(variance(args.numbers(), false)));
        library.register("STDEV.P", 1, VARIADIC, args -> Math.sqrt(variance(args.numbers(), false)));
        library.register("STDEV.S", 1, VARIADIC, args -> Math.sqrt(variance(args.numbers(), true)));
        library.register("VAR", 1, VARIADIC, args -> variance(args.numbers(), false));
        library.register("VAR.P", 1, VARIADIC, args -> variance(args.numbers(), false));
        library.register("VAR.S", 1, VARIADIC, args -> variance(args.numbers(), true));
        library.register("PERCENTILE", 2, 2, args -> {
            List<Double> values = sorted(args.numbers(0));
            double k = args.number(1);
            if (values.isEmpty() || k < 0 || k > 1) {
                throw new FormulaException(CellError.ERROR);
            }
            double index = (values.size() - 1) * k;
            int lower = (int) Math.floor(index);
            int upper = (int) Math.ceil(index);
            double weight = index - lower;
            return values.get(lower) * (1 - weight) + values.get(upper) * weight;
        });
        library.register("CORREL", 2, 2, StatisticalFunctions::correl);
        library.register("LARGE", 2, 2, args -> {
            List<Double> values = sorted(args.numbers(0));
            int k = (int) args.number(1);
            if (k < 1 || k > values.size()) {
                throw new FormulaException(CellError.ERROR);
            }
            return values.get(values.size() - k);
        });
        library.register("SMALL", 2, 2, args -> {
            List<Double> values = sorted(args.numbers(0));
            int k = (int) args.number(1);
            if (k < 1 || k > values.size()) {
                throw new FormulaException(CellError.ERROR);
            }
            return values.get(k - 1);
        });
    }

    static double mean(List<Double> values) {
        if (values.isEmpty()) {
            throw new FormulaException(CellError.ERROR, "No numeric values");
        }
        return MathFunctions.sum(values) / values.size();
    }

    static double variance(List<Double> values, boolean sample) {
        int n = values.size();
        if (n == 0 || (sample && n < 2)) {
            throw new FormulaException(CellError.ERROR, "Not enough values");
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return squares / (sample ? n - 1 : n);
    }

    private static List<Double> sorted(List<Double> values) {
        List<Double> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }

    // Pairs positions where both ranges hold numbers
    private static Object correl(FunctionArgs args) {
        RangeValue xs = args.range(0);
        RangeValue ys = args.range(1);
        if (xs.getRowCount() * (long) xs.getColumnCount() != ys.getRowCount() * (long) ys.getColumnCount()) {
            throw new FormulaException(CellError.ERROR, "Ranges differ in size");
        }
        List<Double> x = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        int rows = Math.max(xs.getDataRowCount(), ys.getDataRowCount());
        int xColumns = xs.getColumnCount();
        int yColumns = ys.getColumnCount();
        int count = Math.min(rows * Math.max(xColumns, yColumns), xs.getRowCount() * xColumns);
        for (int i = 0; i < count; i++) {
            Double a = Values.aggregateNumber(xs.get(i / xColumns, i % xColumns));
            Double b = Values.aggregateNumber(ys.get(i / yColumns, i % yColumns));
            if (a != null && b != null) {
                x.add(a);
                y.add(b);
            }
        }
        if (x.size() < 2) {
            throw new FormulaException(CellError.ERROR);
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double numerator = 0.0;
        double denomX = 0.0;
        double denomY = 0.0;
        for (int i = 0; i < x.size(); i++) {
            numerator += (x.get(i) - meanX) * (y.get(i) - meanY);
            denomX += (x.get(i) - meanX) * (x.get(i) - meanX);
            denomY += (y.get(i) - meanY) * (y.get(i) - meanY);
        }
        if (denomX == 0 || denomY == 0) {
            throw new FormulaException(CellError.ERROR);
        }
        return numerator / Math.sqrt(denomX * denomY);
    }
}
