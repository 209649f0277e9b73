package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.RangeValue;
import com.dealgrid.app.formula.Values;
import com.dealgrid.app.models.CellError;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static com.dealgrid.app.formula.functions.FunctionLibrary.VARIADIC;

final class MathFunctions {

    private MathFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("SUM", 1, VARIADIC, args -> sum(args.numbers()));
        library.register("PRODUCT", 1, VARIADIC, args -> {
            List<Double> values = args.numbers();
            if (values.isEmpty()) {
                return 0.0;
            }
            double product = 1.0;
            for (double v : values) {
                product *= v;
            }
            return product;
        });
        library.register("MIN", 1, VARIADIC, args -> {
            List<Double> values = args.numbers();
            return values.isEmpty() ? 0.0 : values.stream().mapToDouble(Double::doubleValue).min().getAsDouble();
        });
        library.register("MAX", 1, VARIADIC, args -> {
            List<Double> values = args.numbers();
            return values.isEmpty() ? 0.0 : values.stream().mapToDouble(Double::doubleValue).max().getAsDouble();
        });
        library.register("COUNT", 1, VARIADIC, args -> (double) args.numbers().size());
        // Counts every non-blank value, errors included
        library.register("COUNTA", 1, VARIADIC, args -> {
            int count = 0;
            for (Object value : args.flatten()) {
                if (value != null) {
                    count++;
                }
            }
            return (double) count;
        });
        library.register("ABS", 1, 1, args -> Math.abs(args.number(0)));
        library.register("ROUND", 1, 2, args -> round(args.number(0), (int) args.number(1, 0), RoundingMode.HALF_UP));
        library.register("ROUNDUP", 1, 2, args -> round(args.number(0), (int) args.number(1, 0), RoundingMode.UP));
        library.register("ROUNDDOWN", 1, 2, args -> round(args.number(0), (int) args.number(1, 0), RoundingMode.DOWN));
        library.register("CEILING", 1, 2, args -> {
            double value = args.number(0);
            double significance = args.number(1, 1.0);
            if (significance == 0) {
                return 0.0;
            }
            if (value > 0 && significance < 0) {
                throw new FormulaException(CellError.ERROR);
            }
            return Math.ceil(value / significance) * significance;
        });
        library.register("FLOOR", 1, 2, args -> {
            double value = args.number(0);
            double significance = args.number(1, 1.0);
            if (significance == 0) {
                throw new FormulaException(CellError.ERROR);
            }
            if (value > 0 && significance < 0) {
                throw new FormulaException(CellError.ERROR);
            }
            return Math.floor(value / significance) * significance;
        });
        library.register("INT", 1, 1, args -> Math.floor(args.number(0)));
        library.register("POWER", 2, 2, args -> Math.pow(args.number(0), args.number(1)));
        library.register("SQRT", 1, 1, args -> {
            double value = args.number(0);
            if (value < 0) {
                throw new FormulaException(CellError.ERROR);
            }
            return Math.sqrt(value);
        });
        library.register("LN", 1, 1, args -> {
            double value = args.number(0);
            if (value <= 0) {
                throw new FormulaException(CellError.ERROR);
            }
            return Math.log(value);
        });
        library.register("LOG", 1, 2, args -> {
            double value = args.number(0);
            double base = args.number(1, 10.0);
            if (value <= 0 || base <= 0 || base == 1) {
                throw new FormulaException(CellError.ERROR);
            }
            return Math.log(value) / Math.log(base);
        });
        library.register("EXP", 1, 1, args -> Math.exp(args.number(0)));
        // Result takes the sign of the divisor
        library.register("MOD", 2, 2, args -> {
            double n = args.number(0);
            double d = args.number(1);
            if (d == 0) {
                throw new FormulaException(CellError.ERROR);
            }
            return n - d * Math.floor(n / d);
        });
        library.register("SUMIF", 2, 3, MathFunctions::sumIf);
        library.register("COUNTIF", 2, 2, args -> {
            RangeValue range = args.range(0);
            Criteria criteria = Criteria.parse(args.scalar(1));
            int count = 0;
            for (int r = 0; r < range.getDataRowCount(); r++) {
                for (int c = 0; c < range.getColumnCount(); c++) {
                    if (criteria.matches(range.get(r, c))) {
                        count++;
                    }
                }
            }
            // Blank cells past the stored data can only match a blank criterion
            long stored = (long) range.getDataRowCount() * range.getColumnCount();
            long declared = (long) range.getRowCount() * range.getColumnCount();
            if (declared > stored && criteria.matches(null)) {
                count += (int) (declared - stored);
            }
            return (double) count;
        });
    }

    static double sum(List<Double> values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    static double round(double value, int digits, RoundingMode mode) {
        if (!Double.isFinite(value)) {
            throw new FormulaException(CellError.ERROR);
        }
        return BigDecimal.valueOf(value).setScale(digits, mode).doubleValue();
    }

    // sum_range is aligned with range by position
    private static Object sumIf(FunctionArgs args) {
        RangeValue range = args.range(0);
        Criteria criteria = Criteria.parse(args.scalar(1));
        RangeValue sumRange = args.has(2) ? args.range(2) : range;
        double total = 0.0;
        for (int r = 0; r < range.getDataRowCount(); r++) {
            for (int c = 0; c < range.getColumnCount(); c++) {
                if (criteria.matches(range.get(r, c))) {
                    Object member = sumRange.get(r, c);
                    if (member instanceof CellError) {
                        throw new FormulaException((CellError) member);
                    }
                    Double number = Values.aggregateNumber(member);
                    if (number != null) {
                        total += number;
                    }
                }
            }
        }
        return total;
    }
}
