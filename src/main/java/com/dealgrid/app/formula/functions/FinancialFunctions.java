package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.RangeValue;
import com.dealgrid.app.models.CellError;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.dealgrid.app.formula.functions.FunctionLibrary.VARIADIC;

/**
 * Time value of money, depreciation and fund return metrics.
 *
 * <p>Sign conventions follow the usual spreadsheet ones: money paid out is negative,
 * money received is positive. The {@code type} argument is 0 for payments at the end of
 * each period and 1 for payments at the beginning.</p>
 */
final class FinancialFunctions {

    private static final int MAX_ITERATIONS = 100;
    private static final double TOLERANCE = 1e-5;
    private static final double MIN_DERIVATIVE = 1e-12;

    private FinancialFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("NPV", 2, VARIADIC, args -> npv(args.number(0), args.numbersFrom(1)));
        library.register("IRR", 1, 2, args -> irr(args.numbers(0), args.number(1, 0.1)));
        library.register("MIRR", 3, 3, args -> mirr(args.numbers(0), args.number(1), args.number(2)));
        library.register("XNPV", 3, 3, args -> {
            double rate = args.number(0);
            List<Double> values = args.numbers(1);
            List<LocalDate> dates = dates(args.range(2));
            checkDatedFlows(values, dates);
            return xnpv(rate, values, dates);
        });
        library.register("XIRR", 2, 3, args -> {
            List<Double> values = args.numbers(0);
            List<LocalDate> dates = dates(args.range(1));
            checkDatedFlows(values, dates);
            return xirr(values, dates, args.number(2, 0.1));
        });
        library.register("PMT", 3, 5, args -> pmt(args.number(0), args.number(1), args.number(2),
                args.number(3, 0), args.number(4, 0)));
        library.register("FV", 3, 5, args -> fv(args.number(0), args.number(1), args.number(2),
                args.number(3, 0), args.number(4, 0)));
        library.register("PV", 3, 5, args -> pv(args.number(0), args.number(1), args.number(2),
                args.number(3, 0), args.number(4, 0)));
        library.register("NPER", 3, 5, args -> {
            double rate = args.number(0);
            double payment = args.number(1);
            double present = args.number(2);
            double future = args.number(3, 0);
            double type = args.number(4, 0);
            if (rate == 0) {
                return -(present + future) / payment;
            }
            double adjusted = payment * (1 + rate * type);
            return Math.log((adjusted - future * rate) / (adjusted + present * rate)) / Math.log(1 + rate);
        });
        library.register("IPMT", 4, 6, args -> ipmt(args.number(0), args.number(1), args.number(2),
                args.number(3), args.number(4, 0), args.number(5, 0)));
        library.register("PPMT", 4, 6, args -> {
            double rate = args.number(0);
            double period = args.number(1);
            double periods = args.number(2);
            double present = args.number(3);
            double future = args.number(4, 0);
            double type = args.number(5, 0);
            return pmt(rate, periods, present, future, type) - ipmt(rate, period, periods, present, future, type);
        });
        library.register("RATE", 3, 6, args -> rate(args.number(0), args.number(1), args.number(2),
                args.number(3, 0), args.number(4, 0), args.number(5, 0.1)));
        library.register("EFFECT", 2, 2, args -> {
            double nominal = args.number(0);
            double periods = Math.floor(args.number(1));
            if (nominal <= 0 || periods < 1) {
                throw new FormulaException(CellError.ERROR);
            }
            return Math.pow(1 + nominal / periods, periods) - 1;
        });
        library.register("NOMINAL", 2, 2, args -> {
            double effective = args.number(0);
            double periods = Math.floor(args.number(1));
            if (effective <= 0 || periods < 1) {
                throw new FormulaException(CellError.ERROR);
            }
            return periods * (Math.pow(1 + effective, 1 / periods) - 1);
        });
        library.register("SLN", 3, 3, args -> (args.number(0) - args.number(1)) / args.number(2));
        library.register("DB", 4, 5, args -> db(args.number(0), args.number(1), args.number(2),
                args.number(3), args.number(4, 12)));
        library.register("DDB", 4, 5, args -> ddb(args.number(0), args.number(1), args.number(2),
                args.number(3), args.number(4, 2)));
        library.register("WACC", 5, 5, args -> {
            double equity = args.number(0);
            double debt = args.number(1);
            double costOfEquity = args.number(2);
            double costOfDebt = args.number(3);
            double taxRate = args.number(4);
            double total = equity + debt;
            return equity / total * costOfEquity + debt / total * costOfDebt * (1 - taxRate);
        });
        library.register("CAGR", 3, 3, args ->
                Math.pow(args.number(1) / args.number(0), 1 / args.number(2)) - 1);
        library.register("MOIC", 2, 2, args -> args.number(0) / args.number(1));
        library.register("DPI", 2, 2, args -> args.number(0) / args.number(1));
        library.register("TVPI", 3, 3, args -> (args.number(0) + args.number(1)) / args.number(2));
    }

    static double npv(double rate, List<Double> values) {
        double total = 0;
        for (int i = 0; i < values.size(); i++) {
            total += values.get(i) / Math.pow(1 + rate, i + 1);
        }
        return total;
    }

    /**
     * Newton-Raphson from the guess. A vanishing derivative or a non-finite step is an
     * error; running out of iterations returns the last iterate.
     */
    static double irr(List<Double> values, double guess) {
        if (values.isEmpty()) {
            throw new FormulaException(CellError.ERROR, "IRR needs cash flows");
        }
        double rate = guess;
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double value = 0;
            double derivative = 0;
            for (int t = 0; t < values.size(); t++) {
                double cash = values.get(t);
                value += cash / Math.pow(1 + rate, t);
                derivative -= t * cash / Math.pow(1 + rate, t + 1);
            }
            if (Math.abs(derivative) < MIN_DERIVATIVE) {
                throw new FormulaException(CellError.ERROR, "IRR derivative vanished");
            }
            double next = rate - value / derivative;
            if (!Double.isFinite(next)) {
                throw new FormulaException(CellError.ERROR, "IRR diverged");
            }
            if (Math.abs(next - rate) < TOLERANCE) {
                return next;
            }
            rate = next;
        }
        return rate;
    }

    static double mirr(List<Double> values, double financeRate, double reinvestRate) {
        int n = values.size();
        double negatives = 0;
        double positives = 0;
        for (int i = 0; i < n; i++) {
            double cash = values.get(i);
            if (cash < 0) {
                negatives += cash / Math.pow(1 + financeRate, i);
            } else {
                positives += cash * Math.pow(1 + reinvestRate, n - 1 - i);
            }
        }
        if (n < 2 || negatives == 0 || positives == 0) {
            throw new FormulaException(CellError.ERROR, "MIRR needs both positive and negative flows");
        }
        return Math.pow(positives / -negatives, 1.0 / (n - 1)) - 1;
    }

    static double xnpv(double rate, List<Double> values, List<LocalDate> dates) {
        LocalDate first = dates.get(0);
        double total = 0;
        for (int i = 0; i < values.size(); i++) {
            double years = DateFunctions.daysBetween(first, dates.get(i)) / 365.0;
            total += values.get(i) / Math.pow(1 + rate, years);
        }
        return total;
    }

    static double xirr(List<Double> values, List<LocalDate> dates, double guess) {
        LocalDate first = dates.get(0);
        double rate = guess;
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double value = 0;
            double derivative = 0;
            for (int i = 0; i < values.size(); i++) {
                double years = DateFunctions.daysBetween(first, dates.get(i)) / 365.0;
                value += values.get(i) / Math.pow(1 + rate, years);
                derivative -= years * values.get(i) / Math.pow(1 + rate, years + 1);
            }
            if (Math.abs(derivative) < MIN_DERIVATIVE) {
                throw new FormulaException(CellError.ERROR, "XIRR derivative vanished");
            }
            double next = rate - value / derivative;
            if (!Double.isFinite(next)) {
                throw new FormulaException(CellError.ERROR, "XIRR diverged");
            }
            if (Math.abs(next - rate) < TOLERANCE) {
                return next;
            }
            rate = next;
        }
        return rate;
    }

    static double pmt(double rate, double periods, double present, double future, double type) {
        if (rate == 0) {
            return -(present + future) / periods;
        }
        double growth = Math.pow(1 + rate, periods);
        return -(rate * (present * growth + future)) / ((1 + rate * type) * (growth - 1));
    }

    static double fv(double rate, double periods, double payment, double present, double type) {
        if (rate == 0) {
            return -(present + payment * periods);
        }
        double growth = Math.pow(1 + rate, periods);
        return -(present * growth + payment * (1 + rate * type) * (growth - 1) / rate);
    }

    static double pv(double rate, double periods, double payment, double future, double type) {
        if (rate == 0) {
            return -(future + payment * periods);
        }
        double growth = Math.pow(1 + rate, periods);
        return -(future + payment * (1 + rate * type) * (growth - 1) / rate) / growth;
    }

    static double ipmt(double rate, double period, double periods, double present, double future, double type) {
        if (period < 1 || period > periods) {
            throw new FormulaException(CellError.ERROR, "Period out of range");
        }
        if (period == 1 && type == 1) {
            return 0;
        }
        double payment = pmt(rate, periods, present, future, type);
        double interest = fv(rate, period - 1, payment, present, type) * rate;
        return type == 1 ? interest / (1 + rate) : interest;
    }

    static double rate(double periods, double payment, double present, double future, double type, double guess) {
        double rate = guess;
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double value = annuityBalance(rate, periods, payment, present, future, type);
            double step = 1e-7;
            double derivative = (annuityBalance(rate + step, periods, payment, present, future, type) - value) / step;
            if (Math.abs(derivative) < MIN_DERIVATIVE) {
                break;
            }
            double next = rate - value / derivative;
            if (!Double.isFinite(next)) {
                break;
            }
            if (Math.abs(next - rate) < 1e-7) {
                return next;
            }
            rate = next;
        }
        throw new FormulaException(CellError.ERROR, "RATE did not converge");
    }

    private static double annuityBalance(double rate, double periods, double payment, double present,
                                         double future, double type) {
        if (rate == 0) {
            return present + payment * periods + future;
        }
        double growth = Math.pow(1 + rate, periods);
        return present * growth + payment * (1 + rate * type) * (growth - 1) / rate + future;
    }

    /**
     * Fixed declining balance with the rate rounded to three places. A partial first
     * year spills into an extra final period.
     */
    static double db(double cost, double salvage, double life, double period, double month) {
        if (cost <= 0 || life <= 0 || period < 1 || month < 1 || month > 12 || period > life + 1) {
            throw new FormulaException(CellError.ERROR);
        }
        double rate = BigDecimal.valueOf(1 - Math.pow(salvage / cost, 1 / life))
                .setScale(3, RoundingMode.HALF_UP).doubleValue();
        double accumulated = cost * rate * month / 12;
        if (period == 1) {
            return accumulated;
        }
        double depreciation = 0;
        for (int p = 2; p <= (int) period; p++) {
            if (p == (int) life + 1) {
                depreciation = (cost - accumulated) * rate * (12 - month) / 12;
            } else {
                depreciation = (cost - accumulated) * rate;
            }
            accumulated += depreciation;
        }
        return depreciation;
    }

    static double ddb(double cost, double salvage, double life, double period, double factor) {
        if (life <= 0 || period < 1 || period > life) {
            throw new FormulaException(CellError.ERROR);
        }
        double book = cost;
        double depreciation = 0;
        for (int p = 1; p <= (int) period; p++) {
            depreciation = Math.max(0, Math.min(book * factor / life, book - salvage));
            book -= depreciation;
        }
        return depreciation;
    }

    private static List<LocalDate> dates(RangeValue range) {
        List<LocalDate> result = new ArrayList<>();
        for (Object value : range.values()) {
            if (value != null) {
                result.add(DateFunctions.toDate(value));
            }
        }
        return result;
    }

    private static void checkDatedFlows(List<Double> values, List<LocalDate> dates) {
        if (values.isEmpty() || values.size() != dates.size()) {
            throw new FormulaException(CellError.ERROR, "Values and dates must pair up");
        }
    }
}
