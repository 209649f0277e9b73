package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.RangeValue;
import com.dealgrid.app.formula.Values;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.CellValues;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Cap table, exit waterfall and scenario helpers used in venture models.
 */
final class VentureFunctions {

    private static final double DEFAULT_RATCHET_RETURN = 0.2;

    private VentureFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("DILUTION", 3, 3, args -> {
            double oldShares = args.number(0);
            double newShares = args.number(1);
            double totalShares = args.number(2);
            return 1 - oldShares / (totalShares + newShares);
        });
        library.register("OWNERSHIP", 2, 2, args -> args.number(0) / args.number(1));
        library.register("PRICEPERSHARE", 2, 2, args -> args.number(0) / args.number(1));
        library.register("OPTIONPOOL", 2, 2, args -> args.number(1) * args.number(0));
        // The participating flag is accepted but does not change the preference amount
        library.register("LIQUIDPREF", 2, 3, args -> args.number(0) * args.number(1));
        library.register("WATERFALL", 4, 4, args -> {
            double exit = args.number(0);
            double preference = args.number(1);
            double commonShares = args.number(2);
            double totalShares = args.number(3);
            if (exit <= preference) {
                return 0.0;
            }
            return (exit - preference) * commonShares / totalShares;
        });
        library.register("PARTICIPATING", 4, 5, args -> {
            double exit = args.number(0);
            double investment = args.number(1);
            double multiple = args.number(2);
            double ownership = args.number(3);
            double cap = cap(args);
            double preference = investment * multiple;
            if (exit <= preference) {
                // Nothing beyond the exit value can be paid out
                return Math.min(exit, preference);
            }
            return Math.min(preference + (exit - preference) * ownership, cap);
        });
        library.register("IPORATCHET", 2, 3, args -> {
            double investment = args.number(0);
            double current = args.number(1);
            double minimumReturn = args.number(2, DEFAULT_RATCHET_RETURN);
            return Math.max(current, investment * (1 + minimumReturn));
        });
        library.register("CUMULDIV", 3, 3, args -> args.number(0) * Math.pow(1 + args.number(1), args.number(2)));
        library.register("CATCHUP", 3, 3, args -> aboveHurdle(args.number(0), args.number(1), args.number(2)));
        library.register("CARRIEDINT", 3, 3, args -> aboveHurdle(args.number(0), args.number(1), args.number(2)));
        library.register("BREAKEVEN", 2, 3, args -> {
            double fixedCosts = args.number(0);
            double contribution = args.number(1);
            double units = args.number(2, 1);
            return fixedCosts / (contribution / units);
        });
        library.register("SENSITIVITY", 3, 3, args -> args.number(0) * (1 + args.number(1) * args.number(2)));
        library.register("SCENARIO", 4, 6, args -> {
            double base = args.number(0);
            double best = args.number(1);
            double worst = args.number(2);
            double[] weights = scenarioWeights(args);
            return base * weights[0] + best * weights[1] + worst * weights[2];
        });
    }

    private static double aboveHurdle(double amount, double hurdle, double share) {
        return amount <= hurdle ? 0.0 : (amount - hurdle) * share;
    }

    private static double cap(FunctionArgs args) {
        if (!args.has(4) || args.get(4) == null) {
            return Double.POSITIVE_INFINITY;
        }
        Object value = args.scalar(4);
        if (value instanceof String && "uncapped".equalsIgnoreCase(((String) value).trim())) {
            return Double.POSITIVE_INFINITY;
        }
        return Values.toNumber(value);
    }

    /**
     * Probabilities for base, best and worst: three scalars, a three-cell range, or
     * text like "0.5,0.3,0.2".
     */
    private static double[] scenarioWeights(FunctionArgs args) {
        List<Double> weights = new ArrayList<>();
        if (args.size() == 6) {
            weights.add(args.number(3));
            weights.add(args.number(4));
            weights.add(args.number(5));
        } else if (args.size() == 4) {
            Object value = args.get(3);
            if (value instanceof RangeValue) {
                weights.addAll(args.numbers(3));
            } else if (value instanceof String) {
                for (String part : StringUtils.split((String) value, ',')) {
                    Double parsed = CellValues.parseNumber(part.trim());
                    if (parsed == null) {
                        throw new FormulaException(CellError.ERROR, "Bad probability: " + part);
                    }
                    weights.add(parsed);
                }
            } else {
                // Propagates an error argument before the count check below
                args.scalar(3);
            }
        }
        if (weights.size() != 3) {
            throw new FormulaException(CellError.ERROR, "SCENARIO needs three probabilities");
        }
        return new double[]{weights.get(0), weights.get(1), weights.get(2)};
    }
}
