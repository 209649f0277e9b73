package com.dealgrid.app.formula.functions;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry of functions by upper-case name, with their arity bounds.
 */
public class FunctionLibrary {

    public static final int VARIADIC = Integer.MAX_VALUE;

    private final Map<String, Definition> definitions = new TreeMap<>();

    /**
     * The full built-in set: math, statistical, logical, text, date, lookup,
     * financial and venture functions.
     */
    public static FunctionLibrary standard() {
        FunctionLibrary library = new FunctionLibrary();
        MathFunctions.registerAll(library);
        StatisticalFunctions.registerAll(library);
        LogicalFunctions.registerAll(library);
        TextFunctions.registerAll(library);
        DateFunctions.registerAll(library);
        LookupFunctions.registerAll(library);
        FinancialFunctions.registerAll(library);
        VentureFunctions.registerAll(library);
        return library;
    }

    public FunctionLibrary register(String name, int minArgs, int maxArgs, FormulaFunction body) {
        if (minArgs < 0 || maxArgs < minArgs) {
            throw new IllegalArgumentException("Bad arity for " + name + ": " + minArgs + ".." + maxArgs);
        }
        String key = name.toUpperCase(Locale.ROOT);
        definitions.put(key, new Definition(key, minArgs, maxArgs, body));
        return this;
    }

    public Definition find(String name) {
        return name == null ? null : definitions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return find(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public static final class Definition {
        private final String name;
        private final int minArgs;
        private final int maxArgs;
        private final FormulaFunction body;

        Definition(String name, int minArgs, int maxArgs, FormulaFunction body) {
            this.name = name;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.body = body;
        }

        public String getName() {
            return name;
        }

        public int getMinArgs() {
            return minArgs;
        }

        public int getMaxArgs() {
            return maxArgs;
        }

        public FormulaFunction getBody() {
            return body;
        }
    }
}
