package com.dealgrid.app.formula.functions;

/**
 * Body of a spreadsheet function. Arguments are evaluated on demand through FunctionArgs,
 * so a body that never reads an argument never evaluates it.
 */
@FunctionalInterface
public interface FormulaFunction {
    Object apply(FunctionArgs args);
}
