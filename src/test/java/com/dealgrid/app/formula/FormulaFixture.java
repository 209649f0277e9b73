package com.dealgrid.app.formula;

import com.dealgrid.app.config.GridProperties;
import com.dealgrid.app.formula.functions.FunctionLibrary;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.Sheet;
import com.dealgrid.app.models.Workbook;
import com.dealgrid.app.services.MultiSheetManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * A one-sheet workbook with a fixed clock for evaluating formulas directly.
 * Referenced cells are read as stored, so inputs must be literals.
 */
public class FormulaFixture {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-30T09:30:00Z"), ZoneOffset.UTC);

    private final MultiSheetManager sheets;
    private final FormulaEvaluator evaluator = new FormulaEvaluator(FunctionLibrary.standard());

    public FormulaFixture() {
        sheets = new MultiSheetManager(new Workbook(), new GridProperties(), CLOCK);
        sheets.createSheet("Model");
    }

    public Sheet sheet() {
        return sheets.getActiveSheet();
    }

    public MultiSheetManager sheets() {
        return sheets;
    }

    public FormulaFixture set(String address, Object value) {
        sheet().getCells().write(CellAddress.of(address), value, null);
        return this;
    }

    public FormulaFixture set(Sheet sheet, String address, Object value) {
        sheet.getCells().write(CellAddress.of(address), value, null);
        return this;
    }

    public Object eval(String formula) {
        EvaluationContext context = new EvaluationContext(sheet(),
                (s, a) -> s.getCells().readValue(a), sheets, CLOCK);
        return evaluator.evaluate(formula, context);
    }

    public double number(String formula) {
        Object result = eval(formula);
        if (!(result instanceof Double)) {
            throw new AssertionError(formula + " gave " + result);
        }
        return (Double) result;
    }
}
