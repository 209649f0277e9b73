package com.dealgrid.app.formula;

import com.dealgrid.app.models.CellError;

/**
 * Signals an error value from inside expression or function code.
 * Caught at the function-call boundary and turned into the carried CellError.
 */
public class FormulaException extends RuntimeException {

    private final CellError error;

    public FormulaException(CellError error) {
        super(error.getSentinel(), null, false, false);
        this.error = error;
    }

    public FormulaException(CellError error, String message) {
        super(message, null, false, false);
        this.error = error;
    }

    public CellError getError() {
        return error;
    }
}
