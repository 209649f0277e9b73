package com.dealgrid.app.formula;

import com.dealgrid.app.models.Sheet;

import java.time.Clock;

/**
 * Everything one formula evaluation needs: the sheet that owns the formula,
 * how to read other cells, how to find other sheets, and the clock for TODAY/NOW.
 */
public class EvaluationContext {
    private final Sheet sheet;
    private final CellValueResolver resolver;
    private final SheetDirectory directory;
    private final Clock clock;

    public EvaluationContext(Sheet sheet, CellValueResolver resolver, SheetDirectory directory, Clock clock) {
        this.sheet = sheet;
        this.resolver = resolver;
        this.directory = directory;
        this.clock = clock;
    }

    public Sheet getSheet() {
        return sheet;
    }

    public CellValueResolver getResolver() {
        return resolver;
    }

    public SheetDirectory getDirectory() {
        return directory;
    }

    public Clock getClock() {
        return clock;
    }
}
