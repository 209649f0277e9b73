package com.dealgrid.app.formula;

import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.Sheet;

/**
 * Supplies the materialized value of a referenced cell, evaluating it first
 * when it holds a formula that has not settled in the current pass.
 */
public interface CellValueResolver {
    Object resolve(Sheet sheet, CellAddress address);
}
