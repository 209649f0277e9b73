package com.dealgrid.app.formula;

import com.dealgrid.app.models.Sheet;

import java.util.List;

/**
 * Resolves sheet names used in cross-sheet and 3D references.
 */
public interface SheetDirectory {

    /**
     * Sheet with the given name (case-insensitive), or null.
     */
    Sheet findSheet(String name);

    /**
     * Sheets between the two names inclusive, in creation order, whichever comes first.
     * Null when either name is unknown.
     */
    List<Sheet> sheetSpan(String first, String last);
}
