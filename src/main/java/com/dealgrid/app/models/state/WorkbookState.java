package com.dealgrid.app.models.state;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot returned by exportState and accepted by importState.
 * Sheets are listed in creation order.
 */
public class WorkbookState {
    private long activeSheetId;
    private List<SheetState> sheets = new ArrayList<>();

    public WorkbookState() {
    }

    public long getActiveSheetId() {
        return activeSheetId;
    }

    public void setActiveSheetId(long activeSheetId) {
        this.activeSheetId = activeSheetId;
    }

    public List<SheetState> getSheets() {
        return sheets;
    }

    public void setSheets(List<SheetState> sheets) {
        this.sheets = sheets;
    }
}
