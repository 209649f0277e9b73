package com.dealgrid.app.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * An ordered collection of sheets (creation order) plus the active-sheet pointer.
 * The lock is taken by the service layer; the engine itself does no locking.
 */
public class Workbook {

    // Generates unique IDs for newly created workbooks
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final List<Sheet> sheets = new ArrayList<>();
    private long activeSheetId;
    private long nextSheetId = 1;

    // Lock to prevent race conditions when multiple threads update the same Workbook
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Workbook() {
        this.id = ID_GENERATOR.getAndIncrement();
    }

    public long getId() {
        return id;
    }

    public List<Sheet> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    public long nextSheetId() {
        return nextSheetId++;
    }

    /**
     * Used by state import so new sheets never reuse an imported id.
     */
    public void reserveSheetIds(long upTo) {
        nextSheetId = Math.max(nextSheetId, upTo + 1);
    }

    public void addSheet(Sheet sheet) {
        sheets.add(sheet);
    }

    public void removeSheet(Sheet sheet) {
        sheets.remove(sheet);
    }

    public void clearSheets() {
        sheets.clear();
    }

    public int indexOf(Sheet sheet) {
        return sheets.indexOf(sheet);
    }

    public Sheet findById(long sheetId) {
        for (Sheet sheet : sheets) {
            if (sheet.getId() == sheetId) {
                return sheet;
            }
        }
        return null;
    }

    /**
     * Case-insensitive name lookup, or null.
     */
    public Sheet findByName(String name) {
        if (name == null) {
            return null;
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (Sheet sheet : sheets) {
            if (sheet.getName().toLowerCase(Locale.ROOT).equals(wanted)) {
                return sheet;
            }
        }
        return null;
    }

    public long getActiveSheetId() {
        return activeSheetId;
    }

    public void setActiveSheetId(long activeSheetId) {
        this.activeSheetId = activeSheetId;
    }

    public Sheet getActiveSheet() {
        return findById(activeSheetId);
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
