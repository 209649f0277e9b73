package com.dealgrid.app.exceptions;

/**
 * Thrown when a sheet id or name does not match any sheet of the workbook.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
