package com.dealgrid.app.exceptions;

/**
 * Thrown when a sheet operation is rejected, e.g. deleting the last
 * remaining sheet or renaming a sheet to a name already in use.
 */
public class SheetOperationException extends RuntimeException {
    public SheetOperationException(String message) {
        super(message);
    }
}
