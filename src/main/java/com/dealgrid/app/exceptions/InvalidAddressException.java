package com.dealgrid.app.exceptions;

/**
 * Thrown at the API boundary when an address or range text cannot be parsed
 * or falls outside the grid limits, e.g. "A0" or "ZZZZ1".
 * Inside formulas the same failure becomes a #REF! value instead.
 */
public class InvalidAddressException extends RuntimeException {
    public InvalidAddressException(String message) {
        super(message);
    }
}
