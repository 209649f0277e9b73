package com.dealgrid.app.formula;

/**
 * Thrown by the lexer or parser for malformed formula text.
 * The evaluator turns it into a #ERROR! value.
 */
public class FormulaParseException extends RuntimeException {
    public FormulaParseException(String message) {
        super(message);
    }
}
