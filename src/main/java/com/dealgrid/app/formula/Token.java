package com.dealgrid.app.formula;

/**
 * One lexical token. start/end are offsets into the expression text (end exclusive),
 * kept so formulas can be rewritten in place.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int start;
    private final int end;

    public Token(TokenType type, String text, int start, int end) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return type + (text != null ? "(" + text + ")" : "");
    }
}
