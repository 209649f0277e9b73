package com.dealgrid.app.formula;

public enum TokenType {
    NUMBER,
    STRING,
    IDENT,
    QUOTED_SHEET,
    BANG,
    COLON,
    LPAREN,
    RPAREN,
    COMMA,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    AMPERSAND,
    PERCENT,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    EOF
}
