package com.dealgrid.app.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression (without the leading '=') into tokens.
 * Identifiers cover function names, cell addresses, sheet names and named ranges;
 * the parser decides which one an identifier is from what follows it.
 */
public final class FormulaLexer {

    private final String s;
    private int i = 0;

    private FormulaLexer(String s) {
        this.s = s;
    }

    public static List<Token> tokenize(String expression) {
        FormulaLexer lexer = new FormulaLexer(expression);
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = lexer.next();
            tokens.add(t);
        } while (t.getType() != TokenType.EOF);
        return tokens;
    }

    private Token next() {
        skipWhitespace();
        if (i >= s.length()) {
            return new Token(TokenType.EOF, null, i, i);
        }
        char c = s.charAt(i);
        int start = i;
        if (Character.isDigit(c) || (c == '.' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
            return number();
        }
        if (isIdentStart(c)) {
            i++;
            while (i < s.length() && isIdentPart(s.charAt(i))) {
                i++;
            }
            return new Token(TokenType.IDENT, s.substring(start, i), start, i);
        }
        if (c == '"') {
            return string();
        }
        if (c == '\'') {
            return quotedSheet();
        }
        if (i + 1 < s.length()) {
            String two = s.substring(i, i + 2);
            switch (two) {
                case "<>":
                    i += 2;
                    return new Token(TokenType.NE, two, start, i);
                case "<=":
                    i += 2;
                    return new Token(TokenType.LE, two, start, i);
                case ">=":
                    i += 2;
                    return new Token(TokenType.GE, two, start, i);
                default:
                    break;
            }
        }
        i++;
        switch (c) {
            case '(':
                return new Token(TokenType.LPAREN, "(", start, i);
            case ')':
                return new Token(TokenType.RPAREN, ")", start, i);
            case ',':
                return new Token(TokenType.COMMA, ",", start, i);
            case ':':
                return new Token(TokenType.COLON, ":", start, i);
            case '!':
                return new Token(TokenType.BANG, "!", start, i);
            case '+':
                return new Token(TokenType.PLUS, "+", start, i);
            case '-':
                return new Token(TokenType.MINUS, "-", start, i);
            case '*':
                return new Token(TokenType.STAR, "*", start, i);
            case '/':
                return new Token(TokenType.SLASH, "/", start, i);
            case '^':
                return new Token(TokenType.CARET, "^", start, i);
            case '&':
                return new Token(TokenType.AMPERSAND, "&", start, i);
            case '%':
                return new Token(TokenType.PERCENT, "%", start, i);
            case '=':
                return new Token(TokenType.EQ, "=", start, i);
            case '<':
                return new Token(TokenType.LT, "<", start, i);
            case '>':
                return new Token(TokenType.GT, ">", start, i);
            default:
                throw new FormulaParseException("Unexpected character '" + c + "' at " + start);
        }
    }

    private Token number() {
        int start = i;
        while (i < s.length() && Character.isDigit(s.charAt(i))) {
            i++;
        }
        if (i < s.length() && s.charAt(i) == '.') {
            i++;
            while (i < s.length() && Character.isDigit(s.charAt(i))) {
                i++;
            }
        }
        if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < s.length() && (s.charAt(j) == '+' || s.charAt(j) == '-')) {
                j++;
            }
            if (j < s.length() && Character.isDigit(s.charAt(j))) {
                i = j;
                while (i < s.length() && Character.isDigit(s.charAt(i))) {
                    i++;
                }
            }
        }
        return new Token(TokenType.NUMBER, s.substring(start, i), start, i);
    }

    // "text" with "" as an escaped quote
    private Token string() {
        int start = i++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (i >= s.length()) {
                throw new FormulaParseException("Unterminated string at " + start);
            }
            char ch = s.charAt(i++);
            if (ch == '"') {
                if (i < s.length() && s.charAt(i) == '"') {
                    sb.append('"');
                    i++;
                } else {
                    break;
                }
            } else {
                sb.append(ch);
            }
        }
        return new Token(TokenType.STRING, sb.toString(), start, i);
    }

    // 'My Sheet' with '' as an escaped apostrophe
    private Token quotedSheet() {
        int start = i++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (i >= s.length()) {
                throw new FormulaParseException("Unterminated sheet name at " + start);
            }
            char ch = s.charAt(i++);
            if (ch == '\'') {
                if (i < s.length() && s.charAt(i) == '\'') {
                    sb.append('\'');
                    i++;
                } else {
                    break;
                }
            } else {
                sb.append(ch);
            }
        }
        return new Token(TokenType.QUOTED_SHEET, sb.toString(), start, i);
    }

    private void skipWhitespace() {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$';
    }
}
