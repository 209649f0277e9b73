package com.dealgrid.app.formula;

import com.dealgrid.app.references.AddressCodec;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Textual rewrites of formula source that keep everything except the changed tokens.
 */
public final class FormulaRewriter {

    private static final Pattern BARE_SHEET_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private FormulaRewriter() {
    }

    /**
     * Replaces sheet qualifiers naming oldName (case-insensitive) with newName,
     * in plain ("Old!A1"), quoted ("'Old'!A1") and span ("Old:Other!A1") positions.
     * Formulas that do not tokenize are returned unchanged.
     */
    public static String renameSheet(String formula, String oldName, String newName) {
        if (formula == null || !formula.startsWith("=")) {
            return formula;
        }
        String body = formula.substring(1);
        List<Token> tokens;
        try {
            tokens = FormulaLexer.tokenize(body);
        } catch (FormulaParseException e) {
            return formula;
        }
        StringBuilder sb = new StringBuilder(body);
        // Right to left so earlier offsets stay valid
        for (int k = tokens.size() - 1; k >= 0; k--) {
            Token token = tokens.get(k);
            if (!isSheetToken(token) || !token.getText().equalsIgnoreCase(oldName)) {
                continue;
            }
            if (isQualifier(tokens, k)) {
                sb.replace(token.getStart(), token.getEnd(), quote(newName));
            }
        }
        return "=" + sb;
    }

    /**
     * Sheet name as it must appear in formula text.
     */
    public static String quote(String sheetName) {
        if (BARE_SHEET_NAME.matcher(sheetName).matches() && !AddressCodec.isAddress(sheetName)
                && !"TRUE".equalsIgnoreCase(sheetName) && !"FALSE".equalsIgnoreCase(sheetName)) {
            return sheetName;
        }
        return "'" + sheetName.replace("'", "''") + "'";
    }

    private static boolean isQualifier(List<Token> tokens, int k) {
        Token next = at(tokens, k + 1);
        if (next != null && next.is(TokenType.BANG)) {
            return true;
        }
        // first sheet of a span
        if (next != null && next.is(TokenType.COLON)) {
            Token other = at(tokens, k + 2);
            Token bang = at(tokens, k + 3);
            if (other != null && isSheetToken(other) && bang != null && bang.is(TokenType.BANG)) {
                return true;
            }
        }
        return false;
    }

    private static Token at(List<Token> tokens, int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    private static boolean isSheetToken(Token token) {
        return token.is(TokenType.IDENT) || token.is(TokenType.QUOTED_SHEET);
    }
}
