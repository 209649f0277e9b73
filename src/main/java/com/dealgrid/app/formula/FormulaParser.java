package com.dealgrid.app.formula;

import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellRange;
import com.dealgrid.app.references.AddressCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser. Binding, loosest first:
 * comparison, '&amp;', '+ -', '* /', '^', unary '+ -', postfix '%', primary.
 */
public final class FormulaParser {

    private final List<Token> tokens;
    private int pos = 0;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses formula text. A leading '=' is optional.
     */
    public static FormulaNode parse(String formula) {
        if (formula == null) {
            throw new FormulaParseException("Formula is null");
        }
        String expression = formula.startsWith("=") ? formula.substring(1) : formula;
        if (expression.trim().isEmpty()) {
            throw new FormulaParseException("Empty formula");
        }
        FormulaParser parser = new FormulaParser(FormulaLexer.tokenize(expression));
        FormulaNode node = parser.comparison();
        if (!parser.look(TokenType.EOF)) {
            throw new FormulaParseException("Unexpected token " + parser.peek());
        }
        return node;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        int index = Math.min(pos + ahead, tokens.size() - 1);
        return tokens.get(index);
    }

    private boolean look(TokenType type) {
        return peek().getType() == type;
    }

    private Token eat(TokenType type) {
        Token current = peek();
        if (current.getType() != type) {
            throw new FormulaParseException("Expected " + type + " but got " + current);
        }
        pos++;
        return current;
    }

    private FormulaNode comparison() {
        FormulaNode left = concatenation();
        while (true) {
            TokenType type = peek().getType();
            if (type == TokenType.EQ || type == TokenType.NE || type == TokenType.LT
                    || type == TokenType.LE || type == TokenType.GT || type == TokenType.GE) {
                pos++;
                left = new FormulaNode.Binary(type, left, concatenation());
            } else {
                return left;
            }
        }
    }

    private FormulaNode concatenation() {
        FormulaNode left = additive();
        while (look(TokenType.AMPERSAND)) {
            pos++;
            left = new FormulaNode.Binary(TokenType.AMPERSAND, left, additive());
        }
        return left;
    }

    private FormulaNode additive() {
        FormulaNode left = multiplicative();
        while (look(TokenType.PLUS) || look(TokenType.MINUS)) {
            TokenType op = peek().getType();
            pos++;
            left = new FormulaNode.Binary(op, left, multiplicative());
        }
        return left;
    }

    private FormulaNode multiplicative() {
        FormulaNode left = exponent();
        while (look(TokenType.STAR) || look(TokenType.SLASH)) {
            TokenType op = peek().getType();
            pos++;
            left = new FormulaNode.Binary(op, left, exponent());
        }
        return left;
    }

    private FormulaNode exponent() {
        FormulaNode left = unary();
        while (look(TokenType.CARET)) {
            pos++;
            left = new FormulaNode.Binary(TokenType.CARET, left, unary());
        }
        return left;
    }

    private FormulaNode unary() {
        if (look(TokenType.MINUS) || look(TokenType.PLUS)) {
            TokenType op = peek().getType();
            pos++;
            return new FormulaNode.Unary(op, unary());
        }
        return postfix();
    }

    private FormulaNode postfix() {
        FormulaNode node = primary();
        while (look(TokenType.PERCENT)) {
            pos++;
            node = new FormulaNode.Unary(TokenType.PERCENT, node);
        }
        return node;
    }

    private FormulaNode primary() {
        Token token = peek();
        switch (token.getType()) {
            case NUMBER:
                pos++;
                try {
                    return new FormulaNode.NumberLiteral(Double.parseDouble(token.getText()));
                } catch (NumberFormatException e) {
                    throw new FormulaParseException("Bad number " + token.getText());
                }
            case STRING:
                pos++;
                return new FormulaNode.TextLiteral(token.getText());
            case LPAREN: {
                pos++;
                FormulaNode inner = comparison();
                eat(TokenType.RPAREN);
                return inner;
            }
            case QUOTED_SHEET:
                pos++;
                return sheetQualified(token.getText());
            case IDENT:
                return identifier();
            default:
                throw new FormulaParseException("Unexpected token " + token);
        }
    }

    private FormulaNode identifier() {
        Token ident = eat(TokenType.IDENT);
        String text = ident.getText();
        if (look(TokenType.LPAREN)) {
            return call(text.toUpperCase(Locale.ROOT));
        }
        if (look(TokenType.BANG)) {
            return sheetQualified(text);
        }
        if (look(TokenType.COLON) && isSheetName(peek(1)) && peek(2).is(TokenType.BANG)) {
            return sheetQualified(text);
        }
        if ("TRUE".equalsIgnoreCase(text)) {
            return new FormulaNode.BooleanLiteral(true);
        }
        if ("FALSE".equalsIgnoreCase(text)) {
            return new FormulaNode.BooleanLiteral(false);
        }
        if (AddressCodec.isAddress(text)) {
            return reference(null, text);
        }
        return new FormulaNode.NameRef(text);
    }

    private FormulaNode call(String name) {
        eat(TokenType.LPAREN);
        List<FormulaNode> args = new ArrayList<>();
        if (!look(TokenType.RPAREN)) {
            args.add(comparison());
            while (look(TokenType.COMMA)) {
                pos++;
                args.add(comparison());
            }
        }
        eat(TokenType.RPAREN);
        return new FormulaNode.FunctionCall(name, args);
    }

    // After a sheet name: "!A1", "!A1:B2", or ":Last!A1" for a sheet span
    private FormulaNode sheetQualified(String sheet) {
        if (look(TokenType.COLON)) {
            pos++;
            Token last = peek();
            if (!isSheetName(last)) {
                throw new FormulaParseException("Expected sheet name after ':' but got " + last);
            }
            pos++;
            eat(TokenType.BANG);
            Token addr = eat(TokenType.IDENT);
            FormulaNode ref = reference(null, requireAddress(addr));
            CellRange range = ref instanceof FormulaNode.CellRef
                    ? new CellRange(((FormulaNode.CellRef) ref).getAddress(), ((FormulaNode.CellRef) ref).getAddress())
                    : ((FormulaNode.RangeRef) ref).getRange();
            return new FormulaNode.SheetSpanRef(sheet, last.getText(), range);
        }
        eat(TokenType.BANG);
        Token addr = eat(TokenType.IDENT);
        return reference(sheet, requireAddress(addr));
    }

    private FormulaNode reference(String sheet, String startText) {
        CellAddress start = AddressCodec.parseAddress(startText);
        if (look(TokenType.COLON) && peek(1).is(TokenType.IDENT) && AddressCodec.isAddress(peek(1).getText())) {
            pos++;
            CellAddress end = AddressCodec.parseAddress(eat(TokenType.IDENT).getText());
            return new FormulaNode.RangeRef(sheet, new CellRange(start, end));
        }
        return new FormulaNode.CellRef(sheet, start);
    }

    private static String requireAddress(Token token) {
        if (!AddressCodec.isAddress(token.getText())) {
            throw new FormulaParseException("Expected cell address but got " + token.getText());
        }
        return token.getText();
    }

    private static boolean isSheetName(Token token) {
        return token.is(TokenType.IDENT) || token.is(TokenType.QUOTED_SHEET);
    }
}
