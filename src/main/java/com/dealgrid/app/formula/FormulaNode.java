package com.dealgrid.app.formula;

import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellRange;

import java.util.Collections;
import java.util.List;

/**
 * Parsed formula tree. Nodes are immutable and shared through the parse cache.
 */
public abstract class FormulaNode {

    public abstract <T> T accept(FormulaVisitor<T> visitor);

    public static final class NumberLiteral extends FormulaNode {
        private final double value;

        public NumberLiteral(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitNumber(this);
        }
    }

    public static final class TextLiteral extends FormulaNode {
        private final String value;

        public TextLiteral(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitText(this);
        }
    }

    public static final class BooleanLiteral extends FormulaNode {
        private final boolean value;

        public BooleanLiteral(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    /**
     * A single cell, optionally qualified by a sheet name (null means the formula's own sheet).
     */
    public static final class CellRef extends FormulaNode {
        private final String sheet;
        private final CellAddress address;

        public CellRef(String sheet, CellAddress address) {
            this.sheet = sheet;
            this.address = address;
        }

        public String getSheet() {
            return sheet;
        }

        public CellAddress getAddress() {
            return address;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitCellRef(this);
        }
    }

    public static final class RangeRef extends FormulaNode {
        private final String sheet;
        private final CellRange range;

        public RangeRef(String sheet, CellRange range) {
            this.sheet = sheet;
            this.range = range;
        }

        public String getSheet() {
            return sheet;
        }

        public CellRange getRange() {
            return range;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitRangeRef(this);
        }
    }

    /**
     * "Sheet1:Sheet3!A1" - the same range across an interval of sheets in creation order.
     */
    public static final class SheetSpanRef extends FormulaNode {
        private final String firstSheet;
        private final String lastSheet;
        private final CellRange range;

        public SheetSpanRef(String firstSheet, String lastSheet, CellRange range) {
            this.firstSheet = firstSheet;
            this.lastSheet = lastSheet;
            this.range = range;
        }

        public String getFirstSheet() {
            return firstSheet;
        }

        public String getLastSheet() {
            return lastSheet;
        }

        public CellRange getRange() {
            return range;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitSheetSpan(this);
        }
    }

    public static final class NameRef extends FormulaNode {
        private final String name;

        public NameRef(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitName(this);
        }
    }

    /**
     * Prefix '-' / '+', or postfix '%'.
     */
    public static final class Unary extends FormulaNode {
        private final TokenType operator;
        private final FormulaNode operand;

        public Unary(TokenType operator, FormulaNode operand) {
            this.operator = operator;
            this.operand = operand;
        }

        public TokenType getOperator() {
            return operator;
        }

        public FormulaNode getOperand() {
            return operand;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitUnary(this);
        }
    }

    public static final class Binary extends FormulaNode {
        private final TokenType operator;
        private final FormulaNode left;
        private final FormulaNode right;

        public Binary(TokenType operator, FormulaNode left, FormulaNode right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public TokenType getOperator() {
            return operator;
        }

        public FormulaNode getLeft() {
            return left;
        }

        public FormulaNode getRight() {
            return right;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitBinary(this);
        }
    }

    public static final class FunctionCall extends FormulaNode {
        private final String name;
        private final List<FormulaNode> arguments;

        public FunctionCall(String name, List<FormulaNode> arguments) {
            this.name = name;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        public String getName() {
            return name;
        }

        public List<FormulaNode> getArguments() {
            return arguments;
        }

        @Override
        public <T> T accept(FormulaVisitor<T> visitor) {
            return visitor.visitCall(this);
        }
    }
}
