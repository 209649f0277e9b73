package com.dealgrid.app.formula;

import com.dealgrid.app.models.CellRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the reference targets of a parsed formula, in source order.
 */
public final class ReferenceCollector implements FormulaVisitor<Void> {

    private final List<Reference> references = new ArrayList<>();

    private ReferenceCollector() {
    }

    public static List<Reference> collect(FormulaNode node) {
        ReferenceCollector collector = new ReferenceCollector();
        node.accept(collector);
        return collector.references;
    }

    @Override
    public Void visitNumber(FormulaNode.NumberLiteral node) {
        return null;
    }

    @Override
    public Void visitText(FormulaNode.TextLiteral node) {
        return null;
    }

    @Override
    public Void visitBoolean(FormulaNode.BooleanLiteral node) {
        return null;
    }

    @Override
    public Void visitCellRef(FormulaNode.CellRef node) {
        references.add(Reference.range(node.getSheet(),
                new CellRange(node.getAddress(), node.getAddress())));
        return null;
    }

    @Override
    public Void visitRangeRef(FormulaNode.RangeRef node) {
        references.add(Reference.range(node.getSheet(), node.getRange()));
        return null;
    }

    @Override
    public Void visitSheetSpan(FormulaNode.SheetSpanRef node) {
        references.add(Reference.span(node.getFirstSheet(), node.getLastSheet(), node.getRange()));
        return null;
    }

    @Override
    public Void visitName(FormulaNode.NameRef node) {
        references.add(Reference.name(node.getName()));
        return null;
    }

    @Override
    public Void visitUnary(FormulaNode.Unary node) {
        node.getOperand().accept(this);
        return null;
    }

    @Override
    public Void visitBinary(FormulaNode.Binary node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitCall(FormulaNode.FunctionCall node) {
        for (FormulaNode argument : node.getArguments()) {
            argument.accept(this);
        }
        return null;
    }
}
