package com.dealgrid.app.formula;

public interface FormulaVisitor<T> {
    T visitNumber(FormulaNode.NumberLiteral node);

    T visitText(FormulaNode.TextLiteral node);

    T visitBoolean(FormulaNode.BooleanLiteral node);

    T visitCellRef(FormulaNode.CellRef node);

    T visitRangeRef(FormulaNode.RangeRef node);

    T visitSheetSpan(FormulaNode.SheetSpanRef node);

    T visitName(FormulaNode.NameRef node);

    T visitUnary(FormulaNode.Unary node);

    T visitBinary(FormulaNode.Binary node);

    T visitCall(FormulaNode.FunctionCall node);
}
