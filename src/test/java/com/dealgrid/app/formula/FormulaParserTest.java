package com.dealgrid.app.formula;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        FormulaNode node = FormulaParser.parse("=1+2*3");
        FormulaNode.Binary plus = assertInstanceOf(FormulaNode.Binary.class, node);
        assertEquals(TokenType.PLUS, plus.getOperator());
        FormulaNode.Binary times = assertInstanceOf(FormulaNode.Binary.class, plus.getRight());
        assertEquals(TokenType.STAR, times.getOperator());
    }

    @Test
    void testComparisonIsLoosestAndConcatenationSitsAboveAddition() {
        FormulaNode node = FormulaParser.parse("A1&\"x\"=B1+1");
        FormulaNode.Binary eq = assertInstanceOf(FormulaNode.Binary.class, node);
        assertEquals(TokenType.EQ, eq.getOperator());
        assertEquals(TokenType.AMPERSAND, ((FormulaNode.Binary) eq.getLeft()).getOperator());
        assertEquals(TokenType.PLUS, ((FormulaNode.Binary) eq.getRight()).getOperator());
    }

    @Test
    void testPercentIsPostfix() {
        FormulaNode.Unary node = assertInstanceOf(FormulaNode.Unary.class, FormulaParser.parse("=15%"));
        assertEquals(TokenType.PERCENT, node.getOperator());
    }

    @Test
    void testReferenceKinds() {
        FormulaNode.CellRef cell = assertInstanceOf(FormulaNode.CellRef.class, FormulaParser.parse("=$B$2"));
        assertNull(cell.getSheet());
        assertEquals("B2", cell.getAddress().toString());

        FormulaNode.RangeRef range = assertInstanceOf(FormulaNode.RangeRef.class, FormulaParser.parse("=Inputs!A1:C3"));
        assertEquals("Inputs", range.getSheet());
        assertEquals("A1:C3", range.getRange().toString());

        FormulaNode.CellRef quoted = assertInstanceOf(FormulaNode.CellRef.class, FormulaParser.parse("='Cap Table'!D4"));
        assertEquals("Cap Table", quoted.getSheet());

        FormulaNode.SheetSpanRef span = assertInstanceOf(FormulaNode.SheetSpanRef.class,
                FormulaParser.parse("=Q1:Q4!B2:B5"));
        assertEquals("Q1", span.getFirstSheet());
        assertEquals("Q4", span.getLastSheet());
        assertEquals("B2:B5", span.getRange().toString());

        FormulaNode.NameRef name = assertInstanceOf(FormulaNode.NameRef.class, FormulaParser.parse("=Revenue"));
        assertEquals("Revenue", name.getName());
    }

    @Test
    void testFunctionNamesAreUpperCased() {
        FormulaNode.FunctionCall call = assertInstanceOf(FormulaNode.FunctionCall.class,
                FormulaParser.parse("=sum(A1:A3, 4, \"x\")"));
        assertEquals("SUM", call.getName());
        assertEquals(3, call.getArguments().size());
        assertInstanceOf(FormulaNode.TextLiteral.class, call.getArguments().get(2));
    }

    @Test
    void testBooleansAreLiterals() {
        FormulaNode.BooleanLiteral node = assertInstanceOf(FormulaNode.BooleanLiteral.class, FormulaParser.parse("=true"));
        assertTrue(node.getValue());
    }

    @Test
    void testMalformedFormulasAreRejected() {
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("="));
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=1+"));
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=SUM(1,2"));
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("=(1+2))"));
    }

    @Test
    void testReferenceCollectorFindsEveryReference() {
        List<Reference> refs = ReferenceCollector.collect(FormulaParser.parse("=A1+SUM(Data!B1:B3)+Rate"));
        assertEquals(3, refs.size());
        assertEquals("A1:A1", refs.get(0).getRange().toString());
        assertEquals("Data", refs.get(1).getSheet());
        assertTrue(refs.get(2).isName());
    }
}
