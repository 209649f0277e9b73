package com.dealgrid.app.formula;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaRewriterTest {

    @Test
    void testRenamesPlainQuotedAndSpanQualifiers() {
        assertEquals("=Model!A1+1", FormulaRewriter.renameSheet("=Inputs!A1+1", "Inputs", "Model"));
        assertEquals("='Cap Table'!B2*2", FormulaRewriter.renameSheet("=Inputs!B2*2", "inputs", "Cap Table"));
        assertEquals("=Model!C3", FormulaRewriter.renameSheet("='Inputs'!C3", "Inputs", "Model"));
        assertEquals("=SUM(Model:Q4!A1)", FormulaRewriter.renameSheet("=SUM(Inputs:Q4!A1)", "Inputs", "Model"));
    }

    @Test
    void testLeavesOtherTokensAlone() {
        // "Inputs" here is a named range, not a sheet qualifier
        assertEquals("=Inputs+Other!A1", FormulaRewriter.renameSheet("=Inputs+Other!A1", "Inputs", "Model"));
        assertEquals("=\"Inputs!A1\"", FormulaRewriter.renameSheet("=\"Inputs!A1\"", "Inputs", "Model"));
    }

    @Test
    void testQuoteOnlyWhenNeeded() {
        assertEquals("Model", FormulaRewriter.quote("Model"));
        assertEquals("'Cap Table'", FormulaRewriter.quote("Cap Table"));
        assertEquals("'A1'", FormulaRewriter.quote("A1"));
        assertEquals("'Bob''s'", FormulaRewriter.quote("Bob's"));
    }
}
