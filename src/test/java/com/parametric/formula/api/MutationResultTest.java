package com.parametric.formula.api;

import com.parametric.formula.node.ParameterNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class MutationResultTest {

    @Test
    public void testSuccess() {
        MutationResult result = MutationResult.success();
        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertNull(result.error());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFailureNeedsError() {
        MutationResult.failure(null);
    }

    @Test(expected = IllegalStateException.class)
    public void testErrorAsWrongVariant() {
        MutationResult.failure(new FormulaError.MissingSourceFormula("T", "S"))
                .errorAs(FormulaError.TypeMismatch.class);
    }

    @Test
    public void testErrorListsAreCopied() {
        List<String> tokens = new ArrayList<>(List.of("X"));
        FormulaError.UnknownReference error = new FormulaError.UnknownReference("T", tokens, List.of());
        tokens.add("Y");
        assertEquals(List.of("X"), error.tokens());
    }

    @Test
    public void testCyclePathIsCopied() {
        ParameterNode a = ParameterNode.type(1, "A", "number");
        List<Parameter> path = new ArrayList<>(List.of(a));
        CycleResult result = CycleResult.cycle(a, path);
        path.clear();
        assertEquals(List.of("A"), result.pathNames());
        assertTrue(new CycleResult(false, null, null).path().isEmpty());
    }

    @Test
    public void testMessages() {
        assertEquals("Cannot set formula on parameter 'T'. Source parameter 'S' has no formula.",
                new FormulaError.MissingSourceFormula("T", "S").message());
        assertTrue(new FormulaError.TypeMismatch("T", "S", "length", "integer").message()
                .contains("has data type 'length' but target parameter 'T' has data type 'integer'"));
        assertEquals("Cannot set formula on parameter 'T'. Host error: nope",
                new FormulaError.CommitRejected("T", "nope", List.of()).message());
    }
}
