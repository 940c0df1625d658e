package com.parametric.formula.io;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parametric.formula.api.CycleResult;
import com.parametric.formula.api.FormulaError;
import com.parametric.formula.api.MutationResult;
import com.parametric.formula.node.ParameterNode;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DiagnosticSerializerTest {

    private final DiagnosticSerializer serializer = new DiagnosticSerializer();

    @Test
    public void testSuccess() {
        ObjectNode json = serializer.toJson(MutationResult.success());
        assertTrue(json.get("success").asBoolean());
        assertNull(json.get("kind"));
    }

    @Test
    public void testUnknownReference() {
        FormulaError error = new FormulaError.UnknownReference("Width", List.of("Hieght", "in"), List.of("in"));
        ObjectNode json = serializer.toJson(MutationResult.failure(error));
        assertFalse(json.get("success").asBoolean());
        assertEquals("UNKNOWN_REFERENCE", json.get("kind").asText());
        assertEquals("Width", json.get("target").asText());
        assertEquals(2, json.get("tokens").size());
        assertEquals("in", json.get("unitSuffixCandidates").get(0).asText());
        assertEquals(error.message(), json.get("message").asText());
    }

    @Test
    public void testCycle() {
        ParameterNode b = ParameterNode.type(2, "B", "number");
        ParameterNode c = ParameterNode.type(3, "C", "number");
        ParameterNode a = ParameterNode.type(1, "A", "number");
        FormulaError error = new FormulaError.WouldCreateCycle("A", CycleResult.cycle(b, List.of(b, c, a)));

        ObjectNode cycle = (ObjectNode) serializer.toJson(error).get("cycle");
        assertTrue(cycle.get("wouldCycle").asBoolean());
        assertEquals("B", cycle.get("directReference").asText());
        assertEquals("[\"B\",\"C\",\"A\"]", cycle.get("path").toString());
    }

    @Test
    public void testNoCycle() {
        ObjectNode json = serializer.toJson(CycleResult.noCycle());
        assertFalse(json.get("wouldCycle").asBoolean());
        assertTrue(json.get("directReference").isNull());
        assertEquals(0, json.get("path").size());
    }

    @Test
    public void testVariantFields() {
        ObjectNode mismatch = serializer.toJson(new FormulaError.TypeMismatch("T", "S", "length", "integer"));
        assertEquals("S", mismatch.get("source").asText());
        assertEquals("length", mismatch.get("sourceType").asText());
        assertEquals("integer", mismatch.get("targetType").asText());

        ObjectNode missing = serializer.toJson(new FormulaError.MissingSourceFormula("T", "S"));
        assertEquals("MISSING_SOURCE_FORMULA", missing.get("kind").asText());
        assertEquals("S", missing.get("source").asText());

        ObjectNode instance = serializer.toJson(new FormulaError.IllegalInstanceReference("T", List.of("Height")));
        assertEquals("Height", instance.get("names").get(0).asText());

        ObjectNode rejected = serializer.toJson(new FormulaError.CommitRejected("T", "bad", List.of("0'")));
        assertEquals("bad", rejected.get("hostMessage").asText());
        assertEquals("0'", rejected.get("suspiciousTokens").get(0).asText());
    }

    @Test
    public void testPrettyString() {
        String text = serializer.toString(MutationResult.failure(new FormulaError.MissingSourceFormula("T", "S")));
        assertTrue(text.contains("\"kind\" : \"MISSING_SOURCE_FORMULA\""));
    }
}
