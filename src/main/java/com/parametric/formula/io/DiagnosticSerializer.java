package com.parametric.formula.io;

import com.parametric.formula.api.CycleResult;
import com.parametric.formula.api.FormulaError;
import com.parametric.formula.api.MutationResult;
import com.parametric.formula.api.Parameter;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders mutation outcomes as JSON for tooling and logs.
 *
 * <pre>
 * {"kind":"WOULD_CREATE_CYCLE","target":"A","message":"...",
 *  "cycle":{"wouldCycle":true,"directReference":"B","path":["B","C","A"]}}
 * </pre>
 */
public final class DiagnosticSerializer {
    private final ObjectMapper mapper = new ObjectMapper();

    public ObjectNode toJson(MutationResult result) {
        if (result.isSuccess()) {
            ObjectNode node = mapper.createObjectNode();
            node.put("success", true);
            return node;
        }
        ObjectNode node = toJson(result.error());
        node.put("success", false);
        return node;
    }

    public ObjectNode toJson(FormulaError error) {
        ObjectNode node = mapper.createObjectNode();
        node.put("kind", error.kind().name());
        node.put("target", error.target());
        node.put("message", error.message());

        if (error instanceof FormulaError.UnknownReference e) {
            node.set("tokens", array(e.tokens()));
            node.set("unitSuffixCandidates", array(e.unitSuffixCandidates()));
        } else if (error instanceof FormulaError.IllegalInstanceReference e) {
            node.set("names", array(e.names()));
        } else if (error instanceof FormulaError.TypeMismatch e) {
            node.put("source", e.source());
            node.put("sourceType", e.sourceType());
            node.put("targetType", e.targetType());
        } else if (error instanceof FormulaError.MissingSourceFormula e) {
            node.put("source", e.source());
        } else if (error instanceof FormulaError.WouldCreateCycle e) {
            node.set("cycle", toJson(e.cycle()));
        } else if (error instanceof FormulaError.CommitRejected e) {
            node.put("hostMessage", e.hostMessage());
            node.set("suspiciousTokens", array(e.suspiciousTokens()));
        }
        return node;
    }

    public ObjectNode toJson(CycleResult cycle) {
        ObjectNode node = mapper.createObjectNode();
        node.put("wouldCycle", cycle.wouldCycle());
        Parameter direct = cycle.directReference();
        if (direct != null)
            node.put("directReference", direct.name());
        else
            node.putNull("directReference");
        node.set("path", array(cycle.pathNames()));
        return node;
    }

    /** Pretty-printed JSON text of a mutation outcome. */
    public String toString(MutationResult result) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diagnostic", e);
        }
    }

    private ArrayNode array(List<String> values) {
        ArrayNode array = mapper.createArrayNode();
        for (String v : values)
            array.add(v);
        return array;
    }
}
