package com.parametric.formula.util;

import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterSet;
import com.parametric.formula.core.ReferenceResolver;
import com.parametric.formula.engine.DependencyNavigator;
import com.parametric.formula.engine.ReferenceOrder;

import java.util.List;

/**
 * Diagnostic utility for inspecting a parameter set and its references.
 *
 * <p>
 * Generates human-readable descriptions of single parameters, of the whole
 * reference graph in evaluation order, and Mermaid diagrams for embedding in
 * Markdown.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging rejected mutations
 * and tooling output.
 */
public final class FormulaExplain {
    private final ReferenceResolver resolver;
    private final DependencyNavigator navigator;

    public FormulaExplain(ReferenceResolver resolver) {
        this.resolver = resolver;
        this.navigator = new DependencyNavigator(resolver);
    }

    /**
     * Dumps a single parameter with its formula and both reference directions.
     *
     * @throws IllegalArgumentException if no parameter has this name.
     */
    public String explainParameter(String name, ParameterSet parameters) {
        Parameter p = parameters.byName(name);
        if (p == null)
            throw new IllegalArgumentException("Unknown parameter: " + name);

        StringBuilder sb = new StringBuilder(256);
        sb.append("Parameter: ").append(p.name()).append('\n')
                .append("  Id: ").append(p.id()).append('\n')
                .append("  Kind: ").append(p.designation()).append(p.isBuiltIn() ? " (built-in)" : "").append('\n')
                .append("  Data type: ").append(p.dataType()).append('\n')
                .append("  Formula: ").append(p.formula() != null ? p.formula() : "<none>").append('\n');
        appendNames(sb, "  Dependencies", navigator.getDependencies(p, parameters));
        appendNames(sb, "  Dependents", navigator.getDependents(p, parameters));
        List<String> invalid = resolver.getInvalidReferences(parameters, p.formula());
        if (!invalid.isEmpty())
            sb.append("  Unknown tokens: ").append(String.join(", ", invalid)).append('\n');
        return sb.toString();
    }

    /**
     * Dumps the reference graph in evaluation order, each parameter followed by
     * the parameters reading it.
     *
     * @throws IllegalStateException if the set's formulas contain a cycle.
     */
    public String dumpReferences(ParameterSet parameters) {
        ReferenceOrder order = ReferenceOrder.of(parameters, resolver);
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Parameters (").append(order.parameterCount()).append("):\n");
        for (int i = 0; i < order.parameterCount(); i++) {
            Parameter p = order.parameter(i);
            sb.append("  [").append(i).append("] ").append(p.name());
            if (order.isSource(i))
                sb.append(" (SRC)");
            int dc = order.dependentCount(i);
            if (dc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < dc; j++) {
                    sb.append(order.parameter(order.dependent(i, j)).name());
                    if (j < dc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid graph diagram. Edges point from a referenced
     * parameter to the parameter whose formula reads it.
     */
    public String toMermaid(ParameterSet parameters) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare parameters in set order
        for (Parameter p : parameters) {
            sb.append("  ").append(nodeId(p)).append("[\"").append(escape(p.name()));
            if (p.formula() != null)
                sb.append("<br/><i>= ").append(escape(p.formula())).append("</i>");
            sb.append("\"]");
            if (p.isInstance())
                sb.append(":::instance");
            sb.append(";\n");
        }

        // 2. Then every reference
        for (Parameter p : parameters) {
            for (Parameter dep : navigator.getDependencies(p, parameters))
                sb.append("  ").append(nodeId(dep)).append(" --> ").append(nodeId(p)).append(";\n");
        }
        return sb.toString();
    }

    private static void appendNames(StringBuilder sb, String label, List<Parameter> params) {
        sb.append(label).append(" (").append(params.size()).append("): ");
        for (int i = 0; i < params.size(); i++) {
            sb.append(params.get(i).name());
            if (i < params.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }

    // Names may contain spaces and operators, so ids are derived from the stable id
    private static String nodeId(Parameter p) {
        return "p" + p.id().value();
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
