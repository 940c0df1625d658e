package com.parametric.formula.util;

import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterId;
import com.parametric.formula.api.ParameterSet;
import com.parametric.formula.core.ReferenceResolver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies formulas by shape.
 *
 * <p>
 * A formula is <b>constant</b> when it references no parameter ("20",
 * "7.75", "2 * pi()"), and a <b>single reference</b> when it is exactly one
 * parameter name. Chains of single-reference formulas are pass-throughs that
 * can be collapsed onto their source.
 */
public final class FormulaAnalysis {
    private final ReferenceResolver resolver;

    public FormulaAnalysis(ReferenceResolver resolver) {
        this.resolver = resolver;
    }

    /** True if the formula is not blank and references no parameter. */
    public boolean isConstant(ParameterSet parameters, String formula) {
        if (formula == null || formula.isBlank())
            return false;
        return resolver.getReferencedIn(parameters, formula).isEmpty();
    }

    /**
     * Returns the parameter if the formula is exactly its name (ignoring
     * surrounding whitespace), otherwise null.
     */
    public Parameter singleReference(ParameterSet parameters, String formula) {
        if (formula == null || formula.isBlank())
            return null;
        List<Parameter> referenced = resolver.getReferencedIn(parameters, formula);
        if (referenced.size() != 1)
            return null;
        Parameter p = referenced.get(0);
        return formula.trim().equals(p.name()) ? p : null;
    }

    /**
     * Follows single-reference formulas from {@code parameter} to the
     * parameter the chain ultimately reads.
     *
     * @throws IllegalStateException if the chain loops back on itself.
     */
    public FormulaChainResult resolveChain(Parameter parameter, ParameterSet parameters) {
        List<Parameter> intermediates = new ArrayList<>();
        Set<ParameterId> seen = new HashSet<>();
        Parameter current = parameter;

        while (true) {
            if (!seen.add(current.id()))
                throw new IllegalStateException("Formula chain loops at parameter '" + current.name() + "'");

            String formula = current.formula();
            if (formula == null || formula.isBlank())
                return new FormulaChainResult(current, intermediates, false);
            if (isConstant(parameters, formula))
                return new FormulaChainResult(current, intermediates, true);

            Parameter next = singleReference(parameters, formula);
            if (next == null)
                return new FormulaChainResult(current, intermediates, false);

            intermediates.add(current);
            current = next;
        }
    }
}
