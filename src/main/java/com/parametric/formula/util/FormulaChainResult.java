package com.parametric.formula.util;

import com.parametric.formula.api.Parameter;

import java.util.List;

/**
 * Result of following a chain of pass-through formulas.
 *
 * @param source                   The last parameter of the chain: it has no
 *                                 formula, a constant formula or a formula that
 *                                 is more than a single name.
 * @param intermediates            Parameters between the start (inclusive) and
 *                                 the source; empty if the start is the source.
 * @param sourceHasConstantFormula true if the source's formula references no
 *                                 parameter and could be replaced by its value.
 */
public record FormulaChainResult(Parameter source, List<Parameter> intermediates,
        boolean sourceHasConstantFormula) {

    public FormulaChainResult {
        intermediates = List.copyOf(intermediates);
    }

    public boolean isPassThrough() {
        return !intermediates.isEmpty();
    }
}
