package com.parametric.formula.api;

/**
 * The host's own formula mutation.
 *
 * Supplied by the caller and invoked only after every local validation has
 * passed. The host remains the final authority: it may still refuse the
 * formula (forbidden data type, evaluator-level cycle detection, no valid
 * current type) by throwing {@link FormulaCommitException}.
 */
@FunctionalInterface
public interface FormulaCommitter {

    /**
     * Commits a formula to the host store.
     *
     * @param target  The parameter receiving the formula.
     * @param formula The new formula, or null to clear it.
     * @throws FormulaCommitException if the host refuses the mutation.
     */
    void commit(Parameter target, String formula) throws FormulaCommitException;
}
