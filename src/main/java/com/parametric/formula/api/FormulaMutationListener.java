package com.parametric.formula.api;

/**
 * Observability interface for guarded formula mutations.
 *
 * Implementations are registered with the FormulaMutationGuard and receive
 * one callback per outcome. Typical uses:
 *
 * - Auditing: recording which formulas were committed.
 * - Diagnostics: collecting rejected formulas and their reasons.
 * - Metrics: counting rejections by {@link FormulaError.Kind}.
 *
 * Callbacks run synchronously inside the validate-and-commit call, so they
 * should not block.
 */
public interface FormulaMutationListener {

    /** A listener that ignores every event. */
    FormulaMutationListener NONE = new FormulaMutationListener() {
    };

    /**
     * Called after the host accepted the formula.
     *
     * @param target  The parameter that received the formula.
     * @param formula The committed formula, or null if it was cleared.
     */
    default void onCommitted(Parameter target, String formula) {
    }

    /**
     * Called when the mutation was rejected, locally or by the host.
     *
     * @param target  The parameter whose formula was being set.
     * @param formula The rejected formula.
     * @param error   Why it was rejected.
     */
    default void onRejected(Parameter target, String formula, FormulaError error) {
    }
}
