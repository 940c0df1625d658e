package com.parametric.formula.api;

/**
 * Result of a guarded formula mutation: either committed, or rejected with a
 * {@link FormulaError} and nothing written.
 */
public record MutationResult(FormulaError error) {

    private static final MutationResult SUCCESS = new MutationResult(null);

    public static MutationResult success() {
        return SUCCESS;
    }

    public static MutationResult failure(FormulaError error) {
        if (error == null)
            throw new IllegalArgumentException("error must not be null");
        return new MutationResult(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the error cast to the expected variant.
     *
     * @throws IllegalStateException if the mutation succeeded or failed with
     *                               another variant.
     */
    public <E extends FormulaError> E errorAs(Class<E> type) {
        if (!type.isInstance(error))
            throw new IllegalStateException("Expected " + type.getSimpleName() + " but was " + error);
        return type.cast(error);
    }
}
