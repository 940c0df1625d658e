package com.parametric.formula.api;

/**
 * A snapshot of all parameters of one host document.
 *
 * Iteration order is significant: every list the engine returns (referenced
 * parameters, dependents, cycle roots) follows it. Implementations must return
 * the same order for the same snapshot.
 *
 * Thread Safety:
 * The engine assumes exclusive access to the set for the duration of one
 * validate-and-commit call. Serializing mutations is the host's job.
 */
public interface ParameterSet extends Iterable<Parameter> {

    /**
     * Looks up a parameter by exact (case-sensitive) name.
     *
     * @param name The parameter name.
     * @return The parameter, or null if not found.
     */
    Parameter byName(String name);

    /**
     * @return The number of parameters in this set.
     */
    int size();
}
