package com.parametric.formula.engine;

import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterSet;
import com.parametric.formula.core.ReferenceResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Navigates formula dependency relationships without materializing a graph.
 *
 * Direction conventions:
 * - Dependencies (downstream): what a parameter's own formula references.
 * - Dependents (upstream): which other parameters reference this one.
 */
public final class DependencyNavigator {
    private final ReferenceResolver resolver;

    public DependencyNavigator(ReferenceResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Gets the parameters this parameter's formula references.
     *
     * @return Referenced parameters in set order; empty if there is no formula.
     */
    public List<Parameter> getDependencies(Parameter parameter, ParameterSet parameters) {
        return resolver.getReferencedIn(parameters, parameter.formula());
    }

    /**
     * Gets the parameters whose formulas reference this parameter. Built-in
     * parameters cannot hold formulas and are never dependents.
     */
    public List<Parameter> getDependents(Parameter parameter, ParameterSet parameters) {
        List<Parameter> dependents = new ArrayList<>();
        for (Parameter p : parameters) {
            if (p.isBuiltIn())
                continue;
            if (resolver.referencesParameter(p, parameter, parameters))
                dependents.add(p);
        }
        return dependents;
    }
}
