package com.parametric.formula.api;

/**
 * A parameter in a parametric object model.
 *
 * This interface is the read-only view the formula engine has of a parameter
 * owned by the host. The engine never creates, deletes or renames parameters;
 * it reads their name and class, and proposes new formulas through a
 * {@link FormulaCommitter}.
 *
 * Key Properties:
 *
 * 1. Identity: {@link #id()} is stable for the lifetime of the parameter and is
 * what cycle detection and path reconstruction compare on.
 *
 * 2. Name: {@link #name()} is unique within its {@link ParameterSet} and may
 * contain spaces ("Width Offset"). Formulas reference parameters by name.
 *
 * 3. Class: type parameters ({@code isInstance() == false}) may only reference
 * other type parameters; instance parameters may reference both.
 *
 * 4. Formula: {@link #formula()} is the current formula, or null when the
 * parameter holds a plain value.
 */
public interface Parameter {

    /**
     * @return The stable identity of this parameter.
     */
    ParameterId id();

    /**
     * @return The display name, unique within the owning set.
     */
    String name();

    /**
     * @return true for instance parameters, false for type parameters.
     */
    boolean isInstance();

    /**
     * Returns the data type token of this parameter (e.g. "length", "text").
     *
     * The engine treats it as opaque: two parameters share a data type when
     * their tokens are equal.
     *
     * @return The data type token, never null.
     */
    String dataType();

    /**
     * @return The current formula, or null if the parameter has none.
     */
    String formula();

    /**
     * Built-in parameters are reserved by the host and can never hold formulas,
     * so they are never reported as dependents.
     *
     * @return true if this is a host built-in parameter.
     */
    default boolean isBuiltIn() {
        return false;
    }

    /**
     * @return "Instance" or "Type".
     */
    default String designation() {
        return isInstance() ? "Instance" : "Type";
    }
}
