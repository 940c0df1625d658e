package com.parametric.formula.node;

import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterId;

/**
 * A mutable, in-memory parameter owned by a {@link ParameterStore}.
 *
 * Name and formula are changed only by the store (rename, commit); the
 * engine sees this object through the read-only {@link Parameter} view.
 */
public final class ParameterNode implements Parameter {
    private final ParameterId id;
    private final boolean instance;
    private final String dataType;
    private final boolean builtIn;
    private String name;
    private String formula;

    /**
     * Creates a parameter.
     *
     * @param id       Stable identity.
     * @param name     Unique display name.
     * @param instance true for an instance parameter, false for a type parameter.
     * @param dataType Data type token.
     * @param builtIn  true for host built-in parameters (never hold formulas).
     */
    public ParameterNode(ParameterId id, String name, boolean instance, String dataType, boolean builtIn) {
        if (id == null)
            throw new IllegalArgumentException("id must not be null");
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Parameter name must not be empty");
        this.id = id;
        this.name = name;
        this.instance = instance;
        this.dataType = dataType != null ? dataType : "";
        this.builtIn = builtIn;
    }

    public static ParameterNode type(long id, String name, String dataType) {
        return new ParameterNode(ParameterId.of(id), name, false, dataType, false);
    }

    public static ParameterNode instance(long id, String name, String dataType) {
        return new ParameterNode(ParameterId.of(id), name, true, dataType, false);
    }

    @Override
    public ParameterId id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isInstance() {
        return instance;
    }

    @Override
    public String dataType() {
        return dataType;
    }

    @Override
    public String formula() {
        return formula;
    }

    @Override
    public boolean isBuiltIn() {
        return builtIn;
    }

    void rename(String newName) {
        this.name = newName;
    }

    void assignFormula(String formula) {
        this.formula = formula;
    }

    @Override
    public String toString() {
        return designation() + " '" + name + "' " + id + (formula != null ? " = " + formula : "");
    }
}
