package com.parametric.formula.node;

import com.parametric.formula.api.FormulaCommitException;
import com.parametric.formula.api.FormulaCommitter;
import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterId;
import com.parametric.formula.api.ParameterSet;
import com.parametric.formula.core.ReferenceResolver;
import com.parametric.formula.engine.ReferenceOrder;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * In-memory host store: a {@link ParameterSet} that is also its own
 * {@link FormulaCommitter}.
 *
 * Used wherever there is no real host document (tests, fixtures, tooling).
 * Its commit behaves like a strict host evaluator and refuses, independently
 * of any prior validation:
 * - unknown or built-in targets;
 * - targets whose data type cannot hold formulas;
 * - type parameters referencing instance parameters;
 * - formulas that would leave a cycle in the set.
 *
 * Iteration follows insertion order.
 */
@Log4j2
public final class ParameterStore implements ParameterSet, FormulaCommitter {

    /** Data types for which formulas cannot be assigned. */
    public static final Set<String> DEFAULT_FORBIDDEN_DATA_TYPES = Set.of("url", "load_classification",
            "multiline_text");

    private final ReferenceResolver resolver;
    private final Set<String> forbiddenDataTypes;
    private final Map<String, ParameterNode> byName = new LinkedHashMap<>();
    private final Map<ParameterId, ParameterNode> byId = new HashMap<>();

    public ParameterStore(ReferenceResolver resolver) {
        this(resolver, DEFAULT_FORBIDDEN_DATA_TYPES);
    }

    public ParameterStore(ReferenceResolver resolver, Set<String> forbiddenDataTypes) {
        this.resolver = resolver;
        this.forbiddenDataTypes = Set.copyOf(forbiddenDataTypes);
    }

    public ParameterStore add(ParameterNode parameter) {
        if (byName.containsKey(parameter.name()))
            throw new IllegalArgumentException("Duplicate parameter name: " + parameter.name());
        if (byId.containsKey(parameter.id()))
            throw new IllegalArgumentException("Duplicate parameter id: " + parameter.id());
        byName.put(parameter.name(), parameter);
        byId.put(parameter.id(), parameter);
        return this;
    }

    /**
     * Renames a parameter. Formulas referencing the old name are not rewritten,
     * exactly as a host rename of an unreferenced parameter.
     */
    public void rename(String oldName, String newName) {
        ParameterNode node = require(oldName);
        if (newName == null || newName.isEmpty())
            throw new IllegalArgumentException("Parameter name must not be empty");
        if (byName.containsKey(newName))
            throw new IllegalArgumentException("Duplicate parameter name: " + newName);

        // Rebuild to keep the parameter in its original position
        List<ParameterNode> nodes = new ArrayList<>(byName.values());
        byName.clear();
        node.rename(newName);
        for (ParameterNode n : nodes)
            byName.put(n.name(), n);
    }

    public void remove(String name) {
        ParameterNode node = require(name);
        byName.remove(name);
        byId.remove(node.id());
    }

    /**
     * Assigns a formula without any validation. Only for seeding a store from
     * trusted definitions; everything else goes through {@link #commit}.
     */
    public void assignUnchecked(String name, String formula) {
        require(name).assignFormula(formula == null || formula.isBlank() ? null : formula);
    }

    @Override
    public void commit(Parameter target, String formula) throws FormulaCommitException {
        ParameterNode node = byId.get(target.id());
        if (node == null)
            throw new FormulaCommitException("Parameter '" + target.name() + "' does not belong to this store");
        if (node.isBuiltIn())
            throw new FormulaCommitException("Built-in parameter '" + node.name() + "' cannot hold a formula");

        String normalized = formula == null || formula.isBlank() ? null : formula;
        if (normalized != null) {
            if (forbiddenDataTypes.contains(node.dataType()))
                throw new FormulaCommitException("Cannot set formula on parameter '" + node.name()
                        + "'. Data type '" + node.dataType() + "' is formula-forbidden, among these others: "
                        + String.join(", ", new TreeSet<>(forbiddenDataTypes)) + ".");

            if (!node.isInstance()) {
                for (Parameter p : resolver.getReferencedIn(this, normalized))
                    if (p.isInstance())
                        throw new FormulaCommitException("Type parameter formula cannot reference instance parameter '"
                                + p.name() + "'");
            }

            try {
                ReferenceOrder.of(this, resolver, node, normalized);
            } catch (IllegalStateException e) {
                throw new FormulaCommitException("Circular chain of references among formulas", e);
            }
        }

        node.assignFormula(normalized);
        log.debug("Committed {}", node);
    }

    /** Looks up a parameter by id, or null. */
    public ParameterNode byId(ParameterId id) {
        return byId.get(id);
    }

    @Override
    public ParameterNode byName(String name) {
        return byName.get(name);
    }

    /**
     * @throws IllegalArgumentException if no parameter has this name.
     */
    public ParameterNode require(String name) {
        ParameterNode node = byName.get(name);
        if (node == null)
            throw new IllegalArgumentException("Unknown parameter: " + name);
        return node;
    }

    public Set<String> forbiddenDataTypes() {
        return forbiddenDataTypes;
    }

    @Override
    public int size() {
        return byName.size();
    }

    @Override
    public Iterator<Parameter> iterator() {
        return Collections.<Parameter>unmodifiableCollection(byName.values()).iterator();
    }
}
