package com.parametric.formula.io;

import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterId;
import com.parametric.formula.core.FormulaDialect;
import com.parametric.formula.core.ReferenceResolver;
import com.parametric.formula.engine.ReferenceOrder;
import com.parametric.formula.node.ParameterNode;
import com.parametric.formula.node.ParameterStore;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a {@link ParameterSetDefinition} into a populated
 * {@link ParameterStore}.
 *
 * Formulas in a definition are trusted input, but the result must still be a
 * set the guard could have produced: every reference resolves, type formulas
 * reference only type parameters, and the reference graph is acyclic.
 */
@Log4j2
public final class ParameterSetCompiler {

    /**
     * Compiles the definition.
     *
     * @param def The parameter set definition.
     * @return The dialect, resolver, populated store and its reference order.
     * @throws IllegalArgumentException on duplicate names, unknown references or
     *                                  type-to-instance references.
     * @throws IllegalStateException    if the formulas contain a cycle.
     */
    public CompiledParameterSet compile(ParameterSetDefinition def) {
        ParameterSetDefinition.SetInfo info = def.getParameterSet();
        if (info == null)
            throw new IllegalArgumentException("Missing 'parameterSet' section");

        // 1. Dialect and store
        FormulaDialect dialect = buildDialect(info.getDialect());
        ReferenceResolver resolver = new ReferenceResolver(dialect);
        ParameterStore store = info.getForbiddenDataTypes() != null
                ? new ParameterStore(resolver, new HashSet<>(info.getForbiddenDataTypes()))
                : new ParameterStore(resolver);

        // 2. Parameters, formulas seeded without validation
        List<ParameterSetDefinition.ParameterDef> paramDefs = info.getParameters() != null
                ? info.getParameters()
                : List.of();
        for (ParameterSetDefinition.ParameterDef pd : paramDefs) {
            store.add(new ParameterNode(ParameterId.of(pd.getId()), pd.getName(), pd.isInstance(),
                    pd.getDataType(), pd.isBuiltIn()));
        }
        for (ParameterSetDefinition.ParameterDef pd : paramDefs) {
            if (pd.getFormula() != null)
                store.assignUnchecked(pd.getName(), pd.getFormula());
        }

        // 3. Validate the seeded formulas
        for (Parameter p : store) {
            if (p.formula() == null)
                continue;
            if (p.isBuiltIn())
                throw new IllegalArgumentException("Built-in parameter '" + p.name() + "' cannot hold a formula");
            List<String> invalid = resolver.getInvalidReferences(store, p.formula());
            if (!invalid.isEmpty())
                throw new IllegalArgumentException("Parameter '" + p.name()
                        + "' references non-existent parameters: " + String.join(", ", invalid));
            if (!p.isInstance()) {
                for (Parameter ref : resolver.getReferencedIn(store, p.formula()))
                    if (ref.isInstance())
                        throw new IllegalArgumentException("Type parameter '" + p.name()
                                + "' references instance parameter '" + ref.name() + "'");
            }
        }

        // 4. Acyclic check; single source of truth for evaluation order
        ReferenceOrder order = ReferenceOrder.of(store, resolver);

        log.debug("Compiled parameter set '{}' with {} parameters", info.getName(), store.size());
        return new CompiledParameterSet(info.getName(), dialect, resolver, store, order);
    }

    private static FormulaDialect buildDialect(ParameterSetDefinition.DialectDef dd) {
        if (dd == null)
            return FormulaDialect.defaults();
        FormulaDialect.Builder builder = FormulaDialect.builder();
        if (!dd.isExtendDefaults()) {
            builder.withoutDefaults();
            // Replacing boundaries is opt-in; functions alone may be replaced
            if (dd.getBoundaryChars() == null)
                builder.boundaryChars(FormulaDialect.DEFAULT_BOUNDARY_CHARS);
        }
        if (dd.getReservedFunctions() != null)
            builder.reservedFunctions(dd.getReservedFunctions());
        if (dd.getBoundaryChars() != null)
            builder.boundaryChars(dd.getBoundaryChars());
        return builder.build();
    }

    /** The result of compilation: a store ready for guarded mutation. */
    public record CompiledParameterSet(
            String name, FormulaDialect dialect, ReferenceResolver resolver,
            ParameterStore store, ReferenceOrder order) {
    }
}
