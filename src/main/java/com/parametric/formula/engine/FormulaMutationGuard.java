package com.parametric.formula.engine;

import com.parametric.formula.api.CycleResult;
import com.parametric.formula.api.FormulaCommitException;
import com.parametric.formula.api.FormulaCommitter;
import com.parametric.formula.api.FormulaError;
import com.parametric.formula.api.FormulaMutationListener;
import com.parametric.formula.api.MutationResult;
import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterSet;
import com.parametric.formula.core.ReferenceResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The only path through which formulas are written.
 *
 * Validation runs in a fixed order and stops at the first failure:
 *
 * 1. Clear: a blank formula skips all checks and clears the formula.
 * 2. References: every parameter-like token must name an existing parameter.
 * 3. Class: a type parameter may only reference type parameters.
 * 4. Cycles: no referenced parameter may already lead back to the target.
 * 5. Commit: the host's {@link FormulaCommitter} is called. Whatever it throws
 * is captured as {@link FormulaError.CommitRejected}; host exceptions never
 * escape this class.
 *
 * Nothing is written unless all local checks pass, so a rejected mutation
 * leaves the host untouched and the caller can simply re-prompt.
 */
public final class FormulaMutationGuard {
    private static final Logger log = LogManager.getLogger(FormulaMutationGuard.class);

    private static final int MAX_UNIT_SUFFIX_LENGTH = 3;

    private final ReferenceResolver resolver;
    private final CycleDetector cycleDetector;
    private FormulaMutationListener listener = FormulaMutationListener.NONE;

    public FormulaMutationGuard(ReferenceResolver resolver) {
        this(resolver, new CycleDetector(resolver));
    }

    public FormulaMutationGuard(ReferenceResolver resolver, CycleDetector cycleDetector) {
        this.resolver = resolver;
        this.cycleDetector = cycleDetector;
    }

    public void setListener(FormulaMutationListener listener) {
        this.listener = listener != null ? listener : FormulaMutationListener.NONE;
    }

    /**
     * Validates and commits a formula.
     *
     * @param target     The parameter receiving the formula.
     * @param formula    The formula; null or blank clears it.
     * @param parameters The current parameter set snapshot.
     * @param committer  The host's commit operation.
     * @return Success, or the first validation failure.
     */
    public MutationResult trySetFormula(Parameter target, String formula, ParameterSet parameters,
            FormulaCommitter committer) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(committer, "committer");

        if (formula == null || formula.isBlank())
            return commit(target, null, List.of(), committer);

        // 2. Unknown references
        List<String> invalid = resolver.getInvalidReferences(parameters, formula);
        if (!invalid.isEmpty()) {
            List<String> unitSuffixes = new ArrayList<>();
            for (String token : invalid)
                if (looksLikeUnitSuffix(token))
                    unitSuffixes.add(token);
            return reject(target, formula, new FormulaError.UnknownReference(target.name(), invalid, unitSuffixes));
        }

        // 3. Type parameters can only reference other type parameters
        if (!target.isInstance()) {
            List<String> instanceNames = new ArrayList<>();
            for (Parameter p : resolver.getReferencedIn(parameters, formula))
                if (p.isInstance())
                    instanceNames.add(p.name());
            if (!instanceNames.isEmpty())
                return reject(target, formula,
                        new FormulaError.IllegalInstanceReference(target.name(), instanceNames));
        }

        // 4. Cycles
        CycleResult cycle = cycleDetector.detectCycle(target, formula, parameters);
        if (cycle.wouldCycle())
            return reject(target, formula, new FormulaError.WouldCreateCycle(target.name(), cycle));

        // Collected before committing: only used to explain a host rejection
        List<String> suspicious = resolver.getSuspiciousTokens(parameters, formula);
        return commit(target, formula, suspicious, committer);
    }

    /**
     * Sets the target's formula to a verbatim copy of the source's formula.
     * Both parameters must share a data type.
     */
    public MutationResult trySetFormulaFromSource(Parameter target, Parameter source, ParameterSet parameters,
            FormulaCommitter committer) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(source, "source");

        String formula = source.formula();
        if (formula == null || formula.isBlank())
            return reject(target, formula, new FormulaError.MissingSourceFormula(target.name(), source.name()));

        if (!Objects.equals(source.dataType(), target.dataType()))
            return reject(target, formula, new FormulaError.TypeMismatch(
                    target.name(), source.name(), source.dataType(), target.dataType()));

        return trySetFormula(target, formula, parameters, committer);
    }

    /**
     * Clears the target's formula, leaving its current value as a plain value.
     */
    public MutationResult unsetFormula(Parameter target, FormulaCommitter committer) {
        Objects.requireNonNull(target, "target");
        return commit(target, null, List.of(), committer);
    }

    private MutationResult commit(Parameter target, String formula, List<String> suspicious,
            FormulaCommitter committer) {
        try {
            committer.commit(target, formula);
        } catch (FormulaCommitException e) {
            log.warn("Host rejected formula '{}' on '{}': {}", formula, target.name(), e.getMessage());
            return reject(target, formula, new FormulaError.CommitRejected(target.name(), e.getMessage(), suspicious));
        } catch (RuntimeException e) {
            log.warn("Host commit failed for formula '{}' on '{}'", formula, target.name(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return reject(target, formula, new FormulaError.CommitRejected(target.name(), message, suspicious));
        }
        listener.onCommitted(target, formula);
        return MutationResult.success();
    }

    private MutationResult reject(Parameter target, String formula, FormulaError error) {
        log.debug("Rejected formula '{}' on '{}': {}", formula, target.name(), error.kind());
        listener.onRejected(target, formula, error);
        return MutationResult.failure(error);
    }

    /** Short, letters-only tokens such as "in", "mm", "deg", "Hz". */
    static boolean looksLikeUnitSuffix(String token) {
        if (token.isEmpty() || token.length() > MAX_UNIT_SUFFIX_LENGTH)
            return false;
        for (int i = 0; i < token.length(); i++)
            if (!Character.isLetter(token.charAt(i)))
                return false;
        return true;
    }
}
