package com.parametric.formula.core;

import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterId;
import com.parametric.formula.api.ParameterSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves which parameters a formula references.
 *
 * A name N is referenced in formula F only when an occurrence of N in F has a
 * boundary character (or the start of F) immediately to its left and a
 * boundary character (or the end of F) immediately to its right. "Width" is
 * therefore not referenced in "Widths * 2", and neither "A" nor "B" is
 * referenced in "AB".
 *
 * When one name contains another ("Width" and "Width Offset"), set-wide
 * resolution masks the longer name first so the shorter one is not reported
 * inside it. {@link #isReferencedIn(String, String)} is the raw point query
 * and does not mask.
 *
 * Results are recomputed from the formula text on every call; nothing is
 * cached, so an edited formula is always seen as it currently is.
 */
public final class ReferenceResolver {
    private final Tokenizer tokenizer;

    public ReferenceResolver(FormulaDialect dialect) {
        this(new Tokenizer(dialect));
    }

    public ReferenceResolver(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }

    public FormulaDialect dialect() {
        return tokenizer.dialect();
    }

    /**
     * Checks whether the parameter's name is referenced in the formula.
     */
    public boolean isReferencedIn(Parameter parameter, String formula) {
        return isReferencedIn(parameter.name(), formula);
    }

    /**
     * Checks whether {@code name} occurs in {@code formula} as a complete,
     * boundary-delimited token.
     *
     * String literals are not stripped here; callers that need literal safety
     * must strip them first.
     */
    public boolean isReferencedIn(String name, String formula) {
        if (name == null || name.isEmpty() || formula == null || formula.isEmpty())
            return false;

        int searchStart = 0;
        while (searchStart < formula.length()) {
            int index = formula.indexOf(name, searchStart);
            if (index == -1)
                return false;
            if (tokenizer.isBoundedAt(formula, index, name.length()))
                return true;
            // Advance by one, not past the match, so overlapping candidates are still seen
            searchStart = index + 1;
        }
        return false;
    }

    /**
     * Checks whether {@code owner}'s current formula references {@code other},
     * with the same longest-name-first rule as
     * {@link #getReferencedIn(ParameterSet, String)}.
     */
    public boolean referencesParameter(Parameter owner, Parameter other, ParameterSet parameters) {
        String formula = owner.formula();
        if (formula == null || formula.isBlank() || !isReferencedIn(other, formula))
            return false;
        for (Parameter p : getReferencedIn(parameters, formula)) {
            if (p.id().equals(other.id()))
                return true;
        }
        return false;
    }

    /**
     * Gets all parameters of the set referenced in the given formula, in set
     * order. Use this to validate a formula before setting it.
     *
     * <p>
     * Names are matched longest first and each match is masked before shorter
     * names are checked, so with parameters "Width" and "Width Offset" the
     * formula "Width Offset * 2" references only "Width Offset".
     */
    public List<Parameter> getReferencedIn(ParameterSet parameters, String formula) {
        if (formula == null || formula.isBlank())
            return List.of();

        List<Parameter> byLength = new ArrayList<>(parameters.size());
        for (Parameter p : parameters) {
            String name = p.name();
            if (name != null && !name.isEmpty())
                byLength.add(p);
        }
        byLength.sort(Comparator.comparingInt((Parameter p) -> p.name().length()).reversed());

        Set<ParameterId> hits = new HashSet<>();
        String masked = formula;
        for (Parameter p : byLength) {
            if (isReferencedIn(p.name(), masked)) {
                hits.add(p.id());
                masked = tokenizer.mask(masked, p.name());
            }
        }
        if (hits.isEmpty())
            return List.of();

        List<Parameter> referenced = new ArrayList<>(hits.size());
        for (Parameter p : parameters) {
            if (hits.contains(p.id()))
                referenced.add(p);
        }
        return referenced;
    }

    /**
     * Returns the parameter-like tokens of the formula that do not name any
     * parameter of the set. Empty if every reference is valid.
     */
    public List<String> getInvalidReferences(ParameterSet parameters, String formula) {
        if (formula == null || formula.isBlank())
            return List.of();
        return List.copyOf(tokenizer.extractInvalidTokens(formula, names(parameters)));
    }

    /**
     * Returns digit-leading tokens that are not plain numbers, for diagnosing
     * formulas the host rejects.
     */
    public List<String> getSuspiciousTokens(ParameterSet parameters, String formula) {
        if (formula == null || formula.isBlank())
            return List.of();
        return List.copyOf(tokenizer.extractSuspiciousTokens(formula, names(parameters)));
    }

    private static List<String> names(ParameterSet parameters) {
        List<String> names = new ArrayList<>(parameters.size());
        for (Parameter p : parameters)
            names.add(p.name());
        return names;
    }
}
