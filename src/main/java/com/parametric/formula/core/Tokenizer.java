package com.parametric.formula.core;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Low-level formula tokenization.
 *
 * <p>
 * Splits a formula into candidate name tokens. Known parameter names are
 * masked out first, longest name first, so that multi-word names such as
 * "Width Offset" are never split into "Width" and "Offset", and a shorter name
 * that is a prefix of a longer one ("Width") never leaves a fragment behind.
 *
 * <p>
 * Consumers should normally go through {@link ReferenceResolver}, which feeds
 * the live parameter names into this class.
 */
public final class Tokenizer {
    private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"");

    private final FormulaDialect dialect;

    public Tokenizer(FormulaDialect dialect) {
        if (dialect == null)
            throw new IllegalArgumentException("dialect must not be null");
        this.dialect = dialect;
    }

    public FormulaDialect dialect() {
        return dialect;
    }

    /**
     * Extracts potential parameter name tokens without masking any names.
     * Numbers and reserved functions are dropped; the rest is returned
     * unvalidated, distinct, in formula order.
     */
    public List<String> extractTokens(String formula) {
        if (formula == null || formula.isBlank())
            return List.of();

        Set<String> tokens = new LinkedHashSet<>();
        for (String token : split(stripStringLiterals(formula))) {
            if (!isNumeric(token) && !dialect.isReservedFunction(token))
                tokens.add(token);
        }
        return List.copyOf(tokens);
    }

    /**
     * Returns the tokens left after masking every known name that cannot be a
     * number, a reserved function, or a numeric literal with a unit suffix.
     * These are references to parameters that do not exist.
     *
     * @param formula    The formula to scan.
     * @param knownNames The names of all existing parameters.
     * @return Distinct invalid tokens in formula order; empty if the formula is
     *         valid or blank.
     */
    public Set<String> extractInvalidTokens(String formula, Collection<String> knownNames) {
        if (formula == null || formula.isBlank())
            return Set.of();

        Set<String> invalid = new LinkedHashSet<>();
        for (String token : extractUnknownTokens(formula, knownNames)) {
            if (couldBeParameterReference(token))
                invalid.add(token);
        }
        return Collections.unmodifiableSet(invalid);
    }

    /**
     * Returns the tokens left after masking that start with a digit but are not
     * plain numbers, e.g. {@code 0'} or {@code 12in}. They are usually literals
     * with a unit format the host does not accept, occasionally a parameter
     * whose name starts with a digit. Used to explain host rejections.
     */
    public Set<String> extractSuspiciousTokens(String formula, Collection<String> knownNames) {
        if (formula == null || formula.isBlank())
            return Set.of();

        Set<String> suspicious = new LinkedHashSet<>();
        for (String token : extractUnknownTokens(formula, knownNames)) {
            if (Character.isDigit(token.charAt(0)) && !isNumeric(token))
                suspicious.add(token);
        }
        return Collections.unmodifiableSet(suspicious);
    }

    /**
     * Masks every boundary-valid occurrence of {@code name} in {@code text} with
     * blanks. The scan runs left to right once; after a match it resumes past
     * the masked span, never inside it.
     *
     * @return A new string of the same length with matches blanked.
     */
    public String mask(String text, String name) {
        if (name == null || name.isEmpty() || text.length() < name.length())
            return text;

        final int len = name.length();
        final int maxStart = text.length() - len;
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            if (i <= maxStart && text.startsWith(name, i) && isBoundedAt(text, i, len)) {
                for (int j = 0; j < len; j++)
                    sb.append(' ');
                i += len;
            } else {
                sb.append(text.charAt(i++));
            }
        }
        return sb.toString();
    }

    /** Replaces each double-quoted string literal with a single blank. */
    public String stripStringLiterals(String formula) {
        return STRING_LITERAL.matcher(formula).replaceAll(" ");
    }

    /**
     * True if the span {@code [start, start + length)} of {@code text} has a
     * boundary character (or the string edge) on both sides.
     */
    boolean isBoundedAt(String text, int start, int length) {
        boolean leftValid = start == 0 || dialect.isBoundary(text.charAt(start - 1));
        int right = start + length;
        boolean rightValid = right >= text.length() || dialect.isBoundary(text.charAt(right));
        return leftValid && rightValid;
    }

    /** Splits on boundary characters, discarding empty segments. */
    List<String> split(String text) {
        List<String> tokens = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            if (dialect.isBoundary(text.charAt(i))) {
                if (start >= 0) {
                    tokens.add(text.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0)
            tokens.add(text.substring(start));
        return tokens;
    }

    /**
     * Core tokenization: strip string literals, mask known names longest
     * first, split on boundaries.
     */
    private List<String> extractUnknownTokens(String formula, Collection<String> knownNames) {
        String masked = stripStringLiterals(formula);

        List<String> sorted = new ArrayList<>(knownNames.size());
        for (String name : knownNames) {
            if (name != null && !name.isEmpty())
                sorted.add(name);
        }
        // "Width Offset" must be masked before "Width"
        sorted.sort(Comparator.comparingInt(String::length).reversed());

        for (String name : sorted)
            masked = mask(masked, name);

        return split(masked);
    }

    /**
     * Tokens starting with a digit are numeric literals, possibly with a unit
     * suffix ("12in"), never parameter names.
     */
    private boolean couldBeParameterReference(String token) {
        if (token.isEmpty())
            return false;
        if (Character.isDigit(token.charAt(0)))
            return false;
        if (isNumeric(token))
            return false;
        return !dialect.isReservedFunction(token);
    }

    static boolean isNumeric(String token) {
        try {
            new BigDecimal(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
