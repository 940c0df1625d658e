package com.parametric.formula.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The lexical configuration of a host's formula language.
 *
 * A dialect fixes two things:
 * <ul>
 * <li><b>Reserved functions</b>: names (case-insensitive) that are never
 * resolved as parameter references, e.g. {@code sin}, {@code if}.</li>
 * <li><b>Boundary characters</b>: characters that cannot be part of an
 * identifier and therefore delimit tokens (operators, brackets, whitespace).
 * The double quote is never a boundary character because it delimits string
 * literals.</li>
 * </ul>
 *
 * Dialects are immutable and supplied once at construction of the
 * {@link Tokenizer} and {@link ReferenceResolver}.
 */
public final class FormulaDialect {

    /** Built-in functions of the default host formula language. */
    public static final List<String> DEFAULT_FUNCTIONS = List.of(
            "sin", "cos", "tan", "asin", "acos", "atan", "exp", "log", "sqrt", "abs",
            "if", "or", "and", "not", "text_file_lookup_obsoleted", "pi",
            "ConduitSize_Lookup_obsoleted", "round", "roundup", "rounddown", "size_lookup", "ln");

    /** Operators plus structural formula characters. */
    public static final String DEFAULT_BOUNDARY_CHARS = "+-*/^=>< []()," + "\t\r\n";

    private static final FormulaDialect DEFAULT = builder().build();

    private final Set<String> reservedFunctions;
    private final String boundaryChars;
    // Fast path for ASCII; anything above is looked up in boundaryChars.
    private final boolean[] asciiBoundary = new boolean[128];

    private FormulaDialect(Set<String> reservedFunctions, String boundaryChars) {
        TreeSet<String> functions = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        functions.addAll(reservedFunctions);
        this.reservedFunctions = Collections.unmodifiableSet(functions);
        this.boundaryChars = boundaryChars;
        for (int i = 0; i < boundaryChars.length(); i++) {
            char c = boundaryChars.charAt(i);
            if (c < 128)
                asciiBoundary[c] = true;
        }
    }

    /** The default host dialect. */
    public static FormulaDialect defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isBoundary(char c) {
        if (c < 128)
            return asciiBoundary[c];
        return boundaryChars.indexOf(c) >= 0;
    }

    public boolean isReservedFunction(String token) {
        return token != null && reservedFunctions.contains(token);
    }

    /** Reserved function names, iterated case-insensitively sorted. */
    public Set<String> reservedFunctions() {
        return reservedFunctions;
    }

    /** Distinct boundary characters, in declaration order. */
    public String boundaryChars() {
        return boundaryChars;
    }

    @Override
    public String toString() {
        return "FormulaDialect[functions=" + reservedFunctions.size() + ", boundaries="
                + boundaryChars.replace("\t", "\\t").replace("\r", "\\r").replace("\n", "\\n") + "]";
    }

    /**
     * Builder for host-specific dialects.
     * Starts from the defaults unless {@link #withoutDefaults()} is called.
     */
    public static final class Builder {
        private final Set<String> functions = new LinkedHashSet<>(DEFAULT_FUNCTIONS);
        private final Set<Character> boundaries = new LinkedHashSet<>();

        private Builder() {
            addBoundaries(DEFAULT_BOUNDARY_CHARS);
        }

        /** Clears the default functions and boundary characters. */
        public Builder withoutDefaults() {
            functions.clear();
            boundaries.clear();
            return this;
        }

        public Builder reservedFunction(String... names) {
            for (String name : names) {
                if (name == null || name.isBlank())
                    throw new IllegalArgumentException("Reserved function name must not be blank");
                functions.add(name.trim());
            }
            return this;
        }

        public Builder reservedFunctions(Iterable<String> names) {
            for (String name : names)
                reservedFunction(name);
            return this;
        }

        public Builder boundaryChars(String chars) {
            addBoundaries(chars);
            return this;
        }

        private void addBoundaries(String chars) {
            for (int i = 0; i < chars.length(); i++) {
                char c = chars.charAt(i);
                if (c == '"')
                    throw new IllegalArgumentException("The double quote delimits string literals and cannot be a boundary");
                boundaries.add(c);
            }
        }

        public FormulaDialect build() {
            if (boundaries.isEmpty())
                throw new IllegalStateException("A dialect needs at least one boundary character");
            StringBuilder sb = new StringBuilder(boundaries.size());
            for (char c : boundaries)
                sb.append(c);
            return new FormulaDialect(functions, sb.toString());
        }
    }
}
