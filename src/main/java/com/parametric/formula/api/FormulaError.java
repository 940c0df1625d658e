package com.parametric.formula.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A formula mutation rejected before anything was written.
 *
 * Every variant is pure data scoped to one mutation attempt: the caller can
 * report it and re-prompt with no state to repair. {@link #message()} gives a
 * ready-made diagnostic sentence; {@link #kind()} allows switching without
 * instanceof chains.
 */
public interface FormulaError {

    /** Discriminator of the error variants. */
    enum Kind {
        UNKNOWN_REFERENCE,
        ILLEGAL_INSTANCE_REFERENCE,
        TYPE_MISMATCH,
        MISSING_SOURCE_FORMULA,
        WOULD_CREATE_CYCLE,
        COMMIT_REJECTED
    }

    Kind kind();

    /** Name of the parameter whose formula was being set. */
    String target();

    /** Human-readable description suitable for a dialog or log line. */
    String message();

    /**
     * The formula contains boundary-delimited tokens that are neither known
     * parameter names, numeric literals nor reserved functions.
     *
     * @param tokens                The offending tokens, in formula order.
     * @param unitSuffixCandidates  The subset of tokens that look like unit
     *                              suffixes ("in", "mm", "deg").
     */
    record UnknownReference(String target, List<String> tokens, List<String> unitSuffixCandidates)
            implements FormulaError {

        public UnknownReference {
            tokens = List.copyOf(tokens);
            unitSuffixCandidates = List.copyOf(unitSuffixCandidates);
        }

        @Override
        public Kind kind() {
            return Kind.UNKNOWN_REFERENCE;
        }

        @Override
        public String message() {
            if (!unitSuffixCandidates.isEmpty()) {
                return "Cannot set formula on parameter '" + target + "'. "
                        + "Found tokens that look like unit suffixes: " + quoted(unitSuffixCandidates) + ". "
                        + "Formulas do not support unit suffixes; if this is a literal value, set it as a value. "
                        + "Otherwise these may be misspelled parameter names.";
            }
            return "Cannot set formula on parameter '" + target + "'. "
                    + "Formula references non-existent parameters: " + quoted(tokens);
        }
    }

    /**
     * A type parameter's formula references instance parameters.
     *
     * @param names The referenced instance parameter names.
     */
    record IllegalInstanceReference(String target, List<String> names) implements FormulaError {

        public IllegalInstanceReference {
            names = List.copyOf(names);
        }

        @Override
        public Kind kind() {
            return Kind.ILLEGAL_INSTANCE_REFERENCE;
        }

        @Override
        public String message() {
            return "Cannot set formula on type parameter '" + target + "'. "
                    + "Type parameter formulas cannot reference instance parameters: " + quoted(names);
        }
    }

    /**
     * Copying a formula between parameters of different data types.
     */
    record TypeMismatch(String target, String source, String sourceType, String targetType)
            implements FormulaError {

        @Override
        public Kind kind() {
            return Kind.TYPE_MISMATCH;
        }

        @Override
        public String message() {
            return "Cannot set formula on parameter '" + target + "'. "
                    + "Source parameter '" + source + "' has data type '" + sourceType
                    + "' but target parameter '" + target + "' has data type '" + targetType + "'.";
        }
    }

    /**
     * Copying a formula from a parameter that has none.
     */
    record MissingSourceFormula(String target, String source) implements FormulaError {

        @Override
        public Kind kind() {
            return Kind.MISSING_SOURCE_FORMULA;
        }

        @Override
        public String message() {
            return "Cannot set formula on parameter '" + target + "'. "
                    + "Source parameter '" + source + "' has no formula.";
        }
    }

    /**
     * The formula would close a circular chain of references.
     */
    record WouldCreateCycle(String target, CycleResult cycle) implements FormulaError {

        @Override
        public Kind kind() {
            return Kind.WOULD_CREATE_CYCLE;
        }

        @Override
        public String message() {
            return "Cannot set formula on parameter '" + target + "'. "
                    + "It would create a circular reference: " + target + " -> " + cycle.formatPath();
        }
    }

    /**
     * The host refused the commit after local validation passed.
     *
     * @param hostMessage      The host's own error text, passed through as is.
     * @param suspiciousTokens Digit-leading tokens that are not plain numbers;
     *                         often literals with a unit format the host did
     *                         not recognize.
     */
    record CommitRejected(String target, String hostMessage, List<String> suspiciousTokens)
            implements FormulaError {

        public CommitRejected {
            suspiciousTokens = List.copyOf(suspiciousTokens);
        }

        @Override
        public Kind kind() {
            return Kind.COMMIT_REJECTED;
        }

        @Override
        public String message() {
            if (!suspiciousTokens.isEmpty()) {
                return "Cannot set formula on parameter '" + target + "'. "
                        + "The host rejected the formula. Found tokens that may be numeric literals with "
                        + "unrecognized unit formats: " + quoted(suspiciousTokens) + ". "
                        + "Host error: " + hostMessage;
            }
            return "Cannot set formula on parameter '" + target + "'. Host error: " + hostMessage;
        }
    }

    private static String quoted(List<String> values) {
        return values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", "));
    }
}
