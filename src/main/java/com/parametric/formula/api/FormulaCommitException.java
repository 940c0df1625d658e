package com.parametric.formula.api;

/**
 * Raised by a {@link FormulaCommitter} when the host refuses a formula.
 */
public class FormulaCommitException extends Exception {

    public FormulaCommitException(String message) {
        super(message);
    }

    public FormulaCommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
