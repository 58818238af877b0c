package com.pyformatter.api.error;

/**
 * Signals a defect in a rule rather than bad input: overlapping edits, or output
 * that does not re-format to itself.
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
