package com.pyformatter.api.error;

/**
 * Raised when leading whitespace cannot be turned into a consistent block structure.
 */
public class IndentationException extends FormattingException {
    public IndentationException(String message, int line, int column) {
        super(message, line, column);
    }
}
