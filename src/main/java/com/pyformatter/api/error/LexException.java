package com.pyformatter.api.error;

/**
 * Raised for malformed lexical structure: unterminated strings, unbalanced brackets
 * or a stray line-continuation backslash.
 */
public class LexException extends FormattingException {
    public LexException(String message, int line, int column) {
        super(message, line, column);
    }
}
