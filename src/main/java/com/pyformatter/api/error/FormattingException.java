package com.pyformatter.api.error;

/**
 * Base class for malformed-input failures that make a single file unformattable.
 */
public class FormattingException extends Exception {
    private final int line;
    private final int column;

    public FormattingException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() { return line; }
    public int getColumn() { return column; }
}
