package com.pyformatter.lexer;

/**
 * Lexical categories produced by {@link PythonLexer}.
 */
public enum TokenKind {
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    OPERATOR,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    COMMENT,
    NEWLINE,
    /** Leading whitespace of a statement's first physical line. */
    INDENT,
    /** Any other run of spaces, tabs or form feeds. */
    WHITESPACE,
    /** A backslash together with the line ending it escapes. */
    CONTINUATION;

    /**
     * Whether tokens of this kind carry program content, as opposed to layout.
     */
    public boolean isSignificant() {
        return switch (this) {
            case NEWLINE, INDENT, WHITESPACE, CONTINUATION, COMMENT -> false;
            default -> true;
        };
    }

    public boolean isLineBreak() {
        return this == NEWLINE || this == CONTINUATION;
    }
}
