package com.pyformatter.lexer;

/**
 * A slice of the source text with its lexical category.
 * Offsets are char indices into the source string, {@code end} exclusive;
 * line and column are 1-based.
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int start;
    private final int end;
    private final int line;
    private final int column;

    public Token(TokenKind kind, String text, int start, int line, int column) {
        this.kind = kind;
        this.text = text;
        this.start = start;
        this.end = start + text.length();
        this.line = line;
        this.column = column;
    }

    public TokenKind getKind() { return kind; }
    public String getText() { return text; }
    public int getStart() { return start; }
    public int getEnd() { return end; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    public boolean is(TokenKind kind) {
        return this.kind == kind;
    }

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenKind.KEYWORD, keyword);
    }

    public boolean isOperator(String operator) {
        return is(TokenKind.OPERATOR, operator);
    }

    public boolean isSignificant() {
        return kind.isSignificant();
    }

    @Override
    public String toString() {
        return String.format("%s[%s]@%d:%d", kind, text.replace("\n", "\\n"), line, column);
    }
}
