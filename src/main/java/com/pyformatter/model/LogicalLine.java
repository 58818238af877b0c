package com.pyformatter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;

/**
 * One statement, or one blank or comment-only unit, possibly spanning several physical lines.
 * The token list includes the leading indent and the terminating line break, so the
 * logical lines of a file cover its text without gaps.
 */
public class LogicalLine {
    private final int index;
    private final List<Token> tokens;
    private final int[] depths;
    private final List<Integer> significant;
    private final LineKind kind;
    private final String indentText;
    private final int indentWidth;
    private final int alternateIndentWidth;
    private final Token trailingComment;

    public LogicalLine(int index, List<Token> tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("A logical line needs at least one token");
        }
        this.index = index;
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
        this.depths = new int[tokens.size()];

        List<Integer> significantIndexes = new ArrayList<>();
        int depth = 0;
        boolean hasComment = false;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenKind.CLOSE_BRACKET)) {
                depth--;
            }
            depths[i] = depth;
            if (token.is(TokenKind.OPEN_BRACKET)) {
                depth++;
            }
            if (token.isSignificant()) {
                significantIndexes.add(i);
            } else if (token.is(TokenKind.COMMENT)) {
                hasComment = true;
            }
        }
        this.significant = Collections.unmodifiableList(significantIndexes);

        if (!significantIndexes.isEmpty()) {
            this.kind = LineKind.CODE;
        } else {
            this.kind = hasComment ? LineKind.COMMENT : LineKind.BLANK;
        }

        Token first = tokens.get(0);
        // A leading byte order mark is lexed into the first indent but is not indentation.
        this.indentText = first.is(TokenKind.INDENT) ? first.getText().replace("\uFEFF", "") : "";
        this.indentWidth = IndentMeasure.width(indentText);
        this.alternateIndentWidth = IndentMeasure.alternateWidth(indentText);
        this.trailingComment = kind == LineKind.CODE ? _findTrailingComment() : null;
    }

    private Token _findTrailingComment() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            Token token = tokens.get(i);
            if (token.is(TokenKind.COMMENT)) {
                return token;
            }
            if (!token.is(TokenKind.NEWLINE) && !token.is(TokenKind.WHITESPACE)) {
                return null;
            }
        }
        return null;
    }

    public int getIndex() { return index; }
    public List<Token> getTokens() { return tokens; }
    public LineKind getKind() { return kind; }
    public String getIndentText() { return indentText; }
    public int getIndentWidth() { return indentWidth; }
    public int getAlternateIndentWidth() { return alternateIndentWidth; }
    public Token getTrailingComment() { return trailingComment; }

    public boolean isCode() {
        return kind == LineKind.CODE;
    }

    public int getStartOffset() {
        return tokens.get(0).getStart();
    }

    public int getEndOffset() {
        return tokens.get(tokens.size() - 1).getEnd();
    }

    public int getFirstPhysicalLine() {
        return tokens.get(0).getLine();
    }

    public int getLastPhysicalLine() {
        Token last = tokens.get(tokens.size() - 1);
        return last.is(TokenKind.NEWLINE) ? last.getLine() : last.getLine() + _lineBreaks(last.getText());
    }

    /**
     * The line break that ends this logical line, or an empty string at end of input.
     */
    public String getLineEnding() {
        Token last = tokens.get(tokens.size() - 1);
        return last.is(TokenKind.NEWLINE) ? last.getText() : "";
    }

    public boolean endsWithLineBreak() {
        return tokens.get(tokens.size() - 1).is(TokenKind.NEWLINE);
    }

    /**
     * Bracket depth at which the token at {@code tokenIndex} sits; brackets report the outer depth.
     */
    public int depthAt(int tokenIndex) {
        return depths[tokenIndex];
    }

    /**
     * Positions (into {@link #getTokens()}) of the significant tokens, in order.
     */
    public List<Integer> getSignificantIndexes() {
        return significant;
    }

    public Token firstSignificant() {
        return significant.isEmpty() ? null : tokens.get(significant.get(0));
    }

    public Token lastSignificant() {
        return significant.isEmpty() ? null : tokens.get(significant.get(significant.size() - 1));
    }

    public boolean startsWithKeyword(String keyword) {
        Token first = firstSignificant();
        return first != null && first.isKeyword(keyword);
    }

    /**
     * A block header ends with a colon outside any brackets.
     */
    public boolean isHeader() {
        if (significant.isEmpty()) {
            return false;
        }
        int last = significant.get(significant.size() - 1);
        return tokens.get(last).isOperator(":") && depths[last] == 0;
    }

    /**
     * Whether this line is a bare {@code #} comment line, the form of an inserted block end marker.
     */
    public boolean isBareMarker() {
        if (kind != LineKind.COMMENT) {
            return false;
        }
        for (Token token : tokens) {
            if (token.is(TokenKind.COMMENT)) {
                return token.getText().stripTrailing().equals("#");
            }
        }
        return false;
    }

    /**
     * Index of the matching close bracket for the open bracket at {@code openIndex}, or -1.
     */
    public int matchingClose(int openIndex) {
        int depth = depths[openIndex];
        for (int i = openIndex + 1; i < tokens.size(); i++) {
            if (tokens.get(i).is(TokenKind.CLOSE_BRACKET) && depths[i] == depth) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Source text covered by this line.
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.getText());
        }
        return sb.toString();
    }

    private static int _lineBreaks(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "LogicalLine[" + index + ", " + kind + ", line " + getFirstPhysicalLine() + "]";
    }
}
