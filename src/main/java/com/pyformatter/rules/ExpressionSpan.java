package com.pyformatter.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;
import com.pyformatter.model.LogicalLine;

/**
 * The tokens of one expression inside a logical line, given as inclusive indexes into
 * {@link LogicalLine#getTokens()} of its first and last significant token.
 */
final class ExpressionSpan {
    private static final Set<String> CONDITION_KEYWORDS = Set.of("if", "elif", "while");
    private static final Set<String> COMPOUND_KEYWORDS = Set.of(
            "if", "elif", "else", "while", "for", "try", "except", "finally", "with", "def", "class", "async");

    private final LogicalLine line;
    private final int first;
    private final int last;

    private ExpressionSpan(LogicalLine line, int first, int last) {
        this.line = line;
        this.first = first;
        this.last = last;
    }

    LogicalLine getLine() { return line; }
    int getFirst() { return first; }
    int getLast() { return last; }

    /**
     * The condition of an {@code if}, {@code elif} or {@code while} clause: everything
     * between the keyword and the clause colon, also when a one-line body follows the colon.
     * Null for other lines or an empty condition.
     */
    static ExpressionSpan condition(LogicalLine line) {
        if (!line.isCode()) {
            return null;
        }
        List<Integer> significant = line.getSignificantIndexes();
        Token keyword = line.getTokens().get(significant.get(0));
        if (!keyword.is(TokenKind.KEYWORD) || !CONDITION_KEYWORDS.contains(keyword.getText())) {
            return null;
        }
        int colon = clauseColon(line);
        if (colon < 2) {
            return null;
        }
        return new ExpressionSpan(line, significant.get(1), significant.get(colon - 1));
    }

    /**
     * The values of the non-bare {@code return} statements of a line. A return may start
     * the line, follow a top-level {@code ;}, or follow the colon of a one-line compound
     * statement such as {@code if x: return y}; its value ends at the next top-level {@code ;}.
     */
    static List<ExpressionSpan> returnValues(LogicalLine line) {
        List<ExpressionSpan> values = new ArrayList<>();
        if (!line.isCode()) {
            return values;
        }
        List<Integer> significant = line.getSignificantIndexes();
        int colon = clauseColon(line);
        boolean statementStart = true;
        for (int pos = 0; pos < significant.size(); pos++) {
            int index = significant.get(pos);
            Token token = line.getTokens().get(index);
            if (statementStart && token.isKeyword("return")) {
                int valueStart = pos + 1;
                while (pos + 1 < significant.size() && !_isSeparator(line, significant.get(pos + 1))) {
                    pos++;
                }
                if (pos >= valueStart) {
                    values.add(new ExpressionSpan(line, significant.get(valueStart), significant.get(pos)));
                }
                statementStart = false;
                continue;
            }
            statementStart = pos == colon || _isSeparator(line, index);
        }
        return values;
    }

    /**
     * Position in {@link LogicalLine#getSignificantIndexes()} of the colon closing a compound
     * statement's clause header, or -1 when the line does not start with a compound keyword.
     */
    static int clauseColon(LogicalLine line) {
        List<Integer> significant = line.getSignificantIndexes();
        if (significant.isEmpty()) {
            return -1;
        }
        Token first = line.getTokens().get(significant.get(0));
        if (!first.is(TokenKind.KEYWORD) || !COMPOUND_KEYWORDS.contains(first.getText())) {
            return -1;
        }
        for (int pos = 1; pos < significant.size(); pos++) {
            int index = significant.get(pos);
            if (line.getTokens().get(index).isOperator(":") && line.depthAt(index) == 0) {
                return pos;
            }
        }
        return -1;
    }

    private static boolean _isSeparator(LogicalLine line, int index) {
        return line.getTokens().get(index).isOperator(";") && line.depthAt(index) == 0;
    }

    Token firstToken() {
        return line.getTokens().get(first);
    }

    Token lastToken() {
        return line.getTokens().get(last);
    }

    /**
     * Whether a single bracket pair opens at {@code from} and closes at {@code to}.
     */
    private boolean _pairSpans(int from, int to) {
        Token open = line.getTokens().get(from);
        return open.is(TokenKind.OPEN_BRACKET, "(") && line.matchingClose(from) == to;
    }

    private int _nextSignificant(int index) {
        for (int i = index + 1; i <= last; i++) {
            if (line.getTokens().get(i).isSignificant()) {
                return i;
            }
        }
        return -1;
    }

    private int _previousSignificant(int index) {
        for (int i = index - 1; i >= first; i--) {
            if (line.getTokens().get(i).isSignificant()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Edits that leave the expression enclosed by exactly one parenthesis pair: wraps an
     * unwrapped expression, and drops redundant outer pairs around an already wrapped one.
     */
    List<Edit> wrapExactlyOnce(RuleId ruleId, String what) {
        List<Edit> edits = new ArrayList<>();
        if (!_pairSpans(first, last)) {
            edits.add(Edit.insertBefore(firstToken(), "(", ruleId, "Wrap " + what + " in parentheses"));
            edits.add(Edit.insertAfter(lastToken(), ")", ruleId, "Wrap " + what + " in parentheses"));
            return edits;
        }

        int open = first;
        int close = last;
        while (true) {
            int innerOpen = _nextSignificant(open);
            int innerClose = _previousSignificant(close);
            if (innerOpen < 0 || innerOpen >= innerClose || !_pairSpans(innerOpen, innerClose)) {
                break;
            }
            Token outerOpen = line.getTokens().get(open);
            edits.add(Edit.delete(outerOpen, ruleId, "Remove redundant parentheses around " + what));
            edits.add(Edit.delete(line.getTokens().get(close), ruleId, "Remove redundant parentheses around " + what));
            open = innerOpen;
            close = innerClose;
        }
        return edits;
    }
}
