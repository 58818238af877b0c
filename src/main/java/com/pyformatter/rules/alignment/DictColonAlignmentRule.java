package com.pyformatter.rules.alignment;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;
import com.pyformatter.model.LogicalLine;
import com.pyformatter.model.SourceModel;
import com.pyformatter.rules.RuleId;
import com.pyformatter.util.DisplayWidth;

/**
 * Aligns the key colons of a multi-line dict literal.
 * Only entries that start their own physical line, sit alone on it and have a
 * single-line key take part; a blank or comment line between entries, a {@code **}
 * unpacking or a differently indented entry ends the group. Comprehensions are skipped,
 * and so are keys holding {@code and}/{@code or} on an {@code if}, {@code elif} or
 * {@code while} line.
 */
public class DictColonAlignmentRule extends AlignmentRule {

    @Override
    public RuleId getId() {
        return RuleId.ALIGN_DICT_COLONS;
    }

    @Override
    protected String separatorName() {
        return ":";
    }

    @Override
    protected List<List<AlignmentCandidate>> candidateRuns(SourceModel source) {
        List<List<AlignmentCandidate>> runs = new ArrayList<>();
        for (LogicalLine line : source.getLines()) {
            if (!line.isCode()) {
                continue;
            }
            List<Token> tokens = line.getTokens();
            for (int i = 0; i < tokens.size(); i++) {
                if (tokens.get(i).is(TokenKind.OPEN_BRACKET, "{")) {
                    List<AlignmentCandidate> slots = _entrySlots(line, i, line.matchingClose(i));
                    if (!slots.isEmpty()) {
                        runs.add(slots);
                    }
                }
            }
        }
        return runs;
    }

    private List<AlignmentCandidate> _entrySlots(LogicalLine line, int open, int close) {
        List<Token> tokens = line.getTokens();
        int depth = line.depthAt(open) + 1;
        List<AlignmentCandidate> slots = new ArrayList<>();
        if (close < 0 || _isComprehension(line, open, close, depth)) {
            return slots;
        }

        // Entry boundaries: [start, end) between dict-level commas.
        List<int[]> entries = new ArrayList<>();
        int start = open + 1;
        for (int i = open + 1; i <= close; i++) {
            if (i == close || (tokens.get(i).isOperator(",") && line.depthAt(i) == depth)) {
                int first = _firstSignificant(tokens, start, i);
                if (first >= 0) {
                    entries.add(new int[] {start, first, i});
                }
                start = i + 1;
            }
        }

        for (int e = 0; e < entries.size(); e++) {
            int[] entry = entries.get(e);
            if (_lineBreaksBetween(tokens, entry[0], entry[1]) >= 2) {
                slots.add(null);
            }
            boolean sharesLine = e + 1 < entries.size()
                    && tokens.get(entries.get(e + 1)[1]).getLine() == tokens.get(entry[1]).getLine();
            slots.add(sharesLine ? null : _candidate(line, entry[1], entry[2], depth));
        }
        return slots;
    }

    private AlignmentCandidate _candidate(LogicalLine line, int first, int end, int depth) {
        List<Token> tokens = line.getTokens();
        Token key = tokens.get(first);
        if (key.isOperator("**") || !_startsPhysicalLine(tokens, first)) {
            return null;
        }

        int colon = -1;
        for (int i = first; i < end; i++) {
            if (tokens.get(i).isOperator(":") && line.depthAt(i) == depth) {
                colon = i;
                break;
            }
        }
        if (colon < 0) {
            return null;
        }

        int keyEnd = colon - 1;
        Token gap = null;
        if (tokens.get(keyEnd).is(TokenKind.WHITESPACE)) {
            gap = tokens.get(keyEnd);
            keyEnd--;
        }
        boolean conditionLine = _startsWithConditionKeyword(line);
        StringBuilder keyText = new StringBuilder();
        for (int i = first; i <= keyEnd; i++) {
            Token token = tokens.get(i);
            if (token.getKind().isLineBreak() || token.is(TokenKind.COMMENT)) {
                return null;
            }
            // Boolean spacing may still widen this key.
            if (conditionLine && (token.isKeyword("and") || token.isKeyword("or"))) {
                return null;
            }
            keyText.append(token.getText());
        }
        if (keyEnd < first) {
            return null;
        }

        Token leading = tokens.get(first - 1);
        String indent = leading.is(TokenKind.WHITESPACE) ? leading.getText() : "";
        int startColumn = DisplayWidth.of(indent);
        return new AlignmentCandidate(startColumn, startColumn, DisplayWidth.of(keyText), gap, tokens.get(colon));
    }

    private static boolean _startsWithConditionKeyword(LogicalLine line) {
        return line.startsWithKeyword("if") || line.startsWithKeyword("elif") || line.startsWithKeyword("while");
    }

    private static boolean _isComprehension(LogicalLine line, int open, int close, int depth) {
        for (int i = open + 1; i < close; i++) {
            if (line.getTokens().get(i).isKeyword("for") && line.depthAt(i) == depth) {
                return true;
            }
        }
        return false;
    }

    private static boolean _startsPhysicalLine(List<Token> tokens, int index) {
        Token previous = tokens.get(index - 1);
        if (previous.getKind().isLineBreak()) {
            return true;
        }
        return previous.is(TokenKind.WHITESPACE) && index >= 2 && tokens.get(index - 2).getKind().isLineBreak();
    }

    private static int _firstSignificant(List<Token> tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i).isSignificant()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Line breaks between a separator and the next entry; two or more mean a blank or
     * comment-only line lies in between.
     */
    private static int _lineBreaksBetween(List<Token> tokens, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (tokens.get(i).getKind().isLineBreak()) {
                count++;
            }
        }
        return count;
    }
}
