package com.pyformatter.rules.alignment;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;
import com.pyformatter.model.Block;
import com.pyformatter.model.LogicalLine;
import com.pyformatter.model.SourceModel;
import com.pyformatter.util.DisplayWidth;

/**
 * Alignment over whole statements: one slot per single-line statement, grouped only
 * with neighbours of the same indent inside the same block.
 */
abstract class LineAlignmentRule extends AlignmentRule {

    /**
     * Returns the candidate for a code line matching this rule's pattern, or null.
     */
    protected abstract AlignmentCandidate match(LogicalLine line, Block owner);

    @Override
    protected List<List<AlignmentCandidate>> candidateRuns(SourceModel source) {
        List<AlignmentCandidate> slots = new ArrayList<>();
        for (LogicalLine line : source.getLines()) {
            slots.add(line.isCode() ? match(line, source.getBlockTree().ownerOf(line.getIndex())) : null);
        }
        List<List<AlignmentCandidate>> runs = new ArrayList<>();
        runs.add(slots);
        return runs;
    }

    /**
     * Builds a candidate whose left-hand side spans tokens {@code from..to} and whose
     * separator is at {@code separatorIndex}; null when anything but a single run of
     * whitespace sits between them, or when the statement spans several physical lines,
     * whose continuation lines padding would shift out of place.
     */
    protected static AlignmentCandidate candidate(LogicalLine line, Block owner, int from, int to, int separatorIndex) {
        if (line.getFirstPhysicalLine() != line.getLastPhysicalLine()) {
            return null;
        }
        List<Token> tokens = line.getTokens();
        Token gap = null;
        if (separatorIndex - to == 2 && tokens.get(to + 1).is(TokenKind.WHITESPACE)) {
            gap = tokens.get(to + 1);
        } else if (separatorIndex - to != 1) {
            return null;
        }

        StringBuilder left = new StringBuilder();
        for (int i = from; i <= to; i++) {
            Token token = tokens.get(i);
            if (token.getKind().isLineBreak() || token.is(TokenKind.COMMENT)) {
                return null;
            }
            left.append(token.getText());
        }
        return new AlignmentCandidate(List.of(line.getIndentText(), owner), DisplayWidth.of(line.getIndentText()),
                DisplayWidth.of(left), gap, tokens.get(separatorIndex));
    }
}
