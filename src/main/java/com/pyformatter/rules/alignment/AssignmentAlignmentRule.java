package com.pyformatter.rules.alignment;

import java.util.List;

import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;
import com.pyformatter.model.Block;
import com.pyformatter.model.LogicalLine;
import com.pyformatter.rules.RuleId;

/**
 * Aligns the {@code =} of consecutive simple assignments. The target is a name or a
 * dotted attribute chain such as {@code self.total}; augmented, annotated and
 * subscript assignments do not match and end the group.
 */
public class AssignmentAlignmentRule extends LineAlignmentRule {

    @Override
    public RuleId getId() {
        return RuleId.ALIGN_ASSIGNMENTS;
    }

    @Override
    protected String separatorName() {
        return "=";
    }

    @Override
    protected AlignmentCandidate match(LogicalLine line, Block owner) {
        List<Token> tokens = line.getTokens();
        List<Integer> significant = line.getSignificantIndexes();
        if (!tokens.get(significant.get(0)).is(TokenKind.NAME)) {
            return null;
        }

        // name ('.' name)* with no whitespace in between
        int pos = 0;
        while (pos + 2 < significant.size()
                && tokens.get(significant.get(pos + 1)).isOperator(".")
                && tokens.get(significant.get(pos + 2)).is(TokenKind.NAME)
                && significant.get(pos + 2) == significant.get(pos) + 2) {
            pos += 2;
        }

        if (pos + 2 >= significant.size()) {
            return null;
        }
        int separator = significant.get(pos + 1);
        if (!tokens.get(separator).isOperator("=")) {
            return null;
        }
        return candidate(line, owner, significant.get(0), significant.get(pos), separator);
    }
}
