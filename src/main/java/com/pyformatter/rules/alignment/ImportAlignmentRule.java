package com.pyformatter.rules.alignment;

import java.util.List;

import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;
import com.pyformatter.model.Block;
import com.pyformatter.model.LogicalLine;
import com.pyformatter.rules.RuleId;

/**
 * Aligns the {@code import} keyword of consecutive {@code from X import Y} statements.
 */
public class ImportAlignmentRule extends LineAlignmentRule {

    @Override
    public RuleId getId() {
        return RuleId.ALIGN_IMPORTS;
    }

    @Override
    protected String separatorName() {
        return "import";
    }

    @Override
    protected AlignmentCandidate match(LogicalLine line, Block owner) {
        List<Token> tokens = line.getTokens();
        List<Integer> significant = line.getSignificantIndexes();
        if (!tokens.get(significant.get(0)).isKeyword("from")) {
            return null;
        }

        // Module path: names and dots up to the import keyword.
        int pos = 1;
        while (pos < significant.size()) {
            Token token = tokens.get(significant.get(pos));
            if (token.is(TokenKind.NAME) || token.isOperator(".") || token.isOperator("...")) {
                pos++;
            } else {
                break;
            }
        }
        if (pos == 1 || pos + 1 >= significant.size() || !tokens.get(significant.get(pos)).isKeyword("import")) {
            return null;
        }
        return candidate(line, owner, significant.get(0), significant.get(pos - 1), significant.get(pos));
    }
}
