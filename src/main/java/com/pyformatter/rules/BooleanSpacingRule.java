package com.pyformatter.rules;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;
import com.pyformatter.model.LogicalLine;
import com.pyformatter.model.SourceModel;

/**
 * Puts exactly two spaces on each side of {@code and} / {@code or} inside conditions.
 * Only whitespace on the keyword's own physical line is touched: a continuation line's
 * indentation and whitespace before a line break or comment stay as they are.
 */
public class BooleanSpacingRule implements StyleRule {
    static final String SPACING = "  ";

    @Override
    public RuleId getId() {
        return RuleId.BOOLEAN_SPACING;
    }

    @Override
    public List<Edit> apply(SourceModel source) {
        List<Edit> edits = new ArrayList<>();
        for (LogicalLine line : source.getLines()) {
            ExpressionSpan condition = ExpressionSpan.condition(line);
            if (condition == null) {
                continue;
            }
            List<Token> tokens = line.getTokens();
            for (int i = condition.getFirst() + 1; i < condition.getLast(); i++) {
                Token token = tokens.get(i);
                if (token.isKeyword("and") || token.isKeyword("or")) {
                    _spaceBefore(tokens, i, edits);
                    _spaceAfter(tokens, i, edits);
                }
            }
        }
        return edits;
    }

    private void _spaceBefore(List<Token> tokens, int index, List<Edit> edits) {
        Token keyword = tokens.get(index);
        Token previous = tokens.get(index - 1);
        String description = "Normalize spacing before '" + keyword.getText() + "'";

        if (previous.is(TokenKind.WHITESPACE)) {
            if (tokens.get(index - 2).getKind().isLineBreak()) {
                return;
            }
            if (!previous.getText().equals(SPACING)) {
                edits.add(Edit.replace(previous, SPACING, getId(), description));
            }
        } else if (!previous.getKind().isLineBreak() && !previous.is(TokenKind.INDENT)) {
            edits.add(Edit.insertBefore(keyword, SPACING, getId(), description));
        }
    }

    private void _spaceAfter(List<Token> tokens, int index, List<Edit> edits) {
        Token keyword = tokens.get(index);
        Token next = tokens.get(index + 1);
        String description = "Normalize spacing after '" + keyword.getText() + "'";

        if (next.is(TokenKind.WHITESPACE)) {
            Token following = tokens.get(index + 2);
            if (following.getKind().isLineBreak() || following.is(TokenKind.COMMENT)) {
                return;
            }
            if (!next.getText().equals(SPACING)) {
                edits.add(Edit.replace(next, SPACING, getId(), description));
            }
        } else if (!next.getKind().isLineBreak() && !next.is(TokenKind.COMMENT)) {
            edits.add(Edit.insertAfter(keyword, SPACING, getId(), description));
        }
    }
}
