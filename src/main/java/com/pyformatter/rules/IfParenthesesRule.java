package com.pyformatter.rules;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.model.LogicalLine;
import com.pyformatter.model.SourceModel;

/**
 * Encloses every {@code if}, {@code elif} and {@code while} condition in exactly one
 * pair of parentheses.
 */
public class IfParenthesesRule implements StyleRule {

    @Override
    public RuleId getId() {
        return RuleId.IF_PARENTHESES;
    }

    @Override
    public List<Edit> apply(SourceModel source) {
        List<Edit> edits = new ArrayList<>();
        for (LogicalLine line : source.getLines()) {
            ExpressionSpan condition = ExpressionSpan.condition(line);
            if (condition != null) {
                edits.addAll(condition.wrapExactlyOnce(getId(), "condition"));
            }
        }
        return edits;
    }
}
