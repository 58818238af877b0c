package com.pyformatter.rules;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.model.LogicalLine;
import com.pyformatter.model.SourceModel;

/**
 * Encloses the value of every non-bare {@code return} in exactly one pair of parentheses.
 */
public class ReturnParenthesesRule implements StyleRule {

    @Override
    public RuleId getId() {
        return RuleId.RETURN_PARENTHESES;
    }

    @Override
    public List<Edit> apply(SourceModel source) {
        List<Edit> edits = new ArrayList<>();
        for (LogicalLine line : source.getLines()) {
            for (ExpressionSpan value : ExpressionSpan.returnValues(line)) {
                edits.addAll(value.wrapExactlyOnce(getId(), "return value"));
            }
        }
        return edits;
    }
}
