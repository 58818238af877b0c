package com.pyformatter.api;

import com.pyformatter.rules.Edit;
import com.pyformatter.rules.RuleId;

/**
 * A place where the source does not follow a rule; reported by {@code check} and
 * listed for every edit a {@code format} pass applies.
 */
public class Violation {
    private final RuleId ruleId;
    private final int line;
    private final int column;
    private final String description;

    public Violation(RuleId ruleId, int line, int column, String description) {
        this.ruleId = ruleId;
        this.line = line;
        this.column = column;
        this.description = description;
    }

    public static Violation of(Edit edit) {
        return new Violation(edit.getRuleId(), edit.getLine(), edit.getColumn(), edit.getDescription());
    }

    // Getters
    public RuleId getRuleId() { return ruleId; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return line + ":" + column + " [" + ruleId.getKey() + "] " + description;
    }
}
