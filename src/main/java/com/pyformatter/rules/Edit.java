package com.pyformatter.rules;

import java.util.Comparator;

import com.pyformatter.lexer.Token;

/**
 * Replacement of the source range {@code [start, end)} by {@code replacement}.
 * A zero-length range is an insertion.
 */
public final class Edit {
    public static final Comparator<Edit> SOURCE_ORDER = Comparator
            .comparingInt(Edit::getStart)
            .thenComparingInt(Edit::getEnd)
            .thenComparing(Edit::getRuleId);

    private final int start;
    private final int end;
    private final String replacement;
    private final RuleId ruleId;
    private final int line;
    private final int column;
    private final String description;

    public Edit(int start, int end, String replacement, RuleId ruleId, int line, int column, String description) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.replacement = replacement;
        this.ruleId = ruleId;
        this.line = line;
        this.column = column;
        this.description = description;
    }

    public static Edit insertBefore(Token token, String text, RuleId ruleId, String description) {
        return new Edit(token.getStart(), token.getStart(), text, ruleId, token.getLine(), token.getColumn(), description);
    }

    public static Edit insertAfter(Token token, String text, RuleId ruleId, String description) {
        return new Edit(token.getEnd(), token.getEnd(), text, ruleId, token.getLine(), token.getColumn(), description);
    }

    public static Edit replace(Token token, String text, RuleId ruleId, String description) {
        return new Edit(token.getStart(), token.getEnd(), text, ruleId, token.getLine(), token.getColumn(), description);
    }

    public static Edit delete(Token token, RuleId ruleId, String description) {
        return replace(token, "", ruleId, description);
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }
    public String getReplacement() { return replacement; }
    public RuleId getRuleId() { return ruleId; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getDescription() { return description; }

    public boolean isInsertion() {
        return start == end;
    }

    @Override
    public String toString() {
        return ruleId + "[" + start + ", " + end + ") -> '" + replacement.replace("\n", "\\n") + "'";
    }
}
