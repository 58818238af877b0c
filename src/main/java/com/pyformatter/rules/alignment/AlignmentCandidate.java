package com.pyformatter.rules.alignment;

import com.pyformatter.lexer.Token;

/**
 * One statement or entry that could join an alignment group: its left-hand side, the
 * whitespace gap after it and the separator that gets aligned.
 */
public final class AlignmentCandidate {
    private final Object groupKey;
    private final int startColumn;
    private final int leftWidth;
    private final Token gap;
    private final Token separator;

    /**
     * @param groupKey    candidates only group with neighbours carrying an equal key
     * @param startColumn display column where the left-hand side starts
     * @param leftWidth   display width of the left-hand side
     * @param gap         whitespace token between left-hand side and separator, or null if adjacent
     * @param separator   the token to align
     */
    public AlignmentCandidate(Object groupKey, int startColumn, int leftWidth, Token gap, Token separator) {
        this.groupKey = groupKey;
        this.startColumn = startColumn;
        this.leftWidth = leftWidth;
        this.gap = gap;
        this.separator = separator;
    }

    public Object getGroupKey() { return groupKey; }
    public int getStartColumn() { return startColumn; }
    public int getLeftWidth() { return leftWidth; }
    public Token getGap() { return gap; }
    public Token getSeparator() { return separator; }
}
