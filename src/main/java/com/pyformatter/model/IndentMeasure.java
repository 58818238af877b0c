package com.pyformatter.model;

/**
 * Indentation widths computed the way the Python tokenizer computes them.
 */
public final class IndentMeasure {
    public static final int TAB_SIZE = 8;

    private IndentMeasure() {
    }

    /**
     * Width of leading whitespace with tabs advancing to the next multiple of {@code tabSize}.
     * A form feed resets the column; a byte order mark takes no space.
     */
    public static int width(String indent, int tabSize) {
        int col = 0;
        for (int i = 0; i < indent.length(); i++) {
            char ch = indent.charAt(i);
            if (ch == ' ') {
                col++;
            } else if (ch == '\t') {
                col = (col / tabSize + 1) * tabSize;
            } else if (ch == '\f') {
                col = 0;
            }
        }
        return col;
    }

    public static int width(String indent) {
        return width(indent, TAB_SIZE);
    }

    /**
     * Width with every tab counted as one column, used to detect ambiguous tab/space mixes.
     */
    public static int alternateWidth(String indent) {
        return width(indent, 1);
    }
}
