package com.pyformatter.util;

/**
 * Terminal display width of source text, used for column alignment.
 * Tabs advance to the next multiple of 8, East Asian wide characters take two columns
 * and combining marks none.
 */
public final class DisplayWidth {
    private static final int TAB_SIZE = 8;

    private DisplayWidth() {
    }

    public static int of(CharSequence text) {
        return advance(0, text);
    }

    /**
     * Column reached after writing {@code text} starting at {@code column}.
     */
    public static int advance(int column, CharSequence text) {
        int col = column;
        int i = 0;
        while (i < text.length()) {
            int cp = Character.codePointAt(text, i);
            i += Character.charCount(cp);
            if (cp == '\t') {
                col = (col / TAB_SIZE + 1) * TAB_SIZE;
            } else if (cp == '\uFEFF' || _isCombining(cp)) {
                continue;
            } else {
                col += _isWide(cp) ? 2 : 1;
            }
        }
        return col;
    }

    private static boolean _isCombining(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK || type == Character.ENCLOSING_MARK;
    }

    private static boolean _isWide(int cp) {
        return (cp >= 0x1100 && cp <= 0x115F)
                || (cp >= 0x2E80 && cp <= 0xA4CF && cp != 0x303F)
                || (cp >= 0xAC00 && cp <= 0xD7A3)
                || (cp >= 0xF900 && cp <= 0xFAFF)
                || (cp >= 0xFE30 && cp <= 0xFE4F)
                || (cp >= 0xFF00 && cp <= 0xFF60)
                || (cp >= 0xFFE0 && cp <= 0xFFE6)
                || (cp >= 0x1F300 && cp <= 0x1F64F)
                || (cp >= 0x1F900 && cp <= 0x1F9FF)
                || (cp >= 0x20000 && cp <= 0x3FFFD);
    }
}
