package com.pyformatter.core;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.api.error.InvariantViolationException;
import com.pyformatter.rules.Edit;

/**
 * Applies a set of edits to the text they were computed against.
 * Edits must be pairwise disjoint; an insertion may share its offset with a replacement
 * boundary or with an insertion from another rule, which is then ordered by rule.
 */
public final class EditRenderer {

    private EditRenderer() {
    }

    /**
     * Renders {@code edits} into {@code text}. The input list is not modified.
     *
     * @throws InvariantViolationException if an edit is out of bounds or two edits overlap
     */
    public static String render(String text, List<Edit> edits) {
        List<Edit> ordered = new ArrayList<>(edits);
        ordered.sort(Edit.SOURCE_ORDER);
        _checkDisjoint(text, ordered);

        StringBuilder out = new StringBuilder(text.length() + 64);
        int cursor = 0;
        for (Edit edit : ordered) {
            out.append(text, cursor, edit.getStart());
            out.append(edit.getReplacement());
            cursor = edit.getEnd();
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }

    private static void _checkDisjoint(String text, List<Edit> ordered) {
        int maxEnd = 0;
        Edit previous = null;
        for (Edit edit : ordered) {
            if (edit.getEnd() > text.length()) {
                throw new InvariantViolationException("Edit out of bounds (text length " + text.length() + "): " + edit);
            }
            if (previous != null) {
                if (edit.getStart() < maxEnd) {
                    throw new InvariantViolationException("Overlapping edits: " + previous + " and " + edit);
                }
                boolean sameInsertionPoint = edit.isInsertion() && previous.isInsertion()
                        && edit.getStart() == previous.getStart();
                if (sameInsertionPoint && edit.getRuleId() == previous.getRuleId()) {
                    throw new InvariantViolationException("Ambiguous insertions at offset " + edit.getStart()
                            + ": " + previous + " and " + edit);
                }
            }
            maxEnd = Math.max(maxEnd, edit.getEnd());
            previous = edit;
        }
    }
}
