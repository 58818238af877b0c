package com.pyformatter.rules.alignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.pyformatter.rules.Edit;
import com.pyformatter.rules.RuleId;

/**
 * A maximal run of compatible candidates whose separators share one column.
 * The target column is fixed at construction, before any edit exists.
 */
public final class AlignmentGroup {
    private enum State { BETWEEN_GROUPS, IN_GROUP }

    private final List<AlignmentCandidate> members;
    private final int targetColumn;

    AlignmentGroup(List<AlignmentCandidate> members) {
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
        int widest = 0;
        for (AlignmentCandidate member : members) {
            widest = Math.max(widest, member.getLeftWidth());
        }
        this.targetColumn = members.get(0).getStartColumn() + widest + 1;
    }

    public List<AlignmentCandidate> getMembers() {
        return members;
    }

    /**
     * Display column at which every separator of the group starts.
     */
    public int getTargetColumn() {
        return targetColumn;
    }

    /**
     * Splits a slot sequence into groups of two or more. A null slot is a reset
     * (blank line, comment line, non-matching statement); a candidate whose key or start
     * column differs from its predecessor also starts a new group.
     */
    public static List<AlignmentGroup> scan(List<AlignmentCandidate> slots) {
        List<AlignmentGroup> groups = new ArrayList<>();
        List<AlignmentCandidate> current = new ArrayList<>();
        State state = State.BETWEEN_GROUPS;

        for (AlignmentCandidate slot : slots) {
            switch (state) {
                case BETWEEN_GROUPS -> {
                    if (slot != null) {
                        current = new ArrayList<>();
                        current.add(slot);
                        state = State.IN_GROUP;
                    }
                }
                case IN_GROUP -> {
                    if (slot == null) {
                        _close(current, groups);
                        state = State.BETWEEN_GROUPS;
                    } else if (_compatible(current.get(current.size() - 1), slot)) {
                        current.add(slot);
                    } else {
                        _close(current, groups);
                        current = new ArrayList<>();
                        current.add(slot);
                    }
                }
            }
        }
        if (state == State.IN_GROUP) {
            _close(current, groups);
        }
        return groups;
    }

    private static boolean _compatible(AlignmentCandidate previous, AlignmentCandidate next) {
        return previous.getStartColumn() == next.getStartColumn()
                && Objects.equals(previous.getGroupKey(), next.getGroupKey());
    }

    private static void _close(List<AlignmentCandidate> run, List<AlignmentGroup> groups) {
        if (run.size() >= 2) {
            groups.add(new AlignmentGroup(run));
        }
    }

    /**
     * Rewrites each member's gap so its separator starts at the target column.
     */
    public List<Edit> edits(RuleId ruleId, String separatorName) {
        List<Edit> edits = new ArrayList<>();
        String description = "Align '" + separatorName + "' to column " + (targetColumn + 1);
        for (AlignmentCandidate member : members) {
            int padding = targetColumn - member.getStartColumn() - member.getLeftWidth();
            String spaces = " ".repeat(padding);
            if (member.getGap() == null) {
                edits.add(Edit.insertBefore(member.getSeparator(), spaces, ruleId, description));
            } else if (!member.getGap().getText().equals(spaces)) {
                edits.add(Edit.replace(member.getGap(), spaces, ruleId, description));
            }
        }
        return edits;
    }
}
