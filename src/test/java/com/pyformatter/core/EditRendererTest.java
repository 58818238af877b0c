package com.pyformatter.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pyformatter.api.error.InvariantViolationException;
import com.pyformatter.rules.Edit;
import com.pyformatter.rules.RuleId;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EditRendererTest {

    private static Edit edit(int start, int end, String replacement, RuleId ruleId) {
        return new Edit(start, end, replacement, ruleId, 1, start + 1, "test edit");
    }

    @Test
    void appliesEditsRegardlessOfInputOrder() {
        List<Edit> edits = new ArrayList<>(List.of(
                edit(9, 9, ")", RuleId.IF_PARENTHESES),
                edit(3, 3, "(", RuleId.IF_PARENTHESES),
                edit(4, 5, "  ", RuleId.BOOLEAN_SPACING)));

        String rendered = EditRenderer.render("if a or b:", edits);

        assertThat(rendered).isEqualTo("if (a  or b):");
        assertThat(edits.get(0).getStart()).isEqualTo(9);
    }

    @Test
    void noEditsLeavesTextUnchanged() {
        assertThat(EditRenderer.render("x = 1\n", List.of())).isEqualTo("x = 1\n");
    }

    @Test
    void insertionsMayTouchReplacementBoundaries() {
        String rendered = EditRenderer.render("abc", List.of(
                edit(1, 2, "B", RuleId.ALIGN_ASSIGNMENTS),
                edit(1, 1, "<", RuleId.IF_PARENTHESES),
                edit(2, 2, ">", RuleId.IF_PARENTHESES)));

        assertThat(rendered).isEqualTo("a<B>c");
    }

    @Test
    void sameOffsetInsertionsFromDifferentRulesFollowRuleOrder() {
        String rendered = EditRenderer.render("return x", List.of(
                edit(8, 8, "\n#", RuleId.BLOCK_END_MARKER),
                edit(8, 8, ")", RuleId.RETURN_PARENTHESES)));

        assertThat(rendered).isEqualTo("return x)\n#");
    }

    @Test
    void rejectsOverlappingEdits() {
        assertThatThrownBy(() -> EditRenderer.render("abcdef", List.of(
                edit(1, 4, "x", RuleId.ALIGN_ASSIGNMENTS),
                edit(3, 5, "y", RuleId.BOOLEAN_SPACING))))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("Overlapping edits");
    }

    @Test
    void rejectsInsertionInsideReplacedRange() {
        assertThatThrownBy(() -> EditRenderer.render("abcdef", List.of(
                edit(0, 6, "x", RuleId.ALIGN_ASSIGNMENTS),
                edit(5, 5, "y", RuleId.BOOLEAN_SPACING),
                edit(2, 3, "z", RuleId.IF_PARENTHESES))))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void rejectsAmbiguousInsertionsFromOneRule() {
        assertThatThrownBy(() -> EditRenderer.render("abc", List.of(
                edit(1, 1, "x", RuleId.BOOLEAN_SPACING),
                edit(1, 1, "y", RuleId.BOOLEAN_SPACING))))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("Ambiguous insertions");
    }

    @Test
    void rejectsEditsPastTheEnd() {
        assertThatThrownBy(() -> EditRenderer.render("abc", List.of(edit(2, 4, "", RuleId.BOOLEAN_SPACING))))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("out of bounds");
    }

    @Test
    void editRejectsInvertedRange() {
        assertThatThrownBy(() -> edit(3, 2, "", RuleId.BOOLEAN_SPACING))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
