package com.pyformatter.rules.alignment;

import static org.assertj.core.api.Assertions.assertThat;

import com.pyformatter.api.error.FormattingException;
import com.pyformatter.config.RuleConfig;
import com.pyformatter.core.StyleEngine;
import com.pyformatter.rules.RuleId;
import org.junit.jupiter.api.Test;

class AssignmentAlignmentRuleTest {

    private static String format(String source) throws FormattingException {
        return StyleEngine.format(source, RuleConfig.of(RuleId.ALIGN_ASSIGNMENTS)).getRenderedText();
    }

    @Test
    void alignsToColumnPastLongestName() throws FormattingException {
        String source = "open_ = row[\"open\"]\nhigh = row[\"high\"]\nlow = row[\"low\"]\nclose = row[\"close\"]\n";

        assertThat(format(source)).isEqualTo(
                "open_ = row[\"open\"]\nhigh  = row[\"high\"]\nlow   = row[\"low\"]\nclose = row[\"close\"]\n");
    }

    @Test
    void blankAndCommentLinesStartNewGroups() throws FormattingException {
        assertThat(format("a = 1\nbbb = 2\n\ncc = 3\nd = 4\n"))
                .isEqualTo("a   = 1\nbbb = 2\n\ncc = 3\nd  = 4\n");
        assertThat(format("a = 1\n# note\nbbb = 2\n")).isEqualTo("a = 1\n# note\nbbb = 2\n");
    }

    @Test
    void otherStatementsEndTheGroup() throws FormattingException {
        String source = "a = 1\nx += 1\nbbb = 2\nn: int = 3\ncc = 4\nd[0] = 5\n";

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void blockBoundariesEndTheGroup() throws FormattingException {
        String source = "x = 1\nif x:\n    y = 1\n    zz = 2\nwww = 3\n";

        assertThat(format(source)).isEqualTo("x = 1\nif x:\n    y  = 1\n    zz = 2\nwww = 3\n");
    }

    @Test
    void alignsDottedTargets() throws FormattingException {
        assertThat(format("self.total = 0\nself.n = 0\n")).isEqualTo("self.total = 0\nself.n     = 0\n");
    }

    @Test
    void rewritesOnlyTheGapBeforeTheOperator() throws FormattingException {
        assertThat(format("a      = 1\nbb = 2\n")).isEqualTo("a  = 1\nbb = 2\n");
        assertThat(format("a=1\nbb=2\n")).isEqualTo("a  =1\nbb =2\n");
    }

    @Test
    void multiLineStatementsBreakTheGroup() throws FormattingException {
        assertThat(format("a = [\n    1,\n]\nbbb = 2\ncc = 3\n")).isEqualTo("a = [\n    1,\n]\nbbb = 2\ncc  = 3\n");
        assertThat(format("x = f(a=1,\n      bb=2)\nyy = 3\n")).isEqualTo("x = f(a=1,\n      bb=2)\nyy = 3\n");
        assertThat(format("x = 1 + \\\n    2\nyy = 3\n")).isEqualTo("x = 1 + \\\n    2\nyy = 3\n");
    }

    @Test
    void measuresWideCharactersInDisplayColumns() throws FormattingException {
        assertThat(format("名前 = 1\nab = 2\n")).isEqualTo("名前 = 1\nab   = 2\n");
    }
}
