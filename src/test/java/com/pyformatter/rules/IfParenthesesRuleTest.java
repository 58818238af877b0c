package com.pyformatter.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.pyformatter.api.error.FormattingException;
import com.pyformatter.config.RuleConfig;
import com.pyformatter.core.StyleEngine;
import com.pyformatter.model.SourceModel;
import java.util.List;
import org.junit.jupiter.api.Test;

class IfParenthesesRuleTest {

    private static String format(String source) throws FormattingException {
        return StyleEngine.format(source, RuleConfig.of(RuleId.IF_PARENTHESES)).getRenderedText();
    }

    @Test
    void wrapsBareConditions() throws FormattingException {
        assertThat(format("if x > 0:\n    pass\n")).isEqualTo("if (x > 0):\n    pass\n");
        assertThat(format("while not done:\n    step()\n")).isEqualTo("while (not done):\n    step()\n");
    }

    @Test
    void wrapsElifButNotElse() throws FormattingException {
        String source = "if a:\n    pass\nelif b or c:\n    pass\nelse:\n    pass\n";

        assertThat(format(source)).isEqualTo("if (a):\n    pass\nelif (b or c):\n    pass\nelse:\n    pass\n");
    }

    @Test
    void leavesFullyWrappedConditionAlone() throws FormattingException {
        String source = "if (x and (y or z)):\n    pass\n";

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void wrapsConditionThatOnlyStartsWithAParenthesis() throws FormattingException {
        assertThat(format("if (a) and (b):\n    pass\n")).isEqualTo("if ((a) and (b)):\n    pass\n");
        assertThat(format("if (a)(b):\n    pass\n")).isEqualTo("if ((a)(b)):\n    pass\n");
    }

    @Test
    void collapsesRedundantParentheses() throws FormattingException {
        assertThat(format("if ((x)):\n    pass\n")).isEqualTo("if (x):\n    pass\n");
        assertThat(format("if (((a, b))):\n    pass\n")).isEqualTo("if (a, b):\n    pass\n");
    }

    @Test
    void keepsTrailingCommentOutsideTheParentheses() throws FormattingException {
        assertThat(format("if ready:  # go\n    run()\n")).isEqualTo("if (ready):  # go\n    run()\n");
    }

    @Test
    void handlesMultiLineConditions() throws FormattingException {
        String source = "if (a and\n        b):\n    pass\nwhile a and \\\n        b:\n    pass\n";

        assertThat(format(source)).isEqualTo(
                "if (a and\n        b):\n    pass\nwhile (a and \\\n        b):\n    pass\n");
    }

    @Test
    void ignoresConditionalExpressions() throws FormattingException {
        String source = "x = a if b else c\ny = [v for v in w if v]\n";

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void wrapsConditionsOfOneLineCompoundStatements() throws FormattingException {
        assertThat(format("if y: z = 1\n")).isEqualTo("if (y): z = 1\n");
        assertThat(format("while x > 0: x -= 1\n")).isEqualTo("while (x > 0): x -= 1\n");
        assertThat(format("if a[1:2]: b = {'k': 1}\n")).isEqualTo("if (a[1:2]): b = {'k': 1}\n");
    }

    @Test
    void oneLineStatementsCombineWithReturnParentheses() throws FormattingException {
        RuleConfig config = RuleConfig.of(RuleId.IF_PARENTHESES, RuleId.RETURN_PARENTHESES);
        String source = "def f(x):\n    if x > 0: return y\n    else: return x\n";

        assertThat(StyleEngine.format(source, config).getRenderedText())
                .isEqualTo("def f(x):\n    if (x > 0): return (y)\n    else: return (x)\n");
    }

    @Test
    void editsPointAtTheCondition() throws FormattingException {
        List<Edit> edits = new IfParenthesesRule().apply(SourceModel.parse("x = 1\nif x:\n    pass\n"));

        assertThat(edits).hasSize(2);
        assertThat(edits.get(0).getLine()).isEqualTo(2);
        assertThat(edits.get(0).getColumn()).isEqualTo(4);
        assertThat(edits.get(0).getRuleId()).isEqualTo(RuleId.IF_PARENTHESES);
        assertThat(edits).allMatch(Edit::isInsertion);
    }
}
