package com.pyformatter.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.pyformatter.api.error.Severity;
import com.pyformatter.model.BlockKind;
import com.pyformatter.rules.RuleId;
import java.util.List;
import org.junit.jupiter.api.Test;

class RuleConfigTest {

    @Test
    void emptyEnabledListKeepsEveryNonReservedRule() {
        RuleConfig config = RuleConfig.resolve(List.of(), List.of());

        assertThat(config.getEnabledRules()).containsExactlyInAnyOrderElementsOf(RuleConfig.DEFAULT_RULES);
        assertThat(config.isEnabled(RuleId.TYPEHINT_SPACING)).isFalse();
        assertThat(config.getMarkedBlocks()).isEqualTo(RuleConfig.DEFAULT_MARKED_BLOCKS);
        assertThat(config.getWarnings()).isEmpty();
    }

    @Test
    void enabledListReplacesDefaults() {
        RuleConfig config = RuleConfig.resolve(List.of("if_parentheses", "align_imports"), null);

        assertThat(config.getEnabledRules()).containsExactly(RuleId.IF_PARENTHESES, RuleId.ALIGN_IMPORTS);
    }

    @Test
    void disabledWinsOverEnabled() {
        RuleConfig config = RuleConfig.resolve(
                List.of("if_parentheses", "boolean_spacing"), List.of("boolean_spacing"));

        assertThat(config.getEnabledRules()).containsExactly(RuleId.IF_PARENTHESES);
        assertThat(RuleConfig.resolve(List.of(), List.of("block_end_marker")).isEnabled(RuleId.BLOCK_END_MARKER))
                .isFalse();
    }

    @Test
    void unknownIdentifiersBecomeWarnings() {
        RuleConfig config = RuleConfig.resolve(List.of("if_parentheses", "semicolons"), List.of("tabs"));

        assertThat(config.getEnabledRules()).containsExactly(RuleId.IF_PARENTHESES);
        assertThat(config.getWarnings()).hasSize(2);
        assertThat(config.getWarnings()).allSatisfy(
                warning -> assertThat(warning.getSeverity()).isEqualTo(Severity.WARNING));
        assertThat(config.getWarnings().get(0).getMessage()).contains("semicolons");
    }

    @Test
    void reservedIdentifierIsAcceptedSilently() {
        RuleConfig config = RuleConfig.resolve(List.of("typehint_spacing", "return_parentheses"), null);

        assertThat(config.getWarnings()).isEmpty();
        assertThat(config.isEnabled(RuleId.RETURN_PARENTHESES)).isTrue();
    }

    @Test
    void markedBlocksAreParsedAndValidated() {
        RuleConfig config = RuleConfig.resolve(List.of(), List.of(), List.of("def", "WITH", "elif", "nonsense"));

        assertThat(config.getMarkedBlocks()).containsExactlyInAnyOrder(BlockKind.DEF, BlockKind.WITH);
        assertThat(config.getWarnings()).hasSize(2);
    }

    @Test
    void ofEnablesExactlyTheGivenRules() {
        assertThat(RuleConfig.of().getEnabledRules()).isEmpty();
        assertThat(RuleConfig.of(RuleId.ALIGN_DICT_COLONS).getEnabledRules()).containsExactly(RuleId.ALIGN_DICT_COLONS);
    }
}
