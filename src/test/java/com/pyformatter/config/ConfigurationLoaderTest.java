package com.pyformatter.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.pyformatter.model.BlockKind;
import com.pyformatter.rules.RuleId;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledDefaultsEnableEveryRule() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getGeneralConfig("threads", -1)).isEqualTo(0);
        assertThat(config.getGeneralConfig("ignoreFiles", List.of())).contains(".venv/**");
        assertThat(config.toRuleConfig().getEnabledRules()).containsExactlyInAnyOrderElementsOf(RuleConfig.DEFAULT_RULES);
    }

    @Test
    void missingOrNullPathFallsBackToDefaults() {
        assertThat(ConfigurationLoader.loadConfig(null)).isSameAs(ConfigurationLoader.loadDefaultConfig());
        assertThat(ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml")))
                .isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void readsRuleListsFromYaml() throws IOException {
        Path file = Files.writeString(tempDir.resolve(".pyformatter.yml"),
                "general:\n  threads: 4\nrules:\n  enabled: [if_parentheses, block_end_marker]\n"
                        + "  disabled: [block_end_marker]\n  markedBlocks: [def]\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        RuleConfig rules = config.toRuleConfig();

        assertThat(config.getGeneralConfig("threads", 0)).isEqualTo(4);
        assertThat(rules.getEnabledRules()).containsExactly(RuleId.IF_PARENTHESES);
        assertThat(rules.getMarkedBlocks()).containsExactly(BlockKind.DEF);
    }

    @Test
    void commandLineOverridesApplyOnTopOfFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("c.yml"), "rules:\n  disabled: [align_imports]\n");

        RuleConfig rules = ConfigurationLoader.loadConfig(file)
                .toRuleConfig(List.of("align_imports", "align_assignments"), List.of("align_assignments"));

        assertThat(rules.getEnabledRules()).isEmpty();
    }

    @Test
    void invalidValuesAreReplacedByDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.yml"),
                "general:\n  threads: 10000\n  ignoreFiles: build\nrules:\n  enabled: if_parentheses\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getGeneralConfig("threads", -1)).isEqualTo(0);
        assertThat(config.getGeneralConfig("ignoreFiles", List.of("x"))).isEmpty();
        assertThat(config.toRuleConfig().getEnabledRules()).containsExactlyInAnyOrderElementsOf(RuleConfig.DEFAULT_RULES);
    }

    @Test
    void unparsableFileFallsBackToDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.yml"), "rules: [unclosed\n");

        assertThat(ConfigurationLoader.loadConfig(file)).isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void emptyFileUsesDefaultValues() throws IOException {
        Path file = Files.writeString(tempDir.resolve("empty.yml"), "");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.toRuleConfig().getMarkedBlocks()).isEqualTo(RuleConfig.DEFAULT_MARKED_BLOCKS);
    }

    @Test
    void savedConfigurationLoadsBack() throws IOException {
        Path file = tempDir.resolve("nested").resolve("saved.yml");
        FormatterConfig original = ConfigurationLoader.loadDefaultConfig();

        ConfigurationLoader.saveConfig(original, file);
        FormatterConfig reloaded = ConfigurationLoader.loadConfig(file);

        assertThat(Files.readString(file)).contains("markedBlocks");
        assertThat(reloaded.getGeneralConfigMap()).isEqualTo(original.getGeneralConfigMap());
        assertThat(reloaded.getRulesConfigMap()).isEqualTo(original.getRulesConfigMap());
    }
}
