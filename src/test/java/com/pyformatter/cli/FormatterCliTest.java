package com.pyformatter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormatterCliTest {

    private static final String UNFORMATTED = "def f(a):\n    return a\n";
    private static final String FORMATTED = "def f(a):\n    return (a)\n#\n";

    @TempDir
    Path tempDir;

    private String noConfig;

    @BeforeEach
    void setUp() {
        noConfig = "--config=" + tempDir.resolve("absent.yml");
    }

    private int run(String... args) {
        return FormatterCli.run(args);
    }

    @Test
    void formatRewritesFilesInPlace() throws IOException {
        Path file = Files.writeString(tempDir.resolve("mod.py"), UNFORMATTED);

        assertThat(run("format", tempDir.toString(), noConfig, "--ci", "--threads=2")).isEqualTo(FormatterCli.EXIT_OK);

        assertThat(Files.readString(file)).isEqualTo(FORMATTED);
    }

    @Test
    void checkReportsWithoutWriting() throws IOException {
        Path file = Files.writeString(tempDir.resolve("mod.py"), UNFORMATTED);

        assertThat(run("check", file.toString(), noConfig, "--ci")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(Files.readString(file)).isEqualTo(UNFORMATTED);

        Files.writeString(file, FORMATTED);
        assertThat(run("check", file.toString(), noConfig, "--ci")).isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void disabledRulesAreHonoured() throws IOException {
        Path file = Files.writeString(tempDir.resolve("mod.py"), UNFORMATTED);

        int exit = run("format", file.toString(), noConfig, "--ci", "--disable=block_end_marker");

        assertThat(exit).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(file)).isEqualTo("def f(a):\n    return (a)\n");
    }

    @Test
    void unparsableFileFailsAndStaysUntouched() throws IOException {
        Path good = Files.writeString(tempDir.resolve("good.py"), UNFORMATTED);
        Path bad = Files.writeString(tempDir.resolve("bad.py"), "x = [1,\n");

        assertThat(run("format", tempDir.toString(), noConfig, "--ci")).isEqualTo(FormatterCli.EXIT_FAILURE);

        assertThat(Files.readString(bad)).isEqualTo("x = [1,\n");
        assertThat(Files.readString(good)).isEqualTo(FORMATTED);
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertThat(run()).isEqualTo(FormatterCli.EXIT_USAGE);
        assertThat(run("reformat")).isEqualTo(FormatterCli.EXIT_USAGE);
        assertThat(run("format")).isEqualTo(FormatterCli.EXIT_USAGE);
        assertThat(run("check", tempDir.resolve("missing").toString())).isEqualTo(FormatterCli.EXIT_USAGE);
        assertThat(run("--version")).isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void initWritesConfigurationOnce() throws IOException {
        Path config = tempDir.resolve("conf").resolve(".pyformatter.yml");
        String option = "--config=" + config;

        assertThat(run("init", option)).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(config)).contains("markedBlocks");
        assertThat(run("init", option)).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(run("init", option, "--force")).isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void configuredRulesApply() throws IOException {
        Path config = Files.writeString(tempDir.resolve("c.yml"), "rules:\n  enabled: [return_parentheses]\n");
        Path file = Files.writeString(tempDir.resolve("mod.py"), UNFORMATTED);

        run("format", file.toString(), "--config=" + config, "--ci");

        assertThat(Files.readString(file)).isEqualTo("def f(a):\n    return (a)\n");
    }

    @Test
    void ignorePatternsMatchRelativePaths() {
        Path base = Path.of("proj");
        List<String> patterns = List.of(".venv/**", "**/generated.py", "*_pb2.py", "setup.py");

        assertThat(FormatterCli._isIgnored(base.resolve(".venv/lib/x.py"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("pkg/generated.py"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("msg_pb2.py"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("setup.py"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("pkg/setup.py"), base, patterns)).isFalse();
        assertThat(FormatterCli._isIgnored(base.resolve("pkg/mod.py"), base, List.of())).isFalse();
    }

    @Test
    void findFilesSelectsPythonSourcesOnly() throws IOException {
        Path pkg = Files.createDirectories(tempDir.resolve("pkg"));
        Path venv = Files.createDirectories(tempDir.resolve(".venv"));
        Path mod = Files.writeString(pkg.resolve("mod.py"), "");
        Path stub = Files.writeString(pkg.resolve("mod.pyi"), "");
        Files.writeString(pkg.resolve("notes.txt"), "");
        Files.writeString(venv.resolve("site.py"), "");

        assertThat(FormatterCli._findFiles(tempDir, List.of(".venv/**"), null)).containsExactly(mod, stub);
        assertThat(FormatterCli._findFiles(tempDir, List.of(".venv/**"), "*.pyi")).containsExactly(stub);
        assertThat(FormatterCli._findFiles(mod, List.of(), null)).containsExactly(mod);
    }
}
