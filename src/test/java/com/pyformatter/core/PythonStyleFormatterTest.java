package com.pyformatter.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;
import com.pyformatter.config.RuleConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PythonStyleFormatterTest {

    @TempDir
    Path tempDir;

    private final PythonStyleFormatter formatter = new PythonStyleFormatter(RuleConfig.defaults());

    @Test
    void recognizesPythonSourcesAndStubs() {
        assertThat(PythonStyleFormatter.isPythonFile(Path.of("pkg", "mod.py"))).isTrue();
        assertThat(PythonStyleFormatter.isPythonFile(Path.of("pkg", "mod.PYI"))).isTrue();
        assertThat(PythonStyleFormatter.isPythonFile(Path.of("pkg", "mod.pyc"))).isFalse();
        assertThat(PythonStyleFormatter.isPythonFile(Path.of("README.md"))).isFalse();
    }

    @Test
    void formatFileReturnsRenderedText() {
        FormatterResult result = formatter.formatFile(Path.of("a.py"), "while busy:\n    wait()\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isChanged()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("while (busy):\n    wait()\n#\n");
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getViolations()).hasSize(3);
    }

    @Test
    void syntaxErrorBecomesFatalResultWithOriginalText() {
        String broken = "def f(:\n    return x\n";

        FormatterResult result = formatter.formatFile(Path.of("broken.py"), broken);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo(broken);
        assertThat(result.getErrors()).hasSize(1);
        FormatterError error = result.getErrors().get(0);
        assertThat(error.getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(error.getLine()).isPositive();
        assertThat(formatter.getErrorCount()).isEqualTo(1);
    }

    @Test
    void checkFileKeepsInputAndReportsViolations() {
        String source = "def f():\n    return x\n";

        FormatterResult result = formatter.checkFile(Path.of("f.py"), source);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isChanged()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.getViolations()).isNotEmpty();
    }

    @Test
    void formatsEveryPythonFileInDirectory() throws IOException {
        Path pkg = Files.createDirectories(tempDir.resolve("pkg"));
        Path clean = write(pkg.resolve("clean.py"), "x = 1\n");
        Path dirty = write(tempDir.resolve("dirty.py"), "if a:\n    pass\n");
        Path broken = write(pkg.resolve("broken.py"), "x = (\n");
        write(tempDir.resolve("notes.txt"), "if a:\n    pass\n");

        Map<Path, FormatterResult> results = formatter.formatDirectory(tempDir, 2);

        assertThat(results.keySet()).containsExactly(dirty, broken, clean);
        assertThat(results.get(clean).isChanged()).isFalse();
        assertThat(results.get(dirty).getFormattedCode()).isEqualTo("if (a):\n    pass\n#\n");
        assertThat(results.get(broken).isSuccessful()).isFalse();
        assertThat(Files.readString(dirty)).isEqualTo("if a:\n    pass\n");
        assertThat(formatter.getProcessedFileCount()).isEqualTo(3);
        assertThat(formatter.getSuccessCount()).isEqualTo(2);
        assertThat(formatter.getErrorCount()).isEqualTo(1);
    }

    @Test
    void checkOnlyProcessingLeavesTextAlone() throws IOException {
        Path file = write(tempDir.resolve("m.py"), "for i in r:\n    pass\n");

        Map<Path, FormatterResult> results = formatter.processFiles(List.of(file), 1, true);

        assertThat(results.get(file).isChanged()).isTrue();
        assertThat(results.get(file).getFormattedCode()).isEqualTo("for i in r:\n    pass\n");
    }

    @Test
    void unreadableFileIsReportedNotThrown() {
        Path missing = tempDir.resolve("gone.py");

        Map<Path, FormatterResult> results = formatter.processFiles(List.of(missing), 1, false);

        assertThat(results.get(missing).isSuccessful()).isFalse();
        assertThat(results.get(missing).getErrors().get(0).getMessage()).startsWith("Failed to read file");
    }

    @Test
    void missingDirectoryYieldsNoResults() {
        assertThat(formatter.formatDirectory(tempDir.resolve("nope"))).isEmpty();
    }

    private static Path write(Path file, String content) throws IOException {
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
