package com.pyformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.pyformatter.api.Violation;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;
import com.pyformatter.rules.RuleId;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ErrorFormatterTest {

    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void formatsErrorWithLineAndSuggestion() {
        FormatterError error = new FormatterError(Severity.FATAL, "unmatched ')'", 3, 7, "Check brackets");

        assertThat(plain.formatError(error)).isEqualTo("FATAL: unmatched ')' (Line 3)\n  Suggestion: Check brackets");
    }

    @Test
    void omitsUnknownLine() {
        FormatterError warning = new FormatterError(Severity.WARNING, "Unknown rule identifier 'x'", 0, 0);

        assertThat(plain.formatError(warning)).isEqualTo("WARNING: Unknown rule identifier 'x'");
    }

    @Test
    void everySeverityIsLabelledByName() {
        for (Severity severity : Severity.values()) {
            FormatterError error = new FormatterError(severity, "m", 0, 0);

            assertThat(plain.formatError(error)).isEqualTo(severity.name() + ": m");
        }
    }

    @Test
    void violationsUseEditorFriendlyLocation() {
        Violation violation = new Violation(RuleId.RETURN_PARENTHESES, 12, 5, "Wrap return value in parentheses");

        assertThat(plain.formatViolation(Path.of("pkg", "mod.py"), violation))
                .isEqualTo(Path.of("pkg", "mod.py") + ":12:5: [return_parentheses] Wrap return value in parentheses");
    }

    @Test
    void summaryCountsFatalsAndWarningsPerFile() {
        Map<Path, List<FormatterError>> errors = new LinkedHashMap<>();
        errors.put(Path.of("a.py"), List.of(new FormatterError(Severity.FATAL, "boom", 1, 1)));
        errors.put(Path.of("b.py"), List.of());
        errors.put(Path.of("c.py"), List.of(new FormatterError(Severity.WARNING, "hm", 0, 0),
                new FormatterError(Severity.ERROR, "bad", 2, 1)));

        String summary = plain.formatErrorSummary(errors);

        assertThat(summary).contains("a.py: 1 fatal\n").contains("c.py: 1 fatal, 1 warnings\n")
                .doesNotContain("b.py").endsWith("Total: 2 fatal, 1 warnings");
    }

    @Test
    void colorizesOnlyWhenEnabled() {
        assertThat(new ErrorFormatter(true).colorize(ErrorFormatter.ANSI_RED, "x"))
                .isEqualTo(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET);
        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
    }
}
