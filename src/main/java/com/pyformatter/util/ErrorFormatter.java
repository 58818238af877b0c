package com.pyformatter.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.pyformatter.api.Violation;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;

/**
 * Renders errors, violations and per-file summaries for the terminal.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        if (error.getLine() > 0) {
            sb.append(" (Line ").append(error.getLine()).append(")");
        }

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * One line per violation, in the {@code file:line:column: [rule] description} shape
     * editors can jump to.
     */
    public String formatViolation(Path file, Violation violation) {
        return file + ":" + violation.getLine() + ":" + violation.getColumn() + ": "
                + colorize(ANSI_YELLOW, "[" + violation.getRuleId().getKey() + "]") + " " + violation.getDescription();
    }

    /**
     * Creates a summary of errors per file.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        int totalFatals = 0;
        int totalWarnings = 0;

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            long fatals = errors.stream().filter(e -> e.getSeverity() == Severity.FATAL || e.getSeverity() == Severity.ERROR).count();
            long warnings = errors.stream().filter(e -> e.getSeverity() == Severity.WARNING).count();
            totalFatals += fatals;
            totalWarnings += warnings;

            sb.append(entry.getKey()).append(": ");
            if (fatals > 0) {
                sb.append(colorize(ANSI_RED, fatals + " fatal"));
            }
            if (warnings > 0) {
                sb.append(fatals > 0 ? ", " : "").append(colorize(ANSI_YELLOW, warnings + " warnings"));
            }
            sb.append("\n");
        }

        sb.append("\nTotal: ").append(colorize(ANSI_RED, totalFatals + " fatal"));
        if (totalWarnings > 0) {
            sb.append(", ").append(colorize(ANSI_YELLOW, totalWarnings + " warnings"));
        }

        return sb.toString();
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
