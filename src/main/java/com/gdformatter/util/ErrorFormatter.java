package com.gdformatter.util;

import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders diagnostics for the terminal, optionally with ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    public boolean isUsingColors() {
        return useColors;
    }

    /**
     * Formats one diagnostic as {@code SEVERITY: message (line:column)}, followed by
     * an indented suggestion when there is one.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        sb.append(" (").append(error.getLine());
        if (error.getColumn() > 0) {
            sb.append(':').append(error.getColumn());
        }
        sb.append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * One line per file with blocking diagnostics, then a total.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Error Summary:")).append("\n");

        int totalFatals = 0;
        int totalErrors = 0;
        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            long fatals = _count(entry.getValue(), Severity.FATAL);
            long errors = _count(entry.getValue(), Severity.ERROR);
            if (fatals == 0 && errors == 0) {
                continue;
            }
            totalFatals += fatals;
            totalErrors += errors;

            sb.append("  ").append(entry.getKey()).append(": ");
            if (fatals > 0) {
                sb.append(colorize(ANSI_RED, fatals + " parse error" + (fatals == 1 ? "" : "s")));
            }
            if (fatals > 0 && errors > 0) {
                sb.append(", ");
            }
            if (errors > 0) {
                sb.append(colorize(ANSI_RED, errors + " failed check" + (errors == 1 ? "" : "s")));
            }
            sb.append("\n");
        }

        sb.append("Total: ").append(totalFatals).append(" parse errors, ")
                .append(totalErrors).append(" failed checks");
        return sb.toString();
    }

    private static long _count(List<FormatterError> errors, Severity severity) {
        return errors.stream().filter(e -> e.getSeverity() == severity).count();
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
