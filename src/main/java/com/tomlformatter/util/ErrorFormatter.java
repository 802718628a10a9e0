package com.tomlformatter.util;

import com.tomlformatter.api.error.FormatterError;
import com.tomlformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Utility for formatting error messages consistently.
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
     * Creates a new error formatter.
     *
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats a formatter error message, with its position when known.
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
        if (error.hasPosition() && !error.getMessage().contains("(line ")) {
            sb.append(" (line ").append(error.getLine());
            if (error.getColumn() > 0) {
                sb.append(", column ").append(error.getColumn());
            }
            sb.append(")");
        }

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Creates a summary of errors per file.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:")).append("\n");

        int totalFatals = 0;
        int totalErrors = 0;
        int totalWarnings = 0;

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            long fatals = _count(errors, Severity.FATAL);
            long errs = _count(errors, Severity.ERROR);
            long warnings = _count(errors, Severity.WARNING);
            totalFatals += fatals;
            totalErrors += errs;
            totalWarnings += warnings;

            sb.append(entry.getKey()).append(": ")
                    .append(_counts(fatals, errs, warnings)).append("\n");
        }

        sb.append("\nTotal: ").append(_counts(totalFatals, totalErrors, totalWarnings));
        return sb.toString();
    }

    private String _counts(long fatals, long errors, long warnings) {
        StringBuilder sb = new StringBuilder();
        if (fatals > 0) {
            sb.append(colorize(ANSI_RED, fatals + " fatal")).append(", ");
        }
        if (errors > 0) {
            sb.append(colorize(ANSI_RED, errors + " errors")).append(", ");
        }
        if (warnings > 0) {
            sb.append(colorize(ANSI_YELLOW, warnings + " warnings")).append(", ");
        }
        // Remove trailing comma and space
        if (sb.length() >= 2) {
            sb.setLength(sb.length() - 2);
        }
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
