package com.tomlformatter.util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

/**
 * Renders the difference between a file and its formatted text as a unified diff.
 */
public class DiffRenderer {
    private static final int CONTEXT_LINES = 3;

    private final ErrorFormatter colors;

    public DiffRenderer(ErrorFormatter colors) {
        this.colors = colors;
    }

    /**
     * Returns a unified diff with {@code a/} and {@code b/} file headers, or an empty
     * string when both texts are equal.
     */
    public String render(String fileName, String original, String formatted) {
        RawText before = new RawText(original.getBytes(StandardCharsets.UTF_8));
        RawText after = new RawText(formatted.getBytes(StandardCharsets.UTF_8));
        EditList edits = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM)
                .diff(RawTextComparator.DEFAULT, before, after);
        if (edits.isEmpty()) {
            return "";
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setContext(CONTEXT_LINES);
            formatter.format(edits, before, after);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render diff for " + fileName, e);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(colors.colorize(ErrorFormatter.ANSI_BOLD, "--- a/" + fileName)).append('\n');
        sb.append(colors.colorize(ErrorFormatter.ANSI_BOLD, "+++ b/" + fileName)).append('\n');
        for (String line : out.toString(StandardCharsets.UTF_8).split("\n")) {
            sb.append(_colorizeLine(line)).append('\n');
        }
        return sb.toString();
    }

    private String _colorizeLine(String line) {
        if (line.startsWith("@@")) {
            return colors.colorize(ErrorFormatter.ANSI_BLUE, line);
        } else if (line.startsWith("+")) {
            return colors.colorize(ErrorFormatter.ANSI_GREEN, line);
        } else if (line.startsWith("-")) {
            return colors.colorize(ErrorFormatter.ANSI_RED, line);
        }
        return line;
    }
}
