package com.gdformatter.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

/**
 * Unified diffs between a file's current and formatted text.
 */
public class DiffPrinter {
    private static final int CONTEXT_LINES = 3;

    private final ErrorFormatter colors;

    public DiffPrinter(ErrorFormatter colors) {
        this.colors = colors;
    }

    /**
     * Unified diff lines with {@code a/} and {@code b/} headers; empty when the texts are equal.
     */
    public static List<String> unifiedDiff(String fileName, String original, String formatted) {
        if (original.equals(formatted)) {
            return new ArrayList<>();
        }
        List<String> originalLines = _lines(original);
        List<String> formattedLines = _lines(formatted);
        Patch<String> patch = DiffUtils.diff(originalLines, formattedLines);
        return UnifiedDiffUtils.generateUnifiedDiff("a/" + fileName, "b/" + fileName,
                originalLines, patch, CONTEXT_LINES);
    }

    // A final newline shows up as a trailing empty line, so newline-only fixes still diff.
    private static List<String> _lines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }

    /**
     * The diff as printable text, with added and removed lines colored.
     */
    public String render(String fileName, String original, String formatted) {
        StringBuilder out = new StringBuilder();
        for (String line : unifiedDiff(fileName, original, formatted)) {
            out.append(_colorLine(line)).append('\n');
        }
        return out.toString();
    }

    private String _colorLine(String line) {
        if (line.startsWith("+++") || line.startsWith("---")) {
            return colors.colorize(ErrorFormatter.ANSI_BOLD, line);
        } else if (line.startsWith("@@")) {
            return colors.colorize(ErrorFormatter.ANSI_CYAN, line);
        } else if (line.startsWith("+")) {
            return colors.colorize(ErrorFormatter.ANSI_GREEN, line);
        } else if (line.startsWith("-")) {
            return colors.colorize(ErrorFormatter.ANSI_RED, line);
        }
        return line;
    }
}
