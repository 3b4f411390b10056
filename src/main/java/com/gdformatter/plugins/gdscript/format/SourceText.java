package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable source buffer with a 1-indexed line table.
 */
public final class SourceText {
    private final String text;
    private final List<String> lines;

    public SourceText(String text) {
        this.text = text;
        this.lines = Collections.unmodifiableList(splitLines(text));
    }

    /**
     * Splits on '\n', drops a trailing '\r' from each line and does not
     * report an empty last line after a final newline.
     */
    public static List<String> splitLines(String text) {
        List<String> result = new ArrayList<>();
        int start = 0;
        int length = text.length();
        while (start < length) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                end = length;
            }
            String line = text.substring(start, end);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            result.add(line);
            start = end + 1;
        }
        return result;
    }

    public String getText() {
        return text;
    }

    public List<String> getLines() {
        return lines;
    }

    public int getLineCount() {
        return lines.size();
    }

    /**
     * Line by 1-indexed number, or null when out of range.
     */
    public String getLine(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return null;
        }
        return lines.get(lineNumber - 1);
    }

    public boolean isBlank(int lineNumber) {
        String line = getLine(lineNumber);
        return line != null && line.isBlank();
    }

    /**
     * Leading whitespace of a line, or an empty string when out of range.
     */
    public String getIndentation(int lineNumber) {
        String line = getLine(lineNumber);
        if (line == null) {
            return "";
        }
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    /**
     * Index of the first '#' on the line that is not inside a string literal, or -1.
     */
    public static int findCommentStart(String line) {
        boolean inString = false;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    inString = false;
                }
            } else if (c == '"' || c == '\'') {
                inString = true;
                quote = c;
            } else if (c == '#') {
                return i;
            }
        }
        return -1;
    }
}
