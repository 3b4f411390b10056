package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Growing buffer of rendered lines.
 */
public final class FormattedOutput {
    private final List<FormattedLine> lines = new ArrayList<>();

    public void push(FormattedLine line) {
        lines.add(line);
    }

    public void pushMapped(String content, int sourceLine) {
        lines.add(FormattedLine.tagged(content, sourceLine));
    }

    public void pushMapped(String content, int sourceLine, int endSourceLine) {
        lines.add(FormattedLine.tagged(content, sourceLine, endSourceLine));
    }

    /**
     * Adds blank lines so that at most {@code count} (never more than two)
     * trail the buffer. Nothing is added to an empty buffer.
     */
    public void pushBlankLines(int count) {
        if (lines.isEmpty()) {
            return;
        }
        int wanted = Math.min(count, 2) - trailingBlankCount();
        for (int i = 0; i < wanted; i++) {
            lines.add(FormattedLine.blank());
        }
    }

    public int trailingBlankCount() {
        int count = 0;
        for (int i = lines.size() - 1; i >= 0 && lines.get(i).isBlank(); i--) {
            count++;
        }
        return count;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int size() {
        return lines.size();
    }

    public List<FormattedLine> getLines() {
        return Collections.unmodifiableList(lines);
    }
}
