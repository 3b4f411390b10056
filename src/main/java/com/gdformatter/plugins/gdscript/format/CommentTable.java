package com.gdformatter.plugins.gdscript.format;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Comments recovered from raw source lines.
 * <p>
 * A standalone comment is a line whose trimmed text starts with '#'; it is
 * kept whole, indentation included. An inline comment is the text from the
 * first '#' outside a string literal to the end of a code line.
 */
public final class CommentTable {
    private final NavigableMap<Integer, String> standalone;
    private final NavigableMap<Integer, String> inline;

    private CommentTable(NavigableMap<Integer, String> standalone, NavigableMap<Integer, String> inline) {
        this.standalone = Collections.unmodifiableNavigableMap(standalone);
        this.inline = Collections.unmodifiableNavigableMap(inline);
    }

    public static CommentTable extract(SourceText source) {
        NavigableMap<Integer, String> standalone = new TreeMap<>();
        NavigableMap<Integer, String> inline = new TreeMap<>();

        for (int lineNumber = 1; lineNumber <= source.getLineCount(); lineNumber++) {
            String line = source.getLine(lineNumber);
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith("#")) {
                standalone.put(lineNumber, line);
                continue;
            }
            int hash = SourceText.findCommentStart(line);
            if (hash >= 0) {
                inline.put(lineNumber, line.substring(hash).stripTrailing());
            }
        }
        return new CommentTable(standalone, inline);
    }

    public static CommentTable extract(String source) {
        return extract(new SourceText(source));
    }

    public String getStandalone(int line) {
        return standalone.get(line);
    }

    public String getInline(int line) {
        return inline.get(line);
    }

    public boolean isStandalone(int line) {
        return standalone.containsKey(line);
    }

    /**
     * Standalone comments with line numbers in {@code [from, to]}, in line order.
     */
    public NavigableMap<Integer, String> standaloneBetween(int from, int to) {
        if (from > to) {
            return Collections.emptyNavigableMap();
        }
        return standalone.subMap(from, true, to, true);
    }

    /**
     * Whether any line in {@code [from, to]} carries a standalone or inline comment.
     */
    public boolean hasCommentBetween(int from, int to) {
        if (from > to) {
            return false;
        }
        return !standalone.subMap(from, true, to, true).isEmpty()
                || !inline.subMap(from, true, to, true).isEmpty();
    }

    public boolean isEmpty() {
        return standalone.isEmpty() && inline.isEmpty();
    }
}
