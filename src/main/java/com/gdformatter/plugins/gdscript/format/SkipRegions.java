package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line ranges bracketed by {@code # fmt: off} and {@code # fmt: on}.
 * An {@code off} without a matching {@code on} runs to the end of the file.
 */
public final class SkipRegions {
    private static final Pattern FMT_OFF = Pattern.compile("#\\s*fmt:\\s*off");
    private static final Pattern FMT_ON = Pattern.compile("#\\s*fmt:\\s*on");

    private static final SkipRegions NONE = new SkipRegions(List.of());

    private final List<Region> regions;

    private SkipRegions(List<Region> regions) {
        this.regions = regions;
    }

    public static SkipRegions parse(SourceText source) {
        List<Region> regions = new ArrayList<>();
        int openedAt = -1;

        for (int lineNumber = 1; lineNumber <= source.getLineCount(); lineNumber++) {
            String line = source.getLine(lineNumber);
            if (FMT_OFF.matcher(line).find()) {
                if (openedAt < 0) {
                    openedAt = lineNumber;
                }
            } else if (FMT_ON.matcher(line).find() && openedAt >= 0) {
                regions.add(new Region(openedAt, lineNumber));
                openedAt = -1;
            }
        }
        if (openedAt >= 0) {
            regions.add(new Region(openedAt, source.getLineCount()));
        }
        return new SkipRegions(Collections.unmodifiableList(regions));
    }

    public static SkipRegions parse(String source) {
        return parse(new SourceText(source));
    }

    public static SkipRegions none() {
        return NONE;
    }

    public boolean isSkipped(int line) {
        return regionContaining(line) != null;
    }

    /**
     * The region covering a line, or null.
     */
    public Region regionContaining(int line) {
        for (Region region : regions) {
            if (region.contains(line)) {
                return region;
            }
        }
        return null;
    }

    public List<Region> getRegions() {
        return regions;
    }

    public boolean isEmpty() {
        return regions.isEmpty();
    }

    /**
     * Inclusive, 1-indexed line range.
     */
    public static final class Region {
        private final int startLine;
        private final int endLine;

        public Region(int startLine, int endLine) {
            this.startLine = startLine;
            this.endLine = endLine;
        }

        public int getStartLine() {
            return startLine;
        }

        public int getEndLine() {
            return endLine;
        }

        public boolean contains(int line) {
            return line >= startLine && line <= endLine;
        }

        @Override
        public String toString() {
            return "[" + startLine + ", " + endLine + "]";
        }
    }
}
