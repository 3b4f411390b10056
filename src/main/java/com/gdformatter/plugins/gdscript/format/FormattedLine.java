package com.gdformatter.plugins.gdscript.format;

/**
 * A rendered line, optionally tagged with the source lines it stands for.
 * <p>
 * A tagged line may span several source lines ({@code sourceLine..endSourceLine})
 * when the renderer joined a multi-line construct or produced text that itself
 * contains line breaks. Untagged lines are blank lines inserted by policy.
 */
public final class FormattedLine {
    public static final int UNTAGGED = 0;

    private final String content;
    private final int sourceLine;
    private final int endSourceLine;

    private FormattedLine(String content, int sourceLine, int endSourceLine) {
        this.content = content;
        this.sourceLine = sourceLine;
        this.endSourceLine = endSourceLine;
    }

    public static FormattedLine blank() {
        return new FormattedLine("", UNTAGGED, UNTAGGED);
    }

    public static FormattedLine tagged(String content, int sourceLine) {
        return new FormattedLine(content, sourceLine, sourceLine);
    }

    public static FormattedLine tagged(String content, int sourceLine, int endSourceLine) {
        return new FormattedLine(content, sourceLine, Math.max(sourceLine, endSourceLine));
    }

    public FormattedLine withContent(String newContent) {
        return new FormattedLine(newContent, sourceLine, endSourceLine);
    }

    public String getContent() {
        return content;
    }

    public boolean isTagged() {
        return sourceLine != UNTAGGED;
    }

    public int getSourceLine() {
        return sourceLine;
    }

    public int getEndSourceLine() {
        return endSourceLine;
    }

    public boolean isBlank() {
        return content.isBlank();
    }

    @Override
    public String toString() {
        return isTagged() ? sourceLine + (endSourceLine != sourceLine ? "-" + endSourceLine : "") + ": " + content
                : "~: " + content;
    }
}
