package com.gdformatter.plugins.gdscript.format;

/**
 * Mutable state threaded through one rendering pass: indent depth, options,
 * the source tables and the growing output.
 */
public final class RenderContext {
    private final SourceText source;
    private final CommentTable comments;
    private final SkipRegions skipRegions;
    private final FormatOptions options;
    private final FormattedOutput output = new FormattedOutput();
    private int indentLevel = 0;

    public RenderContext(SourceText source, CommentTable comments, SkipRegions skipRegions, FormatOptions options) {
        this.source = source;
        this.comments = comments;
        this.skipRegions = skipRegions;
        this.options = options;
    }

    public void indent() {
        indentLevel++;
    }

    /**
     * Pops one indent level; never goes below zero.
     */
    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public String indentString() {
        return options.getIndentStyle().repeat(indentLevel);
    }

    public String indentString(int level) {
        return options.getIndentStyle().repeat(level);
    }

    public boolean isSkipped(int line) {
        return skipRegions.isSkipped(line);
    }

    public SourceText getSource() {
        return source;
    }

    public CommentTable getComments() {
        return comments;
    }

    public FormatOptions getOptions() {
        return options;
    }

    public FormattedOutput getOutput() {
        return output;
    }
}
