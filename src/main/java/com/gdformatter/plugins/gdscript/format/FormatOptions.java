package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.config.FormatterConfig;

/**
 * Options that shape rendered output.
 */
public final class FormatOptions {
    public static final int DEFAULT_MAX_LINE_LENGTH = 100;

    private final IndentStyle indentStyle;
    private final int maxLineLength;
    private final boolean trailingNewline;

    public FormatOptions(IndentStyle indentStyle, int maxLineLength, boolean trailingNewline) {
        this.indentStyle = indentStyle;
        this.maxLineLength = maxLineLength;
        this.trailingNewline = trailingNewline;
    }

    public static FormatOptions defaults() {
        return new FormatOptions(IndentStyle.tabs(), DEFAULT_MAX_LINE_LENGTH, true);
    }

    /**
     * Reads {@code useTabs}, {@code indentSize}, {@code lineLength} and
     * {@code trailingNewline} from the general configuration section.
     */
    public static FormatOptions fromConfig(FormatterConfig config) {
        boolean useTabs = config.getGeneralConfig("useTabs", true);
        int indentSize = config.getGeneralConfig("indentSize", 4);
        int lineLength = config.getGeneralConfig("lineLength", DEFAULT_MAX_LINE_LENGTH);
        boolean trailingNewline = config.getGeneralConfig("trailingNewline", true);
        IndentStyle style = useTabs ? IndentStyle.tabs() : IndentStyle.spaces(indentSize);
        return new FormatOptions(style, lineLength, trailingNewline);
    }

    public FormatOptions withSpaces(int width) {
        return new FormatOptions(IndentStyle.spaces(width), maxLineLength, trailingNewline);
    }

    public FormatOptions withMaxLineLength(int length) {
        return new FormatOptions(indentStyle, length, trailingNewline);
    }

    public FormatOptions withTrailingNewline(boolean trailingNewline) {
        return new FormatOptions(indentStyle, maxLineLength, trailingNewline);
    }

    public IndentStyle getIndentStyle() {
        return indentStyle;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public boolean isTrailingNewline() {
        return trailingNewline;
    }

    @Override
    public String toString() {
        return "FormatOptions{indent=" + indentStyle + ", maxLineLength=" + maxLineLength
                + ", trailingNewline=" + trailingNewline + "}";
    }
}
