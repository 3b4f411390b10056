package com.gdformatter.plugins.gdscript.format;

/**
 * One level of indentation: a tab, or a fixed number of spaces.
 */
public final class IndentStyle {
    private static final IndentStyle TABS = new IndentStyle(true, 4);

    private final boolean tabs;
    private final int width;

    private IndentStyle(boolean tabs, int width) {
        this.tabs = tabs;
        this.width = width;
    }

    public static IndentStyle tabs() {
        return TABS;
    }

    public static IndentStyle spaces(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Indent width must be positive: " + width);
        }
        return new IndentStyle(false, width);
    }

    /**
     * Visual width of one level; tabs count as four columns.
     */
    public int width() {
        return width;
    }

    public String unit() {
        return tabs ? "\t" : " ".repeat(width);
    }

    public String repeat(int levels) {
        return levels <= 0 ? "" : unit().repeat(levels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndentStyle)) {
            return false;
        }
        IndentStyle other = (IndentStyle) o;
        return tabs == other.tabs && width == other.width;
    }

    @Override
    public int hashCode() {
        return tabs ? -width : width;
    }

    @Override
    public String toString() {
        return tabs ? "tabs" : "spaces(" + width + ")";
    }
}
