package com.gdformatter.plugins.gdscript.format;

/**
 * Failure of a format or reorder run.
 */
public class FormatException extends Exception {

    public enum Kind {
        /** The input is not valid GDScript. */
        PARSE,
        /** Reordering could not rebuild the declaration list. */
        REORDER
    }

    private final Kind kind;
    private final int line;
    private final int column;

    public FormatException(Kind kind, String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    public FormatException(Kind kind, String message) {
        this(kind, message, 0, 0, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 1-based line of the failure, or 0 when unknown.
     */
    public int getLine() {
        return line;
    }

    /**
     * 0-based column of the failure.
     */
    public int getColumn() {
        return column;
    }
}
