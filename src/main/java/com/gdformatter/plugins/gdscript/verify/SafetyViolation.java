package com.gdformatter.plugins.gdscript.verify;

/**
 * A safety check that failed for one file.
 */
public final class SafetyViolation {

    public enum Kind {
        /** The formatted output no longer parses. */
        UNPARSABLE_OUTPUT,
        /** The formatted tree differs from the original tree. */
        MEANING_CHANGED,
        /** Formatting the output again changes it. */
        NOT_IDEMPOTENT,
        /** Reordering added, dropped or altered a member. */
        REORDER_CHANGED_MEMBERS,
        /** Reordering the reordered output changes it. */
        REORDER_NOT_IDEMPOTENT,
        /** Formatting the reordered output changes it. */
        REORDER_NOT_FORMATTED
    }

    private final Kind kind;
    private final String path;
    private final String detail;

    public SafetyViolation(Kind kind, String path, String detail) {
        this.kind = kind;
        this.path = path;
        this.detail = detail;
    }

    public SafetyViolation(Kind kind) {
        this(kind, "", "");
    }

    public Kind getKind() {
        return kind;
    }

    public String getPath() {
        return path;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Human readable report naming {@code fileName}.
     */
    public String describe(String fileName) {
        switch (kind) {
            case UNPARSABLE_OUTPUT:
                return "Formatted output of " + fileName + " does not parse!\n" + detail;
            case MEANING_CHANGED:
                return "AST changed after formatting " + fileName + "!\nPath: " + path
                        + "\nDifference: " + detail;
            case NOT_IDEMPOTENT:
                return "Formatting is not idempotent for " + fileName
                        + "!\nFormatting the output again produces different results.";
            case REORDER_CHANGED_MEMBERS:
                return "Reordering changed the members of " + fileName + "!\nPath: " + path
                        + "\nDifference: " + detail;
            case REORDER_NOT_IDEMPOTENT:
                return "Reordering is not idempotent for " + fileName
                        + "!\nReordering the output again produces different results.";
            case REORDER_NOT_FORMATTED:
                return "Reordered output of " + fileName
                        + " is not stable!\nFormatting the reordered output produces different results.";
            default:
                return kind + " in " + fileName;
        }
    }

    @Override
    public String toString() {
        return describe("<input>");
    }
}
