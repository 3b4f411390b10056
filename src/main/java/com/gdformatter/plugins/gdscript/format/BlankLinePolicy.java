package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.NodeKind;

/**
 * Blank lines between sibling statements.
 * <p>
 * The count is the larger of what the source had directly before the next
 * statement and what the style requires, capped per scope: two at file level,
 * one inside classes and blocks.
 */
public final class BlankLinePolicy {

    public enum Scope {
        TOP_LEVEL(2),
        CLASS_BODY(1),
        BLOCK(1);

        private final int cap;

        Scope(int cap) {
            this.cap = cap;
        }

        public int getCap() {
            return cap;
        }
    }

    private BlankLinePolicy() {
    }

    public static int blankLines(NodeKind previous, NodeKind next, int sourceBlanks, Scope scope) {
        int required = switch (scope) {
            case TOP_LEVEL -> requiredBetween(previous, next, true);
            case CLASS_BODY -> _requiredInClassBody(previous, next);
            case BLOCK -> requiredBetween(previous, next, false);
        };
        return Math.min(Math.max(sourceBlanks, required), scope.getCap());
    }

    /**
     * Minimum blank lines the style asks for between two statements.
     */
    public static int requiredBetween(NodeKind previous, NodeKind next, boolean topLevel) {
        if (previous == NodeKind.ANNOTATION) {
            return 0;
        }
        if (isFunctionOrClass(previous) || isFunctionOrClass(next)) {
            return topLevel ? 2 : 1;
        }
        if (!topLevel) {
            return 0;
        }
        if (next == NodeKind.ANNOTATION) {
            return 1;
        }
        int previousCategory = category(previous);
        int nextCategory = category(next);
        if (previousCategory != nextCategory && previousCategory != OTHER && nextCategory != OTHER) {
            return 1;
        }
        return 0;
    }

    private static int _requiredInClassBody(NodeKind previous, NodeKind next) {
        if (previous == NodeKind.ANNOTATION) {
            return 0;
        }
        return _separated(previous) || _separated(next) ? 1 : 0;
    }

    private static boolean _separated(NodeKind kind) {
        return isFunctionOrClass(kind) || kind == NodeKind.ENUM_DEFINITION;
    }

    public static boolean isFunctionOrClass(NodeKind kind) {
        return kind == NodeKind.FUNCTION_DEFINITION || kind == NodeKind.CLASS_DEFINITION;
    }

    private static final int OTHER = 99;

    /**
     * Declaration groups; a change of group asks for a blank line at file level.
     */
    static int category(NodeKind kind) {
        return switch (kind) {
            case CLASS_NAME_STATEMENT, EXTENDS_STATEMENT -> 0;
            case SIGNAL_STATEMENT -> 1;
            case ENUM_DEFINITION -> 2;
            case CONST_STATEMENT -> 3;
            case VARIABLE_STATEMENT -> 4;
            default -> OTHER;
        };
    }

    /**
     * Blank lines directly above {@code nextStart}, stopping at the first
     * non-blank line (comments included) or at {@code previousEnd}.
     */
    public static int countSourceBlankLines(SourceText source, int previousEnd, int nextStart) {
        int count = 0;
        for (int line = nextStart - 1; line > previousEnd; line--) {
            if (!source.isBlank(line)) {
                break;
            }
            count++;
        }
        return count;
    }
}
