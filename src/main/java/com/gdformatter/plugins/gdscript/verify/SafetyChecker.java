package com.gdformatter.plugins.gdscript.verify;

import java.util.logging.Logger;

import com.gdformatter.plugins.gdscript.format.FormatException;
import com.gdformatter.plugins.gdscript.format.FormatOptions;
import com.gdformatter.plugins.gdscript.format.Formatter;
import com.gdformatter.plugins.gdscript.parser.SyntaxTree;
import com.gdformatter.plugins.gdscript.reorder.ReorderEngine;
import com.gdformatter.util.LoggerUtil;

/**
 * Post-formatting checks that guard against changing what a script means.
 * <p>
 * Every check returns {@code null} when the output is safe to write.
 */
public class SafetyChecker {
    private static final Logger logger = LoggerUtil.getLogger(SafetyChecker.class);

    private final FormatOptions options;

    public SafetyChecker(FormatOptions options) {
        this.options = options;
    }

    /**
     * Checks that {@code formatted} parses to the same tree as {@code original} and
     * that formatting it again is a no-op.
     *
     * @param original source as read, known to parse
     */
    public SafetyViolation checkFormatting(String original, String formatted) throws FormatException {
        SyntaxTree originalTree = Formatter.parse(original);
        SyntaxTree formattedTree;
        try {
            formattedTree = Formatter.parse(formatted);
        } catch (FormatException e) {
            logger.fine("Output failed to parse: " + e.getMessage());
            return new SafetyViolation(SafetyViolation.Kind.UNPARSABLE_OUTPUT, "", e.getMessage());
        }

        EquivalenceResult equivalence = EquivalenceVerifier.compare(originalTree, formattedTree);
        if (!equivalence.isEquivalent()) {
            logger.fine("Tree mismatch at " + equivalence.getPath() + ": " + equivalence.getReason());
            return new SafetyViolation(SafetyViolation.Kind.MEANING_CHANGED,
                    equivalence.getPath(), equivalence.getReason());
        }

        if (!Formatter.format(formattedTree, options).equals(formatted)) {
            return new SafetyViolation(SafetyViolation.Kind.NOT_IDEMPOTENT);
        }
        return null;
    }

    /**
     * Checks that {@code reordered} holds the same members as {@code formatted} in some
     * order, that reordering it again is a no-op, and that it is already formatted.
     */
    public SafetyViolation checkReordering(String formatted, String reordered) throws FormatException {
        SyntaxTree formattedTree = Formatter.parse(formatted);
        SyntaxTree reorderedTree;
        try {
            reorderedTree = Formatter.parse(reordered);
        } catch (FormatException e) {
            logger.fine("Output failed to parse: " + e.getMessage());
            return new SafetyViolation(SafetyViolation.Kind.UNPARSABLE_OUTPUT, "", e.getMessage());
        }

        EquivalenceResult members = EquivalenceVerifier.compareMembers(formattedTree, reorderedTree);
        if (!members.isEquivalent()) {
            logger.fine("Member mismatch at " + members.getPath() + ": " + members.getReason());
            return new SafetyViolation(SafetyViolation.Kind.REORDER_CHANGED_MEMBERS,
                    members.getPath(), members.getReason());
        }

        if (!ReorderEngine.reorder(reordered).equals(reordered)) {
            return new SafetyViolation(SafetyViolation.Kind.REORDER_NOT_IDEMPOTENT);
        }
        if (!Formatter.format(reorderedTree, options).equals(reordered)) {
            return new SafetyViolation(SafetyViolation.Kind.REORDER_NOT_FORMATTED);
        }
        return null;
    }
}
