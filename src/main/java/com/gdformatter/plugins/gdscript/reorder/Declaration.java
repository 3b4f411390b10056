package com.gdformatter.plugins.gdscript.reorder;

import com.gdformatter.plugins.gdscript.parser.SyntaxNode;

/**
 * One sortable member of a class or file scope: its kind, the source lines
 * it owns (attached comments and annotations included) and its position in
 * the source.
 */
public final class Declaration {
    private final MemberKind kind;
    private final SyntaxNode node;
    private final int originalIndex;
    private final int startLine;
    private int endLine;
    private final int blankLinesBefore;
    private final boolean hasDocComment;
    private final boolean hasSectionAnnotation;
    private String text;

    Declaration(MemberKind kind, SyntaxNode node, int originalIndex, int startLine, int endLine,
                int blankLinesBefore, boolean hasDocComment, boolean hasSectionAnnotation) {
        this.kind = kind;
        this.node = node;
        this.originalIndex = originalIndex;
        this.startLine = startLine;
        this.endLine = endLine;
        this.blankLinesBefore = blankLinesBefore;
        this.hasDocComment = hasDocComment;
        this.hasSectionAnnotation = hasSectionAnnotation;
    }

    public MemberKind getKind() {
        return kind;
    }

    /**
     * The declaring statement, or null for a free-standing doc comment block.
     */
    public SyntaxNode getNode() {
        return node;
    }

    public int getOriginalIndex() {
        return originalIndex;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    void extendTo(int line) {
        endLine = Math.max(endLine, line);
    }

    /**
     * Blank source lines directly above the first owned line.
     */
    public int getBlankLinesBefore() {
        return blankLinesBefore;
    }

    public boolean hasDocComment() {
        return hasDocComment;
    }

    public boolean hasSectionAnnotation() {
        return hasSectionAnnotation;
    }

    /**
     * Owned source lines, each ending with '\n'.
     */
    public String getText() {
        return text;
    }

    void setText(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return kind + "#" + originalIndex + " [" + startLine + "-" + endLine + "]";
    }
}
