package com.gdformatter.plugins.gdscript.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable node of a GDScript syntax tree.
 * <p>
 * Offsets index the source string directly, lines are 1-indexed and columns
 * 0-indexed. Children include anonymous {@link NodeKind#TOKEN} nodes in
 * source order; named children are every other child.
 */
public final class SyntaxNode {
    private final NodeKind kind;
    private final TokenType tokenType;
    private final String source;
    private final int startOffset;
    private final int endOffset;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;
    private final List<SyntaxNode> children;
    private final Map<String, SyntaxNode> fields;

    private SyntaxNode(NodeKind kind, TokenType tokenType, String source,
                       int startOffset, int endOffset,
                       int startLine, int startColumn, int endLine, int endColumn,
                       List<SyntaxNode> children, Map<String, SyntaxNode> fields) {
        this.kind = kind;
        this.tokenType = tokenType;
        this.source = source;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.children = children;
        this.fields = fields;
    }

    static SyntaxNode leaf(NodeKind kind, Token token, String source) {
        return new SyntaxNode(kind, token.getType(), source,
                token.getOffset(), token.getEndOffset(),
                token.getLine(), token.getColumn(), token.getEndLine(), token.getEndColumn(),
                List.of(), Map.of());
    }

    static SyntaxNode token(Token token, String source) {
        return leaf(NodeKind.TOKEN, token, source);
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean is(NodeKind kind) {
        return this.kind == kind;
    }

    public boolean isNamed() {
        return kind != NodeKind.TOKEN;
    }

    /**
     * Token type of a leaf; null for inner nodes.
     */
    public TokenType getTokenType() {
        return children.isEmpty() ? tokenType : null;
    }

    public boolean isToken(TokenType type) {
        return kind == NodeKind.TOKEN && tokenType == type;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public boolean isMultiLine() {
        return startLine != endLine;
    }

    /**
     * The exact slice of source text this node covers.
     */
    public String text() {
        return source.substring(startOffset, endOffset);
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    public List<SyntaxNode> getNamedChildren() {
        List<SyntaxNode> named = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.isNamed()) {
                named.add(child);
            }
        }
        return named;
    }

    public int getNamedChildCount() {
        int count = 0;
        for (SyntaxNode child : children) {
            if (child.isNamed()) {
                count++;
            }
        }
        return count;
    }

    /**
     * The n-th named child, or null when there are fewer.
     */
    public SyntaxNode getNamedChild(int index) {
        int seen = 0;
        for (SyntaxNode child : children) {
            if (child.isNamed()) {
                if (seen == index) {
                    return child;
                }
                seen++;
            }
        }
        return null;
    }

    /**
     * Child registered under a field name, or null.
     */
    public SyntaxNode field(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /**
     * Field lookup that falls back to the n-th named child when the field is absent.
     */
    public SyntaxNode fieldOrNamedChild(String name, int index) {
        SyntaxNode byField = fields.get(name);
        return byField != null ? byField : getNamedChild(index);
    }

    public SyntaxNode findChild(NodeKind kind) {
        for (SyntaxNode child : children) {
            if (child.kind == kind) {
                return child;
            }
        }
        return null;
    }

    /**
     * Whether the child just before the closing bracket is a comma.
     */
    public boolean hasTrailingComma() {
        if (children.size() < 2) {
            return false;
        }
        return children.get(children.size() - 2).isToken(TokenType.COMMA);
    }

    /**
     * Lisp-like rendering of the named structure, handy for tests and logs.
     */
    public String toSExpression() {
        if (!isNamed()) {
            return text();
        }
        List<SyntaxNode> named = getNamedChildren();
        if (named.isEmpty()) {
            return kind.isValueKind() ? "(" + kind + " " + text() + ")" : "(" + kind + ")";
        }
        StringBuilder sb = new StringBuilder("(").append(kind);
        for (SyntaxNode child : named) {
            sb.append(' ').append(child.toSExpression());
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return kind + " [" + startLine + ":" + startColumn + " - " + endLine + ":" + endColumn + "]";
    }

    /**
     * Accumulates children of an inner node in source order.
     */
    static final class Builder {
        private final NodeKind kind;
        private final String source;
        private final List<SyntaxNode> children = new ArrayList<>();
        private final Map<String, SyntaxNode> fields = new HashMap<>();

        Builder(NodeKind kind, String source) {
            this.kind = kind;
            this.source = source;
        }

        Builder add(SyntaxNode child) {
            if (child != null) {
                children.add(child);
            }
            return this;
        }

        Builder add(String field, SyntaxNode child) {
            if (child != null) {
                children.add(child);
                fields.put(field, child);
            }
            return this;
        }

        Builder token(Token token) {
            children.add(SyntaxNode.token(token, source));
            return this;
        }

        Builder token(String field, Token token) {
            return add(field, SyntaxNode.token(token, source));
        }

        boolean isEmpty() {
            return children.isEmpty();
        }

        SyntaxNode build() {
            if (children.isEmpty()) {
                throw new IllegalStateException("Node " + kind + " has no children");
            }
            SyntaxNode first = children.get(0);
            SyntaxNode last = children.get(children.size() - 1);
            return new SyntaxNode(kind, null, source,
                    first.startOffset, last.endOffset,
                    first.startLine, first.startColumn, last.endLine, last.endColumn,
                    Collections.unmodifiableList(new ArrayList<>(children)),
                    Collections.unmodifiableMap(new HashMap<>(fields)));
        }

        /**
         * Builds an empty node positioned at the given token, for the root of an empty file.
         */
        SyntaxNode buildEmptyAt(Token at) {
            return new SyntaxNode(kind, null, source, at.getOffset(), at.getOffset(),
                    at.getLine(), at.getColumn(), at.getLine(), at.getColumn(), List.of(), Map.of());
        }
    }
}
