package com.gdformatter.plugins.gdscript.reorder;

import com.gdformatter.plugins.gdscript.format.CommentTable;
import com.gdformatter.plugins.gdscript.format.SourceText;
import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits the members of one scope into {@link Declaration}s that own line ranges.
 * <p>
 * A declaration owns the standalone annotations in front of it and the
 * comment lines directly above it at the scope's indentation; a function or
 * class may be separated from its comment by one blank line. Unattached
 * comment blocks and statements that are not declarations stay with the
 * declaration before them. An unattached block of {@code ##} lines becomes a
 * {@link MemberKind#DOC_COMMENT} member of its own.
 */
final class DeclarationExtractor {
    private final SourceText source;
    private final CommentTable comments;
    private final String indentation;
    private final int scopeStart;
    private final int scopeEnd;

    private final List<Declaration> declarations = new ArrayList<>();
    private int ownedThrough;
    private int nextIndex = 0;

    DeclarationExtractor(SourceText source, CommentTable comments, String indentation, int scopeStart, int scopeEnd) {
        this.source = source;
        this.comments = comments;
        this.indentation = indentation;
        this.scopeStart = scopeStart;
        this.scopeEnd = scopeEnd;
        this.ownedThrough = scopeStart - 1;
    }

    /**
     * Declarations of the scope in source order.
     */
    List<Declaration> extract(List<SyntaxNode> members) {
        List<SyntaxNode> pending = new ArrayList<>();
        for (SyntaxNode member : members) {
            if (member.getStartLine() <= ownedThrough) {
                // another statement on a line that is already owned
                _keepWithPrevious(member);
                pending.clear();
                continue;
            }
            if (member.is(NodeKind.ANNOTATION)) {
                MemberKind fileKind = MemberKind.ofFileAnnotation(annotationName(member));
                if (fileKind == null) {
                    pending.add(member);
                } else {
                    _addDeclaration(fileKind, member, member.getStartLine(), false);
                    pending.clear();
                }
                continue;
            }

            MemberKind kind = _classify(member, pending);
            if (kind == null) {
                _keepWithPrevious(member);
            } else {
                int anchor = pending.isEmpty() ? member.getStartLine() : pending.get(0).getStartLine();
                boolean section = pending.stream()
                        .anyMatch(annotation -> MemberKind.isSectionAnnotation(annotationName(annotation)));
                _addDeclaration(kind, member, anchor, section);
            }
            pending.clear();
        }
        _processGap(scopeEnd + 1);
        return Collections.unmodifiableList(declarations);
    }

    static String annotationName(SyntaxNode annotation) {
        SyntaxNode name = annotation.field("name");
        return name == null ? "" : name.text();
    }

    private MemberKind _classify(SyntaxNode member, List<SyntaxNode> pending) {
        switch (member.getKind()) {
            case CLASS_NAME_STATEMENT:
                return MemberKind.CLASS_NAME;
            case EXTENDS_STATEMENT:
                return MemberKind.EXTENDS;
            case SIGNAL_STATEMENT:
                return MemberKind.SIGNAL;
            case ENUM_DEFINITION:
                return MemberKind.ENUM;
            case CONST_STATEMENT:
                return MemberKind.CONST;
            case CLASS_DEFINITION:
                return MemberKind.INNER_CLASS;
            case FUNCTION_DEFINITION: {
                SyntaxNode name = member.field("name");
                return MemberKind.ofFunction(name == null ? "" : name.text(), member.hasField("static"));
            }
            case VARIABLE_STATEMENT: {
                List<String> modifiers = new ArrayList<>();
                pending.forEach(annotation -> modifiers.add(annotationName(annotation)));
                SyntaxNode annotations = member.field("annotations");
                if (annotations != null) {
                    annotations.getNamedChildren().forEach(annotation -> modifiers.add(annotationName(annotation)));
                }
                if (member.hasField("static")) {
                    modifiers.add("static");
                }
                return MemberKind.ofVariable(modifiers);
            }
            default:
                return null;
        }
    }

    private void _addDeclaration(MemberKind kind, SyntaxNode member, int anchor, boolean section) {
        int start = _attachComments(anchor, kind);
        _processGap(start);

        boolean doc = false;
        for (int line = start; line < anchor; line++) {
            doc |= _isDocComment(line);
        }
        declarations.add(new Declaration(kind, member, nextIndex++, start, member.getEndLine(),
                _blankLinesAbove(start), doc, section));
        ownedThrough = member.getEndLine();
    }

    private void _keepWithPrevious(SyntaxNode member) {
        _processGap(member.getStartLine());
        if (!declarations.isEmpty()) {
            declarations.get(declarations.size() - 1).extendTo(member.getEndLine());
        }
        ownedThrough = Math.max(ownedThrough, member.getEndLine());
    }

    // Walks up from the anchor over attachable comment lines.
    private int _attachComments(int anchor, MemberKind kind) {
        int allowedGap = kind.isFunctionLike() ? 1 : 0;
        int line = anchor - 1;
        int gap = 0;
        while (gap < allowedGap && line > ownedThrough && source.isBlank(line)) {
            line--;
            gap++;
        }
        int start = anchor;
        while (line > ownedThrough && _isAttachable(line) && !(gap > 0 && _isDocComment(line))) {
            start = line;
            line--;
        }
        return start;
    }

    /**
     * Handles unowned lines before {@code before}: a block of {@code ##} lines
     * becomes a doc-comment member, anything else joins the previous declaration.
     */
    private void _processGap(int before) {
        int line = ownedThrough + 1;
        while (line < before) {
            if (source.isBlank(line)) {
                line++;
                continue;
            }
            int blockStart = line;
            boolean onlyComments = true;
            while (line < before && !source.isBlank(line)) {
                onlyComments &= comments.isStandalone(line);
                line++;
            }
            int blockEnd = line - 1;

            if (onlyComments && _isDocComment(blockStart) && _atScopeIndent(blockStart)) {
                declarations.add(new Declaration(MemberKind.DOC_COMMENT, null, nextIndex++,
                        blockStart, blockEnd, _blankLinesAbove(blockStart), true, false));
            } else if (!declarations.isEmpty()) {
                declarations.get(declarations.size() - 1).extendTo(blockEnd);
            }
            ownedThrough = blockEnd;
        }
    }

    private boolean _isAttachable(int line) {
        return comments.isStandalone(line) && _atScopeIndent(line);
    }

    private boolean _atScopeIndent(int line) {
        return source.getIndentation(line).equals(indentation);
    }

    private boolean _isDocComment(int line) {
        return comments.isStandalone(line) && source.getLine(line).trim().startsWith("##");
    }

    private int _blankLinesAbove(int line) {
        int count = 0;
        for (int l = line - 1; l >= scopeStart && source.isBlank(l); l--) {
            count++;
        }
        return count;
    }
}
