package com.gdformatter.plugins.gdscript.reorder;

import com.gdformatter.plugins.gdscript.format.CommentTable;
import com.gdformatter.plugins.gdscript.format.FormatException;
import com.gdformatter.plugins.gdscript.format.Formatter;
import com.gdformatter.plugins.gdscript.format.NodeRenderer;
import com.gdformatter.plugins.gdscript.format.SkipRegions;
import com.gdformatter.plugins.gdscript.format.SourceText;
import com.gdformatter.plugins.gdscript.parser.SyntaxNode;
import com.gdformatter.plugins.gdscript.parser.SyntaxTree;
import com.gdformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reorders class members to follow the style guide order given by {@link MemberKind}.
 * <p>
 * Expects already formatted source. Members of the same kind keep their
 * relative order. Inner classes are reordered recursively. When nothing needs
 * to move the input is returned as is, and a file with a top-level member in
 * a {@code fmt: off} region is never touched.
 */
public final class ReorderEngine {
    private static final Logger logger = LoggerUtil.getLogger(ReorderEngine.class);

    private static final Comparator<Declaration> ORDER = Comparator
            .comparing(Declaration::getKind)
            .thenComparingInt(Declaration::getOriginalIndex);

    private final SourceText source;
    private final CommentTable comments;
    private final SkipRegions skipRegions;

    private ReorderEngine(SourceText source) {
        this.source = source;
        this.comments = CommentTable.extract(source);
        this.skipRegions = SkipRegions.parse(source);
    }

    public static String reorder(String formattedSource) throws FormatException {
        if (formattedSource.isBlank()) {
            return formattedSource;
        }
        SyntaxTree tree = Formatter.parse(formattedSource);
        ReorderEngine engine = new ReorderEngine(new SourceText(formattedSource));

        List<SyntaxNode> members = tree.getRoot().getNamedChildren();
        if (engine._anySkipped(members)) {
            logger.fine("Top-level member inside a fmt: off region, not reordering");
            return formattedSource;
        }

        ScopeResult result = engine._reorderScope(members, 1, engine.source.getLineCount(), "", true);
        if (!result.changed) {
            return formattedSource;
        }
        String text = result.text;
        return text.endsWith("\n") ? text : text + "\n";
    }

    /**
     * Top-level declarations of a file in source order.
     */
    public static List<Declaration> declarations(String formattedSource) throws FormatException {
        SyntaxTree tree = Formatter.parse(formattedSource);
        SourceText text = new SourceText(formattedSource);
        return new DeclarationExtractor(text, CommentTable.extract(text), "", 1, text.getLineCount())
                .extract(tree.getRoot().getNamedChildren());
    }

    private ScopeResult _reorderScope(List<SyntaxNode> members, int scopeStart, int scopeEnd,
                                      String indentation, boolean topLevel) {
        List<Declaration> declarations = new DeclarationExtractor(source, comments, indentation, scopeStart, scopeEnd)
                .extract(members);
        if (declarations.isEmpty()) {
            return new ScopeResult(_lines(scopeStart, scopeEnd), false);
        }

        boolean changed = false;
        for (Declaration declaration : declarations) {
            declaration.setText(_lines(declaration.getStartLine(), declaration.getEndLine()));
            if (declaration.getKind() == MemberKind.INNER_CLASS) {
                String reordered = _reorderClass(declaration);
                if (!reordered.equals(declaration.getText())) {
                    declaration.setText(reordered);
                    changed = true;
                }
            }
        }

        List<Declaration> sorted = new ArrayList<>(declarations);
        sorted.sort(ORDER);
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i) != declarations.get(i)) {
                changed = true;
                break;
            }
        }
        if (!changed) {
            return new ScopeResult(_lines(scopeStart, scopeEnd), false);
        }
        logger.fine("Reordering " + sorted.size() + " declarations starting at line " + scopeStart);

        StringBuilder sb = new StringBuilder(_lines(scopeStart, declarations.get(0).getStartLine() - 1));
        Declaration previous = null;
        for (Declaration declaration : sorted) {
            if (previous != null) {
                sb.append("\n".repeat(blankLinesBetween(previous, declaration, topLevel)));
            }
            sb.append(declaration.getText());
            previous = declaration;
        }
        return new ScopeResult(sb.toString(), true);
    }

    private String _reorderClass(Declaration declaration) {
        SyntaxNode node = declaration.getNode();
        SyntaxNode body = node.field("body");
        int headerEnd = NodeRenderer.headerEndLine(node);
        if (body == null || body.getStartLine() <= headerEnd) {
            return declaration.getText();
        }
        List<SyntaxNode> members = body.getNamedChildren();
        if (_anySkipped(members)) {
            return declaration.getText();
        }

        String indentation = source.getIndentation(members.get(0).getStartLine());
        ScopeResult inner = _reorderScope(members, headerEnd + 1, node.getEndLine(), indentation, false);
        if (!inner.changed) {
            return declaration.getText();
        }
        return _lines(declaration.getStartLine(), headerEnd)
                + inner.text
                + _lines(node.getEndLine() + 1, declaration.getEndLine());
    }

    /**
     * Blank lines the style asks for between two adjacent members after sorting.
     */
    static int blankLinesBetween(Declaration previous, Declaration next, boolean topLevel) {
        MemberKind prev = previous.getKind();
        MemberKind kind = next.getKind();
        if (prev.isHeader() && kind.isHeader()) {
            return 0;
        }
        if (prev.isFunctionLike() || kind.isFunctionLike()) {
            return topLevel ? 2 : 1;
        }
        if (prev == MemberKind.DOC_COMMENT || kind == MemberKind.DOC_COMMENT) {
            return 1;
        }
        int blanks = prev == kind ? Math.min(next.getBlankLinesBefore(), 1) : 1;
        if (next.hasDocComment() || next.hasSectionAnnotation()) {
            blanks = Math.max(blanks, 1);
        }
        return blanks;
    }

    private boolean _anySkipped(List<SyntaxNode> members) {
        for (SyntaxNode member : members) {
            if (skipRegions.isSkipped(member.getStartLine())) {
                return true;
            }
        }
        return false;
    }

    // Source lines [from, to], each followed by '\n'.
    private String _lines(int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int line = Math.max(from, 1); line <= Math.min(to, source.getLineCount()); line++) {
            sb.append(source.getLine(line)).append('\n');
        }
        return sb.toString();
    }

    private static final class ScopeResult {
        private final String text;
        private final boolean changed;

        ScopeResult(String text, boolean changed) {
            this.text = text;
            this.changed = changed;
        }
    }
}
