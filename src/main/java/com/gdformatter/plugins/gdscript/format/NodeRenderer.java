package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.SyntaxNode;
import com.gdformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns a syntax tree into tagged output lines.
 * <p>
 * Dispatch is by node kind. Anything that cannot be re-rendered without
 * risking a lost comment or a structural change is copied from the source
 * instead: nodes starting in a skip region, {@code match} statements,
 * variables with property accessors, single-line compound statements,
 * statements spanning several lines that carry a comment or a block lambda,
 * and any kind without a dedicated renderer.
 */
public class NodeRenderer {
    private static final Logger logger = LoggerUtil.getLogger(NodeRenderer.class);

    private final RenderContext ctx;
    private final ExpressionRenderer expressions;
    private final DeclarationRenderer declarations;
    private final StatementRenderer statements;
    private final ControlFlowRenderer controlFlow;

    // Last source line already copied verbatim.
    private int verbatimThrough = 0;

    public NodeRenderer(RenderContext ctx) {
        this.ctx = ctx;
        this.expressions = new ExpressionRenderer(ctx);
        this.declarations = new DeclarationRenderer(this, expressions);
        this.statements = new StatementRenderer(this, expressions);
        this.controlFlow = new ControlFlowRenderer(this, expressions);
    }

    public void renderSource(SyntaxNode root) {
        renderSequence(root.getNamedChildren(), BlankLinePolicy.Scope.TOP_LEVEL);
    }

    public void render(SyntaxNode node) {
        if (_requiresVerbatim(node)) {
            renderVerbatim(node);
            return;
        }
        switch (node.getKind()) {
            case CLASS_DEFINITION -> declarations.renderClass(node);
            case FUNCTION_DEFINITION -> declarations.renderFunction(node);
            case VARIABLE_STATEMENT -> declarations.renderVariable(node);
            case CONST_STATEMENT -> declarations.renderConst(node);
            case SIGNAL_STATEMENT -> declarations.renderSignal(node);
            case ENUM_DEFINITION -> declarations.renderEnum(node);
            case EXTENDS_STATEMENT, CLASS_NAME_STATEMENT, PASS_STATEMENT, BREAK_STATEMENT,
                    CONTINUE_STATEMENT, BREAKPOINT_STATEMENT, RETURN_STATEMENT,
                    EXPRESSION_STATEMENT, ANNOTATION -> statements.render(node);
            case IF_STATEMENT -> controlFlow.renderIf(node);
            case FOR_STATEMENT -> controlFlow.renderFor(node);
            case WHILE_STATEMENT -> controlFlow.renderWhile(node);
            default -> renderVerbatim(node);
        }
    }

    /**
     * Renders sibling statements with the blank-line policy of their scope.
     */
    void renderSequence(List<SyntaxNode> nodes, BlankLinePolicy.Scope scope) {
        SyntaxNode previous = null;
        for (int i = 0; i < nodes.size(); i++) {
            SyntaxNode node = nodes.get(i);
            if (previous != null) {
                int sourceBlanks = BlankLinePolicy.countSourceBlankLines(
                        ctx.getSource(), previous.getEndLine(), node.getStartLine());
                int blanks = BlankLinePolicy.blankLines(
                        previous.getKind(), _effectiveKind(nodes, i), sourceBlanks, scope);
                ctx.getOutput().pushBlankLines(blanks);
            }
            render(node);
            previous = node;
        }
    }

    void renderBody(SyntaxNode body, BlankLinePolicy.Scope scope) {
        ctx.indent();
        renderSequence(body.getNamedChildren(), scope);
        ctx.dedent();
    }

    /**
     * Pushes a block header such as {@code func f():} tagged with every source
     * line up to its colon.
     */
    void pushHeader(SyntaxNode clause, String header) {
        ctx.getOutput().pushMapped(ctx.indentString() + header, clause.getStartLine(), headerEndLine(clause));
    }

    void pushStatement(SyntaxNode node, String text) {
        ctx.getOutput().pushMapped(ctx.indentString() + text, node.getStartLine(), node.getEndLine());
    }

    /**
     * Copies the node's source unchanged. A node alone on its lines keeps
     * whole lines; a node sharing a line with another statement keeps its own
     * text at the current indentation.
     */
    void renderVerbatim(SyntaxNode node) {
        SourceText source = ctx.getSource();
        int start = node.getStartLine();
        int end = node.getEndLine();
        logger.fine("Copying " + node.getKind() + " at lines " + start + "-" + end + " verbatim");

        String firstLine = source.getLine(start);
        String lastLine = source.getLine(end);
        boolean aloneAtStart = firstLine.substring(0, Math.min(node.getStartColumn(), firstLine.length())).isBlank();
        String rest = node.getEndColumn() < lastLine.length() ? lastLine.substring(node.getEndColumn()).trim() : "";
        boolean aloneAtEnd = rest.isEmpty() || rest.startsWith("#");

        if (!aloneAtStart || !aloneAtEnd) {
            pushStatement(node, node.text());
            verbatimThrough = Math.max(verbatimThrough, end);
            return;
        }
        for (int line = Math.max(start, verbatimThrough + 1); line <= end; line++) {
            ctx.getOutput().pushMapped(source.getLine(line), line);
        }
        verbatimThrough = Math.max(verbatimThrough, end);
    }

    private boolean _requiresVerbatim(SyntaxNode node) {
        if (ctx.isSkipped(node.getStartLine())) {
            return true;
        }
        switch (node.getKind()) {
            case MATCH_STATEMENT:
                return true;
            case VARIABLE_STATEMENT:
                if (node.hasField("setget")) {
                    return true;
                }
                break;
            case FUNCTION_DEFINITION:
            case CLASS_DEFINITION:
            case IF_STATEMENT:
            case FOR_STATEMENT:
            case WHILE_STATEMENT:
                return !node.isMultiLine() || _hasUnsafeHeader(node);
            default:
                break;
        }
        return node.isMultiLine() && _hasUnsafeContent(node, node.getStartLine(), node.getEndLine());
    }

    // A header that would be joined onto one line must not hide a comment or a block lambda.
    private boolean _hasUnsafeHeader(SyntaxNode node) {
        for (SyntaxNode clause : _clauses(node)) {
            int start = clause.getStartLine();
            int end = headerEndLine(clause);
            if (end > start && _hasUnsafeContent(clause, start, end)) {
                return true;
            }
        }
        return false;
    }

    private boolean _hasUnsafeContent(SyntaxNode node, int start, int end) {
        if (ctx.getComments().hasCommentBetween(start, end)) {
            return true;
        }
        SyntaxNode body = node.field("body");
        for (SyntaxNode child : node.getChildren()) {
            if (child.getStartLine() > end) {
                break;
            }
            if (child != body && _containsBlockLambda(child)) {
                return true;
            }
        }
        return false;
    }

    private static boolean _containsBlockLambda(SyntaxNode node) {
        if (node.is(NodeKind.LAMBDA) && node.isMultiLine()) {
            return true;
        }
        for (SyntaxNode child : node.getNamedChildren()) {
            if (_containsBlockLambda(child)) {
                return true;
            }
        }
        return false;
    }

    private static List<SyntaxNode> _clauses(SyntaxNode node) {
        List<SyntaxNode> clauses = new ArrayList<>();
        clauses.add(node);
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child.is(NodeKind.ELIF_CLAUSE) || child.is(NodeKind.ELSE_CLAUSE)) {
                clauses.add(child);
            }
        }
        return clauses;
    }

    /**
     * Line of the colon that opens a clause's body.
     */
    public static int headerEndLine(SyntaxNode clause) {
        SyntaxNode body = clause.field("body");
        int end = clause.getStartLine();
        for (SyntaxNode child : clause.getChildren()) {
            if (child == body) {
                break;
            }
            end = child.getEndLine();
        }
        return end;
    }

    /**
     * A standalone annotation spaces like the declaration it precedes.
     */
    private static NodeKind _effectiveKind(List<SyntaxNode> nodes, int index) {
        for (int i = index; i < nodes.size(); i++) {
            if (!nodes.get(i).is(NodeKind.ANNOTATION)) {
                return nodes.get(i).getKind();
            }
        }
        return nodes.get(index).getKind();
    }
}
