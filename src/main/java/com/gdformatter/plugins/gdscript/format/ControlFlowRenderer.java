package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.SyntaxNode;

/**
 * {@code if}/{@code elif}/{@code else}, {@code for} and {@code while}.
 * {@code match} never reaches this class; it is always copied verbatim.
 */
final class ControlFlowRenderer {
    private final NodeRenderer renderer;
    private final ExpressionRenderer expressions;

    ControlFlowRenderer(NodeRenderer renderer, ExpressionRenderer expressions) {
        this.renderer = renderer;
        this.expressions = expressions;
    }

    void renderIf(SyntaxNode node) {
        renderer.pushHeader(node, "if " + expressions.render(node.field("condition")) + ":");
        renderer.renderBody(node.field("body"), BlankLinePolicy.Scope.BLOCK);

        for (SyntaxNode clause : node.getNamedChildren()) {
            if (clause.is(NodeKind.ELIF_CLAUSE)) {
                renderer.pushHeader(clause, "elif " + expressions.render(clause.field("condition")) + ":");
                renderer.renderBody(clause.field("body"), BlankLinePolicy.Scope.BLOCK);
            }
        }

        SyntaxNode alternative = node.field("alternative");
        if (alternative != null) {
            renderer.pushHeader(alternative, "else:");
            renderer.renderBody(alternative.field("body"), BlankLinePolicy.Scope.BLOCK);
        }
    }

    void renderFor(SyntaxNode node) {
        StringBuilder header = new StringBuilder("for ").append(expressions.render(node.field("left")));
        SyntaxNode type = node.field("type");
        if (type != null) {
            header.append(": ").append(expressions.render(type));
        }
        header.append(" in ").append(expressions.render(node.field("right"))).append(':');
        renderer.pushHeader(node, header.toString());
        renderer.renderBody(node.field("body"), BlankLinePolicy.Scope.BLOCK);
    }

    void renderWhile(SyntaxNode node) {
        renderer.pushHeader(node, "while " + expressions.render(node.field("condition")) + ":");
        renderer.renderBody(node.field("body"), BlankLinePolicy.Scope.BLOCK);
    }
}
