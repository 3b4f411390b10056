package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.SyntaxNode;

/**
 * Simple statements that fit on one logical line.
 */
final class StatementRenderer {
    private final NodeRenderer renderer;
    private final ExpressionRenderer expressions;

    StatementRenderer(NodeRenderer renderer, ExpressionRenderer expressions) {
        this.renderer = renderer;
        this.expressions = expressions;
    }

    void render(SyntaxNode node) {
        String text = switch (node.getKind()) {
            case EXTENDS_STATEMENT -> "extends " + expressions.render(node.fieldOrNamedChild("type", 0));
            case CLASS_NAME_STATEMENT -> "class_name " + expressions.render(node.fieldOrNamedChild("name", 0));
            case PASS_STATEMENT -> "pass";
            case BREAK_STATEMENT -> "break";
            case CONTINUE_STATEMENT -> "continue";
            case BREAKPOINT_STATEMENT -> "breakpoint";
            case RETURN_STATEMENT -> {
                SyntaxNode value = node.field("value");
                yield value == null ? "return" : "return " + expressions.render(value);
            }
            case EXPRESSION_STATEMENT -> expressions.render(node.getNamedChild(0));
            case ANNOTATION -> expressions.renderAnnotation(node);
            default -> node.text();
        };
        renderer.pushStatement(node, text);
    }
}
