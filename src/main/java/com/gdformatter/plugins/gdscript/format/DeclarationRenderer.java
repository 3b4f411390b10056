package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.SyntaxNode;

import java.util.stream.Collectors;

/**
 * Classes, functions, variables, constants, signals and enums.
 */
final class DeclarationRenderer {
    private final NodeRenderer renderer;
    private final ExpressionRenderer expressions;

    DeclarationRenderer(NodeRenderer renderer, ExpressionRenderer expressions) {
        this.renderer = renderer;
        this.expressions = expressions;
    }

    void renderClass(SyntaxNode node) {
        StringBuilder header = new StringBuilder(_modifiers(node))
                .append("class ")
                .append(expressions.render(node.field("name")));
        SyntaxNode base = node.field("extends");
        if (base != null) {
            header.append(" extends ").append(expressions.render(base));
        }
        header.append(':');
        renderer.pushHeader(node, header.toString());
        renderer.renderBody(node.field("body"), BlankLinePolicy.Scope.CLASS_BODY);
    }

    void renderFunction(SyntaxNode node) {
        StringBuilder header = new StringBuilder(_modifiers(node))
                .append("func ")
                .append(expressions.render(node.field("name")))
                .append(expressions.renderParameters(node.field("parameters")));
        SyntaxNode returnType = node.field("return_type");
        if (returnType != null) {
            header.append(" -> ").append(expressions.render(returnType));
        }
        header.append(':');
        renderer.pushHeader(node, header.toString());
        renderer.renderBody(node.field("body"), BlankLinePolicy.Scope.BLOCK);
    }

    void renderVariable(SyntaxNode node) {
        renderer.pushStatement(node, _modifiers(node) + "var " + _binding(node));
    }

    void renderConst(SyntaxNode node) {
        renderer.pushStatement(node, _modifiers(node) + "const " + _binding(node));
    }

    void renderSignal(SyntaxNode node) {
        StringBuilder text = new StringBuilder(_modifiers(node))
                .append("signal ")
                .append(expressions.render(node.field("name")));
        SyntaxNode parameters = node.field("parameters");
        if (parameters != null) {
            text.append(expressions.renderParameters(parameters));
        }
        renderer.pushStatement(node, text.toString());
    }

    void renderEnum(SyntaxNode node) {
        StringBuilder text = new StringBuilder(_modifiers(node)).append("enum ");
        SyntaxNode name = node.field("name");
        if (name != null) {
            text.append(expressions.render(name)).append(' ');
        }
        text.append(expressions.renderEnumerators(node.field("body")));
        renderer.pushStatement(node, text.toString());
    }

    // name[: Type][ = value] or name := value
    private String _binding(SyntaxNode node) {
        StringBuilder text = new StringBuilder(expressions.render(node.field("name")));
        SyntaxNode value = node.field("value");
        if (node.hasField("inferred_type")) {
            return text.append(" := ").append(expressions.render(value)).toString();
        }
        SyntaxNode type = node.field("type");
        if (type != null) {
            text.append(": ").append(expressions.render(type));
        }
        if (value != null) {
            text.append(" = ").append(expressions.render(value));
        }
        return text.toString();
    }

    // Same-line annotations and the static keyword, each followed by a space.
    private String _modifiers(SyntaxNode node) {
        StringBuilder prefix = new StringBuilder();
        SyntaxNode annotations = node.field("annotations");
        if (annotations != null) {
            prefix.append(annotations.getNamedChildren().stream()
                    .map(expressions::renderAnnotation)
                    .collect(Collectors.joining(" ")))
                    .append(' ');
        }
        if (node.hasField("static")) {
            prefix.append("static ");
        }
        return prefix.toString();
    }
}
