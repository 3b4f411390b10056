package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.SyntaxNode;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders expressions, types, parameter lists and annotations to single
 * strings. A container with a trailing comma renders one element per line and
 * so yields text with line breaks.
 */
final class ExpressionRenderer {
    private final RenderContext ctx;

    ExpressionRenderer(RenderContext ctx) {
        this.ctx = ctx;
    }

    String render(SyntaxNode node) {
        if (node == null) {
            return "";
        }
        return switch (node.getKind()) {
            case BINARY_OPERATOR, COMPARISON_OPERATOR, BOOLEAN_OPERATOR -> _binary(node);
            case UNARY_OPERATOR -> _unary(node);
            case CONDITIONAL_EXPRESSION -> render(node.fieldOrNamedChild("left", 0))
                    + " if " + render(node.fieldOrNamedChild("condition", 1))
                    + " else " + render(node.fieldOrNamedChild("right", 2));
            case CAST -> render(node.fieldOrNamedChild("value", 0)) + " as " + render(node.fieldOrNamedChild("type", 1));
            case AWAIT_EXPRESSION -> "await " + render(node.fieldOrNamedChild("value", 0));
            case CALL -> render(node.fieldOrNamedChild("function", 0)) + render(node.fieldOrNamedChild("arguments", 1));
            case ARGUMENTS -> _container(node, "(", ")", false, this::render);
            case ATTRIBUTE -> render(node.fieldOrNamedChild("object", 0)) + "." + render(node.fieldOrNamedChild("attribute", 1));
            case SUBSCRIPT -> render(node.fieldOrNamedChild("value", 0)) + "[" + render(node.fieldOrNamedChild("subscript", 1)) + "]";
            case ARRAY -> _container(node, "[", "]", false, this::render);
            case DICTIONARY -> _container(node, "{", "}", true, this::render);
            case PAIR -> _pair(node);
            case PARENTHESIZED_EXPRESSION -> "(" + render(node.getNamedChild(0)) + ")";
            case ASSIGNMENT, AUGMENTED_ASSIGNMENT -> _binary(node);
            case TYPE -> renderType(node);
            default -> node.text();
        };
    }

    /**
     * {@code int}, {@code Node.Mode}, {@code Array[int]}, {@code Dictionary[String, int]}.
     */
    String renderType(SyntaxNode type) {
        if (!type.is(NodeKind.TYPE)) {
            return type.text();
        }
        StringBuilder sb = new StringBuilder();
        for (SyntaxNode child : type.getChildren()) {
            if (child.is(NodeKind.TYPE)) {
                sb.append(renderType(child));
            } else if (child.text().equals(",")) {
                sb.append(", ");
            } else {
                sb.append(child.text());
            }
        }
        return sb.toString();
    }

    String renderParameters(SyntaxNode parameters) {
        return _container(parameters, "(", ")", false, this::_parameter);
    }

    String renderEnumerators(SyntaxNode list) {
        return _container(list, "{", "}", true, enumerator -> {
            SyntaxNode value = enumerator.field("value");
            String name = render(enumerator.fieldOrNamedChild("name", 0));
            return value == null ? name : name + " = " + render(value);
        });
    }

    String renderAnnotation(SyntaxNode annotation) {
        SyntaxNode arguments = annotation.field("arguments");
        return "@" + render(annotation.field("name")) + (arguments == null ? "" : render(arguments));
    }

    private String _binary(SyntaxNode node) {
        SyntaxNode left = node.fieldOrNamedChild("left", 0);
        SyntaxNode right = node.fieldOrNamedChild("right", 1);
        SyntaxNode operator = node.field("operator");
        String op = operator != null ? operator.text() : _positionalOperator(node);
        return render(left) + " " + op + " " + render(right);
    }

    // Compound operators without an operator field: "not in", "is not".
    private String _positionalOperator(SyntaxNode node) {
        return node.getChildren().stream()
                .filter(child -> !child.isNamed())
                .map(SyntaxNode::text)
                .collect(Collectors.joining(" "));
    }

    private String _unary(SyntaxNode node) {
        SyntaxNode operator = node.field("operator");
        String operand = render(node.fieldOrNamedChild("operand", 0));
        String op = operator != null ? operator.text() : "";
        return op.equals("not") ? "not " + operand : op + operand;
    }

    private String _pair(SyntaxNode pair) {
        String key = render(pair.fieldOrNamedChild("key", 0));
        SyntaxNode value = pair.fieldOrNamedChild("value", 1);
        if (value == null) {
            return key;
        }
        SyntaxNode separator = pair.field("separator");
        boolean assigns = separator != null && separator.text().equals("=");
        return key + (assigns ? " = " : ": ") + render(value);
    }

    private String _parameter(SyntaxNode parameter) {
        String name = render(parameter.fieldOrNamedChild("name", 0));
        SyntaxNode type = parameter.field("type");
        SyntaxNode value = parameter.field("value");
        return switch (parameter.getKind()) {
            case TYPED_PARAMETER -> name + ": " + render(type);
            case DEFAULT_PARAMETER -> parameter.hasField("inferred_type")
                    ? name + " := " + render(value)
                    : name + " = " + render(value);
            case TYPED_DEFAULT_PARAMETER -> name + ": " + render(type) + " = " + render(value);
            default -> parameter.text();
        };
    }

    private String _container(SyntaxNode node, String open, String close, boolean padded,
                              Function<SyntaxNode, String> element) {
        List<SyntaxNode> elements = node.getNamedChildren();
        if (elements.isEmpty()) {
            return open + close;
        }
        if (node.hasTrailingComma()) {
            StringBuilder sb = new StringBuilder(open).append('\n');
            ctx.indent();
            String inner = ctx.indentString();
            for (SyntaxNode child : elements) {
                sb.append(inner).append(element.apply(child)).append(",\n");
            }
            ctx.dedent();
            return sb.append(ctx.indentString()).append(close).toString();
        }
        String joined = elements.stream().map(element).collect(Collectors.joining(", "));
        return padded ? open + " " + joined + " " + close : open + joined + close;
    }
}
