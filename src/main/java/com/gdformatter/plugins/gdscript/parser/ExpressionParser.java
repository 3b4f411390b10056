package com.gdformatter.plugins.gdscript.parser;

import static com.gdformatter.plugins.gdscript.parser.TokenType.*;

/**
 * Expression and match-pattern parsing, sharing the token cursor of a {@link GDScriptParser}.
 * <p>
 * Precedence, loosest first: lambda, ternary {@code if/else}, {@code or},
 * {@code and}, {@code not}, {@code in}, comparisons, {@code |}, {@code ^},
 * {@code &}, shifts, additive, multiplicative, unary sign, {@code ~},
 * {@code **}, {@code is}/{@code as}, {@code await}, postfix access.
 */
class ExpressionParser {
    private final GDScriptParser parser;

    ExpressionParser(GDScriptParser parser) {
        this.parser = parser;
    }

    SyntaxNode parseExpression() {
        if (parser.check(FUNC)) {
            return _parseLambda();
        }
        return _parseTernary();
    }

    private SyntaxNode _parseTernary() {
        SyntaxNode value = _parseOr();
        if (!parser.check(IF)) {
            return value;
        }
        SyntaxNode.Builder conditional = parser.node(NodeKind.CONDITIONAL_EXPRESSION);
        conditional.add("left", value);
        conditional.token(parser.advance());
        conditional.add("condition", _parseOr());
        conditional.token(parser.expect(ELSE, "'else'"));
        conditional.add("right", parseExpression());
        return conditional.build();
    }

    private SyntaxNode _parseOr() {
        SyntaxNode left = _parseAnd();
        while (parser.check(OR) || parser.check(PIPE_PIPE)) {
            left = _binary(NodeKind.BOOLEAN_OPERATOR, left, this::_parseAnd);
        }
        return left;
    }

    private SyntaxNode _parseAnd() {
        SyntaxNode left = _parseNot();
        while (parser.check(AND) || parser.check(AMP_AMP)) {
            left = _binary(NodeKind.BOOLEAN_OPERATOR, left, this::_parseNot);
        }
        return left;
    }

    private SyntaxNode _parseNot() {
        if (parser.check(NOT) || parser.check(BANG)) {
            SyntaxNode.Builder unary = parser.node(NodeKind.UNARY_OPERATOR);
            unary.token("operator", parser.advance());
            unary.add("operand", _parseNot());
            return unary.build();
        }
        return _parseIn();
    }

    private SyntaxNode _parseIn() {
        SyntaxNode left = _parseComparison();
        while (true) {
            if (parser.check(IN)) {
                left = _binary(NodeKind.BINARY_OPERATOR, left, this::_parseComparison);
            } else if (parser.check(NOT) && parser.peekNext().is(IN)) {
                SyntaxNode.Builder binary = parser.node(NodeKind.BINARY_OPERATOR);
                binary.add("left", left);
                binary.token(parser.advance());
                binary.token(parser.advance());
                binary.add("right", _parseComparison());
                left = binary.build();
            } else {
                return left;
            }
        }
    }

    private SyntaxNode _parseComparison() {
        SyntaxNode left = _parseBitOr();
        while (_checkAny(EQ_EQ, BANG_EQ, LT, LE, GT, GE)) {
            left = _binary(NodeKind.COMPARISON_OPERATOR, left, this::_parseBitOr);
        }
        return left;
    }

    private SyntaxNode _parseBitOr() {
        SyntaxNode left = _parseBitXor();
        while (parser.check(PIPE)) {
            left = _binary(NodeKind.BINARY_OPERATOR, left, this::_parseBitXor);
        }
        return left;
    }

    private SyntaxNode _parseBitXor() {
        SyntaxNode left = _parseBitAnd();
        while (parser.check(CARET)) {
            left = _binary(NodeKind.BINARY_OPERATOR, left, this::_parseBitAnd);
        }
        return left;
    }

    private SyntaxNode _parseBitAnd() {
        SyntaxNode left = _parseShift();
        while (parser.check(AMP)) {
            left = _binary(NodeKind.BINARY_OPERATOR, left, this::_parseShift);
        }
        return left;
    }

    private SyntaxNode _parseShift() {
        SyntaxNode left = _parseAdditive();
        while (_checkAny(LSHIFT, RSHIFT)) {
            left = _binary(NodeKind.BINARY_OPERATOR, left, this::_parseAdditive);
        }
        return left;
    }

    private SyntaxNode _parseAdditive() {
        SyntaxNode left = _parseMultiplicative();
        while (_checkAny(PLUS, MINUS)) {
            left = _binary(NodeKind.BINARY_OPERATOR, left, this::_parseMultiplicative);
        }
        return left;
    }

    private SyntaxNode _parseMultiplicative() {
        SyntaxNode left = _parseSign();
        while (_checkAny(STAR, SLASH, PERCENT)) {
            left = _binary(NodeKind.BINARY_OPERATOR, left, this::_parseSign);
        }
        return left;
    }

    private SyntaxNode _parseSign() {
        if (_checkAny(MINUS, PLUS)) {
            SyntaxNode.Builder unary = parser.node(NodeKind.UNARY_OPERATOR);
            unary.token("operator", parser.advance());
            unary.add("operand", _parseSign());
            return unary.build();
        }
        return _parseBitNot();
    }

    private SyntaxNode _parseBitNot() {
        if (parser.check(TILDE)) {
            SyntaxNode.Builder unary = parser.node(NodeKind.UNARY_OPERATOR);
            unary.token("operator", parser.advance());
            unary.add("operand", _parseBitNot());
            return unary.build();
        }
        return _parsePower();
    }

    private SyntaxNode _parsePower() {
        SyntaxNode left = _parseTypeTest();
        while (parser.check(STAR_STAR)) {
            left = _binary(NodeKind.BINARY_OPERATOR, left, this::_parseTypeTest);
        }
        return left;
    }

    private SyntaxNode _parseTypeTest() {
        SyntaxNode left = _parseAwait();
        while (true) {
            if (parser.check(IS)) {
                SyntaxNode.Builder binary = parser.node(NodeKind.BINARY_OPERATOR);
                binary.add("left", left);
                if (parser.peekNext().is(NOT)) {
                    binary.token(parser.advance());
                    binary.token(parser.advance());
                } else {
                    binary.token("operator", parser.advance());
                }
                binary.add("right", parser.parseType());
                left = binary.build();
            } else if (parser.check(AS)) {
                SyntaxNode.Builder cast = parser.node(NodeKind.CAST);
                cast.add("value", left);
                cast.token(parser.advance());
                cast.add("type", parser.parseType());
                left = cast.build();
            } else {
                return left;
            }
        }
    }

    private SyntaxNode _parseAwait() {
        if (parser.check(AWAIT)) {
            SyntaxNode.Builder await = parser.node(NodeKind.AWAIT_EXPRESSION);
            await.token(parser.advance());
            await.add("value", _parseAwait());
            return await.build();
        }
        return _parsePostfix();
    }

    private SyntaxNode _parsePostfix() {
        SyntaxNode expression = _parsePrimary();
        while (true) {
            if (parser.check(LPAREN)) {
                expression = parser.node(NodeKind.CALL)
                        .add("function", expression)
                        .add("arguments", parseArguments())
                        .build();
            } else if (parser.check(DOT)) {
                SyntaxNode.Builder attribute = parser.node(NodeKind.ATTRIBUTE);
                attribute.add("object", expression);
                attribute.token(parser.advance());
                attribute.add("attribute", parser.identifier("member name"));
                expression = attribute.build();
            } else if (parser.check(LBRACKET)) {
                SyntaxNode.Builder subscript = parser.node(NodeKind.SUBSCRIPT);
                subscript.add("value", expression);
                subscript.token(parser.advance());
                parser.bracketDepth++;
                subscript.add("subscript", parseExpression());
                subscript.token(parser.expect(RBRACKET, "']'"));
                parser.bracketDepth--;
                expression = subscript.build();
            } else {
                return expression;
            }
        }
    }

    private SyntaxNode _parsePrimary() {
        if (parser.atLineBreak() || parser.isAtEnd()) {
            throw new ParseException("Expected expression", parser.peek());
        }
        Token token = parser.peek();
        return switch (token.getType()) {
            case IDENTIFIER -> parser.leaf(NodeKind.IDENTIFIER, parser.advance());
            case INTEGER -> parser.leaf(NodeKind.INTEGER, parser.advance());
            case FLOAT -> parser.leaf(NodeKind.FLOAT, parser.advance());
            case STRING -> parser.leaf(NodeKind.STRING, parser.advance());
            case STRING_NAME -> parser.leaf(NodeKind.STRING_NAME, parser.advance());
            case NODE_PATH -> parser.leaf(NodeKind.NODE_PATH, parser.advance());
            case GET_NODE -> parser.leaf(NodeKind.GET_NODE, parser.advance());
            case TRUE -> parser.leaf(NodeKind.TRUE, parser.advance());
            case FALSE -> parser.leaf(NodeKind.FALSE, parser.advance());
            case NULL -> parser.leaf(NodeKind.NULL, parser.advance());
            case SELF -> parser.leaf(NodeKind.SELF, parser.advance());
            case SUPER -> parser.leaf(NodeKind.SUPER, parser.advance());
            case LPAREN -> _parseParenthesized();
            case LBRACKET -> _parseArray();
            case LBRACE -> _parseDictionary();
            case FUNC -> _parseLambda();
            default -> throw new ParseException("Expected expression", token);
        };
    }

    private SyntaxNode _parseParenthesized() {
        SyntaxNode.Builder group = parser.node(NodeKind.PARENTHESIZED_EXPRESSION);
        group.token(parser.advance());
        parser.bracketDepth++;
        group.add(parseExpression());
        group.token(parser.expect(RPAREN, "')'"));
        parser.bracketDepth--;
        return group.build();
    }

    SyntaxNode parseArguments() {
        SyntaxNode.Builder arguments = parser.node(NodeKind.ARGUMENTS);
        arguments.token(parser.expect(LPAREN, "'('"));
        parser.bracketDepth++;
        while (!parser.check(RPAREN)) {
            arguments.add(parseExpression());
            if (!parser.check(COMMA)) {
                break;
            }
            arguments.token(parser.advance());
        }
        arguments.token(parser.expect(RPAREN, "')'"));
        parser.bracketDepth--;
        return arguments.build();
    }

    private SyntaxNode _parseArray() {
        SyntaxNode.Builder array = parser.node(NodeKind.ARRAY);
        array.token(parser.advance());
        parser.bracketDepth++;
        while (!parser.check(RBRACKET)) {
            array.add(parseExpression());
            if (!parser.check(COMMA)) {
                break;
            }
            array.token(parser.advance());
        }
        array.token(parser.expect(RBRACKET, "']'"));
        parser.bracketDepth--;
        return array.build();
    }

    private SyntaxNode _parseDictionary() {
        SyntaxNode.Builder dictionary = parser.node(NodeKind.DICTIONARY);
        dictionary.token(parser.advance());
        parser.bracketDepth++;
        while (!parser.check(RBRACE)) {
            SyntaxNode.Builder pair = parser.node(NodeKind.PAIR);
            pair.add("key", parseExpression());
            if (parser.check(COLON) || parser.check(EQ)) {
                pair.token("separator", parser.advance());
            } else {
                throw new ParseException("Unexpected token in dictionary", parser.peek(), "':' or '='");
            }
            pair.add("value", parseExpression());
            dictionary.add(pair.build());
            if (!parser.check(COMMA)) {
                break;
            }
            dictionary.token(parser.advance());
        }
        dictionary.token(parser.expect(RBRACE, "'}'"));
        parser.bracketDepth--;
        return dictionary.build();
    }

    private SyntaxNode _parseLambda() {
        SyntaxNode.Builder lambda = parser.node(NodeKind.LAMBDA);
        lambda.token(parser.advance());
        if (parser.check(IDENTIFIER)) {
            lambda.add("name", parser.identifier("lambda name"));
        }
        lambda.add("parameters", parser.parseParameters());
        if (parser.check(ARROW)) {
            lambda.token(parser.advance());
            lambda.add("return_type", parser.parseType());
        }
        lambda.token(parser.expect(COLON, "':'"));
        parser.lambdaDepth++;
        try {
            lambda.add("body", parser.parseBody());
        } finally {
            parser.lambdaDepth--;
        }
        return lambda.build();
    }

    // ============ Match patterns ============

    SyntaxNode parsePattern() {
        if (parser.check(VAR)) {
            SyntaxNode.Builder binding = parser.node(NodeKind.PATTERN_BINDING);
            binding.token(parser.advance());
            binding.add("name", parser.identifier("binding name"));
            return binding.build();
        }
        if (parser.check(DOT_DOT)) {
            return parser.node(NodeKind.PATTERN_OPEN_ENDING).token(parser.advance()).build();
        }
        if (parser.check(LBRACKET)) {
            SyntaxNode.Builder array = parser.node(NodeKind.ARRAY);
            array.token(parser.advance());
            parser.bracketDepth++;
            while (!parser.check(RBRACKET)) {
                array.add(parsePattern());
                if (!parser.check(COMMA)) {
                    break;
                }
                array.token(parser.advance());
            }
            array.token(parser.expect(RBRACKET, "']'"));
            parser.bracketDepth--;
            return array.build();
        }
        if (parser.check(LBRACE)) {
            SyntaxNode.Builder dictionary = parser.node(NodeKind.DICTIONARY);
            dictionary.token(parser.advance());
            parser.bracketDepth++;
            while (!parser.check(RBRACE)) {
                if (parser.check(DOT_DOT)) {
                    dictionary.add(parsePattern());
                } else {
                    SyntaxNode.Builder pair = parser.node(NodeKind.PAIR);
                    pair.add("key", parseExpression());
                    if (parser.check(COLON)) {
                        pair.token("separator", parser.advance());
                        pair.add("value", parsePattern());
                    }
                    dictionary.add(pair.build());
                }
                if (!parser.check(COMMA)) {
                    break;
                }
                dictionary.token(parser.advance());
            }
            dictionary.token(parser.expect(RBRACE, "'}'"));
            parser.bracketDepth--;
            return dictionary.build();
        }
        return _parseOr();
    }

    // ============ Helpers ============

    @FunctionalInterface
    private interface ExpressionLevel {
        SyntaxNode parse();
    }

    private SyntaxNode _binary(NodeKind kind, SyntaxNode left, ExpressionLevel operand) {
        SyntaxNode.Builder binary = parser.node(kind);
        binary.add("left", left);
        binary.token("operator", parser.advance());
        binary.add("right", operand.parse());
        return binary.build();
    }

    private boolean _checkAny(TokenType... types) {
        if (parser.atLineBreak()) {
            return false;
        }
        return parser.peek().isOneOf(types);
    }
}
