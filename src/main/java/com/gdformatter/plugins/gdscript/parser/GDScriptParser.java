package com.gdformatter.plugins.gdscript.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.gdformatter.plugins.gdscript.parser.TokenType.*;

/**
 * Recursive-descent parser for GDScript 4 (declarations and statements).
 * <p>
 * Blocks are driven by the line-start and indentation data carried on each
 * token. Inside brackets line breaks are insignificant, except in the body of
 * a block lambda, which re-enters statement mode. Expressions are delegated to
 * {@link ExpressionParser}.
 */
public class GDScriptParser {

    final String source;
    private final List<Token> tokens;
    private int current = 0;

    // >0 while inside brackets of the innermost statement context
    int bracketDepth = 0;
    // >0 while parsing a lambda body, where a closing bracket may end a statement
    int lambdaDepth = 0;
    // index of the token that opens the statement or pattern being parsed
    private int lineOpener = -1;
    private final Deque<Integer> indentStack = new ArrayDeque<>();

    private final ExpressionParser expressions = new ExpressionParser(this);

    public GDScriptParser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
        indentStack.push(0);
    }

    /**
     * Parses the whole file.
     *
     * @throws ParseException on the first syntax error
     */
    public SyntaxTree parse() {
        SyntaxNode.Builder root = node(NodeKind.SOURCE);
        while (!isAtEnd()) {
            Token next = peek();
            if (!next.isLineStart()) {
                throw new ParseException("Expected end of statement", next);
            }
            if (next.getIndent() != 0) {
                throw new ParseException("Unexpected indentation", next);
            }
            parseStatementLine(root);
        }
        SyntaxNode rootNode = root.isEmpty() ? root.buildEmptyAt(peek()) : root.build();
        return new SyntaxTree(source, rootNode);
    }

    // ============ Token cursor ============

    Token peek() {
        return tokens.get(current);
    }

    Token peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }

    Token previous() {
        return tokens.get(current - 1);
    }

    Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    boolean isAtEnd() {
        return peek().is(EOF);
    }

    /**
     * True when the next token starts a new logical line that ends the current expression.
     * The first token of the statement being parsed never counts as a break.
     */
    boolean atLineBreak() {
        return bracketDepth == 0 && peek().isLineStart() && current != lineOpener;
    }

    /**
     * Token check that respects line breaks outside brackets.
     */
    boolean check(TokenType type) {
        return !atLineBreak() && peek().is(type);
    }

    boolean checkIdentifier(String lexeme) {
        return check(IDENTIFIER) && peek().getLexeme().equals(lexeme);
    }

    Token expect(TokenType type, String expected) {
        if (!check(type)) {
            throw new ParseException("Unexpected token", peek(), expected);
        }
        return advance();
    }

    SyntaxNode.Builder node(NodeKind kind) {
        return new SyntaxNode.Builder(kind, source);
    }

    SyntaxNode leaf(NodeKind kind, Token token) {
        return SyntaxNode.leaf(kind, token, source);
    }

    SyntaxNode identifier(String expected) {
        return leaf(NodeKind.IDENTIFIER, expect(IDENTIFIER, expected));
    }

    // ============ Statements ============

    /**
     * Parses one logical line, which may hold several statements separated by semicolons.
     */
    void parseStatementLine(SyntaxNode.Builder block) {
        boolean more;
        do {
            NodeKind kind = _parseStatement(block);
            more = _continuesOnSameLine(kind);
        } while (more);
    }

    private boolean _continuesOnSameLine(NodeKind lastKind) {
        Token next = peek();
        if (next.is(SEMICOLON)) {
            advance();
            next = peek();
            return !next.is(EOF) && !next.isLineStart() && !_closesLambda(next);
        }
        if (next.is(EOF) || next.isLineStart() || _closesLambda(next)) {
            return false;
        }
        // class_name Foo extends Bar
        if (lastKind == NodeKind.CLASS_NAME_STATEMENT && next.is(EXTENDS)) {
            return true;
        }
        throw new ParseException("Expected end of statement", next);
    }

    private boolean _closesLambda(Token token) {
        return lambdaDepth > 0 && token.isOneOf(COMMA, RPAREN, RBRACKET, RBRACE);
    }

    private NodeKind _parseStatement(SyntaxNode.Builder block) {
        lineOpener = current;
        Token token = peek();
        if (token.is(AT)) {
            return _parseAnnotated(block);
        }
        SyntaxNode statement = switch (token.getType()) {
            case VAR -> _parseVariable(null);
            case STATIC -> _parseStatic(null);
            case CONST -> _parseConst(null);
            case SIGNAL -> _parseSignal(null);
            case ENUM -> _parseEnum(null);
            case CLASS -> _parseClass(null);
            case CLASS_NAME -> _parseClassName();
            case EXTENDS -> _parseExtends();
            case FUNC -> peekNext().is(IDENTIFIER) ? _parseFunction(null) : _parseExpressionStatement();
            case IF -> _parseIf();
            case FOR -> _parseFor();
            case WHILE -> _parseWhile();
            case MATCH -> _parseMatch();
            case PASS -> _simple(NodeKind.PASS_STATEMENT);
            case BREAK -> _simple(NodeKind.BREAK_STATEMENT);
            case CONTINUE -> _simple(NodeKind.CONTINUE_STATEMENT);
            case BREAKPOINT -> _simple(NodeKind.BREAKPOINT_STATEMENT);
            case RETURN -> _parseReturn();
            default -> _parseExpressionStatement();
        };
        block.add(statement);
        return statement.getKind();
    }

    private SyntaxNode _simple(NodeKind kind) {
        return node(kind).token(advance()).build();
    }

    /**
     * Annotations on their own line become separate statements; annotations
     * sharing a line with a declaration belong to that declaration.
     */
    private NodeKind _parseAnnotated(SyntaxNode.Builder block) {
        List<SyntaxNode> annotations = new ArrayList<>();
        annotations.add(parseAnnotation());
        while (check(AT)) {
            annotations.add(parseAnnotation());
        }

        Token next = peek();
        boolean declarationFollows = !next.isLineStart()
                && next.isOneOf(VAR, STATIC, CONST, SIGNAL, ENUM, CLASS, FUNC);
        if (!declarationFollows) {
            annotations.forEach(block::add);
            if (next.is(EOF) || next.isLineStart() || next.is(SEMICOLON) || _closesLambda(next)) {
                return NodeKind.ANNOTATION;
            }
            // @warning_ignore(...) in front of a plain statement
            return _parseStatement(block);
        }

        SyntaxNode.Builder group = node(NodeKind.ANNOTATIONS);
        annotations.forEach(group::add);
        SyntaxNode prefix = group.build();
        SyntaxNode declaration = switch (next.getType()) {
            case VAR -> _parseVariable(prefix);
            case STATIC -> _parseStatic(prefix);
            case CONST -> _parseConst(prefix);
            case SIGNAL -> _parseSignal(prefix);
            case ENUM -> _parseEnum(prefix);
            case CLASS -> _parseClass(prefix);
            default -> _parseFunction(prefix);
        };
        block.add(declaration);
        return declaration.getKind();
    }

    SyntaxNode parseAnnotation() {
        SyntaxNode.Builder annotation = node(NodeKind.ANNOTATION);
        annotation.token(expect(AT, "'@'"));
        annotation.add("name", identifier("annotation name"));
        if (check(LPAREN)) {
            annotation.add("arguments", expressions.parseArguments());
        }
        return annotation.build();
    }

    private SyntaxNode _parseStatic(SyntaxNode annotations) {
        if (peekNext().is(VAR)) {
            return _parseVariable(annotations);
        }
        if (peekNext().is(FUNC)) {
            return _parseFunction(annotations);
        }
        throw new ParseException("Unexpected token after 'static'", peekNext(), "'var' or 'func'");
    }

    private SyntaxNode _staticKeyword() {
        return node(NodeKind.STATIC_KEYWORD).token(advance()).build();
    }

    private SyntaxNode _parseVariable(SyntaxNode annotations) {
        SyntaxNode.Builder statement = node(NodeKind.VARIABLE_STATEMENT);
        statement.add("annotations", annotations);
        if (check(STATIC)) {
            statement.add("static", _staticKeyword());
        }
        statement.token(expect(VAR, "'var'"));
        statement.add("name", identifier("variable name"));

        if (check(COLON_EQ)) {
            statement.add("inferred_type", node(NodeKind.INFERRED_TYPE).token(advance()).build());
            statement.add("value", expressions.parseExpression());
        } else {
            if (check(COLON) && !_colonStartsSetget()) {
                statement.token(advance());
                statement.add("type", parseType());
            }
            if (check(EQ)) {
                statement.token(advance());
                statement.add("value", expressions.parseExpression());
            }
        }

        if (check(COLON)) {
            statement.add("setget", _parseSetget());
        }
        return statement.build();
    }

    // "var x:" followed by a line break or by set/get introduces property accessors.
    private boolean _colonStartsSetget() {
        Token after = peekNext();
        if (after.isLineStart() || after.is(EOF)) {
            return true;
        }
        if (after.is(IDENTIFIER) && (after.getLexeme().equals("set") || after.getLexeme().equals("get"))) {
            Token third = current + 2 < tokens.size() ? tokens.get(current + 2) : after;
            return third.isOneOf(EQ, LPAREN, COLON, COMMA);
        }
        return false;
    }

    private SyntaxNode _parseSetget() {
        SyntaxNode.Builder setget = node(NodeKind.SETGET);
        setget.token(expect(COLON, "':'"));

        if (!peek().isLineStart()) {
            _parseAccessorLine(setget);
            return setget.build();
        }

        int indent = peek().getIndent();
        if (indent <= indentStack.peek()) {
            throw new ParseException("Expected an indented block", peek());
        }
        int savedDepth = bracketDepth;
        bracketDepth = 0;
        indentStack.push(indent);
        try {
            while (!isAtEnd() && peek().isLineStart()) {
                int lineIndent = peek().getIndent();
                if (lineIndent < indent) {
                    break;
                }
                if (lineIndent > indent) {
                    throw new ParseException("Unexpected indentation", peek());
                }
                _parseAccessorLine(setget);
            }
        } finally {
            indentStack.pop();
            bracketDepth = savedDepth;
        }
        return setget.build();
    }

    private void _parseAccessorLine(SyntaxNode.Builder setget) {
        while (true) {
            setget.add(_parseAccessor());
            if (peek().is(COMMA) && !peek().isLineStart()) {
                setget.token(advance());
                if (peek().isLineStart() || isAtEnd()) {
                    return;
                }
                continue;
            }
            return;
        }
    }

    private SyntaxNode _parseAccessor() {
        Token name = peek();
        if (!name.is(IDENTIFIER) || !(name.getLexeme().equals("set") || name.getLexeme().equals("get"))) {
            throw new ParseException("Unexpected token in property accessors", name, "'set' or 'get'");
        }
        NodeKind kind = name.getLexeme().equals("set") ? NodeKind.SET_BODY : NodeKind.GET_BODY;
        SyntaxNode.Builder accessor = node(kind);
        accessor.token(advance());

        if (peek().is(EQ)) {
            accessor.token(advance());
            accessor.add("function", identifier("accessor function name"));
            return accessor.build();
        }
        if (peek().is(LPAREN)) {
            accessor.token(advance());
            bracketDepth++;
            if (check(IDENTIFIER)) {
                accessor.add("parameter", identifier("parameter name"));
            }
            accessor.token(expect(RPAREN, "')'"));
            bracketDepth--;
        }
        accessor.token(expect(COLON, "':'"));
        accessor.add("body", parseBody());
        return accessor.build();
    }

    private SyntaxNode _parseConst(SyntaxNode annotations) {
        SyntaxNode.Builder statement = node(NodeKind.CONST_STATEMENT);
        statement.add("annotations", annotations);
        statement.token(expect(CONST, "'const'"));
        statement.add("name", identifier("constant name"));
        if (check(COLON_EQ)) {
            statement.add("inferred_type", node(NodeKind.INFERRED_TYPE).token(advance()).build());
        } else {
            if (check(COLON)) {
                statement.token(advance());
                statement.add("type", parseType());
            }
            statement.token(expect(EQ, "'='"));
        }
        statement.add("value", expressions.parseExpression());
        return statement.build();
    }

    private SyntaxNode _parseSignal(SyntaxNode annotations) {
        SyntaxNode.Builder statement = node(NodeKind.SIGNAL_STATEMENT);
        statement.add("annotations", annotations);
        statement.token(expect(SIGNAL, "'signal'"));
        statement.add("name", identifier("signal name"));
        if (check(LPAREN)) {
            statement.add("parameters", parseParameters());
        }
        return statement.build();
    }

    private SyntaxNode _parseEnum(SyntaxNode annotations) {
        SyntaxNode.Builder statement = node(NodeKind.ENUM_DEFINITION);
        statement.add("annotations", annotations);
        statement.token(expect(ENUM, "'enum'"));
        if (check(IDENTIFIER)) {
            statement.add("name", identifier("enum name"));
        }

        SyntaxNode.Builder list = node(NodeKind.ENUMERATOR_LIST);
        list.token(expect(LBRACE, "'{'"));
        bracketDepth++;
        while (!check(RBRACE)) {
            SyntaxNode.Builder enumerator = node(NodeKind.ENUMERATOR);
            enumerator.add("name", identifier("enumerator name"));
            if (check(EQ)) {
                enumerator.token(advance());
                enumerator.add("value", expressions.parseExpression());
            }
            list.add(enumerator.build());
            if (!check(COMMA)) {
                break;
            }
            list.token(advance());
        }
        list.token(expect(RBRACE, "'}'"));
        bracketDepth--;
        statement.add("body", list.build());
        return statement.build();
    }

    private SyntaxNode _parseClass(SyntaxNode annotations) {
        SyntaxNode.Builder statement = node(NodeKind.CLASS_DEFINITION);
        statement.add("annotations", annotations);
        statement.token(expect(CLASS, "'class'"));
        statement.add("name", identifier("class name"));
        if (check(EXTENDS)) {
            statement.token(advance());
            statement.add("extends", _parseExtendsTarget());
        }
        statement.token(expect(COLON, "':'"));
        statement.add("body", parseBody());
        return statement.build();
    }

    private SyntaxNode _parseClassName() {
        SyntaxNode.Builder statement = node(NodeKind.CLASS_NAME_STATEMENT);
        statement.token(advance());
        statement.add("name", identifier("class name"));
        return statement.build();
    }

    private SyntaxNode _parseExtends() {
        SyntaxNode.Builder statement = node(NodeKind.EXTENDS_STATEMENT);
        statement.token(advance());
        statement.add("type", _parseExtendsTarget());
        return statement.build();
    }

    // Either a (dotted) class name or a script path, optionally followed by an inner class.
    private SyntaxNode _parseExtendsTarget() {
        if (!check(STRING)) {
            return parseType();
        }
        SyntaxNode path = leaf(NodeKind.STRING, advance());
        if (!check(DOT)) {
            return path;
        }
        SyntaxNode.Builder type = node(NodeKind.TYPE).add(path);
        while (check(DOT)) {
            type.token(advance());
            type.add(identifier("inner class name"));
        }
        return type.build();
    }

    private SyntaxNode _parseFunction(SyntaxNode annotations) {
        SyntaxNode.Builder statement = node(NodeKind.FUNCTION_DEFINITION);
        statement.add("annotations", annotations);
        if (check(STATIC)) {
            statement.add("static", _staticKeyword());
        }
        statement.token(expect(FUNC, "'func'"));
        statement.add("name", identifier("function name"));
        statement.add("parameters", parseParameters());
        if (check(ARROW)) {
            statement.token(advance());
            statement.add("return_type", parseType());
        }
        statement.token(expect(COLON, "':'"));
        statement.add("body", parseBody());
        return statement.build();
    }

    /**
     * Parses {@code (a, b: int, c = 1, d: int = 2, e := 3)}.
     */
    SyntaxNode parseParameters() {
        SyntaxNode.Builder parameters = node(NodeKind.PARAMETERS);
        parameters.token(expect(LPAREN, "'('"));
        bracketDepth++;
        while (!check(RPAREN)) {
            parameters.add(_parseParameter());
            if (!check(COMMA)) {
                break;
            }
            parameters.token(advance());
        }
        parameters.token(expect(RPAREN, "')'"));
        bracketDepth--;
        return parameters.build();
    }

    private SyntaxNode _parseParameter() {
        SyntaxNode name = identifier("parameter name");
        if (check(COLON_EQ)) {
            return node(NodeKind.DEFAULT_PARAMETER)
                    .add("name", name)
                    .add("inferred_type", node(NodeKind.INFERRED_TYPE).token(advance()).build())
                    .add("value", expressions.parseExpression())
                    .build();
        }

        Token colon = null;
        SyntaxNode type = null;
        if (check(COLON)) {
            colon = advance();
            type = parseType();
        }
        if (!check(EQ)) {
            if (type == null) {
                return name;
            }
            return node(NodeKind.TYPED_PARAMETER).add("name", name).token(colon).add("type", type).build();
        }

        SyntaxNode.Builder parameter = node(type == null
                ? NodeKind.DEFAULT_PARAMETER : NodeKind.TYPED_DEFAULT_PARAMETER);
        parameter.add("name", name);
        if (type != null) {
            parameter.token(colon).add("type", type);
        }
        parameter.token(advance());
        parameter.add("value", expressions.parseExpression());
        return parameter.build();
    }

    /**
     * Parses a type hint: {@code int}, {@code Node.Mode}, {@code Array[int]},
     * {@code Dictionary[String, Node]}.
     */
    SyntaxNode parseType() {
        SyntaxNode.Builder type = node(NodeKind.TYPE);
        type.add(identifier("type name"));
        while (check(DOT)) {
            type.token(advance());
            type.add(identifier("type name"));
        }
        if (check(LBRACKET)) {
            type.token(advance());
            bracketDepth++;
            type.add(parseType());
            while (check(COMMA)) {
                type.token(advance());
                type.add(parseType());
            }
            type.token(expect(RBRACKET, "']'"));
            bracketDepth--;
        }
        return type.build();
    }

    /**
     * Parses the statements after a block-opening colon, either on the same
     * line or as an indented block.
     */
    SyntaxNode parseBody() {
        SyntaxNode.Builder body = node(NodeKind.BODY);
        Token next = peek();
        if (next.is(EOF)) {
            throw new ParseException("Expected a statement block", next);
        }
        if (!next.isLineStart()) {
            parseStatementLine(body);
            return body.build();
        }

        int indent = next.getIndent();
        if (indent <= indentStack.peek()) {
            throw new ParseException("Expected an indented block", next);
        }
        int savedDepth = bracketDepth;
        bracketDepth = 0;
        indentStack.push(indent);
        try {
            while (!isAtEnd() && peek().isLineStart()) {
                int lineIndent = peek().getIndent();
                if (lineIndent < indent) {
                    break;
                }
                if (lineIndent > indent) {
                    throw new ParseException("Unexpected indentation", peek());
                }
                parseStatementLine(body);
            }
        } finally {
            indentStack.pop();
            bracketDepth = savedDepth;
        }
        return body.build();
    }

    // A continuation keyword (elif/else) must sit at the indentation of its statement.
    private boolean _atClause(TokenType type, int statementIndent) {
        Token next = peek();
        if (!next.is(type)) {
            return false;
        }
        return !next.isLineStart() || next.getIndent() == statementIndent;
    }

    private SyntaxNode _parseIf() {
        int indent = indentStack.peek();
        SyntaxNode.Builder statement = node(NodeKind.IF_STATEMENT);
        statement.token(advance());
        statement.add("condition", expressions.parseExpression());
        statement.token(expect(COLON, "':'"));
        statement.add("body", parseBody());

        while (_atClause(ELIF, indent)) {
            SyntaxNode.Builder clause = node(NodeKind.ELIF_CLAUSE);
            clause.token(advance());
            clause.add("condition", expressions.parseExpression());
            clause.token(expect(COLON, "':'"));
            clause.add("body", parseBody());
            statement.add(clause.build());
        }
        if (_atClause(ELSE, indent)) {
            SyntaxNode.Builder clause = node(NodeKind.ELSE_CLAUSE);
            clause.token(advance());
            clause.token(expect(COLON, "':'"));
            clause.add("body", parseBody());
            statement.add("alternative", clause.build());
        }
        return statement.build();
    }

    private SyntaxNode _parseFor() {
        SyntaxNode.Builder statement = node(NodeKind.FOR_STATEMENT);
        statement.token(advance());
        statement.add("left", identifier("loop variable"));
        if (check(COLON)) {
            statement.token(advance());
            statement.add("type", parseType());
        }
        statement.token(expect(IN, "'in'"));
        statement.add("right", expressions.parseExpression());
        statement.token(expect(COLON, "':'"));
        statement.add("body", parseBody());
        return statement.build();
    }

    private SyntaxNode _parseWhile() {
        SyntaxNode.Builder statement = node(NodeKind.WHILE_STATEMENT);
        statement.token(advance());
        statement.add("condition", expressions.parseExpression());
        statement.token(expect(COLON, "':'"));
        statement.add("body", parseBody());
        return statement.build();
    }

    private SyntaxNode _parseMatch() {
        SyntaxNode.Builder statement = node(NodeKind.MATCH_STATEMENT);
        statement.token(advance());
        statement.add("value", expressions.parseExpression());
        statement.token(expect(COLON, "':'"));

        Token next = peek();
        if (!next.isLineStart() || next.getIndent() <= indentStack.peek()) {
            throw new ParseException("Expected an indented block of match patterns", next);
        }
        int indent = next.getIndent();
        SyntaxNode.Builder body = node(NodeKind.MATCH_BODY);
        int savedDepth = bracketDepth;
        bracketDepth = 0;
        indentStack.push(indent);
        try {
            while (!isAtEnd() && peek().isLineStart()) {
                int lineIndent = peek().getIndent();
                if (lineIndent < indent) {
                    break;
                }
                if (lineIndent > indent) {
                    throw new ParseException("Unexpected indentation", peek());
                }
                body.add(_parsePatternSection());
            }
        } finally {
            indentStack.pop();
            bracketDepth = savedDepth;
        }
        statement.add("body", body.build());
        return statement.build();
    }

    private SyntaxNode _parsePatternSection() {
        SyntaxNode.Builder section = node(NodeKind.PATTERN_SECTION);
        lineOpener = current;
        section.add(expressions.parsePattern());
        while (check(COMMA)) {
            section.token(advance());
            section.add(expressions.parsePattern());
        }
        if (checkIdentifier("when")) {
            SyntaxNode.Builder guard = node(NodeKind.PATTERN_GUARD);
            guard.token(advance());
            guard.add(expressions.parseExpression());
            section.add("guard", guard.build());
        }
        section.token(expect(COLON, "':'"));
        section.add("body", parseBody());
        return section.build();
    }

    private SyntaxNode _parseReturn() {
        SyntaxNode.Builder statement = node(NodeKind.RETURN_STATEMENT);
        statement.token(advance());
        if (!_atStatementEnd()) {
            statement.add("value", expressions.parseExpression());
        }
        return statement.build();
    }

    private boolean _atStatementEnd() {
        Token next = peek();
        return next.is(EOF) || next.is(SEMICOLON) || atLineBreak() || _closesLambda(next)
                || (next.isLineStart() && lambdaDepth > 0);
    }

    private SyntaxNode _parseExpressionStatement() {
        SyntaxNode expression = expressions.parseExpression();
        if (!atLineBreak() && peek().getType().isAssignment()) {
            NodeKind kind = peek().is(EQ) ? NodeKind.ASSIGNMENT : NodeKind.AUGMENTED_ASSIGNMENT;
            SyntaxNode.Builder assignment = node(kind);
            assignment.add("left", expression);
            assignment.token("operator", advance());
            assignment.add("right", expressions.parseExpression());
            expression = assignment.build();
        }
        return node(NodeKind.EXPRESSION_STATEMENT).add(expression).build();
    }
}
