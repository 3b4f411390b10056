package com.gdformatter.plugins.gdscript.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.gdformatter.plugins.gdscript.parser.TokenType.*;

/**
 * Hand-written tokenizer for GDScript 4.
 * <p>
 * Comments, blank lines and line continuations produce no tokens. Instead of
 * NEWLINE/INDENT tokens every token records whether it starts a logical line
 * and, if so, the indentation width of that line, so the parser can drive
 * blocks from indentation while ignoring line breaks inside brackets.
 */
public class Lexer {
    static final int TAB_WIDTH = 4;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("and", AND);
        KEYWORDS.put("as", AS);
        KEYWORDS.put("await", AWAIT);
        KEYWORDS.put("break", BREAK);
        KEYWORDS.put("breakpoint", BREAKPOINT);
        KEYWORDS.put("class", CLASS);
        KEYWORDS.put("class_name", CLASS_NAME);
        KEYWORDS.put("const", CONST);
        KEYWORDS.put("continue", CONTINUE);
        KEYWORDS.put("elif", ELIF);
        KEYWORDS.put("else", ELSE);
        KEYWORDS.put("enum", ENUM);
        KEYWORDS.put("extends", EXTENDS);
        KEYWORDS.put("false", FALSE);
        KEYWORDS.put("for", FOR);
        KEYWORDS.put("func", FUNC);
        KEYWORDS.put("if", IF);
        KEYWORDS.put("in", IN);
        KEYWORDS.put("is", IS);
        KEYWORDS.put("match", MATCH);
        KEYWORDS.put("not", NOT);
        KEYWORDS.put("null", NULL);
        KEYWORDS.put("or", OR);
        KEYWORDS.put("pass", PASS);
        KEYWORDS.put("return", RETURN);
        KEYWORDS.put("self", SELF);
        KEYWORDS.put("signal", SIGNAL);
        KEYWORDS.put("static", STATIC);
        KEYWORDS.put("super", SUPER);
        KEYWORDS.put("true", TRUE);
        KEYWORDS.put("var", VAR);
        KEYWORDS.put("while", WHILE);
    }

    // After one of these a '%' is the modulo operator, not a unique node reference.
    private static final Set<TokenType> OPERAND_END = EnumSet.of(
            IDENTIFIER, INTEGER, FLOAT, STRING, STRING_NAME, NODE_PATH, GET_NODE,
            RPAREN, RBRACKET, RBRACE, SELF, SUPER, TRUE, FALSE, NULL);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int column = 0;

    private int start;
    private int startLine;
    private int startColumn;

    private boolean pendingLineStart = true;
    private int pendingIndent = 0;

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Scans the whole source; the returned list always ends with an EOF token.
     */
    public List<Token> tokenize() {
        boolean lineBegin = true;
        boolean continuation = false;

        while (!isAtEnd()) {
            if (lineBegin) {
                pendingIndent = _measureIndent();
                pendingLineStart = !continuation;
                continuation = false;
                lineBegin = false;
                continue;
            }

            char c = peek();
            if (c == '\n') {
                advance();
                lineBegin = true;
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                advance();
                continue;
            }
            if (c == '#') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
                continue;
            }
            if (c == '\\' && _isLineBreakAfterBackslash()) {
                advance();
                if (peek() == '\r') {
                    advance();
                }
                advance();
                continuation = true;
                lineBegin = true;
                continue;
            }

            start = pos;
            startLine = line;
            startColumn = column;
            _scanToken();
        }

        tokens.add(new Token(EOF, "", line, column, pos, line, column, true, 0));
        return tokens;
    }

    private int _measureIndent() {
        int width = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
            advance();
        }
        return width;
    }

    private boolean _isLineBreakAfterBackslash() {
        char next = peekNext();
        return next == '\n' || (next == '\r' && pos + 2 < source.length() && source.charAt(pos + 2) == '\n');
    }

    private void _scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(LPAREN);
            case ')' -> addToken(RPAREN);
            case '[' -> addToken(LBRACKET);
            case ']' -> addToken(RBRACKET);
            case '{' -> addToken(LBRACE);
            case '}' -> addToken(RBRACE);
            case ',' -> addToken(COMMA);
            case ';' -> addToken(SEMICOLON);
            case '@' -> addToken(AT);
            case '~' -> addToken(TILDE);
            case ':' -> addToken(match('=') ? COLON_EQ : COLON);
            case '+' -> addToken(match('=') ? PLUS_EQ : PLUS);
            case '-' -> {
                if (match('>')) {
                    addToken(ARROW);
                } else {
                    addToken(match('=') ? MINUS_EQ : MINUS);
                }
            }
            case '*' -> {
                if (match('*')) {
                    addToken(match('=') ? STAR_STAR_EQ : STAR_STAR);
                } else {
                    addToken(match('=') ? STAR_EQ : STAR);
                }
            }
            case '/' -> addToken(match('=') ? SLASH_EQ : SLASH);
            case '^' -> {
                if (peek() == '"' || peek() == '\'') {
                    _scanString(advance());
                    addToken(NODE_PATH);
                } else {
                    addToken(match('=') ? CARET_EQ : CARET);
                }
            }
            case '&' -> {
                if (peek() == '"' || peek() == '\'') {
                    _scanString(advance());
                    addToken(STRING_NAME);
                } else if (match('&')) {
                    addToken(AMP_AMP);
                } else {
                    addToken(match('=') ? AMP_EQ : AMP);
                }
            }
            case '|' -> {
                if (match('|')) {
                    addToken(PIPE_PIPE);
                } else {
                    addToken(match('=') ? PIPE_EQ : PIPE);
                }
            }
            case '=' -> addToken(match('=') ? EQ_EQ : EQ);
            case '!' -> addToken(match('=') ? BANG_EQ : BANG);
            case '<' -> {
                if (match('<')) {
                    addToken(match('=') ? LSHIFT_EQ : LSHIFT);
                } else {
                    addToken(match('=') ? LE : LT);
                }
            }
            case '>' -> {
                if (match('>')) {
                    addToken(match('=') ? RSHIFT_EQ : RSHIFT);
                } else {
                    addToken(match('=') ? GE : GT);
                }
            }
            case '%' -> {
                if (_operandExpected() && (isIdentifierStart(peek()) || peek() == '"' || peek() == '\'')) {
                    _scanNodeReference();
                } else {
                    addToken(match('=') ? PERCENT_EQ : PERCENT);
                }
            }
            case '$' -> _scanNodeReference();
            case '.' -> {
                if (isDigit(peek()) && _operandExpected()) {
                    _scanNumber();
                } else {
                    addToken(match('.') ? DOT_DOT : DOT);
                }
            }
            case '"', '\'' -> {
                _scanString(c);
                addToken(STRING);
            }
            default -> {
                if (c == 'r' && (peek() == '"' || peek() == '\'')) {
                    _scanRawString(advance());
                    addToken(STRING);
                } else if (isDigit(c)) {
                    _scanNumber();
                } else if (isIdentifierStart(c)) {
                    _scanIdentifier();
                } else {
                    throw new ParseException("Unexpected character '" + c + "'", startLine, startColumn);
                }
            }
        }
    }

    private boolean _operandExpected() {
        if (pendingLineStart || tokens.isEmpty()) {
            return true;
        }
        return !OPERAND_END.contains(tokens.get(tokens.size() - 1).getType());
    }

    private void _scanIdentifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(start, pos);
        TokenType type = KEYWORDS.getOrDefault(text, IDENTIFIER);
        // Keywords are plain names after a member access, e.g. regex.match().
        if (type != IDENTIFIER && !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(DOT)) {
            type = IDENTIFIER;
        }
        addToken(type);
    }

    private void _scanNumber() {
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isHexDigit(peek()) || peek() == '_') {
                advance();
            }
            addToken(INTEGER);
            return;
        }
        if (source.charAt(start) == '0' && (peek() == 'b' || peek() == 'B')) {
            advance();
            while (peek() == '0' || peek() == '1' || peek() == '_') {
                advance();
            }
            addToken(INTEGER);
            return;
        }

        boolean isFloat = source.charAt(start) == '.';
        _consumeDigits();

        if (!isFloat && peek() == '.' && peekNext() != '.' && !isIdentifierStart(peekNext())) {
            isFloat = true;
            advance();
            _consumeDigits();
        }
        if (peek() == 'e' || peek() == 'E') {
            char after = peekNext();
            int lookahead = (after == '+' || after == '-') ? 2 : 1;
            if (pos + lookahead < source.length() && isDigit(source.charAt(pos + lookahead))) {
                isFloat = true;
                for (int i = 0; i < lookahead; i++) {
                    advance();
                }
                _consumeDigits();
            }
        }
        addToken(isFloat ? FLOAT : INTEGER);
    }

    private void _consumeDigits() {
        while (isDigit(peek()) || peek() == '_') {
            advance();
        }
    }

    private void _scanNodeReference() {
        if (peek() == '"' || peek() == '\'') {
            _scanString(advance());
            addToken(GET_NODE);
            return;
        }
        while (isIdentifierPart(peek()) || peek() == '/' || peek() == '%') {
            advance();
        }
        if (pos - start == 1) {
            throw new ParseException("Expected node path after '" + source.charAt(start) + "'",
                    startLine, startColumn);
        }
        addToken(GET_NODE);
    }

    private void _scanString(char quote) {
        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            _scanLongString(quote, true);
            return;
        }
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                throw new ParseException("Unterminated string", startLine, startColumn);
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) {
                    break;
                }
            }
            advance();
        }
        if (isAtEnd()) {
            throw new ParseException("Unterminated string", startLine, startColumn);
        }
        advance();
    }

    private void _scanRawString(char quote) {
        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            _scanLongString(quote, false);
            return;
        }
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                throw new ParseException("Unterminated string", startLine, startColumn);
            }
            // A raw string still cannot contain its own unescaped quote.
            if (peek() == '\\' && peekNext() == quote) {
                advance();
            }
            advance();
        }
        if (isAtEnd()) {
            throw new ParseException("Unterminated string", startLine, startColumn);
        }
        advance();
    }

    private void _scanLongString(char quote, boolean escapes) {
        while (!isAtEnd()) {
            if (peek() == quote && peekNext() == quote
                    && pos + 2 < source.length() && source.charAt(pos + 2) == quote) {
                advance();
                advance();
                advance();
                return;
            }
            if (escapes && peek() == '\\') {
                advance();
                if (isAtEnd()) {
                    break;
                }
            }
            advance();
        }
        throw new ParseException("Unterminated multi-line string", startLine, startColumn);
    }

    private void addToken(TokenType type) {
        String lexeme = source.substring(start, pos);
        tokens.add(new Token(type, lexeme, startLine, startColumn, start, line, column,
                pendingLineStart, pendingLineStart ? pendingIndent : 0));
        pendingLineStart = false;
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
