package com.gdformatter.plugins.gdscript.parser;

/**
 * Token categories produced by the GDScript {@link Lexer}.
 */
public enum TokenType {
    // Literals and names
    IDENTIFIER,
    INTEGER,
    FLOAT,
    STRING,
    STRING_NAME,
    NODE_PATH,
    GET_NODE,

    // Keywords
    AND,
    AS,
    AWAIT,
    BREAK,
    BREAKPOINT,
    CLASS,
    CLASS_NAME,
    CONST,
    CONTINUE,
    ELIF,
    ELSE,
    ENUM,
    EXTENDS,
    FALSE,
    FOR,
    FUNC,
    IF,
    IN,
    IS,
    MATCH,
    NOT,
    NULL,
    OR,
    PASS,
    RETURN,
    SELF,
    SIGNAL,
    STATIC,
    SUPER,
    TRUE,
    VAR,
    WHILE,

    // Brackets and separators
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    COLON,
    SEMICOLON,
    DOT,
    DOT_DOT,
    ARROW,
    AT,

    // Operators
    PLUS,
    MINUS,
    STAR,
    STAR_STAR,
    SLASH,
    PERCENT,
    AMP,
    PIPE,
    CARET,
    TILDE,
    LSHIFT,
    RSHIFT,
    EQ_EQ,
    BANG_EQ,
    LT,
    LE,
    GT,
    GE,
    AMP_AMP,
    PIPE_PIPE,
    BANG,

    // Assignment
    EQ,
    COLON_EQ,
    PLUS_EQ,
    MINUS_EQ,
    STAR_EQ,
    STAR_STAR_EQ,
    SLASH_EQ,
    PERCENT_EQ,
    AMP_EQ,
    PIPE_EQ,
    CARET_EQ,
    LSHIFT_EQ,
    RSHIFT_EQ,

    EOF;

    /**
     * Whether this token is a compound or plain assignment operator other than {@code :=}.
     */
    public boolean isAssignment() {
        return switch (this) {
            case EQ, PLUS_EQ, MINUS_EQ, STAR_EQ, STAR_STAR_EQ, SLASH_EQ, PERCENT_EQ,
                 AMP_EQ, PIPE_EQ, CARET_EQ, LSHIFT_EQ, RSHIFT_EQ -> true;
            default -> false;
        };
    }

    /**
     * Brackets and separators carry no meaning of their own once the tree is built.
     */
    public boolean isPunctuation() {
        return switch (this) {
            case LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE,
                 COMMA, COLON, SEMICOLON, DOT, AT, EOF -> true;
            default -> false;
        };
    }
}
