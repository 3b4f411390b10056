package com.gdformatter.plugins.gdscript.parser;

/**
 * A lexical token with its position in the source text.
 * <p>
 * Lines are 1-indexed, columns are 0-indexed and offsets are character
 * offsets into the source string. Tokens that begin a logical line carry the
 * visual width of that line's indentation.
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final int line;
    private final int column;
    private final int offset;
    private final int endLine;
    private final int endColumn;
    private final boolean lineStart;
    private final int indent;

    public Token(TokenType type, String lexeme, int line, int column, int offset,
                 int endLine, int endColumn, boolean lineStart, int indent) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.lineStart = lineStart;
        this.indent = indent;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getEndOffset() {
        return offset + lexeme.length();
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    /**
     * True when this is the first token of a logical line.
     */
    public boolean isLineStart() {
        return lineStart;
    }

    /**
     * Indentation width of the line this token starts; only meaningful when {@link #isLineStart()}.
     */
    public int getIndent() {
        return indent;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("%s(%s) at %d:%d", type, lexeme, line, column);
    }
}
