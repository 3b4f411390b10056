package com.gdformatter.plugins.gdscript.parser;

/**
 * Raised when GDScript source cannot be tokenized or parsed.
 */
public class ParseException extends RuntimeException {
    private final int line;
    private final int column;
    private final String found;
    private final String expected;

    public ParseException(String message, int line, int column) {
        this(message, line, column, null, null);
    }

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        this(message, token.getLine(), token.getColumn(),
                token.is(TokenType.EOF) ? "end of file" : token.getLexeme(), expected);
    }

    private ParseException(String message, int line, int column, String found, String expected) {
        super(message);
        this.line = line;
        this.column = column;
        this.found = found;
        this.expected = expected;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getExpected() {
        return expected;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        sb.append(" at line ").append(line);
        sb.append(", column ").append(column + 1);
        if (found != null) {
            sb.append(" (found '").append(found).append("')");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
