package com.gdformatter.plugins.gdscript.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.gdformatter.plugins.gdscript.parser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Lexer")
class LexerTest {

    private List<TokenType> types(String source) {
        return new Lexer(source).tokenize().stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    @DisplayName("keywords, names and assignment operators")
    void testVariableDeclaration() {
        assertEquals(List.of(VAR, IDENTIFIER, COLON_EQ, INTEGER, EOF), types("var x := 1"));
        assertEquals(List.of(IDENTIFIER, STAR_STAR_EQ, IDENTIFIER, EOF), types("a **= b"));
        assertEquals(List.of(IDENTIFIER, LSHIFT_EQ, INTEGER, EOF), types("a <<= 2"));
    }

    @Test
    @DisplayName("the token list always ends with EOF")
    void testEmptySource() {
        assertEquals(List.of(EOF), types(""));
        assertEquals(List.of(EOF), types("\n\n# only a comment\n"));
    }

    @Test
    @DisplayName("comments produce no tokens")
    void testCommentsSkipped() {
        assertEquals(List.of(IDENTIFIER, EOF), types("x # trailing comment\n"));
    }

    @Test
    @DisplayName("numeric literals")
    void testNumbers() {
        assertEquals(List.of(INTEGER, EOF), types("0xFF"));
        assertEquals(List.of(INTEGER, EOF), types("0b1010"));
        assertEquals(List.of(INTEGER, EOF), types("1_000_000"));
        assertEquals(List.of(FLOAT, EOF), types("1.5"));
        assertEquals(List.of(FLOAT, EOF), types("1e10"));
        assertEquals(List.of(FLOAT, EOF), types(".5"));
    }

    @Test
    @DisplayName("string flavours")
    void testStrings() {
        assertEquals(List.of(STRING, EOF), types("\"hello\""));
        assertEquals(List.of(STRING, EOF), types("'single'"));
        assertEquals(List.of(STRING, EOF), types("r\"raw\\d\""));
        assertEquals(List.of(STRING_NAME, EOF), types("&\"signal_name\""));
        assertEquals(List.of(NODE_PATH, EOF), types("^\"Path/To\""));

        List<Token> tokens = new Lexer("\"\"\"multi\nline\"\"\"").tokenize();
        assertEquals(STRING, tokens.get(0).getType());
        assertEquals(2, tokens.get(0).getEndLine());
    }

    @Test
    @DisplayName("'#' inside a string does not start a comment")
    void testHashInString() {
        assertEquals(List.of(IDENTIFIER, LPAREN, STRING, RPAREN, EOF), types("print(\"# not a comment\")"));
    }

    @Test
    @DisplayName("node references with $ and %")
    void testNodeReferences() {
        List<Token> tokens = new Lexer("$Path/To/Node").tokenize();
        assertEquals(GET_NODE, tokens.get(0).getType());
        assertEquals("$Path/To/Node", tokens.get(0).getLexeme());

        assertEquals(List.of(GET_NODE, EOF), types("%UniqueName"));
        assertEquals(List.of(GET_NODE, EOF), types("$\"Quoted Node\""));
    }

    @Test
    @DisplayName("'%' after an operand is the modulo operator")
    void testModulo() {
        assertEquals(List.of(IDENTIFIER, PERCENT, IDENTIFIER, EOF), types("a % b"));
        assertEquals(List.of(IDENTIFIER, PERCENT, IDENTIFIER, EOF), types("a %b"));
    }

    @Test
    @DisplayName("keywords after a dot are member names")
    void testKeywordAsMember() {
        assertEquals(List.of(IDENTIFIER, DOT, IDENTIFIER, LPAREN, RPAREN, EOF), types("regex.match()"));
    }

    @Test
    @DisplayName("line start and indentation are recorded on the first token of each line")
    void testLineStartAndIndent() {
        List<Token> tokens = new Lexer("func f():\n\tpass\n").tokenize();
        Token func = tokens.get(0);
        Token pass = tokens.get(5);

        assertTrue(func.isLineStart());
        assertEquals(0, func.getIndent());
        assertEquals(PASS, pass.getType());
        assertTrue(pass.isLineStart());
        assertEquals(Lexer.TAB_WIDTH, pass.getIndent());
        assertEquals(2, pass.getLine());
        assertEquals(1, pass.getColumn());
        assertFalse(tokens.get(1).isLineStart());
    }

    @Test
    @DisplayName("a backslash continuation does not start a new line")
    void testContinuation() {
        List<Token> tokens = new Lexer("var x = 1 + \\\n\t2\n").tokenize();
        Token two = tokens.get(5);
        assertEquals(INTEGER, two.getType());
        assertEquals(2, two.getLine());
        assertFalse(two.isLineStart());
    }

    @Test
    @DisplayName("unterminated strings are rejected with a position")
    void testUnterminatedString() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("var s = \"abc\n").tokenize());
        assertTrue(e.getMessage().startsWith("Unterminated string"));
        assertEquals(1, e.getLine());
        assertEquals(8, e.getColumn());
    }

    @Test
    @DisplayName("unknown characters are rejected")
    void testUnexpectedCharacter() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("var x = 1 ? 2").tokenize());
        assertTrue(e.getMessage().contains("Unexpected character '?'"));
    }
}
