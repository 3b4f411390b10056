package com.gdformatter.plugins.gdscript.parser;

/**
 * A parsed GDScript file: the root {@code source} node and the text it was parsed from.
 */
public final class SyntaxTree {
    private final String source;
    private final SyntaxNode root;

    SyntaxTree(String source, SyntaxNode root) {
        this.source = source;
        this.root = root;
    }

    /**
     * Parses the given text.
     *
     * @throws ParseException when the text is not valid GDScript
     */
    public static SyntaxTree parse(String source) {
        return new GDScriptParser(source).parse();
    }

    public String getSource() {
        return source;
    }

    public SyntaxNode getRoot() {
        return root;
    }
}
