package com.gdformatter.plugins.gdscript.parser;

/**
 * Closed set of syntax node kinds produced by {@link GDScriptParser}.
 * <p>
 * Grammar names follow the tree-sitter-gdscript vocabulary so diagnostics
 * read the same as in other GDScript tooling. {@link #TOKEN} marks anonymous
 * children (keywords, operators, punctuation) kept for positional inspection.
 */
public enum NodeKind {
    SOURCE("source"),

    // Declarations
    EXTENDS_STATEMENT("extends_statement"),
    CLASS_NAME_STATEMENT("class_name_statement"),
    CLASS_DEFINITION("class_definition"),
    FUNCTION_DEFINITION("function_definition"),
    VARIABLE_STATEMENT("variable_statement"),
    CONST_STATEMENT("const_statement"),
    SIGNAL_STATEMENT("signal_statement"),
    ENUM_DEFINITION("enum_definition"),
    ENUMERATOR_LIST("enumerator_list"),
    ENUMERATOR("enumerator"),
    ANNOTATIONS("annotations"),
    ANNOTATION("annotation"),
    STATIC_KEYWORD("static_keyword"),
    INFERRED_TYPE("inferred_type"),
    SETGET("setget"),
    SET_BODY("set_body"),
    GET_BODY("get_body"),
    PARAMETERS("parameters"),
    TYPED_PARAMETER("typed_parameter"),
    DEFAULT_PARAMETER("default_parameter"),
    TYPED_DEFAULT_PARAMETER("typed_default_parameter"),
    TYPE("type"),
    BODY("body"),

    // Statements
    IF_STATEMENT("if_statement"),
    ELIF_CLAUSE("elif_clause"),
    ELSE_CLAUSE("else_clause"),
    FOR_STATEMENT("for_statement"),
    WHILE_STATEMENT("while_statement"),
    MATCH_STATEMENT("match_statement"),
    MATCH_BODY("match_body"),
    PATTERN_SECTION("pattern_section"),
    PATTERN_GUARD("pattern_guard"),
    PATTERN_BINDING("pattern_binding"),
    PATTERN_OPEN_ENDING("pattern_open_ending"),
    RETURN_STATEMENT("return_statement"),
    PASS_STATEMENT("pass_statement"),
    BREAK_STATEMENT("break_statement"),
    CONTINUE_STATEMENT("continue_statement"),
    BREAKPOINT_STATEMENT("breakpoint_statement"),
    EXPRESSION_STATEMENT("expression_statement"),

    // Expressions
    ASSIGNMENT("assignment"),
    AUGMENTED_ASSIGNMENT("augmented_assignment"),
    BINARY_OPERATOR("binary_operator"),
    COMPARISON_OPERATOR("comparison_operator"),
    BOOLEAN_OPERATOR("boolean_operator"),
    UNARY_OPERATOR("unary_operator"),
    CONDITIONAL_EXPRESSION("conditional_expression"),
    CAST("cast"),
    AWAIT_EXPRESSION("await_expression"),
    CALL("call"),
    ARGUMENTS("arguments"),
    ATTRIBUTE("attribute"),
    SUBSCRIPT("subscript"),
    ARRAY("array"),
    DICTIONARY("dictionary"),
    PAIR("pair"),
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    LAMBDA("lambda"),

    // Leaves
    IDENTIFIER("identifier"),
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string"),
    STRING_NAME("string_name"),
    NODE_PATH("node_path"),
    GET_NODE("get_node"),
    TRUE("true"),
    FALSE("false"),
    NULL("null"),
    SELF("self"),
    SUPER("super"),

    TOKEN("token");

    private final String grammarName;

    NodeKind(String grammarName) {
        this.grammarName = grammarName;
    }

    /**
     * Leaf kinds whose source text is their value.
     */
    public boolean isValueKind() {
        return switch (this) {
            case IDENTIFIER, INTEGER, FLOAT, STRING, STRING_NAME, NODE_PATH, GET_NODE,
                 TRUE, FALSE, NULL, SELF, SUPER -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return grammarName;
    }
}
