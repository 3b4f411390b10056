package com.gdformatter.plugins.gdscript.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GDScriptParser")
class GDScriptParserTest {

    private SyntaxNode parse(String source) {
        return SyntaxTree.parse(source).getRoot();
    }

    private SyntaxNode first(String source) {
        return parse(source).getNamedChild(0);
    }

    @Nested
    @DisplayName("declarations")
    class Declarations {

        @Test
        @DisplayName("class_name and extends on one line become two statements")
        void testClassNameExtends() {
            SyntaxNode root = parse("class_name Player extends CharacterBody2D\n");
            List<SyntaxNode> statements = root.getNamedChildren();
            assertEquals(2, statements.size());
            assertEquals(NodeKind.CLASS_NAME_STATEMENT, statements.get(0).getKind());
            assertEquals("Player", statements.get(0).field("name").text());
            assertEquals(NodeKind.EXTENDS_STATEMENT, statements.get(1).getKind());
            assertEquals("CharacterBody2D", statements.get(1).field("type").text());
        }

        @Test
        @DisplayName("extends accepts a script path")
        void testExtendsPath() {
            SyntaxNode statement = first("extends \"res://base.gd\"\n");
            assertEquals(NodeKind.STRING, statement.field("type").getKind());
        }

        @Test
        @DisplayName("typed variable with default value")
        void testTypedVariable() {
            SyntaxNode variable = first("var speed: float = 10.0\n");
            assertEquals(NodeKind.VARIABLE_STATEMENT, variable.getKind());
            assertEquals("speed", variable.field("name").text());
            assertEquals("float", variable.field("type").text());
            assertEquals(NodeKind.FLOAT, variable.field("value").getKind());
            assertFalse(variable.hasField("annotations"));
        }

        @Test
        @DisplayName("inferred type with :=")
        void testInferredVariable() {
            SyntaxNode variable = first("var count := 3\n");
            assertTrue(variable.hasField("inferred_type"));
            assertEquals("3", variable.field("value").text());
        }

        @Test
        @DisplayName("static variables and functions")
        void testStatic() {
            assertTrue(first("static var instances = 0\n").hasField("static"));
            SyntaxNode function = first("static func create():\n\tpass\n");
            assertEquals(NodeKind.FUNCTION_DEFINITION, function.getKind());
            assertTrue(function.hasField("static"));
        }

        @Test
        @DisplayName("property accessors on following lines")
        void testSetget() {
            SyntaxNode variable = first("var health: int = 100:\n\tset(value):\n\t\thealth = value\n\tget:\n\t\treturn health\n");
            assertTrue(variable.hasField("setget"));
            assertNotNull(variable.field("setget").findChild(NodeKind.SET_BODY));
            assertNotNull(variable.field("setget").findChild(NodeKind.GET_BODY));
        }

        @Test
        @DisplayName("function with parameters and return type")
        void testFunction() {
            SyntaxNode function = first("func move(a, b: int, c = 1, d: int = 2, e := 3) -> void:\n\tpass\n");
            assertEquals("move", function.field("name").text());
            List<SyntaxNode> parameters = function.field("parameters").getNamedChildren();
            assertEquals(5, parameters.size());
            assertEquals(NodeKind.IDENTIFIER, parameters.get(0).getKind());
            assertEquals(NodeKind.TYPED_PARAMETER, parameters.get(1).getKind());
            assertEquals(NodeKind.DEFAULT_PARAMETER, parameters.get(2).getKind());
            assertEquals(NodeKind.TYPED_DEFAULT_PARAMETER, parameters.get(3).getKind());
            assertEquals(NodeKind.DEFAULT_PARAMETER, parameters.get(4).getKind());
            assertEquals("void", function.field("return_type").text());
            assertEquals(NodeKind.BODY, function.field("body").getKind());
        }

        @Test
        @DisplayName("signal, const and enum")
        void testSignalConstEnum() {
            SyntaxNode root = parse("signal hit(damage: int)\nconst MAX = 5\nenum State { IDLE, RUN = 2 }\n");
            List<SyntaxNode> statements = root.getNamedChildren();
            assertEquals(NodeKind.SIGNAL_STATEMENT, statements.get(0).getKind());
            assertEquals(NodeKind.CONST_STATEMENT, statements.get(1).getKind());
            SyntaxNode enumDefinition = statements.get(2);
            assertEquals(NodeKind.ENUM_DEFINITION, enumDefinition.getKind());
            assertEquals("State", enumDefinition.field("name").text());
            assertEquals(2, enumDefinition.field("body").getNamedChildCount());
        }

        @Test
        @DisplayName("inner class with its own body")
        void testInnerClass() {
            SyntaxNode inner = first("class Inner extends Node:\n\tvar x = 1\n\n\tfunc foo():\n\t\tpass\n");
            assertEquals(NodeKind.CLASS_DEFINITION, inner.getKind());
            assertEquals("Inner", inner.field("name").text());
            assertEquals(2, inner.field("body").getNamedChildCount());
        }
    }

    @Nested
    @DisplayName("annotations")
    class Annotations {

        @Test
        @DisplayName("same-line annotations belong to the declaration")
        void testInlineAnnotation() {
            SyntaxNode variable = first("@export var speed = 1\n");
            assertEquals(NodeKind.VARIABLE_STATEMENT, variable.getKind());
            SyntaxNode annotations = variable.field("annotations");
            assertEquals(NodeKind.ANNOTATIONS, annotations.getKind());
            assertEquals("export", annotations.getNamedChild(0).field("name").text());
        }

        @Test
        @DisplayName("an annotation on its own line is a separate statement")
        void testStandaloneAnnotation() {
            SyntaxNode root = parse("@export_range(0, 10)\nvar speed = 1\n");
            assertEquals(2, root.getNamedChildCount());
            SyntaxNode annotation = root.getNamedChild(0);
            assertEquals(NodeKind.ANNOTATION, annotation.getKind());
            assertTrue(annotation.hasField("arguments"));
            assertFalse(root.getNamedChild(1).hasField("annotations"));
        }
    }

    @Nested
    @DisplayName("expressions")
    class Expressions {

        private SyntaxNode expression(String source) {
            SyntaxNode statement = first(source);
            assertEquals(NodeKind.EXPRESSION_STATEMENT, statement.getKind());
            return statement.getNamedChild(0);
        }

        @Test
        @DisplayName("multiplication binds tighter than addition")
        void testPrecedence() {
            SyntaxNode sum = expression("1 + 2 * 3\n");
            assertEquals(NodeKind.BINARY_OPERATOR, sum.getKind());
            assertEquals("+", sum.field("operator").text());
            assertEquals(NodeKind.BINARY_OPERATOR, sum.field("right").getKind());
            assertEquals("*", sum.field("right").field("operator").text());
        }

        @Test
        @DisplayName("assignments and augmented assignments")
        void testAssignments() {
            SyntaxNode assignment = expression("x = 1\n");
            assertEquals(NodeKind.ASSIGNMENT, assignment.getKind());
            assertEquals("=", assignment.field("operator").text());

            SyntaxNode augmented = expression("x += 1\n");
            assertEquals(NodeKind.AUGMENTED_ASSIGNMENT, augmented.getKind());
            assertEquals("+=", augmented.field("operator").text());
        }

        @Test
        @DisplayName("calls, attributes and subscripts chain left to right")
        void testPostfix() {
            SyntaxNode call = expression("a.b[0].c(1, 2)\n");
            assertEquals(NodeKind.CALL, call.getKind());
            assertEquals(2, call.field("arguments").getNamedChildCount());
            SyntaxNode attribute = call.field("function");
            assertEquals(NodeKind.ATTRIBUTE, attribute.getKind());
            assertEquals(NodeKind.SUBSCRIPT, attribute.field("object").getKind());
        }

        @Test
        @DisplayName("ternary conditional")
        void testConditional() {
            SyntaxNode conditional = expression("a if b else c\n");
            assertEquals(NodeKind.CONDITIONAL_EXPRESSION, conditional.getKind());
            assertEquals("b", conditional.field("condition").text());
        }

        @Test
        @DisplayName("line breaks inside brackets are insignificant")
        void testMultilineCollections() {
            SyntaxNode array = expression("[\n\t1,\n\t2,\n]\n");
            assertEquals(NodeKind.ARRAY, array.getKind());
            assertEquals(2, array.getNamedChildCount());
            assertTrue(array.hasTrailingComma());
            assertTrue(array.isMultiLine());

            SyntaxNode dictionary = expression("{\"a\": 1, b = 2}\n");
            assertEquals(NodeKind.DICTIONARY, dictionary.getKind());
            assertEquals(2, dictionary.getNamedChildCount());
        }

        @Test
        @DisplayName("lambda with a block body inside a call")
        void testLambda() {
            SyntaxNode call = expression("connect(func(x):\n\tprint(x)\n)\n");
            SyntaxNode lambda = call.field("arguments").getNamedChild(0);
            assertEquals(NodeKind.LAMBDA, lambda.getKind());
            assertEquals(NodeKind.BODY, lambda.field("body").getKind());
        }
    }

    @Nested
    @DisplayName("statements")
    class Statements {

        @Test
        @DisplayName("if / elif / else chain")
        void testIfChain() {
            SyntaxNode function = first("func f(x):\n\tif x > 0:\n\t\tpass\n\telif x < 0:\n\t\tpass\n\telse:\n\t\tpass\n");
            SyntaxNode ifStatement = function.field("body").getNamedChild(0);
            assertEquals(NodeKind.IF_STATEMENT, ifStatement.getKind());
            assertNotNull(ifStatement.findChild(NodeKind.ELIF_CLAUSE));
            assertNotNull(ifStatement.findChild(NodeKind.ELSE_CLAUSE));
        }

        @Test
        @DisplayName("for, while and match")
        void testLoopsAndMatch() {
            SyntaxNode body = first("func f(items):\n\tfor i in items:\n\t\tcontinue\n\twhile true:\n\t\tbreak\n"
                    + "\tmatch items:\n\t\t1, 2:\n\t\t\tpass\n\t\t_:\n\t\t\tpass\n").field("body");
            assertEquals(NodeKind.FOR_STATEMENT, body.getNamedChild(0).getKind());
            assertEquals(NodeKind.WHILE_STATEMENT, body.getNamedChild(1).getKind());
            SyntaxNode match = body.getNamedChild(2);
            assertEquals(NodeKind.MATCH_STATEMENT, match.getKind());
            assertEquals(2, match.field("body").getNamedChildCount());
        }

        @Test
        @DisplayName("semicolons separate statements on one line")
        void testSemicolons() {
            SyntaxNode body = first("func f():\n\tvar a = 1; var b = 2\n").field("body");
            assertEquals(2, body.getNamedChildCount());
        }

        @Test
        @DisplayName("empty source parses to an empty root")
        void testEmpty() {
            SyntaxNode root = parse("");
            assertEquals(NodeKind.SOURCE, root.getKind());
            assertEquals(0, root.getNamedChildCount());
        }
    }

    @Nested
    @DisplayName("line starts")
    class LineStarts {

        @Test
        @DisplayName("keywords that open a statement are consumed")
        void testStatementKeywords() {
            List<SyntaxNode> statements = parse("static var count = 0\nstatic func make():\n\tpass\n"
                    + "const A = 1\nsignal died\n@export\nvar hp = 3\n").getNamedChildren();
            assertEquals(NodeKind.VARIABLE_STATEMENT, statements.get(0).getKind());
            assertTrue(statements.get(0).hasField("static"));
            assertEquals(NodeKind.FUNCTION_DEFINITION, statements.get(1).getKind());
            assertTrue(statements.get(1).hasField("static"));
            assertEquals(NodeKind.CONST_STATEMENT, statements.get(2).getKind());
            assertEquals(NodeKind.SIGNAL_STATEMENT, statements.get(3).getKind());
            assertEquals(NodeKind.ANNOTATION, statements.get(4).getKind());
            assertEquals(NodeKind.VARIABLE_STATEMENT, statements.get(5).getKind());
        }

        @Test
        @DisplayName("bare calls and unary expressions open a statement")
        void testExpressionStatements() {
            SyntaxNode body = first("func f():\n\tprint(1)\n\t-x\n\tqueue_free()\n").field("body");
            assertEquals(3, body.getNamedChildCount());
            assertEquals(NodeKind.CALL, body.getNamedChild(0).getNamedChild(0).getKind());
            assertEquals(NodeKind.CALL, body.getNamedChild(2).getNamedChild(0).getKind());
        }

        @Test
        @DisplayName("the next line still ends the previous expression")
        void testLineEndsExpression() {
            List<SyntaxNode> statements = parse("var a = b\n(c)\n").getNamedChildren();
            assertEquals(2, statements.size());
            assertEquals(NodeKind.IDENTIFIER, statements.get(0).field("value").getKind());
        }

        @Test
        @DisplayName("closing brackets alone on their line")
        void testClosingBracketOnOwnLine() {
            SyntaxNode variable = first("var x = [\n\t1,\n]\n");
            assertTrue(variable.field("value").hasTrailingComma());

            SyntaxNode body = first("func f(\n\ta,\n\tb,\n):\n\tg(\n\t\ta,\n\t)\n"
                    + "\tvar d = {\n\t\t\"k\": 1,\n\t}\n").field("body");
            assertEquals(2, body.getNamedChildCount());
            assertEquals(NodeKind.CALL, body.getNamedChild(0).getNamedChild(0).getKind());
            assertEquals(NodeKind.DICTIONARY, body.getNamedChild(1).field("value").getKind());

            SyntaxNode enumeration = first("enum State {\n\tIDLE,\n\tRUN,\n}\n");
            assertEquals(2, enumeration.field("body").getNamedChildCount());
        }

        @Test
        @DisplayName("match pattern sections start on their own lines")
        void testPatternSections() {
            SyntaxNode match = first("func f(v):\n\tmatch v:\n\t\t1:\n\t\t\tpass\n"
                    + "\t\tState.IDLE, State.RUN:\n\t\t\tpass\n\t\t[var a, ..]:\n\t\t\tpass\n"
                    + "\t\tvar other when other > 3:\n\t\t\tpass\n").field("body").getNamedChild(0);
            SyntaxNode sections = match.field("body");
            assertEquals(4, sections.getNamedChildCount());
            assertEquals(NodeKind.INTEGER, sections.getNamedChild(0).getNamedChild(0).getKind());
            assertEquals(NodeKind.ARRAY, sections.getNamedChild(2).getNamedChild(0).getKind());
            assertEquals(NodeKind.PATTERN_BINDING, sections.getNamedChild(3).getNamedChild(0).getKind());
            assertTrue(sections.getNamedChild(3).hasField("guard"));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("missing colon after a function header")
        void testMissingColon() {
            ParseException e = assertThrows(ParseException.class, () -> parse("func foo()\n\tpass\n"));
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("unexpected indentation at top level")
        void testUnexpectedIndent() {
            ParseException e = assertThrows(ParseException.class, () -> parse("var x = 1\n\tvar y = 2\n"));
            assertTrue(e.getMessage().startsWith("Unexpected indentation"));
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("two expressions on one line")
        void testTrailingGarbage() {
            ParseException e = assertThrows(ParseException.class, () -> parse("var x = 1 2\n"));
            assertTrue(e.getMessage().contains("found '2'"));
        }

        @Test
        @DisplayName("static must introduce a variable or function")
        void testStaticWithoutDeclaration() {
            ParseException e = assertThrows(ParseException.class, () -> parse("static x = 1\n"));
            assertEquals("'var' or 'func'", e.getExpected());
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("block header without a body")
        void testMissingBody() {
            assertThrows(ParseException.class, () -> parse("func foo():\n"));
        }
    }
}
