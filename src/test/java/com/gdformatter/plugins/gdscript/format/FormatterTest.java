package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.SyntaxTree;
import com.gdformatter.plugins.gdscript.verify.EquivalenceResult;
import com.gdformatter.plugins.gdscript.verify.EquivalenceVerifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Formatter")
class FormatterTest {

    private static String format(String source) {
        try {
            return Formatter.format(source, FormatOptions.defaults());
        } catch (FormatException e) {
            throw new AssertionError("Unexpected failure: " + e.getMessage(), e);
        }
    }

    private static String formatWithSpaces(String source, int width) throws FormatException {
        return Formatter.format(source, FormatOptions.defaults().withSpaces(width));
    }

    private static void assertEquivalent(String source) {
        String formatted = format(source);
        EquivalenceResult result = EquivalenceVerifier.compare(SyntaxTree.parse(source), SyntaxTree.parse(formatted));
        assertTrue(result.isEquivalent(),
                () -> "AST changed: " + result + "\nOriginal:\n" + source + "\nFormatted:\n" + formatted);
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = FormatterTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("declarations")
    class Declarations {

        @Test
        @DisplayName("extends and class_name collapse inner whitespace")
        void testHeaderStatements() {
            assertEquals("extends Node2D\n", format("extends  Node2D\n"));
            assertEquals("extends Node2D\n", format("extends   Node2D\n"));
            assertEquals("class_name MyClass\n", format("class_name   MyClass\n"));
        }

        @Test
        @DisplayName("variables get canonical spacing around ':' and '='")
        void testVariables() {
            assertEquals("var x: int = 1\n", format("var x:int=1\n"));
            assertEquals("var x: int = 1\n", format("var   x  :  int   =   1\n"));
            assertEquals("var x = 1\n", format("var x = 1\n"));
        }

        @Test
        @DisplayName("inferred types keep ':='")
        void testInferredType() {
            assertEquals("var x := 1\n", format("var x := 1\n"));
            assertEquals("var x := 1\n", format("var x:=1\n"));
            assertEquals("var gltf := GLTFDocument.new()\n", format("var gltf := GLTFDocument.new()\n"));
        }

        @Test
        @DisplayName("constants")
        void testConstants() {
            assertEquals("const X: int = 1\n", format("const X:int=1\n"));
            assertEquals("const X = 100\n", format("const   X   =   100\n"));
        }

        @Test
        @DisplayName("function headers")
        void testFunctions() {
            assertEquals("func foo():\n\tpass\n", format("func foo(  ):\n\tpass\n"));
            assertEquals("func foo(a: int, b: int) -> int:\n\treturn a + b\n",
                    format("func foo(a:int,b:int)->int:\n\treturn a+b\n"));
        }

        @Test
        @DisplayName("typed default parameters are left alone when already canonical")
        void testTypedDefaults() {
            String input = "func save_file(path: String, with_model: bool = false, count: int = 10):\n\tpass\n";
            assertEquals(input, format(input));
        }

        @Test
        @DisplayName("static keyword and annotations are kept")
        void testModifiers() {
            assertTrue(format("static func bar():\n\tpass\n").startsWith("static func"));
            assertEquals("@export var speed: float = 10.0\n", format("@export var speed: float = 10.0\n"));
        }

        @Test
        @DisplayName("signals and enums")
        void testSignalsAndEnums() {
            assertEquals("signal my_signal\n", format("signal my_signal\n"));
            assertEquals("enum State { IDLE, WALKING, RUNNING }\n", format("enum State { IDLE, WALKING, RUNNING }\n"));
        }
    }

    @Nested
    @DisplayName("expressions")
    class Expressions {

        @Test
        @DisplayName("calls drop inner padding")
        void testCalls() {
            assertEquals("print(\"Hello\")\n", format("print(   \"Hello\"   )\n"));
            assertEquals("foo(a, b, c)\n", format("foo(  a  ,  b  ,  c  )\n"));
            assertEquals("var x = obj.method().another()\n", format("var x = obj.method().another()\n"));
        }

        @Test
        @DisplayName("binary operators get single spaces")
        void testBinaryOperators() {
            assertEquals("var x = a + b\n", format("var x = a+b\n"));
            assertEquals("var x = a - b\n", format("var x = a-b\n"));
            assertEquals("var x = a * b\n", format("var x = a*b\n"));
            assertEquals("var x = a / b\n", format("var x = a/b\n"));
            assertEquals("print(\"Hello\" + \" \" + \"World\")\n", format("print(\"Hello\" + \" \" + \"World\")\n"));
        }

        @Test
        @DisplayName("comparisons")
        void testComparisons() {
            assertEquals("if x != OK:\n\tpass\n", format("if x!=OK:\n\tpass\n"));
            assertEquals("if x == 1:\n\tpass\n", format("if x==1:\n\tpass\n"));
        }

        @Test
        @DisplayName("boolean operators in both spellings")
        void testBooleanOperators() {
            assertDoesNotThrow(() -> Formatter.format("if x && y:\n\tpass\n", FormatOptions.defaults()));
            assertDoesNotThrow(() -> Formatter.format("if x || y:\n\tpass\n", FormatOptions.defaults()));
            assertDoesNotThrow(() -> Formatter.format("if !x:\n\tpass\n", FormatOptions.defaults()));
        }

        @Test
        @DisplayName("arrays and dictionaries on one line")
        void testCollections() {
            assertEquals("var x = [1, 2, 3]\n", format("var x = [1,2,3]\n"));
            assertEquals("var x = [1, 2, 3]\n", format("var x = [  1  ,  2  ,  3  ]\n"));
            assertEquals("var x = []\n", format("var x = []\n"));
            assertEquals("var x = {}\n", format("var x = {}\n"));
            assertEquals("var x = { a: 1, b: 2 }\n", format("var x = {a:1,b:2}\n"));
        }

        @Test
        @DisplayName("a trailing comma keeps a collection multi-line")
        void testTrailingComma() {
            String dictionary = "var data := {\n\t\"key1\": \"value1\",\n\t\"key2\": \"value2\",\n}\n";
            assertEquals(dictionary, format(dictionary));
            assertEquals("var x = [\n\t1,\n\t2,\n\t3,\n]\n", format("var x = [1, 2, 3,]\n"));
        }

        @Test
        @DisplayName("multi-line output parses back to the same text")
        void testMultiLineOutputIsStable() {
            String array = format("var x = [1, 2, 3,]\n");
            assertEquals(array, format(array));
            assertEquivalent(array);

            String call = format("func f():\n\tg(a, b,)\n");
            assertEquals("func f():\n\tg(\n\t\ta,\n\t\tb,\n\t)\n", call);
            assertEquals(call, format(call));
        }
    }

    @Nested
    @DisplayName("control flow")
    class ControlFlow {

        @Test
        @DisplayName("loop headers")
        void testLoops() {
            assertTrue(format("for i in range(10):\n\tpass\n").contains("for i in range(10):"));
            assertTrue(format("while x>0:\n\tpass\n").contains("while x > 0:"));
            assertEquals("func foo():\n\twhile true:\n\t\tbreak\n", format("func foo():\n\twhile true:\n\t\tbreak\n"));
            assertEquals("func foo():\n\twhile true:\n\t\tcontinue\n",
                    format("func foo():\n\twhile true:\n\t\tcontinue\n"));
        }

        @Test
        @DisplayName("return with and without a value")
        void testReturn() {
            assertEquals("func foo():\n\treturn\n", format("func foo():\n\treturn\n"));
            assertEquals("func foo():\n\treturn a + b\n", format("func foo():\n\treturn a+b\n"));
        }

        @Test
        @DisplayName("elif bodies are preserved")
        void testElif() {
            String input = "if x == 1:\n\tx = 2\nelif x == 3:\n\tx = 4\n";
            assertEquals(input, format(input));
        }

        @Test
        @DisplayName("complex elif chain is already canonical")
        void testComplexElifChain() {
            String input = "if name == \"main\":\n"
                    + "\tresource = \"ModelMesh\"\n"
                    + "elif !name.begins_with(\"ModelMesh_\"):\n"
                    + "\tresource = \"ModelMesh_\" + str(name)\n"
                    + "else:\n"
                    + "\tresource = name\n";
            assertEquals(input, format(input));
        }

        @Test
        @DisplayName("match statements")
        void testMatch() {
            assertTrue(format("match x:\n\t1:\n\t\tpass\n\t_:\n\t\tpass\n").contains("match x:"));
        }
    }

    @Nested
    @DisplayName("layout")
    class Layout {

        @Test
        @DisplayName("exactly one trailing newline")
        void testTrailingNewline() {
            assertEquals("var x = 1\n", format("var x = 1"));
            assertEquals("var x = 1\n", format("var x = 1\n"));
            assertEquals("var x = 1\n", format("var x = 1\n\n"));
        }

        @Test
        @DisplayName("trailing newline can be switched off")
        void testNoTrailingNewline() throws FormatException {
            FormatOptions options = FormatOptions.defaults().withTrailingNewline(false);
            assertEquals("var x = 1", Formatter.format("var x = 1\n\n", options));
        }

        @Test
        @DisplayName("indentation with spaces")
        void testSpaces() throws FormatException {
            assertEquals("func foo():\n    pass\n", formatWithSpaces("func foo():\n\tpass\n", 4));
            assertEquals("func foo():\n  if x:\n    pass\n", formatWithSpaces("func foo():\n\tif x:\n\t\tpass\n", 2));
        }

        @Test
        @DisplayName("blank lines inside functions separate sections")
        void testBlankLinesInFunction() {
            String input = "func foo():\n\tvar x = 1\n\tvar y = 2\n\n\tx = x + 1\n\ty = y + 1\n";
            assertEquals(input, format(input));
            assertEquals("func foo():\n\tvar x = 1\n\n\tvar y = 2\n",
                    format("func foo():\n\tvar x = 1\n\n\n\n\tvar y = 2\n"));
        }

        @Test
        @DisplayName("blank lines between top-level variables are kept")
        void testBlankLinesBetweenVariables() {
            String input = "extends Node\n\nvar gltf := GLTFDocument.new()\nvar gltf_state := GLTFState.new()\n\nvar key_remap := {}\n";
            assertEquals(input, format(input));
        }

        @Test
        @DisplayName("top-level blank runs collapse to two")
        void testBlankLinesCollapsed() {
            assertEquals("extends Node\n\n\nvar x = 1\n", format("extends Node\n\n\n\n\nvar x = 1\n"));
        }

        @Test
        @DisplayName("functions get two blank lines at file level")
        void testFunctionSpacing() {
            assertEquals("extends Node\n\nvar x = 1\n\n\nfunc _ready():\n\tprint(x)\n",
                    format("extends Node\nvar x=1\nfunc _ready():\n\tprint(x)\n"));
        }
    }

    @Nested
    @DisplayName("comments")
    class Comments {

        @Test
        @DisplayName("inline comments sit two spaces after code")
        void testInlineComment() {
            assertEquals("var x = 1  # comment\n", format("var x = 1  # comment\n"));
            assertEquals("var x = 1  # comment\n", format("var x = 1 # comment\n"));
        }

        @Test
        @DisplayName("standalone comments survive formatting")
        void testStandaloneComments() {
            String formatted = format("# header\nextends Node\n\n# about x\nvar x=1\n");
            assertTrue(formatted.contains("# header\n"));
            assertTrue(formatted.contains("# about x\nvar x = 1\n"));
        }
    }

    @Nested
    @DisplayName("skip regions")
    class Skip {

        @Test
        @DisplayName("lines between fmt: off and fmt: on are copied verbatim")
        void testFmtOffOn() {
            String source = "extends Node2D\n# fmt: off\nvar   x   =   1\n# fmt: on\nvar y = 2\n";
            String formatted = format(source);
            assertTrue(formatted.contains("var   x   =   1"));
            assertTrue(formatted.contains("var y = 2"));
            assertEquals("extends Node2D\n\n# fmt: off\nvar   x   =   1\n# fmt: on\nvar y = 2\n", formatted);
        }

        @Test
        @DisplayName("property accessors are copied verbatim even on one line")
        void testSetgetVerbatim() {
            String source = "var  hp:  int:  get = _get_hp\n";
            assertEquals(source, format(source));
        }

        @Test
        @DisplayName("a '#' inside a string does not block re-rendering")
        void testHashInsideString() {
            assertEquals("var tags = [\"#red\", \"#blue\"]\n", format("var tags = [\"#red\",   \"#blue\"]\n"));
            assertEquals("print(\"#1\", x)\n", format("print( \"#1\",x )\n"));
        }
    }

    @Nested
    @DisplayName("safety properties")
    class Properties {

        @Test
        @DisplayName("formatting keeps the syntax tree")
        void testEquivalence() {
            List<String> sources = List.of(
                    "extends Node2D\n",
                    "class_name MyClass\n",
                    "var x: int = 1\n",
                    "var x := 1\n",
                    "const MAX = 100\n",
                    "signal data_received(data, sender)\n",
                    "func foo(a: int, b: String) -> void:\n\treturn\n",
                    "func foo(x = 5, y: int = 10):\n\tpass\n",
                    "static func bar():\n\tpass\n",
                    "@export var speed: float = 10.0\n",
                    "if x:\n\tpass\nelif y:\n\tpass\nelse:\n\tpass\n",
                    "for i in range(10):\n\tpass\n",
                    "match x:\n\t1:\n\t\tpass\n\t_:\n\t\tpass\n",
                    "var x = a && b\n",
                    "var x = -a\n",
                    "var x = !a\n",
                    "var x = arr[0]\n",
                    "var x = {a: 1, b: 2}\n",
                    "var d = {\n\ta: 1,\n\tb: 2,\n}\n",
                    "func foo(a:int,b:String):\n\tpass\n",
                    "if x==1:\n\tpass\n");
            sources.forEach(FormatterTest::assertEquivalent);
        }

        @Test
        @DisplayName("the fixture keeps its tree and formats idempotently")
        void testFixture() throws IOException {
            String source = fixture("player.gd");
            assertEquivalent(source);
            String once = format(source);
            assertEquals(once, format(once), "Formatting is not idempotent");
        }

        @Test
        @DisplayName("fixture keeps the skip region and the inline comment")
        void testFixtureContent() throws IOException {
            String formatted = format(fixture("player.gd"));
            assertTrue(formatted.contains("var   matrix = [\n\t1,0,\n\t0,1,\n]\n"));
            assertTrue(formatted.contains("\tsprite.play(\"idle\")  # start animation\n"));
            assertTrue(formatted.contains("func _physics_process(delta: float) -> void:\n"));
            assertTrue(formatted.endsWith("\t\titems.append(item)\n"));
        }
    }

    @Nested
    @DisplayName("errors and diagnostics")
    class Errors {

        @Test
        @DisplayName("a syntax error is reported with its position")
        void testParseError() {
            FormatException e = assertThrows(FormatException.class,
                    () -> Formatter.format("func foo(:\n\tpass\n", FormatOptions.defaults()));
            assertEquals(FormatException.Kind.PARSE, e.getKind());
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("long lines are reported, counting tabs as indent width")
        void testLongLines() {
            FormatOptions options = FormatOptions.defaults().withMaxLineLength(40);
            String text = "var short = 1\n\t" + "x".repeat(37) + "\n" + "y".repeat(41) + "\n";
            assertEquals(List.of(2, 3), Formatter.linesExceedingLength(text, options));
        }
    }
}
