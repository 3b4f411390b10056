package com.gdformatter.plugins.gdscript.reorder;

import com.gdformatter.plugins.gdscript.format.FormatException;
import com.gdformatter.plugins.gdscript.format.FormatOptions;
import com.gdformatter.plugins.gdscript.format.Formatter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReorderEngine")
class ReorderEngineTest {

    private static String reorder(String source) {
        try {
            String formatted = Formatter.format(source, FormatOptions.defaults());
            return ReorderEngine.reorder(formatted);
        } catch (FormatException e) {
            throw new AssertionError("Unexpected failure: " + e.getMessage(), e);
        }
    }

    private static void assertBefore(String text, String first, String second) {
        int a = text.indexOf(first);
        int b = text.indexOf(second);
        assertTrue(a >= 0, () -> "missing '" + first + "' in:\n" + text);
        assertTrue(b >= 0, () -> "missing '" + second + "' in:\n" + text);
        assertTrue(a < b, () -> "'" + first + "' should precede '" + second + "' in:\n" + text);
    }

    @Nested
    @DisplayName("member categories")
    class Categories {

        @Test
        @DisplayName("variables move above methods")
        void testVarsBeforeMethods() {
            assertEquals("extends Node\n\nvar x = 1\n\n\nfunc foo():\n\tpass\n",
                    reorder("extends Node\n\n\nfunc foo():\n\tpass\n\n\nvar x = 1\n"));
        }

        @Test
        @DisplayName("signals, enums and constants come before variables")
        void testSignalsEnumsConsts() {
            assertEquals("extends Node\n\nsignal my_signal\n\nvar x = 1\n",
                    reorder("extends Node\n\nvar x = 1\n\nsignal my_signal\n"));
            assertEquals("extends Node\n\nconst MAX = 100\n\nvar x = 1\n",
                    reorder("extends Node\n\nvar x = 1\n\nconst MAX = 100\n"));
            assertEquals("extends Node\n\nenum State { IDLE, RUNNING }\n\nconst MAX = 100\n",
                    reorder("extends Node\n\nconst MAX = 100\n\nenum State { IDLE, RUNNING }\n"));
        }

        @Test
        @DisplayName("members of one kind keep their relative order")
        void testStableOrder() {
            String result = reorder("extends Node\n\nvar a = 1\n\nsignal z\nsignal y\nsignal x\n");
            assertEquals("extends Node\n\nsignal z\nsignal y\nsignal x\n\nvar a = 1\n", result);
        }

        @Test
        @DisplayName("inner classes go last")
        void testInnerClassLast() {
            assertEquals("extends Node\n\n\nfunc foo():\n\tpass\n\n\nclass Inner:\n\tpass\n",
                    reorder("extends Node\n\n\nclass Inner:\n\tpass\n\n\nfunc foo():\n\tpass\n"));
        }
    }

    @Nested
    @DisplayName("methods")
    class Methods {

        @Test
        @DisplayName("virtual callbacks follow the engine lifecycle")
        void testVirtualOrder() {
            String input = "extends Node\n\n\n"
                    + "func _physics_process(delta):\n\tpass\n\n\n"
                    + "func _ready():\n\tpass\n\n\n"
                    + "func _process(delta):\n\tpass\n\n\n"
                    + "func _enter_tree():\n\tpass\n\n\n"
                    + "func _init():\n\tpass\n";
            String expected = "extends Node\n\n\n"
                    + "func _init():\n\tpass\n\n\n"
                    + "func _enter_tree():\n\tpass\n\n\n"
                    + "func _ready():\n\tpass\n\n\n"
                    + "func _process(delta):\n\tpass\n\n\n"
                    + "func _physics_process(delta):\n\tpass\n";
            assertEquals(expected, reorder(input));
        }

        @Test
        @DisplayName("other virtual callbacks come after _physics_process")
        void testOtherVirtuals() {
            assertEquals("extends Node\n\n\nfunc _ready():\n\tpass\n\n\nfunc _exit_tree():\n\tpass\n",
                    reorder("extends Node\n\n\nfunc _exit_tree():\n\tpass\n\n\nfunc _ready():\n\tpass\n"));
        }

        @Test
        @DisplayName("static methods precede virtual methods, _static_init first")
        void testStaticMethods() {
            assertEquals("extends Node\n\n\nstatic func _static_init():\n\tpass\n\n\nstatic func helper():\n\tpass\n",
                    reorder("extends Node\n\n\nstatic func helper():\n\tpass\n\n\nstatic func _static_init():\n\tpass\n"));
            assertEquals("extends Node\n\n\nstatic func helper():\n\tpass\n\n\nfunc _ready():\n\tpass\n",
                    reorder("extends Node\n\n\nfunc _ready():\n\tpass\n\n\nstatic func helper():\n\tpass\n"));
        }
    }

    @Nested
    @DisplayName("variables")
    class Variables {

        @Test
        @DisplayName("static, export, plain, onready")
        void testVariableKinds() {
            assertEquals("extends Node\n\n@export var exported = 2\n\nvar regular = 1\n",
                    reorder("extends Node\n\nvar regular = 1\n\n@export var exported = 2\n"));
            assertEquals("extends Node\n\nvar regular = 1\n\n@onready var node = $Node\n",
                    reorder("extends Node\n\n@onready var node = $Node\n\nvar regular = 1\n"));
            assertEquals("extends Node\n\nstatic var static_var = 2\n\n@export var exported = 1\n",
                    reorder("extends Node\n\n@export var exported = 1\n\nstatic var static_var = 2\n"));
        }

        @Test
        @DisplayName("section annotations travel with their variable")
        void testSectionAnnotations() {
            String result = reorder("extends Node\n\n\nfunc foo():\n\tpass\n\n\n"
                    + "@export_category(\"Physics\")\n@export_group(\"Movement\")\nvar speed: float = 10.0\n");
            assertBefore(result, "@export_category", "@export_group");
            assertBefore(result, "@export_group", "var speed");
            assertBefore(result, "var speed", "func foo");
        }

        @Test
        @DisplayName("a lone section annotation stays put when nothing moves")
        void testSectionAnnotationInPlace() {
            String input = "extends Node\n\n@export_subgroup(\"Advanced\")\nvar acceleration: float = 5.0\n";
            assertEquals(input, reorder(input));
        }
    }

    @Nested
    @DisplayName("file header")
    class Header {

        @Test
        @DisplayName("@tool, @icon and @static_unload lead, then class_name, then extends")
        void testHeaderOrder() {
            assertEquals("@tool\nclass_name MyClass\nextends Node\n", reorder("class_name MyClass\n@tool\nextends Node\n"));
            assertEquals("@tool\n@icon(\"res://icon.png\")\nextends Node\n",
                    reorder("@icon(\"res://icon.png\")\n@tool\nextends Node\n"));
            assertEquals("@tool\n@static_unload\nextends Node\n", reorder("@static_unload\n@tool\nextends Node\n"));
            assertEquals("class_name MyClass\nextends Node\n", reorder("extends Node\nclass_name MyClass\n"));
        }
    }

    @Nested
    @DisplayName("comments")
    class Comments {

        @Test
        @DisplayName("a comment block directly above a member moves with it")
        void testAttachedComments() {
            assertEquals("extends Node\n\n# Line 1\n# Line 2\nvar x = 1\n\n\nfunc foo():\n\tpass\n",
                    reorder("extends Node\n\n\nfunc foo():\n\tpass\n\n\n# Line 1\n# Line 2\nvar x = 1\n"));
        }

        @Test
        @DisplayName("a free-standing ## block is the class documentation")
        void testDocComment() {
            assertEquals("extends Node\n\n## This is a class doc comment.\n\nvar x = 1\n",
                    reorder("extends Node\n\nvar x = 1\n\n## This is a class doc comment.\n"));
        }

        @Test
        @DisplayName("a comment separated by a blank line is kept")
        void testDetachedComment() {
            String result = reorder("extends Node\n\n# Standalone comment\n\nvar x = 1\n");
            assertTrue(result.contains("# Standalone comment"));
            assertTrue(result.contains("var x = 1"));
        }
    }

    @Nested
    @DisplayName("inner classes")
    class InnerClasses {

        @Test
        @DisplayName("members of an inner class are reordered")
        void testInnerMembers() {
            assertEquals("extends Node\n\n\nclass Inner:\n\tvar x = 1\n\n\tfunc foo():\n\t\tpass\n",
                    reorder("extends Node\n\n\nclass Inner:\n\tfunc foo():\n\t\tpass\n\n\tvar x = 1\n"));
        }

        @Test
        @DisplayName("nested classes are reordered at every level")
        void testNested() {
            String result = reorder("extends Node\n\n\nclass Outer:\n"
                    + "\tclass InnerInner:\n\t\tfunc foo():\n\t\t\tpass\n\n\t\tvar y = 2\n\n"
                    + "\tfunc bar():\n\t\tpass\n\n"
                    + "\tvar x = 1\n");
            assertBefore(result, "\tvar x = 1", "\tfunc bar()");
            assertBefore(result, "\tfunc bar()", "\tclass InnerInner:");
            assertBefore(result, "\t\tvar y = 2", "\t\tfunc foo()");
        }
    }

    @Nested
    @DisplayName("no-op cases")
    class NoOp {

        @Test
        @DisplayName("ordered input is returned unchanged")
        void testAlreadyOrdered() throws FormatException {
            String input = "extends Node\n\nsignal hit\n\nvar x = 1\n\n\nfunc _ready():\n\tpass\n";
            assertSame(input, ReorderEngine.reorder(input));
        }

        @Test
        @DisplayName("a file with a top-level member in a fmt: off region is left alone")
        void testSkipRegion() throws FormatException {
            String input = "extends Node\n\n\nfunc foo():\n\tpass\n\n\n# fmt: off\nvar   x = 1\n# fmt: on\n";
            assertSame(input, ReorderEngine.reorder(input));
        }

        @Test
        @DisplayName("reordering is idempotent")
        void testIdempotent() throws FormatException {
            String once = reorder("extends Node\n\n\nfunc foo():\n\tpass\n\n\nvar x = 1\n\nconst A = 1\n");
            assertEquals(once, ReorderEngine.reorder(once));
        }

        @Test
        @DisplayName("empty input")
        void testEmpty() throws FormatException {
            assertEquals("", ReorderEngine.reorder(""));
        }
    }

    @Test
    @DisplayName("declarations are listed in source order with their kinds")
    void testDeclarations() throws FormatException {
        List<Declaration> declarations = ReorderEngine.declarations(
                "extends Node\n\n# speed\n@export var speed = 1\n\n\nfunc _ready():\n\tpass\n");
        assertEquals(3, declarations.size());
        assertEquals(MemberKind.EXTENDS, declarations.get(0).getKind());
        assertEquals(MemberKind.EXPORT_VAR, declarations.get(1).getKind());
        assertEquals(3, declarations.get(1).getStartLine());
        assertEquals(MemberKind.VIRTUAL_READY, declarations.get(2).getKind());
    }
}
