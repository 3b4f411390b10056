package com.gdformatter.plugins.gdscript.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.gdformatter.plugins.gdscript.parser.NodeKind.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BlankLinePolicy")
class BlankLinePolicyTest {

    @Test
    @DisplayName("functions and classes are separated by two lines at file level")
    void testTopLevelFunctions() {
        assertEquals(2, BlankLinePolicy.blankLines(VARIABLE_STATEMENT, FUNCTION_DEFINITION, 0, BlankLinePolicy.Scope.TOP_LEVEL));
        assertEquals(2, BlankLinePolicy.blankLines(FUNCTION_DEFINITION, CLASS_DEFINITION, 5, BlankLinePolicy.Scope.TOP_LEVEL));
    }

    @Test
    @DisplayName("a change of declaration group asks for one line")
    void testCategoryChange() {
        assertEquals(1, BlankLinePolicy.blankLines(EXTENDS_STATEMENT, VARIABLE_STATEMENT, 0, BlankLinePolicy.Scope.TOP_LEVEL));
        assertEquals(0, BlankLinePolicy.blankLines(VARIABLE_STATEMENT, VARIABLE_STATEMENT, 0, BlankLinePolicy.Scope.TOP_LEVEL));
        assertEquals(0, BlankLinePolicy.blankLines(CLASS_NAME_STATEMENT, EXTENDS_STATEMENT, 0, BlankLinePolicy.Scope.TOP_LEVEL));
    }

    @Test
    @DisplayName("source blank lines are kept up to the scope cap")
    void testCaps() {
        assertEquals(2, BlankLinePolicy.blankLines(VARIABLE_STATEMENT, VARIABLE_STATEMENT, 4, BlankLinePolicy.Scope.TOP_LEVEL));
        assertEquals(1, BlankLinePolicy.blankLines(EXPRESSION_STATEMENT, EXPRESSION_STATEMENT, 3, BlankLinePolicy.Scope.BLOCK));
        assertEquals(1, BlankLinePolicy.blankLines(VARIABLE_STATEMENT, FUNCTION_DEFINITION, 0, BlankLinePolicy.Scope.CLASS_BODY));
    }

    @Test
    @DisplayName("nothing separates an annotation from what it annotates")
    void testAnnotation() {
        assertEquals(0, BlankLinePolicy.blankLines(ANNOTATION, FUNCTION_DEFINITION, 0, BlankLinePolicy.Scope.TOP_LEVEL));
        assertEquals(0, BlankLinePolicy.blankLines(ANNOTATION, VARIABLE_STATEMENT, 0, BlankLinePolicy.Scope.CLASS_BODY));
    }

    @Test
    @DisplayName("source blank lines are counted upward until the previous statement or a comment")
    void testCountSourceBlankLines() {
        SourceText text = new SourceText("var a = 1\n\n# note\n\n\nvar b = 2\n");
        assertEquals(2, BlankLinePolicy.countSourceBlankLines(text, 1, 6));
        assertEquals(1, BlankLinePolicy.countSourceBlankLines(text, 1, 3));
    }
}
