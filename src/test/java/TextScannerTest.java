import org.junit.jupiter.api.Test;

import com.panini.script.parser.TextScanner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextScannerTest {

    @Test
    void indexOfTopLevel_skipsStringsAndParens() {
        assertEquals(-1, TextScanner.indexOfTopLevel("\"a=b\"", "="));
        assertEquals(-1, TextScanner.indexOfTopLevel("f(a=b)", "="));
        assertEquals(6, TextScanner.indexOfTopLevel("f(a=b)=c", "="));
        assertEquals(2, TextScanner.indexOfTopLevel("a == b", "=="));
    }

    @Test
    void indexOfTopLevel_unbalancedCloseDoesNotGoNegative() {
        assertEquals(2, TextScanner.indexOfTopLevel("a)+b", "+"));
    }

    @Test
    void lastIndexOfTopLevel() {
        assertEquals(6, TextScanner.lastIndexOfTopLevel("1 + 2 + 3", "+", i -> true));
        assertEquals(2, TextScanner.lastIndexOfTopLevel("1 + (2 + 3)", "+", i -> true));
        assertEquals(2, TextScanner.lastIndexOfTopLevel("1 + 2 + 3", "+", i -> i < 5));
        assertEquals(-1, TextScanner.lastIndexOfTopLevel("\"a+b\"", "+", i -> true));
    }

    @Test
    void splitTopLevel_dropsEmptyParts() {
        assertEquals(List.of("a", "f(b, c)", "\"d,e\""), TextScanner.splitTopLevel("a, f(b, c), \"d,e\"", ','));
        assertEquals(List.of(), TextScanner.splitTopLevel("", ','));
        assertEquals(List.of("a", "b"), TextScanner.splitTopLevel("a, ,b", ','));
    }

    @Test
    void matchingParen_ignoresParensInStrings() {
        assertEquals(5, TextScanner.matchingParen("f(\")\")", 1));
        assertEquals(-1, TextScanner.matchingParen("f((a)", 1));
    }

    @Test
    void wrappedAndLiteralDetection() {
        assertTrue(TextScanner.isWrappedInParens("(a + b)"));
        assertFalse(TextScanner.isWrappedInParens("(a) + (b)"));
        assertTrue(TextScanner.isStringLiteral("\"नमस्ते\""));
        assertFalse(TextScanner.isStringLiteral("\"a\" + \"b\""));
    }

    @Test
    void identifiers_acceptDevanagari() {
        assertTrue(TextScanner.isValidIdentifier("योग"));
        assertTrue(TextScanner.isValidIdentifier("x_1"));
        assertFalse(TextScanner.isValidIdentifier("a b"));
        assertFalse(TextScanner.isValidIdentifier(""));
        assertFalse(TextScanner.isValidIdentifier("f(x)"));
    }
}
