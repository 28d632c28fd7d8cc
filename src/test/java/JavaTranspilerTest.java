import org.junit.jupiter.api.Test;

import com.panini.script.JavaTranspiler;

import static org.junit.jupiter.api.Assertions.*;

public class JavaTranspilerTest {

    @Test
    void assignmentsAndPrint() {
        String java = JavaTranspiler.transpile("x = 5\nx = x + 1\nदर्श(x)\n", "Hello");
        assertTrue(java.startsWith("public class Hello {\n"));
        assertTrue(java.contains("public static void main(String[] args) {"));
        assertTrue(java.contains("        var x = 5;\n"));
        assertTrue(java.contains("        x = x + 1;\n"));
        assertTrue(java.contains("        System.out.println(x);\n"));
    }

    @Test
    void ifElseAndLoops() {
        String java = JavaTranspiler.transpile(
                "यदि x < 5:\n" +
                "  दर्श(1)\n" +
                "अन्यथा:\n" +
                "  दर्श(2)\n" +
                "परिभ्रमण i in परिधि(3):\n" +
                "  दर्श(i)\n",
                "Flow");
        assertTrue(java.contains("        if (x < 5) {\n            System.out.println(1);\n        } else {\n"));
        assertTrue(java.contains("        for (double i = 0; i < 3; i++) {\n"));
    }

    @Test
    void functionsBecomeStaticMethods() {
        String java = JavaTranspiler.transpile(
                "कार्य greet(नाम):\n" +
                "    दर्श(\"नमस्ते \" + नाम)\n" +
                "greet(\"भारत\")\n",
                "Greeter");
        assertTrue(java.contains("    static void greet(Object नाम) {\n"));
        assertTrue(java.contains("        System.out.println(\"नमस्ते \" + नाम);\n"));
        assertTrue(java.contains("        greet(\"भारत\");\n"));
        assertTrue(java.indexOf("greet(\"भारत\");") < java.indexOf("static void greet"));
    }

    @Test
    void booleanWordsOutsideStrings() {
        String java = JavaTranspiler.transpile("a = सत्य\nदर्श(\"सत्य\")\n", "Bools");
        assertTrue(java.contains("var a = true;"));
        assertTrue(java.contains("System.out.println(\"सत्य\");"));
    }

    @Test
    void invalidClassName() {
        assertThrows(IllegalArgumentException.class, () -> JavaTranspiler.transpile("x = 1", "1Bad"));
        assertThrows(IllegalArgumentException.class, () -> JavaTranspiler.transpile("x = 1", "my-class"));
    }
}
