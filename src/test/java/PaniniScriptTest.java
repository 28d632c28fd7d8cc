import org.junit.jupiter.api.Test;

import com.panini.script.PaniniScript;
import com.panini.script.parser.Interpreter;
import com.panini.script.parser.RunResult;
import com.panini.script.parser.ScriptException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PaniniScriptTest {

    private static RunResult ok(String source) {
        RunResult r = new PaniniScript().run(source);
        assertEquals(List.of(), r.errors(), "Unexpected errors for:\n" + source);
        return r;
    }

    @Test
    void assignmentAndArithmetic() {
        RunResult r = ok(
                "x = 5\n" +
                "y = 10\n" +
                "योग = x + y\n" +
                "दर्श(योग)\n"
        );
        assertEquals("15\n", r.output());
    }

    @Test
    void integralNumbersPrintWithoutFraction() {
        assertEquals("5\n0.1\n", ok("दर्श(2.5 + 2.5)\nदर्श(0.1)\n").output());
    }

    @Test
    void stringConcatenation_usesDisplayForms() {
        RunResult r = ok(
                "दर्श(\"a\" + \"b\")\n" +
                "दर्श(\"योग: \" + 5)\n" +
                "दर्श(\"flag \" + सत्य)\n"
        );
        assertEquals("ab\nयोग: 5\nflag सत्य\n", r.output());
    }

    @Test
    void plusIsLeftAssociative() {
        RunResult r = ok(
                "दर्श(1 + 2 + \"x\")\n" +
                "दर्श(\"x\" + 1 + 2)\n"
        );
        assertEquals("3x\nx12\n", r.output());
    }

    @Test
    void booleansAndRange() {
        RunResult r = ok(
                "दर्श(असत्य)\n" +
                "r = परिधि(3)\n" +
                "दर्श(r)\n"
        );
        assertEquals("असत्य\n[0, 1, 2]\n", r.output());
    }

    @Test
    void ifElse_pythonStyle() {
        String src =
                "यदि x < 5:\n" +
                "    दर्श(\"small\")\n" +
                "अन्यथा:\n" +
                "    दर्श(\"big\")\n";
        assertEquals("small\n", ok("x = 3\n" + src).output());
        assertEquals("big\n", ok("x = 7\n" + src).output());
    }

    @Test
    void ifWithoutElse_falseConditionPrintsNothing() {
        assertEquals("", ok("यदि (2 == 3):\n    दर्श(1)\n").output());
    }

    @Test
    void whileLoop_countsUp() {
        RunResult r = ok(
                "i = 0\n" +
                "यावत् i < 3:\n" +
                "    दर्श(i)\n" +
                "    i = i + 1\n"
        );
        assertEquals("0\n1\n2\n", r.output());
    }

    @Test
    void whileLoop_stopsAtIterationGuard() {
        Interpreter it = new Interpreter();
        RunResult r = it.run(
                "n = 0\n" +
                "यावत् 1 < 2:\n" +
                "    n = n + 1\n"
        );
        assertFalse(r.hasErrors());
        assertEquals(Interpreter.MAX_LOOP_ITERATIONS, it.get("n").asNumber(), 1e-9);
    }

    @Test
    void forLoop_overRange() {
        RunResult r = ok(
                "परिभ्रमण i in परिधि(3):\n" +
                "    दर्श(i)\n"
        );
        assertEquals("0\n1\n2\n", r.output());
    }

    @Test
    void forLoop_lastValuePersists() {
        Interpreter it = new Interpreter();
        it.run("परिभ्रमण i in परिधि(5):\n    दर्श(i)\n");
        assertEquals(4.0, it.get("i").asNumber(), 1e-9);
    }

    @Test
    void ifTrue_neverRunsElseBranch() {
        Interpreter it = new Interpreter();
        RunResult r = it.run(
                "यदि (1 < 2): x = 1\n" +
                "अन्यथा:\n" +
                "    x = 2\n" +
                "    दर्श(\"else ran\")\n"
        );
        assertEquals(List.of(), r.errors());
        assertEquals("", r.output());
        assertEquals(1.0, it.get("x").asNumber(), 1e-9);
    }

    @Test
    void nestedBlocks() {
        RunResult r = ok(
                "परिभ्रमण i in परिधि(2):\n" +
                "    परिभ्रमण j in परिधि(2):\n" +
                "        दर्श(i + j)\n" +
                "    दर्श(\"-\")\n"
        );
        assertEquals("0\n1\n-\n1\n2\n-\n", r.output());
    }

    @Test
    void function_printsThroughCaller() {
        RunResult r = ok(
                "कार्य greet(नाम):\n" +
                "    दर्श(\"नमस्ते \" + नाम)\n" +
                "greet(\"भारत\")\n"
        );
        assertEquals("नमस्ते भारत\n", r.output());
    }

    @Test
    void function_seesCallerStateButCannotChangeIt() {
        RunResult r = ok(
                "x = 1\n" +
                "कार्य f():\n" +
                "    दर्श(x)\n" +
                "    x = 2\n" +
                "    दर्श(x)\n" +
                "f()\n" +
                "दर्श(x)\n"
        );
        assertEquals("1\n2\n1\n", r.output());
    }

    @Test
    void function_callEvaluatesToNull() {
        RunResult r = ok(
                "कार्य f():\n" +
                "    दर्श(\"in f\")\n" +
                "v = f()\n" +
                "दर्श(v)\n"
        );
        assertEquals("in f\nnull\n", r.output());
    }

    @Test
    void inlineHeaderAndExplicitBraces() {
        RunResult r = ok(
                "यदि (1 < 2): दर्श(\"inline\")\n" +
                "यदि (1 < 2) {\n" +
                "  दर्श(\"braces\")\n" +
                "}\n"
        );
        assertEquals("inline\nbraces\n", r.output());
    }

    @Test
    void commentsAndBlankLinesAreIgnored() {
        RunResult r = ok(
                "!! टिप्पणी\n" +
                "# another\n" +
                "\n" +
                "दर्श(1)\n"
        );
        assertEquals("1\n", r.output());
    }

    @Test
    void help_printsUsage() {
        assertEquals(Interpreter.HELP_TEXT, ok("help\n").output());
    }

    @Test
    void session_keepsStateAcrossRuns() {
        Interpreter session = new PaniniScript().newSession();
        session.run("x = 5");
        session.run("कार्य show():\n    दर्श(x)\n");
        assertEquals("5\n", session.run("show()").output());
        assertTrue(session.hasFunction("show"));
    }

    @Test
    void copy_isIndependent() {
        Interpreter a = new Interpreter();
        a.run("x = 1");
        Interpreter b = a.copy();
        b.run("x = 2");
        assertEquals(1.0, a.get("x").asNumber(), 1e-9);
        assertEquals(2.0, b.get("x").asNumber(), 1e-9);
    }

    @Test
    void callDepth_isBounded() {
        PaniniScript engine = new PaniniScript();
        engine.setMaxCallDepth(5);
        RunResult r = engine.run(
                "कार्य f():\n" +
                "    f()\n" +
                "f()\n"
        );
        assertEquals(List.of("Line 2: " + ScriptException.MSG_CALL_DEPTH), r.errors());
    }

    @Test
    void functionDefinition_runsWithDefaultLogSink() {
        RunResult r = assertDoesNotThrow(() -> new PaniniScript().run(
                "कार्य f():\n" +
                "    दर्श(1)\n" +
                "f()\n"
        ));
        assertEquals(List.of(), r.errors());
        assertEquals("1\n", r.output());
    }

    @Test
    void boundedRecursion_belowDefaultDepth() {
        RunResult r = ok(
                "कार्य f(n):\n" +
                "    यदि n > 0:\n" +
                "        f(n + -1)\n" +
                "    अन्यथा:\n" +
                "        दर्श(\"done\")\n" +
                "f(250)\n"
        );
        assertEquals("done\n", r.output());
    }

    @Test
    void hostStackOverflow_becomesCallError() {
        PaniniScript engine = new PaniniScript();
        engine.setMaxCallDepth(Integer.MAX_VALUE);
        RunResult r = assertDoesNotThrow(() -> engine.run(
                "कार्य f():\n" +
                "    f()\n" +
                "f()\n"
        ));
        assertFalse(r.errors().isEmpty());
        for (String e : r.errors()) assertTrue(e.endsWith(ScriptException.MSG_CALL_DEPTH), e);
    }

    @Test
    void forLoop_truncatesCountTowardZero() {
        assertEquals("0\n1\n", ok("परिभ्रमण i in परिधि(2.9):\n    दर्श(i)\n").output());
        assertEquals("", ok("परिभ्रमण i in परिधि(-1):\n    दर्श(i)\n").output());
        assertEquals("", ok("परिभ्रमण i in परिधि(0.5):\n    दर्श(i)\n").output());
    }

    @Test
    void help_isIndependentOfSessionState() {
        Interpreter session = new Interpreter();
        session.run("x = 5\nकार्य f(a):\n    दर्श(a)\nhelp = 3\n");
        RunResult r = session.run("help");
        assertEquals(List.of(), r.errors());
        assertEquals(Interpreter.HELP_TEXT, r.output());
    }

    @Test
    void nonFiniteLiterals() {
        assertEquals("inf\n-inf\nNaN\ninf\n",
                ok("दर्श(inf)\nदर्श(-Infinity)\nदर्श(nan)\nदर्श(inf + 1)\n").output());
    }

    @Test
    void setMaxCallDepth_rejectsZero() {
        assertThrows(IllegalArgumentException.class, () -> new PaniniScript().setMaxCallDepth(0));
    }
}
