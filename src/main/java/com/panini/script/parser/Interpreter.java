package com.panini.script.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.panini.debug.Debug;
import com.panini.script.parser.Statement.Block;
import com.panini.script.parser.Statement.For;
import com.panini.script.parser.Statement.FunctionStmt;
import com.panini.script.parser.Statement.If;
import com.panini.script.parser.Statement.InvalidStmt;
import com.panini.script.parser.Statement.SimpleStmt;
import com.panini.script.parser.Statement.Stmt;
import com.panini.script.parser.Statement.StmtVisitor;
import com.panini.script.parser.Statement.While;

/**
 * Execution context: one variable map and one function table.
 *
 * {@link #run(String)} never throws. Each failing statement adds a
 * "Line N: message" entry and execution continues with the next statement.
 *
 * A function call runs its body in a new context holding copies of the
 * caller's variables and functions plus the bound parameters; nothing the
 * callee assigns is visible to the caller afterwards. Not thread-safe: give
 * every concurrent user its own {@link #copy()}.
 */
public final class Interpreter implements StmtVisitor {

    private static final String TAG = "Interpreter";

    /** While-loop bodies run at most this many times per loop execution. */
    public static final int MAX_LOOP_ITERATIONS = 10_000;

    public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

    public static final String HELP_TEXT =
            "Paanini आज्ञाः (Python-रूपेण):\n"
            + "  x = 5\n"
            + "  नाम = \"नमस्ते\"\n"
            + "  दर्श(expr)\n"
            + "  यदि x == 5:\n"
            + "    दर्श(\"सत्यं\")\n"
            + "  अन्यथा:\n"
            + "    दर्श(\"असत्यं\")\n"
            + "  यावत् x < 5:\n"
            + "    दर्श(x)\n"
            + "    x = x + 1\n"
            + "  परिभ्रमण i in परिधि(5):\n"
            + "    दर्श(i)\n"
            + "  कार्य greet(नाम):\n"
            + "    दर्श(\"नमस्ते \" + नाम)\n"
            + "  greet(\"विश्व\")\n"
            + "  !! टिप्पण्यः\n";

    private final Map<String, Value> vars;
    private final Map<String, FunctionDef> functions;
    private final int maxCallDepth;
    private final int callDepth;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(this);

    // sink of the run in progress
    private RunResult.Collector out;

    public Interpreter() {
        this(DEFAULT_MAX_CALL_DEPTH);
    }

    public Interpreter(int maxCallDepth) {
        this(new HashMap<>(), new HashMap<>(), maxCallDepth, 0);
    }

    private Interpreter(Map<String, Value> vars, Map<String, FunctionDef> functions, int maxCallDepth, int callDepth) {
        this.vars = vars;
        this.functions = functions;
        this.maxCallDepth = maxCallDepth;
        this.callDepth = callDepth;
    }

    /** Independent duplicate of this context's variables and functions. */
    public Interpreter copy() {
        return new Interpreter(new HashMap<>(vars), new HashMap<>(functions), maxCallDepth, callDepth);
    }

    public RunResult run(String source) {
        RunResult.Collector collector = new RunResult.Collector();
        Block program = BlockParser.parse(source);
        RunResult.Collector previous = out;
        out = collector;
        try {
            executeBlock(program);
        } finally {
            out = previous;
        }
        return collector.toResult();
    }

    // ===================== CONTEXT ACCESS =====================

    /** Current value of a variable, or null when unbound. */
    public Value get(String name) {
        return vars.get(name);
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    // ===================== STATEMENTS =====================

    private void executeBlock(Block block) {
        for (Stmt stmt : block.statements) {
            try {
                stmt.accept(this);
            } catch (ScriptException e) {
                out.error(stmt.line(), e.getMessage());
            } catch (RuntimeException e) {
                Debug.get().e(TAG, "unexpected failure at line " + stmt.line(), e);
                out.error(stmt.line(), e.toString());
            }
        }
    }

    @Override
    public void visitBlockStmt(Block stmt) {
        executeBlock(stmt);
    }

    @Override
    public void visitSimpleStmt(SimpleStmt stmt) {
        String printed = execLine(stmt.text);
        if (printed != null) out.print(printed);
    }

    @Override
    public void visitIfStmt(If stmt) {
        if (evaluator.evaluateCondition(stmt.condition)) {
            executeBlock(stmt.thenBranch);
        } else if (stmt.elseBranch != null) {
            executeBlock(stmt.elseBranch);
        }
    }

    @Override
    public void visitWhileStmt(While stmt) {
        int guard = 0;
        while (guard < MAX_LOOP_ITERATIONS) {
            guard++;
            if (!evaluator.evaluateCondition(stmt.condition)) return;
            executeBlock(stmt.body);
        }
        Debug.get().d(TAG, "while loop at line " + stmt.line + " stopped after " + MAX_LOOP_ITERATIONS + " iterations");
    }

    @Override
    public void visitForStmt(For stmt) {
        Value count = evaluator.evaluate(stmt.count).orElse(null);
        if (count == null || !count.isNumber()) throw ScriptException.evaluation(ScriptException.MSG_RANGE_NUMBER);
        long n = (long) count.asNumber();
        for (long i = 0; i < n; i++) {
            vars.put(stmt.variable, Value.number(i));
            executeBlock(stmt.body);
        }
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        functions.put(stmt.name, new FunctionDef(stmt.params, stmt.body));
        Debug.get().t(TAG, "defined " + stmt.name + "/" + stmt.params.size());
    }

    @Override
    public void visitInvalidStmt(InvalidStmt stmt) {
        throw new ScriptException(stmt.error.kind(), stmt.error.getMessage());
    }

    /**
     * Assignment, print, bare call or help. Returns the text to print, or null.
     */
    private String execLine(String line) {
        int eq = TextScanner.indexOfTopLevel(line, "=");
        if (eq >= 0 && !isPartOfComparison(line, eq)) {
            String left = line.substring(0, eq).strip();
            String right = line.substring(eq + 1).strip();
            if (!TextScanner.isValidIdentifier(left)) throw ScriptException.syntax(ScriptException.MSG_BAD_ASSIGN_NAME);
            Value v = evaluator.evaluate(right)
                    .orElseThrow(() -> ScriptException.evaluation(ScriptException.MSG_EXPR_NOT_STORED + right));
            vars.put(left, v);
            return null;
        }

        if (Keywords.startsWith(line, Keywords.PRINT)) {
            String rest = Keywords.afterKeyword(line, Keywords.PRINT);
            if (!rest.startsWith("(") || !line.endsWith(")")) {
                throw ScriptException.syntax(ScriptException.MSG_PRINT_SYNTAX);
            }
            String inner = line.substring(line.indexOf('(') + 1, line.lastIndexOf(')'));
            return evaluator.evaluate(inner).orElse(Value.nil()).toString();
        }

        int lp = line.indexOf('(');
        if (lp > 0 && TextScanner.matchingParen(line, lp) == line.length() - 1) {
            String name = line.substring(0, lp).strip();
            if (TextScanner.isValidIdentifier(name)) {
                call(name, evaluator.evaluateArguments(line.substring(lp + 1, line.length() - 1)));
                return null;
            }
        }

        if (Keywords.HELP.equals(line)) return HELP_TEXT;

        throw ScriptException.syntax(ScriptException.MSG_UNKNOWN_COMMAND + line);
    }

    private static boolean isPartOfComparison(String line, int eq) {
        char before = eq > 0 ? line.charAt(eq - 1) : ' ';
        char after = eq + 1 < line.length() ? line.charAt(eq + 1) : ' ';
        return before == '=' || before == '>' || before == '<' || after == '=';
    }

    // ===================== CALLS =====================

    /**
     * Calls a builtin or user function with already evaluated arguments.
     * User functions always evaluate to Null.
     */
    Value call(String name, List<Value> args) {
        if (Keywords.RANGE.equals(name)) return range(args);
        if (Keywords.PRINT.equals(name)) throw ScriptException.syntax(ScriptException.MSG_PRINT_SYNTAX);

        FunctionDef def = functions.get(name);
        if (def == null) throw ScriptException.runtime(ScriptException.MSG_UNKNOWN_FUNCTION + name);
        if (def.arity() != args.size()) throw ScriptException.runtime(ScriptException.MSG_ARITY);
        if (callDepth >= maxCallDepth) {
            Debug.get().w(TAG, "call depth " + maxCallDepth + " exceeded calling " + name);
            throw ScriptException.runtime(ScriptException.MSG_CALL_DEPTH);
        }

        Interpreter callee = new Interpreter(new HashMap<>(vars), new HashMap<>(functions), maxCallDepth, callDepth + 1);
        for (int i = 0; i < def.params.size(); i++) {
            callee.vars.put(def.params.get(i), args.get(i));
        }
        callee.out = out;
        try {
            callee.executeBlock(def.body);
        } catch (StackOverflowError e) {
            // host stack ran out before maxCallDepth was reached
            throw ScriptException.runtime(ScriptException.MSG_CALL_DEPTH);
        }
        return Value.nil();
    }

    private static Value range(List<Value> args) {
        if (args.size() != 1) throw ScriptException.runtime(ScriptException.MSG_RANGE_ARITY);
        Value n = args.get(0);
        if (!n.isNumber()) throw ScriptException.evaluation(ScriptException.MSG_RANGE_NUMBER);
        long count = (long) n.asNumber();
        List<Value> items = new ArrayList<>();
        for (long i = 0; i < count; i++) items.add(Value.number(i));
        return Value.list(items);
    }
}
