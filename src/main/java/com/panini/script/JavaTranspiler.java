package com.panini.script;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;

import com.panini.script.parser.Keywords;
import com.panini.script.parser.TextScanner;

/**
 * Naive Panini to Java source rewriter used by the build command.
 *
 * Works line by line on the surface syntax and independently of the evaluator:
 * blocks become braces closed on dedent, functions become static methods,
 * the first assignment of a name becomes a {@code var} declaration. The
 * result is best effort: programs relying on dynamic scoping or on the
 * evaluator's number formatting will not behave the same.
 */
public final class JavaTranspiler {

    private static final String INDENT = "    ";

    private static final class Frame {
        final int indent;
        final boolean function;
        Frame(int indent, boolean function) {
            this.indent = indent;
            this.function = function;
        }
    }

    private final StringBuilder main = new StringBuilder();
    private final StringBuilder methods = new StringBuilder();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Set<String> declaredInMain = new HashSet<>();
    private final Set<String> declaredInMethod = new HashSet<>();

    private JavaTranspiler() {}

    public static String transpile(String source, String className) {
        if (!TextScanner.isValidIdentifier(className) || Character.isDigit(className.charAt(0))) {
            throw new IllegalArgumentException("Invalid class name: " + className);
        }
        JavaTranspiler t = new JavaTranspiler();
        for (String line : (Iterable<String>) source.lines()::iterator) {
            t.line(line.replace("\t", "  "));
        }
        t.closeTo(-1, false);

        StringBuilder sb = new StringBuilder();
        sb.append("public class ").append(className).append(" {\n");
        sb.append(INDENT).append("public static void main(String[] args) {\n");
        sb.append(t.main);
        sb.append(INDENT).append("}\n");
        sb.append(t.methods);
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Compiles a generated source file with the system Java compiler.
     *
     * @return compiler diagnostics, empty on success
     * @throws IllegalStateException when the running JVM has no compiler
     */
    public static String compile(Path javaFile, Path outputDir) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) throw new IllegalStateException("No Java compiler available (running on a JRE?)");
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int rc = compiler.run(null, null, new PrintStream(err, true, StandardCharsets.UTF_8),
                "-encoding", "UTF-8", "-d", outputDir.toString(), javaFile.toString());
        String diagnostics = err.toString(StandardCharsets.UTF_8);
        return rc == 0 ? "" : (diagnostics.isEmpty() ? "javac exited with " + rc : diagnostics);
    }

    private void line(String raw) {
        String trimmed = raw.strip();
        if (Keywords.isBlankOrComment(trimmed)) return;
        int indent = 0;
        while (indent < raw.length() && raw.charAt(indent) == ' ') indent++;

        boolean isElse = Keywords.startsWith(trimmed, Keywords.ELSE);
        closeTo(indent, isElse);
        if (isElse) {
            emit("} else {");
            frames.push(new Frame(indent, false));
            return;
        }

        String stmt = trimmed.endsWith(":") ? trimmed.substring(0, trimmed.length() - 1).strip() : trimmed;
        if (Keywords.startsWith(stmt, Keywords.IF)) {
            emit("if (" + unwrap(Keywords.afterKeyword(stmt, Keywords.IF)) + ") {");
            frames.push(new Frame(indent, false));
        } else if (Keywords.startsWith(stmt, Keywords.WHILE)) {
            emit("while (" + unwrap(Keywords.afterKeyword(stmt, Keywords.WHILE)) + ") {");
            frames.push(new Frame(indent, false));
        } else if (Keywords.startsWith(stmt, Keywords.FOR)) {
            forLoop(stmt, indent);
        } else if (Keywords.startsWith(stmt, Keywords.FUNCTION)) {
            function(stmt, indent);
        } else {
            emit(simple(stmt));
        }
    }

    private void forLoop(String stmt, int indent) {
        String rest = Keywords.afterKeyword(stmt, Keywords.FOR);
        int in = rest.indexOf(" " + Keywords.IN + " ");
        if (in < 0) {
            emit("// unsupported: " + stmt);
            return;
        }
        String var = rest.substring(0, in).strip();
        String iterable = rest.substring(in + Keywords.IN.length() + 2).strip();
        int lp = iterable.indexOf('(');
        int rp = iterable.lastIndexOf(')');
        String count = (lp >= 0 && rp > lp) ? expression(iterable.substring(lp + 1, rp)) : "0";
        emit("for (double " + var + " = 0; " + var + " < " + count + "; " + var + "++) {");
        frames.push(new Frame(indent, false));
    }

    private void function(String stmt, int indent) {
        String rest = Keywords.afterKeyword(stmt, Keywords.FUNCTION);
        int lp = rest.indexOf('(');
        int rp = rest.lastIndexOf(')');
        if (lp < 0 || rp < lp) {
            emit("// unsupported: " + stmt);
            return;
        }
        StringBuilder params = new StringBuilder();
        declaredInMethod.clear();
        for (String p : TextScanner.splitTopLevel(rest.substring(lp + 1, rp), ',')) {
            if (params.length() > 0) params.append(", ");
            params.append("Object ").append(p);
            declaredInMethod.add(p);
        }
        frames.push(new Frame(indent, true));
        methods.append('\n').append(INDENT).append("static void ").append(rest.substring(0, lp).strip())
                .append('(').append(params).append(") {\n");
    }

    private String simple(String stmt) {
        int eq = TextScanner.indexOfTopLevel(stmt, "=");
        if (eq > 0 && stmt.charAt(eq - 1) != '=' && stmt.charAt(eq - 1) != '<' && stmt.charAt(eq - 1) != '>'
                && (eq + 1 >= stmt.length() || stmt.charAt(eq + 1) != '=')) {
            String name = stmt.substring(0, eq).strip();
            String value = expression(stmt.substring(eq + 1));
            Set<String> declared = inFunction() ? declaredInMethod : declaredInMain;
            return declared.add(name) ? "var " + name + " = " + value + ";" : name + " = " + value + ";";
        }
        if (Keywords.startsWith(stmt, Keywords.PRINT)) {
            int lp = stmt.indexOf('(');
            int rp = stmt.lastIndexOf(')');
            if (lp >= 0 && rp > lp) return "System.out.println(" + expression(stmt.substring(lp + 1, rp)) + ");";
        }
        if (Keywords.HELP.equals(stmt)) return "// help";
        if (stmt.endsWith(")")) return expression(stmt) + ";";
        return "// unsupported: " + stmt;
    }

    /** Rewrites boolean words outside string literals. */
    static String expression(String expr) {
        String s = expr.strip();
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"') {
                int end = s.indexOf('"', i + 1);
                end = end < 0 ? s.length() : end + 1;
                sb.append(s, i, end);
                i = end;
            } else if (TextScanner.isIdentifierChar(c)) {
                int end = i;
                while (end < s.length() && TextScanner.isIdentifierChar(s.charAt(end))) end++;
                String word = s.substring(i, end);
                if (Keywords.TRUE.equals(word)) sb.append("true");
                else if (Keywords.FALSE.equals(word)) sb.append("false");
                else sb.append(word);
                i = end;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static String unwrap(String condition) {
        String c = expression(condition);
        return TextScanner.isWrappedInParens(c) ? c.substring(1, c.length() - 1) : c;
    }

    // closes every block opened at or deeper than indent; an else keeps its if open
    private void closeTo(int indent, boolean forElse) {
        while (!frames.isEmpty() && frames.peek().indent >= indent) {
            if (forElse && frames.peek().indent == indent) {
                frames.pop();
                return;
            }
            Frame f = frames.pop();
            if (f.function) {
                methods.append(INDENT).append("}\n");
            } else {
                emit("}");
            }
        }
    }

    private boolean inFunction() {
        for (Frame f : frames) {
            if (f.function) return true;
        }
        return false;
    }

    private void emit(String code) {
        StringBuilder target = inFunction() ? methods : main;
        int depth = 2;
        for (Frame f : frames) {
            if (!f.function) depth++;
        }
        target.append(INDENT.repeat(depth)).append(code).append('\n');
    }
}
