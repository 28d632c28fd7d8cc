package com.panini.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evaluates expression and condition text directly, without tokenizing.
 *
 * Expression forms, tried in order: empty (Null), one fully enclosing pair of
 * parentheses, string literal, boolean word, call, number, top-level '+',
 * variable. Text matching none of them evaluates to {@link Optional#empty()}.
 */
public final class ExpressionEvaluator {

    private static final Pattern NUMBER =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** Non-finite literals: inf, infinity, nan, any case, optional sign. */
    private static final Pattern SPECIAL_NUMBER =
            Pattern.compile("[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    /** Comparison operators in the order they are searched for. */
    private static final String[] COMPARISONS = { "==", "!=", ">=", "<=", ">", "<" };

    private final Interpreter context;

    ExpressionEvaluator(Interpreter context) {
        this.context = context;
    }

    public Optional<Value> evaluate(String expr) {
        String s = expr.strip();
        if (s.isEmpty()) return Optional.of(Value.nil());

        if (TextScanner.isWrappedInParens(s)) return evaluate(s.substring(1, s.length() - 1));
        if (TextScanner.isStringLiteral(s)) return Optional.of(Value.string(s.substring(1, s.length() - 1)));
        if (Keywords.TRUE.equals(s)) return Optional.of(Value.bool(true));
        if (Keywords.FALSE.equals(s)) return Optional.of(Value.bool(false));

        int lp = s.indexOf('(');
        if (lp > 0 && TextScanner.matchingParen(s, lp) == s.length() - 1) {
            String name = s.substring(0, lp).strip();
            if (TextScanner.isValidIdentifier(name)) {
                List<Value> args = evaluateArguments(s.substring(lp + 1, s.length() - 1));
                return Optional.of(context.call(name, args));
            }
        }

        if (NUMBER.matcher(s).matches()) return Optional.of(Value.number(Double.parseDouble(s)));
        if (SPECIAL_NUMBER.matcher(s).matches()) return Optional.of(Value.number(parseSpecial(s)));

        int plus = lastPlus(s);
        if (plus >= 0) {
            Optional<Value> left = evaluate(s.substring(0, plus));
            if (left.isEmpty()) return Optional.empty();
            Optional<Value> right = evaluate(s.substring(plus + 1));
            if (right.isEmpty()) return Optional.empty();
            return add(left.get(), right.get());
        }

        if (TextScanner.isValidIdentifier(s)) return Optional.ofNullable(context.get(s));
        return Optional.empty();
    }

    /**
     * Evaluates a comma-separated argument list in the current context.
     *
     * @throws ScriptException EVALUATION when any argument has no value
     */
    public List<Value> evaluateArguments(String argsText) {
        List<Value> values = new ArrayList<>();
        for (String arg : TextScanner.splitTopLevel(argsText, ',')) {
            Optional<Value> v = evaluate(arg);
            if (v.isEmpty()) throw ScriptException.evaluation(ScriptException.MSG_ARGS_NOT_EVALUATED);
            values.add(v.get());
        }
        return values;
    }

    /**
     * Evaluates a numeric comparison. The first operator found (in the order
     * == != >= <= > <) splits the condition.
     *
     * @throws ScriptException EVALUATION for a missing operator, an operand
     *         without a value, or a non-number operand
     */
    public boolean evaluateCondition(String cond) {
        for (String op : COMPARISONS) {
            int p = TextScanner.indexOfTopLevel(cond, op);
            if (p < 0) continue;

            Value lv = evaluate(cond.substring(0, p))
                    .orElseThrow(() -> ScriptException.evaluation(ScriptException.MSG_CONDITION_UNREADABLE));
            Value rv = evaluate(cond.substring(p + op.length()))
                    .orElseThrow(() -> ScriptException.evaluation(ScriptException.MSG_CONDITION_UNREADABLE));
            if (!lv.isNumber() || !rv.isNumber()) {
                throw ScriptException.evaluation(ScriptException.MSG_CONDITION_NUMBERS_ONLY);
            }
            double a = lv.asNumber();
            double b = rv.asNumber();
            switch (op) {
                case "==": return a == b;
                case "!=": return a != b;
                case ">=": return a >= b;
                case "<=": return a <= b;
                case ">":  return a > b;
                default:   return a < b;
            }
        }
        throw ScriptException.evaluation(ScriptException.MSG_CONDITION_INVALID);
    }

    private static double parseSpecial(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.endsWith("nan")) return Double.NaN;
        return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }

    private static Optional<Value> add(Value l, Value r) {
        if (l.isNumber() && r.isNumber()) return Optional.of(Value.number(l.asNumber() + r.asNumber()));
        if (l.isString() || r.isString()) return Optional.of(Value.string(l.toString() + r.toString()));
        return Optional.empty();
    }

    /** Last top-level '+' that is a binary operator, so a + b + c groups as (a + b) + c. */
    private static int lastPlus(String s) {
        return TextScanner.lastIndexOfTopLevel(s, "+", i -> !isExponentSign(s, i) && !isUnarySign(s, i));
    }

    // 1e+5: digits, 'e', '+', digit, not preceded by an identifier character
    private static boolean isExponentSign(String s, int i) {
        if (i < 2 || i + 1 >= s.length()) return false;
        char e = s.charAt(i - 1);
        if ((e != 'e' && e != 'E') || !Character.isDigit(s.charAt(i + 1))) return false;
        int j = i - 2;
        while (j >= 0 && (Character.isDigit(s.charAt(j)) || s.charAt(j) == '.')) j--;
        if (j == i - 2) return false;
        return j < 0 || !TextScanner.isIdentifierChar(s.charAt(j));
    }

    private static boolean isUnarySign(String s, int i) {
        int j = i - 1;
        while (j >= 0 && Character.isWhitespace(s.charAt(j))) j--;
        return j < 0 || s.charAt(j) == '+';
    }
}
