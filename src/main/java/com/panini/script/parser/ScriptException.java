package com.panini.script.parser;

/**
 * Failure of a single statement. Thrown inside the evaluator and turned into a
 * "Line N: ..." entry at statement dispatch; never escapes {@link Interpreter#run}.
 */
public class ScriptException extends RuntimeException {

    public enum Kind {
        /** Missing or unbalanced block markers, missing parentheses. */
        STRUCTURAL,
        /** Invalid identifier, malformed call or iterable. */
        SYNTAX,
        /** Unparseable expression, wrong comparison operands. */
        EVALUATION,
        /** Unknown function, arity mismatch, call depth. */
        RUNTIME
    }

    // User-facing messages of the language.
    public static final String MSG_BAD_ASSIGN_NAME = "त्रुटिः: असाइनस्य नाम अवैधम्";
    public static final String MSG_EXPR_NOT_STORED = "त्रुटिः: अभिव्यक्ति न संगृहीता -> ";
    public static final String MSG_PRINT_SYNTAX = "त्रुटिः: दर्श प्रयोगः केवलं दर्श(expr) स्वरूपेण भवेत्";
    public static final String MSG_ARGS_NOT_EVALUATED = "त्रुटिः: तर्काः न संगृहीताः";
    public static final String MSG_UNKNOWN_COMMAND = "अज्ञाता आज्ञा: ";
    public static final String MSG_CONDITION_UNREADABLE = "त्रुटिः: यदि शर्ता अपठिता";
    public static final String MSG_CONDITION_NUMBERS_ONLY = "त्रुटिः: यदि शर्ते संख्यायाः तुलनाः एव समर्थिताः";
    public static final String MSG_CONDITION_INVALID = "त्रुटिः: यदि शर्ता अवैध";
    public static final String MSG_IF_PARENS = "त्रुटिः: यदि शर्ता ( ) मध्ये भवेत्";
    public static final String MSG_WHILE_PARENS = "त्रुटिः: यावत् शर्ता ( ) मध्ये भवेत्";
    public static final String MSG_ELSE_WITHOUT_IF = "त्रुटिः: अन्यथा यदि विना";
    public static final String MSG_FOR_FORM = "त्रुटिः: परिभ्रमण स्वरूपः: परिभ्रमण x in परिधि(n)";
    public static final String MSG_FOR_VAR = "त्रुटिः: परिभ्रमण चरः अवैधः";
    public static final String MSG_FOR_RANGE_PARENS = "त्रुटिः: परिभ्रमण परिधि( ) अपेक्षितम्";
    public static final String MSG_FOR_RANGE_ONLY = "त्रुटिः: परिभ्रमण केवलं परिधि(n) सह समर्थितम्";
    public static final String MSG_RANGE_NUMBER = "त्रुटिः: परिधि(n) मध्ये n संख्या भवेत्";
    public static final String MSG_RANGE_ARITY = "त्रुटिः: परिधि(n) एकः एव तर्कः";
    public static final String MSG_FUNC_OPEN_PAREN = "त्रुटिः: कार्य नामस्य अनन्तरं ( अपेक्षितम्";
    public static final String MSG_FUNC_CLOSE_PAREN = "त्रुटिः: कार्य तर्काणां ')' न लब्धम्";
    public static final String MSG_FUNC_NAME = "त्रुटिः: कार्य नाम अवैधम्";
    public static final String MSG_FUNC_PARAM = "त्रुटिः: कार्य तर्कस्य नाम अवैधम्";
    public static final String MSG_ARITY = "त्रुटिः: कार्य तर्कसंख्या न समा";
    public static final String MSG_UNKNOWN_FUNCTION = "त्रुटिः: अज्ञातः कार्यः: ";
    public static final String MSG_CALL_DEPTH = "त्रुटिः: कार्य आह्वान गभीरता अतिक्रान्ता";
    public static final String MSG_EXPECTED_OPEN = "त्रुटिः: अपेक्षितम् '{'";
    public static final String MSG_UNCLOSED_BLOCK = "त्रुटिः: '}' न लब्धम्";

    private final Kind kind;

    public ScriptException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    static ScriptException structural(String message) { return new ScriptException(Kind.STRUCTURAL, message); }
    static ScriptException syntax(String message) { return new ScriptException(Kind.SYNTAX, message); }
    static ScriptException evaluation(String message) { return new ScriptException(Kind.EVALUATION, message); }
    static ScriptException runtime(String message) { return new ScriptException(Kind.RUNTIME, message); }
}
