package com.panini.script.parser;

/** Reserved words of the surface syntax. */
public final class Keywords {

    public static final String IF = "यदि";
    public static final String ELSE = "अन्यथा";
    public static final String WHILE = "यावत्";
    public static final String FOR = "परिभ्रमण";
    public static final String FUNCTION = "कार्य";
    public static final String PRINT = "दर्श";
    public static final String RANGE = "परिधि";
    public static final String TRUE = "सत्य";
    public static final String FALSE = "असत्य";
    public static final String IN = "in";
    public static final String HELP = "help";

    public static final String OPEN_BLOCK = "{";
    public static final String CLOSE_BLOCK = "}";

    /**
     * True when {@code line} begins with {@code keyword} and the keyword is not
     * just the prefix of a longer identifier.
     */
    public static boolean startsWith(String line, String keyword) {
        if (!line.startsWith(keyword)) return false;
        if (line.length() == keyword.length()) return true;
        int next = line.codePointAt(keyword.length());
        return !TextScanner.isIdentifierChar(next);
    }

    /** Text following the keyword, leading whitespace removed. */
    public static String afterKeyword(String line, String keyword) {
        return line.substring(keyword.length()).trim();
    }

    public static boolean isComment(String trimmed) {
        return trimmed.startsWith("!!") || trimmed.startsWith("#");
    }

    public static boolean isBlankOrComment(String trimmed) {
        return trimmed.isEmpty() || isComment(trimmed);
    }

    private Keywords() {}
}
