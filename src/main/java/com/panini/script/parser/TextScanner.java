package com.panini.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Quote- and parenthesis-aware searching over raw statement text.
 *
 * A position is "top level" when it is outside any double-quoted string
 * literal and at parenthesis depth zero. Unbalanced closing parentheses never
 * drive the depth below zero. Parentheses themselves are never reported as
 * matches.
 */
public final class TextScanner {

    private static final char QUOTE = '"';

    /** First top-level occurrence of {@code token}, or -1. */
    public static int indexOfTopLevel(String s, String token) {
        return indexOfTopLevel(s, token, 0);
    }

    /** First top-level occurrence of {@code token} starting at or after {@code from}, or -1. */
    public static int indexOfTopLevel(String s, String token, int from) {
        boolean inString = false;
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == QUOTE) {
                inString = !inString;
                continue;
            }
            if (inString) continue;
            if (c == '(') {
                depth++;
                continue;
            }
            if (c == ')') {
                if (depth > 0) depth--;
                continue;
            }
            if (depth == 0 && i >= from && s.startsWith(token, i)) return i;
        }
        return -1;
    }

    /** Last top-level occurrence of {@code token} whose index passes {@code accept}, or -1. */
    public static int lastIndexOfTopLevel(String s, String token, IntPredicate accept) {
        int last = -1;
        int idx = indexOfTopLevel(s, token, 0);
        while (idx >= 0) {
            if (accept.test(idx)) last = idx;
            idx = indexOfTopLevel(s, token, idx + 1);
        }
        return last;
    }

    /**
     * Splits on top-level occurrences of {@code delimiter}. Parts are trimmed
     * and empty parts dropped, so "" and "a, ,b" give [] and [a, b].
     */
    public static List<String> splitTopLevel(String s, char delimiter) {
        List<String> parts = new ArrayList<>();
        String token = String.valueOf(delimiter);
        int start = 0;
        int idx = indexOfTopLevel(s, token, 0);
        while (idx >= 0) {
            addIfNotEmpty(parts, s.substring(start, idx));
            start = idx + 1;
            idx = indexOfTopLevel(s, token, start);
        }
        addIfNotEmpty(parts, s.substring(start));
        return parts;
    }

    private static void addIfNotEmpty(List<String> parts, String part) {
        String p = part.trim();
        if (!p.isEmpty()) parts.add(p);
    }

    /** Index of the ')' matching the '(' at {@code open}, skipping string literals; -1 if unmatched. */
    public static int matchingParen(String s, int open) {
        if (open < 0 || open >= s.length() || s.charAt(open) != '(') return -1;
        boolean inString = false;
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == QUOTE) {
                inString = !inString;
                continue;
            }
            if (inString) continue;
            if (c == '(') depth++;
            if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /** True when the whole of {@code s} is one parenthesized group: "(a) + (b)" is not. */
    public static boolean isWrappedInParens(String s) {
        return !s.isEmpty() && s.charAt(0) == '(' && matchingParen(s, 0) == s.length() - 1;
    }

    /** True when {@code s} is exactly one string literal: "\"a\" + \"b\"" is not. */
    public static boolean isStringLiteral(String s) {
        return s.length() >= 2 && s.charAt(0) == QUOTE && s.indexOf(QUOTE, 1) == s.length() - 1;
    }

    /** Index of the first top-level occurrence of a character outside strings, ignoring depth. */
    public static int indexOfOutsideString(String s, char target, int from) {
        boolean inString = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == QUOTE) {
                inString = !inString;
                continue;
            }
            if (!inString && i >= from && c == target) return i;
        }
        return -1;
    }

    public static boolean isIdentifierChar(int cp) {
        return cp > 127 || cp == '_' || Character.isLetterOrDigit(cp);
    }

    /** One or more characters, each alphanumeric, underscore or non-ASCII. */
    public static boolean isValidIdentifier(String s) {
        if (s == null || s.isEmpty()) return false;
        return s.codePoints().allMatch(TextScanner::isIdentifierChar);
    }

    private TextScanner() {}
}
