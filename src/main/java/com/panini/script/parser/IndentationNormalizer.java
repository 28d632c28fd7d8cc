package com.panini.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rewrites indentation-based source into explicit block form.
 *
 * An indented line directly after a line ending in ':' is preceded by an open
 * marker line, and every dedent emits one close marker line per level left.
 * Header lines lose their trailing ':'; bare if/while conditions are wrapped
 * in parentheses and an else header becomes the bare keyword. Explicit braces
 * written in the source are split onto their own lines, and a statement
 * written after a header colon on the same line becomes a one-line block.
 *
 * Blank and comment lines pass through and never affect the indentation
 * stack. Inconsistent indentation is not an error; it only changes how lines
 * are grouped.
 */
public final class IndentationNormalizer {

    private static final String TAB_AS_SPACES = "  ";

    public static List<SourceLine> normalize(String source) {
        List<SourceLine> out = new ArrayList<>();
        Deque<Integer> indents = new ArrayDeque<>();
        indents.push(0);
        boolean prevEndedColon = false;
        int lineNo = 0;

        for (String orig : (Iterable<String>) source.lines()::iterator) {
            lineNo++;
            String raw = orig.replace("\t", TAB_AS_SPACES);
            String trimmed = raw.strip();
            if (Keywords.isBlankOrComment(trimmed)) {
                out.add(new SourceLine(lineNo, trimmed));
                continue;
            }

            int indent = leadingSpaces(raw);
            int current = indents.peek();
            if (indent > current) {
                if (prevEndedColon) {
                    out.add(new SourceLine(lineNo, Keywords.OPEN_BLOCK));
                    indents.push(indent);
                }
            } else if (indent < current) {
                while (indent < indents.peek()) {
                    indents.pop();
                    out.add(new SourceLine(lineNo, Keywords.CLOSE_BLOCK));
                }
            }

            boolean endedColon = false;
            for (String piece : splitBraces(trimmed)) {
                if (Keywords.OPEN_BLOCK.equals(piece) || Keywords.CLOSE_BLOCK.equals(piece)) {
                    out.add(new SourceLine(lineNo, piece));
                    endedColon = false;
                } else {
                    endedColon = emitStatement(out, lineNo, piece);
                }
            }
            prevEndedColon = endedColon;
        }

        while (indents.size() > 1) {
            indents.pop();
            out.add(new SourceLine(lineNo, Keywords.CLOSE_BLOCK));
        }
        return out;
    }

    /** Renders normalized lines back to text, one per line. */
    public static String render(List<SourceLine> lines) {
        StringBuilder sb = new StringBuilder();
        for (SourceLine l : lines) sb.append(l.text).append('\n');
        return sb.toString();
    }

    /** Returns true when the piece was a header ending in ':' (a block is expected on the next lines). */
    private static boolean emitStatement(List<SourceLine> out, int lineNo, String piece) {
        if (piece.endsWith(":")) {
            String header = piece.substring(0, piece.length() - 1).strip();
            out.add(new SourceLine(lineNo, isBlockHeader(header) ? canonicalHeader(header) : header));
            return true;
        }
        if (isBlockHeader(piece)) {
            int colon = TextScanner.indexOfTopLevel(piece, ":");
            if (colon > 0) {
                String body = piece.substring(colon + 1).strip();
                out.add(new SourceLine(lineNo, canonicalHeader(piece.substring(0, colon).strip())));
                out.add(new SourceLine(lineNo, Keywords.OPEN_BLOCK));
                if (!body.isEmpty()) out.add(new SourceLine(lineNo, body));
                out.add(new SourceLine(lineNo, Keywords.CLOSE_BLOCK));
            } else {
                out.add(new SourceLine(lineNo, canonicalHeader(piece)));
            }
            return false;
        }
        out.add(new SourceLine(lineNo, piece));
        return false;
    }

    static boolean isBlockHeader(String line) {
        return Keywords.startsWith(line, Keywords.IF)
                || Keywords.startsWith(line, Keywords.ELSE)
                || Keywords.startsWith(line, Keywords.WHILE)
                || Keywords.startsWith(line, Keywords.FOR)
                || Keywords.startsWith(line, Keywords.FUNCTION);
    }

    private static String canonicalHeader(String header) {
        if (Keywords.startsWith(header, Keywords.ELSE)) return Keywords.ELSE;
        if (Keywords.startsWith(header, Keywords.IF)) return wrapCondition(header, Keywords.IF);
        if (Keywords.startsWith(header, Keywords.WHILE)) return wrapCondition(header, Keywords.WHILE);
        return header;
    }

    private static String wrapCondition(String header, String keyword) {
        String condition = Keywords.afterKeyword(header, keyword);
        if (TextScanner.isWrappedInParens(condition)) return keyword + " " + condition;
        return keyword + " (" + condition + ")";
    }

    /** Splits a line around '{' and '}' that are outside string literals. */
    static List<String> splitBraces(String line) {
        List<String> pieces = new ArrayList<>();
        int start = 0;
        int i = nextBrace(line, 0);
        while (i >= 0) {
            String before = line.substring(start, i).strip();
            if (!before.isEmpty()) pieces.add(before);
            pieces.add(String.valueOf(line.charAt(i)));
            start = i + 1;
            i = nextBrace(line, start);
        }
        String rest = line.substring(start).strip();
        if (!rest.isEmpty()) pieces.add(rest);
        return pieces;
    }

    private static int nextBrace(String line, int from) {
        int open = TextScanner.indexOfOutsideString(line, '{', from);
        int close = TextScanner.indexOfOutsideString(line, '}', from);
        if (open < 0) return close;
        if (close < 0) return open;
        return Math.min(open, close);
    }

    private static int leadingSpaces(String raw) {
        int n = 0;
        while (n < raw.length() && raw.charAt(n) == ' ') n++;
        return n;
    }

    private IndentationNormalizer() {}
}
