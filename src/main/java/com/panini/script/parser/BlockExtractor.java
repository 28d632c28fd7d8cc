package com.panini.script.parser;

import java.util.List;

/**
 * Finds the explicit block belonging to a compound statement header.
 */
public final class BlockExtractor {

    /** Body lines of one block and how many lines (header through close marker) it spans. */
    public static final class Extraction {
        public final List<SourceLine> body;
        public final int consumed;

        Extraction(List<SourceLine> body, int consumed) {
            this.body = body;
            this.consumed = consumed;
        }
    }

    /**
     * Extracts the first block opened after the header at {@code start}. Only
     * blank and comment lines may sit between the header and the open marker.
     * Close markers are matched by depth, so the body may contain nested blocks.
     *
     * @throws ScriptException STRUCTURAL when no open marker follows or it is never closed
     */
    public static Extraction extract(List<SourceLine> lines, int start) {
        int open = findOpen(lines, start);
        if (open < 0) throw ScriptException.structural(ScriptException.MSG_EXPECTED_OPEN);
        int close = findClose(lines, open);
        if (close < 0) throw ScriptException.structural(ScriptException.MSG_UNCLOSED_BLOCK);
        return new Extraction(lines.subList(open + 1, close), close + 1 - start);
    }

    /** Lines spanned by the header at {@code start} and its block, or 1 when there is no complete block. */
    public static int span(List<SourceLine> lines, int start) {
        int open = findOpen(lines, start);
        int close = open < 0 ? -1 : findClose(lines, open);
        return close < 0 ? 1 : close + 1 - start;
    }

    private static int findOpen(List<SourceLine> lines, int start) {
        int i = start + 1;
        while (i < lines.size() && lines.get(i).isBlankOrComment()) i++;
        return (i < lines.size() && lines.get(i).isOpen()) ? i : -1;
    }

    private static int findClose(List<SourceLine> lines, int open) {
        int depth = 0;
        for (int i = open; i < lines.size(); i++) {
            SourceLine l = lines.get(i);
            if (l.isOpen()) {
                depth++;
            } else if (l.isClose() && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private BlockExtractor() {}
}
