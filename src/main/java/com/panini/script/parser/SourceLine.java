package com.panini.script.parser;

/** One normalized line together with the 1-based source line it came from. */
public final class SourceLine {
    public final int number;
    public final String text;

    public SourceLine(int number, String text) {
        this.number = number;
        this.text = text;
    }

    public boolean isOpen() { return Keywords.OPEN_BLOCK.equals(text); }
    public boolean isClose() { return Keywords.CLOSE_BLOCK.equals(text); }
    public boolean isBlankOrComment() { return Keywords.isBlankOrComment(text); }

    @Override
    public String toString() {
        return number + ": " + text;
    }
}
