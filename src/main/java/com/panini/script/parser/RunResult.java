package com.panini.script.parser;

import java.util.ArrayList;
import java.util.List;

/** Printed output and the ordered error messages of one run. */
public final class RunResult {
    private final String output;
    private final List<String> errors;

    public RunResult(String output, List<String> errors) {
        this.output = output;
        this.errors = List.copyOf(errors);
    }

    public String output() { return output; }
    public List<String> errors() { return errors; }
    public boolean hasErrors() { return !errors.isEmpty(); }

    @Override
    public String toString() {
        return "RunResult{output=" + output + ", errors=" + errors + "}";
    }

    /** Accumulates output and errors across nested blocks and calls. */
    static final class Collector {
        private final StringBuilder output = new StringBuilder();
        private final List<String> errors = new ArrayList<>();

        void print(String text) {
            output.append(text);
            if (!text.endsWith("\n")) output.append('\n');
        }

        void error(int line, String message) {
            errors.add("Line " + line + ": " + message);
        }

        RunResult toResult() {
            return new RunResult(output.toString(), errors);
        }
    }
}
