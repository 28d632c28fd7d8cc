package com.panini.script;

import com.panini.script.parser.Interpreter;
import com.panini.script.parser.RunResult;

/**
 * Panini engine.
 *
 * - Python-like indentation, Sanskrit keywords (यदि / अन्यथा / यावत् / परिभ्रमण / कार्य / दर्श)
 * - Types: number (double), string, bool, list, null
 * - Resilient: a failing statement is reported and the next one runs
 * - Functions: dynamic scoping by copy, no return values
 *
 * A session is one long-lived {@link Interpreter}; {@link #run(String)} is a
 * one-shot run on a fresh session.
 */
public class PaniniScript {

    public static final String VERSION = "0.1.0";

    private int maxCallDepth = Interpreter.DEFAULT_MAX_CALL_DEPTH;

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1, got " + depth);
        this.maxCallDepth = depth;
    }

    /** New empty context configured with this engine's settings. */
    public Interpreter newSession() {
        return new Interpreter(maxCallDepth);
    }

    public RunResult run(String source) {
        return newSession().run(source);
    }
}
