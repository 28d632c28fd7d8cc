package com.panini.script.parser;

import java.util.List;

import com.panini.script.parser.Statement.Block;

/** A user function: parameter names and the parsed body. Immutable once defined. */
final class FunctionDef {
    final List<String> params;
    final Block body;

    FunctionDef(List<String> params, Block body) {
        this.params = List.copyOf(params);
        this.body = body;
    }

    int arity() { return params.size(); }
}
