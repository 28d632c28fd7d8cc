package com.panini.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.panini.script.parser.BlockExtractor.Extraction;
import com.panini.script.parser.Statement.Block;
import com.panini.script.parser.Statement.For;
import com.panini.script.parser.Statement.FunctionStmt;
import com.panini.script.parser.Statement.If;
import com.panini.script.parser.Statement.InvalidStmt;
import com.panini.script.parser.Statement.SimpleStmt;
import com.panini.script.parser.Statement.Stmt;
import com.panini.script.parser.Statement.While;

/**
 * Groups normalized lines into statements, extracting every compound
 * statement's block once so loops and calls can re-run it without rescanning.
 *
 * A header that cannot be parsed becomes an {@link InvalidStmt} spanning its
 * block when the block itself could be found, otherwise spanning the header
 * line alone.
 */
public final class BlockParser {

    private final List<SourceLine> lines;
    private final List<Stmt> statements = new ArrayList<>();

    private BlockParser(List<SourceLine> lines) {
        this.lines = lines;
    }

    public static Block parse(List<SourceLine> lines) {
        int first = lines.isEmpty() ? 1 : lines.get(0).number;
        BlockParser p = new BlockParser(lines);
        p.parseAll();
        return new Block(first, p.statements);
    }

    public static Block parse(String source) {
        return parse(IndentationNormalizer.normalize(source));
    }

    private void parseAll() {
        int i = 0;
        while (i < lines.size()) {
            SourceLine l = lines.get(i);
            String text = l.text.strip();
            if (Keywords.isBlankOrComment(text)) {
                i++;
            } else if (Keywords.startsWith(text, Keywords.IF)) {
                i += parseIf(i, text);
            } else if (Keywords.startsWith(text, Keywords.ELSE)) {
                i += invalidWithBlock(i, ScriptException.structural(ScriptException.MSG_ELSE_WITHOUT_IF));
            } else if (Keywords.startsWith(text, Keywords.WHILE)) {
                i += parseWhile(i, text);
            } else if (Keywords.startsWith(text, Keywords.FOR)) {
                i += parseFor(i, text);
            } else if (Keywords.startsWith(text, Keywords.FUNCTION)) {
                i += parseFunction(i, text);
            } else {
                statements.add(new SimpleStmt(l.number, text));
                i++;
            }
        }
    }

    private int parseIf(int start, String header) {
        int line = lines.get(start).number;
        Extraction then;
        try {
            then = BlockExtractor.extract(lines, start);
        } catch (ScriptException e) {
            return invalid(line, e, 1);
        }

        int consumed = then.consumed;
        Block elseBlock = null;
        int j = start + then.consumed;
        while (j < lines.size() && lines.get(j).isBlankOrComment()) j++;
        if (j < lines.size() && Keywords.startsWith(lines.get(j).text.strip(), Keywords.ELSE)) {
            try {
                Extraction otherwise = BlockExtractor.extract(lines, j);
                elseBlock = parse(otherwise.body);
                consumed = j + otherwise.consumed - start;
            } catch (ScriptException e) {
                return invalid(line, e, j + 1 - start);
            }
        }

        try {
            String condition = condition(header, Keywords.IF, ScriptException.MSG_IF_PARENS);
            statements.add(new If(line, condition, parse(then.body), elseBlock));
        } catch (ScriptException e) {
            statements.add(new InvalidStmt(line, e));
        }
        return consumed;
    }

    private int parseWhile(int start, String header) {
        int line = lines.get(start).number;
        Extraction body;
        try {
            body = BlockExtractor.extract(lines, start);
        } catch (ScriptException e) {
            return invalid(line, e, 1);
        }
        try {
            String condition = condition(header, Keywords.WHILE, ScriptException.MSG_WHILE_PARENS);
            statements.add(new While(line, condition, parse(body.body)));
        } catch (ScriptException e) {
            statements.add(new InvalidStmt(line, e));
        }
        return body.consumed;
    }

    // परिभ्रमण x in परिधि(n)
    private int parseFor(int start, String header) {
        int line = lines.get(start).number;
        Extraction body;
        try {
            body = BlockExtractor.extract(lines, start);
        } catch (ScriptException e) {
            return invalid(line, e, 1);
        }
        try {
            String afterKw = Keywords.afterKeyword(header, Keywords.FOR);
            int in = afterKw.indexOf(" " + Keywords.IN + " ");
            if (in < 0) throw ScriptException.syntax(ScriptException.MSG_FOR_FORM);
            String var = afterKw.substring(0, in).strip();
            if (!TextScanner.isValidIdentifier(var)) throw ScriptException.syntax(ScriptException.MSG_FOR_VAR);

            String iterable = afterKw.substring(in + Keywords.IN.length() + 2).strip();
            int lp = iterable.indexOf('(');
            int rp = iterable.lastIndexOf(')');
            if (lp < 0 || rp < lp) throw ScriptException.syntax(ScriptException.MSG_FOR_RANGE_PARENS);
            if (!Keywords.RANGE.equals(iterable.substring(0, lp).strip())) {
                throw ScriptException.syntax(ScriptException.MSG_FOR_RANGE_ONLY);
            }
            String count = iterable.substring(lp + 1, rp).strip();
            statements.add(new For(line, var, count, parse(body.body)));
        } catch (ScriptException e) {
            statements.add(new InvalidStmt(line, e));
        }
        return body.consumed;
    }

    // कार्य name(a, b)
    private int parseFunction(int start, String header) {
        int line = lines.get(start).number;
        Extraction body;
        try {
            body = BlockExtractor.extract(lines, start);
        } catch (ScriptException e) {
            return invalid(line, e, 1);
        }
        try {
            String rest = Keywords.afterKeyword(header, Keywords.FUNCTION);
            int lp = rest.indexOf('(');
            if (lp < 0) throw ScriptException.syntax(ScriptException.MSG_FUNC_OPEN_PAREN);
            int rp = rest.lastIndexOf(')');
            if (rp < lp) throw ScriptException.syntax(ScriptException.MSG_FUNC_CLOSE_PAREN);
            String name = rest.substring(0, lp).strip();
            if (!TextScanner.isValidIdentifier(name)) throw ScriptException.syntax(ScriptException.MSG_FUNC_NAME);

            String paramText = rest.substring(lp + 1, rp);
            List<String> params = new ArrayList<>();
            if (!paramText.isBlank()) {
                for (String p : paramText.split(",", -1)) {
                    String param = p.strip();
                    if (!TextScanner.isValidIdentifier(param)) {
                        throw ScriptException.syntax(ScriptException.MSG_FUNC_PARAM);
                    }
                    params.add(param);
                }
            }
            statements.add(new FunctionStmt(line, name, List.copyOf(params), parse(body.body)));
        } catch (ScriptException e) {
            statements.add(new InvalidStmt(line, e));
        }
        return body.consumed;
    }

    /** Condition text inside the parentheses that follow {@code keyword}. */
    private static String condition(String header, String keyword, String message) {
        String rest = Keywords.afterKeyword(header, keyword);
        if (!TextScanner.isWrappedInParens(rest)) throw ScriptException.structural(message);
        return rest.substring(1, rest.length() - 1);
    }

    private int invalidWithBlock(int start, ScriptException error) {
        return invalid(lines.get(start).number, error, BlockExtractor.span(lines, start));
    }

    private int invalid(int line, ScriptException error, int consumed) {
        statements.add(new InvalidStmt(line, error));
        return consumed;
    }
}
