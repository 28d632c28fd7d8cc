package com.panini.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

import com.panini.script.parser.Interpreter;
import com.panini.script.parser.RunResult;

/**
 * Interactive line loop. One {@link Interpreter} lives for the whole session,
 * so variables and functions persist from line to line.
 */
public final class PaniniRepl {

    static final String PROMPT = "panini> ";
    static final String FAREWELL = "धन्यवाद! Namaste! 🙏";
    static final String ERROR_PREFIX = "त्रुटि: ";
    private static final String CLEAR_SCREEN = "\u001B[2J\u001B[1;1H";

    private final Interpreter session;
    private final BufferedReader in;
    private final PrintStream out;

    public PaniniRepl(PaniniScript engine, BufferedReader in, PrintStream out) {
        this.session = engine.newSession();
        this.in = in;
        this.out = out;
    }

    public void loop() throws IOException {
        printWelcome();
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                out.println(FAREWELL);
                return;
            }
            line = line.strip();
            if (line.isEmpty()) continue;

            if ("exit".equals(line) || "quit".equals(line) || "बाहर".equals(line)) {
                out.println(FAREWELL);
                return;
            } else if ("help".equals(line) || "सहायता".equals(line)) {
                printHelp();
            } else if ("clear".equals(line) || "स्पष्ट".equals(line)) {
                out.print(CLEAR_SCREEN);
                printWelcome();
            } else {
                RunResult result = session.run(line);
                if (!result.output().isEmpty()) out.print(result.output());
                for (String error : result.errors()) {
                    out.println(ERROR_PREFIX + error);
                }
            }
        }
    }

    private void printWelcome() {
        out.println("🕉️  Panini REPL प्रारम्भः");
        out.println("Sanskrit Programming Language v" + PaniniScript.VERSION);
        out.println("Type 'help' for commands, 'exit' to quit.");
        out.println();
    }

    private void printHelp() {
        out.println("📖 REPL Commands:");
        out.println("  exit/quit/बाहर - Exit REPL");
        out.println("  help/सहायता - Show this help");
        out.println("  clear/स्पष्ट - Clear screen");
        out.println();
        out.println("🎯 Sanskrit Keywords:");
        out.println("  दर्श() darsh() - Print/Display");
        out.println("  यदि yadi - If condition");
        out.println("  अन्यथा anyatha - Else");
        out.println("  यावत् yavat - While loop");
        out.println("  परिभ्रमण paribhraman - For loop");
        out.println("  कार्य karya - Function");
        out.println("  !! - Comments");
        out.println();
    }
}
