package com.panini.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.panini.debug.Debug;
import com.panini.debug.DebugLevel;
import com.panini.script.parser.RunResult;
import com.panini.script.server.PaniniHttpServer;

/**
 * Command line entry point.
 *
 * Usage:
 *   panini                                  start the REPL
 *   panini repl                             start the REPL
 *   panini run <file.panini> [--verbose]    run a source file
 *   panini build <file.panini> [--output=Name] [--no-compile]
 *   panini serve [--port=8080] [--threads=4]
 *   panini example                          print a sample program
 */
public final class PaniniCli {

    private static final String TAG = "PaniniCli";

    static final int EXIT_OK = 0;
    static final int EXIT_PROGRAM_ERRORS = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    static final String ERROR_PREFIX = "त्रुटि: ";

    static final String EXAMPLE =
            "!! नमस्ते विश्व - Hello World\n"
            + "दर्श(\"नमस्ते विश्व\")\n"
            + "\n"
            + "!! चर और गणना - Variables and Math\n"
            + "x = 5\n"
            + "y = 10\n"
            + "योग = x + y\n"
            + "दर्श(\"योग: \" + योग)\n"
            + "\n"
            + "!! शर्त - Conditionals\n"
            + "यदि x < y:\n"
            + "    दर्श(\"x छोटा है\")\n"
            + "अन्यथा:\n"
            + "    दर्श(\"x बड़ा है\")\n"
            + "\n"
            + "!! लूप - Loops\n"
            + "यावत् x <= y:\n"
            + "    दर्श(x)\n"
            + "    x = x + 1\n"
            + "\n"
            + "!! फंक्शन - Functions\n"
            + "कार्य greet(नाम):\n"
            + "    दर्श(\"नमस्ते \" + नाम)\n"
            + "\n"
            + "greet(\"भारत\")\n";

    private final PaniniScript engine = new PaniniScript();
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public PaniniCli(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new PaniniCli(System.in, System.out, System.err).execute(args);
        // serve returns EXIT_OK while its threads keep the JVM alive
        if (code != EXIT_OK) System.exit(code);
    }

    /** Runs one command line and returns its exit code. */
    public int execute(String[] args) {
        List<String> positional = new ArrayList<>();
        Map<String, String> flags = parseArgs(args, positional);
        String command = positional.isEmpty() ? "repl" : positional.get(0);

        switch (command) {
            case "repl":
                return repl();
            case "run":
                if (positional.size() != 2) return usage("run <file.panini> [--verbose]");
                return runFile(Path.of(positional.get(1)), flags.containsKey("verbose") || flags.containsKey("v"));
            case "build":
                if (positional.size() != 2) return usage("build <file.panini> [--output=Name] [--no-compile]");
                return build(Path.of(positional.get(1)), flags.getOrDefault("output", "output"),
                        !flags.containsKey("no-compile"));
            case "serve":
                return serve(flags);
            case "example":
                example();
                return EXIT_OK;
            case "help":
                printUsage(out);
                return EXIT_OK;
            default:
                err.println("Unknown command: " + command);
                printUsage(err);
                return EXIT_USAGE;
        }
    }

    private int repl() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            new PaniniRepl(engine, reader, out).loop();
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Input error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private int runFile(Path file, boolean verbose) {
        if (verbose) Debug.useSysOut(DebugLevel.DEBUG);
        String source = readSource(file);
        if (source == null) return EXIT_IO;

        if (verbose) {
            out.println("▶️  Executing: " + file);
            out.println("📄 Source: " + source.lines().count() + " lines");
        }

        RunResult result = engine.run(source);
        if (!result.output().isEmpty()) out.print(result.output());
        if (result.hasErrors()) {
            for (String e : result.errors()) err.println(ERROR_PREFIX + e);
            return EXIT_PROGRAM_ERRORS;
        }
        if (verbose) {
            out.println();
            out.println("✅ Execution completed successfully");
        }
        return EXIT_OK;
    }

    private int build(Path file, String output, boolean compile) {
        String source = readSource(file);
        if (source == null) return EXIT_IO;
        out.println("🔧 Building: " + file);

        Path javaFile = Path.of(output + ".java");
        String className = javaFile.getFileName().toString().replace(".java", "");
        String javaSource;
        try {
            javaSource = JavaTranspiler.transpile(source, className);
        } catch (IllegalArgumentException e) {
            err.println(ERROR_PREFIX + "Transpilation failed: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            Files.writeString(javaFile, javaSource, StandardCharsets.UTF_8);
        } catch (IOException e) {
            Debug.get().e(TAG, "cannot write " + javaFile, e);
            err.println(ERROR_PREFIX + "Cannot write Java file: " + e.getMessage());
            return EXIT_IO;
        }
        out.println("✅ Generated: " + javaFile);
        if (!compile) return EXIT_OK;

        Path outDir = javaFile.toAbsolutePath().getParent();
        String diagnostics;
        try {
            diagnostics = JavaTranspiler.compile(javaFile, outDir);
        } catch (IllegalStateException e) {
            err.println(ERROR_PREFIX + e.getMessage());
            return EXIT_PROGRAM_ERRORS;
        }
        if (!diagnostics.isEmpty()) {
            err.println(ERROR_PREFIX + "Build failed:");
            err.println(diagnostics);
            return EXIT_PROGRAM_ERRORS;
        }
        out.println("🎉 Built: " + outDir.resolve(className + ".class"));
        return EXIT_OK;
    }

    private int serve(Map<String, String> flags) {
        int port;
        int threads;
        try {
            port = Integer.parseInt(flags.getOrDefault("port", "8080"));
            threads = Integer.parseInt(flags.getOrDefault("threads", "4"));
        } catch (NumberFormatException e) {
            return usage("serve [--port=8080] [--threads=4]");
        }

        Debug.useSysOut();
        try {
            PaniniHttpServer server = new PaniniHttpServer(engine, port, threads);
            server.start();
            out.println("📝 Open http://localhost:" + server.port() + "/api/run to run Sanskrit code");
            return EXIT_OK;
        } catch (IOException e) {
            Debug.get().e(TAG, "cannot start server on port " + port, e);
            err.println(ERROR_PREFIX + "Cannot start server: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private void example() {
        out.println("📚 Panini Sanskrit Programming Examples");
        out.println();
        out.println(EXAMPLE);
        out.println("💡 Usage:");
        out.println("  1. Save the above code as 'hello.panini'");
        out.println("  2. Run with: panini run hello.panini");
        out.println("  3. Build with: panini build hello.panini");
    }

    /** Reads a source file, reporting problems to stderr; null when unreadable. */
    private String readSource(Path file) {
        if (!Files.exists(file)) {
            err.println(ERROR_PREFIX + "File not found: " + file);
            return null;
        }
        if (!file.getFileName().toString().endsWith(".panini")) {
            err.println("चेतावनी: File should have .panini extension");
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            Debug.get().e(TAG, "cannot read " + file, e);
            err.println(ERROR_PREFIX + "Cannot read file " + file + ": " + e.getMessage());
            return null;
        }
    }

    private int usage(String form) {
        err.println("Usage: panini " + form);
        return EXIT_USAGE;
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage:");
        ps.println("  panini                                  start the REPL");
        ps.println("  panini run <file.panini> [--verbose]    run a source file");
        ps.println("  panini build <file.panini> [--output=Name] [--no-compile]");
        ps.println("  panini serve [--port=8080] [--threads=4]");
        ps.println("  panini example                          print a sample program");
    }

    public static Map<String, String> parseArgs(String[] args, List<String> positional) {
        Map<String, String> flags = new HashMap<String, String>();
        for (String a : args) {
            if (a.startsWith("--") && a.indexOf('=') >= 0) {
                int i = a.indexOf('=');
                flags.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                flags.put(a.substring(2), "true");
            } else if (a.startsWith("-") && a.length() > 1) {
                flags.put(a.substring(1), "true");
            } else {
                positional.add(a);
            }
        }
        return flags;
    }
}
