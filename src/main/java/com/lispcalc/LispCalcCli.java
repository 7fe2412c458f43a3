package com.lispcalc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.lispcalc.debug.Debug;
import com.lispcalc.debug.DebugLevel;
import com.lispcalc.error.LispCalcException;
import com.lispcalc.parser.Expr.ExprInterface;
import com.lispcalc.print.AstJson;

public final class LispCalcCli {
    private static final String TAG = "lispcalc.cli";

    public static final int EXIT_OK = 0;
    public static final int EXIT_SCRIPT_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: LispCalcCli [--variadic] [--partial] [--json] [--verbose] (<script-file> | -e <source>)\n"
            + "  --partial prints the folded AST for display; it may not parse back as source.";

    public static void main(String[] args) {
        System.exit(run(args, new LispCalc()));
    }

    /** Runs the CLI against {@code engine} and returns the process exit code. */
    public static int run(String[] args, LispCalc engine) {
        boolean partial = false;
        boolean json = false;
        String source = null;
        Path scriptPath = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--variadic": engine.setArityMode(LispCalc.ArityMode.VARIADIC); break;
                case "--partial": partial = true; break;
                case "--json": json = true; break;
                case "--verbose": Debug.useSysErr(DebugLevel.TRACE); break;
                case "-e":
                    if (i + 1 >= args.length) return usage();
                    source = args[++i];
                    break;
                default:
                    if (a.startsWith("-") || scriptPath != null) return usage();
                    scriptPath = Path.of(a);
            }
        }
        if ((source == null) == (scriptPath == null)) return usage();

        if (scriptPath != null) {
            try {
                source = Files.readString(scriptPath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                System.err.println("Failed to read script file: " + scriptPath);
                Debug.get().e(TAG, "read failed: " + scriptPath, e);
                return EXIT_IO;
            }
        }

        try {
            ExprInterface ast = engine.parse(source);
            System.out.println("AST: " + engine.visualize(ast));
            if (partial) {
                // Folding can yield negative constants and extra operands, so this line is for
                // display only: "-4" lexes as "-" "4" and may not re-parse, above all in STRICT mode.
                // The value printed below comes from the folded tree itself.
                ast = engine.partialEvaluate(ast);
                System.out.println("Partially evaluated AST: " + engine.visualize(ast));
            }
            if (json) {
                System.out.println("JSON: " + AstJson.toJsonString(ast));
            }
            System.out.println(engine.evaluate(ast));
            return EXIT_OK;
        } catch (LispCalcException e) {
            System.err.println("Script error: " + e.getMessage());
            Debug.get().e(TAG, e.getClass().getSimpleName(), e);
            return EXIT_SCRIPT_ERROR;
        } catch (UncheckedIOException e) {
            System.err.println("Input error: " + e.getMessage());
            Debug.get().e(TAG, "stdin failed", e);
            return EXIT_IO;
        }
    }

    private static int usage() {
        System.err.println(USAGE);
        return EXIT_USAGE;
    }

    private LispCalcCli() {}
}
