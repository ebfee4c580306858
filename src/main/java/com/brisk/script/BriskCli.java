package com.brisk.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

import com.brisk.debug.Debug;
import com.brisk.protocol.util.ValueJson;
import com.brisk.script.parser.AstPrinter;
import com.brisk.script.parser.Environment;
import com.brisk.script.parser.EvalResult;
import com.brisk.script.parser.ScriptError;
import com.brisk.script.parser.Value;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Host program: evaluates a script file, or runs a line REPL over stdin when no file is given.
 *
 * <pre>
 * BriskCli [--strict] [--json] [--ast] [--debug] [--env vars.json] [--max-depth n] [script-file]
 * </pre>
 */
public final class BriskCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_SCRIPT_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: BriskCli [--strict] [--json] [--ast] [--debug] [--env <vars.json>] [--max-depth <n>] [script-file]";

    private final BriskScript engine = new BriskScript();
    private final PrintStream out;
    private final PrintStream err;
    private boolean json;
    private boolean ast;
    private Map<String, Value> initialEnv = Collections.emptyMap();

    private BriskCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(run(args, stdin, System.out, System.err));
    }

    public static int run(String[] args, BufferedReader in, PrintStream out, PrintStream err) {
        BriskCli cli = new BriskCli(out, err);
        String scriptFile = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--strict": cli.engine.setMode(BriskScript.Mode.STRICT); break;
                case "--json": cli.json = true; break;
                case "--ast": cli.ast = true; break;
                case "--debug": Debug.useSysOut(); break;
                case "--env": {
                    if (++i >= args.length) return usage(err, "--env needs a file");
                    Path envPath = Path.of(args[i]);
                    try {
                        cli.initialEnv = ValueJson.readEnvironment(Files.readString(envPath, StandardCharsets.UTF_8));
                    } catch (IOException | IllegalArgumentException e) {
                        err.println("Failed to read environment file: " + envPath + " (" + e.getMessage() + ")");
                        return EXIT_IO;
                    }
                    break;
                }
                case "--max-depth": {
                    if (++i >= args.length) return usage(err, "--max-depth needs a number");
                    try {
                        cli.engine.setMaxCallDepth(Integer.parseInt(args[i]));
                    } catch (IllegalArgumentException e) {
                        return usage(err, "bad --max-depth: " + args[i]);
                    }
                    break;
                }
                default:
                    if (a.startsWith("--") || scriptFile != null) return usage(err, "unexpected argument: " + a);
                    scriptFile = a;
            }
        }

        if (scriptFile == null) return cli.repl(in);

        final Path scriptPath = Path.of(scriptFile);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(err);
            return EXIT_IO;
        }
        return cli.runScript(script);
    }

    private int runScript(String script) {
        if (ast) return printAst(script) ? EXIT_OK : EXIT_SCRIPT_ERROR;

        EvalResult result = engine.evaluate(script, initialEnv);
        if (json) {
            ObjectNode node = ValueJson.mapper().createObjectNode();
            if (result.isOk()) {
                node.set("value", ValueJson.toJson(result.value()));
            } else {
                ObjectNode error = node.putObject("error");
                error.put("stage", result.error().stage().name());
                error.put("message", result.error().getMessage());
            }
            node.set("env", ValueJson.toJson(result.env()));
            try {
                out.println(ValueJson.writeString(node));
            } catch (IOException e) {
                err.println("Failed to write JSON output: " + e.getMessage());
                return EXIT_IO;
            }
        } else if (result.isOk()) {
            out.println(result.value());
        } else {
            err.println(result.error().describe());
        }
        return result.isOk() ? EXIT_OK : EXIT_SCRIPT_ERROR;
    }

    /** One environment lives across all lines; an error is printed and the loop goes on. */
    private int repl(BufferedReader in) {
        Environment env = new Environment(initialEnv);
        try {
            while (true) {
                out.print("> ");
                out.flush();
                String line = in.readLine();
                if (line == null) break;
                if (line.trim().isEmpty()) continue;

                if (ast) {
                    printAst(line);
                    continue;
                }
                try {
                    Value value = engine.eval(line, env);
                    out.println(json ? ValueJson.writeString(ValueJson.toJson(value)) : value.toString());
                } catch (ScriptError e) {
                    err.println(e.describe());
                } catch (JsonProcessingException e) {
                    err.println("Failed to write JSON output: " + e.getMessage());
                }
            }
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getMessage());
            return EXIT_IO;
        }
        out.println();
        return EXIT_OK;
    }

    private boolean printAst(String source) {
        try {
            out.println(new AstPrinter().print(engine.parse(source)));
            return true;
        } catch (ScriptError e) {
            err.println(e.describe());
            return false;
        }
    }

    private static int usage(PrintStream err, String problem) {
        err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }
}
