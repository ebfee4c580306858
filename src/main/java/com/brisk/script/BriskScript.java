package com.brisk.script;

import java.util.List;
import java.util.Map;

import com.brisk.debug.Debug;
import com.brisk.script.parser.Environment;
import com.brisk.script.parser.EvalResult;
import com.brisk.script.parser.Expr;
import com.brisk.script.parser.Interpreter;
import com.brisk.script.parser.Lexer;
import com.brisk.script.parser.Parser;
import com.brisk.script.parser.ScriptError;
import com.brisk.script.parser.Token;
import com.brisk.script.parser.Value;

/**
 * Core Brisk engine.
 *
 * - Expression language: numbers, + - * / %, == &lt; &gt; &lt;= &gt;=, assignment
 * - Blocks {@code [a; b]}, switches {@code {cond -> value, ...}}, {@code while cond body}
 * - First-class functions {@code fn a, b -> body} with a captured environment snapshot
 * - Pipeline: source -> tokens -> one root expression -> value
 * - Mode:
 *     - LENIENT (default): unknown characters are dropped, tokens after the root expression are ignored
 *     - STRICT: both are errors
 */
public class BriskScript {

    private static final String TAG = "BriskScript";

    /** Lexer/parser strictness. Default LENIENT. */
    public enum Mode {
        LENIENT,
        STRICT
    }

    /** Error reporter hook used by the interpreter to surface evaluation faults to the host. */
    public interface SystemErrorReporter {
        void report(Interpreter interpreter, String kind, String name, String message);
    }

    private int maxCallDepth = Interpreter.DEFAULT_MAX_DEPTH;
    private int maxNestingDepth = Parser.DEFAULT_MAX_NESTING;
    private Mode mode = Mode.LENIENT;
    private SystemErrorReporter errorReporter;

    public BriskScript() {}

    public void setMaxCallDepth(int depth) {
        if (depth <= 0) throw new IllegalArgumentException("max call depth must be positive, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** Bound on expression nesting accepted by the parser. */
    public void setMaxNestingDepth(int depth) {
        if (depth <= 0) throw new IllegalArgumentException("max nesting depth must be positive, got " + depth);
        this.maxNestingDepth = depth;
    }

    public int getMaxNestingDepth() { return maxNestingDepth; }

    public void setMode(Mode mode) { this.mode = (mode == null) ? Mode.LENIENT : mode; }

    public Mode getMode() { return mode; }

    public void setErrorReporter(SystemErrorReporter reporter) { this.errorReporter = reporter; }

    public List<Token> tokenize(String source) {
        List<Token> tokens = new Lexer(source, mode).tokenize();
        Debug.get().d(TAG, "tokenized " + tokens.size() + " tokens");
        return tokens;
    }

    public Expr.ExprInterface parse(String source) {
        Expr.ExprInterface root = new Parser(tokenize(source), mode, maxNestingDepth).parse();
        Debug.get().d(TAG, "parsed root " + root.getClass().getSimpleName());
        return root;
    }

    /** Evaluates against a fresh empty environment. Throws the first {@link ScriptError}. */
    public Value eval(String source) {
        return eval(source, new Environment());
    }

    /** Evaluates against {@code env}, which top-level assignments mutate in place. */
    public Value eval(String source, Environment env) {
        Expr.ExprInterface root = parse(source);
        Interpreter interpreter = new Interpreter(env, maxCallDepth, errorReporter);
        Value out;
        try {
            out = interpreter.eval(root);
        } catch (StackOverflowError e) {
            // deep recursion below maxCallDepth can still exhaust a small thread stack
            throw new ScriptError(ScriptError.Stage.EVAL, "Stack overflow during evaluation", e);
        }
        Debug.get().d(TAG, "evaluated to " + out.getType());
        return out;
    }

    /** Result form of {@link #eval(String)}: never throws for a script fault. */
    public EvalResult evaluate(String source) {
        return evaluate(source, null);
    }

    public EvalResult evaluate(String source, Map<String, Value> initialEnv) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        Environment env = new Environment(initialEnv);
        try {
            Value out = eval(source, env);
            return EvalResult.ok(env.snapshot(), out);
        } catch (ScriptError e) {
            Debug.get().w(TAG, e.describe());
            return EvalResult.failed(env.snapshot(), e);
        }
    }
}
