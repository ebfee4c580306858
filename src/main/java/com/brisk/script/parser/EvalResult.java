package com.brisk.script.parser;

import java.util.Map;

/**
 * Outcome of one evaluate() run: either a value or the first error, plus the environment as it stood
 * when the run ended.
 */
public class EvalResult {
    private final Map<String, Value> env;
    private final Value value;
    private final ScriptError error;

    private EvalResult(Map<String, Value> env, Value value, ScriptError error) {
        this.env = env;
        this.value = value;
        this.error = error;
    }

    public static EvalResult ok(Map<String, Value> env, Value value) {
        return new EvalResult(env, value, null);
    }

    public static EvalResult failed(Map<String, Value> env, ScriptError error) {
        return new EvalResult(env, null, error);
    }

    public boolean isOk() { return error == null; }

    public Map<String, Value> env() { return env; }

    /** @throws IllegalStateException if the run failed */
    public Value value() {
        if (error != null) throw new IllegalStateException("Run failed: " + error.describe());
        return value;
    }

    /** @throws IllegalStateException if the run succeeded */
    public ScriptError error() {
        if (error == null) throw new IllegalStateException("Run succeeded with " + value);
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error.describe() + ")";
    }
}
