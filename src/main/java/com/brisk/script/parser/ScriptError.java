package com.brisk.script.parser;

/**
 * The single failure type of the pipeline. Each stage stops at its first fault and throws one of these.
 */
public class ScriptError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Stage { LEX, PARSE, EVAL }

    private final Stage stage;

    public ScriptError(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public ScriptError(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public static ScriptError lex(String message) { return new ScriptError(Stage.LEX, message); }
    public static ScriptError parse(String message) { return new ScriptError(Stage.PARSE, message); }
    public static ScriptError eval(String message) { return new ScriptError(Stage.EVAL, message); }

    public Stage stage() { return stage; }

    /** Host-facing rendering, e.g. {@code "eval error: Undefined variable: x"}. */
    public String describe() {
        return stage.name().toLowerCase() + " error: " + getMessage();
    }
}
