package com.brisk.script.parser;

import java.util.List;
import java.util.Map;

/**
 * Payload of a function value: parameters and body copied from the defining node, plus a snapshot
 * of the environment the function was defined in.
 */
public final class Closure {
    public final List<String> params;
    public final Expr.ExprInterface body;
    /** Immutable; never a live view of the defining environment. */
    public final Map<String, Value> captured;

    Closure(List<String> params, Expr.ExprInterface body, Map<String, Value> captured) {
        this.params = List.copyOf(params);
        this.body = body;
        this.captured = captured;
    }

    /**
     * Runs the body against a fresh invocation environment built from three layers, later ones
     * winning on name collisions: the caller's snapshot, the captured snapshot, then the parameter
     * bindings. Only the supplied prefix of parameters is bound.
     */
    Value call(Interpreter interpreter, Map<String, Value> callerSnapshot, List<Value> args) {
        if (args.size() > params.size()) {
            throw interpreter.fail("arity_error", interpreter.currentFunctionName(),
                    "Function expects " + params.size() + " arguments, got " + args.size());
        }

        Environment invocation = new Environment(callerSnapshot);
        invocation.assignAll(captured);
        for (int i = 0; i < args.size(); i++) {
            invocation.assign(params.get(i), args.get(i));
        }

        Environment previous = interpreter.env;
        interpreter.env = invocation;
        try {
            return interpreter.eval(body);
        } finally {
            interpreter.env = previous;
        }
    }

    @Override
    public String toString() {
        return "fn " + String.join(", ", params) + " -> ...";
    }
}
