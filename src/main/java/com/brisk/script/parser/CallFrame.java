package com.brisk.script.parser;

import java.util.List;

/**
 * One active function invocation: the name the callee was reached through and the evaluated
 * arguments. Rendered as {@code name(arg, ...)} in call-depth errors.
 */
public final class CallFrame {
    private final String functionName;
    private final List<Value> arguments;

    CallFrame(String functionName, List<Value> arguments) {
        this.functionName = functionName;
        this.arguments = List.copyOf(arguments);
    }

    public String functionName() {
        return functionName;
    }

    public List<Value> arguments() {
        return arguments;
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder(functionName).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) out.append(", ");
            out.append(arguments.get(i));
        }
        return out.append(')').toString();
    }
}
