package com.brisk.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.brisk.script.BriskScript.SystemErrorReporter;
import com.brisk.script.parser.Expr.Assign;
import com.brisk.script.parser.Expr.Binary;
import com.brisk.script.parser.Expr.Call;
import com.brisk.script.parser.Expr.CodeBlock;
import com.brisk.script.parser.Expr.ExprInterface;
import com.brisk.script.parser.Expr.ExprVisitor;
import com.brisk.script.parser.Expr.Function;
import com.brisk.script.parser.Expr.NumberLiteral;
import com.brisk.script.parser.Expr.Switch;
import com.brisk.script.parser.Expr.Variable;
import com.brisk.script.parser.Expr.While;

/**
 * Tree-walking evaluator. One environment is threaded through a scope, so an assignment is visible
 * to every later sibling in the same block, loop or switch. Function calls swap in a freshly built
 * environment and restore the caller's afterwards.
 */
public class Interpreter implements ExprVisitor<Value> {
    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final String ANONYMOUS = "<anonymous>";

    Environment env;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;
    private final SystemErrorReporter errorReporter;

    public Interpreter(Environment env) {
        this(env, DEFAULT_MAX_DEPTH, null);
    }

    public Interpreter(Environment env, int maxDepth, SystemErrorReporter errorReporter) {
        if (env == null) throw new IllegalArgumentException("env must not be null");
        if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        this.env = env;
        this.maxDepth = maxDepth;
        this.errorReporter = errorReporter;
    }

    public Value eval(ExprInterface expr) { return expr.accept(this); }

    /** Name of the innermost function being called, or null at top level. */
    public String currentFunctionName() {
        return callStack.isEmpty() ? null : callStack.peek().functionName();
    }

    /** Arguments of the innermost active call, empty at top level. */
    public List<Value> currentArguments() {
        return callStack.isEmpty() ? List.of() : callStack.peek().arguments();
    }

    public int callDepth() {
        return callStack.size();
    }

    void reportSystemError(String kind, String name, String message) {
        if (errorReporter != null) {
            errorReporter.report(this, kind, name, message);
        }
    }

    ScriptError fail(String kind, String name, String message) {
        reportSystemError(kind, name, message);
        return ScriptError.eval(message);
    }

    @Override
    public Value visitNumberExpr(NumberLiteral expr) {
        return Value.number(expr.value);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        Value value = env.get(expr.name);
        if (value == null) {
            throw fail("var_not_found", expr.name, "Undefined variable: " + expr.name);
        }
        return value;
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        if (!left.isNumber()) {
            throw fail("type_error", expr.operator.lexeme, "Left operand is not a number.");
        }
        Value right = eval(expr.right);
        if (!right.isNumber()) {
            throw fail("type_error", expr.operator.lexeme, "Right operand is not a number.");
        }
        double l = left.asNumber();
        double r = right.asNumber();

        switch (expr.operator.type) {
            case PLUS: return Value.number(l + r);
            case MINUS: return Value.number(l - r);
            case STAR: return Value.number(l * r);
            case SLASH: return Value.number(l / r);
            case PERCENT: return Value.number(l % r);

            case EQUAL_EQUAL: return bool(l == r);
            case LESS: return bool(l < r);
            case GREATER: return bool(l > r);
            case LESS_EQUAL: return bool(l <= r);
            case GREATER_EQUAL: return bool(l >= r);

            default:
                // The parser never builds a Binary with any other operator.
                return Value.number(0.0);
        }
    }

    @Override
    public Value visitCodeBlockExpr(CodeBlock expr) {
        Value last = Value.nil();
        for (ExprInterface statement : expr.statements) {
            last = eval(statement);
        }
        return last;
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        env.assign(expr.name, value);
        return value;
    }

    @Override
    public Value visitFunctionExpr(Function expr) {
        return Value.function(new Closure(expr.params, expr.body, env.snapshot()));
    }

    @Override
    public Value visitCallExpr(Call expr) {
        String name = (expr.callee instanceof Variable) ? ((Variable) expr.callee).name : ANONYMOUS;

        Value callee = eval(expr.callee);
        if (!callee.isFunction()) {
            throw fail("call_error", name, "Can only call functions, got " + callee.getType());
        }

        // Taken before the arguments run: assignments made by arguments reach the caller's
        // environment but not the invocation environment.
        Map<String, Value> callerSnapshot = env.snapshot();

        List<Value> args = new ArrayList<Value>(expr.arguments.size());
        for (ExprInterface argument : expr.arguments) {
            args.add(eval(argument));
        }

        CallFrame frame = new CallFrame(name, args);
        if (callStack.size() >= maxDepth) {
            throw fail("call_depth", name, "Max call depth exceeded (" + maxDepth + ") calling " + frame);
        }

        callStack.push(frame);
        try {
            return callee.asFunction().call(this, callerSnapshot, args);
        } finally {
            callStack.pop();
        }
    }

    @Override
    public Value visitSwitchExpr(Switch expr) {
        if (expr.conditions.size() != expr.branches.size()) {
            throw fail("switch_mismatch", null, "Switch has " + expr.conditions.size()
                    + " conditions but " + expr.branches.size() + " branches.");
        }
        for (int i = 0; i < expr.conditions.size(); i++) {
            if (matchesCase(eval(expr.conditions.get(i)))) {
                return eval(expr.branches.get(i));
            }
        }
        return Value.nil();
    }

    @Override
    public Value visitWhileExpr(While expr) {
        while (isTruthy(eval(expr.condition))) {
            eval(expr.body);
        }
        return Value.nil();
    }

    /** Loop truthiness: null is false, a number is false only at 0.0, functions and vectors are true. */
    public static boolean isTruthy(Value v) {
        switch (v.getType()) {
            case NULL: return false;
            case NUMBER: return v.asNumber() != 0.0;
            case FUNCTION: return true;
            case VECTOR: return true;
            default: return false;
        }
    }

    /** Switch matching is narrower than loop truthiness: vectors never match. */
    public static boolean matchesCase(Value v) {
        switch (v.getType()) {
            case NUMBER: return v.asNumber() != 0.0;
            case FUNCTION: return true;
            default: return false;
        }
    }

    private static Value bool(boolean b) {
        return Value.number(b ? 1.0 : 0.0);
    }
}
