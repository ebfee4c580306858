package com.brisk.script.parser;

import java.util.List;

import com.brisk.script.parser.Expr.ExprInterface;

/** Renders an AST as a parenthesized prefix string, e.g. {@code (+ 1.0 (* 2.0 x))}. */
public class AstPrinter implements Expr.ExprVisitor<String> {

    public String print(ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public String visitNumberExpr(Expr.NumberLiteral expr) {
        return Double.toString(expr.value);
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return expr.name;
    }

    @Override
    public String visitCodeBlockExpr(Expr.CodeBlock expr) {
        return parenthesize("block", expr.statements);
    }

    @Override
    public String visitAssignExpr(Expr.Assign expr) {
        return "(= " + expr.name + " " + print(expr.value) + ")";
    }

    @Override
    public String visitFunctionExpr(Expr.Function expr) {
        return "(fn (" + String.join(" ", expr.params) + ") " + print(expr.body) + ")";
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        StringBuilder builder = new StringBuilder("(call ").append(print(expr.callee));
        for (ExprInterface arg : expr.arguments) {
            builder.append(' ').append(print(arg));
        }
        return builder.append(')').toString();
    }

    @Override
    public String visitSwitchExpr(Expr.Switch expr) {
        StringBuilder builder = new StringBuilder("(switch");
        int n = Math.min(expr.conditions.size(), expr.branches.size());
        for (int i = 0; i < n; i++) {
            builder.append(" (").append(print(expr.conditions.get(i)))
                    .append(' ').append(print(expr.branches.get(i))).append(')');
        }
        return builder.append(')').toString();
    }

    @Override
    public String visitWhileExpr(Expr.While expr) {
        return parenthesize("while", List.of(expr.condition, expr.body));
    }

    private String parenthesize(String name, ExprInterface left, ExprInterface right) {
        return parenthesize(name, List.of(left, right));
    }

    private String parenthesize(String name, List<ExprInterface> exprs) {
        StringBuilder builder = new StringBuilder();
        builder.append('(').append(name);
        for (ExprInterface expr : exprs) {
            builder.append(' ').append(print(expr));
        }
        return builder.append(')').toString();
    }
}
