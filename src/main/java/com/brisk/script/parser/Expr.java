package com.brisk.script.parser;

import java.util.List;

/**
 * AST node vocabulary. Every node owns its children; nodes are never shared between trees.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitNumberExpr(NumberLiteral expr);
        R visitBinaryExpr(Binary expr);
        R visitVariableExpr(Variable expr);
        R visitCodeBlockExpr(CodeBlock expr);
        R visitAssignExpr(Assign expr);
        R visitFunctionExpr(Function expr);
        R visitCallExpr(Call expr);
        R visitSwitchExpr(Switch expr);
        R visitWhileExpr(While expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    public static final class NumberLiteral implements ExprInterface {
        public final double value;

        public NumberLiteral(double value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumberExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final String name;
        public final ExprInterface value;

        public Assign(String name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    // -------------------------
    // Sequencing and control flow
    // -------------------------

    /** {@code [a; b; c]}: evaluates to its last statement. */
    public static final class CodeBlock implements ExprInterface {
        public final List<ExprInterface> statements;

        public CodeBlock(List<ExprInterface> statements) {
            this.statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCodeBlockExpr(this);
        }
    }

    /** {@code {c1 -> b1, c2 -> b2}}: conditions.get(i) pairs with branches.get(i). */
    public static final class Switch implements ExprInterface {
        public final List<ExprInterface> conditions;
        public final List<ExprInterface> branches;

        public Switch(List<ExprInterface> conditions, List<ExprInterface> branches) {
            this.conditions = List.copyOf(conditions);
            this.branches = List.copyOf(branches);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSwitchExpr(this);
        }
    }

    public static final class While implements ExprInterface {
        public final ExprInterface condition;
        public final ExprInterface body;

        public While(ExprInterface condition, ExprInterface body) {
            this.condition = condition;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitWhileExpr(this);
        }
    }

    // -------------------------
    // Functions and calls
    // -------------------------

    public static final class Function implements ExprInterface {
        public final List<String> params;
        public final ExprInterface body;

        public Function(List<String> params, ExprInterface body) {
            this.params = List.copyOf(params);
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }
}
