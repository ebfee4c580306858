package com.brisk.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.brisk.script.BriskScript.Mode;
import com.brisk.script.parser.Expr.Assign;
import com.brisk.script.parser.Expr.Binary;
import com.brisk.script.parser.Expr.Call;
import com.brisk.script.parser.Expr.CodeBlock;
import com.brisk.script.parser.Expr.ExprInterface;
import com.brisk.script.parser.Expr.Function;
import com.brisk.script.parser.Expr.NumberLiteral;
import com.brisk.script.parser.Expr.Switch;
import com.brisk.script.parser.Expr.Variable;
import com.brisk.script.parser.Expr.While;

/**
 * Precedence climbing for binary operators, recursive descent for everything else.
 *
 * <pre>
 * comparison := addSub (('==' | '&lt;' | '&gt;' | '&lt;=' | '&gt;=') addSub)*
 * addSub     := mulDiv (('+' | '-') mulDiv)*
 * mulDiv     := call (('*' | '/' | '%') call)*
 * call       := leaf ('(' args? ')')*
 * leaf       := number | '(' expr ')' | ident ('=' expr)? | fn | while | block | switch
 * </pre>
 *
 * The cursor only moves forward. Past the last token there is no current token.
 */
public class Parser {
    public static final int DEFAULT_MAX_NESTING = 256;

    private final List<Token> tokens;
    private final Mode mode;
    private final int maxNesting;
    private int current = 0;
    private int nesting = 0;

    public Parser(List<Token> tokens) {
        this(tokens, Mode.LENIENT);
    }

    public Parser(List<Token> tokens, Mode mode) {
        this(tokens, mode, DEFAULT_MAX_NESTING);
    }

    /**
     * @param maxNesting bound on AST depth: nested sub-expressions plus links in an operator or
     *                   call chain. Keeps both this parser and the evaluator off the JVM stack limit.
     */
    public Parser(List<Token> tokens, Mode mode, int maxNesting) {
        if (tokens == null) throw new IllegalArgumentException("tokens must not be null");
        if (maxNesting <= 0) throw new IllegalArgumentException("maxNesting must be positive, got " + maxNesting);
        this.tokens = tokens;
        this.mode = (mode == null) ? Mode.LENIENT : mode;
        this.maxNesting = maxNesting;
    }

    /** Parses one root expression. LENIENT mode ignores whatever follows it. */
    public ExprInterface parse() {
        ExprInterface root = expression();
        if (mode == Mode.STRICT && !isAtEnd()) {
            throw error(peek(), "Unexpected token after expression");
        }
        return root;
    }

    private ExprInterface expression() {
        enter();
        try {
            return comparison();
        } finally {
            nesting--;
        }
    }

    private ExprInterface comparison() {
        ExprInterface expr = addSub();
        int links = 0;
        try {
            while (match(TokenType.EQUAL_EQUAL, TokenType.LESS, TokenType.GREATER,
                    TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL)) {
                Token op = previous();
                enter();
                links++;
                ExprInterface right = addSub();
                expr = new Binary(expr, op, right);
            }
        } finally {
            nesting -= links;
        }
        return expr;
    }

    private ExprInterface addSub() {
        ExprInterface expr = mulDiv();
        int links = 0;
        try {
            while (match(TokenType.PLUS, TokenType.MINUS)) {
                Token op = previous();
                enter();
                links++;
                ExprInterface right = mulDiv();
                expr = new Binary(expr, op, right);
            }
        } finally {
            nesting -= links;
        }
        return expr;
    }

    private ExprInterface mulDiv() {
        ExprInterface expr = call();
        int links = 0;
        try {
            while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
                Token op = previous();
                enter();
                links++;
                ExprInterface right = call();
                expr = new Binary(expr, op, right);
            }
        } finally {
            nesting -= links;
        }
        return expr;
    }

    private ExprInterface call() {
        ExprInterface expr = leaf();
        int links = 0;
        try {
            while (match(TokenType.LEFT_PAREN)) {
                enter();
                links++;
                expr = finishCall(expr);
            }
        } finally {
            nesting -= links;
        }
        return expr;
    }

    private ExprInterface finishCall(ExprInterface callee) {
        List<ExprInterface> arguments = new ArrayList<>();
        if (match(TokenType.RIGHT_PAREN)) {
            return new Call(callee, arguments);
        }
        while (true) {
            arguments.add(expression());
            if (match(TokenType.COMMA)) continue;
            if (match(TokenType.RIGHT_PAREN)) break;
            throw error(peek(), "Expect ',' or ')' after an argument");
        }
        return new Call(callee, arguments);
    }

    private ExprInterface leaf() {
        if (match(TokenType.NUMBER)) return new NumberLiteral((Double) previous().literal);

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression");
            return expr;
        }

        if (match(TokenType.IDENTIFIER)) {
            String name = (String) previous().literal;
            if (match(TokenType.EQUAL)) {
                // right-recursive: a = b = c is a = (b = c)
                return new Assign(name, expression());
            }
            return new Variable(name);
        }

        if (match(TokenType.FN)) return function();
        if (match(TokenType.WHILE)) return whileLoop();
        if (match(TokenType.LEFT_BRACKET)) return codeBlock();
        if (match(TokenType.LEFT_BRACE)) return switchExpr();

        throw error(peek(), "Unexpected token");
    }

    // fn a, b -> body
    private ExprInterface function() {
        List<String> params = new ArrayList<>();
        while (match(TokenType.IDENTIFIER)) {
            params.add((String) previous().literal);
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.ARROW, "Expect '->' after function parameters");
        return new Function(params, expression());
    }

    // while cond body: the body is the next full expression, no delimiter
    private ExprInterface whileLoop() {
        ExprInterface condition = expression();
        ExprInterface body = expression();
        return new While(condition, body);
    }

    // [a; b; c]
    private ExprInterface codeBlock() {
        List<ExprInterface> statements = new ArrayList<>();
        do {
            statements.add(expression());
        } while (match(TokenType.SEMICOLON));
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after block");
        return new CodeBlock(statements);
    }

    // {cond -> branch, cond -> branch}
    private ExprInterface switchExpr() {
        List<ExprInterface> conditions = new ArrayList<>();
        List<ExprInterface> branches = new ArrayList<>();
        do {
            conditions.add(expression());
            consume(TokenType.ARROW, "Expect '->' after switch condition");
            branches.add(expression());
        } while (match(TokenType.COMMA));
        consume(TokenType.RIGHT_BRACE, "Expect '}' after switch");
        return new Switch(conditions, branches);
    }

    private void enter() {
        if (++nesting > maxNesting) {
            throw ScriptError.parse("Expression nested too deeply (max " + maxNesting + ")");
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return current >= tokens.size(); }
    private Token peek() { return isAtEnd() ? null : tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ScriptError error(Token token, String message) {
        String found = (token == null) ? "end of input" : token.toString();
        return ScriptError.parse(message + ", found " + found);
    }
}
