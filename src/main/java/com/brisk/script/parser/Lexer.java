package com.brisk.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import com.brisk.script.BriskScript.Mode;

/**
 * Turns source text into tokens. No comments, whitespace is never significant.
 *
 * In LENIENT mode characters outside the token vocabulary are dropped without a token or an error;
 * STRICT mode rejects them.
 */
public class Lexer {
    private final String source;
    private final Mode mode;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("fn", TokenType.FN);
        map.put("while", TokenType.WHILE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this(source, Mode.LENIENT);
    }

    public Lexer(String source, Mode mode) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
        this.mode = (mode == null) ? Mode.LENIENT : mode;
    }

    /** Scans the whole source from the beginning; safe to call more than once. */
    public List<Token> tokenize() {
        tokens.clear();
        start = 0;
        current = 0;
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return new ArrayList<>(tokens);
    }

    /** Canonical text for a token list; lexing it again yields an equal list. */
    public static String render(List<Token> tokens) {
        StringJoiner out = new StringJoiner(" ");
        for (Token t : tokens) out.add(t.lexeme);
        return out.toString();
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(match('>') ? TokenType.ARROW : TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '&': addToken(TokenType.AMP); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            default:
                if (Character.isWhitespace(c)) break;
                if (isDigit(c) || c == '.') number(c);
                else if (isAlpha(c)) identifier();
                else if (mode == Mode.STRICT) throw ScriptError.lex("Unexpected character: " + c);
                // LENIENT: unknown symbol, no token
        }
    }

    private void number(char first) {
        boolean dot = first == '.';
        while (isDigit(peek()) || peek() == '.') {
            if (peek() == '.') {
                if (dot) throw ScriptError.lex("Found second dot in a number.");
                dot = true;
            }
            advance();
        }
        String text = source.substring(start, current);
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ScriptError(ScriptError.Stage.LEX, "Invalid number literal '" + text + "'", e);
        }
        addToken(TokenType.NUMBER, value);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.get(text);
        if (type == null) addToken(TokenType.IDENTIFIER, text);
        else addToken(type);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) { return Character.isLetter(c) || c == '_'; }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal));
    }
}
