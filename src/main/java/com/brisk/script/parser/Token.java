package com.brisk.script.parser;

import java.util.Objects;

/**
 * A lexical unit. Carries no position: two tokens are equal when their type and literal are.
 * The lexeme is kept for rendering only.
 */
public final class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;

    public Token(TokenType type, String lexeme, Object literal) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        if (type == TokenType.NUMBER && !(literal instanceof Double)) {
            throw new IllegalArgumentException("NUMBER token needs a Double literal, got " + literal);
        }
        if (type == TokenType.IDENTIFIER && !(literal instanceof String)) {
            throw new IllegalArgumentException("IDENTIFIER token needs a String literal, got " + literal);
        }
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
    }

    public static Token of(TokenType type, String lexeme) {
        return new Token(type, lexeme, null);
    }

    public static Token number(double value) {
        return new Token(TokenType.NUMBER, Double.toString(value), value);
    }

    public static Token identifier(String name) {
        return new Token(TokenType.IDENTIFIER, name, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type && Objects.equals(literal, other.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, literal);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return "Number(" + literal + ")";
            case IDENTIFIER:
                return "Identifier(" + literal + ")";
            default:
                return type + " '" + lexeme + "'";
        }
    }
}
