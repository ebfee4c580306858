package com.brisk.script.parser;

public enum TokenType {
    // Arithmetic
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // Comparison
    EQUAL_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Brackets
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACKET, RIGHT_BRACKET,
    LEFT_BRACE, RIGHT_BRACE,

    // Punctuation
    SEMICOLON, COMMA, AMP, ARROW, EQUAL,

    // Literals
    NUMBER, IDENTIFIER,

    // Keywords
    FN, WHILE
}
