package com.fluxo.script.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, DOT, SEMICOLON, PLUS, MINUS, STAR, SLASH, PERCENT,

    // One, two or three character tokens.
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR, ELLIPSIS,

    // Literals.
    IDENTIFIER, STRING, NUMBER,

    // Keywords.
    LOCAL, FUNCTION, RETURN, IF, ELSE, WHILE, FOR, BREAK, CONTINUE,
    TRUE, FALSE, NULL, UNDEFINED,
    MODULE, EXPORT, IMPORT, REQUIRE, WAIT,

    EOF
}
