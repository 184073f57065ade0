package com.example.sclanalyzer.service.expression;

public enum TokenType {
    // Literals and names
    NUMBER, TEXT, IDENTIFIER, TAG_REFERENCE,

    // Keywords
    TRUE, FALSE, AND, OR, XOR, NOT, MOD,

    // Operators
    PLUS, MINUS, STAR, SLASH,
    EQUAL, NOT_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    LEFT_PAREN, RIGHT_PAREN,

    EOF
}
