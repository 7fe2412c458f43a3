package com.lispcalc.parser;

public enum TokenType {
    IDENTIFIER,
    NUMBER,
    LEFT_PAREN,
    RIGHT_PAREN,
    EOF
}
