package com.lispcalc.parser;

import java.util.Objects;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final int line;

    public Token(TokenType type, String lexeme, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
    }

    public static Token identifier(String text) { return new Token(TokenType.IDENTIFIER, text, 1); }
    public static Token number(String digits) { return new Token(TokenType.NUMBER, digits, 1); }
    public static Token leftParen() { return new Token(TokenType.LEFT_PAREN, "(", 1); }
    public static Token rightParen() { return new Token(TokenType.RIGHT_PAREN, ")", 1); }
    public static Token eof() { return new Token(TokenType.EOF, "", 1); }

    // line is positional metadata, not part of a token's identity
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type && lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "EOF" : type + "(" + lexeme + ")";
    }
}
