package com.lispcalc.parser;

import java.util.ArrayList;
import java.util.List;

import com.lispcalc.debug.Debug;

/**
 * Turns source text into tokens. Never fails: characters that cannot start a token are
 * dropped, leaving structural problems for the parser to report.
 */
public class Lexer {
    private static final String TAG = "lispcalc.lexer";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", line));
        Debug.get().t(TAG, "tokenized " + source.length() + " chars into " + tokens.size() + " tokens");
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '\n':
                line++;
                break;
            default:
                if (isDigit(c)) number();
                else if (isIdentifierChar(c)) identifier();
                // anything else is skipped
        }
    }

    private void identifier() {
        while (isIdentifierChar(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        addToken(TokenType.NUMBER);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    // Operator symbols lex as identifiers so every call head is handled the same way.
    private boolean isIdentifierChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                || c == '+' || c == '-' || c == '*' || c == '/';
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), line));
    }
}
