package com.lispcalc.parser;

import java.util.ArrayList;
import java.util.List;

import com.lispcalc.LispCalc.ArityMode;
import com.lispcalc.debug.Debug;
import com.lispcalc.error.MalformedInputException;
import com.lispcalc.parser.Expr.Binding;
import com.lispcalc.parser.Expr.Call;
import com.lispcalc.parser.Expr.ExprInterface;
import com.lispcalc.parser.Expr.Let;
import com.lispcalc.parser.Expr.Var;

/**
 * Recursive-descent parser over a single index cursor.
 *
 * <pre>
 * expr    := NUMBER | IDENT | '(' 'let' '(' binding+ ')' expr ')' | '(' IDENT expr* ')'
 * binding := '(' IDENT expr ')'
 * </pre>
 *
 * The first structural defect aborts the whole parse with a {@link MalformedInputException}.
 */
public class Parser {
    private static final String TAG = "lispcalc.parser";

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final List<Token> tokens;
    private final ArityMode mode;
    private final int maxDepth;
    private int current = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) { this(tokens, ArityMode.STRICT, DEFAULT_MAX_DEPTH); }

    public Parser(List<Token> tokens, ArityMode mode, int maxDepth) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new MalformedInputException(0, "Token list must end with EOF.");
        }
        this.tokens = tokens;
        this.mode = (mode == null) ? ArityMode.STRICT : mode;
        this.maxDepth = maxDepth;
    }

    public ExprInterface parse() {
        ExprInterface root = expression();
        if (!isAtEnd()) {
            throw error(peek(), "Unexpected trailing token " + describe(peek()) + " after expression.");
        }
        Debug.get().d(TAG, "parsed " + root);
        return root;
    }

    private ExprInterface expression() {
        if (check(TokenType.NUMBER)) return number(advance());
        if (check(TokenType.IDENTIFIER)) return new Var(advance().lexeme);
        if (check(TokenType.LEFT_PAREN)) return list();
        throw error(peek(), "Unexpected token " + describe(peek()) + ", expect expression.");
    }

    private ExprInterface list() {
        Token open = consume(TokenType.LEFT_PAREN, "Expect '('.");
        if (++depth > maxDepth) {
            throw error(open, "Expression nested deeper than " + maxDepth + " levels.");
        }
        try {
            Token head = consume(TokenType.IDENTIFIER, "Expect operator name after '('.");
            if (Expr.LET.equals(head.lexeme)) return letBody();
            return callBody(head);
        } finally {
            depth--;
        }
    }

    // after "(let"
    private ExprInterface letBody() {
        consume(TokenType.LEFT_PAREN, "Expect '(' before let bindings.");
        List<Binding> bindings = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (isAtEnd()) throw error(peek(), "Expect ')' after let bindings.");
            bindings.add(binding());
        }
        if (bindings.isEmpty()) throw error(peek(), "Expect at least one let binding.");
        consume(TokenType.RIGHT_PAREN, "Expect ')' after let bindings.");

        ExprInterface body = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after let body.");
        return new Let(bindings, body);
    }

    private Binding binding() {
        consume(TokenType.LEFT_PAREN, "Expect '(' before binding.");
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name in binding.");
        ExprInterface value = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after binding value.");
        return new Binding(name.lexeme, value);
    }

    // after "(" head
    private ExprInterface callBody(Token head) {
        List<ExprInterface> args = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (isAtEnd()) throw error(peek(), "Expect ')' after arguments to '" + head.lexeme + "'.");
            args.add(expression());
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments to '" + head.lexeme + "'.");
        if (mode == ArityMode.STRICT) checkArity(head, args.size());
        return new Call(head.lexeme, args);
    }

    private void checkArity(Token head, int count) {
        switch (head.lexeme) {
            case Expr.ADD:
            case Expr.SUBTRACT:
                if (count != 2) throw error(head, "'" + head.lexeme + "' expects 2 arguments, got " + count + ".");
                break;
            case Expr.READ:
                if (count != 0) throw error(head, "'read' expects no arguments, got " + count + ".");
                break;
            default:
                break;
        }
    }

    private Expr.Number number(Token token) {
        try {
            return new Expr.Number(Integer.parseInt(token.lexeme));
        } catch (NumberFormatException e) {
            throw new MalformedInputException(token.line, "Number literal out of range: " + token.lexeme, e);
        }
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private static String describe(Token token) {
        return token.type == TokenType.EOF ? "end of input" : "'" + token.lexeme + "'";
    }

    private MalformedInputException error(Token token, String message) {
        return new MalformedInputException(token.line, message);
    }
}
