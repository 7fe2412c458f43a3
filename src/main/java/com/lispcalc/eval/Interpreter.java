package com.lispcalc.eval;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.lispcalc.debug.Debug;
import com.lispcalc.error.ArityMismatchException;
import com.lispcalc.error.InvalidNumericInputException;
import com.lispcalc.error.LispCalcException;
import com.lispcalc.parser.Expr;
import com.lispcalc.parser.Expr.Binding;
import com.lispcalc.parser.Expr.Call;
import com.lispcalc.parser.Expr.ExprInterface;
import com.lispcalc.parser.Expr.ExprVisitor;
import com.lispcalc.parser.Expr.Let;
import com.lispcalc.parser.Expr.Var;

/**
 * Reduces an AST to an int.
 *
 * Arguments are evaluated left to right, the minuend of {@code -} before its subtrahends, so
 * {@code read} prompts and {@code let} bindings happen in source order. Arithmetic wraps on
 * int overflow.
 *
 * Not thread-safe: one instance owns one {@link Environment} for one top-level evaluation.
 */
public class Interpreter implements ExprVisitor<Integer> {
    private static final String TAG = "lispcalc.eval";

    public static final String READ_PROMPT = "> ";

    /** What an uninterpreted operator evaluates to. */
    public static final int UNINTERPRETED_CALL_VALUE = 0;

    private final Environment env;
    private final LineSource lineSource;

    public Interpreter(Environment env, LineSource lineSource) {
        this.env = (env == null) ? new Environment() : env;
        this.lineSource = lineSource;
    }

    /** Evaluates {@code expr} against a fresh environment. */
    public static int evaluate(ExprInterface expr, LineSource lineSource) {
        return new Interpreter(new Environment(), lineSource).eval(expr);
    }

    public int eval(ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public Integer visitNumberExpr(Expr.Number expr) {
        return expr.value;
    }

    @Override
    public Integer visitCallExpr(Call expr) {
        switch (expr.operator) {
            case Expr.ADD:
                return sum(expr, 0);
            case Expr.SUBTRACT: {
                if (expr.args.isEmpty()) {
                    throw new ArityMismatchException(Expr.SUBTRACT, "at least 1 argument", 0);
                }
                int minuend = eval(expr.args.get(0));
                return minuend - sum(expr, 1);
            }
            case Expr.READ:
                if (!expr.args.isEmpty()) {
                    throw new ArityMismatchException(Expr.READ, "no arguments", expr.args.size());
                }
                return read();
            default:
                Debug.get().w(TAG, "uninterpreted call '" + expr.operator + "' evaluates to " + UNINTERPRETED_CALL_VALUE);
                return UNINTERPRETED_CALL_VALUE;
        }
    }

    @Override
    public Integer visitLetExpr(Let expr) {
        for (Binding b : expr.bindings) {
            int value = eval(b.value);
            env.define(b.name, value);
            Debug.get().t(TAG, "bind " + b.name + " = " + value);
        }
        return eval(expr.body);
    }

    @Override
    public Integer visitVarExpr(Var expr) {
        return env.get(expr.name);
    }

    private int sum(Call expr, int from) {
        int total = 0;
        for (int i = from; i < expr.args.size(); i++) {
            total += eval(expr.args.get(i));
        }
        return total;
    }

    private int read() {
        if (lineSource == null) {
            throw new LispCalcException("read: no line source configured");
        }
        String line;
        try {
            line = lineSource.readLine(READ_PROMPT);
        } catch (IOException e) {
            throw new UncheckedIOException("read: input failed", e);
        }
        if (line == null) throw new InvalidNumericInputException(null, null);

        String trimmed = line.trim();
        try {
            int value = Integer.parseInt(trimmed);
            Debug.get().d(TAG, "read " + value);
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidNumericInputException(trimmed, e);
        }
    }
}
