package com.lispcalc.eval;

import java.util.ArrayList;
import java.util.List;

import com.lispcalc.debug.Debug;
import com.lispcalc.parser.Expr;
import com.lispcalc.parser.Expr.Binding;
import com.lispcalc.parser.Expr.Call;
import com.lispcalc.parser.Expr.ExprInterface;
import com.lispcalc.parser.Expr.ExprVisitor;
import com.lispcalc.parser.Expr.Let;
import com.lispcalc.parser.Expr.Var;

/**
 * Constant folding as a pure bottom-up rewrite. The input tree is never modified.
 *
 * Only {@code +} and {@code -} are folded. {@code read} and uninterpreted calls come back as
 * they are, so every effect of the input tree survives in the same order. Never does I/O
 * and never throws; at worst the result equals the input.
 */
public final class PartialEvaluator implements ExprVisitor<ExprInterface> {
    private static final String TAG = "lispcalc.pe";

    private static final PartialEvaluator INSTANCE = new PartialEvaluator();

    private PartialEvaluator() {}

    public static ExprInterface partialEvaluate(ExprInterface expr) {
        ExprInterface out = expr.accept(INSTANCE);
        Debug.get().d(TAG, expr + " => " + out);
        return out;
    }

    @Override
    public ExprInterface visitNumberExpr(Expr.Number expr) {
        return expr;
    }

    @Override
    public ExprInterface visitCallExpr(Call expr) {
        switch (expr.operator) {
            case Expr.ADD:
                return foldAdd(expr);
            case Expr.SUBTRACT:
                return expr.args.isEmpty() ? expr : foldSubtract(expr);
            default:
                // read and uninterpreted operators are opaque
                return expr;
        }
    }

    @Override
    public ExprInterface visitLetExpr(Let expr) {
        List<Binding> bindings = new ArrayList<>(expr.bindings.size());
        for (Binding b : expr.bindings) {
            bindings.add(new Binding(b.name, b.value.accept(this)));
        }
        return new Let(bindings, expr.body.accept(this));
    }

    @Override
    public ExprInterface visitVarExpr(Var expr) {
        return expr;
    }

    private ExprInterface foldAdd(Call expr) {
        Split split = split(expr.args, 0);
        if (split.residual.isEmpty()) return new Expr.Number(split.sum);

        List<ExprInterface> args = new ArrayList<>(split.residual.size() + 1);
        args.add(new Expr.Number(split.sum));
        args.addAll(split.residual);
        return new Call(Expr.ADD, args);
    }

    private ExprInterface foldSubtract(Call expr) {
        ExprInterface minuend = expr.args.get(0).accept(this);
        Split split = split(expr.args, 1);

        List<ExprInterface> args = new ArrayList<>(split.residual.size() + 2);
        if (minuend instanceof Expr.Number) {
            int m = ((Expr.Number) minuend).value;
            if (split.residual.isEmpty()) return new Expr.Number(m - split.sum);
            args.add(new Expr.Number(m - split.sum));
            args.addAll(split.residual);
        } else {
            // constant subtrahend total goes last
            args.add(minuend);
            args.addAll(split.residual);
            args.add(new Expr.Number(split.sum));
        }
        return new Call(Expr.SUBTRACT, args);
    }

    /** Folds {@code args[from..]} and separates constant results from residual ones. */
    private Split split(List<ExprInterface> args, int from) {
        Split split = new Split();
        for (int i = from; i < args.size(); i++) {
            ExprInterface folded = args.get(i).accept(this);
            if (folded instanceof Expr.Number) {
                split.sum += ((Expr.Number) folded).value;
            } else {
                split.residual.add(folded);
            }
        }
        return split;
    }

    private static final class Split {
        int sum = 0;
        final List<ExprInterface> residual = new ArrayList<>();
    }
}
