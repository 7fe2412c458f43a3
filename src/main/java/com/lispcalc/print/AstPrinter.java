package com.lispcalc.print;

import java.util.List;

import com.lispcalc.parser.Expr;
import com.lispcalc.parser.Expr.Binding;
import com.lispcalc.parser.Expr.Call;
import com.lispcalc.parser.Expr.ExprInterface;
import com.lispcalc.parser.Expr.ExprVisitor;
import com.lispcalc.parser.Expr.Let;
import com.lispcalc.parser.Expr.Var;

/**
 * Prints an AST back as fully parenthesised canonical source. Lexing and parsing the output
 * yields a structurally equal tree.
 */
public final class AstPrinter implements ExprVisitor<String> {

    private static final AstPrinter INSTANCE = new AstPrinter();

    private AstPrinter() {}

    public static String print(ExprInterface expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitNumberExpr(Expr.Number expr) {
        return Integer.toString(expr.value);
    }

    @Override
    public String visitCallExpr(Call expr) {
        return parenthesise(expr.operator, expr.args);
    }

    @Override
    public String visitLetExpr(Let expr) {
        StringBuilder builder = new StringBuilder();
        builder.append("(let (");
        for (int i = 0; i < expr.bindings.size(); i++) {
            Binding b = expr.bindings.get(i);
            if (i > 0) builder.append(' ');
            builder.append('(').append(b.name).append(' ').append(b.value.accept(this)).append(')');
        }
        builder.append(") ").append(expr.body.accept(this)).append(')');
        return builder.toString();
    }

    @Override
    public String visitVarExpr(Var expr) {
        return expr.name;
    }

    private String parenthesise(String name, List<ExprInterface> exprs) {
        StringBuilder builder = new StringBuilder();
        builder.append('(').append(name);
        for (ExprInterface expr : exprs) {
            builder.append(' ').append(expr.accept(this));
        }
        builder.append(')');
        return builder.toString();
    }
}
