package com.lispcalc;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.lispcalc.eval.ConsoleLineSource;
import com.lispcalc.eval.Environment;
import com.lispcalc.eval.Interpreter;
import com.lispcalc.eval.LineSource;
import com.lispcalc.eval.PartialEvaluator;
import com.lispcalc.parser.Expr.ExprInterface;
import com.lispcalc.parser.Lexer;
import com.lispcalc.parser.Parser;
import com.lispcalc.parser.Token;
import com.lispcalc.print.AstJson;
import com.lispcalc.print.AstPrinter;

/**
 * LispCalc engine.
 *
 * - S-expression syntax: numbers, (+ a b), (- a b), (read), (let ((x e) ...) body), x
 * - Values: int only
 * - Pipeline: tokenize -> parse -> visualize / evaluate / partialEvaluate
 * - Mode:
 *     - STRICT (default): '+' and '-' take exactly two arguments, 'read' none; checked while parsing
 *     - VARIADIC: any arity parses; '+' sums all, '-' subtracts the sum of the rest
 *
 * Every failure is a {@link com.lispcalc.error.LispCalcException} subclass and propagates to the caller.
 */
public class LispCalc {

    /** Arity policy applied by the parser. Default STRICT. */
    public enum ArityMode {
        STRICT,
        VARIADIC
    }

    private ArityMode arityMode = ArityMode.STRICT;
    private int maxDepth = Parser.DEFAULT_MAX_DEPTH;
    private LineSource lineSource = new ConsoleLineSource();

    public void setArityMode(ArityMode mode) { this.arityMode = (mode == null) ? ArityMode.STRICT : mode; }

    public ArityMode getArityMode() { return arityMode; }

    public void setMaxDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got " + depth);
        this.maxDepth = depth;
    }

    public int getMaxDepth() { return maxDepth; }

    /** Input for {@code read}. Defaults to stdin with a "> " prompt on stdout. */
    public void setLineSource(LineSource lineSource) {
        this.lineSource = (lineSource == null) ? new ConsoleLineSource() : lineSource;
    }

    // ===================== PIPELINE =====================

    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public ExprInterface parse(List<Token> tokens) {
        return new Parser(tokens, arityMode, maxDepth).parse();
    }

    public ExprInterface parse(String source) {
        return parse(tokenize(source));
    }

    public String visualize(ExprInterface expr) {
        return AstPrinter.print(expr);
    }

    public int evaluate(ExprInterface expr) {
        return Interpreter.evaluate(expr, lineSource);
    }

    public int evaluate(String source) {
        return evaluate(parse(source));
    }

    /** Evaluates against a caller-owned environment, which keeps every binding made. */
    public int evaluate(ExprInterface expr, Environment env) {
        return new Interpreter(env, lineSource).eval(expr);
    }

    public ExprInterface partialEvaluate(ExprInterface expr) {
        return PartialEvaluator.partialEvaluate(expr);
    }

    public JsonNode toJson(ExprInterface expr) {
        return AstJson.toJson(expr);
    }
}
