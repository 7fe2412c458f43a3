package com.lispcalc.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.lispcalc.print.AstPrinter;

/**
 * AST node types. The set is closed: every stage implements {@link ExprVisitor}, so adding a
 * node means adding a visit method and the compiler points at every stage that must handle it.
 *
 * Nodes are immutable values with structural equality.
 */
public class Expr {

    public static final String ADD = "+";
    public static final String SUBTRACT = "-";
    public static final String READ = "read";
    public static final String LET = "let";

    private Expr() {}

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitNumberExpr(Number expr);
        R visitCallExpr(Call expr);
        R visitLetExpr(Let expr);
        R visitVarExpr(Var expr);
    }

    // -------------------------
    // Factories
    // -------------------------

    public static Number number(int value) { return new Number(value); }

    public static Call call(String operator, ExprInterface... args) {
        return new Call(operator, Arrays.asList(args));
    }

    public static Let let(List<Binding> bindings, ExprInterface body) { return new Let(bindings, body); }

    public static Binding binding(String name, ExprInterface value) { return new Binding(name, value); }

    public static Var var(String name) { return new Var(name); }

    // -------------------------
    // Nodes
    // -------------------------

    public static final class Number implements ExprInterface {
        public final int value;

        public Number(int value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumberExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Number && ((Number) o).value == value;
        }

        @Override
        public int hashCode() { return Integer.hashCode(value); }

        @Override
        public String toString() { return Integer.toString(value); }
    }

    /** Operator application. {@code +}, {@code -} and {@code read} are interpreted; any other head is inert. */
    public static final class Call implements ExprInterface {
        public final String operator;
        public final List<ExprInterface> args;

        public Call(String operator, List<ExprInterface> args) {
            this.operator = Objects.requireNonNull(operator, "operator");
            this.args = (args == null)
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Call)) return false;
            Call other = (Call) o;
            return operator.equals(other.operator) && args.equals(other.args);
        }

        @Override
        public int hashCode() { return Objects.hash(operator, args); }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    public static final class Binding {
        public final String name;
        public final ExprInterface value;

        public Binding(String name, ExprInterface value) {
            this.name = Objects.requireNonNull(name, "name");
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binding)) return false;
            Binding other = (Binding) o;
            return name.equals(other.name) && value.equals(other.value);
        }

        @Override
        public int hashCode() { return Objects.hash(name, value); }

        @Override
        public String toString() { return "(" + name + " " + value + ")"; }
    }

    public static final class Let implements ExprInterface {
        public final List<Binding> bindings;
        public final ExprInterface body;

        public Let(List<Binding> bindings, ExprInterface body) {
            this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
            this.body = Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLetExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Let)) return false;
            Let other = (Let) o;
            return bindings.equals(other.bindings) && body.equals(other.body);
        }

        @Override
        public int hashCode() { return Objects.hash(bindings, body); }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    public static final class Var implements ExprInterface {
        public final String name;

        public Var(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVarExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Var && ((Var) o).name.equals(name);
        }

        @Override
        public int hashCode() { return name.hashCode(); }

        @Override
        public String toString() { return name; }
    }
}
