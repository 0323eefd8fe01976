package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.exception.UnreducibleExpressionException;

import java.util.Objects;

/**
 * Typed abstract syntax tree of the boolean language.
 * <p>
 * The language has exactly six forms, modeled as the record variants of this sealed interface:
 * </p>
 * <table border="1">
 * <caption>Expression forms</caption>
 * <thead>
 * <tr><th>Variant</th><th>Children</th><th>Meaning</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@link True}</td><td>none</td><td>literal true</td></tr>
 * <tr><td>{@link False}</td><td>none</td><td>literal false</td></tr>
 * <tr><td>{@link Not}</td><td>e</td><td>negation</td></tr>
 * <tr><td>{@link And}</td><td>e1, e2</td><td>conjunction</td></tr>
 * <tr><td>{@link Or}</td><td>e1, e2</td><td>disjunction</td></tr>
 * <tr><td>{@link If}</td><td>c, e1, e2</td><td>conditional</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Rendering</h2>
 * <p>
 * {@link Object#toString()} produces the canonical textual form: the variant name followed by the
 * comma-separated renderings of its children, with no spaces. Nullary variants render as their bare name.
 * </p>
 * <pre>{@code
 * new Expr.And(Expr.TRUE, Expr.FALSE).toString();              // "And(True,False)"
 * new Expr.If(new Expr.Not(Expr.TRUE), Expr.FALSE, Expr.TRUE); // "If(Not(True),False,True)"
 * }</pre>
 *
 * <p>
 * Instances are immutable and compared structurally: two {@code And(True,False)} nodes are equal
 * whatever way they were built. Children are never null.
 * </p>
 *
 * @see ExprParser
 * @see ExprEvaluator
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Expr {

    Expr TRUE = new True();

    Expr FALSE = new False();

    /**
     * Returns the literal matching a Java boolean.
     *
     * @param value the boolean value
     * @return {@link #TRUE} or {@link #FALSE}
     */
    static Expr of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * @return {@code true} if this node is {@link True} or {@link False}
     */
    default boolean isLiteral() {
        return this instanceof True || this instanceof False;
    }

    /**
     * Converts a literal to its Java boolean value.
     *
     * @return the value of this literal
     * @throws UnreducibleExpressionException if this node is not a literal
     */
    default boolean asBoolean() {
        if (this instanceof True) return true;
        if (this instanceof False) return false;
        throw new UnreducibleExpressionException("Expression is not a literal: " + this);
    }

    record True() implements Expr {
        @Override
        public String toString() {
            return "True";
        }
    }

    record False() implements Expr {
        @Override
        public String toString() {
            return "False";
        }
    }

    record Not(Expr e) implements Expr {
        public Not {
            Objects.requireNonNull(e, "operand cannot be null");
        }

        @Override
        public String toString() {
            return "Not(" + e + ")";
        }
    }

    record And(Expr e1, Expr e2) implements Expr {
        public And {
            Objects.requireNonNull(e1, "left operand cannot be null");
            Objects.requireNonNull(e2, "right operand cannot be null");
        }

        @Override
        public String toString() {
            return "And(" + e1 + "," + e2 + ")";
        }
    }

    record Or(Expr e1, Expr e2) implements Expr {
        public Or {
            Objects.requireNonNull(e1, "left operand cannot be null");
            Objects.requireNonNull(e2, "right operand cannot be null");
        }

        @Override
        public String toString() {
            return "Or(" + e1 + "," + e2 + ")";
        }
    }

    record If(Expr c, Expr e1, Expr e2) implements Expr {
        public If {
            Objects.requireNonNull(c, "condition cannot be null");
            Objects.requireNonNull(e1, "then branch cannot be null");
            Objects.requireNonNull(e2, "else branch cannot be null");
        }

        @Override
        public String toString() {
            return "If(" + c + "," + e1 + "," + e2 + ")";
        }
    }
}
