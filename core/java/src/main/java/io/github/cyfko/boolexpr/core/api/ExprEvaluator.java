package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.exception.UnreducibleExpressionException;

/**
 * Reducer of {@link Expr} trees to a canonical literal.
 * <p>
 * An evaluator rewrites an expression until only {@link Expr#TRUE} or {@link Expr#FALSE} remains.
 * The rewrite rules on literal operands are:
 * </p>
 * <pre>
 * True                =&gt; True
 * False               =&gt; False
 * Not(True)           =&gt; False
 * Not(False)          =&gt; True
 * And(True, e)        =&gt; e
 * And(False, e)       =&gt; False
 * Or(True, e)         =&gt; True
 * Or(False, e)        =&gt; e
 * If(True, e1, e2)    =&gt; e1
 * If(False, e1, e2)   =&gt; e2
 * </pre>
 * <p>
 * Operands that are not literals are reduced first, then the rule is applied again.
 * </p>
 *
 * <pre>{@code
 * ExprEvaluator evaluator = new ShortCircuitEvaluator();
 * Expr expr = new Expr.And(new Expr.Or(Expr.FALSE, Expr.TRUE), new Expr.Not(Expr.FALSE));
 * evaluator.eval(expr); // True
 * }</pre>
 *
 * @see Expr
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExprEvaluator {

    /**
     * Reduces an expression to a literal.
     *
     * @param expr the expression to reduce
     * @return {@link Expr#TRUE} or {@link Expr#FALSE}, never a compound node
     * @throws UnreducibleExpressionException if the tree contains a node outside the six known forms
     */
    Expr eval(Expr expr) throws UnreducibleExpressionException;
}
