package io.github.cyfko.boolexpr.core.impl;

import io.github.cyfko.boolexpr.core.api.Expr;
import io.github.cyfko.boolexpr.core.api.ExprEvaluator;
import io.github.cyfko.boolexpr.core.exception.UnreducibleExpressionException;

import java.util.logging.Logger;

/**
 * Term-rewriting implementation of {@link ExprEvaluator} honoring short-circuit rules.
 * <p>
 * Case analysis runs in a fixed order: literals first, then the operator rules on literal operands,
 * then the fallback that reduces a compound operand to a literal and applies the operator rule again.
 * For {@link Expr.And}, {@link Expr.Or} and {@link Expr.If} only the leading operand is reduced by the
 * fallback, so an operand discarded by a short-circuit rule is never visited.
 * </p>
 *
 * <p>
 * Every recursive call works on a strictly smaller subtree, hence reduction terminates on any finite tree.
 * Instances hold no state and may be shared.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ShortCircuitEvaluator implements ExprEvaluator {

    private static final Logger log = Logger.getLogger(ShortCircuitEvaluator.class.getName());

    @Override
    public Expr eval(Expr expr) throws UnreducibleExpressionException {
        Expr result = reduce(expr);
        log.fine(() -> String.format("Reduced %s to %s", expr, result));
        return result;
    }

    private Expr reduce(Expr expr) {
        log.finest(() -> "Reducing " + expr);

        if (expr instanceof Expr.True || expr instanceof Expr.False) {
            return expr;
        }

        if (expr instanceof Expr.Not not) {
            if (not.e() instanceof Expr.True) return Expr.FALSE;
            if (not.e() instanceof Expr.False) return Expr.TRUE;
            return reduce(new Expr.Not(reduce(not.e())));
        }

        if (expr instanceof Expr.And and) {
            if (and.e1() instanceof Expr.True) return reduce(and.e2());
            if (and.e1() instanceof Expr.False) return Expr.FALSE;
            return reduce(new Expr.And(reduce(and.e1()), and.e2()));
        }

        if (expr instanceof Expr.Or or) {
            if (or.e1() instanceof Expr.True) return Expr.TRUE;
            if (or.e1() instanceof Expr.False) return reduce(or.e2());
            return reduce(new Expr.Or(reduce(or.e1()), or.e2()));
        }

        if (expr instanceof Expr.If conditional) {
            if (conditional.c() instanceof Expr.True) return reduce(conditional.e1());
            if (conditional.c() instanceof Expr.False) return reduce(conditional.e2());
            return reduce(new Expr.If(reduce(conditional.c()), conditional.e1(), conditional.e2()));
        }

        throw new UnreducibleExpressionException("Unreducible expression: " + expr);
    }
}
