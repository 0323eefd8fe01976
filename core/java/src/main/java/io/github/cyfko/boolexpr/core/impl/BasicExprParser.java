package io.github.cyfko.boolexpr.core.impl;

import io.github.cyfko.boolexpr.core.api.Expr;
import io.github.cyfko.boolexpr.core.api.ExprParser;
import io.github.cyfko.boolexpr.core.config.ExprPolicy;
import io.github.cyfko.boolexpr.core.exception.InvalidSyntaxException;
import io.github.cyfko.boolexpr.sexpr.SExpr;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Recursive-descent implementation of {@link ExprParser}.
 * <p>
 * Each tree is first normalized with {@link SExpr#unwrapSingleton()}, so that a literal and a
 * one-element sequence wrapping it are accepted by the same match arm. The normalized tree is then
 * matched against the recognized forms and every operand is translated recursively.
 * </p>
 *
 * <h2>Complexity Limits</h2>
 * <p>
 * The nesting depth of the translated tree is limited by {@link ExprPolicy#maxDepth()}. Deeper trees are
 * rejected with an {@link InvalidSyntaxException} before any stack exhaustion can happen, here or in the
 * evaluator.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * ExprParser parser = new BasicExprParser();
 * Expr expr = parser.parse(SExpr.list(SExpr.IF, SExpr.T, SExpr.F, SExpr.T)); // If(True,False,True)
 *
 * // Strict limits for untrusted trees
 * ExprParser strictParser = new BasicExprParser(ExprPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicExprParser implements ExprParser {

    private static final Logger log = Logger.getLogger(BasicExprParser.class.getName());

    private static final Map<SExpr, Integer> OPERATOR_ARITY = Map.of(
            SExpr.NOT, 1,
            SExpr.AND, 2,
            SExpr.OR, 2,
            SExpr.IF, 3
    );

    /** Character budget for the offending subtree quoted in error messages. */
    static final int MAX_QUOTED_LENGTH = 200;

    private final ExprPolicy exprPolicy;

    /**
     * Default constructor using {@link ExprPolicy#defaults()}.
     */
    public BasicExprParser() {
        this(ExprPolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param exprPolicy the limits applied to translated trees
     * @throws IllegalArgumentException if exprPolicy is null
     */
    public BasicExprParser(ExprPolicy exprPolicy) {
        if (exprPolicy == null) {
            throw new IllegalArgumentException("Expression policy is required");
        }
        this.exprPolicy = exprPolicy;
    }

    @Override
    public Expr parse(SExpr tree) throws InvalidSyntaxException {
        if (tree == null) {
            throw new InvalidSyntaxException("Symbolic expression cannot be null");
        }

        Expr expr = translate(tree, 1);
        log.fine(() -> String.format("Translated %s into %s", SExpr.render(tree, MAX_QUOTED_LENGTH), expr));
        return expr;
    }

    private Expr translate(SExpr tree, int depth) {
        if (depth > exprPolicy.maxDepth()) {
            throw new InvalidSyntaxException(String.format(
                    "Expression too deeply nested (max depth: %d). Policy applied: %s",
                    exprPolicy.maxDepth(), exprPolicy.policyName()
            ));
        }

        SExpr node = tree.unwrapSingleton();

        if (SExpr.T.equals(node)) return Expr.TRUE;
        if (SExpr.F.equals(node)) return Expr.FALSE;

        if (node instanceof SExpr.SAtom atom) {
            throw invalid(OPERATOR_ARITY.containsKey(atom)
                    ? "operator " + atom + " used without operands"
                    : "unknown atom '" + atom + "'", node);
        }
        if (!(node instanceof SExpr.SCons form)) {
            throw invalid("empty expression", node);
        }
        if (!(form.head() instanceof SExpr.SAtom operator)) {
            throw invalid("operator position holds " + SExpr.render(form.head(), MAX_QUOTED_LENGTH)
                    + " instead of an operator", node);
        }

        Integer arity = OPERATOR_ARITY.get(operator);
        if (arity == null) {
            throw invalid("unknown operator '" + operator + "'", node);
        }

        List<SExpr> operands = form.tail().elements()
                .orElseThrow(() -> invalid("operands of " + operator + " do not form a proper list", node));
        if (operands.size() != arity) {
            throw invalid(String.format("%s expects %d operand(s) but got %d", operator, arity, operands.size()), node);
        }

        return switch (operator.name()) {
            case "NOT" -> new Expr.Not(translate(operands.get(0), depth + 1));
            case "AND" -> new Expr.And(translate(operands.get(0), depth + 1), translate(operands.get(1), depth + 1));
            case "OR" -> new Expr.Or(translate(operands.get(0), depth + 1), translate(operands.get(1), depth + 1));
            case "IF" -> new Expr.If(
                    translate(operands.get(0), depth + 1),
                    translate(operands.get(1), depth + 1),
                    translate(operands.get(2), depth + 1)
            );
            default -> throw invalid("unknown operator '" + operator + "'", node);
        };
    }

    private static InvalidSyntaxException invalid(String reason, SExpr node) {
        return new InvalidSyntaxException("Invalid syntax: " + reason + " in " + SExpr.render(node, MAX_QUOTED_LENGTH));
    }
}
