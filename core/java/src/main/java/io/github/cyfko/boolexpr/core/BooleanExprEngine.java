package io.github.cyfko.boolexpr.core;

import io.github.cyfko.boolexpr.core.api.Expr;
import io.github.cyfko.boolexpr.core.api.ExprEvaluator;
import io.github.cyfko.boolexpr.core.api.ExprParser;
import io.github.cyfko.boolexpr.core.config.ExprPolicy;
import io.github.cyfko.boolexpr.core.exception.InvalidSyntaxException;
import io.github.cyfko.boolexpr.core.exception.UnreducibleExpressionException;
import io.github.cyfko.boolexpr.core.impl.BasicExprParser;
import io.github.cyfko.boolexpr.core.impl.ShortCircuitEvaluator;
import io.github.cyfko.boolexpr.core.parsing.SExprReader;
import io.github.cyfko.boolexpr.sexpr.SExpr;

import java.util.logging.Logger;

/**
 * High-level facade running the whole boolean expression pipeline.
 *
 * <p><strong>Architecture Overview:</strong></p>
 * <ol>
 *   <li><strong>Read:</strong> Turn source text into a {@link SExpr} tree using {@link SExprReader}</li>
 *   <li><strong>Parse:</strong> Translate the tree into an {@link Expr} using an {@link ExprParser}</li>
 *   <li><strong>Evaluate:</strong> Reduce the expression to a literal using an {@link ExprEvaluator}</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * BooleanExprEngine engine = new BooleanExprEngine();
 *
 * engine.parse("(AND T (NOT F))");        // And(True,Not(False))
 * engine.evaluate("(AND T (NOT F))");     // True
 * engine.test("(IF F T F)");              // false
 *
 * // Trees built in code
 * engine.evaluate(SExpr.list(SExpr.OR, SExpr.F, SExpr.T)); // True
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link InvalidSyntaxException} - text or tree outside the grammar, or beyond the policy limits</li>
 *   <li>{@link UnreducibleExpressionException} - expression outside the six known forms</li>
 * </ul>
 * Errors are propagated unchanged, and the evaluator is never invoked for input the parser rejected.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BooleanExprEngine {

    private static final Logger log = Logger.getLogger(BooleanExprEngine.class.getName());

    private static final int MAX_LOGGED_LENGTH = 200;

    private final ExprPolicy exprPolicy;
    private final ExprParser parser;
    private final ExprEvaluator evaluator;

    /**
     * Creates an engine with {@link ExprPolicy#defaults()}.
     */
    public BooleanExprEngine() {
        this(ExprPolicy.defaults());
    }

    /**
     * Creates an engine using the default parser and evaluator under the given policy.
     *
     * @param exprPolicy the limits applied to read and translated expressions
     */
    public BooleanExprEngine(ExprPolicy exprPolicy) {
        this(exprPolicy, new BasicExprParser(exprPolicy), new ShortCircuitEvaluator());
    }

    /**
     * Creates an engine from explicit collaborators.
     *
     * @param exprPolicy the limits applied when reading source text
     * @param parser     the tree translator
     * @param evaluator  the expression reducer
     * @throws IllegalArgumentException if any argument is null
     */
    public BooleanExprEngine(ExprPolicy exprPolicy, ExprParser parser, ExprEvaluator evaluator) {
        if (exprPolicy == null) {
            throw new IllegalArgumentException("Expression policy is required");
        }
        if (parser == null) {
            throw new IllegalArgumentException("Expression parser is required");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("Expression evaluator is required");
        }
        this.exprPolicy = exprPolicy;
        this.parser = parser;
        this.evaluator = evaluator;
    }

    public Expr parse(String source) {
        return parse(SExprReader.read(source, exprPolicy));
    }

    public Expr parse(SExpr tree) {
        return parser.parse(tree);
    }

    /**
     * Reads, translates and reduces the given source text.
     *
     * @param source the expression text, e.g. {@code (OR F (NOT F))}
     * @return {@link Expr#TRUE} or {@link Expr#FALSE}
     */
    public Expr evaluate(String source) {
        return evaluate(SExprReader.read(source, exprPolicy));
    }

    /**
     * Translates and reduces the given tree.
     *
     * @param tree the symbolic expression
     * @return {@link Expr#TRUE} or {@link Expr#FALSE}
     */
    public Expr evaluate(SExpr tree) {
        Expr expr = parseOrReport(tree);

        long start = System.nanoTime();
        Expr result = evaluator.eval(expr);
        long durationMicros = (System.nanoTime() - start) / 1_000;

        log.fine(() -> String.format("Evaluated %s to %s in %d µs", expr, result, durationMicros));
        return result;
    }

    private Expr parseOrReport(SExpr tree) {
        try {
            return parser.parse(tree);
        } catch (InvalidSyntaxException e) {
            log.warning(() -> String.format("Rejected expression %s: %s", SExpr.render(tree, MAX_LOGGED_LENGTH), e.getMessage()));
            throw e;
        }
    }

    /**
     * Evaluates the given source text to a Java boolean.
     *
     * @param source the expression text
     * @return the value of the expression
     */
    public boolean test(String source) {
        return evaluate(source).asBoolean();
    }
}
