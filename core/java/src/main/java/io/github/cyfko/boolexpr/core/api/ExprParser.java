package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.exception.InvalidSyntaxException;
import io.github.cyfko.boolexpr.sexpr.SExpr;

/**
 * Translator from untyped symbolic-expression trees to the typed {@link Expr} AST.
 * <p>
 * This interface defines the translation contract of the boolean language. The input is a generic
 * {@link SExpr} tree; the output is a structurally equivalent tree made of the six {@link Expr} variants.
 * </p>
 *
 * <h2>Grammar</h2>
 * <pre>
 * expr := T
 *       | F
 *       | (NOT expr)
 *       | (AND expr expr)
 *       | (OR  expr expr)
 *       | (IF  expr expr expr)
 *       | (expr)              ; a one-element sequence stands for its element
 * </pre>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExprParser parser = new BasicExprParser();
 *
 * parser.parse(SExpr.T);                                        // True
 * parser.parse(SExpr.list(SExpr.T));                            // True
 * parser.parse(SExpr.list(SExpr.AND, SExpr.T, SExpr.F));        // And(True,False)
 * parser.parse(SExpr.list(SExpr.NOT, SExpr.list(SExpr.OR, SExpr.F, SExpr.T)));
 *                                                               // Not(Or(False,True))
 * }</pre>
 *
 * <h3>Invalid Tree Examples</h3>
 * <pre>{@code
 * parser.parse(SExpr.list(SExpr.AND, SExpr.T));                 // wrong arity
 * parser.parse(SExpr.list(SExpr.atom("XOR"), SExpr.T, SExpr.F)); // unknown operator
 * parser.parse(SExpr.NIL);                                      // empty sequence
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Must never return a partially constructed node</li>
 *   <li>Must produce structurally equal results for identical input</li>
 *   <li>Must not keep state between calls</li>
 * </ul>
 *
 * @see Expr
 * @see InvalidSyntaxException
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExprParser {

    /**
     * Translates a symbolic-expression tree into an {@link Expr}.
     *
     * @param tree the tree to translate
     * @return the typed expression
     * @throws InvalidSyntaxException if the tree is null or does not match one of the recognized forms
     */
    Expr parse(SExpr tree) throws InvalidSyntaxException;
}
