package io.github.cyfko.boolexpr.core.exception;

import io.github.cyfko.boolexpr.core.api.ExprParser;
import io.github.cyfko.boolexpr.core.impl.BasicExprParser;
import io.github.cyfko.boolexpr.core.parsing.SExprReader;

/**
 * Exception thrown when a boolean expression does not match the grammar of the language.
 * <p>
 * It is raised while reading source text into a symbolic-expression tree and while translating
 * such a tree into an {@link io.github.cyfko.boolexpr.core.api.Expr}. No partial result is ever
 * returned alongside it.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Wrong Arity:</strong> {@code (AND T)}, {@code (IF T F)}</li>
 *   <li><strong>Unknown Operator:</strong> {@code (XOR T F)}</li>
 *   <li><strong>Unknown Atom:</strong> {@code MAYBE}</li>
 *   <li><strong>Empty Sequence:</strong> {@code ()}</li>
 *   <li><strong>Unmatched Parentheses:</strong> {@code (AND T F}</li>
 *   <li><strong>Limit Violations:</strong> text too long or tree too deeply nested</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse(SExprReader.read("(AND T)"));
 * // → "Invalid syntax: AND expects 2 operand(s) but got 1 in (AND T)"
 *
 * SExprReader.read("(AND T F");
 * // → "Mismatched parentheses: unmatched '('"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExprParser
 * @see BasicExprParser
 * @see SExprReader
 */
public class InvalidSyntaxException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the cause of the exception
     */
    public InvalidSyntaxException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public InvalidSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
