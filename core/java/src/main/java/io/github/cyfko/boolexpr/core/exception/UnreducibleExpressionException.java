package io.github.cyfko.boolexpr.core.exception;

import io.github.cyfko.boolexpr.core.api.ExprEvaluator;

/**
 * Exception thrown when an expression cannot be reduced to a literal.
 * <p>
 * Trees produced by the parser are always reducible, so this exception signals an AST built by
 * other means that escaped validation, or a request for the boolean value of a compound node.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExprEvaluator
 */
public class UnreducibleExpressionException extends RuntimeException {

    /**
     * @param message the message describing the cause of the exception
     */
    public UnreducibleExpressionException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public UnreducibleExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
