package io.github.cyfko.boolexpr.core.parsing;

import io.github.cyfko.boolexpr.core.config.ExprPolicy;
import io.github.cyfko.boolexpr.core.exception.InvalidSyntaxException;
import io.github.cyfko.boolexpr.sexpr.SExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads source text into a {@link SExpr} tree.
 * <p>
 * Tokens are {@code (}, {@code )} and runs of characters separated by whitespace or parentheses.
 * Atom names are upper-cased, so {@code (and t f)} and {@code (AND T F)} read the same tree.
 * Only limit and parenthesis errors are detected here; grammar checks belong to the parser.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * SExpr tree = SExprReader.read("(IF (NOT F) T F)");
 * Expr expr = new BasicExprParser().parse(tree);   // If(Not(False),True,False)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SExprReader {

    private SExprReader() {}

    public static SExpr read(String source) {
        return read(source, ExprPolicy.defaults());
    }

    /**
     * Reads exactly one symbolic expression from the given text.
     *
     * @param source    the text to read
     * @param exprPolicy limits applied to the text length and the nesting depth
     * @return the tree
     * @throws InvalidSyntaxException if the text is empty, too long, too deep, unbalanced, or holds more
     *                                than one expression
     */
    public static SExpr read(String source, ExprPolicy exprPolicy) {
        Objects.requireNonNull(exprPolicy, "Expression policy is required");
        if (source == null || source.isBlank()) {
            throw new InvalidSyntaxException("Expression source cannot be null or empty");
        }

        String trimmed = source.trim();

        if (trimmed.length() > exprPolicy.maxExpressionLength()) {
            throw new InvalidSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    trimmed.length(), exprPolicy.maxExpressionLength(), exprPolicy.policyName()
            ));
        }

        List<String> tokens = tokenize(trimmed);
        int[] pos = {0};
        SExpr result = readExpr(tokens, pos, 1, exprPolicy);
        if (pos[0] != tokens.size()) {
            throw new InvalidSyntaxException("Unexpected token '" + tokens.get(pos[0]) + "' after complete expression");
        }
        return result;
    }

    private static SExpr readExpr(List<String> tokens, int[] pos, int depth, ExprPolicy exprPolicy) {
        if (depth > exprPolicy.maxDepth()) {
            throw new InvalidSyntaxException(String.format(
                    "Expression too deeply nested (max depth: %d). Policy applied: %s",
                    exprPolicy.maxDepth(), exprPolicy.policyName()
            ));
        }

        String token = tokens.get(pos[0]++);

        if (token.equals(")")) {
            throw new InvalidSyntaxException("Mismatched parentheses: unmatched ')'");
        }
        if (!token.equals("(")) {
            return SExpr.atom(token.toUpperCase(Locale.ROOT));
        }

        List<SExpr> items = new ArrayList<>();
        while (true) {
            if (pos[0] >= tokens.size()) {
                throw new InvalidSyntaxException("Mismatched parentheses: unmatched '('");
            }
            if (tokens.get(pos[0]).equals(")")) {
                pos[0]++;
                return SExpr.list(items);
            }
            items.add(readExpr(tokens, pos, depth + 1, exprPolicy));
        }
    }

    static List<String> tokenize(String source) {
        List<String> tokens = new ArrayList<>();
        StringBuilder currentToken = new StringBuilder();

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);

            if (Character.isWhitespace(c)) {
                flushToken(currentToken, tokens);
            } else if (c == '(' || c == ')') {
                flushToken(currentToken, tokens);
                tokens.add(String.valueOf(c));
            } else {
                currentToken.append(c);
            }
        }

        flushToken(currentToken, tokens);
        return tokens;
    }

    private static void flushToken(StringBuilder currentToken, List<String> tokens) {
        if (currentToken.length() == 0) return;
        tokens.add(currentToken.toString());
        currentToken.setLength(0);
    }
}
