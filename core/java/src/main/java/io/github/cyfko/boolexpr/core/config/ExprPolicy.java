package io.github.cyfko.boolexpr.core.config;

/**
 * Input limits applied when reading and translating boolean expressions.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of a source text (default: 5000)</li>
 *   <li><strong>maxDepth</strong>: Maximum nesting depth of an expression tree (default: 512)</li>
 * </ul>
 * <p>
 * The depth limit also bounds the recursion of the evaluator, since it only ever sees trees
 * accepted by the parser.
 * </p>
 * <p>
 * Depth is measured differently by the two stages. The reader counts every parenthesis level, so
 * {@code (((T)))} has depth 4 there. The parser counts operator levels only, since one-element
 * wrappers are unwrapped before matching, so the same tree has depth 1 there. A source text
 * therefore needs the budget of its raw nesting, while a tree built in code is checked on its
 * operator nesting alone.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ExprPolicy policy = ExprPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * ExprPolicy policy = ExprPolicy.strict();
 *
 * // Relaxed (for trusted generated expressions)
 * ExprPolicy policy = ExprPolicy.relaxed();
 *
 * // Custom
 * ExprPolicy policy = ExprPolicy.builder()
 *     .maxDepth(128)
 *     .build();
 * }</pre>
 *
 * @param policyName name reported in limit violation messages
 * @param maxExpressionLength maximum character length of a source text
 * @param maxDepth maximum nesting depth: parenthesis levels when reading, operator levels when parsing
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ExprPolicy(
    String policyName,
    int maxExpressionLength,
    int maxDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ExprPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Depth: 512</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ExprPolicy defaults() {
        return new ExprPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 512);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Depth: 64</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ExprPolicy strict() {
        return new ExprPolicy(PolicyName.STRICT_POLICY.name(), 1000, 64);
    }

    /**
     * Relaxed configuration for trusted, machine generated expressions.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Depth: 2048</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ExprPolicy relaxed() {
        return new ExprPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 2048);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxDepth = 512;

        private Builder() {}

        public ExprPolicy build() {
            return new ExprPolicy(_policyName, _maxExpressionLength, _maxDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
