package io.github.cyfko.flatdae.core.config;

/**
 * Limits applied by the lexer and parser to one compilation unit.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxSourceLength</strong>: Maximum character length of the source text (default: 1 000 000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum depth of nested expressions and classes (default: 256)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * ParserPolicy policy = ParserPolicy.defaults();
 * ParserPolicy policy = ParserPolicy.strict();    // untrusted input
 * ParserPolicy policy = ParserPolicy.relaxed();   // generated or trusted sources
 *
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxSourceLength(50_000)
 *     .build();
 * }</pre>
 *
 * @param policyName      name reported in limit violations
 * @param maxSourceLength maximum character length of the source
 * @param maxNestingDepth maximum recursion depth of the descent
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
        String policyName,
        int maxSourceLength,
        int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a limit is not positive or the name is blank
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxSourceLength <= 0) {
            throw new IllegalArgumentException("maxSourceLength must be positive, got: " + maxSourceLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default limits.
     * <ul>
     *   <li>Max Source Length: 1 000 000 characters</li>
     *   <li>Max Nesting Depth: 256</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 1_000_000, 256);
    }

    /**
     * Tight limits for sources coming from untrusted callers.
     * <ul>
     *   <li>Max Source Length: 100 000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 100_000, 64);
    }

    /**
     * Loose limits for generated or otherwise trusted sources.
     * <ul>
     *   <li>Max Source Length: 20 000 000 characters</li>
     *   <li>Max Nesting Depth: 1024</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 20_000_000, 1024);
    }

    /**
     * Creates a custom configuration. Builder fields start at the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxSourceLength = 1_000_000;
        private int _maxNestingDepth = 256;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxSourceLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxSourceLength(int maxSourceLength) { this._maxSourceLength = maxSourceLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
