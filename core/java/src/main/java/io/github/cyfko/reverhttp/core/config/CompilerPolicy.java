package io.github.cyfko.reverhttp.core.config;

/**
 * Limits applied by the parse entry point before any tokenizing happens.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxSourceLength</strong>: maximum number of characters of one source unit (default: 1 000 000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (project sources)
 * CompilerPolicy policy = CompilerPolicy.defaults();
 *
 * // Strict (live editor buffers, untrusted input)
 * CompilerPolicy policy = CompilerPolicy.strict();
 *
 * // Relaxed (generated sources)
 * CompilerPolicy policy = CompilerPolicy.relaxed();
 *
 * // Custom
 * CompilerPolicy policy = CompilerPolicy.builder()
 *     .maxSourceLength(50_000)
 *     .build();
 * }</pre>
 *
 * <p>
 * A source over the limit is never tokenized: the parse entry point returns an empty tree and a
 * single diagnostic naming the policy.
 * </p>
 *
 * @param policyName      name reported in diagnostics
 * @param maxSourceLength maximum number of characters of one source unit
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record CompilerPolicy(
    String policyName,
    int maxSourceLength
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or the length is not positive
     */
    public CompilerPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxSourceLength <= 0) {
            throw new IllegalArgumentException("maxSourceLength must be positive, got: " + maxSourceLength);
        }
    }

    /**
     * @return 1 000 000 characters
     */
    public static CompilerPolicy defaults() {
        return new CompilerPolicy(PolicyName.DEFAULT_POLICY.name(), 1_000_000);
    }

    /**
     * Strict configuration for sources coming from untrusted clients.
     *
     * @return 100 000 characters
     */
    public static CompilerPolicy strict() {
        return new CompilerPolicy(PolicyName.STRICT_POLICY.name(), 100_000);
    }

    /**
     * @return 10 000 000 characters
     */
    public static CompilerPolicy relaxed() {
        return new CompilerPolicy(PolicyName.RELAXED_POLICY.name(), 10_000_000);
    }

    /**
     * Builder parameters start from the {@link #defaults()} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxSourceLength = 1_000_000;

        private Builder() {}

        public CompilerPolicy build() {
            return new CompilerPolicy(_policyName, _maxSourceLength);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxSourceLength(int maxSourceLength) { this._maxSourceLength = maxSourceLength; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
