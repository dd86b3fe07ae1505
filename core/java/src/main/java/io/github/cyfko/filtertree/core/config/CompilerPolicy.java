package io.github.cyfko.filtertree.core.config;

/**
 * Structural limits applied to a filter tree before it is compiled.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxDepth</strong>: deepest node level accepted, the root being level 1 (default: 64)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * CompilerPolicy policy = CompilerPolicy.defaults();
 *
 * // Strict (for trees built from untrusted payloads)
 * CompilerPolicy policy = CompilerPolicy.strict();
 *
 * // Relaxed (for internal, generated trees)
 * CompilerPolicy policy = CompilerPolicy.relaxed();
 *
 * // Custom
 * CompilerPolicy policy = CompilerPolicy.builder()
 *     .maxDepth(32)
 *     .build();
 * }</pre>
 *
 * @param policyName name reported in logs and error messages
 * @param maxDepth   maximum node depth, root included
 * @since 1.0.0
 */
public record CompilerPolicy(String policyName, int maxDepth) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or the depth is not positive
     */
    public CompilerPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }

    /**
     * @return policy accepting trees up to 64 levels deep
     */
    public static CompilerPolicy defaults() {
        return new CompilerPolicy(PolicyName.DEFAULT_POLICY.name(), 64);
    }

    /**
     * @return policy accepting trees up to 16 levels deep
     */
    public static CompilerPolicy strict() {
        return new CompilerPolicy(PolicyName.STRICT_POLICY.name(), 16);
    }

    /**
     * @return policy accepting trees up to 256 levels deep
     */
    public static CompilerPolicy relaxed() {
        return new CompilerPolicy(PolicyName.RELAXED_POLICY.name(), 256);
    }

    /**
     * Builder parameters are initialized exactly as in {@link #defaults()}, apart from the name.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxDepth = 64;

        private Builder() {}

        public CompilerPolicy build() {
            return new CompilerPolicy(_policyName, _maxDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
