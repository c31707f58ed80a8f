package io.github.cyfko.targetql.core.config;

/**
 * Configuration of the document codecs and of their JSON rendering.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>metadataKey</strong>: key of the metadata entry present at every level (default: {@code _metadata})</li>
 *   <li><strong>kindKey</strong>: key, inside the metadata entry, of the type discriminator (default: {@code kind})</li>
 *   <li><strong>criterionKind</strong>: discriminator value of criterion documents (default: {@code Criterion})</li>
 *   <li><strong>writeNullFields</strong>: whether unset target fields are written as {@code null} (default: true)</li>
 *   <li><strong>prettyPrint</strong>: whether JSON output is indented (default: false)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default
 * CodecPolicy policy = CodecPolicy.defaults();
 *
 * // Documents readable by consumers of the legacy "cls" metadata format
 * CodecPolicy policy = CodecPolicy.legacy();
 *
 * // Indented JSON, for logs and fixtures
 * CodecPolicy policy = CodecPolicy.pretty();
 *
 * // Custom
 * CodecPolicy policy = CodecPolicy.builder()
 *     .writeNullFields(false)
 *     .build();
 * }</pre>
 * <p>
 * Whatever the policy, readers also accept the legacy discriminator key {@code cls} and the
 * legacy criterion kind {@code TargetingCriterion}.
 * </p>
 *
 * @param policyName name of the policy, for diagnostics
 * @param metadataKey key of the metadata entry
 * @param kindKey key of the type discriminator inside the metadata entry
 * @param criterionKind discriminator value written for criteria
 * @param writeNullFields whether unset standard target fields are written
 * @param prettyPrint whether JSON output is indented
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public record CodecPolicy(
    String policyName,
    String metadataKey,
    String kindKey,
    String criterionKind,
    boolean writeNullFields,
    boolean prettyPrint
) {

    /** Discriminator key of the legacy document format. */
    public static final String LEGACY_KIND_KEY = "cls";

    /** Criterion discriminator of the legacy document format. */
    public static final String LEGACY_CRITERION_KIND = "TargetingCriterion";

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a key or name is blank
     */
    public CodecPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (metadataKey == null || metadataKey.isBlank()) {
            throw new IllegalArgumentException("metadataKey is required");
        }
        if (kindKey == null || kindKey.isBlank()) {
            throw new IllegalArgumentException("kindKey is required");
        }
        if (criterionKind == null || criterionKind.isBlank()) {
            throw new IllegalArgumentException("criterionKind is required");
        }
    }

    /**
     * Default configuration: {@code _metadata.kind} discriminators, null fields written,
     * compact JSON.
     *
     * @return default configuration
     */
    public static CodecPolicy defaults() {
        return new CodecPolicy(PolicyName.DEFAULT_POLICY.name(), "_metadata", "kind", "Criterion", true, false);
    }

    /**
     * Writes the legacy {@code _metadata.cls} discriminators and the
     * {@code TargetingCriterion} criterion kind.
     *
     * @return legacy configuration
     */
    public static CodecPolicy legacy() {
        return new CodecPolicy(PolicyName.LEGACY_POLICY.name(), "_metadata", LEGACY_KIND_KEY,
                LEGACY_CRITERION_KIND, true, false);
    }

    /**
     * Default discriminators with indented JSON output.
     *
     * @return pretty-printing configuration
     */
    public static CodecPolicy pretty() {
        return new CodecPolicy(PolicyName.PRETTY_POLICY.name(), "_metadata", "kind", "Criterion", true, true);
    }

    /**
     * Creates a custom configuration. Builder parameters start from {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private String _metadataKey = "_metadata";
        private String _kindKey = "kind";
        private String _criterionKind = "Criterion";
        private boolean _writeNullFields = true;
        private boolean _prettyPrint = false;

        private Builder() {}

        public CodecPolicy build() {
            return new CodecPolicy(_policyName, _metadataKey, _kindKey, _criterionKind, _writeNullFields, _prettyPrint);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder metadataKey(String metadataKey) { this._metadataKey = metadataKey; return this; }
        public Builder kindKey(String kindKey) { this._kindKey = kindKey; return this; }
        public Builder criterionKind(String criterionKind) { this._criterionKind = criterionKind; return this; }
        public Builder writeNullFields(boolean writeNullFields) { this._writeNullFields = writeNullFields; return this; }
        public Builder prettyPrint(boolean prettyPrint) { this._prettyPrint = prettyPrint; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        LEGACY_POLICY,
        PRETTY_POLICY,
        CUSTOM_POLICY
    }
}
