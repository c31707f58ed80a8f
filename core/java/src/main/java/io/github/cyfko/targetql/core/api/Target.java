package io.github.cyfko.targetql.core.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Atomic, identity-bearing value that can appear in a {@link Criterion} or in a tree
 * built by {@link io.github.cyfko.targetql.core.tree.TreeBuilder}.
 * <p>
 * A target carries an identity key, an optional parent identity, a {@link TargetKind}
 * discriminator and a handful of naming fields. Fields that only exist for some kinds
 * ({@code id_key}/{@code node_key} of custom targets, {@code version} of technologies,
 * {@code include_descendants} of ad units...) travel opaquely in {@link #getAttributes()}
 * under their document key.
 * </p>
 *
 * <h2>Equality</h2>
 * <p>
 * Equality is structural: two targets are equal when their kind, every standard field and
 * every attribute are equal, except the attributes listed in
 * {@link #IGNORED_COMPARABLE_KEYS}. Those carry provider bookkeeping (modification stamps,
 * signed preview URLs) that says nothing about what is targeted.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Target home = Target.builder(TargetKind.AD_UNIT)
 *     .id("1")
 *     .name("home")
 *     .attribute("include_descendants", true)
 *     .build();
 *
 * Target renamed = home.toBuilder().externalName("Home Page").build();
 * }</pre>
 *
 * <p>Instances are immutable and therefore thread-safe.</p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class Target implements TargetingElement {

    /**
     * Attribute keys skipped by {@link #equals(Object)} and {@link #hashCode()}.
     */
    public static final Set<String> IGNORED_COMPARABLE_KEYS = Set.of(
            "last_modified",
            "last_modified_by",
            "preview_url"
    );

    private final TargetKind kind;
    private final String id;
    private final String parentId;
    private final String name;
    private final String externalId;
    private final String externalName;
    private final String descriptiveName;
    private final Map<String, Object> attributes;

    private Target(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "Target kind cannot be null");
        this.id = builder.id;
        this.parentId = builder.parentId;
        this.name = builder.name;
        this.externalId = builder.externalId;
        this.externalName = builder.externalName;
        this.descriptiveName = builder.descriptiveName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    /**
     * Starts building a target of the given kind.
     *
     * @param kind kind of the target
     * @return a new builder
     */
    public static Builder builder(TargetKind kind) {
        return new Builder(kind);
    }

    /**
     * @return a builder pre-filled with every field of this target
     */
    public Builder toBuilder() {
        Builder builder = new Builder(kind)
                .id(id)
                .parentId(parentId)
                .name(name)
                .externalId(externalId)
                .externalName(externalName)
                .descriptiveName(descriptiveName);
        builder.attributes.putAll(attributes);
        return builder;
    }

    public TargetKind getKind() { return kind; }
    public String getId() { return id; }
    public String getParentId() { return parentId; }
    public String getName() { return name; }
    public String getExternalId() { return externalId; }
    public String getExternalName() { return externalName; }
    public String getDescriptiveName() { return descriptiveName; }

    /**
     * @return kind-specific fields keyed by document key, in insertion order (read-only)
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Reads a field by document key: a standard field when the key names one
     * (see {@link TargetField}), otherwise the attribute stored under that key.
     *
     * @param key document key, e.g. {@code "id"} or {@code "node_key"}
     * @return the value, or {@code null} when absent
     */
    public Object get(String key) {
        return TargetField.fromKey(key)
                .<Object>map(field -> field.valueOf(this))
                .orElseGet(() -> attributes.get(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Target other)) return false;
        return kind == other.kind
                && Objects.equals(id, other.id)
                && Objects.equals(parentId, other.parentId)
                && Objects.equals(name, other.name)
                && Objects.equals(externalId, other.externalId)
                && Objects.equals(externalName, other.externalName)
                && Objects.equals(descriptiveName, other.descriptiveName)
                && comparableAttributes().equals(other.comparableAttributes());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, parentId, name, externalId, externalName, descriptiveName,
                comparableAttributes());
    }

    private Map<String, Object> comparableAttributes() {
        if (Collections.disjoint(attributes.keySet(), IGNORED_COMPARABLE_KEYS)) {
            return attributes;
        }
        Map<String, Object> comparable = new LinkedHashMap<>(attributes);
        comparable.keySet().removeAll(IGNORED_COMPARABLE_KEYS);
        return comparable;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.documentName()).append("{id=").append(id);
        if (parentId != null) sb.append(", parentId=").append(parentId);
        if (name != null) sb.append(", name=").append(name);
        if (externalId != null) sb.append(", externalId=").append(externalId);
        if (externalName != null) sb.append(", externalName=").append(externalName);
        if (descriptiveName != null) sb.append(", descriptiveName=").append(descriptiveName);
        if (!attributes.isEmpty()) sb.append(", attributes=").append(attributes);
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link Target}. Every field except the kind is optional.
     */
    public static final class Builder {
        private final TargetKind kind;
        private String id;
        private String parentId;
        private String name;
        private String externalId;
        private String externalName;
        private String descriptiveName;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(TargetKind kind) {
            this.kind = Objects.requireNonNull(kind, "Target kind cannot be null");
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder parentId(String parentId) { this.parentId = parentId; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder externalId(String externalId) { this.externalId = externalId; return this; }
        public Builder externalName(String externalName) { this.externalName = externalName; return this; }
        public Builder descriptiveName(String descriptiveName) { this.descriptiveName = descriptiveName; return this; }

        /**
         * Sets a kind-specific field. Keys naming a standard field are rejected so that a
         * value can never live in two places.
         *
         * @param key document key of the field
         * @param value value, may be {@code null}
         * @return this builder
         * @throws IllegalArgumentException if {@code key} names a standard field
         */
        public Builder attribute(String key, Object value) {
            Objects.requireNonNull(key, "Attribute key cannot be null");
            if (TargetField.fromKey(key).isPresent()) {
                throw new IllegalArgumentException("'" + key + "' is a standard target field, not an attribute");
            }
            attributes.put(key, value);
            return this;
        }

        public Target build() {
            return new Target(this);
        }
    }
}
