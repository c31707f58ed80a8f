package io.github.cyfko.targetql.core.codec;

import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetField;
import io.github.cyfko.targetql.core.api.TargetKind;
import io.github.cyfko.targetql.core.config.CodecPolicy;
import io.github.cyfko.targetql.core.exception.DocumentFormatException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts {@link Target}s to and from their document form.
 * <p>
 * A target document holds the standard fields under their {@link TargetField} keys, the
 * kind-specific attributes flatly next to them, and a metadata entry naming the kind:
 * </p>
 * <pre>{@code
 * {
 *   "id": "1", "parent_id": null, "name": "home", ...,
 *   "include_descendants": true,
 *   "_metadata": {"kind": "AdUnit"}
 * }
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class TargetCodec {

    private final CodecPolicy policy;

    public TargetCodec() {
        this(CodecPolicy.defaults());
    }

    public TargetCodec(CodecPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Codec policy is required");
    }

    /**
     * @param target target to serialize
     * @return a new mutable document
     */
    public Map<String, Object> toDocument(Target target) {
        Objects.requireNonNull(target, "Target cannot be null");

        Map<String, Object> document = new LinkedHashMap<>();
        for (TargetField field : TargetField.values()) {
            String value = field.valueOf(target);
            if (value != null || policy.writeNullFields()) {
                document.put(field.key(), value);
            }
        }
        document.putAll(target.getAttributes());
        document.put(policy.metadataKey(), Documents.metadata(policy, target.getKind().documentName()));
        return document;
    }

    /**
     * @param document target document
     * @return the target
     * @throws DocumentFormatException if the metadata is missing or names an unknown kind
     */
    public Target fromDocument(Map<String, ?> document) {
        Objects.requireNonNull(document, "Document cannot be null");

        String kindName = Documents.readKind(policy, document);
        TargetKind kind = TargetKind.fromDocumentName(kindName)
                .orElseThrow(() -> new DocumentFormatException("Unknown target kind '" + kindName + "'"));

        Target.Builder builder = Target.builder(kind);
        for (Map.Entry<String, ?> entry : document.entrySet()) {
            String key = entry.getKey();
            if (key.equals(policy.metadataKey())) {
                continue;
            }
            Optional<TargetField> field = TargetField.fromKey(key);
            if (field.isPresent()) {
                setField(builder, field.get(), entry.getValue());
            } else {
                builder.attribute(key, entry.getValue());
            }
        }
        return builder.build();
    }

    private static void setField(Target.Builder builder, TargetField field, Object raw) {
        String value = raw == null ? null : raw.toString();
        switch (field) {
            case ID -> builder.id(value);
            case PARENT_ID -> builder.parentId(value);
            case NAME -> builder.name(value);
            case EXTERNAL_ID -> builder.externalId(value);
            case EXTERNAL_NAME -> builder.externalName(value);
            case DESCRIPTIVE_NAME -> builder.descriptiveName(value);
        }
    }

    public CodecPolicy policy() {
        return policy;
    }
}
