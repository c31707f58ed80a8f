package io.github.cyfko.targetql.core.codec;

import io.github.cyfko.targetql.core.api.Criterion;
import io.github.cyfko.targetql.core.api.TargetingData;
import io.github.cyfko.targetql.core.config.CodecPolicy;
import io.github.cyfko.targetql.core.exception.DocumentFormatException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts {@link TargetingData} to and from its document form: one entry per slot holding a
 * criterion document or {@code null}, plus a {@code TargetingData} metadata entry.
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class TargetingDataCodec {

    /** Discriminator of targeting data documents. */
    public static final String KIND = "TargetingData";

    private final CodecPolicy policy;
    private final CriterionCodec criterionCodec;

    public TargetingDataCodec() {
        this(CodecPolicy.defaults());
    }

    public TargetingDataCodec(CodecPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Codec policy is required");
        this.criterionCodec = new CriterionCodec(policy);
    }

    public Map<String, Object> toDocument(TargetingData data) {
        Objects.requireNonNull(data, "Targeting data cannot be null");

        Map<String, Object> document = new LinkedHashMap<>();
        for (TargetingData.Slot slot : TargetingData.Slot.values()) {
            document.put(slot.key(), data.get(slot).map(criterionCodec::toDocument).orElse(null));
        }
        document.put(policy.metadataKey(), Documents.metadata(policy, KIND));
        return document;
    }

    /**
     * @param document targeting data document; absent or null slots stay empty
     * @return the targeting data
     * @throws DocumentFormatException if the document is not a targeting data document
     */
    public TargetingData fromDocument(Map<String, ?> document) {
        Objects.requireNonNull(document, "Document cannot be null");

        String kind = Documents.readKind(policy, document);
        if (!KIND.equals(kind)) {
            throw new DocumentFormatException(String.format("Expected a '%s' document, got '%s'", KIND, kind));
        }

        TargetingData.Builder builder = TargetingData.builder();
        for (TargetingData.Slot slot : TargetingData.Slot.values()) {
            Object slotDocument = document.get(slot.key());
            if (slotDocument != null) {
                Criterion criterion = criterionCodec.fromDocument(Documents.asDocument(slotDocument, "slot '" + slot.key() + "'"));
                builder.criterion(slot, criterion);
            }
        }
        return builder.build();
    }
}
