package io.github.cyfko.targetql.core.codec;

import io.github.cyfko.targetql.core.config.CodecPolicy;
import io.github.cyfko.targetql.core.exception.DocumentFormatException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers shared by the codecs to write and read the metadata entry and to check the
 * shape of document values.
 */
final class Documents {

    private Documents() {
        // Utility class - prevent instantiation
    }

    static Map<String, Object> metadata(CodecPolicy policy, String kind) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(policy.kindKey(), kind);
        return metadata;
    }

    /**
     * Reads the discriminator of a document, accepting the legacy {@code cls} key as well.
     */
    static String readKind(CodecPolicy policy, Map<String, ?> document) {
        Object metadata = document.get(policy.metadataKey());
        if (!(metadata instanceof Map<?, ?> metadataMap)) {
            throw new DocumentFormatException(String.format(
                    "Document has no '%s' entry: %s", policy.metadataKey(), document.keySet()
            ));
        }
        Object kind = metadataMap.get(policy.kindKey());
        if (kind == null) {
            kind = metadataMap.get(CodecPolicy.LEGACY_KIND_KEY);
        }
        if (!(kind instanceof String kindName)) {
            throw new DocumentFormatException(String.format(
                    "Document metadata has no '%s' discriminator: %s", policy.kindKey(), metadataMap
            ));
        }
        return kindName;
    }

    static boolean isCriterionKind(CodecPolicy policy, String kind) {
        return policy.criterionKind().equals(kind) || CodecPolicy.LEGACY_CRITERION_KIND.equals(kind);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asDocument(Object value, String context) {
        if (!(value instanceof Map<?, ?>)) {
            throw new DocumentFormatException(String.format(
                    "Expected a document for %s, got %s", context, describe(value)
            ));
        }
        return (Map<String, Object>) value;
    }

    static List<?> asList(Object value, String context) {
        if (!(value instanceof List<?> list)) {
            throw new DocumentFormatException(String.format(
                    "Expected a list for %s, got %s", context, describe(value)
            ));
        }
        return list;
    }

    static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
