package io.github.cyfko.targetql.core.codec;

import io.github.cyfko.targetql.core.Criteria;
import io.github.cyfko.targetql.core.api.Criterion;
import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetingElement;
import io.github.cyfko.targetql.core.config.CodecPolicy;
import io.github.cyfko.targetql.core.exception.DocumentFormatException;
import io.github.cyfko.targetql.core.exception.TargetingArgumentException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts {@link Criterion} trees to and from their document form.
 * <p>
 * Each criterion becomes a document holding a single operator key mapped to the ordered
 * documents of its elements, plus a metadata entry tagging it as a criterion. Element
 * documents are tagged with their own kind, which drives reconstruction:
 * </p>
 * <pre>{@code
 * {
 *   "AND": [
 *     {"OR": [{"id": "1", ..., "_metadata": {"kind": "AdUnit"}}], "_metadata": {"kind": "Criterion"}},
 *     {"NOT": [{"OR": [...], "_metadata": {"kind": "Criterion"}}], "_metadata": {"kind": "Criterion"}}
 *   ],
 *   "_metadata": {"kind": "Criterion"}
 * }
 * }</pre>
 *
 * <h2>Round-trip</h2>
 * <p>
 * For every criterion {@code c}, {@code fromDocument(toDocument(c)).equals(c)}. Element
 * order is preserved, so the law holds under the ordered equality of criteria.
 * </p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class CriterionCodec {

    private final CodecPolicy policy;
    private final TargetCodec targetCodec;

    public CriterionCodec() {
        this(CodecPolicy.defaults());
    }

    public CriterionCodec(CodecPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Codec policy is required");
        this.targetCodec = new TargetCodec(policy);
    }

    /**
     * @param criterion criterion to serialize
     * @return a new mutable document
     */
    public Map<String, Object> toDocument(Criterion criterion) {
        Objects.requireNonNull(criterion, "Criterion cannot be null");

        List<Object> children = new ArrayList<>(criterion.elements().size());
        for (TargetingElement element : criterion.elements()) {
            children.add(elementToDocument(element));
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(criterion.operator().name(), children);
        document.put(policy.metadataKey(), Documents.metadata(policy, policy.criterionKind()));
        return document;
    }

    private Object elementToDocument(TargetingElement element) {
        if (element instanceof Criterion criterion) {
            return toDocument(criterion);
        }
        if (element instanceof Target target) {
            return targetCodec.toDocument(target);
        }
        throw new TargetingArgumentException("Unsupported criterion element: " + element);
    }

    /**
     * @param document criterion document
     * @return the reconstructed criterion
     * @throws DocumentFormatException if the document is not a well-formed criterion document
     * @throws TargetingArgumentException if its operator key is not a known operator
     */
    public Criterion fromDocument(Map<String, ?> document) {
        Objects.requireNonNull(document, "Document cannot be null");

        String kind = Documents.readKind(policy, document);
        if (!Documents.isCriterionKind(policy, kind)) {
            throw new DocumentFormatException(String.format(
                    "Expected a '%s' document, got '%s'", policy.criterionKind(), kind
            ));
        }

        List<String> operatorKeys = new ArrayList<>();
        for (String key : document.keySet()) {
            if (!key.equals(policy.metadataKey())) {
                operatorKeys.add(key);
            }
        }
        if (operatorKeys.size() != 1) {
            throw new DocumentFormatException(String.format(
                    "Criterion document must hold exactly one operator key, got %s", operatorKeys
            ));
        }

        String operator = operatorKeys.get(0);
        List<?> children = Documents.asList(document.get(operator), "operator '" + operator + "'");

        List<TargetingElement> elements = new ArrayList<>(children.size());
        for (Object child : children) {
            elements.add(elementFromDocument(Documents.asDocument(child, "element of '" + operator + "'")));
        }
        return Criteria.of(operator, elements);
    }

    private TargetingElement elementFromDocument(Map<String, Object> document) {
        String kind = Documents.readKind(policy, document);
        if (Documents.isCriterionKind(policy, kind)) {
            return fromDocument(document);
        }
        return targetCodec.fromDocument(document);
    }

    public CodecPolicy policy() {
        return policy;
    }
}
