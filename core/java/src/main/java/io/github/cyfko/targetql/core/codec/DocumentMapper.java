package io.github.cyfko.targetql.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.cyfko.targetql.core.api.Criterion;
import io.github.cyfko.targetql.core.api.TargetingData;
import io.github.cyfko.targetql.core.config.CodecPolicy;
import io.github.cyfko.targetql.core.exception.DocumentFormatException;
import io.github.cyfko.targetql.core.tree.NodeTree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders documents as JSON text and parses JSON text back into documents, using Jackson.
 * <p>
 * Besides the generic {@link #write(Map)} / {@link #read(String)} pair, typed shortcuts chain
 * the codecs for criteria, targeting data and trees:
 * </p>
 * <pre>{@code
 * DocumentMapper mapper = new DocumentMapper(CodecPolicy.pretty());
 * String json = mapper.writeCriterion(criterion);
 * Criterion copy = mapper.readCriterion(json);   // copy.equals(criterion)
 * }</pre>
 *
 * <h2>Attribute values</h2>
 * <p>
 * Target attributes travel as plain JSON values and come back with the Java type Jackson
 * picks for them: strings, booleans, {@code null}, lists, maps, {@link Integer} for integral
 * numbers that fit (then {@link Long}, then {@link java.math.BigInteger}) and {@link Double}
 * for decimals. The round-trip above holds for targets whose attributes already use those
 * types; a {@code Long} attribute of {@code 5} reads back as the {@code Integer} {@code 5},
 * and the restored target is then not equal to the original.
 * </p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class DocumentMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final CriterionCodec criterionCodec;
    private final TargetingDataCodec targetingDataCodec;
    private final NodeTreeCodec nodeTreeCodec;

    public DocumentMapper() {
        this(CodecPolicy.defaults());
    }

    public DocumentMapper(CodecPolicy policy) {
        Objects.requireNonNull(policy, "Codec policy is required");
        this.objectMapper = new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, policy.prettyPrint());
        this.criterionCodec = new CriterionCodec(policy);
        this.targetingDataCodec = new TargetingDataCodec(policy);
        this.nodeTreeCodec = new NodeTreeCodec(policy);
    }

    /**
     * @param document document to render
     * @return JSON text
     * @throws DocumentFormatException if the document holds values Jackson cannot serialize
     */
    public String write(Map<String, ?> document) {
        Objects.requireNonNull(document, "Document cannot be null");
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Failed to render document as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param json JSON object text
     * @return the parsed document, with keys in source order
     * @throws DocumentFormatException if {@code json} is not a JSON object
     */
    public Map<String, Object> read(String json) {
        Objects.requireNonNull(json, "JSON cannot be null");
        try {
            Map<String, Object> document = objectMapper.readValue(json, DOCUMENT_TYPE);
            if (document == null) {
                throw new DocumentFormatException("JSON text does not hold a document");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Invalid JSON document: " + e.getOriginalMessage(), e);
        }
    }

    public String writeCriterion(Criterion criterion) {
        return write(criterionCodec.toDocument(criterion));
    }

    public Criterion readCriterion(String json) {
        return criterionCodec.fromDocument(read(json));
    }

    public String writeTargetingData(TargetingData data) {
        return write(targetingDataCodec.toDocument(data));
    }

    public TargetingData readTargetingData(String json) {
        return targetingDataCodec.fromDocument(read(json));
    }

    public String writeTree(NodeTree tree) {
        return write(nodeTreeCodec.toDocument(tree));
    }

    public NodeTree readTree(String json) {
        return nodeTreeCodec.fromDocument(read(json));
    }
}
