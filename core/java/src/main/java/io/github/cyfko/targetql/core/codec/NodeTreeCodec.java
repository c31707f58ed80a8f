package io.github.cyfko.targetql.core.codec;

import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.config.CodecPolicy;
import io.github.cyfko.targetql.core.exception.DocumentFormatException;
import io.github.cyfko.targetql.core.tree.NodeTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts {@link NodeTree} forests to and from their document form:
 * <pre>{@code
 * {"node": <target document or null>, "children": [<tree document>, ...], "depth": <int or null>}
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class NodeTreeCodec {

    static final String NODE = "node";
    static final String CHILDREN = "children";
    static final String DEPTH = "depth";

    private final TargetCodec targetCodec;

    public NodeTreeCodec() {
        this(CodecPolicy.defaults());
    }

    public NodeTreeCodec(CodecPolicy policy) {
        this.targetCodec = new TargetCodec(Objects.requireNonNull(policy, "Codec policy is required"));
    }

    /**
     * @param tree tree to serialize
     * @return a new mutable document
     */
    public Map<String, Object> toDocument(NodeTree tree) {
        Objects.requireNonNull(tree, "Tree cannot be null");

        List<Object> children = new ArrayList<>(tree.getChildren().size());
        for (NodeTree child : tree.getChildren()) {
            children.add(toDocument(child));
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(NODE, tree.getValue() == null ? null : targetCodec.toDocument(tree.getValue()));
        document.put(CHILDREN, children);
        document.put(DEPTH, tree.getDepth());
        return document;
    }

    /**
     * @param document tree document; a missing {@code children} entry means no children
     * @return the reconstructed tree
     * @throws DocumentFormatException if the document is malformed
     */
    public NodeTree fromDocument(Map<String, ?> document) {
        Objects.requireNonNull(document, "Document cannot be null");

        Object node = document.get(NODE);
        Target value = node == null ? null : targetCodec.fromDocument(Documents.asDocument(node, "tree node"));

        Object rawChildren = document.get(CHILDREN);
        List<?> childDocuments = rawChildren == null ? List.of() : Documents.asList(rawChildren, "tree children");
        List<NodeTree> children = new ArrayList<>(childDocuments.size());
        for (Object child : childDocuments) {
            children.add(fromDocument(Documents.asDocument(child, "tree child")));
        }

        Object depth = document.get(DEPTH);
        if (depth != null && !(depth instanceof Number)) {
            throw new DocumentFormatException("Tree depth must be a number, got " + Documents.describe(depth));
        }
        return new NodeTree(value, children, depth == null ? null : ((Number) depth).intValue());
    }
}
