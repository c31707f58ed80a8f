package io.github.cyfko.targetql.core.tree;

import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetField;
import io.github.cyfko.targetql.core.exception.TargetingArgumentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Node of a forest of {@link Target}s.
 * <p>
 * A forest is represented by a synthetic root whose value and depth are {@code null}; its
 * children are the maximal trees, rooted at depth 0. Every other node carries a target
 * and its depth below the synthetic root.
 * </p>
 *
 * <pre>{@code
 * NodeTree forest = new TreeBuilder().build(adUnits);
 *
 * forest.getSubtree(TargetField.ID, "2");       // branch rooted at ad unit 2
 * forest.flatten(1);                            // targets at depth 1
 * forest.filterTree(Set.of("2"));               // keep only branches leading to ad unit 2
 * }</pre>
 *
 * <p>
 * Nodes own their children; nothing is shared between trees. Apart from
 * {@link #updateExternalNames(Map)}, which relabels in place, every operation leaves the tree
 * untouched and returns new values.
 * </p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class NodeTree {

    private Target value;
    private final List<NodeTree> children;
    private final Integer depth;

    /**
     * @param value target of this node, {@code null} for a synthetic root
     * @param children child nodes, in order
     * @param depth depth of this node, {@code null} for a synthetic root
     */
    public NodeTree(Target value, List<NodeTree> children, Integer depth) {
        this.value = value;
        this.children = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(children, "Children cannot be null")));
        this.depth = depth;
    }

    /**
     * Creates a synthetic root over the given trees.
     *
     * @param children the maximal trees
     * @return a root with no value and no depth
     */
    public static NodeTree root(List<NodeTree> children) {
        return new NodeTree(null, children, null);
    }

    /**
     * @return the target of this node, or {@code null} for a synthetic root
     */
    public Target getValue() {
        return value;
    }

    /**
     * @return the child nodes, in order (read-only)
     */
    public List<NodeTree> getChildren() {
        return children;
    }

    /**
     * @return the depth of this node, or {@code null} for a synthetic root
     */
    public Integer getDepth() {
        return depth;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Depth-first search, among the descendants of this node, for the first node whose target
     * has {@code fieldValue} under {@code key}.
     *
     * @param key target field key, e.g. {@code "id"}
     * @param fieldValue value to match
     * @return the matching branch, or empty
     */
    public Optional<NodeTree> getSubtree(String key, Object fieldValue) {
        for (NodeTree branch : children) {
            if (branch.value != null && Objects.equals(branch.value.get(key), fieldValue)) {
                return Optional.of(branch);
            }
            Optional<NodeTree> subtree = branch.getSubtree(key, fieldValue);
            if (subtree.isPresent()) {
                return subtree;
            }
        }
        return Optional.empty();
    }

    public Optional<NodeTree> getSubtree(TargetField field, Object fieldValue) {
        return getSubtree(field.key(), fieldValue);
    }

    /**
     * Lists the targets of every node that has a matching descendant, i.e. the ancestors of
     * the matching nodes, in document order. Every branch is searched, so ancestors of
     * matches in disjoint branches are all returned.
     *
     * @param key target field key
     * @param fieldValue value to match
     * @return ancestor targets, possibly empty
     */
    public List<Target> getSubtreeParents(String key, Object fieldValue) {
        List<Target> parents = new ArrayList<>();
        collectSubtreeParents(key, fieldValue, parents);
        return parents;
    }

    public List<Target> getSubtreeParents(TargetField field, Object fieldValue) {
        return getSubtreeParents(field.key(), fieldValue);
    }

    private void collectSubtreeParents(String key, Object fieldValue, List<Target> sink) {
        if (value != null && getSubtree(key, fieldValue).isPresent()) {
            sink.add(value);
        }
        for (NodeTree branch : children) {
            branch.collectSubtreeParents(key, fieldValue, sink);
        }
    }

    /**
     * @return the largest depth found in this tree, or empty if no node carries a depth
     */
    public OptionalInt getMaxDepth() {
        Integer max = maxDepthOrNull();
        return max == null ? OptionalInt.empty() : OptionalInt.of(max);
    }

    private Integer maxDepthOrNull() {
        Integer max = depth;
        for (NodeTree branch : children) {
            Integer branchMax = branch.maxDepthOrNull();
            if (branchMax != null && (max == null || branchMax > max)) {
                max = branchMax;
            }
        }
        return max;
    }

    /**
     * @return every target of this tree, in document order
     */
    public List<Target> flatten() {
        return flatten(null, false);
    }

    /**
     * @param depth depth to select
     * @return the targets found at exactly {@code depth}, in document order
     */
    public List<Target> flatten(int depth) {
        return flatten(depth, false);
    }

    /**
     * @return the targets of the leaf nodes, in document order
     */
    public List<Target> flattenLeaves() {
        return flatten(null, true);
    }

    /**
     * Lists the targets of this tree in document order, optionally restricted to one depth
     * or to leaves. Every branch is visited whether or not its root qualifies.
     *
     * @param depth depth to select, or {@code null} for all depths
     * @param onlyLeaves whether to keep only nodes without children
     * @return the selected targets
     * @throws TargetingArgumentException if both a depth and {@code onlyLeaves} are given
     */
    public List<Target> flatten(Integer depth, boolean onlyLeaves) {
        if (onlyLeaves && depth != null) {
            throw new TargetingArgumentException("Depth selection and leaf selection are mutually exclusive");
        }
        List<Target> targets = new ArrayList<>();
        collect(depth, onlyLeaves, targets);
        return targets;
    }

    private void collect(Integer selectedDepth, boolean onlyLeaves, List<Target> sink) {
        if (value != null
                && (selectedDepth == null || selectedDepth.equals(depth))
                && (!onlyLeaves || children.isEmpty())) {
            sink.add(value);
        }
        for (NodeTree branch : children) {
            branch.collect(selectedDepth, onlyLeaves, sink);
        }
    }

    /**
     * Builds a filtered copy of this tree: a child branch is kept when at least one of its
     * targets (its own or a descendant's) has a {@code key} value in {@code ids}; kept branches
     * are filtered the same way. The value of this node is always kept.
     *
     * @param key target field key to filter on
     * @param ids retained key values
     * @return a new, filtered tree
     */
    public NodeTree filterTreeByKey(String key, Collection<?> ids) {
        Objects.requireNonNull(key, "Filter key cannot be null");
        Objects.requireNonNull(ids, "Filter ids cannot be null");
        return filter(key, new HashSet<>(ids));
    }

    private NodeTree filter(String key, Set<?> retained) {
        List<NodeTree> filteredChildren = new ArrayList<>();
        for (NodeTree branch : children) {
            boolean hit = false;
            for (Target target : branch.flatten()) {
                if (retained.contains(target.get(key))) {
                    hit = true;
                    break;
                }
            }
            if (hit) {
                filteredChildren.add(branch.filter(key, retained));
            }
        }
        return new NodeTree(value, filteredChildren, depth);
    }

    /**
     * Filters on target ids.
     *
     * @param ids retained ids
     * @return a new, filtered tree
     * @see #filterTreeByKey(String, Collection)
     */
    public NodeTree filterTree(Collection<String> ids) {
        return filterTreeByKey(TargetField.ID.key(), ids);
    }

    /**
     * Sets, in place, the external name of every node whose target id appears in
     * {@code idMap}. Null or empty names are ignored. The whole tree is visited.
     * <p>
     * Targets are immutable: a relabelled node holds a copy of its former target with the
     * new external name. References obtained earlier, such as the provider's list or the
     * result of a previous {@link #flatten()}, keep the old name.
     * </p>
     *
     * @param idMap target id to new external name
     */
    public void updateExternalNames(Map<String, String> idMap) {
        Objects.requireNonNull(idMap, "Id map cannot be null");
        if (value != null) {
            String externalName = idMap.get(value.getId());
            if (externalName != null && !externalName.isEmpty()) {
                value = value.toBuilder().externalName(externalName).build();
            }
        }
        for (NodeTree branch : children) {
            branch.updateExternalNames(idMap);
        }
    }

    /**
     * Trees are equal when their values and depths are equal and their children can be paired
     * one to one with equal children of the other tree, in any order.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeTree other)) return false;
        if (!Objects.equals(value, other.value)
                || !Objects.equals(depth, other.depth)
                || children.size() != other.children.size()) {
            return false;
        }
        boolean[] matched = new boolean[other.children.size()];
        for (NodeTree child : children) {
            if (!matchChild(child, other.children, matched)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchChild(NodeTree child, List<NodeTree> candidates, boolean[] matched) {
        for (int i = 0; i < candidates.size(); i++) {
            if (!matched[i] && child.equals(candidates.get(i))) {
                matched[i] = true;
                return true;
            }
        }
        return false;
    }

    @Override
    public int hashCode() {
        // sum keeps the hash independent of sibling order
        int childrenHash = 0;
        for (NodeTree child : children) {
            childrenHash += child.hashCode();
        }
        return 31 * Objects.hash(value, depth) + childrenHash;
    }

    @Override
    public String toString() {
        return "NodeTree{value=" + value + ", depth=" + depth + ", children=" + children + "}";
    }
}
