package io.github.cyfko.targetql.core.tree;

import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetProvider;
import io.github.cyfko.targetql.core.api.TargetType;
import io.github.cyfko.targetql.core.exception.TargetingArgumentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns flat, parent-linked target lists into a {@link NodeTree} forest.
 * <p>
 * Ad servers organize inventory, geographies and custom key/values as hierarchies but list
 * them flat, each item naming its parent. The builder groups items by parent id, finds the
 * maximal parents (parent ids that are not the id of any listed item) and grows one tree per
 * maximal parent, whose children become depth-0 roots.
 * </p>
 * <p>
 * Roots and children keep the order in which they first appear in the input.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * // home(1) <- home/us(2) <- home/us/mi(3)
 * NodeTree forest = new TreeBuilder().build(List.of(home, homeUs, homeUsMi));
 * forest.getMaxDepth();   // OptionalInt[2]
 *
 * // from an ad provider
 * NodeTree geographies = new TreeBuilder(provider).constructTree(TargetType.GEOGRAPHY);
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class TreeBuilder {

    private static final Logger log = Logger.getLogger(TreeBuilder.class.getName());

    private final TargetProvider provider;

    /**
     * Creates a builder working on explicit target lists only.
     */
    public TreeBuilder() {
        this.provider = null;
    }

    /**
     * @param provider source of target lists for {@link #constructTree(TargetType)}
     */
    public TreeBuilder(TargetProvider provider) {
        this.provider = Objects.requireNonNull(provider, "Target provider cannot be null");
    }

    /**
     * Builds a forest from a flat list of targets.
     *
     * @param nodes targets, each with a non-null id; parent ids may be null
     * @return the synthetic root of the forest
     * @throws TargetingArgumentException if a target has no id
     */
    public NodeTree build(Collection<? extends Target> nodes) {
        Objects.requireNonNull(nodes, "Nodes cannot be null");

        Map<String, Target> nodeMap = new LinkedHashMap<>();
        Map<String, List<Target>> parents = new LinkedHashMap<>();
        for (Target node : nodes) {
            Objects.requireNonNull(node, "Tree nodes cannot be null");
            if (node.getId() == null) {
                throw new TargetingArgumentException("Tree nodes must have an id: " + node);
            }
            parents.computeIfAbsent(node.getParentId(), k -> new ArrayList<>()).add(node);
            if (nodeMap.put(node.getId(), node) != null) {
                log.warning(() -> "Duplicate tree node id '" + node.getId() + "', the last occurrence wins");
            }
        }

        // Every listed item is the child of some parent id, so a maximal parent id never names
        // a listed item: its children are the depth-0 roots.
        Set<String> childIds = nodeMap.keySet();

        List<NodeTree> maximalTrees = new ArrayList<>();
        for (String parentId : parents.keySet()) {
            if (!childIds.contains(parentId)) {
                maximalTrees.addAll(makeTrees(parentId, parents, nodeMap, 0, new HashSet<>()));
            }
        }

        log.fine(() -> String.format("Built forest of %d root(s) from %d node(s)", maximalTrees.size(), nodes.size()));
        return NodeTree.root(maximalTrees);
    }

    private List<NodeTree> makeTrees(String parentId,
                                     Map<String, List<Target>> parents,
                                     Map<String, Target> nodeMap,
                                     int depth,
                                     Set<String> path) {
        List<NodeTree> trees = new ArrayList<>();
        for (Target child : parents.getOrDefault(parentId, List.of())) {
            String id = child.getId();
            if (!path.add(id)) {
                log.warning(() -> "Cycle detected on tree node id '" + id + "', branch skipped");
                continue;
            }
            trees.add(new NodeTree(nodeMap.get(id), makeTrees(id, parents, nodeMap, depth + 1, path), depth));
            path.remove(id);
        }
        return trees;
    }

    /**
     * Fetches the targets of the given type from the provider and builds their forest.
     *
     * @param type target family to build
     * @return the synthetic root of the forest
     * @throws IllegalStateException if this builder has no provider
     */
    public NodeTree constructTree(TargetType type) {
        Objects.requireNonNull(type, "Target type cannot be null");
        if (provider == null) {
            throw new IllegalStateException("No target provider configured, cannot construct a " + type + " tree");
        }
        List<Target> nodes = provider.getTargets(type);
        log.fine(() -> String.format("Constructing %s tree from %d provider target(s)", type, nodes.size()));
        return build(nodes);
    }
}
