package io.github.cyfko.targetql.core.tree;

import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetField;
import io.github.cyfko.targetql.core.exception.TargetingArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import static io.github.cyfko.targetql.core.TargetFixtures.adUnit;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link NodeTree} queries, filtering and relabelling.
 *
 * @author TargetQL Test Suite
 * @since 1.0.0
 */
@DisplayName("NodeTree Tests")
class NodeTreeTest {

    private static final Target HOME = adUnit("1", "", "home");
    private static final Target US = adUnit("2", "1", "home/us");
    private static final Target MI = adUnit("3", "2", "home/us/mi");
    private static final Target UK = adUnit("4", "1", "home/uk");
    private static final Target SPORTS = adUnit("5", "", "sports");

    private final TreeBuilder builder = new TreeBuilder();

    private NodeTree nested;
    private NodeTree forest;

    @BeforeEach
    void setUp() {
        nested = builder.build(List.of(HOME, US, MI));
        // home -> [us -> [mi], uk], sports
        forest = builder.build(List.of(HOME, US, MI, UK, SPORTS));
    }

    // ========== Search Tests ==========

    @Test
    @DisplayName("Should find the branch rooted at a matching node")
    void shouldFindSubtree() {
        // When
        Optional<NodeTree> subtree = forest.getSubtree(TargetField.ID, "2");

        // Then
        assertTrue(subtree.isPresent());
        assertEquals(US, subtree.get().getValue());
        assertEquals(1, subtree.get().getDepth());
        assertEquals(List.of(US, MI), subtree.get().flatten());
    }

    @Test
    @DisplayName("Should search by any field key")
    void shouldFindSubtreeByName() {
        assertEquals(Optional.of(SPORTS), forest.getSubtree("name", "sports").map(NodeTree::getValue));
    }

    @Test
    @DisplayName("Should return empty when no node matches")
    void shouldNotFindMissingSubtree() {
        assertEquals(Optional.empty(), forest.getSubtree(TargetField.ID, "42"));
    }

    @Test
    @DisplayName("Should not match the node the search starts from")
    void shouldSearchDescendantsOnly() {
        NodeTree home = forest.getChildren().get(0);

        assertEquals(Optional.empty(), home.getSubtree(TargetField.ID, "1"));
    }

    @Test
    @DisplayName("Should list the ancestors of a matching node")
    void shouldListSubtreeParents() {
        assertEquals(List.of(HOME, US), nested.getSubtreeParents(TargetField.ID, "3"));
        assertEquals(List.of(HOME), forest.getSubtreeParents(TargetField.ID, "4"));
    }

    @Test
    @DisplayName("Should list no ancestors for a root or a missing node")
    void shouldListNoParentsForRoots() {
        assertEquals(List.of(), forest.getSubtreeParents(TargetField.ID, "5"));
        assertEquals(List.of(), forest.getSubtreeParents(TargetField.ID, "42"));
    }

    // ========== Depth And Flatten Tests ==========

    @Test
    @DisplayName("Should compute the maximum depth")
    void shouldComputeMaxDepth() {
        assertEquals(OptionalInt.of(2), nested.getMaxDepth());
        assertEquals(OptionalInt.of(2), forest.getMaxDepth());
        assertEquals(OptionalInt.empty(), NodeTree.root(List.of()).getMaxDepth());
    }

    @Test
    @DisplayName("Should flatten in document order")
    void shouldFlattenInDocumentOrder() {
        assertEquals(List.of(HOME, US, MI, UK, SPORTS), forest.flatten());
    }

    @Test
    @DisplayName("Should select targets at one depth")
    void shouldFlattenAtDepth() {
        assertEquals(List.of(HOME, SPORTS), forest.flatten(0));
        assertEquals(List.of(US, UK), forest.flatten(1));
        assertEquals(List.of(MI), forest.flatten(2));
        assertEquals(List.of(), forest.flatten(3));
    }

    @Test
    @DisplayName("Should select leaves")
    void shouldFlattenLeaves() {
        assertEquals(List.of(MI, UK, SPORTS), forest.flattenLeaves());
    }

    @Test
    @DisplayName("Should reject depth and leaf selection together")
    void shouldRejectDepthWithLeaves() {
        assertThrows(TargetingArgumentException.class, () -> forest.flatten(1, true));
    }

    // ========== Filter Tests ==========

    @Test
    @DisplayName("Should keep the full path to a retained deep node")
    void shouldKeepPathToRetainedNode() {
        // When
        NodeTree filtered = nested.filterTree(Set.of("3"));

        // Then
        assertEquals(nested, filtered);
        assertNotSame(nested, filtered);
    }

    @Test
    @DisplayName("Should drop branches without any retained id")
    void shouldDropUnretainedBranches() {
        // When
        NodeTree filtered = forest.filterTree(Set.of("4"));

        // Then
        assertEquals(List.of(HOME, UK), filtered.flatten());
        assertEquals(1, filtered.getChildren().size());
    }

    @Test
    @DisplayName("Should keep a retained node without its unretained descendants")
    void shouldPruneBelowRetainedNode() {
        NodeTree filtered = nested.filterTree(Set.of("1"));

        assertEquals(List.of(HOME), filtered.flatten());
        assertTrue(filtered.getChildren().get(0).isLeaf());
    }

    @Test
    @DisplayName("Should filter on any field key")
    void shouldFilterByKey() {
        NodeTree filtered = forest.filterTreeByKey("name", List.of("sports"));

        assertEquals(List.of(SPORTS), filtered.flatten());
    }

    @Test
    @DisplayName("Should keep an empty forest when nothing is retained")
    void shouldFilterEverythingOut() {
        NodeTree filtered = forest.filterTree(List.of());

        assertTrue(filtered.isLeaf());
        assertNull(filtered.getValue());
    }

    @Test
    @DisplayName("Should be idempotent and leave the source untouched")
    void shouldFilterIdempotently() {
        // Given
        List<Target> before = forest.flatten();

        // When
        NodeTree once = forest.filterTree(Set.of("2", "5"));
        NodeTree twice = once.filterTree(Set.of("2", "5"));

        // Then
        assertEquals(once, twice);
        assertEquals(List.of(HOME, US, SPORTS), once.flatten());
        assertEquals(before, forest.flatten());
    }

    @Test
    @DisplayName("Should return an equal forest when every id is retained")
    void shouldKeepForestWhenEveryIdRetained() {
        // Given
        List<String> ids = forest.flatten().stream().map(Target::getId).toList();

        // When
        NodeTree filtered = forest.filterTree(ids);

        // Then
        assertEquals(forest, filtered);
        assertEquals(forest.flatten(), filtered.flatten());
    }

    // ========== Equality Tests ==========

    @Test
    @DisplayName("Should equal a forest whose siblings come in another order")
    void shouldIgnoreSiblingOrder() {
        // Given
        NodeTree homeUsUk = builder.build(List.of(HOME, US, UK));
        NodeTree homeUkUs = builder.build(List.of(HOME, UK, US));

        // Then
        assertEquals(homeUsUk, homeUkUs);
        assertEquals(homeUsUk.hashCode(), homeUkUs.hashCode());
        assertNotEquals(homeUsUk.flatten(), homeUkUs.flatten());
    }

    @Test
    @DisplayName("Should equal a forest whose roots come in another order")
    void shouldIgnoreRootOrder() {
        // Given
        Target news = adUnit("6", "-1", "news");
        Target weather = adUnit("7", "-2", "weather");

        // When
        NodeTree newsFirst = builder.build(List.of(news, weather));
        NodeTree weatherFirst = builder.build(List.of(weather, news));

        // Then
        assertEquals(newsFirst, weatherFirst);
        assertEquals(newsFirst.hashCode(), weatherFirst.hashCode());
    }

    @Test
    @DisplayName("Should pair duplicate children one to one")
    void shouldCountDuplicateChildren() {
        // Given
        NodeTree us = new NodeTree(US, List.of(), 0);
        NodeTree uk = new NodeTree(UK, List.of(), 0);

        // When
        NodeTree usUsUk = NodeTree.root(List.of(us, us, uk));
        NodeTree usUkUk = NodeTree.root(List.of(us, uk, uk));

        // Then
        assertNotEquals(usUsUk, usUkUk);
        assertEquals(usUsUk, NodeTree.root(List.of(uk, us, us)));
    }

    @Test
    @DisplayName("Should distinguish forests with different children, depths or values")
    void shouldDistinguishDifferentForests() {
        assertNotEquals(nested, forest);
        assertNotEquals(new NodeTree(HOME, List.of(), 0), new NodeTree(HOME, List.of(), 1));
        assertNotEquals(new NodeTree(HOME, List.of(), 0), new NodeTree(US, List.of(), 0));
    }

    // ========== Relabel Tests ==========

    @Test
    @DisplayName("Should set external names on matching nodes in place")
    void shouldUpdateExternalNames() {
        // When
        forest.updateExternalNames(Map.of("3", "Michigan", "5", "Sports"));

        // Then
        assertEquals("Michigan", forest.getSubtree(TargetField.ID, "3").orElseThrow().getValue().getExternalName());
        assertEquals("Sports", forest.getSubtree(TargetField.ID, "5").orElseThrow().getValue().getExternalName());
        assertNull(forest.getSubtree(TargetField.ID, "1").orElseThrow().getValue().getExternalName());
        assertNull(MI.getExternalName(), "Source targets must stay untouched");
    }

    @Test
    @DisplayName("Should leave previously flattened targets with their old name")
    void shouldKeepEarlierReferencesUnchanged() {
        // Given
        List<Target> before = forest.flatten();

        // When
        forest.updateExternalNames(Map.of("1", "Home"));

        // Then
        assertNull(before.get(0).getExternalName());
        assertEquals("Home", forest.flatten().get(0).getExternalName());
        assertNotEquals(before.get(0), forest.flatten().get(0));
    }

    @Test
    @DisplayName("Should ignore empty external names")
    void shouldIgnoreEmptyExternalNames() {
        // Given
        NodeTree expected = builder.build(List.of(HOME, US, MI));

        // When
        nested.updateExternalNames(Map.of("2", ""));

        // Then
        assertEquals(expected, nested);
    }
}
