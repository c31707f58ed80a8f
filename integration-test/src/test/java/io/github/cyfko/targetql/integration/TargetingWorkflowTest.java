package io.github.cyfko.targetql.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.targetql.core.Criteria;
import io.github.cyfko.targetql.core.api.Criterion;
import io.github.cyfko.targetql.core.api.Operator;
import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetField;
import io.github.cyfko.targetql.core.api.TargetKind;
import io.github.cyfko.targetql.core.api.TargetPartition;
import io.github.cyfko.targetql.core.api.TargetProvider;
import io.github.cyfko.targetql.core.api.TargetType;
import io.github.cyfko.targetql.core.api.TargetingData;
import io.github.cyfko.targetql.core.codec.DocumentMapper;
import io.github.cyfko.targetql.core.config.CodecPolicy;
import io.github.cyfko.targetql.core.tree.NodeTree;
import io.github.cyfko.targetql.core.tree.TreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end workflow: ad server listings are turned into trees, narrowed to a selection,
 * expressed as targeting criteria and persisted as JSON.
 */
class TargetingWorkflowTest {

    private static final Target NETWORK = adUnit("100", null, "network");
    private static final Target NEWS = adUnit("200", "100", "news");
    private static final Target SPORTS = adUnit("300", "100", "sports");
    private static final Target HOCKEY = adUnit("310", "300", "sports/hockey");
    private static final Target BASEBALL = adUnit("320", "300", "sports/baseball");

    private static final Target US = geography("2840", null, "United States", "COUNTRY");
    private static final Target MICHIGAN = geography("21155", "2840", "Michigan", "STATE");
    private static final Target DETROIT = geography("1017250", "21155", "Detroit", "CITY");
    private static final Target CANADA = geography("2124", null, "Canada", "COUNTRY");

    private TargetProvider provider;
    private TreeBuilder treeBuilder;

    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        provider = mock(TargetProvider.class);
        when(provider.getTargets(any())).thenCallRealMethod();
        when(provider.getAdUnitTargets()).thenReturn(List.of(NETWORK, NEWS, SPORTS, HOCKEY, BASEBALL));
        when(provider.getGeographyTargets()).thenReturn(List.of(US, MICHIGAN, DETROIT, CANADA));
        treeBuilder = new TreeBuilder(provider);
    }

    @Test
    void shouldBuildInventoryTargetingFromSelectedAdUnits() {
        NodeTree inventory = treeBuilder.constructTree(TargetType.ADUNIT);
        NodeTree sports = inventory.getSubtree(TargetField.ID, "300").orElseThrow();

        Criterion included = Criteria.of(Operator.OR, sports.flattenLeaves());
        Criterion excluded = Criteria.of(NEWS);
        Criterion criterion = included.and(excluded.not());

        TargetPartition partition = criterion.getIncludesAndExcludes();
        assertEquals(List.of(HOCKEY, BASEBALL), partition.includes());
        assertEquals(List.of(NEWS), partition.excludes());
        assertEquals(List.of(NETWORK, SPORTS), inventory.getSubtreeParents(TargetField.ID, "310"));
        verify(provider).getAdUnitTargets();
    }

    @Test
    void shouldNarrowGeographiesToSelection() {
        NodeTree geographies = treeBuilder.constructTree(TargetType.GEOGRAPHY);

        NodeTree selection = geographies.filterTree(Set.of("21155"));

        assertEquals(List.of(US, MICHIGAN), selection.flatten());
        assertEquals(2, geographies.getChildren().size(), "Source tree must stay untouched");
        assertEquals(List.of(US, CANADA), geographies.flatten(0));
        assertEquals(List.of(DETROIT, CANADA), geographies.flattenLeaves());
    }

    @Test
    void shouldPersistTargetingDataAsJson() throws Exception {
        Criterion inventory = Criteria.of(HOCKEY).or(Criteria.of(BASEBALL)).and(Criteria.of(NEWS).not());
        Criterion geography = Criteria.of(MICHIGAN).or(Criteria.of(CANADA));
        TargetingData data = TargetingData.builder()
                .criterion(TargetingData.Slot.INVENTORY, inventory)
                .criterion(TargetingData.Slot.GEOGRAPHY, geography)
                .build();
        DocumentMapper documents = new DocumentMapper();

        String json = documents.writeTargetingData(data);

        JsonNode root = mapper.readTree(json);
        assertEquals("TargetingData", root.path("_metadata").path("kind").asText());
        assertTrue(root.get("day_part").isNull());
        JsonNode and = root.path("inventory").path("AND");
        assertEquals(2, and.size());
        assertEquals("310", and.get(0).path("OR").get(0).path("id").asText());
        assertEquals("Criterion", and.get(1).path("_metadata").path("kind").asText());
        assertEquals("STATE", root.path("geography").path("OR").get(0).path("type").asText());

        assertEquals(data, documents.readTargetingData(json));
    }

    @Test
    void shouldExchangeDocumentsWithLegacyConsumers() throws Exception {
        Criterion criterion = Criteria.of(US).and(Criteria.of(DETROIT).not());
        DocumentMapper legacy = new DocumentMapper(CodecPolicy.legacy());

        String json = legacy.writeCriterion(criterion);

        JsonNode root = mapper.readTree(json);
        assertEquals("TargetingCriterion", root.path("_metadata").path("cls").asText());
        assertEquals(criterion, new DocumentMapper().readCriterion(json));
    }

    @Test
    void shouldPersistRelabelledTrees() {
        NodeTree inventory = treeBuilder.constructTree(TargetType.ADUNIT);
        inventory.updateExternalNames(Map.of("310", "Hockey", "320", ""));
        DocumentMapper documents = new DocumentMapper(CodecPolicy.pretty());

        NodeTree restored = documents.readTree(documents.writeTree(inventory));

        assertEquals(inventory, restored);
        assertEquals("Hockey", restored.getSubtree(TargetField.ID, "310").orElseThrow().getValue().getExternalName());
        assertNull(restored.getSubtree(TargetField.ID, "320").orElseThrow().getValue().getExternalName());
        assertEquals(2, restored.getMaxDepth().orElseThrow());
    }

    @Test
    void shouldDropTargetFromTopLevelSelection() {
        Criterion selection = Criteria.of(Operator.AND, NEWS, SPORTS, HOCKEY);

        Criterion remaining = selection.removeTarget(Criteria.of(SPORTS)).orElseThrow();

        assertEquals(Criteria.of(Operator.AND, NEWS, HOCKEY), remaining);
        assertEquals(Criteria.of(HOCKEY),
                remaining.removeTarget(Criteria.of(NEWS)).orElseThrow());
    }

    private static Target adUnit(String id, String parentId, String name) {
        return Target.builder(TargetKind.AD_UNIT)
                .id(id)
                .parentId(parentId)
                .name(name)
                .attribute("include_descendants", true)
                .build();
    }

    private static Target geography(String id, String parentId, String name, String type) {
        return Target.builder(TargetKind.GEOGRAPHY)
                .id(id)
                .parentId(parentId)
                .name(name)
                .attribute("type", type)
                .build();
    }
}
