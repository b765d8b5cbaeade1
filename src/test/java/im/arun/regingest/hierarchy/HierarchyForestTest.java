package im.arun.regingest.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.regingest.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HierarchyForestTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void ancestorsRunFromLeafToRootWithEachParentLinked() {
        HierarchyForest forest = HierarchyForest.of(List.of(
                new HierarchyNode("1", "ROOT", "Commons Chamber", null),
                new HierarchyNode("2", "MID", "Financial Services", "1"),
                new HierarchyNode("3", "LEAF", "Crypto Assets", "2")));

        List<HierarchyNode> chain = forest.ancestors("LEAF");

        assertThat(chain).extracting(HierarchyNode::getExternalId).containsExactly("LEAF", "MID", "ROOT");
        for (int i = 0; i < chain.size() - 1; i++) {
            assertThat(chain.get(i).getParentExternalId()).isEqualTo(chain.get(i + 1).getExternalId());
        }
        assertThat(chain.get(chain.size() - 1).getParentExternalId()).isNull();
    }

    @Test
    void leafCanBeLookedUpByLocalId() {
        HierarchyForest forest = HierarchyForest.of(List.of(
                new HierarchyNode("10", "A", "Root", null),
                new HierarchyNode("11", "B", "Child", "10")));

        assertThat(forest.ancestors("11")).extracting(HierarchyNode::getExternalId).containsExactly("B", "A");
    }

    @Test
    void parentReferencesAlreadyGivenAsExternalIdsAreKept() {
        HierarchyForest forest = HierarchyForest.of(List.of(
                new HierarchyNode("1", "ROOT", "Root", null),
                new HierarchyNode("2", "CHILD", "Child", "ROOT")));

        assertThat(forest.find("CHILD")).get()
                .extracting(HierarchyNode::getParentExternalId).isEqualTo("ROOT");
    }

    @Test
    void cycleStopsTheWalk() {
        HierarchyForest forest = HierarchyForest.of(List.of(
                new HierarchyNode("1", "A", "A", "2"),
                new HierarchyNode("2", "B", "B", "1")));

        assertThat(forest.ancestors("A")).extracting(HierarchyNode::getExternalId).containsExactly("A", "B");
    }

    @Test
    void unknownLeafGivesEmptyChain() {
        assertThat(HierarchyForest.empty().ancestors("X")).isEmpty();
    }

    @Test
    void parsesSectionTreeItems() throws Exception {
        JsonNode trees = mapper.readTree("[{\"SectionTreeItems\":["
                + "{\"Id\":100,\"ExternalId\":\"E-100\",\"Title\":\"Business\",\"ParentId\":null},"
                + "{\"Id\":101,\"ExternalId\":\"E-101\",\"Title\":\"Banking\",\"ParentId\":100}]}]");

        List<HierarchyNode> nodes = HierarchyForest.parseSectionTrees(trees);
        HierarchyForest forest = HierarchyForest.of(nodes);

        assertThat(nodes).hasSize(2);
        assertThat(forest.ancestors("E-101").stream().map(HierarchyNode::getTitle).collect(Collectors.toList()))
                .containsExactly("Banking", "Business");
        assertThat(forest.find("E-101").get().getParentExternalId()).isEqualTo("E-100");
    }

    @Test
    void itemWithoutExternalIdIsRejected() throws Exception {
        JsonNode trees = mapper.readTree("[{\"SectionTreeItems\":[{\"Id\":1,\"Title\":\"Broken\"}]}]");

        assertThatThrownBy(() -> HierarchyForest.parseSectionTrees(trees)).isInstanceOf(ValidationException.class);
    }
}
