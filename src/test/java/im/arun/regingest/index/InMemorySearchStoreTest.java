package im.arun.regingest.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class InMemorySearchStoreTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final InMemorySearchStore store = new InMemorySearchStore();

    private IndexAction doc(String key, String house, String text) {
        ObjectNode node = mapper.createObjectNode().put("House", house).put("ContributionTextFull", text);
        return new IndexAction(key, node, "hansard");
    }

    @Test
    void searchRanksByOccurrencesAndAppliesFilters() {
        store.bulkUpsert("hansard", List.of(
                doc("a", "Commons", "crypto regulation and more crypto"),
                doc("b", "Lords", "crypto"),
                doc("c", "Commons", "pensions")));

        List<SearchHit> hits = store.search("hansard", SearchQuery.text("Crypto"));
        assertThat(hits).extracting(SearchHit::getDocumentKey).containsExactly("a", "b");

        List<SearchHit> lords = store.search("hansard", SearchQuery.text("crypto").withFilter("House", "Lords"));
        assertThat(lords).extracting(SearchHit::getDocumentKey).containsExactly("b");
    }

    @Test
    void upsertReplacesDocumentsWithTheSameKey() {
        store.bulkUpsert("hansard", List.of(doc("a", "Commons", "old")));
        store.bulkUpsert("hansard", List.of(doc("a", "Commons", "new")));

        assertThat(store.count("hansard")).isEqualTo(1);
        assertThat(store.get("hansard", "a")).get()
                .satisfies(d -> assertThat(d.path("ContributionTextFull").asText()).isEqualTo("new"));
    }

    @Test
    void sizeLimitsHitsAndDeleteDropsCollection() {
        store.bulkUpsert("hansard", List.of(doc("a", "Commons", "x"), doc("b", "Commons", "x")));

        assertThat(store.search("hansard", SearchQuery.text("x").withSize(1))).hasSize(1);

        store.deleteCollection("hansard");
        assertThat(store.count("hansard")).isZero();
        assertThat(store.search("hansard", SearchQuery.text("x"))).isEmpty();
    }
}
