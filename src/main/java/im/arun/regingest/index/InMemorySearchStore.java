package im.arun.regingest.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps documents in memory. Backs dry runs and tests.
 *
 * <p>Search scores a document by the number of occurrences of the query text in its string
 * values, case-insensitively; filters compare field values exactly.
 */
public class InMemorySearchStore implements SearchStore {
    private final Map<String, Map<String, ObjectNode>> collections = new ConcurrentHashMap<>();

    @Override
    public BulkResult bulkUpsert(String collection, List<IndexAction> actions) {
        Map<String, ObjectNode> documents = collections.computeIfAbsent(collection, k -> new ConcurrentHashMap<>());
        for (IndexAction action : actions) {
            documents.put(action.getDocumentKey(), action.getDocument().deepCopy());
        }
        return BulkResult.allAccepted(actions.size());
    }

    @Override
    public List<SearchHit> search(String collection, SearchQuery query) {
        Map<String, ObjectNode> documents = collections.get(collection);
        if (documents == null) {
            return List.of();
        }
        String needle = query.getText() == null ? "" : query.getText().toLowerCase(Locale.ROOT).trim();
        List<SearchHit> hits = new ArrayList<>();
        documents.forEach((key, doc) -> {
            if (!matchesFilters(doc, query.getFilters())) {
                return;
            }
            double score = needle.isEmpty() ? 1.0 : occurrences(doc, needle);
            if (score > 0) {
                hits.add(new SearchHit(key, score, doc.deepCopy()));
            }
        });
        hits.sort(Comparator.comparingDouble(SearchHit::getScore).reversed()
                .thenComparing(SearchHit::getDocumentKey));
        return hits.size() > query.getSize() ? new ArrayList<>(hits.subList(0, query.getSize())) : hits;
    }

    @Override
    public void createCollection(String collection) {
        collections.computeIfAbsent(collection, k -> new ConcurrentHashMap<>());
    }

    @Override
    public void deleteCollection(String collection) {
        collections.remove(collection);
    }

    @Override
    public long count(String collection) {
        Map<String, ObjectNode> documents = collections.get(collection);
        return documents == null ? 0 : documents.size();
    }

    public Optional<ObjectNode> get(String collection, String documentKey) {
        Map<String, ObjectNode> documents = collections.get(collection);
        return documents == null ? Optional.empty() : Optional.ofNullable(documents.get(documentKey));
    }

    private static boolean matchesFilters(ObjectNode doc, Map<String, String> filters) {
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            JsonNode value = doc.get(filter.getKey());
            if (value == null || !filter.getValue().equals(value.asText())) {
                return false;
            }
        }
        return true;
    }

    private static int occurrences(JsonNode node, String needle) {
        if (node.isTextual()) {
            String text = node.asText().toLowerCase(Locale.ROOT);
            int count = 0;
            int from = text.indexOf(needle);
            while (from >= 0) {
                count++;
                from = text.indexOf(needle, from + needle.length());
            }
            return count;
        }
        int total = 0;
        Iterator<JsonNode> children = node.elements();
        while (children.hasNext()) {
            total += occurrences(children.next(), needle);
        }
        return total;
    }
}
