package im.arun.regingest.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.regingest.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * All debate sections of one (date, chamber), indexed by both local and external id.
 */
public class HierarchyForest {
    private final Map<String, HierarchyNode> byId;
    private final int nodeCount;

    private HierarchyForest(Map<String, HierarchyNode> byId, int nodeCount) {
        this.byId = Collections.unmodifiableMap(byId);
        this.nodeCount = nodeCount;
    }

    public static HierarchyForest empty() {
        return new HierarchyForest(new HashMap<>(), 0);
    }

    /**
     * Builds a forest from flattened nodes. A parent reference that matches another node's
     * local id is rewritten to that node's external id.
     */
    public static HierarchyForest of(List<HierarchyNode> nodes) {
        Map<String, String> externalByLocal = new HashMap<>();
        for (HierarchyNode node : nodes) {
            if (node.getLocalId() != null && node.getExternalId() != null) {
                externalByLocal.put(node.getLocalId(), node.getExternalId());
            }
        }

        Map<String, HierarchyNode> index = new HashMap<>();
        for (HierarchyNode node : nodes) {
            String parent = node.getParentExternalId();
            String normalizedParent = parent != null && externalByLocal.containsKey(parent)
                    ? externalByLocal.get(parent)
                    : parent;
            HierarchyNode normalized = new HierarchyNode(node.getLocalId(), node.getExternalId(),
                    node.getTitle(), normalizedParent);
            if (normalized.getLocalId() != null) {
                index.put(normalized.getLocalId(), normalized);
            }
            if (normalized.getExternalId() != null) {
                index.put(normalized.getExternalId(), normalized);
            }
        }
        return new HierarchyForest(index, nodes.size());
    }

    /**
     * Reads the {@code SectionTreeItems} of a {@code sectiontrees.json} response.
     *
     * @throws ValidationException if an item has no id or no external id
     */
    public static List<HierarchyNode> parseSectionTrees(JsonNode trees) {
        List<HierarchyNode> nodes = new ArrayList<>();
        if (trees == null || !trees.isArray()) {
            return nodes;
        }
        for (JsonNode tree : trees) {
            JsonNode items = tree.path("SectionTreeItems");
            if (!items.isArray()) {
                continue;
            }
            for (JsonNode item : items) {
                JsonNode id = item.get("Id");
                JsonNode externalId = item.get("ExternalId");
                if (id == null || id.isNull() || externalId == null || externalId.isNull()) {
                    throw new ValidationException("Section tree item without Id/ExternalId: " + item);
                }
                JsonNode parentId = item.get("ParentId");
                nodes.add(new HierarchyNode(
                        id.asText(),
                        externalId.asText(),
                        item.path("Title").asText(null),
                        parentId == null || parentId.isNull() ? null : parentId.asText()));
            }
        }
        return nodes;
    }

    public Optional<HierarchyNode> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Walks from {@code leafId} to the root, leaf first. Stops at a missing parent or a node
     * already visited.
     */
    public List<HierarchyNode> ancestors(String leafId) {
        List<HierarchyNode> chain = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        Optional<HierarchyNode> current = find(leafId);
        while (current.isPresent()) {
            HierarchyNode node = current.get();
            if (!visited.add(node.getExternalId())) {
                break;
            }
            chain.add(node);
            current = find(node.getParentExternalId());
        }
        return chain;
    }

    public int size() {
        return nodeCount;
    }
}
