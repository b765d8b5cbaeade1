package im.arun.regingest.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.regingest.http.FetchKey;
import im.arun.regingest.http.RateLimitedCache;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * Resolves the debate ancestor chain of a Hansard section.
 *
 * <p>The whole forest of a (date, chamber) is loaded on first use and kept for the life of the
 * process. Concurrent lookups of the same key share a single load. A failed load is dropped
 * from the table so the next lookup tries again.
 */
public class HierarchyResolver {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyResolver.class);

    private final RateLimitedCache http;
    private final String hansardBaseUrl;
    private final ConcurrentMap<ForestKey, CompletableFuture<HierarchyForest>> forests = new ConcurrentHashMap<>();

    public HierarchyResolver(RateLimitedCache http, String hansardBaseUrl) {
        this.http = http;
        this.hansardBaseUrl = stripTrailingSlash(hansardBaseUrl);
    }

    /**
     * Ancestor chain of {@code leafId} (local or external id), leaf first and root last.
     * Returns an empty list when the forest cannot be loaded or the leaf is unknown; never throws.
     */
    public List<HierarchyNode> resolveAncestors(LocalDate date, Chamber chamber, String leafId) {
        if (date == null || chamber == null || leafId == null) {
            return List.of();
        }
        try {
            return forestFor(date, chamber).ancestors(leafId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while resolving hierarchy for {} {} {}", date, chamber, leafId);
            return List.of();
        } catch (Exception e) {
            logger.error("Failed to get debate parents for {} on {} ({}): {}", leafId, date, chamber, e.toString());
            return List.of();
        }
    }

    /**
     * Number of forests currently memoised.
     */
    public int cachedForestCount() {
        return (int) forests.values().stream()
                .filter(f -> f.isDone() && !f.isCompletedExceptionally())
                .count();
    }

    HierarchyForest forestFor(LocalDate date, Chamber chamber) throws InterruptedException, ExecutionException {
        ForestKey key = new ForestKey(date, chamber);
        CompletableFuture<HierarchyForest> mine = new CompletableFuture<>();
        CompletableFuture<HierarchyForest> existing = forests.putIfAbsent(key, mine);
        if (existing != null) {
            return existing.get();
        }

        try {
            HierarchyForest forest = loadForest(date, chamber);
            mine.complete(forest);
            logger.debug("Loaded hierarchy for {} {}: {} nodes", date, chamber, forest.size());
            return forest;
        } catch (RuntimeException e) {
            forests.remove(key, mine);
            mine.completeExceptionally(e);
            throw new ExecutionException(e);
        }
    }

    private HierarchyForest loadForest(LocalDate date, Chamber chamber) {
        String day = date.toString();
        JsonNode sections = http.fetchJson(FetchKey.get(hansardBaseUrl + "/overview/sectionsforday.json")
                .withParam("house", chamber.getApiName())
                .withParam("date", day));

        List<HierarchyNode> nodes = new ArrayList<>();
        if (sections != null && sections.isArray()) {
            for (JsonNode section : sections) {
                JsonNode trees = http.fetchJson(FetchKey.get(hansardBaseUrl + "/overview/sectiontrees.json")
                        .withParam("section", section.asText())
                        .withParam("date", day)
                        .withParam("house", chamber.getApiName()));
                nodes.addAll(HierarchyForest.parseSectionTrees(trees));
            }
        }
        return HierarchyForest.of(nodes);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Getter
    @EqualsAndHashCode
    @RequiredArgsConstructor
    private static final class ForestKey {
        private final LocalDate date;
        private final Chamber chamber;
    }
}
