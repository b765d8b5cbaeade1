package im.arun.regingest.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.regingest.hierarchy.HierarchyResolver;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.model.Contribution;
import im.arun.regingest.model.ContributionsResponse;
import im.arun.regingest.pagination.PagedEndpoint;
import im.arun.regingest.pagination.PaginationDriver;
import im.arun.regingest.pagination.PaginationResult;
import im.arun.regingest.pagination.ProgressReporter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Loads Hansard contributions of every configured type, each enriched with the chain of debate
 * sections it sits in.
 */
public class HansardContributionLoader extends PaginatedSourceLoader<Contribution> {
    private final HierarchyResolver hierarchy;
    private final String baseUrl;
    private final List<String> contributionTypes;
    private final int pageSize;
    private final int concurrency;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HansardContributionLoader(PaginationDriver driver,
                                     BulkIndexer indexer,
                                     HierarchyResolver hierarchy,
                                     ExecutorService executor,
                                     ProgressReporter progress,
                                     String baseUrl,
                                     List<String> contributionTypes,
                                     int pageSize,
                                     int concurrency,
                                     int enrichmentConcurrency,
                                     Clock clock) {
        super(driver, indexer, executor, progress, enrichmentConcurrency, clock);
        this.hierarchy = hierarchy;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.contributionTypes = List.copyOf(contributionTypes);
        this.pageSize = pageSize;
        this.concurrency = concurrency;
    }

    @Override
    public Source source() {
        return Source.HANSARD;
    }

    @Override
    protected PaginationResult run(DateRange range, LoadTally tally) {
        List<CompletableFuture<PaginationResult>> runs = new ArrayList<>();
        for (String type : contributionTypes) {
            PagedEndpoint endpoint = endpoint(type, range);
            runs.add(CompletableFuture.supplyAsync(() -> paginate(endpoint,
                    body -> ContributionsResponse.parse(body, objectMapper),
                    pageSize, concurrency,
                    page -> enrichConcurrently(page, this::withDebateParents),
                    tally), executor));
        }
        return combine(runs);
    }

    PagedEndpoint endpoint(String type, DateRange range) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("orderBy", "SittingDateAsc");
        params.put("startDate", range.getFrom());
        if (range.getTo() != null) {
            params.put("endDate", range.getTo());
        }
        return PagedEndpoint.of("hansard " + type,
                baseUrl + "/search/contributions/" + type + ".json",
                params, ContributionsResponse.COUNT_FIELD);
    }

    private Contribution withDebateParents(Contribution contribution) {
        contribution.setDebateParents(hierarchy.resolveAncestors(
                contribution.sittingDay(), contribution.chamber(), contribution.getDebateSectionExtId()));
        return contribution;
    }
}
