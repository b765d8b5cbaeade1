package im.arun.regingest.source;

import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.hierarchy.HierarchyResolver;
import im.arun.regingest.http.FakeUpstream;
import im.arun.regingest.http.RateLimitedCache;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.index.InMemorySearchStore;
import im.arun.regingest.pagination.PaginationDriver;
import im.arun.regingest.pagination.ProgressReporter;
import im.arun.regingest.util.ExecutorProvider;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HansardContributionLoaderTest {
    private static final String BASE = "https://hansard.example.org";
    private static final int TOTAL = 3;
    private static final DateRange MARCH_5 = DateRange.of(LocalDate.of(2024, 3, 5), LocalDate.of(2024, 3, 5));

    @TempDir
    Path cacheDir;

    private ExecutorService executor;
    private InMemorySearchStore store;
    private FakeUpstream upstream;
    private RateLimitedCache http;

    @BeforeEach
    void setUp() {
        executor = ExecutorProvider.newWorkerPool("hansard-test-");
        store = new InMemorySearchStore();
        upstream = new FakeUpstream()
                .json("/overview/sectionsforday.json", "[\"Commons Chamber\"]")
                .json("/overview/sectiontrees.json", "[{\"SectionTreeItems\":["
                        + "{\"Id\":1,\"ExternalId\":\"ROOT\",\"Title\":\"Commons Chamber\",\"ParentId\":null},"
                        + "{\"Id\":2,\"ExternalId\":\"DEBATE\",\"Title\":\"Financial Services Bill\",\"ParentId\":1}]}]")
                .json(FakeUpstream.path("/search/contributions/Spoken.json"), HansardContributionLoaderTest::spokenPage)
                .json("/search/contributions/Written.json", "{\"TotalResultCount\":0,\"Results\":[]}");
        http = upstream.rateLimitedCache(cacheDir);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static String spokenPage(HttpUrl url) {
        int skip = Integer.parseInt(url.queryParameter("skip"));
        int take = Integer.parseInt(url.queryParameter("take"));
        StringBuilder results = new StringBuilder();
        for (int i = skip; i < Math.min(TOTAL, skip + take); i++) {
            results.append(results.length() == 0 ? "" : ",")
                    .append("{\"ContributionExtId\":\"C-").append(i).append("\",")
                    .append("\"ContributionText\":\"Speech ").append(i).append("\",")
                    .append("\"ContributionTextFull\":\"Speech ").append(i).append(" about banking\",")
                    .append("\"DebateSection\":\"Financial Services Bill\",\"DebateSectionExtId\":\"DEBATE\",")
                    .append("\"SittingDate\":\"2024-03-05T00:00:00\",\"House\":\"Commons\",")
                    .append("\"OrderInDebateSection\":").append(i).append("}");
        }
        return "{\"TotalResultCount\":" + TOTAL + ",\"Results\":[" + results + "]}";
    }

    private HansardContributionLoader loader() {
        return new HansardContributionLoader(new PaginationDriver(http, executor), new BulkIndexer(store, 0, 0),
                new HierarchyResolver(http, BASE), executor, ProgressReporter.NONE, BASE,
                List.of("Spoken", "Written"), 2, 5, 3, Clock.systemUTC());
    }

    @Test
    void indexesEveryContributionWithItsDebateChain() {
        LoadReport report = loader().load(MARCH_5);

        assertThat(report.getAttempted()).isEqualTo(3);
        assertThat(report.getIndexed()).isEqualTo(3);
        assertThat(report.getFailedPages()).isZero();
        assertThat(report.getSource()).isEqualTo("hansard");
        assertThat(store.count("hansard_contributions")).isEqualTo(3);

        ObjectNode doc = store.get("hansard_contributions", "debate_DEBATE_contrib_C-1").orElseThrow();
        assertThat(doc.path("debate_parents")).hasSize(2);
        assertThat(doc.path("debate_parents").get(0).path("external_id").asText()).isEqualTo("DEBATE");
        assertThat(doc.path("debate_parents").get(1).path("external_id").asText()).isEqualTo("ROOT");
    }

    @Test
    void requestsCarryTheDateWindowAndOrdering() {
        loader().load(MARCH_5);

        HttpUrl count = upstream.requests().stream()
                .map(r -> r.url())
                .filter(u -> u.encodedPath().endsWith("/Spoken.json"))
                .findFirst().orElseThrow();
        assertThat(count.queryParameter("orderBy")).isEqualTo("SittingDateAsc");
        assertThat(count.queryParameter("startDate")).isEqualTo("2024-03-05");
        assertThat(count.queryParameter("endDate")).isEqualTo("2024-03-05");
    }

    @Test
    void rerunIsServedFromCacheAndKeepsOneDocumentPerContribution() {
        loader().load(MARCH_5);
        long callsAfterFirstRun = http.networkCallCount();

        LoadReport second = loader().load(MARCH_5);

        assertThat(second.getIndexed()).isEqualTo(3);
        assertThat(store.count("hansard_contributions")).isEqualTo(3);
        assertThat(http.networkCallCount()).isEqualTo(callsAfterFirstRun);
    }

    @Test
    void fromDateIsRequired() {
        assertThatThrownBy(() -> loader().load(DateRange.none())).isInstanceOf(ValidationException.class);
        assertThat(upstream.callCount()).isZero();
    }
}
