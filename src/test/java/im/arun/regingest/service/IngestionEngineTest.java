package im.arun.regingest.service;

import im.arun.regingest.config.IngestConfig;
import im.arun.regingest.http.FakeUpstream;
import im.arun.regingest.index.InMemorySearchStore;
import im.arun.regingest.index.SearchHit;
import im.arun.regingest.index.SearchQuery;
import im.arun.regingest.index.SearchStore;
import im.arun.regingest.pagination.ProgressReporter;
import im.arun.regingest.source.DateRange;
import im.arun.regingest.source.LoadReport;
import im.arun.regingest.source.Source;
import im.arun.regingest.util.ExecutorProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class IngestionEngineTest {
    @TempDir
    Path cacheDir;

    private ExecutorService executor;
    private IngestConfig config;

    @BeforeEach
    void setUp() {
        executor = ExecutorProvider.newWorkerPool("engine-test-");
        config = new IngestConfig();
        config.getFca().setBaseUrl("https://fca.test/services");
        config.getFca().setFirmSearchTerms(List.of());
        config.getFca().setKnownFrns(List.of("615820"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void initAndDeleteTouchEveryCollection() {
        SearchStore store = mock(SearchStore.class);
        IngestionEngine engine = new IngestionEngine(config, new FakeUpstream().rateLimitedCache(cacheDir),
                store, executor, ProgressReporter.NONE, Clock.systemUTC());

        engine.initStore();
        engine.deleteStore();

        for (Source source : Source.values()) {
            verify(store).createCollection(source.getCollection());
            verify(store).deleteCollection(source.getCollection());
        }
    }

    @Test
    void loadDispatchesToTheSourceAndResultsAreSearchable() {
        FakeUpstream upstream = new FakeUpstream()
                .json("/Firm/615820", "{\"Status\":\"FSR-API-02-01-00\",\"Message\":\"Ok. Firm Found\","
                        + "\"Data\":[{\"Organisation Name\":\"Example Payments Ltd\"}]}");
        InMemorySearchStore store = new InMemorySearchStore();
        IngestionEngine engine = new IngestionEngine(config, upstream.rateLimitedCache(cacheDir),
                store, executor, ProgressReporter.NONE, Clock.systemUTC());

        LoadReport report = engine.load(Source.FIRMS_REGISTER, DateRange.none());

        assertThat(report.getSource()).isEqualTo("firms-register");
        assertThat(report.getIndexed()).isEqualTo(1);
        assertThat(engine.count(Source.FIRMS_REGISTER)).isEqualTo(1);
        SearchQuery query = SearchQuery.text("payments");
        assertThat(engine.search(Source.FIRMS_REGISTER, query))
                .extracting(SearchHit::getDocumentKey)
                .containsExactly("firm_615820");
        assertThat(engine.search(Source.PRODUCTS, query)).isEmpty();
    }
}
