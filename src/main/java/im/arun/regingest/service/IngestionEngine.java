package im.arun.regingest.service;

import im.arun.regingest.config.IngestConfig;
import im.arun.regingest.hierarchy.HierarchyResolver;
import im.arun.regingest.http.DiskResponseCache;
import im.arun.regingest.http.HttpClientFactory;
import im.arun.regingest.http.RateLimitedCache;
import im.arun.regingest.http.TokenBucketRateLimiter;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.index.SearchHit;
import im.arun.regingest.index.SearchQuery;
import im.arun.regingest.index.SearchStore;
import im.arun.regingest.pagination.PaginationDriver;
import im.arun.regingest.pagination.ProgressReporter;
import im.arun.regingest.source.DateRange;
import im.arun.regingest.source.FcaFirmLoader;
import im.arun.regingest.source.FcaIndividualLoader;
import im.arun.regingest.source.FcaProductLoader;
import im.arun.regingest.source.FcaRegisterClient;
import im.arun.regingest.source.HansardContributionLoader;
import im.arun.regingest.source.LoadReport;
import im.arun.regingest.source.ParliamentaryQuestionLoader;
import im.arun.regingest.source.Source;
import im.arun.regingest.source.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Wires the HTTP layer, hierarchy resolver, pagination driver and indexer into one loader per
 * source, and exposes the store maintenance operations.
 *
 * <p>One engine holds one {@link RateLimitedCache}, so every loader it runs shares the same
 * rate budget and response cache.
 */
public class IngestionEngine {
    private static final Logger logger = LoggerFactory.getLogger(IngestionEngine.class);

    private final SearchStore store;
    private final RateLimitedCache http;
    private final HierarchyResolver hierarchy;
    private final Map<Source, SourceLoader> loaders = new EnumMap<>(Source.class);

    public IngestionEngine(IngestConfig config,
                           RateLimitedCache http,
                           SearchStore store,
                           ExecutorService executor,
                           ProgressReporter progress,
                           Clock clock) {
        this.store = store;
        this.http = http;

        IngestConfig.Hansard hansard = config.getHansard();
        IngestConfig.Questions questions = config.getQuestions();
        IngestConfig.Fca fca = config.getFca();

        this.hierarchy = new HierarchyResolver(http, hansard.getBaseUrl());
        PaginationDriver driver = new PaginationDriver(http, executor);
        BulkIndexer indexer = new BulkIndexer(store, config.getStore().getBulkMaxRetries(),
                config.getStore().getBulkBackoffMs());
        FcaRegisterClient register = new FcaRegisterClient(http, fca.getBaseUrl(), fca.getEmail(), fca.getApiKey());

        register(new HansardContributionLoader(driver, indexer, hierarchy, executor, progress,
                hansard.getBaseUrl(), hansard.getContributionTypes(), hansard.getPageSize(),
                hansard.getConcurrency(), hansard.getEnrichmentConcurrency(), clock));
        register(new ParliamentaryQuestionLoader(driver, indexer, http, executor, progress,
                questions.getBaseUrl(), questions.getPageSize(), questions.getConcurrency(),
                questions.getEnrichmentConcurrency(), clock));
        register(new FcaFirmLoader(register, indexer, executor, progress,
                fca.getFirmSearchTerms(), fca.getKnownFrns(), fca.getMaxHitsPerTerm(), fca.getMaxFirms(),
                fca.getBatchSize(), fca.getFanOut(), clock));
        register(new FcaIndividualLoader(register, indexer, executor, progress,
                fca.getIndividualFirmFrns(), fca.getBatchSize(), fca.getFanOut(), clock));
        register(new FcaProductLoader(register, indexer, executor, progress,
                fca.getProductSearchTerms(), fca.getMaxHitsPerTerm(), fca.getMaxProducts(),
                fca.getBatchSize(), fca.getFanOut(), clock));
    }

    /**
     * Builds an engine talking to the real upstream APIs, with the disk cache and rate limiter
     * configured from {@code config}.
     */
    public static IngestionEngine create(IngestConfig config,
                                         SearchStore store,
                                         ExecutorService executor,
                                         ProgressReporter progress,
                                         Map<String, String> env) {
        IngestConfig.Http settings = config.getHttp();
        Clock clock = Clock.systemUTC();
        DiskResponseCache cache = new DiskResponseCache(settings.resolveCacheDir(env),
                Duration.ofHours(settings.getCacheTtlHours()), clock);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(
                Duration.ofMillis(settings.getRateLimitIntervalMs()), settings.getRateLimitCapacity());
        RateLimitedCache http = new RateLimitedCache(
                HttpClientFactory.create(Duration.ofSeconds(settings.getTimeoutSeconds())),
                cache, limiter, settings.getMaxRetries(),
                Duration.ofSeconds(settings.getRateLimitMaxWaitSeconds()), settings.getRetryBackoffMs(), clock);
        logger.info("HTTP cache at {}, one request per {}ms", cache.getBaseDir(), settings.getRateLimitIntervalMs());
        return new IngestionEngine(config, http, store, executor, progress, clock);
    }

    /**
     * Loads one source for the given window.
     */
    public LoadReport load(Source source, DateRange range) {
        SourceLoader loader = loaders.get(source);
        LoadReport report = loader.load(range);
        logger.info("{}: {} network call(s) so far, {} debate hierarchies cached",
                source, http.networkCallCount(), hierarchy.cachedForestCount());
        return report;
    }

    /**
     * Creates every source collection. Existing collections are left alone.
     */
    public void initStore() {
        for (Source source : Source.values()) {
            store.createCollection(source.getCollection());
        }
    }

    /**
     * Drops every source collection with its documents.
     */
    public void deleteStore() {
        for (Source source : Source.values()) {
            store.deleteCollection(source.getCollection());
        }
    }

    public List<SearchHit> search(Source source, SearchQuery query) {
        return store.search(source.getCollection(), query);
    }

    public long count(Source source) {
        return store.count(source.getCollection());
    }

    public RateLimitedCache getHttp() {
        return http;
    }

    private void register(SourceLoader loader) {
        loaders.put(loader.source(), loader);
    }
}
