package im.arun.regingest.source;

import im.arun.regingest.exception.ErrorCode;
import im.arun.regingest.exception.IngestException;
import im.arun.regingest.exception.PartialBulkFailureException;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.index.IndexableRecord;
import im.arun.regingest.pagination.PagedEndpoint;
import im.arun.regingest.pagination.PageParser;
import im.arun.regingest.pagination.PaginationDriver;
import im.arun.regingest.pagination.PaginationResult;
import im.arun.regingest.pagination.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Shared orchestration for paginated sources: count, page, optionally enrich each record,
 * then index each page as soon as it arrives.
 *
 * <p>Flat sources pass records straight to the indexer. Enriched sources transform them first
 * through {@link #enrichConcurrently}, whose concurrency is bounded separately from the
 * page-level limit.
 */
public abstract class PaginatedSourceLoader<R extends IndexableRecord> implements SourceLoader {
    private static final Logger logger = LoggerFactory.getLogger(PaginatedSourceLoader.class);

    protected final PaginationDriver driver;
    protected final BulkIndexer indexer;
    protected final ExecutorService executor;
    protected final ProgressReporter progress;
    protected final Clock clock;
    private final Semaphore enrichmentPermits;

    protected PaginatedSourceLoader(PaginationDriver driver,
                                    BulkIndexer indexer,
                                    ExecutorService executor,
                                    ProgressReporter progress,
                                    int enrichmentConcurrency,
                                    Clock clock) {
        this.driver = driver;
        this.indexer = indexer;
        this.executor = executor;
        this.progress = progress;
        this.clock = clock;
        this.enrichmentPermits = new Semaphore(Math.max(1, enrichmentConcurrency));
    }

    @Override
    public LoadReport load(DateRange range) {
        if (source().isDateBound() && range.getFrom() == null) {
            throw new ValidationException("--from-date is required for source '" + source() + "'");
        }
        LoadTally tally = new LoadTally(source(), range, clock);
        logger.info("Loading {} for {}", source(), range);

        PaginationResult result = run(range, tally);
        tally.failedPages(result.getFailures().size());

        if (result.allPagesFailed()) {
            throw new IngestException(ErrorCode.INGESTION_FAILED,
                    "Every page failed for source " + source(),
                    Map.of("source", source().getCliName(), "pages", result.getPagesIssued()));
        }
        LoadReport report = tally.toReport();
        logger.info("Finished {}", report);
        return report;
    }

    /**
     * Runs every paginated query of the source and returns their combined result.
     */
    protected abstract PaginationResult run(DateRange range, LoadTally tally);

    /**
     * Paginates one endpoint, passing each page through {@code prepare} and into the indexer.
     */
    protected PaginationResult paginate(PagedEndpoint endpoint,
                                        PageParser<R> parser,
                                        int pageSize,
                                        int concurrency,
                                        UnaryOperator<List<R>> prepare,
                                        LoadTally tally) {
        return driver.paginate(endpoint, parser, pageSize, concurrency,
                (page, records) -> index(prepare.apply(records), tally), progress);
    }

    /**
     * Applies {@code enrichment} to every record with bounded concurrency and returns the results
     * in input order. A record whose enrichment throws is kept unchanged.
     */
    protected List<R> enrichConcurrently(List<R> records, UnaryOperator<R> enrichment) {
        List<CompletableFuture<R>> futures = new ArrayList<>(records.size());
        for (R record : records) {
            try {
                enrichmentPermits.acquire();
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while enriching " + source());
            }
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return enrichment.apply(record);
                } catch (CancellationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    logger.warn("Enrichment failed for {}: {}", record.documentKey(), e.getMessage());
                    return record;
                } finally {
                    enrichmentPermits.release();
                }
            }, executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
    }

    /**
     * Raises the first count failure of concurrently run endpoints once all of them finished.
     */
    protected static PaginationResult combine(List<CompletableFuture<PaginationResult>> runs) {
        PaginationResult combined = PaginationResult.empty();
        RuntimeException firstFailure = null;
        for (CompletableFuture<PaginationResult> run : runs) {
            try {
                combined = combined.plus(run.join());
            } catch (RuntimeException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException
                        ? (RuntimeException) e.getCause()
                        : e;
                if (firstFailure == null) {
                    firstFailure = cause;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        return combined;
    }

    private void index(List<R> records, LoadTally tally) {
        if (records.isEmpty()) {
            return;
        }
        tally.attempted(records.size());
        try {
            tally.indexed(indexer.store(source().getCollection(), records));
        } catch (PartialBulkFailureException e) {
            tally.indexed(e.getAcceptedCount());
            tally.failedRecords(e.getFailedKeys().size());
            logger.error("{} of {} document(s) rejected by {}: {}", e.getFailedKeys().size(), records.size(),
                    e.getCollection(), e.getCauses());
        }
    }
}
