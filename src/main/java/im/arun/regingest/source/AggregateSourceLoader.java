package im.arun.regingest.source;

import im.arun.regingest.exception.ErrorCode;
import im.arun.regingest.exception.IngestException;
import im.arun.regingest.exception.PartialBulkFailureException;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.index.IndexableRecord;
import im.arun.regingest.pagination.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Shared orchestration for multi-endpoint sources: discover the core items, then assemble each
 * item from its sub-resources and index the composites.
 *
 * <p>Items run in small fixed-size batches; within an item at most {@code fanOut} sub-resource
 * fetches run at once. Requests in flight for the whole job stay below batch size times fan-out,
 * and the shared rate limiter paces what actually reaches the network.
 */
public abstract class AggregateSourceLoader<I, R extends IndexableRecord> implements SourceLoader {
    private static final Logger logger = LoggerFactory.getLogger(AggregateSourceLoader.class);

    protected final BulkIndexer indexer;
    protected final ExecutorService executor;
    protected final ProgressReporter progress;
    protected final Clock clock;
    private final int batchSize;
    private final int fanOut;

    protected AggregateSourceLoader(BulkIndexer indexer,
                                    ExecutorService executor,
                                    ProgressReporter progress,
                                    int batchSize,
                                    int fanOut,
                                    Clock clock) {
        this.indexer = indexer;
        this.executor = executor;
        this.progress = progress;
        this.batchSize = Math.max(1, batchSize);
        this.fanOut = Math.max(1, fanOut);
        this.clock = clock;
    }

    @Override
    public LoadReport load(DateRange range) {
        LoadTally tally = new LoadTally(source(), range, clock);
        List<I> items = discoverItems();
        String task = source().getCliName();
        progress.start(task, items.size());
        logger.info("{}: {} item(s) to load in batches of {}", task, items.size(), batchSize);

        int failedItems = 0;
        for (int start = 0; start < items.size(); start += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Load of " + source() + " cancelled");
            }
            List<I> batch = items.subList(start, Math.min(start + batchSize, items.size()));
            List<CompletableFuture<Optional<R>>> futures = batch.stream()
                    .map(item -> CompletableFuture.supplyAsync(() -> assemble(item), executor))
                    .collect(Collectors.toList());
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .exceptionally(e -> null)
                    .join();

            List<R> records = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).join().ifPresent(records::add);
                } catch (RuntimeException e) {
                    failedItems++;
                    tally.failedRecords(1);
                    logger.warn("Failed to process {} {}: {}", task, batch.get(i), rootMessage(e));
                }
            }
            index(records, tally);
            progress.advance(task, batch.size());
        }
        progress.finish(task);

        if (!items.isEmpty() && failedItems == items.size()) {
            throw new IngestException(ErrorCode.INGESTION_FAILED,
                    "Every item failed for source " + source(),
                    Map.of("source", source().getCliName(), "items", items.size()));
        }
        LoadReport report = tally.toReport();
        logger.info("Finished {}", report);
        return report;
    }

    /**
     * Core items to load, already de-duplicated.
     */
    protected abstract List<I> discoverItems();

    /**
     * Builds the composite record of one item. Empty when the register has no record for it.
     */
    protected abstract Optional<R> assemble(I item);

    /**
     * Runs the sub-resource fetches of one item concurrently and returns their results in order.
     * At most {@code fanOut} of this item's fetches are in flight at once.
     */
    protected <T> List<T> fetchConcurrently(List<Supplier<T>> fetches) {
        Semaphore fanOutPermits = new Semaphore(fanOut);
        List<CompletableFuture<T>> futures = new ArrayList<>(fetches.size());
        for (Supplier<T> fetch : fetches) {
            try {
                fanOutPermits.acquire();
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while loading " + source());
            }
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return fetch.get();
                } finally {
                    fanOutPermits.release();
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
    }

    private void index(List<R> records, LoadTally tally) {
        for (R record : records) {
            logger.debug("Assembled {}", record.documentKey());
        }
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

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
