package im.arun.regingest.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.http.RateLimitedCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Counts a paginated endpoint, splits it into pages and fetches them with bounded concurrency.
 *
 * <p>A failing page is logged, recorded as a {@link PageFailure} and counted as zero records;
 * it never stops its siblings. A failing count fetch is fatal and propagates to the caller.
 * When the upstream total drifts between the count and the page fetches, pages simply return
 * fewer or more records than expected.
 */
public class PaginationDriver {
    private static final Logger logger = LoggerFactory.getLogger(PaginationDriver.class);

    private final RateLimitedCache http;
    private final ExecutorService executor;

    public PaginationDriver(RateLimitedCache http, ExecutorService executor) {
        this.http = http;
        this.executor = executor;
    }

    /**
     * Runs the whole pagination, handing each page's records to {@code sink} as soon as they
     * are parsed. Blocks until every page task has finished.
     *
     * @throws CancellationException if the calling thread is interrupted; in-flight page tasks
     *                               are cancelled, pages already sunk stay sunk
     */
    public <R> PaginationResult paginate(PagedEndpoint endpoint,
                                         PageParser<R> parser,
                                         int pageSize,
                                         int concurrencyLimit,
                                         PageSink<R> sink,
                                         ProgressReporter progress) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1");
        }
        long total = count(endpoint);
        progress.start(endpoint.getName(), total);
        if (total == 0) {
            progress.finish(endpoint.getName());
            return PaginationResult.empty();
        }

        List<Page> pages = Page.partition(total, pageSize);
        logger.info("{}: {} records in {} pages of {}", endpoint.getName(), total, pages.size(), pageSize);

        Semaphore permits = new Semaphore(concurrencyLimit);
        List<Future<PageOutcome>> futures = new ArrayList<>(pages.size());
        List<PageFailure> failures = new ArrayList<>();
        AtomicLong recordsSeen = new AtomicLong();

        try {
            for (Page page : pages) {
                permits.acquire();
                futures.add(executor.submit(() -> {
                    try {
                        return processPage(endpoint, page, parser, sink, progress);
                    } finally {
                        permits.release();
                    }
                }));
            }
            for (Future<PageOutcome> future : futures) {
                PageOutcome outcome = future.get();
                recordsSeen.addAndGet(outcome.records);
                if (outcome.failure != null) {
                    failures.add(outcome.failure);
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Pagination of " + endpoint.getName() + " cancelled");
        } catch (ExecutionException e) {
            // processPage contains ordinary failures; only cancellation and errors end up here
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof CancellationException) {
                throw (CancellationException) e.getCause();
            }
            throw new IllegalStateException("Page task crashed for " + endpoint.getName(), e.getCause());
        }

        progress.finish(endpoint.getName());
        if (!failures.isEmpty()) {
            logger.warn("{}: {} of {} pages failed", endpoint.getName(), failures.size(), pages.size());
        }
        return new PaginationResult(total, pages.size(), recordsSeen.get(), List.copyOf(failures));
    }

    /**
     * Lazy, finite, single-use view of all valid records. Nothing is fetched until the first
     * element is requested. Failed pages are skipped; a failed count fetch surfaces from the
     * terminal operation.
     *
     * <p>The stream must be closed, typically with try-with-resources. Closing cancels the run;
     * a stream abandoned after a short-circuiting operation such as {@code findFirst()} keeps
     * its producer blocked on the full buffer until it is closed.
     */
    public <R> Stream<R> stream(PagedEndpoint endpoint, PageParser<R> parser, int pageSize, int concurrencyLimit) {
        RecordSpliterator<R> spliterator = new RecordSpliterator<>(endpoint, parser, pageSize, concurrencyLimit);
        return StreamSupport.stream(spliterator, false).onClose(spliterator::cancel);
    }

    /**
     * Fetches the total record count with a one-record page.
     *
     * @throws ValidationException if the count field is missing or not a number
     */
    long count(PagedEndpoint endpoint) {
        JsonNode body = http.fetchJson(endpoint.countRequest());
        JsonNode count = body == null ? null : body.get(endpoint.getCountField());
        if (count == null || !count.canConvertToLong()) {
            throw new ValidationException("Count key " + endpoint.getCountField()
                    + " not found in response from " + endpoint.getName());
        }
        return count.asLong();
    }

    private <R> PageOutcome processPage(PagedEndpoint endpoint,
                                        Page page,
                                        PageParser<R> parser,
                                        PageSink<R> sink,
                                        ProgressReporter progress) {
        try {
            JsonNode body = http.fetchJson(endpoint.pageRequest(page));
            List<R> records = parser.parse(body);
            sink.accept(page, records);
            progress.advance(endpoint.getName(), records.size());
            return new PageOutcome(records.size(), null);
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to process page - {} {}: {}", endpoint.getName(), page, e.toString());
            return new PageOutcome(0, PageFailure.of(endpoint, page, e));
        }
    }

    private static final class PageOutcome {
        private final long records;
        private final PageFailure failure;

        private PageOutcome(long records, PageFailure failure) {
            this.records = records;
            this.failure = failure;
        }
    }

    private final class RecordSpliterator<R> extends Spliterators.AbstractSpliterator<R> {
        private final PagedEndpoint endpoint;
        private final PageParser<R> parser;
        private final int pageSize;
        private final int concurrencyLimit;
        private final BlockingQueue<Batch<R>> queue;

        private Future<?> producer;
        private List<R> current = Collections.emptyList();
        private int position;
        private boolean done;

        RecordSpliterator(PagedEndpoint endpoint, PageParser<R> parser, int pageSize, int concurrencyLimit) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.endpoint = endpoint;
            this.parser = parser;
            this.pageSize = pageSize;
            this.concurrencyLimit = concurrencyLimit;
            this.queue = new ArrayBlockingQueue<>(Math.max(1, concurrencyLimit) + 1);
        }

        @Override
        public boolean tryAdvance(Consumer<? super R> action) {
            if (producer == null) {
                producer = executor.submit(this::produce);
            }
            while (position >= current.size()) {
                if (done) {
                    return false;
                }
                Batch<R> batch;
                try {
                    batch = queue.take();
                } catch (InterruptedException e) {
                    cancel();
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while streaming " + endpoint.getName());
                }
                if (batch.error != null) {
                    done = true;
                    throw batch.error;
                }
                if (batch.end) {
                    done = true;
                    return false;
                }
                current = batch.records;
                position = 0;
            }
            action.accept(current.get(position++));
            return true;
        }

        void cancel() {
            done = true;
            if (producer != null) {
                producer.cancel(true);
            }
        }

        private void produce() {
            Batch<R> last;
            try {
                paginate(endpoint, parser, pageSize, concurrencyLimit, (page, records) -> {
                    if (records.isEmpty()) {
                        return;
                    }
                    try {
                        queue.put(new Batch<>(records, null, false));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CancellationException("Stream closed");
                    }
                }, ProgressReporter.NONE);
                last = new Batch<>(Collections.emptyList(), null, true);
            } catch (CancellationException e) {
                return;
            } catch (RuntimeException e) {
                last = new Batch<>(Collections.emptyList(), e, true);
            }
            try {
                queue.put(last);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final class Batch<R> {
        private final List<R> records;
        private final RuntimeException error;
        private final boolean end;

        private Batch(List<R> records, RuntimeException error, boolean end) {
            this.records = records;
            this.error = error;
            this.end = end;
        }
    }
}
