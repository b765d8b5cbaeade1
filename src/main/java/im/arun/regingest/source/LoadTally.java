package im.arun.regingest.source;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for one run, updated from page and batch tasks.
 */
class LoadTally {
    private final Source source;
    private final DateRange range;
    private final Clock clock;
    private final Instant startedAt;
    private final AtomicLong attempted = new AtomicLong();
    private final AtomicLong indexed = new AtomicLong();
    private final AtomicInteger failedPages = new AtomicInteger();
    private final AtomicLong failedRecords = new AtomicLong();

    LoadTally(Source source, DateRange range, Clock clock) {
        this.source = source;
        this.range = range;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    void attempted(long n) {
        attempted.addAndGet(n);
    }

    void indexed(long n) {
        indexed.addAndGet(n);
    }

    void failedPages(int n) {
        failedPages.addAndGet(n);
    }

    void failedRecords(long n) {
        failedRecords.addAndGet(n);
    }

    LoadReport toReport() {
        return new LoadReport(
                source.getCliName(),
                source.getCollection(),
                range.getFrom() == null ? null : range.getFrom().toString(),
                range.getTo() == null ? null : range.getTo().toString(),
                attempted.get(),
                indexed.get(),
                failedPages.get(),
                failedRecords.get(),
                startedAt,
                Duration.between(startedAt, clock.instant()),
                null);
    }
}
