package im.arun.regingest.pagination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class LoggingProgressReporter implements ProgressReporter {
    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressReporter.class);

    private final Map<String, Long> totals = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> completed = new ConcurrentHashMap<>();

    @Override
    public void start(String task, long total) {
        totals.put(task, total);
        completed.put(task, new AtomicLong());
        logger.info("Loading '{}': {} records", task, total);
    }

    @Override
    public void advance(String task, long records) {
        long done = completed.computeIfAbsent(task, k -> new AtomicLong()).addAndGet(records);
        logger.info("'{}': {}/{}", task, done, totals.getOrDefault(task, 0L));
    }

    @Override
    public void finish(String task) {
        AtomicLong done = completed.get(task);
        logger.info("Finished '{}': {} records", task, done == null ? 0 : done.get());
    }

    public long completed(String task) {
        AtomicLong done = completed.get(task);
        return done == null ? 0 : done.get();
    }
}
