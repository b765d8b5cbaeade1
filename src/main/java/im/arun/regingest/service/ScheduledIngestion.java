package im.arun.regingest.service;

import im.arun.regingest.source.DateRange;
import im.arun.regingest.source.LoadReport;
import im.arun.regingest.source.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The periodic job: Hansard, written questions and the firms register over a short rolling
 * window. A failing source is reported and the job moves on to the next one.
 */
public class ScheduledIngestion {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledIngestion.class);

    public static final List<Source> SOURCES = List.of(
            Source.HANSARD, Source.PARLIAMENTARY_QUESTIONS, Source.FIRMS_REGISTER);
    public static final int DEFAULT_WINDOW_DAYS = 2;

    private final IngestionEngine engine;
    private final Clock clock;

    public ScheduledIngestion(IngestionEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * Window ending today and starting {@value #DEFAULT_WINDOW_DAYS} days earlier.
     */
    public DateRange defaultWindow() {
        LocalDate today = LocalDate.now(clock);
        return DateRange.of(today.minusDays(DEFAULT_WINDOW_DAYS), today);
    }

    public List<LoadReport> run() {
        return run(defaultWindow());
    }

    public List<LoadReport> run(DateRange range) {
        logger.info("Scheduled ingestion for {}", range);
        List<LoadReport> reports = new ArrayList<>();
        for (Source source : SOURCES) {
            Instant started = clock.instant();
            DateRange window = source.isDateBound() ? range : DateRange.none();
            try {
                reports.add(engine.load(source, window));
            } catch (RuntimeException e) {
                logger.error("Scheduled load of {} failed: {}", source, e.getMessage(), e);
                reports.add(new LoadReport(source.getCliName(), source.getCollection(),
                        window.getFrom() == null ? null : window.getFrom().toString(),
                        window.getTo() == null ? null : window.getTo().toString(),
                        0, 0, 0, 0, started, Duration.between(started, clock.instant()),
                        e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
            }
        }
        return reports;
    }
}
