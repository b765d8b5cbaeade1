package im.arun.regingest.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.regingest.http.FetchKey;
import im.arun.regingest.http.RateLimitedCache;
import im.arun.regingest.index.BulkIndexer;
import im.arun.regingest.model.ParliamentaryQuestion;
import im.arun.regingest.model.QuestionsResponse;
import im.arun.regingest.pagination.PagedEndpoint;
import im.arun.regingest.pagination.PaginationDriver;
import im.arun.regingest.pagination.PaginationResult;
import im.arun.regingest.pagination.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Loads written questions tabled or answered in the window. Questions whose listing texts are
 * truncated are re-read in full.
 */
public class ParliamentaryQuestionLoader extends PaginatedSourceLoader<ParliamentaryQuestion> {
    private static final Logger logger = LoggerFactory.getLogger(ParliamentaryQuestionLoader.class);

    private final RateLimitedCache http;
    private final String baseUrl;
    private final int pageSize;
    private final int concurrency;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ParliamentaryQuestionLoader(PaginationDriver driver,
                                       BulkIndexer indexer,
                                       RateLimitedCache http,
                                       ExecutorService executor,
                                       ProgressReporter progress,
                                       String baseUrl,
                                       int pageSize,
                                       int concurrency,
                                       int enrichmentConcurrency,
                                       Clock clock) {
        super(driver, indexer, executor, progress, enrichmentConcurrency, clock);
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.pageSize = pageSize;
        this.concurrency = concurrency;
    }

    @Override
    public Source source() {
        return Source.PARLIAMENTARY_QUESTIONS;
    }

    /**
     * Tabled pass, then answered pass. A question found by both is indexed once.
     */
    @Override
    protected PaginationResult run(DateRange range, LoadTally tally) {
        Set<Long> seen = ConcurrentHashMap.newKeySet();
        PaginationResult result = PaginationResult.empty();
        for (String window : List.of("tabled", "answered")) {
            result = result.plus(paginate(endpoint(window, range),
                    body -> QuestionsResponse.parse(body, objectMapper),
                    pageSize, concurrency,
                    page -> enrichConcurrently(unseen(page, seen), this::withFullText),
                    tally));
        }
        return result;
    }

    PagedEndpoint endpoint(String window, DateRange range) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("expandMember", true);
        params.put(window + "WhenFrom", range.getFrom());
        if (range.getTo() != null) {
            params.put(window + "WhenTo", range.getTo());
        }
        return PagedEndpoint.of("questions " + window, baseUrl + "/writtenquestions/questions",
                params, QuestionsResponse.COUNT_FIELD);
    }

    private static List<ParliamentaryQuestion> unseen(List<ParliamentaryQuestion> page, Set<Long> seen) {
        List<ParliamentaryQuestion> fresh = new ArrayList<>(page.size());
        for (ParliamentaryQuestion question : page) {
            if (seen.add(question.getId())) {
                fresh.add(question);
            }
        }
        return fresh;
    }

    private ParliamentaryQuestion withFullText(ParliamentaryQuestion question) {
        if (!question.isTruncated()) {
            return question;
        }
        FetchKey key = FetchKey.get(baseUrl + "/writtenquestions/questions/" + question.getId())
                .withParam("expandMember", true);
        try {
            question.applyFullText(QuestionsResponse.parseValue(http.fetchJson(key), objectMapper));
        } catch (RuntimeException e) {
            logger.warn("Keeping truncated text of question {}: {}", question.getId(), e.getMessage());
        }
        return question;
    }
}
