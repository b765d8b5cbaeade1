package im.arun.regingest.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import im.arun.regingest.exception.PartialBulkFailureException;
import im.arun.regingest.exception.PermanentHttpException;
import im.arun.regingest.exception.TransientNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Writes batches of records into a collection, keyed by {@link IndexableRecord#documentKey()}.
 *
 * <p>Records sharing a key within one batch collapse to the last one. Whole-call transient
 * failures and items rejected with a transient status are resubmitted up to {@code maxRetries}
 * times. Whatever is still rejected after that is reported through
 * {@link PartialBulkFailureException}; accepted documents are never rolled back.
 */
public class BulkIndexer {
    private static final Logger logger = LoggerFactory.getLogger(BulkIndexer.class);
    private static final long MAX_BACKOFF_MS = 30000;

    private final SearchStore store;
    private final int maxRetries;
    private final long baseBackoffMs;
    private final ObjectMapper objectMapper;

    public BulkIndexer(SearchStore store, int maxRetries, long baseBackoffMs) {
        this.store = store;
        this.maxRetries = Math.max(0, maxRetries);
        this.baseBackoffMs = Math.max(0, baseBackoffMs);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Upserts {@code records} into {@code collection}.
     *
     * @return number of documents the store accepted
     * @throws PartialBulkFailureException if some documents were rejected for good
     */
    public int store(String collection, List<? extends IndexableRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        Map<String, String> causes = new LinkedHashMap<>();
        List<IndexAction> pending = toActions(collection, records, causes);

        int accepted = 0;
        for (int attempt = 0; attempt <= maxRetries && !pending.isEmpty(); attempt++) {
            boolean lastAttempt = attempt == maxRetries;
            BulkResult result;
            try {
                result = store.bulkUpsert(collection, pending);
            } catch (TransientNetworkException e) {
                logger.warn("Bulk upsert into {} failed (attempt {}/{}): {}",
                        collection, attempt + 1, maxRetries + 1, e.getMessage());
                if (lastAttempt) {
                    pending.forEach(a -> causes.put(a.getDocumentKey(), describe(e)));
                    break;
                }
                backoff(attempt);
                continue;
            } catch (PermanentHttpException e) {
                logger.error("Bulk upsert into {} refused: {}", collection, e.getMessage());
                pending.forEach(a -> causes.put(a.getDocumentKey(), describe(e)));
                break;
            }

            accepted += result.getAcceptedCount();
            List<IndexAction> retry = new ArrayList<>();
            for (IndexAction action : pending) {
                BulkItemError error = result.getErrors().get(action.getDocumentKey());
                if (error == null) {
                    continue;
                }
                if (error.isTransient() && !lastAttempt) {
                    retry.add(action);
                } else {
                    causes.put(action.getDocumentKey(), error.getStatus() + " " + error.getReason());
                }
            }
            pending = retry;
            if (!pending.isEmpty()) {
                logger.warn("Retrying {} document(s) rejected transiently by {}", pending.size(), collection);
                backoff(attempt);
            }
        }

        logger.info("Indexed {} document(s) into {}", accepted, collection);
        if (!causes.isEmpty()) {
            throw new PartialBulkFailureException(collection, accepted, causes);
        }
        return accepted;
    }

    private List<IndexAction> toActions(String collection,
                                        List<? extends IndexableRecord> records,
                                        Map<String, String> causes) {
        // LinkedHashMap keeps the first-seen position while a later duplicate replaces the value
        Map<String, IndexAction> byKey = new LinkedHashMap<>();
        for (IndexableRecord record : records) {
            String key = record.documentKey();
            try {
                JsonNode node = objectMapper.valueToTree(record);
                if (!(node instanceof ObjectNode)) {
                    causes.put(key, "record did not serialize to a JSON object");
                    continue;
                }
                byKey.put(key, new IndexAction(key, (ObjectNode) node, collection));
                causes.remove(key);
            } catch (IllegalArgumentException e) {
                logger.warn("Cannot serialize document {}: {}", key, e.getMessage());
                byKey.remove(key);
                causes.put(key, "serialization failed: " + e.getMessage());
            }
        }
        if (byKey.size() < records.size()) {
            logger.debug("Batch for {}: {} records, {} unique keys", collection, records.size(), byKey.size());
        }
        return new ArrayList<>(byKey.values());
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private void backoff(int attempt) {
        long delay = Math.min(baseBackoffMs * (1L << attempt), MAX_BACKOFF_MS);
        if (delay == 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during bulk retry wait");
        }
    }
}
