package im.arun.regingest.index;

import java.util.List;

/**
 * Document store the engine writes into. Only upsert-by-key and search are relied on.
 *
 * <p>Collection names passed here are logical ({@code hansard_contributions}); implementations
 * map them to physical indices.
 */
public interface SearchStore {

    /**
     * Inserts or replaces every action's document under its key.
     *
     * @return accepted count and per-key rejections
     * @throws im.arun.regingest.exception.TransientNetworkException if the whole call failed and may be retried
     * @throws im.arun.regingest.exception.PermanentHttpException if the store refused the call
     */
    BulkResult bulkUpsert(String collection, List<IndexAction> actions);

    List<SearchHit> search(String collection, SearchQuery query);

    /**
     * Creates the collection if it does not exist yet.
     */
    void createCollection(String collection);

    /**
     * Deletes the collection and its documents. Missing collections are ignored.
     */
    void deleteCollection(String collection);

    long count(String collection);
}
