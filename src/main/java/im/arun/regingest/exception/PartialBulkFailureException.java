package im.arun.regingest.exception;

import java.util.List;
import java.util.Map;

/**
 * The search store rejected a subset of a bulk batch. Documents not listed here were accepted.
 */
public class PartialBulkFailureException extends IngestException {
    private final String collection;
    private final int acceptedCount;
    private final Map<String, String> causes;

    public PartialBulkFailureException(String collection, int acceptedCount, Map<String, String> causes) {
        super(ErrorCode.PARTIAL_BULK_FAILURE,
                causes.size() + " document(s) rejected by collection " + collection,
                Map.of("collection", collection, "accepted", acceptedCount, "rejected", causes.size()));
        this.collection = collection;
        this.acceptedCount = acceptedCount;
        this.causes = Map.copyOf(causes);
    }

    public String getCollection() {
        return collection;
    }

    public int getAcceptedCount() {
        return acceptedCount;
    }

    public List<String> getFailedKeys() {
        return causes.keySet().stream().sorted().toList();
    }

    /** Rejection reason per failed document key. */
    public Map<String, String> getCauses() {
        return causes;
    }
}
