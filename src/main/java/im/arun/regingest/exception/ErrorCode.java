package im.arun.regingest.exception;

/**
 * Stable error codes carried by every {@link IngestException}.
 */
public enum ErrorCode {
    TRANSIENT_NETWORK,
    PERMANENT_HTTP,
    RATE_LIMIT_TIMEOUT,
    VALIDATION,
    PARTIAL_BULK_FAILURE,
    CONFIGURATION,
    INGESTION_FAILED
}
