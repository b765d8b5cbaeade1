package im.arun.regingest.exception;

/**
 * Retryable network failure: timeouts, connection resets, upstream 5xx.
 */
public class TransientNetworkException extends IngestException {
    public TransientNetworkException(String message) {
        super(ErrorCode.TRANSIENT_NETWORK, message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_NETWORK, message, cause);
    }

    protected TransientNetworkException(ErrorCode code, String message) {
        super(code, message);
    }
}
