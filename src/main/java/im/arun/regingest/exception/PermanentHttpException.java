package im.arun.regingest.exception;

import java.util.Map;

/**
 * Client-side HTTP error (4xx). Never retried.
 */
public class PermanentHttpException extends IngestException {
    private final int statusCode;

    public PermanentHttpException(int statusCode, String url) {
        super(ErrorCode.PERMANENT_HTTP, "HTTP " + statusCode + " for " + url,
                Map.of("status", statusCode, "url", url));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
