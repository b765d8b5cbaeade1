package im.arun.regingest.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the ingestion engine.
 * Carries an {@link ErrorCode} and an optional, unmodifiable context map for diagnostics.
 */
public class IngestException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> context;

    public IngestException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public IngestException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public IngestException(ErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public IngestException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public ErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
