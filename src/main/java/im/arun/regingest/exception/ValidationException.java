package im.arun.regingest.exception;

/**
 * A response or record did not have the shape we expect.
 */
public class ValidationException extends IngestException {
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
