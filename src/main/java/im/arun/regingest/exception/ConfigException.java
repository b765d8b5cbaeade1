package im.arun.regingest.exception;

public class ConfigException extends IngestException {
    public ConfigException(String message) {
        super(ErrorCode.CONFIGURATION, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION, message, cause);
    }
}
