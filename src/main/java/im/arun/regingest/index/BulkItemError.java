package im.arun.regingest.index;

import lombok.Value;

/**
 * Store-side rejection of a single bulk item.
 */
@Value
public class BulkItemError {
    int status;
    String reason;

    /**
     * Throttling and server-side errors are worth resubmitting.
     */
    public boolean isTransient() {
        return status == 429 || status >= 500;
    }
}
