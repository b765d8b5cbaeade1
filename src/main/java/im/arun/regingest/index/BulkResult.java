package im.arun.regingest.index;

import lombok.Value;

import java.util.Map;

@Value
public class BulkResult {
    int acceptedCount;
    Map<String, BulkItemError> errors;

    public static BulkResult allAccepted(int count) {
        return new BulkResult(count, Map.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
