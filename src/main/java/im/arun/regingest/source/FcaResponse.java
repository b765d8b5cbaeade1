package im.arun.regingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Envelope of every FCA register response: a {@code Status} code, a {@code Message} and the
 * {@code Data} payload, which is null when the register has nothing for the request.
 */
@Value
public class FcaResponse {
    String status;
    String message;
    JsonNode data;

    public boolean hasData() {
        return data != null && !data.isNull() && data.size() > 0;
    }

    /**
     * Elements of an array payload; an object payload counts as a single element.
     */
    public List<JsonNode> records() {
        List<JsonNode> records = new ArrayList<>();
        if (!hasData()) {
            return records;
        }
        if (data.isArray()) {
            data.forEach(records::add);
        } else {
            records.add(data);
        }
        return records;
    }

    public Optional<JsonNode> firstRecord() {
        List<JsonNode> records = records();
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }
}
