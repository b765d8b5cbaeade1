package im.arun.regingest.http;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A successful upstream response as stored in, and served from, the response cache.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FetchResponse {

    @JsonProperty("status")
    private int status;

    @JsonProperty("body")
    private String body;

    @JsonProperty("content_type")
    private String contentType;

    @JsonProperty("stored_at")
    private long storedAt;

    @JsonIgnore
    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
