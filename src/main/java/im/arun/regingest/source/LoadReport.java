package im.arun.regingest.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one source run: how many records were attempted and how many made it into the
 * store. Individual failures are only in the logs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoadReport {

    @JsonProperty("source")
    private String source;

    @JsonProperty("collection")
    private String collection;

    @JsonProperty("from_date")
    private String fromDate;

    @JsonProperty("to_date")
    private String toDate;

    @JsonProperty("attempted")
    private long attempted;

    @JsonProperty("indexed")
    private long indexed;

    @JsonProperty("failed_pages")
    private int failedPages;

    @JsonProperty("failed_records")
    private long failedRecords;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("duration")
    private Duration duration;

    @JsonProperty("error")
    private String error;

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null;
    }

    @Override
    public String toString() {
        return String.format("%s: %d attempted, %d indexed, %d failed page(s), %d failed record(s)%s",
                source, attempted, indexed, failedPages, failedRecords, error == null ? "" : " [" + error + "]");
    }
}
