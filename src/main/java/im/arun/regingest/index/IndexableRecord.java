package im.arun.regingest.index;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A record that can be written to the search store. Implementations must be serializable
 * with Jackson and derive their key from their own content only.
 */
public interface IndexableRecord {

    @JsonProperty("document_uri")
    String documentKey();
}
