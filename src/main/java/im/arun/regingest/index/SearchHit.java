package im.arun.regingest.index;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class SearchHit {
    String documentKey;
    double score;
    JsonNode source;
}
