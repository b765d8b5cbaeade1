package im.arun.regingest.hierarchy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One debate section in a day's hierarchy. Parents are referenced by external id,
 * which is stable across days; local ids are only meaningful within one response.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyNode {

    @JsonProperty("id")
    private String localId;

    @JsonProperty("external_id")
    private String externalId;

    @JsonProperty("title")
    private String title;

    @JsonProperty("parent_external_id")
    private String parentExternalId;
}
