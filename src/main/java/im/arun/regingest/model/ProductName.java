package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductName {

    @JsonProperty("name")
    private String name;

    @JsonProperty("effective_from")
    private String effectiveFrom;

    @JsonProperty("effective_to")
    private String effectiveTo;
}
